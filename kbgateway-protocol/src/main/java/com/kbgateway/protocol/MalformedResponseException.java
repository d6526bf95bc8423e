package com.kbgateway.protocol;

/**
 * Thrown when the gateway reports success but the expected result field is missing from
 * {@code output} (or has the wrong shape).
 */
public final class MalformedResponseException extends ToolGatewayException {

    private final String field;

    public MalformedResponseException(String field) {
        this(field, String.format("Malformed tool response: missing '%s'", field));
    }

    public MalformedResponseException(String field, String message) {
        super(message);
        this.field = field;
    }

    public MalformedResponseException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public Kind getKind() {
        return Kind.MALFORMED_RESPONSE;
    }
}
