package com.kbgateway.protocol;

/**
 * Thrown when the gateway reports {@code ok=false}. The message is the remote
 * {@code error.message} when present, otherwise {@link #FALLBACK_MESSAGE}.
 */
public final class ToolFailureException extends ToolGatewayException {

    public static final String FALLBACK_MESSAGE = "Tool call failed";

    private final String toolName;
    private final String errorCode;

    public ToolFailureException(String toolName, String message, String errorCode) {
        super(message != null ? message : FALLBACK_MESSAGE);
        this.toolName = toolName;
        this.errorCode = errorCode;
    }

    public String getToolName() {
        return toolName;
    }

    /** Remote {@code error.code}, or null when the gateway sent none. */
    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public Kind getKind() {
        return Kind.TOOL_FAILURE;
    }
}
