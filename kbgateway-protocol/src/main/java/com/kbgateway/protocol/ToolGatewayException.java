package com.kbgateway.protocol;

/**
 * Base of every failure surfaced by the Tool Gateway client. Callers that need to branch on the
 * failure class can switch on {@link #getKind()} instead of catching each subtype.
 */
public abstract class ToolGatewayException extends RuntimeException {

    /** Failure classes, in the order they can occur during one call. */
    public enum Kind {
        /** Required setting missing for the selected transport; raised before any network call. */
        CONFIGURATION,
        /** Network, status, stream or decode failure. */
        TRANSPORT,
        /** Response contract version differs from {@link ContractVersion#CURRENT}. */
        CONTRACT_MISMATCH,
        /** Response reports {@code ok=false}. */
        TOOL_FAILURE,
        /** Response reports success but lacks the expected result field. */
        MALFORMED_RESPONSE
    }

    protected ToolGatewayException(String message) {
        super(message);
    }

    protected ToolGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Kind getKind();
}
