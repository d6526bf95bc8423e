package com.kbgateway.protocol;

/**
 * Thrown when the transport could not produce a decoded response: connection failure, timeout,
 * non-2xx status, stream read failure or undecodable body.
 */
public final class GatewayTransportException extends ToolGatewayException {

    /** Status code when the gateway answered with a non-success status; -1 otherwise. */
    private final int statusCode;
    private final String transport;

    public GatewayTransportException(String transport, String message, Throwable cause) {
        super(message, cause);
        this.transport = transport;
        this.statusCode = -1;
    }

    public GatewayTransportException(String transport, int statusCode, String message) {
        super(message);
        this.transport = transport;
        this.statusCode = statusCode;
    }

    public String getTransport() {
        return transport;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public Kind getKind() {
        return Kind.TRANSPORT;
    }
}
