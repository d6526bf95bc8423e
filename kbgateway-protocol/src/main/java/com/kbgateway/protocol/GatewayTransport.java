package com.kbgateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One way of delivering a {@link ToolRequestEnvelope} to the Tool Gateway. Implementations make
 * exactly one outbound call per {@link #send}, never retry, and return the decoded response body
 * unchanged; interpreting it is the caller's job (see {@link ResponseValidator}).
 * <p>
 * Implementations must be safe for concurrent use: calls share no mutable state.
 */
public interface GatewayTransport extends AutoCloseable {

    /**
     * Sends the envelope and returns the decoded response envelope as raw JSON.
     *
     * @throws GatewayTransportException on network, status, stream or decode failure
     */
    JsonNode send(ToolRequestEnvelope request);

    /** Short name for logs (e.g. "http", "agentcore"). */
    String name();

    /** Releases client resources; no-op for transports that hold none. */
    @Override
    default void close() {
    }
}
