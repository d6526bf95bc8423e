/**
 * Wire contract between agents and the Tool Gateway: versioned request envelope, response
 * validation, caller context and the failure taxonomy ({@link com.kbgateway.protocol.ToolGatewayException}).
 * <p>
 * Transports implement {@link com.kbgateway.protocol.GatewayTransport}; they deliver envelopes and
 * return raw JSON, and never interpret it.
 */
package com.kbgateway.protocol;
