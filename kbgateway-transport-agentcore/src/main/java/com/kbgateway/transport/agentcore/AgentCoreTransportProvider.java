package com.kbgateway.transport.agentcore;

import com.kbgateway.client.GatewayTransportProvider;
import com.kbgateway.config.GatewayConfig;
import com.kbgateway.config.TransportMode;
import com.kbgateway.protocol.GatewayTransport;

/**
 * SPI provider for the AgentCore transport. Registered in
 * META-INF/services/com.kbgateway.client.GatewayTransportProvider; putting this module on the
 * classpath is all it takes for TOOL_GATEWAY_MODE=agentcore to work.
 */
public final class AgentCoreTransportProvider implements GatewayTransportProvider {

    @Override
    public TransportMode getMode() {
        return TransportMode.AGENTCORE;
    }

    @Override
    public GatewayTransport create(GatewayConfig config) {
        return AgentCoreGatewayTransport.create(config);
    }
}
