package com.kbgateway.config;

import com.kbgateway.protocol.GatewayConfigurationException;

import java.util.Locale;

/**
 * How the client reaches the Tool Gateway. Configured with TOOL_GATEWAY_MODE.
 */
public enum TransportMode {

    /** Direct {@code POST /tools/invoke} to a locally reachable gateway (default). */
    HTTP("http"),

    /** Invocation of the gateway hosted behind Bedrock AgentCore InvokeAgentRuntime. */
    AGENTCORE("agentcore");

    private final String id;

    TransportMode(String id) {
        this.id = id;
    }

    /** Lower-case id used in TOOL_GATEWAY_MODE and transport provider registration. */
    public String id() {
        return id;
    }

    /**
     * Parses a mode id case-insensitively; null/blank → {@link #HTTP}.
     *
     * @throws GatewayConfigurationException for any other value
     */
    public static TransportMode parse(String value) {
        if (value == null || value.isBlank()) {
            return HTTP;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (TransportMode m : values()) {
            if (m.id.equals(v)) {
                return m;
            }
        }
        throw new GatewayConfigurationException(GatewayConfig.ENV_MODE,
                String.format("Unknown %s=%s (expected http or agentcore)", GatewayConfig.ENV_MODE, value));
    }
}
