package com.kbgateway.protocol;

/**
 * Thrown when the selected transport is missing a required setting (e.g. the hosted-runtime ARN)
 * or the transport mode itself is unknown. Always raised before any network attempt.
 */
public final class GatewayConfigurationException extends ToolGatewayException {

    private final String setting;

    public GatewayConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    /** Name of the offending setting (e.g. "TOOL_GATEWAY_RUNTIME_ARN"). */
    public String getSetting() {
        return setting;
    }

    @Override
    public Kind getKind() {
        return Kind.CONFIGURATION;
    }
}
