package com.kbgateway.client;

import com.kbgateway.config.GatewayConfig;
import com.kbgateway.config.TransportMode;
import com.kbgateway.protocol.GatewayTransport;

/**
 * SPI for Tool Gateway transports. Implementations outside this module are discovered via
 * {@link java.util.ServiceLoader} (META-INF/services/com.kbgateway.client.GatewayTransportProvider),
 * so the default HTTP path carries no dependency on optional transport SDKs.
 */
public interface GatewayTransportProvider {

    /** Mode this provider serves; one provider per mode wins (internal first). */
    TransportMode getMode();

    /**
     * Creates the transport from configuration. Must validate required settings and throw
     * {@link com.kbgateway.protocol.GatewayConfigurationException} before opening any connection.
     */
    GatewayTransport create(GatewayConfig config);

    /** Whether this provider should be registered. */
    default boolean isEnabled() {
        return true;
    }
}
