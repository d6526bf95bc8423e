package com.kbgateway.client;

import com.kbgateway.config.GatewayConfig;
import com.kbgateway.config.TransportMode;
import com.kbgateway.protocol.GatewayTransport;

/** Internal provider for the direct-HTTP transport. */
final class HttpTransportProvider implements GatewayTransportProvider {

    @Override
    public TransportMode getMode() {
        return TransportMode.HTTP;
    }

    @Override
    public GatewayTransport create(GatewayConfig config) {
        return new HttpGatewayTransport(config.getGatewayBaseUrl(), config.getHttpTimeout());
    }
}
