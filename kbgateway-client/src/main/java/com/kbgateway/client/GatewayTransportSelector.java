package com.kbgateway.client;

import com.kbgateway.config.GatewayConfig;
import com.kbgateway.config.TransportMode;
import com.kbgateway.protocol.GatewayConfigurationException;
import com.kbgateway.protocol.GatewayTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Chooses the one transport for the configured {@link TransportMode}.
 * <p>
 * Internal providers (HTTP) are registered explicitly; other providers come from
 * {@link ServiceLoader} on the given class loader. When two providers claim the same mode the
 * internal one wins, then the first discovered.
 */
public final class GatewayTransportSelector {

    private static final Logger log = LoggerFactory.getLogger(GatewayTransportSelector.class);

    private final List<GatewayTransportProvider> internalProviders = new ArrayList<>();
    private final List<GatewayTransportProvider> discoveredProviders = new ArrayList<>();

    /** Selector with the internal HTTP provider only. */
    public GatewayTransportSelector() {
        registerInternal(new HttpTransportProvider());
    }

    /** Selector with the internal HTTP provider plus every provider found on the context class loader. */
    public static GatewayTransportSelector withDiscoveredProviders() {
        GatewayTransportSelector selector = new GatewayTransportSelector();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        selector.loadProviders(cl != null ? cl : GatewayTransportSelector.class.getClassLoader());
        return selector;
    }

    public void registerInternal(GatewayTransportProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /**
     * Loads providers registered under META-INF/services. A provider that fails to instantiate is
     * a broken deployment, not an optional extra, so the failure propagates.
     */
    public void loadProviders(ClassLoader classLoader) {
        int n = 0;
        for (GatewayTransportProvider provider : ServiceLoader.load(GatewayTransportProvider.class, classLoader)) {
            if (provider.isEnabled()) {
                discoveredProviders.add(provider);
                n++;
            }
        }
        if (n > 0) {
            log.debug("Discovered {} gateway transport provider(s)", n);
        }
    }

    /**
     * Creates the transport for {@code config.getTransportMode()}.
     *
     * @throws GatewayConfigurationException no provider for the mode, or the provider rejects the config
     */
    public GatewayTransport select(GatewayConfig config) {
        TransportMode mode = config.getTransportMode();
        GatewayTransportProvider provider = find(mode);
        if (provider == null) {
            throw new GatewayConfigurationException("TOOL_GATEWAY_MODE", String.format(
                    "No transport available for TOOL_GATEWAY_MODE=%s (is the %s transport module on the classpath?)",
                    mode.id(), mode.id()));
        }
        GatewayTransport transport = provider.create(config);
        log.info("Tool Gateway transport selected: {}", transport.name());
        return transport;
    }

    /** Modes that currently have a provider, internal first. */
    public List<TransportMode> getAvailableModes() {
        List<TransportMode> out = new ArrayList<>();
        for (GatewayTransportProvider p : getProviders()) {
            if (!out.contains(p.getMode())) {
                out.add(p.getMode());
            }
        }
        return out;
    }

    private GatewayTransportProvider find(TransportMode mode) {
        for (GatewayTransportProvider p : getProviders()) {
            if (p.getMode() == mode) {
                return p;
            }
        }
        return null;
    }

    private List<GatewayTransportProvider> getProviders() {
        List<GatewayTransportProvider> out = new ArrayList<>(internalProviders.size() + discoveredProviders.size());
        out.addAll(internalProviders);
        out.addAll(discoveredProviders);
        return out;
    }
}
