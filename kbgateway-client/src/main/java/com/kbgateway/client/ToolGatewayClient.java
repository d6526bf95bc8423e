package com.kbgateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.kbgateway.config.GatewayConfig;
import com.kbgateway.protocol.GatewayTransport;
import com.kbgateway.protocol.InvocationContext;
import com.kbgateway.protocol.ResponseValidator;
import com.kbgateway.protocol.ToolGatewayException;
import com.kbgateway.protocol.ToolRequestEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Invokes a named gateway tool: builds the versioned request envelope, sends it through the
 * selected {@link GatewayTransport} and validates the response envelope.
 * <p>
 * Each call is synchronous, single-shot and independent; instances hold no per-call state and may
 * be shared between threads. Every failure surfaces as a {@link ToolGatewayException}; nothing is
 * retried.
 */
public final class ToolGatewayClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolGatewayClient.class);

    private final GatewayTransport transport;
    private final InvocationContext defaultContext;

    public ToolGatewayClient(GatewayTransport transport, InvocationContext defaultContext) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.defaultContext = defaultContext != null ? defaultContext : InvocationContext.empty();
    }

    public ToolGatewayClient(GatewayTransport transport) {
        this(transport, InvocationContext.empty());
    }

    /**
     * Client for the process environment: TOOL_GATEWAY_* settings select the transport
     * (discovering optional transport modules on the classpath) and TENANT_ID / USER_ID /
     * CORRELATION_ID become the default context.
     */
    public static ToolGatewayClient fromEnvironment() {
        GatewayConfig config = GatewayConfig.fromEnvironment();
        GatewayTransport transport = GatewayTransportSelector.withDiscoveredProviders().select(config);
        return new ToolGatewayClient(transport, InvocationContext.fromEnvironment());
    }

    /** Invokes with the default context. */
    public JsonNode invoke(String toolName, Map<String, Object> input, String resultField) {
        return invoke(toolName, input, defaultContext, resultField);
    }

    /**
     * Invokes {@code toolName} and returns {@code output.<resultField>} of the response.
     *
     * @param context ids propagated into the envelope; null means the default context
     */
    public JsonNode invoke(String toolName, Map<String, Object> input, InvocationContext context, String resultField) {
        InvocationContext ctx = context != null ? context : defaultContext;
        ToolRequestEnvelope request = ToolRequestEnvelope.of(toolName, input, ctx);
        long start = System.nanoTime();
        try {
            JsonNode body = transport.send(request);
            JsonNode result = ResponseValidator.extract(body, toolName, resultField);
            if (log.isDebugEnabled()) {
                log.debug("Tool {} via {} ok in {} ms (correlationId={})", toolName, transport.name(),
                        (System.nanoTime() - start) / 1_000_000, ctx.getCorrelationId());
            }
            return result;
        } catch (ToolGatewayException e) {
            log.warn("Tool {} via {} failed ({}): {} (correlationId={})", toolName, transport.name(),
                    e.getKind(), e.getMessage(), ctx.getCorrelationId());
            throw e;
        }
    }

    /** Releases the transport's resources (e.g. the AgentCore SDK client). */
    @Override
    public void close() {
        transport.close();
    }
}
