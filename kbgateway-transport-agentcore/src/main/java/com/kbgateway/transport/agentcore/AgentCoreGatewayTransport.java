package com.kbgateway.transport.agentcore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbgateway.config.GatewayConfig;
import com.kbgateway.protocol.GatewayConfigurationException;
import com.kbgateway.protocol.GatewayTransport;
import com.kbgateway.protocol.GatewayTransportException;
import com.kbgateway.protocol.ToolRequestEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.retry.AwsRetryStrategy;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockagentcore.BedrockAgentCoreClient;
import software.amazon.awssdk.services.bedrockagentcore.BedrockAgentCoreClientBuilder;
import software.amazon.awssdk.services.bedrockagentcore.model.InvokeAgentRuntimeRequest;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Transport that reaches the Tool Gateway hosted as a Bedrock AgentCore runtime. Each call uses a
 * fresh runtime session id, sends the request envelope as the JSON payload, reads the whole
 * response stream and decodes it as JSON.
 * <p>
 * The SDK client is built with retries disabled and an API call timeout (TOOL_GATEWAY_RUNTIME_TIMEOUT_SECONDS);
 * the response is buffered within that call, so the timeout covers the stream read as well.
 */
public final class AgentCoreGatewayTransport implements GatewayTransport {

    private static final Logger log = LoggerFactory.getLogger(AgentCoreGatewayTransport.class);

    private static final String NAME = "agentcore";
    static final String CONTENT_TYPE = "application/json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final BedrockAgentCoreClient client;
    private final String runtimeArn;
    private final String qualifier;
    private final Supplier<String> sessionIds;

    AgentCoreGatewayTransport(BedrockAgentCoreClient client, String runtimeArn, String qualifier,
                              Supplier<String> sessionIds) {
        this.client = Objects.requireNonNull(client, "client");
        this.runtimeArn = Objects.requireNonNull(runtimeArn, "runtimeArn");
        this.qualifier = qualifier != null ? qualifier : GatewayConfig.DEFAULT_QUALIFIER;
        this.sessionIds = Objects.requireNonNull(sessionIds, "sessionIds");
    }

    /**
     * Creates the transport with an SDK client for {@code config.getRegion()}.
     *
     * @throws GatewayConfigurationException when TOOL_GATEWAY_RUNTIME_ARN is not set
     */
    public static AgentCoreGatewayTransport create(GatewayConfig config) {
        return create(config, AgentCoreGatewayTransport::buildClient);
    }

    /**
     * Creates the transport with a caller-supplied client factory. The runtime ARN is checked
     * before the factory is invoked, so a misconfigured mode never builds a client.
     */
    public static AgentCoreGatewayTransport create(GatewayConfig config,
                                                   Function<GatewayConfig, BedrockAgentCoreClient> clientFactory) {
        Objects.requireNonNull(config, "config");
        String arn = config.getRuntimeArn();
        if (arn == null || arn.isBlank()) {
            throw new GatewayConfigurationException(GatewayConfig.ENV_RUNTIME_ARN,
                    GatewayConfig.ENV_RUNTIME_ARN + " is required when TOOL_GATEWAY_MODE=agentcore");
        }
        return new AgentCoreGatewayTransport(clientFactory.apply(config), arn,
                config.getRuntimeQualifier(), RuntimeSessionIds::next);
    }

    static BedrockAgentCoreClient buildClient(GatewayConfig config) {
        return clientBuilder(config).build();
    }

    /** Region, no retries, and an API call timeout covering invoke plus full response read. */
    static BedrockAgentCoreClientBuilder clientBuilder(GatewayConfig config) {
        return BedrockAgentCoreClient.builder()
                .region(Region.of(config.getRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryStrategy(AwsRetryStrategy.doNotRetry())
                        .apiCallTimeout(config.getRuntimeTimeout())
                        .build());
    }

    @Override
    public JsonNode send(ToolRequestEnvelope request) {
        byte[] payload;
        try {
            payload = MAPPER.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new GatewayTransportException(NAME, "Failed to encode request envelope: " + e.getOriginalMessage(), e);
        }

        String sessionId = sessionIds.get();
        InvokeAgentRuntimeRequest invoke = InvokeAgentRuntimeRequest.builder()
                .agentRuntimeArn(runtimeArn)
                .runtimeSessionId(sessionId)
                .qualifier(qualifier)
                .contentType(CONTENT_TYPE)
                .accept(CONTENT_TYPE)
                .payload(SdkBytes.fromByteArray(payload))
                .build();
        log.debug("InvokeAgentRuntime tool={} qualifier={} session={}", request.getToolName(), qualifier, sessionId);

        // Buffer inside the SDK call so apiCallTimeout also bounds the stream read.
        byte[] raw;
        try {
            raw = client.invokeAgentRuntimeAsBytes(invoke).asByteArray();
        } catch (SdkException e) {
            throw new GatewayTransportException(NAME, "InvokeAgentRuntime failed: " + e.getMessage(), e);
        }

        try {
            JsonNode body = MAPPER.readTree(raw);
            if (body == null || body.isMissingNode()) {
                throw new GatewayTransportException(NAME, "AgentCore returned an empty response stream", null);
            }
            return body;
        } catch (IOException e) {
            throw new GatewayTransportException(NAME, "AgentCore response is not valid JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void close() {
        client.close();
    }
}
