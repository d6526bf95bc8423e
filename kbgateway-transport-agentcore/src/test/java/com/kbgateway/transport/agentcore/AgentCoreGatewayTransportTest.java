package com.kbgateway.transport.agentcore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbgateway.client.GatewayTransportSelector;
import com.kbgateway.client.KnowledgeBaseTools;
import com.kbgateway.client.ToolGatewayClient;
import com.kbgateway.config.GatewayConfig;
import com.kbgateway.config.TransportMode;
import com.kbgateway.protocol.ContractMismatchException;
import com.kbgateway.protocol.GatewayConfigurationException;
import com.kbgateway.protocol.GatewayTransportException;
import com.kbgateway.protocol.InvocationContext;
import com.kbgateway.protocol.ToolRequestEnvelope;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockagentcore.BedrockAgentCoreClient;
import software.amazon.awssdk.services.bedrockagentcore.model.InvokeAgentRuntimeRequest;
import software.amazon.awssdk.services.bedrockagentcore.model.InvokeAgentRuntimeResponse;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentCoreGatewayTransportTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ARN = "arn:aws:bedrock-agentcore:us-east-1:123456789012:runtime/tool_gateway-abc123";
    private static final ToolRequestEnvelope REQUEST = ToolRequestEnvelope.of(
            "search_kb", Map.of("query", "refund policy"), new InvocationContext("acme", "u-1", null));

    private static ResponseBytes<InvokeAgentRuntimeResponse> stream(String json) {
        return ResponseBytes.fromByteArray(InvokeAgentRuntimeResponse.builder().build(),
                json.getBytes(StandardCharsets.UTF_8));
    }

    private static GatewayConfig agentCoreConfig(String arn) {
        return GatewayConfig.builder()
                .transportMode(TransportMode.AGENTCORE)
                .runtimeArn(arn)
                .build();
    }

    @Test
    void create_missingArnFailsBeforeAnyClientOrCall() {
        AtomicInteger clientsBuilt = new AtomicInteger();
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);

        GatewayConfigurationException ex = assertThrows(GatewayConfigurationException.class,
                () -> AgentCoreGatewayTransport.create(agentCoreConfig(null), cfg -> {
                    clientsBuilt.incrementAndGet();
                    return client;
                }));

        assertEquals("TOOL_GATEWAY_RUNTIME_ARN", ex.getSetting());
        assertEquals(0, clientsBuilt.get());
        verify(client, times(0)).invokeAgentRuntime(any(InvokeAgentRuntimeRequest.class));
    }

    @Test
    void selector_agentCoreModeWithoutArnIsConfigurationError() {
        GatewayTransportSelector selector = GatewayTransportSelector.withDiscoveredProviders();

        assertTrue(selector.getAvailableModes().contains(TransportMode.AGENTCORE));
        assertThrows(GatewayConfigurationException.class, () -> selector.select(agentCoreConfig(" ")));
    }

    @Test
    void send_invokesRuntimeWithEnvelopePayloadAndReturnsDecodedStream() throws Exception {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        String response = "{\"contract_version\":\"v1\",\"ok\":true,\"output\":{\"results\":[{\"id\":\"doc1\"}]}}";
        when(client.invokeAgentRuntimeAsBytes(any(InvokeAgentRuntimeRequest.class))).thenReturn(stream(response));
        AgentCoreGatewayTransport transport = AgentCoreGatewayTransport.create(agentCoreConfig(ARN), cfg -> client);

        JsonNode body = transport.send(REQUEST);

        assertEquals(MAPPER.readTree(response), body);
        ArgumentCaptor<InvokeAgentRuntimeRequest> captor = ArgumentCaptor.forClass(InvokeAgentRuntimeRequest.class);
        verify(client, times(1)).invokeAgentRuntime(captor.capture());
        InvokeAgentRuntimeRequest sent = captor.getValue();
        assertEquals(ARN, sent.agentRuntimeArn());
        assertEquals("DEFAULT", sent.qualifier());
        assertTrue(sent.runtimeSessionId().length() >= RuntimeSessionIds.MIN_LENGTH);
        JsonNode payload = MAPPER.readTree(sent.payload().asUtf8String());
        assertEquals("v1", payload.get("contract_version").asText());
        assertEquals("search_kb", payload.get("tool_name").asText());
        assertEquals("refund policy", payload.get("input").get("query").asText());
        assertEquals("acme", payload.get("tenant_id").asText());
        assertTrue(payload.get("correlation_id").isNull());
    }

    @Test
    void send_usesFreshSessionIdPerCall() {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        when(client.invokeAgentRuntimeAsBytes(any(InvokeAgentRuntimeRequest.class)))
                .thenReturn(stream("{}"), stream("{}"));
        AgentCoreGatewayTransport transport = AgentCoreGatewayTransport.create(agentCoreConfig(ARN), cfg -> client);

        transport.send(REQUEST);
        transport.send(REQUEST);

        ArgumentCaptor<InvokeAgentRuntimeRequest> captor = ArgumentCaptor.forClass(InvokeAgentRuntimeRequest.class);
        verify(client, times(2)).invokeAgentRuntime(captor.capture());
        List<InvokeAgentRuntimeRequest> sent = captor.getAllValues();
        assertNotEquals(sent.get(0).runtimeSessionId(), sent.get(1).runtimeSessionId());
    }

    @Test
    void send_passesConfiguredQualifier() {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        when(client.invokeAgentRuntimeAsBytes(any(InvokeAgentRuntimeRequest.class))).thenReturn(stream("{}"));
        GatewayConfig config = GatewayConfig.builder()
                .transportMode(TransportMode.AGENTCORE)
                .runtimeArn(ARN)
                .runtimeQualifier("canary")
                .build();

        AgentCoreGatewayTransport.create(config, cfg -> client).send(REQUEST);

        ArgumentCaptor<InvokeAgentRuntimeRequest> captor = ArgumentCaptor.forClass(InvokeAgentRuntimeRequest.class);
        verify(client).invokeAgentRuntime(captor.capture());
        assertEquals("canary", captor.getValue().qualifier());
    }

    @Test
    void send_sdkFailureIsTransportError() {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        when(client.invokeAgentRuntimeAsBytes(any(InvokeAgentRuntimeRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));
        AgentCoreGatewayTransport transport = AgentCoreGatewayTransport.create(agentCoreConfig(ARN), cfg -> client);

        GatewayTransportException ex = assertThrows(GatewayTransportException.class, () -> transport.send(REQUEST));

        assertEquals("agentcore", ex.getTransport());
        assertInstanceOf(SdkClientException.class, ex.getCause());
    }

    @Test
    void send_apiCallTimeoutIsTransportError() {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        when(client.invokeAgentRuntimeAsBytes(any(InvokeAgentRuntimeRequest.class)))
                .thenThrow(ApiCallTimeoutException.create(1_000));
        AgentCoreGatewayTransport transport = AgentCoreGatewayTransport.create(agentCoreConfig(ARN), cfg -> client);

        GatewayTransportException ex = assertThrows(GatewayTransportException.class, () -> transport.send(REQUEST));

        assertInstanceOf(ApiCallTimeoutException.class, ex.getCause());
    }

    @Test
    void send_stalledResponseBodyIsBoundedByRuntimeTimeout() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            exchange.getRequestBody().readAllBytes();
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write("{\"contract_version\":".getBytes(StandardCharsets.UTF_8));
                os.flush();
                Thread.sleep(4_000);
                os.write("\"v1\",\"ok\":true,\"output\":{\"results\":[]}}".getBytes(StandardCharsets.UTF_8));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                // client gave up and closed the connection
            }
        });
        server.start();
        GatewayConfig config = GatewayConfig.builder()
                .transportMode(TransportMode.AGENTCORE)
                .runtimeArn(ARN)
                .runtimeTimeout(Duration.ofSeconds(1))
                .build();
        URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        try (AgentCoreGatewayTransport transport = AgentCoreGatewayTransport.create(config,
                cfg -> AgentCoreGatewayTransport.clientBuilder(cfg)
                        .endpointOverride(endpoint)
                        .credentialsProvider(StaticCredentialsProvider.create(
                                AwsBasicCredentials.create("AKIDEXAMPLE", "test-secret")))
                        .build())) {
            long start = System.nanoTime();

            GatewayTransportException ex = assertThrows(GatewayTransportException.class, () -> transport.send(REQUEST));

            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
            assertInstanceOf(ApiCallTimeoutException.class, ex.getCause());
            assertTrue(elapsedMillis < 3_500, "send took " + elapsedMillis + " ms");
        } finally {
            server.stop(0);
        }
    }

    @Test
    void close_closesClientThroughToolGatewayClient() {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        ToolGatewayClient gatewayClient = new ToolGatewayClient(
                AgentCoreGatewayTransport.create(agentCoreConfig(ARN), cfg -> client));

        gatewayClient.close();

        verify(client).close();
    }

    @Test
    void send_nonJsonStreamIsTransportError() {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        when(client.invokeAgentRuntimeAsBytes(any(InvokeAgentRuntimeRequest.class))).thenReturn(stream("not json"));
        AgentCoreGatewayTransport transport = AgentCoreGatewayTransport.create(agentCoreConfig(ARN), cfg -> client);

        assertThrows(GatewayTransportException.class, () -> transport.send(REQUEST));
    }

    @Test
    void searchKb_overAgentCoreValidatesContractVersion() {
        BedrockAgentCoreClient client = mock(BedrockAgentCoreClient.class);
        when(client.invokeAgentRuntimeAsBytes(any(InvokeAgentRuntimeRequest.class)))
                .thenReturn(stream("{\"contract_version\":\"v2\",\"ok\":true,\"output\":{\"results\":[]}}"));
        KnowledgeBaseTools tools = new KnowledgeBaseTools(new ToolGatewayClient(
                AgentCoreGatewayTransport.create(agentCoreConfig(ARN), cfg -> client)));

        assertThrows(ContractMismatchException.class, () -> tools.searchKb("refund policy"));
    }
}
