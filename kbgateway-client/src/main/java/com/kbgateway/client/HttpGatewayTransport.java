package com.kbgateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbgateway.config.GatewayConfig;
import com.kbgateway.protocol.GatewayConfigurationException;
import com.kbgateway.protocol.GatewayTransport;
import com.kbgateway.protocol.GatewayTransportException;
import com.kbgateway.protocol.ToolRequestEnvelope;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Transport that calls the gateway directly: {@code POST {baseUrl}/tools/invoke} with the
 * request envelope as JSON body. Default base URL http://localhost:8080, default timeout 20s.
 * A base URL that is not absolute http(s) is rejected at construction.
 * Non-2xx, timeout, I/O failure and non-JSON bodies are {@link GatewayTransportException}s.
 */
public final class HttpGatewayTransport implements GatewayTransport {

    static final String INVOKE_PATH = "/tools/invoke";
    private static final String NAME = "http";
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI invokeUri;
    private final Duration timeout;
    private final HttpClient httpClient;

    /**
     * @param baseUrl gateway base URL without trailing slash (as normalized by {@link GatewayConfig})
     * @throws GatewayConfigurationException when the URL is not an absolute http(s) URL
     */
    public HttpGatewayTransport(String baseUrl, Duration timeout) {
        String base = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : GatewayConfig.DEFAULT_BASE_URL;
        this.invokeUri = toInvokeUri(base);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public JsonNode send(ToolRequestEnvelope request) {
        String json;
        try {
            json = MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new GatewayTransportException(NAME, "Failed to encode request envelope: " + e.getOriginalMessage(), e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder(invokeUri)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new GatewayTransportException(NAME, "Tool Gateway call timed out after " + timeout.toSeconds() + "s: " + invokeUri, e);
        } catch (IOException e) {
            throw new GatewayTransportException(NAME, "Tool Gateway call failed: " + invokeUri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayTransportException(NAME, "Interrupted while calling Tool Gateway: " + invokeUri, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new GatewayTransportException(NAME, status,
                    "Tool Gateway HTTP error: " + status + " " + abbreviate(response.body()));
        }

        try {
            JsonNode body = MAPPER.readTree(response.body());
            if (body == null || body.isMissingNode()) {
                throw new GatewayTransportException(NAME, status, "Tool Gateway returned an empty body");
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new GatewayTransportException(NAME, "Tool Gateway returned a non-JSON body: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    private static URI toInvokeUri(String base) {
        URI uri;
        try {
            uri = URI.create(base + INVOKE_PATH);
        } catch (IllegalArgumentException e) {
            throw new GatewayConfigurationException(GatewayConfig.ENV_URL,
                    String.format("Invalid %s=%s: %s", GatewayConfig.ENV_URL, base, e.getMessage()));
        }
        String scheme = uri.getScheme();
        if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
            throw new GatewayConfigurationException(GatewayConfig.ENV_URL,
                    String.format("Invalid %s=%s (expected http://host:port or https://host:port)", GatewayConfig.ENV_URL, base));
        }
        return uri;
    }

    URI getInvokeUri() {
        return invokeUri;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
