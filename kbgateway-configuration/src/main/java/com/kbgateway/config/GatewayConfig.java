package com.kbgateway.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the Tool Gateway client.
 * <p>
 * Mode: TOOL_GATEWAY_MODE ({@code http} or {@code agentcore}). HTTP: TOOL_GATEWAY_URL,
 * TOOL_GATEWAY_TIMEOUT_SECONDS. AgentCore: TOOL_GATEWAY_RUNTIME_ARN, TOOL_GATEWAY_QUALIFIER,
 * TOOL_GATEWAY_RUNTIME_TIMEOUT_SECONDS, AWS_REGION (falls back to AWS_DEFAULT_REGION).
 * <p>
 * Nothing here validates mode-specific requirements; a missing runtime ARN is reported by the
 * AgentCore transport when it is selected.
 */
public final class GatewayConfig {

    static final String ENV_MODE = "TOOL_GATEWAY_MODE";
    public static final String ENV_URL = "TOOL_GATEWAY_URL";
    static final String ENV_TIMEOUT_SECONDS = "TOOL_GATEWAY_TIMEOUT_SECONDS";
    public static final String ENV_RUNTIME_ARN = "TOOL_GATEWAY_RUNTIME_ARN";
    static final String ENV_QUALIFIER = "TOOL_GATEWAY_QUALIFIER";
    static final String ENV_RUNTIME_TIMEOUT_SECONDS = "TOOL_GATEWAY_RUNTIME_TIMEOUT_SECONDS";
    static final String ENV_AWS_REGION = "AWS_REGION";
    static final String ENV_AWS_DEFAULT_REGION = "AWS_DEFAULT_REGION";

    public static final String DEFAULT_BASE_URL = "http://localhost:8080";
    /** Qualifier sentinel meaning "the runtime's default endpoint version". */
    public static final String DEFAULT_QUALIFIER = "DEFAULT";
    public static final String DEFAULT_REGION = "us-east-1";
    private static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 20;
    /** Explicit bound for invoke + full stream read; the SDK has no such default. */
    private static final int DEFAULT_RUNTIME_TIMEOUT_SECONDS = 60;

    private final TransportMode transportMode;
    private final String gatewayBaseUrl;
    private final Duration httpTimeout;
    private final String runtimeArn;
    private final String runtimeQualifier;
    private final Duration runtimeTimeout;
    private final String region;

    private GatewayConfig(Builder b) {
        this.transportMode = b.transportMode;
        this.gatewayBaseUrl = stripTrailingSlash(b.gatewayBaseUrl);
        this.httpTimeout = b.httpTimeout;
        this.runtimeArn = b.runtimeArn;
        this.runtimeQualifier = b.runtimeQualifier;
        this.runtimeTimeout = b.runtimeTimeout;
        this.region = b.region;
    }

    public TransportMode getTransportMode() {
        return transportMode;
    }

    /** Base URL of the gateway without trailing slash. Default {@value #DEFAULT_BASE_URL}. */
    public String getGatewayBaseUrl() {
        return gatewayBaseUrl;
    }

    /** Bounded wait for one HTTP request/response. Default 20 seconds. */
    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    /** AgentCore runtime ARN, or null when unset. Required only in {@link TransportMode#AGENTCORE}. */
    public String getRuntimeArn() {
        return runtimeArn;
    }

    public String getRuntimeQualifier() {
        return runtimeQualifier;
    }

    public Duration getRuntimeTimeout() {
        return runtimeTimeout;
    }

    public String getRegion() {
        return region;
    }

    public static GatewayConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reading from the given map (tests, embedded use). */
    public static GatewayConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String region = getEnv(env, ENV_AWS_REGION, getEnv(env, ENV_AWS_DEFAULT_REGION, DEFAULT_REGION));
        return builder()
                .transportMode(TransportMode.parse(env.get(ENV_MODE)))
                .gatewayBaseUrl(getEnv(env, ENV_URL, DEFAULT_BASE_URL))
                .httpTimeout(Duration.ofSeconds(parseInt(env.get(ENV_TIMEOUT_SECONDS), DEFAULT_HTTP_TIMEOUT_SECONDS)))
                .runtimeArn(getEnv(env, ENV_RUNTIME_ARN, null))
                .runtimeQualifier(getEnv(env, ENV_QUALIFIER, DEFAULT_QUALIFIER))
                .runtimeTimeout(Duration.ofSeconds(parseInt(env.get(ENV_RUNTIME_TIMEOUT_SECONDS), DEFAULT_RUNTIME_TIMEOUT_SECONDS)))
                .region(region)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int n = Integer.parseInt(value.trim());
            return n > 0 ? n : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String stripTrailingSlash(String url) {
        String u = url;
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }

    public static final class Builder {
        private TransportMode transportMode = TransportMode.HTTP;
        private String gatewayBaseUrl = DEFAULT_BASE_URL;
        private Duration httpTimeout = Duration.ofSeconds(DEFAULT_HTTP_TIMEOUT_SECONDS);
        private String runtimeArn;
        private String runtimeQualifier = DEFAULT_QUALIFIER;
        private Duration runtimeTimeout = Duration.ofSeconds(DEFAULT_RUNTIME_TIMEOUT_SECONDS);
        private String region = DEFAULT_REGION;

        public Builder transportMode(TransportMode transportMode) {
            this.transportMode = Objects.requireNonNull(transportMode, "transportMode");
            return this;
        }

        public Builder gatewayBaseUrl(String gatewayBaseUrl) {
            this.gatewayBaseUrl = gatewayBaseUrl != null && !gatewayBaseUrl.isBlank() ? gatewayBaseUrl.trim() : DEFAULT_BASE_URL;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = Objects.requireNonNull(httpTimeout, "httpTimeout");
            return this;
        }

        public Builder runtimeArn(String runtimeArn) {
            this.runtimeArn = runtimeArn != null && !runtimeArn.isBlank() ? runtimeArn.trim() : null;
            return this;
        }

        public Builder runtimeQualifier(String runtimeQualifier) {
            this.runtimeQualifier = runtimeQualifier != null && !runtimeQualifier.isBlank() ? runtimeQualifier.trim() : DEFAULT_QUALIFIER;
            return this;
        }

        public Builder runtimeTimeout(Duration runtimeTimeout) {
            this.runtimeTimeout = Objects.requireNonNull(runtimeTimeout, "runtimeTimeout");
            return this;
        }

        public Builder region(String region) {
            this.region = region != null && !region.isBlank() ? region.trim() : DEFAULT_REGION;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }
}
