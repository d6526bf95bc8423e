package com.kbgateway.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned request sent to {@code /tools/invoke} (or wrapped in a hosted-runtime payload).
 * Wire shape: {@code {contract_version, tool_name, input, tenant_id, user_id, correlation_id}};
 * absent ids are written as JSON null, never omitted.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"contract_version", "tool_name", "input", "tenant_id", "user_id", "correlation_id"})
public final class ToolRequestEnvelope {

    private final String contractVersion;
    private final String toolName;
    private final Map<String, Object> input;
    private final String tenantId;
    private final String userId;
    private final String correlationId;

    @JsonCreator
    public ToolRequestEnvelope(
            @JsonProperty("contract_version") String contractVersion,
            @JsonProperty("tool_name") String toolName,
            @JsonProperty("input") Map<String, Object> input,
            @JsonProperty("tenant_id") String tenantId,
            @JsonProperty("user_id") String userId,
            @JsonProperty("correlation_id") String correlationId) {
        if (!ContractVersion.isCompatible(contractVersion)) {
            throw new IllegalArgumentException(String.format(
                    "Request contract version must be %s, got %s", ContractVersion.CURRENT, contractVersion));
        }
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName is required");
        }
        this.contractVersion = contractVersion;
        this.toolName = toolName;
        this.input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
        this.tenantId = tenantId;
        this.userId = userId;
        this.correlationId = correlationId;
    }

    /** Builds an envelope at {@link ContractVersion#CURRENT} with ids taken from {@code context}. */
    public static ToolRequestEnvelope of(String toolName, Map<String, Object> input, InvocationContext context) {
        InvocationContext ctx = Objects.requireNonNullElse(context, InvocationContext.empty());
        return new ToolRequestEnvelope(ContractVersion.CURRENT, toolName, input,
                ctx.getTenantId(), ctx.getUserId(), ctx.getCorrelationId());
    }

    @JsonProperty("contract_version")
    public String getContractVersion() {
        return contractVersion;
    }

    @JsonProperty("tool_name")
    public String getToolName() {
        return toolName;
    }

    @JsonProperty("input")
    public Map<String, Object> getInput() {
        return input;
    }

    @JsonProperty("tenant_id")
    public String getTenantId() {
        return tenantId;
    }

    @JsonProperty("user_id")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("correlation_id")
    public String getCorrelationId() {
        return correlationId;
    }
}
