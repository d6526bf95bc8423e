package com.kbgateway.protocol;

import java.util.Map;
import java.util.Objects;

/**
 * Caller identity propagated into every request envelope: tenant, user and correlation id.
 * All three are optional; blank values are normalized to null so they serialize as JSON null.
 */
public final class InvocationContext {

    static final String ENV_TENANT_ID = "TENANT_ID";
    static final String ENV_USER_ID = "USER_ID";
    static final String ENV_CORRELATION_ID = "CORRELATION_ID";

    private static final InvocationContext EMPTY = new InvocationContext(null, null, null);

    private final String tenantId;
    private final String userId;
    private final String correlationId;

    public InvocationContext(String tenantId, String userId, String correlationId) {
        this.tenantId = normalize(tenantId);
        this.userId = normalize(userId);
        this.correlationId = normalize(correlationId);
    }

    public static InvocationContext empty() {
        return EMPTY;
    }

    /** Reads TENANT_ID, USER_ID and CORRELATION_ID from the process environment. */
    public static InvocationContext fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static InvocationContext fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return new InvocationContext(env.get(ENV_TENANT_ID), env.get(ENV_USER_ID), env.get(ENV_CORRELATION_ID));
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    private static String normalize(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InvocationContext)) return false;
        InvocationContext that = (InvocationContext) o;
        return Objects.equals(tenantId, that.tenantId)
                && Objects.equals(userId, that.userId)
                && Objects.equals(correlationId, that.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, userId, correlationId);
    }

    @Override
    public String toString() {
        return "InvocationContext{tenantId=" + tenantId + ", userId=" + userId + ", correlationId=" + correlationId + "}";
    }
}
