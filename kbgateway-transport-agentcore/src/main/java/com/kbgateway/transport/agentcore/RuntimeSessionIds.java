package com.kbgateway.transport.agentcore;

import java.util.UUID;

/**
 * Runtime session ids for InvokeAgentRuntime. AgentCore requires at least 33 characters;
 * a dashless random UUID is 32 hex chars, so every id is {@code "session-" + hex} (40 chars).
 * {@link UUID#randomUUID()} draws from {@link java.security.SecureRandom}, so ids never repeat in practice.
 */
public final class RuntimeSessionIds {

    /** Minimum runtimeSessionId length accepted by AgentCore. */
    public static final int MIN_LENGTH = 33;
    static final String PREFIX = "session-";

    private RuntimeSessionIds() {
    }

    /** New id for exactly one invocation; never reuse. */
    public static String next() {
        String id = PREFIX + UUID.randomUUID().toString().replace("-", "");
        if (id.length() < MIN_LENGTH) {
            throw new IllegalStateException("Generated runtime session id shorter than " + MIN_LENGTH + ": " + id);
        }
        return id;
    }
}
