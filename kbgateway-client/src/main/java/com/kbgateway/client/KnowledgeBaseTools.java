package com.kbgateway.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbgateway.protocol.InvocationContext;
import com.kbgateway.protocol.MalformedResponseException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Agent-facing knowledge-base tools. Callers never see which transport is active.
 */
public final class KnowledgeBaseTools {

    public static final String SEARCH_KB = "search_kb";
    static final String QUERY_KEY = "query";
    static final String RESULTS_FIELD = "results";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {
    };

    private final ToolGatewayClient client;

    public KnowledgeBaseTools(ToolGatewayClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /** Searches the knowledge base with the client's default context. */
    public List<Map<String, Object>> searchKb(String query) {
        return searchKb(query, null);
    }

    /**
     * Calls {@code search_kb} with input {@code {"query": query}} and returns the ordered result
     * records exactly as the gateway sent them.
     *
     * @throws MalformedResponseException when {@code results} is not an array of objects
     */
    public List<Map<String, Object>> searchKb(String query, InvocationContext context) {
        Objects.requireNonNull(query, "query");
        JsonNode results = client.invoke(SEARCH_KB, Map.of(QUERY_KEY, query), context, RESULTS_FIELD);
        if (!results.isArray()) {
            throw new MalformedResponseException(RESULTS_FIELD,
                    "Malformed tool response: 'results' is not an array");
        }
        try {
            return MAPPER.convertValue(results, RECORDS);
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException(RESULTS_FIELD,
                    "Malformed tool response: 'results' entries are not objects", e);
        }
    }
}
