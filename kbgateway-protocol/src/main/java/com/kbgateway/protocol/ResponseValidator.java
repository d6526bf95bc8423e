package com.kbgateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Validates a decoded response envelope and unwraps the expected result field.
 * <p>
 * Checks run in a fixed order: contract version, then {@code ok}, then the result field.
 * A version mismatch wins over everything else because no other field of an untrusted
 * envelope can be relied on.
 */
public final class ResponseValidator {

    static final String FIELD_CONTRACT_VERSION = "contract_version";
    static final String FIELD_OK = "ok";
    static final String FIELD_OUTPUT = "output";
    static final String FIELD_ERROR = "error";
    static final String FIELD_MESSAGE = "message";
    static final String FIELD_CODE = "code";

    private ResponseValidator() {
    }

    /**
     * Returns {@code output.<resultField>} of a trusted, successful envelope.
     *
     * @param body        decoded response envelope
     * @param toolName    tool that was invoked (for failure reporting)
     * @param resultField field expected under {@code output} (e.g. "results")
     * @throws ContractMismatchException   version absent or different
     * @throws ToolFailureException        {@code ok} absent or not true
     * @throws MalformedResponseException  result field absent or null
     */
    public static JsonNode extract(JsonNode body, String toolName, String resultField) {
        Objects.requireNonNull(resultField, "resultField");
        if (body == null || !body.isObject()) {
            throw new ContractMismatchException(ContractVersion.CURRENT, null);
        }

        JsonNode version = body.get(FIELD_CONTRACT_VERSION);
        String actual = version != null && version.isTextual() ? version.asText() : null;
        if (!ContractVersion.isCompatible(actual)) {
            throw new ContractMismatchException(ContractVersion.CURRENT, actual);
        }

        JsonNode ok = body.get(FIELD_OK);
        if (ok == null || !ok.isBoolean() || !ok.booleanValue()) {
            JsonNode error = body.get(FIELD_ERROR);
            throw new ToolFailureException(toolName, textOrNull(error, FIELD_MESSAGE), textOrNull(error, FIELD_CODE));
        }

        JsonNode output = body.get(FIELD_OUTPUT);
        JsonNode result = output != null && output.isObject() ? output.get(resultField) : null;
        if (result == null || result.isNull()) {
            throw new MalformedResponseException(resultField);
        }
        return result;
    }

    private static String textOrNull(JsonNode parent, String field) {
        if (parent == null || !parent.isObject()) return null;
        JsonNode n = parent.get(field);
        return n != null && n.isTextual() ? n.asText() : null;
    }
}
