package com.kbgateway.protocol;

/**
 * Thrown when the response envelope's {@code contract_version} is absent or differs from
 * {@link ContractVersion#CURRENT}. No other field of such an envelope is inspected.
 */
public final class ContractMismatchException extends ToolGatewayException {

    private final String expectedVersion;
    private final String actualVersion;

    public ContractMismatchException(String expectedVersion, String actualVersion) {
        super(String.format("Tool Gateway contract version mismatch: expected=%s, actual=%s",
                expectedVersion, actualVersion));
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getExpectedVersion() {
        return expectedVersion;
    }

    /** Version found in the response, or null when absent. */
    public String getActualVersion() {
        return actualVersion;
    }

    @Override
    public Kind getKind() {
        return Kind.CONTRACT_MISMATCH;
    }
}
