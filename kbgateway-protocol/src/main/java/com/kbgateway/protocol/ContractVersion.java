package com.kbgateway.protocol;

/**
 * Contract version agreed with the Tool Gateway. Both the request envelope and the response
 * envelope carry it; a response with any other value is not trusted.
 */
public final class ContractVersion {

    /** Version compiled into this client (e.g. "v1"). */
    public static final String CURRENT = "v1";

    private ContractVersion() {
    }

    /** True when {@code version} equals {@link #CURRENT}; null is never compatible. */
    public static boolean isCompatible(String version) {
        return CURRENT.equals(version);
    }
}
