package com.phillippitts.styleswap.service.model;

/**
 * Canonical network names used in logs, metrics and errors.
 */
public final class NetworkNames {

    public static final String EXTRACTOR = "extractor";
    public static final String INVERSE = "inverse";

    private NetworkNames() {
    }
}
