package com.phillippitts.styleswap.service.model;

import com.phillippitts.styleswap.exception.ExternalModelException;

/**
 * Lifecycle shared by the two external networks.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Adapter is constructed with configuration (model path, tensor names)</li>
 *   <li>{@link #initialize()} loads the parameters once; they are immutable afterwards</li>
 *   <li>forward passes run against the loaded parameters</li>
 *   <li>{@link #close()} releases native resources</li>
 * </ol>
 */
public interface NetworkAdapter extends AutoCloseable {

    /**
     * Loads the network. Idempotent.
     *
     * @throws ExternalModelException if the network cannot be loaded
     */
    void initialize();

    /**
     * Returns the name of this network for logging and error reporting.
     *
     * @return network name (e.g., "extractor", "inverse")
     */
    String getNetworkName();

    /**
     * @return true if the network is loaded and not closed
     */
    boolean isHealthy();

    /**
     * Releases all resources held by this network. Idempotent; never throws.
     */
    @Override
    void close();
}
