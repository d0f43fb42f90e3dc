package org.genesignature.tools.signature.consensus;

import java.io.Serializable;
import java.util.List;

/**
 * Medium through which bootstrap workers hand their samples to the consensus aggregator.
 * Each iteration stores one sample per {@link ExchangeRole}; an iteration counts as completed once its
 * {@link ExchangeRole#QUERY} sample is present, so workers put the {@link ExchangeRole#REFERENCE} sample first.
 * Implementations must tolerate concurrent puts for distinct iterations.
 */
public interface ExchangeStore extends Serializable {

    void put(final int iteration, final ExchangeRole role, final BootstrapSample sample);

    /**
     * @return indices of the completed iterations, ascending
     */
    List<Integer> listCompleted();

    BootstrapSample get(final int iteration, final ExchangeRole role);

    /**
     * @return whether samples put by a Spark executor are visible to the driver
     */
    default boolean isVisibleToExecutors() {
        return false;
    }
}
