package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.genesignature.utils.Utils;
import org.genesignature.utils.param.ParamUtils;

/**
 * Runs a single bootstrap iteration: resamples the query and reference matrices with a generator seeded by the
 * iteration index and hands both samples to the exchange store.
 */
public final class BootstrapWorker {
    private static final Logger logger = LogManager.getLogger(BootstrapWorker.class);

    private BootstrapWorker() {}

    /**
     * The same iteration index always yields the same two samples, whichever thread or executor runs it.
     *
     * @throws org.genesignature.exceptions.UserException.CouldNotCreateOutputFile if the samples cannot be persisted
     */
    public static void runIteration(final LabeledMatrix query,
                                    final LabeledMatrix reference,
                                    final BootstrapParameters parameters,
                                    final int iterationIndex,
                                    final ExchangeStore store) {
        Utils.nonNull(query);
        Utils.nonNull(reference);
        Utils.nonNull(parameters);
        Utils.nonNull(store);
        ParamUtils.isPositiveOrZero(iterationIndex, "Iteration index must be non-negative.");

        final RandomGenerator rng = new Well19937c(iterationIndex);
        final BootstrapSample querySample = BootstrapSampler.sampleFeatures(query.getValues(),
                parameters.getRowsSamplingFraction(), parameters.getColsSamplingFraction(), rng);
        final BootstrapSample referenceSample = BootstrapSampler.sampleFeatures(reference.getValues(),
                parameters.getRowsSamplingFraction(), parameters.getColsSamplingFraction(), rng);

        // the query sample marks the iteration complete, so it goes last
        store.put(iterationIndex, ExchangeRole.REFERENCE, referenceSample);
        store.put(iterationIndex, ExchangeRole.QUERY, querySample);
        logger.debug(String.format("Bootstrap iteration %d retained %d query and %d reference features.",
                iterationIndex, querySample.getNumRetained(), referenceSample.getNumRetained()));
    }
}
