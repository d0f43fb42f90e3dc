package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genesignature.exceptions.UserException;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.genesignature.tools.signature.similarity.SimilarityResult;
import org.genesignature.tools.signature.similarity.SimilarityUtils;
import org.genesignature.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads back the completed bootstrap iterations from an {@link ExchangeStore} and averages their similarity into a
 * consensus, which is then binarized so that each reference column is assigned to one query column.
 */
public final class ConsensusAggregator {
    private static final Logger logger = LogManager.getLogger(ConsensusAggregator.class);

    private ConsensusAggregator() {}

    /**
     * Iterations missing from the store still count in the denominator, so the consensus of a partially
     * populated store is scaled down rather than renormalized.  The same holds for a completed iteration whose
     * resampled matrices share too few features to compute a similarity: it is skipped with a warning and
     * contributes nothing to the sum.
     */
    public static ConsensusResult aggregate(final LabeledMatrix originalQuery,
                                            final LabeledMatrix originalReference,
                                            final BootstrapParameters parameters,
                                            final ExchangeStore store) {
        Utils.nonNull(originalQuery);
        Utils.nonNull(originalReference);
        Utils.nonNull(parameters);
        Utils.nonNull(store);

        final List<Integer> completedIterations = store.listCompleted();
        logger.info(String.format("Aggregating %d completed bootstrap iterations...", completedIterations.size()));

        RealMatrix accumulatedSimilarity = new Array2DRowRealMatrix(originalQuery.getNumColumns(), originalReference.getNumColumns());
        final List<Integer> skippedIterations = new ArrayList<>();
        for (final int iteration : completedIterations) {
            final LabeledMatrix query = realign(originalQuery, store.get(iteration, ExchangeRole.QUERY), iteration);
            final LabeledMatrix reference = realign(originalReference, store.get(iteration, ExchangeRole.REFERENCE), iteration);
            final RealMatrix similarity;
            try {
                similarity = SimilarityUtils.computeSimilarity(query, reference, parameters.getSimilarityMeasure());
            } catch (final UserException.EmptyIntersection | UserException.BadInput e) {
                logger.warn(String.format("Skipping bootstrap iteration %d: %s", iteration, e.getMessage()));
                skippedIterations.add(iteration);
                continue;
            }
            accumulatedSimilarity = accumulatedSimilarity.add(similarity);
        }
        if (!skippedIterations.isEmpty()) {
            logger.warn(String.format("%d of %d completed bootstrap iterations were skipped because their resampled " +
                    "matrices could not be compared: %s", skippedIterations.size(), completedIterations.size(), skippedIterations));
        }

        final int numberOfBootstraps = parameters.getNumberOfBootstraps();
        if (completedIterations.size() < numberOfBootstraps) {
            logger.warn(String.format("Only %d of %d bootstrap iterations were found in the exchange store; " +
                    "the consensus is still normalized by %d.", completedIterations.size(), numberOfBootstraps, numberOfBootstraps));
        }
        final RealMatrix consensusSimilarity = accumulatedSimilarity.scalarMultiply(1. / numberOfBootstraps);
        final RealMatrix assignment = SimilarityUtils.binarize(consensusSimilarity, SimilarityUtils.AXIS_COLUMNS);

        return new ConsensusResult(accumulatedSimilarity, completedIterations.size(), skippedIterations, numberOfBootstraps,
                consensusSimilarity, new SimilarityResult(originalQuery.getColumnLabels(), originalReference.getColumnLabels(), assignment));
    }

    // labels each retained row with the feature label it had in the original matrix
    private static LabeledMatrix realign(final LabeledMatrix original, final BootstrapSample sample, final int iteration) {
        if (sample.getValues().getColumnDimension() != original.getNumColumns()) {
            throw new UserException.BadInput(String.format("The sample of iteration %d has %d columns, but the input matrix has %d.",
                    iteration, sample.getValues().getColumnDimension(), original.getNumColumns()));
        }
        final List<String> originalRowLabels = original.getRowLabels();
        final List<String> rowLabels = new ArrayList<>(sample.getNumRetained());
        for (final int index : sample.getRetainedIndices()) {
            if (index >= originalRowLabels.size()) {
                throw new UserException.BadInput(String.format("The sample of iteration %d retains feature %d, but the input matrix has only %d features.",
                        iteration, index, originalRowLabels.size()));
            }
            rowLabels.add(originalRowLabels.get(index));
        }
        return new LabeledMatrix(rowLabels, original.getColumnLabels(), sample.getValues());
    }
}
