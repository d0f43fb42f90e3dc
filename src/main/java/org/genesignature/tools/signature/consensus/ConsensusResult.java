package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.linear.RealMatrix;
import org.genesignature.tools.signature.similarity.SimilarityResult;
import org.genesignature.utils.Utils;
import org.genesignature.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of aggregating the bootstrap iterations of a consensus run.
 */
public final class ConsensusResult {
    private final RealMatrix accumulatedSimilarity;
    private final int numberOfDiscoveredIterations;
    private final List<Integer> skippedIterations;
    private final int numberOfConfiguredIterations;
    private final RealMatrix consensusSimilarity;
    private final SimilarityResult assignment;

    public ConsensusResult(final RealMatrix accumulatedSimilarity,
                           final int numberOfDiscoveredIterations,
                           final List<Integer> skippedIterations,
                           final int numberOfConfiguredIterations,
                           final RealMatrix consensusSimilarity,
                           final SimilarityResult assignment) {
        Utils.nonNull(accumulatedSimilarity);
        ParamUtils.isPositiveOrZero(numberOfDiscoveredIterations, "Number of discovered iterations must be non-negative.");
        Utils.nonNull(skippedIterations);
        Utils.validateArg(skippedIterations.size() <= numberOfDiscoveredIterations,
                "Cannot skip more iterations than were discovered.");
        ParamUtils.isPositive(numberOfConfiguredIterations, "Number of configured iterations must be positive.");
        Utils.nonNull(consensusSimilarity);
        Utils.nonNull(assignment);
        Utils.validateArg(accumulatedSimilarity.getRowDimension() == consensusSimilarity.getRowDimension()
                        && accumulatedSimilarity.getColumnDimension() == consensusSimilarity.getColumnDimension(),
                "Accumulated and consensus similarity must have the same shape.");
        this.accumulatedSimilarity = accumulatedSimilarity;
        this.numberOfDiscoveredIterations = numberOfDiscoveredIterations;
        this.skippedIterations = Collections.unmodifiableList(new ArrayList<>(skippedIterations));
        this.numberOfConfiguredIterations = numberOfConfiguredIterations;
        this.consensusSimilarity = consensusSimilarity;
        this.assignment = assignment;
    }

    /**
     * Sum of the per-iteration similarity matrices, query columns x reference columns.
     */
    public RealMatrix getAccumulatedSimilarity() {
        return accumulatedSimilarity;
    }

    public int getNumberOfDiscoveredIterations() {
        return numberOfDiscoveredIterations;
    }

    /**
     * Completed iterations left out of the sum because their resampled matrices shared too few features.
     */
    public List<Integer> getSkippedIterations() {
        return skippedIterations;
    }

    public int getNumberOfConfiguredIterations() {
        return numberOfConfiguredIterations;
    }

    /**
     * The accumulated similarity divided by the configured (not discovered) number of iterations.
     */
    public RealMatrix getConsensusSimilarity() {
        return consensusSimilarity;
    }

    /**
     * One-hot assignment of each reference column to its most similar query column.
     */
    public SimilarityResult getAssignment() {
        return assignment;
    }
}
