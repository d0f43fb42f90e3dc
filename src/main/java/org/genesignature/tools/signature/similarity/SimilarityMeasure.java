package org.genesignature.tools.signature.similarity;

import org.broadinstitute.barclay.argparser.CommandLineException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Column-pair similarity measures understood by {@link SimilarityUtils#computeSimilarity}.
 */
public enum SimilarityMeasure {
    /**
     * Cosine of the angle between two columns.
     */
    COSINE("cosine"),

    /**
     * Absolute Spearman rank correlation between two columns, ties receiving average ranks.
     */
    SPEARMAN("spearman");

    public static final String ARGUMENT_LONG_NAME = "similarity-measure";

    private final String name;

    SimilarityMeasure(final String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @throws CommandLineException.BadArgumentValue if {@code name} does not name a measure
     */
    public static SimilarityMeasure fromName(final String name) {
        return Arrays.stream(values())
                .filter(m -> m.name.equals(name))
                .findFirst()
                .orElseThrow(() -> new CommandLineException.BadArgumentValue(ARGUMENT_LONG_NAME, String.valueOf(name),
                        String.format("Similarity measure must be one of: %s.",
                                Arrays.stream(values()).map(SimilarityMeasure::getName).collect(Collectors.joining(", ")))));
    }

    @Override
    public String toString() {
        return name;
    }
}
