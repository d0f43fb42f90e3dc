package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.genesignature.utils.Utils;

/**
 * Draws feature-reduced copies of a features x columns matrix for bootstrap resampling.
 */
public final class BootstrapSampler {

    private BootstrapSampler() {}

    /**
     * Retains {@code round(rowsSamplingFraction * numFeatures)} (at least one) features, drawn uniformly without
     * replacement and kept in draw order.  Of the columns, {@code round(colsSamplingFraction * numColumns)} (at least
     * one) are kept and the values of the others are zeroed; all columns stay in place so their labels still apply.
     *
     * @param matrix                features x columns; not modified
     * @param rowsSamplingFraction  fraction of features to retain, in (0, 1]
     * @param colsSamplingFraction  fraction of columns to keep unmasked, in (0, 1]
     * @param rng                   source of randomness; the draws depend only on its state
     */
    public static BootstrapSample sampleFeatures(final RealMatrix matrix,
                                                 final double rowsSamplingFraction,
                                                 final double colsSamplingFraction,
                                                 final RandomGenerator rng) {
        Utils.nonNull(matrix);
        Utils.nonNull(rng);
        validateSamplingFraction(rowsSamplingFraction, "Rows sampling fraction");
        validateSamplingFraction(colsSamplingFraction, "Columns sampling fraction");

        final int numFeatures = matrix.getRowDimension();
        final int numColumns = matrix.getColumnDimension();
        final RandomDataGenerator randomDataGenerator = new RandomDataGenerator(rng);

        final int[] retainedIndices = randomDataGenerator.nextPermutation(numFeatures, countRetained(rowsSamplingFraction, numFeatures));
        final int[] allColumns = new int[numColumns];
        for (int j = 0; j < numColumns; j++) {
            allColumns[j] = j;
        }
        final RealMatrix reducedValues = matrix.getSubMatrix(retainedIndices, allColumns);

        final int numKeptColumns = countRetained(colsSamplingFraction, numColumns);
        if (numKeptColumns < numColumns) {
            final boolean[] isKept = new boolean[numColumns];
            for (final int j : randomDataGenerator.nextPermutation(numColumns, numKeptColumns)) {
                isKept[j] = true;
            }
            for (int j = 0; j < numColumns; j++) {
                if (!isKept[j]) {
                    reducedValues.setColumn(j, new double[retainedIndices.length]);
                }
            }
        }
        return new BootstrapSample(reducedValues, retainedIndices);
    }

    static void validateSamplingFraction(final double fraction, final String name) {
        Utils.validateArg(fraction > 0. && fraction <= 1., () -> String.format("%s must be in (0, 1], but was %s.", name, fraction));
    }

    static int countRetained(final double fraction, final int total) {
        return (int) Math.max(1, Math.min(total, Math.round(fraction * total)));
    }
}
