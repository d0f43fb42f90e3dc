package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.genesignature.tools.signature.similarity.SimilarityMeasure;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Random non-negative inputs and parameter sets shared by the consensus tests.
 */
final class ConsensusTestUtils {

    private ConsensusTestUtils() {}

    static LabeledMatrix randomMatrix(final String featurePrefix, final int firstFeature, final int numFeatures,
                                      final String columnPrefix, final int numColumns, final int seed) {
        final RandomGenerator rng = new Well19937c(seed);
        final List<String> rowLabels = IntStream.range(firstFeature, firstFeature + numFeatures)
                .mapToObj(i -> featurePrefix + i).collect(Collectors.toList());
        final List<String> columnLabels = IntStream.range(0, numColumns)
                .mapToObj(j -> columnPrefix + j).collect(Collectors.toList());
        final double[][] values = new double[numFeatures][numColumns];
        for (int i = 0; i < numFeatures; i++) {
            for (int j = 0; j < numColumns; j++) {
                values[i][j] = rng.nextDouble();
            }
        }
        return new LabeledMatrix(rowLabels, columnLabels, new Array2DRowRealMatrix(values, false));
    }

    static BootstrapParameters parameters(final ProcessingMethod method, final int numberOfBootstraps,
                                          final double rowsSamplingFraction, final double colsSamplingFraction,
                                          final Path runDirectory) {
        return new BootstrapParameters(SimilarityMeasure.COSINE, method, numberOfBootstraps,
                rowsSamplingFraction, colsSamplingFraction, 4, runDirectory, null);
    }
}
