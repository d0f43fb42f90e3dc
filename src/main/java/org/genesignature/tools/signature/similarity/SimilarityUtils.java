package org.genesignature.tools.signature.similarity;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genesignature.exceptions.GeneSignatureException;
import org.genesignature.exceptions.UserException;
import org.genesignature.utils.MatrixSummaryUtils;
import org.genesignature.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Utility class for computing similarity between the columns of two {@link LabeledMatrix}s that share a feature
 * axis, and for turning a similarity matrix into a one-hot assignment.
 */
public final class SimilarityUtils {
    private static final Logger logger = LogManager.getLogger(SimilarityUtils.class);

    /**
     * Binarize each column: one 1 per reference column, at its most similar query column.
     */
    public static final int AXIS_COLUMNS = 0;

    /**
     * Binarize each row: one 1 per query column, at its most similar reference column.
     */
    public static final int AXIS_ROWS = 1;

    private static final int MINIMUM_NUMBER_OF_FEATURES_FOR_SPEARMAN = 2;

    private SimilarityUtils() {}

    /**
     * Computes the similarity between every column of {@code query} and every column of {@code reference},
     * restricted to the feature labels the two matrices share.
     * Common features are taken in the order of the query, each at its first occurrence in either matrix.
     *
     * @return a fresh matrix of shape (query columns) x (reference columns)
     * @throws UserException.EmptyIntersection if the matrices share no feature label
     */
    public static RealMatrix computeSimilarity(final LabeledMatrix query,
                                               final LabeledMatrix reference,
                                               final SimilarityMeasure measure) {
        Utils.nonNull(query);
        Utils.nonNull(reference);
        Utils.nonNull(measure);

        final Map<String, Integer> queryIndices = query.getFirstOccurrenceRowIndices();
        final Map<String, Integer> referenceIndices = reference.getFirstOccurrenceRowIndices();
        final List<Integer> commonQueryRows = new ArrayList<>();
        final List<Integer> commonReferenceRows = new ArrayList<>();
        queryIndices.forEach((label, queryRow) -> {
            final Integer referenceRow = referenceIndices.get(label);
            if (referenceRow != null) {
                commonQueryRows.add(queryRow);
                commonReferenceRows.add(referenceRow);
            }
        });
        if (commonQueryRows.isEmpty()) {
            throw new UserException.EmptyIntersection(String.format(
                    "The query (%d features) and reference (%d features) matrices have no feature label in common.",
                    query.getNumRows(), reference.getNumRows()));
        }
        logger.debug(String.format("Computing %s similarity over %d common features.", measure, commonQueryRows.size()));

        final RealMatrix queryValues = selectRows(query.getValues(), commonQueryRows);
        final RealMatrix referenceValues = selectRows(reference.getValues(), commonReferenceRows);
        switch (measure) {
            case COSINE:
                return cosineSimilarity(queryValues, referenceValues);
            case SPEARMAN:
                return absoluteSpearmanCorrelation(queryValues, referenceValues);
            default:
                throw new GeneSignatureException.ShouldNeverReachHereException("Unhandled similarity measure: " + measure);
        }
    }

    /**
     * Replaces each maximum along {@code axis} by 1 and every other entry by 0. The first maximum wins on ties.
     *
     * @param similarity    matrix to binarize; not modified
     * @param axis          {@link #AXIS_COLUMNS} or {@link #AXIS_ROWS}
     * @return a new matrix of the same shape
     */
    public static RealMatrix binarize(final RealMatrix similarity, final int axis) {
        Utils.nonNull(similarity);
        Utils.validateArg(axis == AXIS_COLUMNS || axis == AXIS_ROWS,
                () -> String.format("Binarization axis must be %d or %d, but was %d.", AXIS_COLUMNS, AXIS_ROWS, axis));
        final RealMatrix assignment = new Array2DRowRealMatrix(similarity.getRowDimension(), similarity.getColumnDimension());
        if (axis == AXIS_COLUMNS) {
            final int[] maxRows = MatrixSummaryUtils.getColumnArgMaxes(similarity);
            for (int j = 0; j < maxRows.length; j++) {
                assignment.setEntry(maxRows[j], j, 1.);
            }
        } else {
            final int[] maxColumns = MatrixSummaryUtils.getRowArgMaxes(similarity);
            for (int i = 0; i < maxColumns.length; i++) {
                assignment.setEntry(i, maxColumns[i], 1.);
            }
        }
        return assignment;
    }

    private static RealMatrix selectRows(final RealMatrix values, final List<Integer> rows) {
        final int[] rowIndices = rows.stream().mapToInt(Integer::intValue).toArray();
        final int[] allColumns = new int[values.getColumnDimension()];
        for (int j = 0; j < allColumns.length; j++) {
            allColumns[j] = j;
        }
        return values.getSubMatrix(rowIndices, allColumns);
    }

    // columns with zero norm have similarity 0 with everything
    private static RealMatrix cosineSimilarity(final RealMatrix query, final RealMatrix reference) {
        final double[] queryNorms = MatrixSummaryUtils.getColumnL2Norms(query);
        final double[] referenceNorms = MatrixSummaryUtils.getColumnL2Norms(reference);
        final RealMatrix similarity = query.transpose().multiply(reference);
        similarity.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(final int queryIndex, final int referenceIndex, final double dotProduct) {
                final double normProduct = queryNorms[queryIndex] * referenceNorms[referenceIndex];
                return normProduct == 0. ? 0. : dotProduct / normProduct;
            }
        });
        return similarity;
    }

    // correlations left undefined by a constant column are reported as 0
    private static RealMatrix absoluteSpearmanCorrelation(final RealMatrix query, final RealMatrix reference) {
        final int numFeatures = query.getRowDimension();
        if (numFeatures < MINIMUM_NUMBER_OF_FEATURES_FOR_SPEARMAN) {
            throw new UserException.BadInput(String.format(
                    "Spearman correlation requires at least %d common features, but only %d were found.",
                    MINIMUM_NUMBER_OF_FEATURES_FOR_SPEARMAN, numFeatures));
        }
        final int numQueryColumns = query.getColumnDimension();
        final int numReferenceColumns = reference.getColumnDimension();
        final RealMatrix combined = new Array2DRowRealMatrix(numFeatures, numQueryColumns + numReferenceColumns);
        combined.setSubMatrix(query.getData(), 0, 0);
        combined.setSubMatrix(reference.getData(), 0, numQueryColumns);

        final RealMatrix correlation = new SpearmansCorrelation().computeCorrelationMatrix(combined);
        final RealMatrix crossBlock = correlation.getSubMatrix(
                0, numQueryColumns - 1, numQueryColumns, numQueryColumns + numReferenceColumns - 1);
        crossBlock.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(final int queryIndex, final int referenceIndex, final double value) {
                return Double.isNaN(value) ? 0. : Math.abs(value);
            }
        });
        return crossBlock;
    }
}
