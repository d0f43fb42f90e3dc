package org.genesignature.utils;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.stream.IntStream;

/**
 * Static class for implementing some matrix summary stats that are not in Apache, Spark, etc
 */
public final class MatrixSummaryUtils {

    private MatrixSummaryUtils() {}

    /**
     * Return an array containing, for each column of the given matrix, the row index of its maximum.
     * Ties resolve to the lowest row index.
     * @param m Not {@code null}.  Size MxN, where M is not zero.
     * @return array of size N.  Never {@code null}
     */
    public static int[] getColumnArgMaxes(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate argmax on a null matrix.");
        Utils.validateArg(m.getRowDimension() > 0, "Cannot calculate column argmax of a matrix without rows.");
        return IntStream.range(0, m.getColumnDimension()).map(j -> argMax(m.getColumn(j))).toArray();
    }

    /**
     * Return an array containing, for each row of the given matrix, the column index of its maximum.
     * Ties resolve to the lowest column index.
     * @param m Not {@code null}.  Size MxN, where N is not zero.
     * @return array of size M.  Never {@code null}
     */
    public static int[] getRowArgMaxes(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate argmax on a null matrix.");
        Utils.validateArg(m.getColumnDimension() > 0, "Cannot calculate row argmax of a matrix without columns.");
        return IntStream.range(0, m.getRowDimension()).map(i -> argMax(m.getRow(i))).toArray();
    }

    /**
     * Return an array containing the Euclidean norm of each column in the given matrix.
     * @param m Not {@code null}.  Size MxN.
     * @return array of size N.  Never {@code null}
     */
    public static double[] getColumnL2Norms(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate norms on a null matrix.");
        return IntStream.range(0, m.getColumnDimension())
                .mapToDouble(j -> m.getColumnVector(j).getNorm()).toArray();
    }

    private static int argMax(final double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
