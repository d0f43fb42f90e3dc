package org.genesignature.tools.signature.similarity;

import org.apache.commons.math3.linear.RealMatrix;
import org.genesignature.utils.MatrixSummaryUtils;
import org.genesignature.utils.Utils;

import java.io.File;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Similarity (or one-hot assignment) between the columns of a query matrix and the columns of a reference matrix.
 * Rows are labeled by query column and columns by reference column.
 */
public final class SimilarityResult {
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final LabeledMatrix table;

    public SimilarityResult(final List<String> queryLabels,
                            final List<String> referenceLabels,
                            final RealMatrix values) {
        Utils.nonEmpty(queryLabels, "Query labels cannot be empty.");
        Utils.nonEmpty(referenceLabels, "Reference labels cannot be empty.");
        Utils.nonNull(values);
        Utils.validateArg(queryLabels.size() == values.getRowDimension(),
                "Number of query labels and rows in the similarity matrix must match.");
        Utils.validateArg(referenceLabels.size() == values.getColumnDimension(),
                "Number of reference labels and columns in the similarity matrix must match.");
        Utils.validateArg(queryLabels.stream().distinct().count() == queryLabels.size(), "Query labels must all be unique.");
        this.table = new LabeledMatrix(queryLabels, referenceLabels, values);
    }

    public List<String> getQueryLabels() {
        return table.getRowLabels();
    }

    public List<String> getReferenceLabels() {
        return table.getColumnLabels();
    }

    public RealMatrix getValues() {
        return table.getValues();
    }

    /**
     * Maps each reference label to the query label holding the largest value in its column (first one on ties).
     */
    public Map<String, String> getBestQueryLabelByReference() {
        final int[] maxRows = MatrixSummaryUtils.getColumnArgMaxes(table.getValues());
        final Map<String, String> best = new LinkedHashMap<>();
        for (int j = 0; j < maxRows.length; j++) {
            best.put(getReferenceLabels().get(j), getQueryLabels().get(maxRows[j]));
        }
        return best;
    }

    public void write(final File file) {
        Utils.nonNull(file);
        table.write(file);
    }

    /**
     * Composes {@code result_<method>_<measure>_<timestamp>_viz.tsv} inside {@code resultsDirectory}.
     */
    public static File composeOutputFile(final File resultsDirectory,
                                         final String method,
                                         final SimilarityMeasure measure,
                                         final LocalDateTime timestamp) {
        Utils.nonNull(resultsDirectory);
        Utils.nonEmpty(method, "Method name cannot be empty.");
        Utils.nonNull(measure);
        Utils.nonNull(timestamp);
        return new File(resultsDirectory, String.format("result_%s_%s_%s_viz.tsv",
                method, measure.getName(), TIMESTAMP_FORMATTER.format(timestamp)));
    }
}
