package org.genesignature.tools.signature.similarity;

import com.esotericsoftware.kryo.DefaultSerializer;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genesignature.exceptions.UserException;
import org.genesignature.utils.Utils;
import org.genesignature.utils.io.IOUtils;
import org.supercsv.comment.CommentStartsWith;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListReader;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A numeric matrix whose rows are labeled by feature (e.g., gene identifiers) and whose columns are labeled by
 * sample or signature name. Column labels must be unique; a repeated feature label resolves to its first occurrence.
 *
 * <p>The TSV representation has a header line holding the column labels after a leading cell for the feature column,
 * and one line per feature whose first cell is the feature label. Lines starting with {@code #} are skipped.</p>
 */
@DefaultSerializer(LabeledMatrix.Serializer.class)
public final class LabeledMatrix implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LogManager.getLogger(LabeledMatrix.class);

    private static final String COMMENT_STRING = "#";
    private static final CsvPreference TAB_SKIP_COMMENTS_PREFERENCE = new CsvPreference.Builder(CsvPreference.TAB_PREFERENCE)
            .skipComments(new CommentStartsWith(COMMENT_STRING)).build();

    private final List<String> rowLabels;
    private final List<String> columnLabels;
    private final RealMatrix values;

    /**
     * @param rowLabels     feature labels, one per row of {@code values}
     * @param columnLabels  unique column labels, one per column of {@code values}
     * @param values        features x columns; copied
     */
    public LabeledMatrix(final List<String> rowLabels,
                         final List<String> columnLabels,
                         final RealMatrix values) {
        Utils.nonEmpty(rowLabels, "Matrix must have at least one row.");
        Utils.nonEmpty(columnLabels, "Matrix must have at least one column.");
        Utils.containsNoNull(rowLabels, "Row labels cannot be null.");
        Utils.containsNoNull(columnLabels, "Column labels cannot be null.");
        Utils.nonNull(values);
        Utils.validateArg(rowLabels.size() == values.getRowDimension(),
                () -> String.format("Number of row labels (%d) and matrix rows (%d) must match.", rowLabels.size(), values.getRowDimension()));
        Utils.validateArg(columnLabels.size() == values.getColumnDimension(),
                () -> String.format("Number of column labels (%d) and matrix columns (%d) must match.", columnLabels.size(), values.getColumnDimension()));
        Utils.validateArg(columnLabels.stream().distinct().count() == columnLabels.size(), "Column labels must all be unique.");

        this.rowLabels = new ArrayList<>(rowLabels);
        this.columnLabels = new ArrayList<>(columnLabels);
        this.values = values.copy();
    }

    private LabeledMatrix(final Kryo kryo, final Input input) {
        final int numRows = input.readInt();
        final int numColumns = input.readInt();
        rowLabels = new ArrayList<>(numRows);
        for (int i = 0; i < numRows; i++) {
            rowLabels.add(input.readString());
        }
        columnLabels = new ArrayList<>(numColumns);
        for (int j = 0; j < numColumns; j++) {
            columnLabels.add(input.readString());
        }
        final double[][] data = new double[numRows][];
        for (int i = 0; i < numRows; i++) {
            data[i] = input.readDoubles(numColumns);
        }
        values = new Array2DRowRealMatrix(data, false);
    }

    public List<String> getRowLabels() {
        return Collections.unmodifiableList(rowLabels);
    }

    public List<String> getColumnLabels() {
        return Collections.unmodifiableList(columnLabels);
    }

    /**
     * Returns the backing matrix (features x columns), which must not be modified.
     */
    public RealMatrix getValues() {
        return values;
    }

    public int getNumRows() {
        return rowLabels.size();
    }

    public int getNumColumns() {
        return columnLabels.size();
    }

    /**
     * Maps each distinct row label to the index of its first occurrence, in row order.
     */
    public Map<String, Integer> getFirstOccurrenceRowIndices() {
        final Map<String, Integer> indices = new LinkedHashMap<>(2 * rowLabels.size());
        for (int i = 0; i < rowLabels.size(); i++) {
            indices.putIfAbsent(rowLabels.get(i), i);
        }
        return indices;
    }

    public static LabeledMatrix read(final File file) {
        IOUtils.canReadFile(file);
        try (final FileReader fileReader = new FileReader(file);
             final ICsvListReader listReader = new CsvListReader(fileReader, TAB_SKIP_COMMENTS_PREFERENCE)) {
            final String[] header = listReader.getHeader(true);
            if (header == null || header.length < 2) {
                throw new UserException.BadInput(String.format("File %s must have a header with at least one column label.", file));
            }
            final List<String> columnLabels = new ArrayList<>(header.length - 1);
            for (int j = 1; j < header.length; j++) {
                if (header[j] == null) {
                    throw new UserException.BadInput(String.format("File %s has an empty column label at column %d.", file, j));
                }
                columnLabels.add(header[j]);
            }

            final List<String> rowLabels = new ArrayList<>();
            final List<double[]> rows = new ArrayList<>();
            List<String> row;
            while ((row = listReader.read()) != null) {
                if (row.size() != header.length) {
                    throw new UserException.BadInput(String.format("Line %d of file %s has %d fields, but the header has %d.",
                            listReader.getLineNumber(), file, row.size(), header.length));
                }
                if (row.get(0) == null) {
                    throw new UserException.BadInput(String.format("Line %d of file %s has an empty feature label.", listReader.getLineNumber(), file));
                }
                rowLabels.add(row.get(0));
                final double[] rowValues = new double[columnLabels.size()];
                for (int j = 0; j < rowValues.length; j++) {
                    rowValues[j] = parseValue(row.get(j + 1), listReader.getLineNumber(), file);
                }
                rows.add(rowValues);
            }
            if (rows.isEmpty()) {
                throw new UserException.BadInput(String.format("File %s contains no feature rows.", file));
            }
            logger.debug(String.format("Read %d features x %d columns from %s.", rows.size(), columnLabels.size(), file));
            return new LabeledMatrix(rowLabels, columnLabels, new Array2DRowRealMatrix(rows.toArray(new double[0][]), false));
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, e.getMessage(), e);
        } catch (final IllegalArgumentException e) {
            throw new UserException.BadInput(String.format("File %s does not hold a valid labeled matrix: %s", file, e.getMessage()), e);
        }
    }

    /**
     * Writes this matrix as a TSV; the header begins with an empty cell above the row labels.
     */
    public void write(final File file) {
        Utils.nonNull(file);
        try (final FileWriter fileWriter = new FileWriter(file);
             final ICsvListWriter listWriter = new CsvListWriter(fileWriter, CsvPreference.TAB_PREFERENCE)) {
            final List<String> header = new ArrayList<>(columnLabels.size() + 1);
            header.add("");
            header.addAll(columnLabels);
            listWriter.writeHeader(header.toArray(new String[0]));
            for (int i = 0; i < rowLabels.size(); i++) {
                final List<Object> line = new ArrayList<>(columnLabels.size() + 1);
                line.add(rowLabels.get(i));
                for (final double value : values.getRow(i)) {
                    line.add(value);
                }
                listWriter.write(line);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(file, e.getMessage(), e);
        }
    }

    private static double parseValue(final String cell, final int lineNumber, final File file) {
        if (cell == null) {
            throw new UserException.BadInput(String.format("Line %d of file %s has an empty value.", lineNumber, file));
        }
        final double value;
        try {
            value = Double.parseDouble(cell);
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput(String.format("Line %d of file %s has a non-numeric value: %s", lineNumber, file, cell), e);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new UserException.BadInput(String.format("Line %d of file %s has a non-finite value: %s", lineNumber, file, cell));
        }
        return value;
    }

    private void serialize(final Kryo kryo, final Output output) {
        output.writeInt(rowLabels.size());
        output.writeInt(columnLabels.size());
        rowLabels.forEach(output::writeString);
        columnLabels.forEach(output::writeString);
        for (int i = 0; i < rowLabels.size(); i++) {
            output.writeDoubles(values.getRow(i));
        }
    }

    @Override
    public String toString() {
        return String.format("LabeledMatrix{%d features x %d columns}", getNumRows(), getNumColumns());
    }

    public static final class Serializer extends com.esotericsoftware.kryo.Serializer<LabeledMatrix> {
        @Override
        public void write(final Kryo kryo, final Output output, final LabeledMatrix matrix) {
            matrix.serialize(kryo, output);
        }

        @Override
        public LabeledMatrix read(final Kryo kryo, final Input input, final Class<LabeledMatrix> klass) {
            return new LabeledMatrix(kryo, input);
        }
    }
}
