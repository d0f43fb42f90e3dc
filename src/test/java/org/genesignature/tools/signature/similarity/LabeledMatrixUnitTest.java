package org.genesignature.tools.signature.similarity;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.genesignature.exceptions.UserException;
import org.genesignature.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class LabeledMatrixUnitTest extends BaseTest {
    private static final File TEST_SUB_DIR = new File("src/test/resources/org/genesignature/tools/signature/");
    private static final File QUERY_FILE = new File(TEST_SUB_DIR, "query.tsv");
    private static final File BAD_VALUE_FILE = new File(TEST_SUB_DIR, "bad_value.tsv");

    private static final double EPSILON = 1E-12;

    @Test
    public void testRead() {
        final LabeledMatrix query = LabeledMatrix.read(QUERY_FILE);
        Assert.assertEquals(query.getColumnLabels(), Arrays.asList("S1", "S2", "S3"));
        Assert.assertEquals(query.getRowLabels(), Arrays.asList("G1", "G2", "G3", "G4", "G5", "G6", "G7"));
        Assert.assertEquals(query.getNumRows(), 7);
        Assert.assertEquals(query.getNumColumns(), 3);
        assertEqualsDoubleArray(query.getValues().getRow(0), new double[]{10, 1, 0}, EPSILON);
        assertEqualsDoubleArray(query.getValues().getColumn(2), new double[]{0, 1, 1, 2, 9, 7, 3}, EPSILON);
    }

    @Test
    public void testWriteAndRead() {
        final LabeledMatrix matrix = new LabeledMatrix(
                Arrays.asList("A", "B"),
                Arrays.asList("X", "Y", "Z"),
                new Array2DRowRealMatrix(new double[][]{{1.5, 0, -2}, {0.25, 3, 1E-3}}));
        final File outputFile = createTempFile("labeled-matrix", ".tsv");
        matrix.write(outputFile);

        final LabeledMatrix result = LabeledMatrix.read(outputFile);
        Assert.assertEquals(result.getRowLabels(), matrix.getRowLabels());
        Assert.assertEquals(result.getColumnLabels(), matrix.getColumnLabels());
        assertEqualsMatrix(result.getValues(), matrix.getValues().getData(), EPSILON);
    }

    @Test
    public void testValuesAreCopied() {
        final double[][] data = {{1, 2}};
        final RealMatrix values = new Array2DRowRealMatrix(data);
        final LabeledMatrix matrix = new LabeledMatrix(Collections.singletonList("A"), Arrays.asList("X", "Y"), values);
        values.setEntry(0, 0, 100.);
        Assert.assertEquals(matrix.getValues().getEntry(0, 0), 1., EPSILON);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testLabelsAreUnmodifiable() {
        final LabeledMatrix matrix = new LabeledMatrix(Collections.singletonList("A"), Collections.singletonList("X"),
                new Array2DRowRealMatrix(new double[][]{{1}}));
        matrix.getColumnLabels().add("Y");
    }

    @Test
    public void testFirstOccurrenceRowIndices() {
        final LabeledMatrix matrix = new LabeledMatrix(
                Arrays.asList("G2", "G1", "G2", "G3"),
                Collections.singletonList("X"),
                new Array2DRowRealMatrix(new double[][]{{1}, {2}, {3}, {4}}));
        final Map<String, Integer> indices = matrix.getFirstOccurrenceRowIndices();
        Assert.assertEquals(indices.size(), 3);
        Assert.assertEquals(indices.get("G2"), Integer.valueOf(0));
        Assert.assertEquals(indices.get("G1"), Integer.valueOf(1));
        Assert.assertEquals(indices.get("G3"), Integer.valueOf(3));
        Assert.assertEquals(indices.keySet().iterator().next(), "G2");
    }

    @Test
    public void testKryoSerializer() {
        final LabeledMatrix matrix = new LabeledMatrix(
                Arrays.asList("A", "B"),
                Arrays.asList("X", "Y"),
                new Array2DRowRealMatrix(new double[][]{{1, 2}, {3, 4}}));
        final Kryo kryo = new Kryo();
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (final Output output = new Output(bytes)) {
            kryo.writeObject(output, matrix);
        }
        final LabeledMatrix result;
        try (final Input input = new Input(new ByteArrayInputStream(bytes.toByteArray()))) {
            result = kryo.readObject(input, LabeledMatrix.class);
        }
        Assert.assertEquals(result.getRowLabels(), matrix.getRowLabels());
        Assert.assertEquals(result.getColumnLabels(), matrix.getColumnLabels());
        assertEqualsMatrix(result.getValues(), new double[][]{{1, 2}, {3, 4}}, 0.);
    }

    @DataProvider(name = "invalidConstructorArguments")
    public Object[][] invalidConstructorArguments() {
        return new Object[][]{
                //row label count mismatch
                {Collections.singletonList("A"), Arrays.asList("X", "Y"), new double[][]{{1, 2}, {3, 4}}},
                //column label count mismatch
                {Arrays.asList("A", "B"), Collections.singletonList("X"), new double[][]{{1, 2}, {3, 4}}},
                //duplicate column labels
                {Arrays.asList("A", "B"), Arrays.asList("X", "X"), new double[][]{{1, 2}, {3, 4}}},
                //null label
                {Arrays.asList("A", null), Arrays.asList("X", "Y"), new double[][]{{1, 2}, {3, 4}}}
        };
    }

    @Test(dataProvider = "invalidConstructorArguments", expectedExceptions = IllegalArgumentException.class)
    public void testInvalidConstructorArguments(final List<String> rowLabels,
                                                final List<String> columnLabels,
                                                final double[][] values) {
        new LabeledMatrix(rowLabels, columnLabels, new Array2DRowRealMatrix(values));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testReadNonNumericValue() {
        LabeledMatrix.read(BAD_VALUE_FILE);
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testReadMissingFile() {
        LabeledMatrix.read(new File(TEST_SUB_DIR, "does_not_exist.tsv"));
    }

    @DataProvider(name = "malformedFiles")
    public Object[][] malformedFiles() {
        return new Object[][]{
                {"gene\tX\tX\nA\t1\t2\n"},
                {"gene\tX\tY\nA\t1\n"},
                {"gene\tX\nA\tInfinity\n"},
                {"gene\tX\tY\n"},
                {"gene\n"}
        };
    }

    @Test(dataProvider = "malformedFiles", expectedExceptions = UserException.BadInput.class)
    public void testReadMalformedFile(final String contents) throws IOException {
        final File file = createTempFile("malformed", ".tsv");
        Files.write(file.toPath(), contents.getBytes(StandardCharsets.UTF_8));
        LabeledMatrix.read(file);
    }
}
