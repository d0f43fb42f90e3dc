package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.Well19937c;
import org.genesignature.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

public final class BootstrapSamplerUnitTest extends BaseTest {
    private static final int NUM_FEATURES = 20;
    private static final int NUM_COLUMNS = 4;

    // entry (i, j) is 100 * i + j + 1, so every entry is non-zero and identifies its position
    private static RealMatrix positionMatrix() {
        final double[][] values = new double[NUM_FEATURES][NUM_COLUMNS];
        for (int i = 0; i < NUM_FEATURES; i++) {
            for (int j = 0; j < NUM_COLUMNS; j++) {
                values[i][j] = 100 * i + j + 1;
            }
        }
        return new Array2DRowRealMatrix(values);
    }

    @DataProvider(name = "retainedCounts")
    public Object[][] retainedCounts() {
        return new Object[][]{
                {1., 20},
                {0.8, 16},
                {0.5, 10},
                {0.125, 3},     //2.5 rounds up
                {0.01, 1}       //never fewer than one
        };
    }

    @Test(dataProvider = "retainedCounts")
    public void testRetainedFeatures(final double rowsSamplingFraction, final int expectedNumRetained) {
        final RealMatrix matrix = positionMatrix();
        final BootstrapSample sample = BootstrapSampler.sampleFeatures(matrix, rowsSamplingFraction, 1., new Well19937c(1));
        Assert.assertEquals(sample.getNumRetained(), expectedNumRetained);
        Assert.assertEquals(sample.getValues().getRowDimension(), expectedNumRetained);
        Assert.assertEquals(sample.getValues().getColumnDimension(), NUM_COLUMNS);

        final int[] retainedIndices = sample.getRetainedIndices();
        Assert.assertEquals(Arrays.stream(retainedIndices).distinct().count(), (long) expectedNumRetained);
        for (int i = 0; i < retainedIndices.length; i++) {
            Assert.assertTrue(retainedIndices[i] >= 0 && retainedIndices[i] < NUM_FEATURES);
            assertEqualsDoubleArray(sample.getValues().getRow(i), matrix.getRow(retainedIndices[i]), 0.);
        }
    }

    @Test
    public void testColumnMasking() {
        final RealMatrix matrix = positionMatrix();
        final BootstrapSample sample = BootstrapSampler.sampleFeatures(matrix, 0.5, 0.5, new Well19937c(3));
        Assert.assertEquals(sample.getValues().getColumnDimension(), NUM_COLUMNS);

        int numKeptColumns = 0;
        for (int j = 0; j < NUM_COLUMNS; j++) {
            final double[] column = sample.getValues().getColumn(j);
            final boolean isMasked = Arrays.stream(column).allMatch(v -> v == 0.);
            final boolean isKept = Arrays.stream(column).allMatch(v -> v != 0.);
            Assert.assertTrue(isMasked ^ isKept, "a column is either fully masked or fully kept");
            if (isKept) {
                numKeptColumns++;
                final int[] retainedIndices = sample.getRetainedIndices();
                for (int i = 0; i < retainedIndices.length; i++) {
                    Assert.assertEquals(column[i], matrix.getEntry(retainedIndices[i], j), 0.);
                }
            }
        }
        Assert.assertEquals(numKeptColumns, 2);
    }

    @Test
    public void testInputIsNotModified() {
        final RealMatrix matrix = positionMatrix();
        BootstrapSampler.sampleFeatures(matrix, 0.5, 0.25, new Well19937c(5));
        assertEqualsMatrix(matrix, positionMatrix().getData(), 0.);
    }

    @Test
    public void testSameSeedSameSample() {
        final BootstrapSample first = BootstrapSampler.sampleFeatures(positionMatrix(), 0.6, 0.75, new Well19937c(42));
        final BootstrapSample second = BootstrapSampler.sampleFeatures(positionMatrix(), 0.6, 0.75, new Well19937c(42));
        Assert.assertEquals(first.getRetainedIndices(), second.getRetainedIndices());
        assertEqualsMatrix(first.getValues(), second.getValues().getData(), 0.);
    }

    @DataProvider(name = "invalidFractions")
    public Object[][] invalidFractions() {
        return new Object[][]{{0., 1.}, {-0.1, 1.}, {1.1, 1.}, {1., 0.}, {1., 1.5}, {Double.NaN, 1.}};
    }

    @Test(dataProvider = "invalidFractions", expectedExceptions = IllegalArgumentException.class)
    public void testInvalidFractions(final double rowsSamplingFraction, final double colsSamplingFraction) {
        BootstrapSampler.sampleFeatures(positionMatrix(), rowsSamplingFraction, colsSamplingFraction, new Well19937c(0));
    }
}
