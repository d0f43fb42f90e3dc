package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.linear.RealMatrix;
import org.genesignature.utils.Utils;

import java.util.Arrays;

/**
 * A feature-reduced copy of a matrix produced by one bootstrap draw, together with the original row position
 * of each retained feature.  Row {@code i} of {@link #getValues()} is original row {@code getRetainedIndices()[i]}.
 */
public final class BootstrapSample {
    private final RealMatrix values;
    private final int[] retainedIndices;

    public BootstrapSample(final RealMatrix values, final int[] retainedIndices) {
        Utils.nonNull(values);
        Utils.nonNull(retainedIndices);
        Utils.validateArg(retainedIndices.length > 0, "At least one feature must be retained.");
        Utils.validateArg(values.getRowDimension() == retainedIndices.length,
                () -> String.format("Number of retained indices (%d) and rows of reduced values (%d) must match.",
                        retainedIndices.length, values.getRowDimension()));
        Utils.validateArg(Arrays.stream(retainedIndices).allMatch(i -> i >= 0), "Retained indices must be non-negative.");
        Utils.validateArg(Arrays.stream(retainedIndices).distinct().count() == retainedIndices.length,
                "Retained indices must all be unique.");
        this.values = values.copy();
        this.retainedIndices = retainedIndices.clone();
    }

    /**
     * Returns a copy of the reduced values, so that a stored sample cannot be changed through it.
     */
    public RealMatrix getValues() {
        return values.copy();
    }

    public int[] getRetainedIndices() {
        return retainedIndices.clone();
    }

    public int getNumRetained() {
        return retainedIndices.length;
    }

    @Override
    public String toString() {
        return String.format("BootstrapSample{%d features x %d columns}", values.getRowDimension(), values.getColumnDimension());
    }
}
