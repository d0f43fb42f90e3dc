package org.genesignature.tools.signature.consensus;

import org.broadinstitute.barclay.argparser.CommandLineException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * How the bootstrap iterations of a consensus run are dispatched.
 */
public enum ProcessingMethod {
    /**
     * One iteration after the other on the calling thread.
     */
    SERIAL("serial"),

    /**
     * A fixed-size pool of local worker threads.
     */
    PARALLEL("parallel"),

    /**
     * A Spark job over the iteration indices; the exchange directory must be visible to every executor.
     */
    DISTRIBUTE("distribute");

    public static final String ARGUMENT_LONG_NAME = "processing-method";

    private final String name;

    ProcessingMethod(final String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @throws CommandLineException.BadArgumentValue if {@code name} does not name a processing method
     */
    public static ProcessingMethod fromName(final String name) {
        return Arrays.stream(values())
                .filter(m -> m.name.equals(name))
                .findFirst()
                .orElseThrow(() -> new CommandLineException.BadArgumentValue(ARGUMENT_LONG_NAME, String.valueOf(name),
                        String.format("Processing method must be one of: %s.",
                                Arrays.stream(values()).map(ProcessingMethod::getName).collect(Collectors.joining(", ")))));
    }

    @Override
    public String toString() {
        return name;
    }
}
