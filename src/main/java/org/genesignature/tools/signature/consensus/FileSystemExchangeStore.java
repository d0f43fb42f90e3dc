package org.genesignature.tools.signature.consensus;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genesignature.exceptions.UserException;
import org.genesignature.utils.Utils;
import org.genesignature.utils.param.ParamUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ExchangeStore} that keeps every sample as two Kryo artifacts in a directory, which may live on a volume
 * shared by all Spark executors:
 *
 * <ul>
 *     <li>{@code bootstrap_<role>_values_<iteration>.kryo}: the reduced values, one {@code double[]} per retained feature</li>
 *     <li>{@code bootstrap_<role>_indices_<iteration>.kryo}: the original row index of each retained feature</li>
 * </ul>
 *
 * Artifacts are written to a hidden temporary file and moved into place atomically, values before indices,
 * so a visible indices artifact always has its values artifact next to it.
 */
public final class FileSystemExchangeStore implements ExchangeStore {
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LogManager.getLogger(FileSystemExchangeStore.class);

    private static final String VALUES_ARTIFACT_FORMAT = "bootstrap_%s_values_%d.kryo";
    private static final String INDICES_ARTIFACT_FORMAT = "bootstrap_%s_indices_%d.kryo";
    private static final Pattern COMPLETED_ARTIFACT_PATTERN =
            Pattern.compile(String.format("bootstrap_%s_indices_(\\d+)\\.kryo", ExchangeRole.QUERY.getName()));
    private static final String TEMPORARY_SUFFIX = ".tmp";

    // a String rather than a Path so the store can be shipped to Spark executors
    private final String directory;

    public FileSystemExchangeStore(final Path directory) {
        Utils.nonNull(directory);
        Utils.validateArg(Files.isDirectory(directory), () -> String.format("Exchange directory %s does not exist.", directory));
        this.directory = directory.toAbsolutePath().toString();
    }

    public Path getDirectory() {
        return Paths.get(directory);
    }

    @Override
    public void put(final int iteration, final ExchangeRole role, final BootstrapSample sample) {
        ParamUtils.isPositiveOrZero(iteration, "Iteration index must be non-negative.");
        Utils.nonNull(role);
        Utils.nonNull(sample);
        writeArtifact(valuesArtifact(iteration, role), output -> new Kryo().writeObject(output, sample.getValues().getData()));
        writeArtifact(indicesArtifact(iteration, role), output -> new Kryo().writeObject(output, sample.getRetainedIndices()));
        logger.debug(String.format("Stored %s sample of iteration %d in %s.", role.getName(), iteration, directory));
    }

    @Override
    public List<Integer> listCompleted() {
        final List<Integer> completed = new ArrayList<>();
        try (final DirectoryStream<Path> entries = Files.newDirectoryStream(getDirectory())) {
            for (final Path entry : entries) {
                final Matcher matcher = COMPLETED_ARTIFACT_PATTERN.matcher(entry.getFileName().toString());
                if (matcher.matches()) {
                    completed.add(Integer.parseInt(matcher.group(1)));
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(getDirectory(), "the exchange directory could not be listed", e);
        }
        Collections.sort(completed);
        return completed;
    }

    @Override
    public BootstrapSample get(final int iteration, final ExchangeRole role) {
        Utils.nonNull(role);
        final double[][] values = readArtifact(valuesArtifact(iteration, role), input -> new Kryo().readObject(input, double[][].class));
        final int[] retainedIndices = readArtifact(indicesArtifact(iteration, role), input -> new Kryo().readObject(input, int[].class));
        if (values.length != retainedIndices.length) {
            throw new UserException.BadInput(String.format("Exchange artifacts of the %s sample of iteration %d disagree: " +
                    "%d rows of values but %d retained indices.", role.getName(), iteration, values.length, retainedIndices.length));
        }
        return new BootstrapSample(new Array2DRowRealMatrix(values, false), retainedIndices);
    }

    @Override
    public boolean isVisibleToExecutors() {
        return true;
    }

    private Path valuesArtifact(final int iteration, final ExchangeRole role) {
        return getDirectory().resolve(String.format(VALUES_ARTIFACT_FORMAT, role.getName(), iteration));
    }

    private Path indicesArtifact(final int iteration, final ExchangeRole role) {
        return getDirectory().resolve(String.format(INDICES_ARTIFACT_FORMAT, role.getName(), iteration));
    }

    private void writeArtifact(final Path artifact, final Consumer<Output> writer) {
        Path temporary = null;
        try {
            temporary = Files.createTempFile(getDirectory(), "." + artifact.getFileName(), TEMPORARY_SUFFIX);
            try (final Output output = new Output(Files.newOutputStream(temporary))) {
                writer.accept(output);
            }
            Files.move(temporary, artifact, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException | KryoException e) {
            if (temporary != null) {
                try {
                    Files.deleteIfExists(temporary);
                } catch (final IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new UserException.CouldNotCreateOutputFile(artifact.toFile(), "the exchange artifact could not be written", e);
        }
    }

    private static <T> T readArtifact(final Path artifact, final Function<Input, T> reader) {
        try (final Input input = new Input(Files.newInputStream(artifact))) {
            return reader.apply(input);
        } catch (final IOException | KryoException e) {
            throw new UserException.CouldNotReadInputFile(artifact, "the exchange artifact could not be read", e);
        }
    }
}
