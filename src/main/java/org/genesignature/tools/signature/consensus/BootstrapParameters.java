package org.genesignature.tools.signature.consensus;

import org.genesignature.tools.signature.similarity.SimilarityMeasure;
import org.genesignature.utils.Utils;
import org.genesignature.utils.param.ParamUtils;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Validated configuration of a bootstrap consensus run.  Serializable so that it can be shipped to Spark executors.
 */
public final class BootstrapParameters implements Serializable {
    private static final long serialVersionUID = 1L;

    private final SimilarityMeasure similarityMeasure;
    private final ProcessingMethod processingMethod;
    private final int numberOfBootstraps;
    private final double rowsSamplingFraction;
    private final double colsSamplingFraction;
    private final int parallelism;
    private final String runDirectory;
    private final String clusterSharedVolume;

    /**
     * @param clusterSharedVolume   directory visible to all Spark executors; required only for {@link ProcessingMethod#DISTRIBUTE}
     */
    public BootstrapParameters(final SimilarityMeasure similarityMeasure,
                               final ProcessingMethod processingMethod,
                               final int numberOfBootstraps,
                               final double rowsSamplingFraction,
                               final double colsSamplingFraction,
                               final int parallelism,
                               final Path runDirectory,
                               final Path clusterSharedVolume) {
        Utils.nonNull(similarityMeasure);
        Utils.nonNull(processingMethod);
        ParamUtils.isPositive(numberOfBootstraps, "Number of bootstraps must be positive.");
        BootstrapSampler.validateSamplingFraction(rowsSamplingFraction, "Rows sampling fraction");
        BootstrapSampler.validateSamplingFraction(colsSamplingFraction, "Columns sampling fraction");
        ParamUtils.isPositive(parallelism, "Parallelism must be positive.");
        Utils.nonNull(runDirectory, "Run directory cannot be null.");
        Utils.validateArg(processingMethod != ProcessingMethod.DISTRIBUTE || clusterSharedVolume != null,
                "A cluster shared volume is required when the processing method is distribute.");
        this.similarityMeasure = similarityMeasure;
        this.processingMethod = processingMethod;
        this.numberOfBootstraps = numberOfBootstraps;
        this.rowsSamplingFraction = rowsSamplingFraction;
        this.colsSamplingFraction = colsSamplingFraction;
        this.parallelism = parallelism;
        this.runDirectory = runDirectory.toString();
        this.clusterSharedVolume = clusterSharedVolume == null ? null : clusterSharedVolume.toString();
    }

    public SimilarityMeasure getSimilarityMeasure() {
        return similarityMeasure;
    }

    public ProcessingMethod getProcessingMethod() {
        return processingMethod;
    }

    public int getNumberOfBootstraps() {
        return numberOfBootstraps;
    }

    public double getRowsSamplingFraction() {
        return rowsSamplingFraction;
    }

    public double getColsSamplingFraction() {
        return colsSamplingFraction;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Path getRunDirectory() {
        return Paths.get(runDirectory);
    }

    /**
     * @return the shared volume, or null if none was configured
     */
    public Path getClusterSharedVolume() {
        return clusterSharedVolume == null ? null : Paths.get(clusterSharedVolume);
    }

    @Override
    public String toString() {
        return String.format("BootstrapParameters{measure=%s, method=%s, bootstraps=%d, rowsFraction=%s, colsFraction=%s, parallelism=%d}",
                similarityMeasure, processingMethod, numberOfBootstraps, rowsSamplingFraction, colsSamplingFraction, parallelism);
    }
}
