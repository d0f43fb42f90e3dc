package org.genesignature.tools.signature.consensus;

import com.google.common.annotations.VisibleForTesting;
import org.apache.spark.api.java.JavaSparkContext;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.genesignature.cmdline.CommandLineProgram;
import org.genesignature.cmdline.programgroups.SignatureAnalysisProgramGroup;
import org.genesignature.engine.spark.SparkCommandLineArgumentCollection;
import org.genesignature.engine.spark.SparkContextFactory;
import org.genesignature.tools.signature.SignatureArgumentCollection;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.genesignature.utils.io.IOUtils;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Assigns each gene signature to an expression sample by bootstrap consensus.  Each iteration resamples the features
 * (and optionally masks columns) of both inputs, the per-iteration similarities are averaged over the configured number
 * of iterations, and the average is binarized so that each signature is assigned to exactly one sample.
 *
 * <p>
 *     Iterations run serially, on a local thread pool, or as a Spark job, and hand their resampled matrices to the
 *     aggregation step through a temporary exchange directory ({@code tmp_cc_similarity_*}).  That directory is created
 *     under {@code --run-directory}, or under {@code --cluster-shared-volume} when distributing over Spark, where it must be
 *     visible to every executor.  It is deleted once the result has been written, unless {@code --keep-exchange-directory}
 *     is given.
 * </p>
 *
 * <h3>Examples</h3>
 *
 * <pre>
 * java -jar gene-signature-toolkit.jar ConsensusSignatureSimilarity \
 *   --query expression.tsv \
 *   --signature signatures.tsv \
 *   --processing-method parallel \
 *   --number-of-bootstraps 200 \
 *   --rows-sampling-fraction 0.8 \
 *   --results-directory results
 * </pre>
 *
 * <pre>
 * java -jar gene-signature-toolkit.jar ConsensusSignatureSimilarity \
 *   --query expression.tsv \
 *   --signature signatures.tsv \
 *   --processing-method distribute \
 *   --cluster-shared-volume /shared/scratch \
 *   --spark-master spark://master:7077 \
 *   -O consensus.tsv
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Assigns each gene signature to its most similar expression sample by the consensus of many " +
                "bootstrap-resampled similarity computations",
        oneLineSummary = "Assign gene signatures to expression samples by bootstrap consensus similarity",
        programGroup = SignatureAnalysisProgramGroup.class
)
@DocumentedFeature
public final class ConsensusSignatureSimilarity extends CommandLineProgram {
    static final String METHOD_NAME = "cc_similarity";

    public static final String NUMBER_OF_BOOTSTRAPS_LONG_NAME = "number-of-bootstraps";
    public static final String ROWS_SAMPLING_FRACTION_LONG_NAME = "rows-sampling-fraction";
    public static final String COLS_SAMPLING_FRACTION_LONG_NAME = "cols-sampling-fraction";
    public static final String PARALLELISM_LONG_NAME = "parallelism";
    public static final String RUN_DIRECTORY_LONG_NAME = "run-directory";
    public static final String CLUSTER_SHARED_VOLUME_LONG_NAME = "cluster-shared-volume";
    public static final String KEEP_EXCHANGE_DIRECTORY_LONG_NAME = "keep-exchange-directory";

    public static final int DEFAULT_NUMBER_OF_BOOTSTRAPS = 100;
    public static final double DEFAULT_ROWS_SAMPLING_FRACTION = 0.8;
    public static final double DEFAULT_COLS_SAMPLING_FRACTION = 1.;

    @ArgumentCollection
    private SignatureArgumentCollection signatureArguments = new SignatureArgumentCollection();

    @ArgumentCollection
    private SparkCommandLineArgumentCollection sparkArguments = new SparkCommandLineArgumentCollection();

    @Argument(
            doc = "How bootstrap iterations are executed (serial, parallel or distribute).",
            fullName = ProcessingMethod.ARGUMENT_LONG_NAME,
            optional = true
    )
    private String processingMethod = ProcessingMethod.SERIAL.getName();

    @Argument(
            doc = "Number of bootstrap iterations.  The consensus is normalized by this number even if some iterations fail.",
            fullName = NUMBER_OF_BOOTSTRAPS_LONG_NAME,
            minValue = 1,
            optional = true
    )
    private int numberOfBootstraps = DEFAULT_NUMBER_OF_BOOTSTRAPS;

    @Argument(
            doc = "Fraction of features retained by each bootstrap iteration.",
            fullName = ROWS_SAMPLING_FRACTION_LONG_NAME,
            minValue = 0.,
            maxValue = 1.,
            optional = true
    )
    private double rowsSamplingFraction = DEFAULT_ROWS_SAMPLING_FRACTION;

    @Argument(
            doc = "Fraction of columns kept by each bootstrap iteration; the values of the other columns are zeroed.",
            fullName = COLS_SAMPLING_FRACTION_LONG_NAME,
            minValue = 0.,
            maxValue = 1.,
            optional = true
    )
    private double colsSamplingFraction = DEFAULT_COLS_SAMPLING_FRACTION;

    @Argument(
            doc = "Maximum number of worker threads when the processing method is parallel.  " +
                    "If not specified, the number of available processors is used.",
            fullName = PARALLELISM_LONG_NAME,
            minValue = 1,
            optional = true
    )
    private Integer parallelism = null;

    @Argument(
            doc = "Directory under which the exchange directory is created when the processing method is serial or parallel.",
            fullName = RUN_DIRECTORY_LONG_NAME,
            optional = true
    )
    private File runDirectory = new File(".");

    @Argument(
            doc = "Directory visible to all Spark executors, under which the exchange directory is created.  " +
                    "Required when the processing method is distribute.",
            fullName = CLUSTER_SHARED_VOLUME_LONG_NAME,
            optional = true
    )
    private File clusterSharedVolume = null;

    @Argument(
            doc = "Keep the exchange directory after the run instead of deleting it.",
            fullName = KEEP_EXCHANGE_DIRECTORY_LONG_NAME,
            optional = true
    )
    private boolean keepExchangeDirectory = false;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        final ProcessingMethod method = ProcessingMethod.fromName(processingMethod);
        // throws on an unrecognized measure
        signatureArguments.getSimilarityMeasure();
        if (method == ProcessingMethod.DISTRIBUTE && clusterSharedVolume == null) {
            errors.add(String.format("--%s is required when --%s is %s.",
                    CLUSTER_SHARED_VOLUME_LONG_NAME, ProcessingMethod.ARGUMENT_LONG_NAME, ProcessingMethod.DISTRIBUTE));
        }
        if (rowsSamplingFraction <= 0.) {
            errors.add(String.format("--%s must be greater than 0.", ROWS_SAMPLING_FRACTION_LONG_NAME));
        }
        if (colsSamplingFraction <= 0.) {
            errors.add(String.format("--%s must be greater than 0.", COLS_SAMPLING_FRACTION_LONG_NAME));
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected Object doWork() {
        final BootstrapParameters parameters = new BootstrapParameters(
                signatureArguments.getSimilarityMeasure(),
                ProcessingMethod.fromName(processingMethod),
                numberOfBootstraps,
                rowsSamplingFraction,
                colsSamplingFraction,
                parallelism == null ? Runtime.getRuntime().availableProcessors() : parallelism,
                runDirectory.toPath(),
                clusterSharedVolume == null ? null : clusterSharedVolume.toPath());
        logger.info(String.format("Consensus parameters: %s", parameters));

        logger.info(String.format("Reading query matrix (%s)...", signatureArguments.getQueryFile()));
        final LabeledMatrix query = signatureArguments.readQuery();
        logger.info(String.format("Reading signature matrix (%s)...", signatureArguments.getSignatureFile()));
        final LabeledMatrix signatures = signatureArguments.readSignature();

        final Path exchangeDirectory = BootstrapScheduler.createExchangeDirectory(parameters);
        JavaSparkContext sparkContext = null;
        try {
            final ExchangeStore store = new FileSystemExchangeStore(exchangeDirectory);
            if (parameters.getProcessingMethod() == ProcessingMethod.DISTRIBUTE) {
                sparkContext = SparkContextFactory.getSparkContext(getClass().getSimpleName(),
                        sparkArguments.getSparkProperties(), sparkArguments.getSparkMaster());
            }

            final List<Integer> failedIterations = BootstrapScheduler.runAll(query, signatures, parameters, store, sparkContext);
            if (!failedIterations.isEmpty()) {
                logger.warn(String.format("%d bootstrap iterations failed: %s", failedIterations.size(), failedIterations));
            }

            final ConsensusResult result = ConsensusAggregator.aggregate(query, signatures, parameters, store);
            result.getAssignment().getBestQueryLabelByReference().forEach((signature, sample) ->
                    logger.info(String.format("Signature %s is assigned to sample %s.", signature, sample)));

            final File outputFile = signatureArguments.resolveOutputFile(METHOD_NAME);
            logger.info(String.format("Writing result to %s...", outputFile));
            result.getAssignment().write(outputFile);
        } finally {
            final JavaSparkContext contextToStop = sparkContext;
            releaseRunResources(
                    () -> {
                        if (contextToStop != null) {
                            SparkContextFactory.stopSparkContext(contextToStop);
                        }
                    },
                    () -> cleanUpExchangeDirectory(exchangeDirectory));
        }

        logger.info("Consensus signature similarity complete.");

        return "SUCCESS";
    }

    /**
     * Stops Spark and then removes the exchange directory.  A failure to stop Spark is logged and never prevents
     * the cleanup or replaces the outcome of the run.
     */
    @VisibleForTesting
    void releaseRunResources(final Runnable stopSparkContext, final Runnable cleanUpExchangeDirectory) {
        try {
            stopSparkContext.run();
        } catch (final RuntimeException e) {
            logger.warn(String.format("Could not stop the Spark context: %s", e.getMessage()));
        } finally {
            cleanUpExchangeDirectory.run();
        }
    }

    private void cleanUpExchangeDirectory(final Path exchangeDirectory) {
        if (keepExchangeDirectory) {
            logger.info(String.format("Keeping exchange directory %s.", exchangeDirectory));
            return;
        }
        try {
            IOUtils.deleteRecursively(exchangeDirectory);
        } catch (final RuntimeException e) {
            logger.warn(String.format("Could not delete exchange directory %s: %s", exchangeDirectory, e.getMessage()));
        }
    }
}
