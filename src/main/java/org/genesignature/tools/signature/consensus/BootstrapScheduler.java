package org.genesignature.tools.signature.consensus;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;
import org.genesignature.exceptions.GeneSignatureException;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.genesignature.utils.Utils;
import org.genesignature.utils.io.IOUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Dispatches the bootstrap iterations of a consensus run serially, on a local thread pool, or as a Spark job.
 * Every iteration is attempted; a failed iteration is logged and reported, but does not stop the others.
 */
public final class BootstrapScheduler {
    private static final Logger logger = LogManager.getLogger(BootstrapScheduler.class);

    public static final String EXCHANGE_DIRECTORY_PREFIX = "tmp_cc_similarity_";

    private BootstrapScheduler() {}

    /**
     * Creates a run-unique exchange directory under the cluster shared volume for {@link ProcessingMethod#DISTRIBUTE},
     * otherwise under the run directory.  The caller removes it once the consensus has been aggregated.
     */
    public static Path createExchangeDirectory(final BootstrapParameters parameters) {
        Utils.nonNull(parameters);
        final Path parent = parameters.getProcessingMethod() == ProcessingMethod.DISTRIBUTE
                ? parameters.getClusterSharedVolume()
                : parameters.getRunDirectory();
        final Path exchangeDirectory = IOUtils.createTempDirInDirectory(parent, EXCHANGE_DIRECTORY_PREFIX);
        logger.info(String.format("Created exchange directory %s.", exchangeDirectory));
        return exchangeDirectory;
    }

    /**
     * Runs all iterations with a method that needs no Spark context.
     *
     * @return indices of the iterations that failed, ascending
     */
    public static List<Integer> runAll(final LabeledMatrix query,
                                       final LabeledMatrix reference,
                                       final BootstrapParameters parameters,
                                       final ExchangeStore store) {
        return runAll(query, reference, parameters, store, null);
    }

    /**
     * @param sparkContext  required for {@link ProcessingMethod#DISTRIBUTE}, ignored otherwise
     * @return indices of the iterations that failed, ascending
     */
    public static List<Integer> runAll(final LabeledMatrix query,
                                       final LabeledMatrix reference,
                                       final BootstrapParameters parameters,
                                       final ExchangeStore store,
                                       final JavaSparkContext sparkContext) {
        Utils.nonNull(query);
        Utils.nonNull(reference);
        Utils.nonNull(parameters);
        Utils.nonNull(store);

        logger.info(String.format("Running %d bootstrap iterations (%s)...",
                parameters.getNumberOfBootstraps(), parameters.getProcessingMethod()));
        final List<Integer> failedIterations;
        switch (parameters.getProcessingMethod()) {
            case SERIAL:
                failedIterations = runSerially(query, reference, parameters, store);
                break;
            case PARALLEL:
                failedIterations = runOnThreadPool(query, reference, parameters, store);
                break;
            case DISTRIBUTE:
                Utils.nonNull(sparkContext, "A Spark context is required when the processing method is distribute.");
                Utils.validateArg(store.isVisibleToExecutors(), "The exchange store must be visible to Spark executors.");
                failedIterations = runOnSpark(query, reference, parameters, store, sparkContext);
                break;
            default:
                throw new GeneSignatureException.ShouldNeverReachHereException("Unhandled processing method: " + parameters.getProcessingMethod());
        }
        logger.info(String.format("%d of %d bootstrap iterations completed.",
                parameters.getNumberOfBootstraps() - failedIterations.size(), parameters.getNumberOfBootstraps()));
        return failedIterations;
    }

    private static List<Integer> runSerially(final LabeledMatrix query,
                                             final LabeledMatrix reference,
                                             final BootstrapParameters parameters,
                                             final ExchangeStore store) {
        return IntStream.range(0, parameters.getNumberOfBootstraps())
                .filter(i -> !attemptIteration(query, reference, parameters, i, store))
                .boxed()
                .collect(Collectors.toList());
    }

    private static List<Integer> runOnThreadPool(final LabeledMatrix query,
                                                 final LabeledMatrix reference,
                                                 final BootstrapParameters parameters,
                                                 final ExchangeStore store) {
        final int numberOfBootstraps = parameters.getNumberOfBootstraps();
        final int numThreads = Math.min(Math.min(parameters.getParallelism(), numberOfBootstraps),
                Runtime.getRuntime().availableProcessors());
        logger.info(String.format("Starting %d worker threads...", numThreads));
        final ExecutorService executorService = Executors.newFixedThreadPool(numThreads, new ThreadFactoryBuilder()
                .setNameFormat("bootstrap-worker-%d")
                .setDaemon(true).build());
        try {
            final List<Future<?>> futures = new ArrayList<>(numberOfBootstraps);
            for (int i = 0; i < numberOfBootstraps; i++) {
                final int iterationIndex = i;
                futures.add(executorService.submit(() -> BootstrapWorker.runIteration(query, reference, parameters, iterationIndex, store)));
            }
            final List<Integer> failedIterations = new ArrayList<>();
            for (int i = 0; i < numberOfBootstraps; i++) {
                try {
                    futures.get(i).get();
                } catch (final ExecutionException e) {
                    logFailedIteration(i, e.getCause());
                    failedIterations.add(i);
                }
            }
            return failedIterations;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneSignatureException("Interrupted while waiting for bootstrap iterations.", e);
        } finally {
            executorService.shutdownNow();
        }
    }

    private static List<Integer> runOnSpark(final LabeledMatrix query,
                                            final LabeledMatrix reference,
                                            final BootstrapParameters parameters,
                                            final ExchangeStore store,
                                            final JavaSparkContext sparkContext) {
        final Broadcast<LabeledMatrix> queryBroadcast = sparkContext.broadcast(query);
        final Broadcast<LabeledMatrix> referenceBroadcast = sparkContext.broadcast(reference);
        try {
            final List<Integer> iterations = IntStream.range(0, parameters.getNumberOfBootstraps()).boxed().collect(Collectors.toList());
            final List<Integer> failedIterations = new ArrayList<>(sparkContext.parallelize(iterations, iterations.size())
                    .filter(i -> !attemptIteration(queryBroadcast.getValue(), referenceBroadcast.getValue(), parameters, i, store))
                    .collect());
            failedIterations.sort(null);
            failedIterations.forEach(i -> logger.error(String.format("Bootstrap iteration %d failed on an executor; see the executor logs for the cause.", i)));
            return failedIterations;
        } finally {
            queryBroadcast.unpersist();
            referenceBroadcast.unpersist();
        }
    }

    /**
     * @return whether the iteration succeeded
     */
    private static boolean attemptIteration(final LabeledMatrix query,
                                            final LabeledMatrix reference,
                                            final BootstrapParameters parameters,
                                            final int iterationIndex,
                                            final ExchangeStore store) {
        try {
            BootstrapWorker.runIteration(query, reference, parameters, iterationIndex, store);
            return true;
        } catch (final RuntimeException e) {
            logFailedIteration(iterationIndex, e);
            return false;
        }
    }

    private static void logFailedIteration(final int iterationIndex, final Throwable cause) {
        logger.error(String.format("Bootstrap iteration %d failed: %s", iterationIndex, cause.getMessage()), cause);
    }
}
