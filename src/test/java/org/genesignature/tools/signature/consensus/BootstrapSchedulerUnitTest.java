package org.genesignature.tools.signature.consensus;

import org.genesignature.testutils.BaseTest;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.genesignature.tools.signature.similarity.SimilarityMeasure;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class BootstrapSchedulerUnitTest extends BaseTest {
    private static final LabeledMatrix QUERY = ConsensusTestUtils.randomMatrix("G", 0, 40, "S", 3, 21);
    private static final LabeledMatrix REFERENCE = ConsensusTestUtils.randomMatrix("G", 5, 40, "Sig", 2, 22);

    /**
     * Fails every write of the listed iterations and delegates everything else.
     */
    private static final class FailingExchangeStore implements ExchangeStore {
        private static final long serialVersionUID = 1L;

        private final ExchangeStore delegate = new InMemoryExchangeStore();
        private final Set<Integer> failingIterations;

        private FailingExchangeStore(final Integer... failingIterations) {
            this.failingIterations = Arrays.stream(failingIterations).collect(Collectors.toSet());
        }

        @Override
        public void put(final int iteration, final ExchangeRole role, final BootstrapSample sample) {
            if (failingIterations.contains(iteration)) {
                throw new IllegalStateException("simulated failure of iteration " + iteration);
            }
            delegate.put(iteration, role, sample);
        }

        @Override
        public List<Integer> listCompleted() {
            return delegate.listCompleted();
        }

        @Override
        public BootstrapSample get(final int iteration, final ExchangeRole role) {
            return delegate.get(iteration, role);
        }
    }

    @DataProvider(name = "localMethods")
    public Object[][] localMethods() {
        return new Object[][]{{ProcessingMethod.SERIAL}, {ProcessingMethod.PARALLEL}};
    }

    @Test(dataProvider = "localMethods")
    public void testAllIterationsComplete(final ProcessingMethod method) {
        final BootstrapParameters parameters = ConsensusTestUtils.parameters(method, 9, 0.5, 1., createTempDir("run").toPath());
        final ExchangeStore store = new InMemoryExchangeStore();
        final List<Integer> failed = BootstrapScheduler.runAll(QUERY, REFERENCE, parameters, store);
        Assert.assertEquals(failed, Collections.emptyList());
        Assert.assertEquals(store.listCompleted(), IntStream.range(0, 9).boxed().collect(Collectors.toList()));
    }

    @Test
    public void testParallelMatchesSerial() {
        final Path runDirectory = createTempDir("run").toPath();
        final ExchangeStore serialStore = new InMemoryExchangeStore();
        final ExchangeStore parallelStore = new InMemoryExchangeStore();
        BootstrapScheduler.runAll(QUERY, REFERENCE,
                ConsensusTestUtils.parameters(ProcessingMethod.SERIAL, 8, 0.7, 0.5, runDirectory), serialStore);
        BootstrapScheduler.runAll(QUERY, REFERENCE,
                ConsensusTestUtils.parameters(ProcessingMethod.PARALLEL, 8, 0.7, 0.5, runDirectory), parallelStore);

        for (int i = 0; i < 8; i++) {
            for (final ExchangeRole role : ExchangeRole.values()) {
                Assert.assertEquals(parallelStore.get(i, role).getRetainedIndices(), serialStore.get(i, role).getRetainedIndices());
                assertEqualsMatrix(parallelStore.get(i, role).getValues(), serialStore.get(i, role).getValues().getData(), 0.);
            }
        }
    }

    @Test(dataProvider = "localMethods")
    public void testFailedIterationsAreReportedAndOthersComplete(final ProcessingMethod method) {
        final BootstrapParameters parameters = ConsensusTestUtils.parameters(method, 6, 0.5, 1., createTempDir("run").toPath());
        final ExchangeStore store = new FailingExchangeStore(4, 1);
        final List<Integer> failed = BootstrapScheduler.runAll(QUERY, REFERENCE, parameters, store);
        Assert.assertEquals(failed, Arrays.asList(1, 4));
        Assert.assertEquals(store.listCompleted(), Arrays.asList(0, 2, 3, 5));
    }

    @Test
    public void testExchangeDirectoryIsCreatedUnderRunDirectory() {
        final File runDirectory = createTempDir("run");
        final BootstrapParameters parameters = ConsensusTestUtils.parameters(ProcessingMethod.PARALLEL, 1, 1., 1., runDirectory.toPath());
        final Path first = BootstrapScheduler.createExchangeDirectory(parameters);
        final Path second = BootstrapScheduler.createExchangeDirectory(parameters);
        Assert.assertNotEquals(first, second);
        for (final Path exchangeDirectory : Arrays.asList(first, second)) {
            Assert.assertTrue(Files.isDirectory(exchangeDirectory));
            Assert.assertEquals(exchangeDirectory.getParent().toFile().getAbsoluteFile(), runDirectory.getAbsoluteFile());
            Assert.assertTrue(exchangeDirectory.getFileName().toString().startsWith(BootstrapScheduler.EXCHANGE_DIRECTORY_PREFIX));
        }
    }

    @Test
    public void testExchangeDirectoryIsCreatedUnderSharedVolumeWhenDistributing() {
        final File runDirectory = createTempDir("run");
        final File sharedVolume = createTempDir("shared");
        final BootstrapParameters parameters = new BootstrapParameters(SimilarityMeasure.COSINE, ProcessingMethod.DISTRIBUTE,
                1, 1., 1., 1, runDirectory.toPath(), sharedVolume.toPath());
        final Path exchangeDirectory = BootstrapScheduler.createExchangeDirectory(parameters);
        Assert.assertEquals(exchangeDirectory.getParent().toFile().getAbsoluteFile(), sharedVolume.getAbsoluteFile());
        Assert.assertEquals(runDirectory.list().length, 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDistributeRequiresSharedVolume() {
        new BootstrapParameters(SimilarityMeasure.COSINE, ProcessingMethod.DISTRIBUTE, 1, 1., 1., 1,
                createTempDir("run").toPath(), null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDistributeRequiresSparkContext() {
        final BootstrapParameters parameters = new BootstrapParameters(SimilarityMeasure.COSINE, ProcessingMethod.DISTRIBUTE,
                1, 1., 1., 1, createTempDir("run").toPath(), createTempDir("shared").toPath());
        BootstrapScheduler.runAll(QUERY, REFERENCE, parameters, new FileSystemExchangeStore(createTempDir("exchange").toPath()));
    }
}
