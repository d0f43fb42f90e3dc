package org.genesignature.tools.signature.consensus;

import org.genesignature.testutils.BaseTest;
import org.genesignature.tools.signature.similarity.LabeledMatrix;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

public final class BootstrapWorkerUnitTest extends BaseTest {
    private static final LabeledMatrix QUERY = ConsensusTestUtils.randomMatrix("G", 0, 50, "S", 3, 1);
    private static final LabeledMatrix REFERENCE = ConsensusTestUtils.randomMatrix("G", 10, 60, "Sig", 2, 2);

    @Test
    public void testIterationStoresBothRoles() {
        final BootstrapParameters parameters = ConsensusTestUtils.parameters(ProcessingMethod.SERIAL, 1, 0.5, 1.,
                createTempDir("worker").toPath());
        final ExchangeStore store = new InMemoryExchangeStore();
        BootstrapWorker.runIteration(QUERY, REFERENCE, parameters, 4, store);

        Assert.assertEquals(store.listCompleted(), Collections.singletonList(4));
        Assert.assertEquals(store.get(4, ExchangeRole.QUERY).getNumRetained(), 25);
        Assert.assertEquals(store.get(4, ExchangeRole.QUERY).getValues().getColumnDimension(), 3);
        Assert.assertEquals(store.get(4, ExchangeRole.REFERENCE).getNumRetained(), 30);
        Assert.assertEquals(store.get(4, ExchangeRole.REFERENCE).getValues().getColumnDimension(), 2);
    }

    @Test
    public void testSameIterationSameSamples() {
        final BootstrapParameters parameters = ConsensusTestUtils.parameters(ProcessingMethod.SERIAL, 1, 0.7, 0.5,
                createTempDir("worker").toPath());
        final ExchangeStore first = new InMemoryExchangeStore();
        final ExchangeStore second = new InMemoryExchangeStore();
        BootstrapWorker.runIteration(QUERY, REFERENCE, parameters, 9, first);
        BootstrapWorker.runIteration(QUERY, REFERENCE, parameters, 9, second);

        for (final ExchangeRole role : ExchangeRole.values()) {
            Assert.assertEquals(first.get(9, role).getRetainedIndices(), second.get(9, role).getRetainedIndices());
            assertEqualsMatrix(first.get(9, role).getValues(), second.get(9, role).getValues().getData(), 0.);
        }
    }

    @Test
    public void testDifferentIterationsDifferentSamples() {
        final BootstrapParameters parameters = ConsensusTestUtils.parameters(ProcessingMethod.SERIAL, 2, 0.5, 1.,
                createTempDir("worker").toPath());
        final ExchangeStore store = new InMemoryExchangeStore();
        BootstrapWorker.runIteration(QUERY, REFERENCE, parameters, 0, store);
        BootstrapWorker.runIteration(QUERY, REFERENCE, parameters, 1, store);
        Assert.assertFalse(Arrays.equals(store.get(0, ExchangeRole.QUERY).getRetainedIndices(),
                store.get(1, ExchangeRole.QUERY).getRetainedIndices()));
    }

    @Test
    public void testArtifactsAreByteIdenticalAcrossRuns() throws IOException {
        final BootstrapParameters parameters = ConsensusTestUtils.parameters(ProcessingMethod.SERIAL, 1, 0.8, 1.,
                createTempDir("worker").toPath());
        final Path firstDirectory = createTempDir("exchange-first").toPath();
        final Path secondDirectory = createTempDir("exchange-second").toPath();
        BootstrapWorker.runIteration(QUERY, REFERENCE, parameters, 3, new FileSystemExchangeStore(firstDirectory));
        BootstrapWorker.runIteration(QUERY, REFERENCE, parameters, 3, new FileSystemExchangeStore(secondDirectory));

        for (final String role : Arrays.asList("query", "reference")) {
            for (final String kind : Arrays.asList("values", "indices")) {
                final String artifact = String.format("bootstrap_%s_%s_3.kryo", role, kind);
                Assert.assertTrue(Files.exists(firstDirectory.resolve(artifact)), artifact);
                Assert.assertEquals(Files.readAllBytes(firstDirectory.resolve(artifact)),
                        Files.readAllBytes(secondDirectory.resolve(artifact)), artifact);
            }
        }
    }
}
