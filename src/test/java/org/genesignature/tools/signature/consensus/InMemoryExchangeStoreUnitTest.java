package org.genesignature.tools.signature.consensus;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.genesignature.exceptions.GeneSignatureException;
import org.genesignature.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;

public final class InMemoryExchangeStoreUnitTest extends BaseTest {

    private static BootstrapSample sample() {
        return new BootstrapSample(new Array2DRowRealMatrix(new double[][]{{1.}}), new int[]{0});
    }

    @Test
    public void testListCompleted() {
        final InMemoryExchangeStore store = new InMemoryExchangeStore();
        store.put(3, ExchangeRole.QUERY, sample());
        store.put(1, ExchangeRole.QUERY, sample());
        store.put(2, ExchangeRole.REFERENCE, sample());
        Assert.assertEquals(store.listCompleted(), Arrays.asList(1, 3));
    }

    @Test
    public void testStoredSampleCannotBeModified() {
        final InMemoryExchangeStore store = new InMemoryExchangeStore();
        final RealMatrix values = new Array2DRowRealMatrix(new double[][]{{1., 2.}, {3., 4.}});
        store.put(0, ExchangeRole.QUERY, new BootstrapSample(values, new int[]{4, 1}));

        values.setEntry(0, 0, -1.);
        store.get(0, ExchangeRole.QUERY).getValues().setEntry(1, 1, -1.);
        store.get(0, ExchangeRole.QUERY).getRetainedIndices()[0] = 7;

        final BootstrapSample stored = store.get(0, ExchangeRole.QUERY);
        assertEqualsMatrix(stored.getValues(), new double[][]{{1., 2.}, {3., 4.}}, 0.);
        Assert.assertEquals(stored.getRetainedIndices(), new int[]{4, 1});
    }

    @Test(expectedExceptions = GeneSignatureException.class)
    public void testGetMissingSample() {
        new InMemoryExchangeStore().get(0, ExchangeRole.QUERY);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeIteration() {
        new InMemoryExchangeStore().put(-1, ExchangeRole.QUERY, sample());
    }
}
