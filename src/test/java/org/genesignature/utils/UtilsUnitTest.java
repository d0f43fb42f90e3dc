package org.genesignature.utils;

import org.genesignature.testutils.BaseTest;
import org.genesignature.utils.param.ParamUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public class UtilsUnitTest extends BaseTest {

    @Test
    public void testValidateArg() {
        Utils.validateArg(true, "message");
        try {
            Utils.validateArg(false, () -> "lazy message");
            Assert.fail("expected an IllegalArgumentException");
        } catch (final IllegalArgumentException e) {
            Assert.assertEquals(e.getMessage(), "lazy message");
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonEmptyCollection() {
        Utils.nonEmpty(Collections.emptyList(), "empty");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testContainsNoNull() {
        Utils.containsNoNull(Arrays.asList("a", null), "null element");
    }

    @Test
    public void testParamUtils() {
        Assert.assertEquals(ParamUtils.isPositive(3, "count"), 3);
        Assert.assertEquals(ParamUtils.isPositiveOrZero(0, "index"), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testParamUtilsNotPositive() {
        ParamUtils.isPositive(0, "count");
    }
}
