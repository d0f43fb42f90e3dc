package org.genesignature.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.genesignature.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class LoggingUtilsUnitTest extends BaseTest {

    @DataProvider(name = "levels")
    public Object[][] levels() {
        return new Object[][]{
                {Log.LogLevel.ERROR, Level.ERROR},
                {Log.LogLevel.WARNING, Level.WARN},
                {Log.LogLevel.INFO, Level.INFO},
                {Log.LogLevel.DEBUG, Level.DEBUG}
        };
    }

    @Test(dataProvider = "levels")
    public void testLevelTranslation(final Log.LogLevel verbosity, final Level log4jLevel) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(verbosity), log4jLevel);
        Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), verbosity);
    }

    @Test(dataProvider = "levels")
    public void testSetLoggingLevel(final Log.LogLevel verbosity, final Level log4jLevel) {
        LoggingUtils.setLoggingLevel(verbosity);
        Assert.assertEquals(LogManager.getLogger(LoggingUtilsUnitTest.class).getLevel(), log4jLevel);
        Assert.assertEquals(Log.getGlobalLogLevel(), verbosity);
    }

    @AfterMethod
    public void resetLoggingLevel() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }
}
