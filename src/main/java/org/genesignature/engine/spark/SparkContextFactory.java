package org.genesignature.engine.spark;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.serializer.KryoSerializer;
import org.genesignature.exceptions.UserException;
import org.genesignature.utils.Utils;

import java.util.Collections;
import java.util.Map;

/**
 * Manages creation of the Spark context. In particular, for tests a shared global context is used, since Spark does not
 * support multiple concurrent contexts (see https://issues.apache.org/jira/browse/SPARK-2243), and is susceptible to
 * transient errors if contexts are created and stopped in rapid succession.
 */
public final class SparkContextFactory {

    public static final String DEFAULT_SPARK_MASTER = determineDefaultSparkMaster();
    private static final boolean SPARK_DEBUG_ENABLED = Boolean.getBoolean("genesignature.spark.debug");
    private static final String SPARK_CORES_ENV_VARIABLE = "GENE_SIGNATURE_TEST_SPARK_CORES";

    private static final Logger logger = LogManager.getLogger(SparkContextFactory.class);

    /**
     * The toolkit will not run without these properties.
     * They will always be set unless explicitly overridden with {@link org.genesignature.cmdline.StandardArgumentDefinitions#SPARK_PROPERTY_NAME}
     */
    public static final Map<String, String> MANDATORY_PROPERTIES = ImmutableMap.<String, String>builder()
            .put("spark.serializer", KryoSerializer.class.getCanonicalName())
            .put("spark.kryo.registrator", SignatureKryoRegistrator.class.getCanonicalName())
            .build();

    /**
     * Default properties, set only if not already set in the environment.
     */
    public static final Map<String, String> DEFAULT_PROPERTIES = ImmutableMap.<String, String>builder()
            .put("spark.kryoserializer.buffer.max", "512m")
            .put("spark.driver.maxResultSize", "0")
            .build();

    public static final Map<String, String> DEFAULT_TEST_PROPERTIES = ImmutableMap.<String, String>builder()
            .put("spark.ui.enabled", Boolean.toString(SPARK_DEBUG_ENABLED))
            .put("spark.kryoserializer.buffer.max", "256m")
            .put("spark.driver.host", "localhost")
            .put("spark.driver.bindAddress", "127.0.0.1")
            .build();

    private static boolean testContextEnabled;
    private static JavaSparkContext testContext;

    private SparkContextFactory() {}

    /**
     * Register a shared global {@link JavaSparkContext} for this JVM; this should only be used for testing.
     */
    public static synchronized void enableTestSparkContext() {
        testContextEnabled = true;
    }

    /**
     * Get a {@link JavaSparkContext}. If the test context has been set then it will be returned.
     *
     * @param appName the name of the application to run
     * @param overridingProperties properties to set on the spark context, overriding any existing value for the same property
     * @param master the Spark master URL
     */
    public static synchronized JavaSparkContext getSparkContext(final String appName, final Map<String, String> overridingProperties, final String master) {
        if (testContextEnabled) {
            final JavaSparkContext context = getTestSparkContext(overridingProperties);
            Utils.validateArg(master.equals(context.master()), () -> String.format("Cannot reuse spark context " +
                    "with different spark master URL. Existing: %s, requested: %s.", context.master(), master));
            return context;
        }
        logger.info(String.format("Creating Spark context %s on master %s", appName, master));
        return new JavaSparkContext(setupSparkConf(appName, master, DEFAULT_PROPERTIES, overridingProperties));
    }

    /**
     * Get the test {@link JavaSparkContext} if it has been registered, otherwise returns null.
     */
    public static synchronized JavaSparkContext getTestSparkContext() {
        return getTestSparkContext(Collections.emptyMap());
    }

    /**
     * Get the test {@link JavaSparkContext} if it has been registered, otherwise returns null.
     *
     * @param overridingProperties properties to set on the spark context, possibly overriding values already set
     */
    public static synchronized JavaSparkContext getTestSparkContext(final Map<String, String> overridingProperties) {
        if (testContextEnabled && testContext == null) {
            testContext = new JavaSparkContext(setupSparkConf("TestContext", DEFAULT_SPARK_MASTER, DEFAULT_TEST_PROPERTIES, overridingProperties));
            Runtime.getRuntime().addShutdownHook(new Thread() {
                @Override
                public void run() {
                    testContext.stop();
                }
            });
        }
        return testContext;
    }

    /**
     * Stop a {@link JavaSparkContext}, unless it is the test context.
     *
     * @param context the context to stop
     */
    public static synchronized void stopSparkContext(final JavaSparkContext context) {
        if (context != testContext) {
            context.stop();
        }
    }

    /**
     * setup a spark context with the given name, master, and settings
     *
     * @param appName human readable name
     * @param master spark master to use
     * @param suggestedProperties properties to set if no values are set for them already
     * @param overridingProperties properties to force to the given value ignoring values already set
     */
    @VisibleForTesting
    static SparkConf setupSparkConf(final String appName, final String master, final Map<String, String> suggestedProperties, final Map<String, String> overridingProperties) {
        final SparkConf sparkConf = new SparkConf().setAppName(appName).setMaster(master);

        suggestedProperties.forEach(sparkConf::setIfMissing);
        MANDATORY_PROPERTIES.forEach(sparkConf::set);
        overridingProperties.forEach(sparkConf::set);

        return sparkConf;
    }

    /**
     * Reads the number of test cores from GENE_SIGNATURE_TEST_SPARK_CORES, using all available cores when unset.
     */
    private static String determineDefaultSparkMaster() {
        final String sparkSpecFromEnvironment = System.getenv(SPARK_CORES_ENV_VARIABLE);
        if (null == sparkSpecFromEnvironment) {
            return "local[*]";
        }
        final int numSparkCoresFromEnv;
        try {
            numSparkCoresFromEnv = Integer.parseInt(sparkSpecFromEnvironment);
        } catch (final NumberFormatException e) {
            throw new UserException("Illegal number of cores specified in " + SPARK_CORES_ENV_VARIABLE + ". Positive integers only");
        }
        if (numSparkCoresFromEnv <= 0) {
            throw new UserException("Illegal number of cores specified in " + SPARK_CORES_ENV_VARIABLE + ". Number of cores must be positive");
        }
        return String.format("local[%d]", numSparkCoresFromEnv);
    }
}
