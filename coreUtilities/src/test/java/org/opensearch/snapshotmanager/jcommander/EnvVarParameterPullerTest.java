package org.opensearch.snapshotmanager.jcommander;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EnvVarParameterPullerTest {

    static class TestParams {
        @Parameter(names = {"--repository-name"})
        String repositoryName;

        @Parameter(names = {"--min-days-to-snapshot"})
        String minDaysToSnapshot;

        @Parameter(names = {"--max-workers"})
        int maxWorkers = 4;

        @Parameter(names = {"--delete-old-snapshots"})
        boolean deleteOldSnapshots = false;

        @Parameter(names = {"--request-timeout-seconds"})
        long requestTimeoutSeconds = 0L;

        @ParametersDelegate
        NestedParams clusterParams = new NestedParams();
    }

    static class NestedParams {
        @Parameter(names = {"--target"})
        String target;

        @Parameter(names = {"--pass"})
        String pass;
    }

    private EnvVarParameterPuller.EnvVarGetter envOf(Map<String, String> envVars) {
        return envVars::get;
    }

    @Test
    void testInjectStringParameter() {
        var params = new TestParams();
        var env = Map.of("ELASTIC_REPOSITORY_NAME", "backups");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ELASTIC_");

        Assertions.assertEquals("backups", params.repositoryName);
    }

    @Test
    void testIntegerSettingHeldAsStringIsCopiedVerbatim() {
        var params = new TestParams();
        var env = Map.of("ELASTIC_MIN_DAYS_TO_SNAPSHOT", "thirty");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ELASTIC_");

        Assertions.assertEquals("thirty", params.minDaysToSnapshot);
    }

    @Test
    void testUnprefixedMaxWorkers() {
        var params = new TestParams();
        var env = Map.of("MAX_WORKERS", "8");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ELASTIC_");

        Assertions.assertEquals(8, params.maxWorkers);
    }

    @Test
    void testPrefixedMaxWorkersWinsOverUnprefixed() {
        var params = new TestParams();
        var env = Map.of("MAX_WORKERS", "8", "ELASTIC_MAX_WORKERS", "2");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ELASTIC_");

        Assertions.assertEquals(2, params.maxWorkers);
    }

    @Test
    void testBooleanParsingIsCaseInsensitive() {
        var upper = new TestParams();
        EnvVarParameterPuller.injectFromEnv(upper, envOf(Map.of("ELASTIC_DELETE_OLD_SNAPSHOTS", "TRUE")), "ELASTIC_");
        Assertions.assertTrue(upper.deleteOldSnapshots);

        var other = new TestParams();
        EnvVarParameterPuller.injectFromEnv(other, envOf(Map.of("ELASTIC_DELETE_OLD_SNAPSHOTS", "yes")), "ELASTIC_");
        Assertions.assertFalse(other.deleteOldSnapshots);
    }

    @Test
    void testInjectLongParameter() {
        var params = new TestParams();

        EnvVarParameterPuller.injectFromEnv(params, envOf(Map.of("ELASTIC_REQUEST_TIMEOUT_SECONDS", "90")), "ELASTIC_");

        Assertions.assertEquals(90L, params.requestTimeoutSeconds);
    }

    @Test
    void testNestedParametersDelegateInjection() {
        var params = new TestParams();
        var env = new HashMap<String, String>();
        env.put("ELASTIC_TARGET", "https://localhost:9200");
        env.put("ELASTIC_PASS", "changeme");

        EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ELASTIC_");

        Assertions.assertEquals("https://localhost:9200", params.clusterParams.target);
        Assertions.assertEquals("changeme", params.clusterParams.pass);
    }

    @Test
    void testInvalidIntegerKeepsDefault() {
        var params = new TestParams();
        var env = Map.of("MAX_WORKERS", "lots");

        Assertions.assertDoesNotThrow(() -> EnvVarParameterPuller.injectFromEnv(params, envOf(env), "ELASTIC_"));

        Assertions.assertEquals(4, params.maxWorkers);
    }

    @Test
    void testNoEnvironmentVariablesSet() {
        var params = new TestParams();

        EnvVarParameterPuller.injectFromEnv(params, envOf(Map.of()), "ELASTIC_");

        Assertions.assertNull(params.repositoryName);
        Assertions.assertNull(params.clusterParams.target);
        Assertions.assertEquals(4, params.maxWorkers);
        Assertions.assertFalse(params.deleteOldSnapshots);
    }

    @Test
    void testToEnvVarNameConversion() {
        Assertions.assertEquals(List.of("ELASTIC_TARGET"), EnvVarParameterPuller.toEnvVarNames("--target", "ELASTIC_"));
        Assertions.assertEquals(List.of("ELASTIC_DATA_STREAM_PATTERN"),
            EnvVarParameterPuller.toEnvVarNames("--data-stream-pattern", "ELASTIC_"));
        Assertions.assertEquals(List.of("ELASTIC_MAX_WORKERS", "MAX_WORKERS"),
            EnvVarParameterPuller.toEnvVarNames("--max-workers", "ELASTIC_"));
        Assertions.assertEquals(List.of("MAX_WORKERS"), EnvVarParameterPuller.toEnvVarNames("--max-workers", ""));
        Assertions.assertEquals(List.of("ELASTIC_REPOSITORY_NAME"),
            EnvVarParameterPuller.toEnvVarNames("--repositoryName", "ELASTIC_"));
    }
}
