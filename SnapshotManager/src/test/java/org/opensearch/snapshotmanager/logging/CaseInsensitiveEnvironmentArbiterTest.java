package org.opensearch.snapshotmanager.logging;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaseInsensitiveEnvironmentArbiterTest {

    private static CaseInsensitiveEnvironmentArbiter arbiter(Map<String, String> env) {
        return new CaseInsensitiveEnvironmentArbiter("SLOGGER_ENABLED", "true", env::get);
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", "True", " true "})
    void anyCasingOfTheValueMatches(String value) {
        assertTrue(arbiter(Map.of("SLOGGER_ENABLED", value)).isCondition());
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "1", "yes", ""})
    void otherValuesDoNotMatch(String value) {
        assertFalse(arbiter(Map.of("SLOGGER_ENABLED", value)).isCondition());
    }

    @Test
    void unsetVariableDoesNotMatch() {
        assertFalse(arbiter(Map.of()).isCondition());
    }

    @Test
    void builderReadsTheProcessEnvironment() {
        var built = CaseInsensitiveEnvironmentArbiter.newBuilder()
            .setPropertyName("SNAPSHOT_MANAGER_VARIABLE_THAT_IS_NEVER_SET")
            .setPropertyValue("true")
            .build();
        assertFalse(built.isCondition());
    }
}
