package org.opensearch.snapshotmanager.logging;

import java.util.function.UnaryOperator;

import org.apache.logging.log4j.core.config.Node;
import org.apache.logging.log4j.core.config.arbiters.Arbiter;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderFactory;

/**
 * Like Log4j's EnvironmentArbiter, but compares the variable's value ignoring case so that
 * {@code SLOGGER_ENABLED=TRUE} and {@code SLOGGER_ENABLED=true} select the same appender.
 */
@Plugin(name = "CaseInsensitiveEnvironmentArbiter",
    category = Node.CATEGORY,
    elementType = Arbiter.ELEMENT_TYPE,
    deferChildren = true,
    printObject = true)
public class CaseInsensitiveEnvironmentArbiter implements Arbiter {

    private final String propertyName;
    private final String propertyValue;
    private final UnaryOperator<String> envVarGetter;

    CaseInsensitiveEnvironmentArbiter(String propertyName, String propertyValue, UnaryOperator<String> envVarGetter) {
        this.propertyName = propertyName;
        this.propertyValue = propertyValue;
        this.envVarGetter = envVarGetter;
    }

    @Override
    public boolean isCondition() {
        if (propertyName == null) {
            return false;
        }
        var value = envVarGetter.apply(propertyName);
        if (value == null) {
            return false;
        }
        return propertyValue == null || value.trim().equalsIgnoreCase(propertyValue);
    }

    @PluginBuilderFactory
    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder implements org.apache.logging.log4j.core.util.Builder<CaseInsensitiveEnvironmentArbiter> {
        @PluginBuilderAttribute
        private String propertyName;

        @PluginBuilderAttribute
        private String propertyValue;

        public Builder setPropertyName(String propertyName) {
            this.propertyName = propertyName;
            return this;
        }

        public Builder setPropertyValue(String propertyValue) {
            this.propertyValue = propertyValue;
            return this;
        }

        @Override
        public CaseInsensitiveEnvironmentArbiter build() {
            return new CaseInsensitiveEnvironmentArbiter(propertyName, propertyValue, System::getenv);
        }
    }
}
