package org.opensearch.snapshotmanager.arguments;

import java.util.List;
import java.util.regex.Pattern;

public class ArgNameConstants {

    private ArgNameConstants() {
        throw new IllegalStateException("Constant class should not be instantiated");
    }

    /**
     * Flags that may also be supplied through an environment variable without the tool's prefix,
     * e.g. MAX_WORKERS alongside ELASTIC_MAX_WORKERS.
     */
    public static final Pattern UNPREFIXED_ENV_ARG_FLAG_NAMES = Pattern.compile("--max-workers");

    public static final String PASSWORD_ARG = "--pass";
    public static final String USERNAME_ARG = "--user";
    public static final List<String> CENSORED_CLUSTER_ARGS = List.of(PASSWORD_ARG);
}
