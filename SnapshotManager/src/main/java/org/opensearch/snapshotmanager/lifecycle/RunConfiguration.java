package org.opensearch.snapshotmanager.lifecycle;

import java.util.ArrayList;
import java.util.LinkedHashMap;

import org.opensearch.snapshotmanager.SnapshotManagerArgs;
import org.opensearch.snapshotmanager.common.http.ConnectionContext;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class RunConfiguration {
    public static final int DEFAULT_MAX_WORKERS = 4;

    static final String TARGET_KEY = "ELASTIC_TARGET";
    static final String USER_KEY = "ELASTIC_USER";
    static final String PASS_KEY = "ELASTIC_PASS";
    static final String REPOSITORY_NAME_KEY = "ELASTIC_REPOSITORY_NAME";
    static final String DATA_STREAM_PATTERN_KEY = "ELASTIC_DATA_STREAM_PATTERN";
    static final String MIN_DAYS_TO_SNAPSHOT_KEY = "ELASTIC_MIN_DAYS_TO_SNAPSHOT";
    static final String MIN_DAYS_TO_DELETE_SNAPSHOT_KEY = "ELASTIC_MIN_DAYS_TO_DELETE_SNAPSHOT";
    static final String MAX_WORKERS_KEY = "MAX_WORKERS";

    @NonNull ConnectionContext connectionContext;
    @NonNull String repositoryName;
    @NonNull String dataStreamPattern;
    int minDaysToSnapshot;
    boolean deleteDataStreamAfterSnapshot;
    boolean deleteOldSnapshots;
    /** Only set when {@link #deleteOldSnapshots} is on */
    Integer minDaysToDeleteSnapshot;
    @Builder.Default
    int maxWorkers = DEFAULT_MAX_WORKERS;
    boolean dryRun;

    /**
     * Validates the parsed arguments.  All missing settings are reported together, before any
     * numeric setting is checked.
     *
     * @throws ConfigurationException naming the environment variables that are missing or malformed
     */
    public static RunConfiguration fromArgs(SnapshotManagerArgs args) {
        var cluster = args.clusterArgs;
        var required = new LinkedHashMap<String, String>();
        required.put(TARGET_KEY, cluster.getHost());
        required.put(USER_KEY, cluster.getUsername());
        required.put(PASS_KEY, cluster.getPassword());
        required.put(REPOSITORY_NAME_KEY, args.repositoryName);
        required.put(DATA_STREAM_PATTERN_KEY, args.dataStreamPattern);
        required.put(MIN_DAYS_TO_SNAPSHOT_KEY, args.minDaysToSnapshot);
        if (args.deleteOldSnapshots) {
            required.put(MIN_DAYS_TO_DELETE_SNAPSHOT_KEY, args.minDaysToDeleteSnapshot);
        }

        var missing = new ArrayList<String>();
        required.forEach((key, value) -> {
            if (value == null || value.isEmpty()) {
                missing.add(key);
            }
        });
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required environment variables: " + String.join(", ", missing));
        }

        int minDaysToSnapshot = parseInteger(MIN_DAYS_TO_SNAPSHOT_KEY, args.minDaysToSnapshot);
        Integer minDaysToDeleteSnapshot = args.deleteOldSnapshots
            ? parseInteger(MIN_DAYS_TO_DELETE_SNAPSHOT_KEY, args.minDaysToDeleteSnapshot)
            : null;
        int maxWorkers = args.maxWorkers == null
            ? DEFAULT_MAX_WORKERS
            : parseInteger(MAX_WORKERS_KEY, args.maxWorkers);
        if (maxWorkers < 1) {
            throw new ConfigurationException(MAX_WORKERS_KEY + " must be at least 1");
        }

        ConnectionContext connectionContext;
        try {
            connectionContext = cluster.toConnectionContext();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid " + TARGET_KEY + " " + cluster.getHost() + ": " + e.getMessage(), e);
        }

        return RunConfiguration.builder()
            .connectionContext(connectionContext)
            .repositoryName(args.repositoryName)
            .dataStreamPattern(args.dataStreamPattern)
            .minDaysToSnapshot(minDaysToSnapshot)
            .deleteDataStreamAfterSnapshot(args.deleteDataStreamAfterSnapshot)
            .deleteOldSnapshots(args.deleteOldSnapshots)
            .minDaysToDeleteSnapshot(minDaysToDeleteSnapshot)
            .maxWorkers(maxWorkers)
            .dryRun(args.dryRun)
            .build();
    }

    private static int parseInteger(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer", e);
        }
    }
}
