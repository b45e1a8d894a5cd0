package org.opensearch.snapshotmanager.common;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.opensearch.snapshotmanager.common.http.ConnectionContext;
import org.opensearch.snapshotmanager.common.http.HttpResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Every request the snapshot lifecycle makes against the cluster.  Discovery calls throw
 * {@link SnapshotStoreException} once retries are exhausted; the existence check and the mutating
 * calls never throw and report their outcome as a value instead.
 */
@Slf4j
public class SnapshotStoreClient {
    protected static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    public static final Retry DISCOVERY_RETRY_STRATEGY = Retry.backoff(DEFAULT_MAX_RETRY_ATTEMPTS, DEFAULT_BACKOFF)
        .maxBackoff(DEFAULT_MAX_BACKOFF)
        .filter(throwable -> !(throwable instanceof SnapshotStoreException.InvalidResponse)); // Do not retry on this exception

    public static final String SNAPSHOT_PREFIX_STR = "_snapshot/";
    public static final String DATA_STREAM_PREFIX_STR = "_data_stream/";
    public static final String SNAPSHOT_SUCCESS_STATE = "SUCCESS";

    private final RestClient client;
    private final Retry discoveryRetryStrategy;

    public SnapshotStoreClient(ConnectionContext connectionContext, int maxConnections) {
        this(new RestClient(connectionContext, maxConnections));
    }

    public SnapshotStoreClient(RestClient client) {
        this(client, DISCOVERY_RETRY_STRATEGY);
    }

    public SnapshotStoreClient(RestClient client, Retry discoveryRetryStrategy) {
        this.client = client;
        this.discoveryRetryStrategy = discoveryRetryStrategy;
    }

    /**
     * Names of the data streams matching {@code pattern}, in the order the cluster returned them.
     * A pattern matching nothing yields an empty list.
     */
    public List<String> listDataStreams(String pattern) {
        String targetPath = DATA_STREAM_PREFIX_STR + encodePathSegment(pattern);
        log.info("Starting listDataStreams for pattern={}", pattern);
        long startTime = System.currentTimeMillis();

        var response = blockForDiscovery(
            client.getAsync(targetPath).flatMap(resp -> {
                if (resp.isOk() || resp.isNotFound()) {
                    return Mono.just(resp);
                }
                return Mono.error(unexpectedResponse("Could not list data streams: " + targetPath + ".", resp));
            }),
            "Could not list data streams for pattern " + pattern
        );

        long duration = System.currentTimeMillis() - startTime;
        log.info("Completed listDataStreams for pattern={} in {} ms with statusCode={}",
            pattern, duration, response.statusCode);

        if (response.isNotFound()) {
            return List.of();
        }
        return readNames(response, "data_streams", "name", "Could not parse data stream listing for: " + targetPath);
    }

    /**
     * Checks whether {@code snapshotName} is already present in the repository.  Only a definite 404
     * reports {@link SnapshotExistence#NOT_EXISTS}.
     */
    public SnapshotExistenceCheck snapshotExists(String repoName, String snapshotName) {
        String targetPath = snapshotPath(repoName, snapshotName);
        try {
            var response = client.getAsync(targetPath)
                .flatMap(resp -> {
                    if (resp.isOk() || resp.isNotFound()) {
                        return Mono.just(resp);
                    }
                    return Mono.<HttpResponse>error(
                        unexpectedResponse("Unexpected response for: " + targetPath + ".", resp));
                })
                .retryWhen(discoveryRetryStrategy)
                .block();
            if (response == null) {
                return SnapshotExistenceCheck.indeterminate("empty response for " + targetPath);
            }
            return response.isOk() ? SnapshotExistenceCheck.exists() : SnapshotExistenceCheck.notExists();
        } catch (RuntimeException e) {
            var cause = rootCause(e);
            log.atWarn().setCause(cause).setMessage("Could not check existence of snapshot {} in repository {}")
                .addArgument(snapshotName)
                .addArgument(repoName)
                .log();
            return SnapshotExistenceCheck.indeterminate(String.valueOf(cause.getMessage()));
        }
    }

    /**
     * Creates a snapshot of exactly one data stream, named after it, and waits for it to finish.
     */
    public OperationResult createSnapshot(String repoName, String dataStreamName, boolean dryRun) {
        if (dryRun) {
            log.info("[DRY RUN] Would create snapshot for {}", dataStreamName);
            return OperationResult.success();
        }

        String targetPath = snapshotPath(repoName, dataStreamName) + "?wait_for_completion=true";
        ObjectNode settings = OBJECT_MAPPER.createObjectNode();
        settings.put("indices", dataStreamName);
        settings.put("ignore_unavailable", false);
        settings.put("include_global_state", false);
        settings.put("partial", false);

        log.info("Starting createSnapshot for repoName={}, snapshotName={}", repoName, dataStreamName);
        long startTime = System.currentTimeMillis();
        OperationResult result;
        try {
            var response = client.putAsync(targetPath, settings.toString()).block();
            result = interpretCreateResponse(response);
        } catch (RuntimeException e) {
            result = OperationResult.failure(String.valueOf(rootCause(e).getMessage()));
        }
        long duration = System.currentTimeMillis() - startTime;

        if (result.isSuccessful()) {
            log.info("Created snapshot: {} in {} ms", dataStreamName, duration);
        } else {
            log.error("Error creating snapshot for {}: {}", dataStreamName, result.getReason());
        }
        return result;
    }

    private static OperationResult interpretCreateResponse(HttpResponse response) {
        if (response == null) {
            return OperationResult.failure("no response received");
        }
        if (!response.isOk()) {
            return OperationResult.failure(response.describe());
        }
        var state = readSnapshotState(response);
        if (state.isPresent() && !SNAPSHOT_SUCCESS_STATE.equals(state.get())) {
            return OperationResult.failure("snapshot finished in state " + state.get());
        }
        return OperationResult.success();
    }

    private static Optional<String> readSnapshotState(HttpResponse response) {
        if (response.body == null || response.body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(OBJECT_MAPPER.readTree(response.body))
                .map(root -> root.path("snapshot").get("state"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText);
        } catch (JsonProcessingException e) {
            log.atWarn().setCause(e).setMessage("Could not read snapshot state from: {}").addArgument(response.body).log();
            return Optional.empty();
        }
    }

    public OperationResult deleteDataStream(String dataStreamName, boolean dryRun) {
        if (dryRun) {
            log.info("[DRY RUN] Would delete data stream {}", dataStreamName);
            return OperationResult.success();
        }

        var result = delete(DATA_STREAM_PREFIX_STR + encodePathSegment(dataStreamName));
        if (result.isSuccessful()) {
            log.info("Deleted data stream: {}", dataStreamName);
        } else {
            log.error("Error deleting data stream {}: {}", dataStreamName, result.getReason());
        }
        return result;
    }

    /**
     * Names of the snapshots in {@code repoName} matching {@code pattern}.
     */
    public List<String> listSnapshots(String repoName, String pattern) {
        String targetPath = snapshotPath(repoName, pattern);
        log.info("Starting listSnapshots for repoName={}, pattern={}", repoName, pattern);
        long startTime = System.currentTimeMillis();

        var response = blockForDiscovery(
            client.getAsync(targetPath).flatMap(resp -> {
                if (resp.isOk()) {
                    return Mono.just(resp);
                }
                return Mono.error(unexpectedResponse("Could not list snapshots: " + targetPath + ".", resp));
            }),
            "Could not list snapshots in repository " + repoName
        );

        long duration = System.currentTimeMillis() - startTime;
        log.info("Completed listSnapshots for repoName={}, pattern={} in {} ms with statusCode={}",
            repoName, pattern, duration, response.statusCode);
        return readNames(response, "snapshots", "snapshot", "Could not parse snapshot listing for: " + targetPath);
    }

    public OperationResult deleteSnapshot(String repoName, String snapshotName, boolean dryRun) {
        if (dryRun) {
            log.info("[DRY RUN] Would delete old snapshot: {}", snapshotName);
            return OperationResult.success();
        }

        var result = delete(snapshotPath(repoName, snapshotName));
        if (result.isSuccessful()) {
            log.info("Deleted old snapshot: {}", snapshotName);
        } else {
            log.error("Error deleting snapshot {}: {}", snapshotName, result.getReason());
        }
        return result;
    }

    private OperationResult delete(String targetPath) {
        try {
            var response = client.deleteAsync(targetPath).block();
            if (response == null) {
                return OperationResult.failure("no response received");
            }
            return response.isOk() ? OperationResult.success() : OperationResult.failure(response.describe());
        } catch (RuntimeException e) {
            return OperationResult.failure(String.valueOf(rootCause(e).getMessage()));
        }
    }

    private HttpResponse blockForDiscovery(Mono<HttpResponse> request, String failureMessage) {
        HttpResponse response;
        try {
            response = request
                .doOnError(e -> log.error(e.getMessage()))
                .retryWhen(discoveryRetryStrategy)
                .block();
        } catch (RuntimeException e) {
            var cause = rootCause(e);
            if (cause instanceof SnapshotStoreException) {
                throw (SnapshotStoreException) cause;
            }
            throw new SnapshotStoreException(failureMessage + ": " + cause.getMessage(), cause);
        }
        if (response == null) {
            throw new SnapshotStoreException(failureMessage + ": no response received");
        }
        return response;
    }

    private static List<String> readNames(HttpResponse response, String arrayField, String nameField, String errorMessage) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(response.body);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SnapshotStoreException(errorMessage, e);
        }
        if (root == null || !root.isObject()) {
            throw new SnapshotStoreException.OperationFailed(errorMessage, response);
        }

        var names = new ArrayList<String>();
        root.path(arrayField).forEach(entry -> {
            var name = entry.get(nameField);
            if (name != null && name.isTextual()) {
                names.add(name.asText());
            }
        });
        return names;
    }

    private static SnapshotStoreException.OperationFailed unexpectedResponse(String message, HttpResponse response) {
        if (response.isClientError()) {
            return new SnapshotStoreException.InvalidResponse(message, response);
        }
        return new SnapshotStoreException.OperationFailed(message, response);
    }

    private static Throwable rootCause(Throwable t) {
        var unwrapped = Exceptions.unwrap(t);
        if (Exceptions.isRetryExhausted(unwrapped) && unwrapped.getCause() != null) {
            return unwrapped.getCause();
        }
        return unwrapped;
    }

    private static String snapshotPath(String repoName, String snapshotName) {
        return SNAPSHOT_PREFIX_STR + encodePathSegment(repoName) + "/" + encodePathSegment(snapshotName);
    }

    static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
