package org.opensearch.snapshotmanager.lifecycle;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.opensearch.snapshotmanager.common.SnapshotStoreClient;
import org.opensearch.snapshotmanager.common.SnapshotStoreException;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One pass of the snapshot lifecycle: snapshot every data stream past its age threshold (optionally
 * deleting it afterwards), then optionally delete snapshots past theirs.  Each data stream is handled
 * independently so a failure on one never stops the others.
 */
@Slf4j
@AllArgsConstructor
public class SnapshotLifecycleWorkflow {
    public static final String WORKER_THREAD_NAME = "SnapshotWorker";

    private final SnapshotStoreClient storeClient;
    private final RunConfiguration config;
    private final Clock clock;

    /**
     * @throws SnapshotStoreException when the data streams cannot be listed; nothing has been changed at that point
     */
    public RunSummary run() {
        log.info("Starting elasticsearch snapshots");
        if (config.isDryRun()) {
            log.info("Running in DRY RUN mode - no changes will be made");
        }

        var cutoff = AgeClassifier.cutoff(clock, config.getMinDaysToSnapshot());
        var dataStreams = storeClient.listDataStreams(config.getDataStreamPattern());
        var candidates = AgeClassifier.filterOlderThan(dataStreams, cutoff, AgeClassifier.DATA_STREAM_KIND);
        log.atDebug().setMessage("{} of {} data streams are dated before {}")
            .addArgument(candidates::size)
            .addArgument(dataStreams::size)
            .addArgument(cutoff)
            .log();

        var results = processDataStreams(candidates);

        PruneResult pruneResult = null;
        if (config.isDeleteOldSnapshots()) {
            pruneResult = deleteOldSnapshots();
        }

        log.info("Finishing elasticsearch snapshots");
        return new RunSummary(results, pruneResult, config.isDryRun());
    }

    List<DataStreamResult> processDataStreams(List<String> dataStreams) {
        if (dataStreams.isEmpty()) {
            log.info("No data streams to process");
            return List.of();
        }

        log.info("Processing {} data streams with {} workers", dataStreams.size(), config.getMaxWorkers());
        AtomicInteger id = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(
            config.getMaxWorkers(),
            r -> new Thread(r, WORKER_THREAD_NAME + "-" + id.incrementAndGet()));
        try {
            var futures = new ArrayList<Future<DataStreamResult>>(dataStreams.size());
            for (var dataStream : dataStreams) {
                futures.add(executor.submit(() -> processDataStreamSafely(dataStream)));
            }

            var results = new ArrayList<DataStreamResult>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(awaitResult(dataStreams.get(i), futures.get(i)));
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private static DataStreamResult awaitResult(String dataStream, Future<DataStreamResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Error processing data stream: {}", e.getCause().getMessage(), e.getCause());
            return new DataStreamResult(dataStream, DataStreamOutcome.SNAPSHOT_FAILED,
                "unexpected error: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for data stream " + dataStream, e);
        }
    }

    private DataStreamResult processDataStreamSafely(String dataStream) {
        try {
            return processDataStream(dataStream);
        } catch (RuntimeException e) {
            log.error("Error processing data stream: {}", e.getMessage(), e);
            return new DataStreamResult(dataStream, DataStreamOutcome.SNAPSHOT_FAILED, "unexpected error: " + e.getMessage());
        }
    }

    /**
     * Snapshots one data stream unless a snapshot of the same name exists or might exist.  The data
     * stream is only deleted after its snapshot was confirmed.
     */
    public DataStreamResult processDataStream(String dataStream) {
        var existence = storeClient.snapshotExists(config.getRepositoryName(), dataStream);
        if (existence.shouldSkip()) {
            log.warn("Skipping {} - {}", dataStream, existence.getReason());
            return new DataStreamResult(dataStream, DataStreamOutcome.SKIPPED, existence.getReason());
        }

        var snapshot = storeClient.createSnapshot(config.getRepositoryName(), dataStream, config.isDryRun());
        if (!snapshot.isSuccessful()) {
            return new DataStreamResult(dataStream, DataStreamOutcome.SNAPSHOT_FAILED, snapshot.getReason());
        }

        if (!config.isDeleteDataStreamAfterSnapshot()) {
            return DataStreamResult.of(dataStream, DataStreamOutcome.SNAPSHOT_CREATED);
        }

        var deletion = storeClient.deleteDataStream(dataStream, config.isDryRun());
        if (!deletion.isSuccessful()) {
            return new DataStreamResult(dataStream, DataStreamOutcome.STREAM_DELETE_FAILED, deletion.getReason());
        }
        return DataStreamResult.of(dataStream, DataStreamOutcome.STREAM_DELETED);
    }

    /**
     * Deletes snapshots matching the data stream pattern that are dated before the deletion cutoff.
     * Never throws; a failed listing is reported in the result.
     */
    PruneResult deleteOldSnapshots() {
        var cutoff = AgeClassifier.cutoff(clock, config.getMinDaysToDeleteSnapshot());
        List<String> candidates;
        try {
            var snapshots = storeClient.listSnapshots(config.getRepositoryName(), config.getDataStreamPattern());
            candidates = AgeClassifier.filterOlderThan(snapshots, cutoff, AgeClassifier.SNAPSHOT_KIND);
        } catch (SnapshotStoreException e) {
            log.atError().setCause(e).setMessage("Error deleting old snapshots").log();
            return PruneResult.listingFailed(e.getMessage());
        }

        var deleted = new ArrayList<String>();
        var failed = new ArrayList<String>();
        for (var snapshot : candidates) {
            var result = storeClient.deleteSnapshot(config.getRepositoryName(), snapshot, config.isDryRun());
            if (result.isSuccessful()) {
                deleted.add(snapshot);
            } else {
                failed.add(snapshot);
            }
        }

        if (candidates.isEmpty()) {
            log.info("No old snapshots to delete");
        } else if (deleted.isEmpty()) {
            log.debug("None of the {} old snapshots were deleted", candidates.size());
        } else if (config.isDryRun()) {
            log.info("[DRY RUN] Would delete {} old snapshots", deleted.size());
        } else {
            log.info("Successfully deleted {} old snapshots", deleted.size());
        }
        if (!failed.isEmpty()) {
            log.warn("Could not delete {} old snapshots: {}", failed.size(), failed);
        }
        return PruneResult.completed(deleted, failed);
    }
}
