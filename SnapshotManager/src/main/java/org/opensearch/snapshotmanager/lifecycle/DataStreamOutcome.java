package org.opensearch.snapshotmanager.lifecycle;

public enum DataStreamOutcome {
    SKIPPED,
    SNAPSHOT_FAILED,
    /** Snapshot taken, data stream kept */
    SNAPSHOT_CREATED,
    /** Snapshot taken and the data stream removed */
    STREAM_DELETED,
    /** Snapshot taken but the data stream could not be removed */
    STREAM_DELETE_FAILED
}
