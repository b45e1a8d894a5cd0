package org.opensearch.snapshotmanager.common;

public enum SnapshotExistence {
    EXISTS,
    NOT_EXISTS,
    /** The cluster could not confirm either way; treated as a reason to skip */
    INDETERMINATE
}
