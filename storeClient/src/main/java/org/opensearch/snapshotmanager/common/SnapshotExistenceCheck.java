package org.opensearch.snapshotmanager.common;

import lombok.NonNull;
import lombok.Value;

@Value
public class SnapshotExistenceCheck {
    public static final String ALREADY_EXISTS_REASON = "snapshot already exists";
    public static final String INDETERMINATE_REASON_PREFIX = "could not verify snapshot existence";

    @NonNull SnapshotExistence existence;
    String reason;

    public static SnapshotExistenceCheck exists() {
        return new SnapshotExistenceCheck(SnapshotExistence.EXISTS, ALREADY_EXISTS_REASON);
    }

    public static SnapshotExistenceCheck notExists() {
        return new SnapshotExistenceCheck(SnapshotExistence.NOT_EXISTS, null);
    }

    public static SnapshotExistenceCheck indeterminate(String detail) {
        return new SnapshotExistenceCheck(SnapshotExistence.INDETERMINATE, INDETERMINATE_REASON_PREFIX + ": " + detail);
    }

    /** Anything other than a confirmed absence means the data stream must be left alone. */
    public boolean shouldSkip() {
        return existence != SnapshotExistence.NOT_EXISTS;
    }
}
