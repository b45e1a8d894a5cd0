package org.opensearch.snapshotmanager.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a mutating call against the cluster.  Failures are reported here rather than thrown
 * so one data stream cannot abort the others.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult {
    private static final OperationResult SUCCESS = new OperationResult(true, null);

    boolean successful;
    String reason;

    public static OperationResult success() {
        return SUCCESS;
    }

    public static OperationResult failure(String reason) {
        return new OperationResult(false, reason);
    }
}
