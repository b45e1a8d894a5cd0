package org.opensearch.snapshotmanager.common;

import org.opensearch.snapshotmanager.common.http.HttpResponse;

/**
 * Raised when the cluster cannot answer a discovery request.  Ends the run, or the pruning pass when
 * raised while listing snapshots.
 */
public class SnapshotStoreException extends RuntimeException {
    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static class OperationFailed extends SnapshotStoreException {
        public final transient HttpResponse response;

        public OperationFailed(String message, HttpResponse response) {
            super(message + " " + response.describe());
            this.response = response;
        }
    }

    /** The cluster rejected the request itself; repeating it will not help. */
    public static class InvalidResponse extends OperationFailed {
        public InvalidResponse(String message, HttpResponse response) {
            super(message, response);
        }
    }
}
