package org.opensearch.snapshotmanager.lifecycle;

import java.util.List;

import lombok.Value;

/**
 * What the old-snapshot pass did.  When the listing failed nothing was attempted and
 * {@link #getListingError()} says why.
 */
@Value
public class PruneResult {
    List<String> deletedSnapshots;
    List<String> failedSnapshots;
    String listingError;

    public static PruneResult completed(List<String> deletedSnapshots, List<String> failedSnapshots) {
        return new PruneResult(List.copyOf(deletedSnapshots), List.copyOf(failedSnapshots), null);
    }

    public static PruneResult listingFailed(String listingError) {
        return new PruneResult(List.of(), List.of(), listingError);
    }

    public int getDeletedCount() {
        return deletedSnapshots.size();
    }

    public boolean isListingFailed() {
        return listingError != null;
    }
}
