package org.opensearch.snapshotmanager.lifecycle;

import java.util.List;
import java.util.Optional;

import lombok.Value;

@Value
public class RunSummary {
    public static final int SUCCESS_EXIT_CODE = 0;

    List<DataStreamResult> results;
    PruneResult pruneResult;
    boolean dryRun;

    public long count(DataStreamOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }

    public Optional<PruneResult> getPruneResultIfRun() {
        return Optional.ofNullable(pruneResult);
    }

    /**
     * A run that got this far completed; skipped and failed items do not change the exit code.
     */
    public int getExitCode() {
        return SUCCESS_EXIT_CODE;
    }

    public String asCliOutput() {
        var sb = new StringBuilder();
        sb.append("Data streams processed: ").append(results.size());
        for (var outcome : DataStreamOutcome.values()) {
            sb.append(", ").append(outcome).append("=").append(count(outcome));
        }
        getPruneResultIfRun().ifPresent(prune -> {
            if (prune.isListingFailed()) {
                sb.append("; old snapshot listing failed: ").append(prune.getListingError());
            } else {
                sb.append("; old snapshots deleted: ").append(prune.getDeletedCount())
                    .append(", failed: ").append(prune.getFailedSnapshots().size());
            }
        });
        if (dryRun) {
            sb.append(" (dry run)");
        }
        return sb.toString();
    }
}
