package org.opensearch.snapshotmanager.lifecycle;

import lombok.NonNull;
import lombok.Value;

@Value
public class DataStreamResult {
    @NonNull String dataStreamName;
    @NonNull DataStreamOutcome outcome;
    String reason;

    public static DataStreamResult of(String dataStreamName, DataStreamOutcome outcome) {
        return new DataStreamResult(dataStreamName, outcome, null);
    }
}
