package org.opensearch.snapshotmanager;

import org.opensearch.snapshotmanager.common.http.ConnectionContext;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

/**
 * Command line flags.  Each is also read from the environment as {@code ELASTIC_<FLAG_NAME>}, with
 * {@code --max-workers} also read from {@code MAX_WORKERS}.  Numeric settings are kept as text here
 * and checked by {@link org.opensearch.snapshotmanager.lifecycle.RunConfiguration#fromArgs}.
 */
public class SnapshotManagerArgs {
    @Parameter(
        names = {"--help", "-h"},
        help = true,
        description = "Displays information about how to use this tool")
    public boolean help;

    @ParametersDelegate
    public ConnectionContext.ClusterArgs clusterArgs = new ConnectionContext.ClusterArgs();

    @Parameter(
        names = {"--repository-name"},
        description = "The snapshot repository that receives the snapshots; it must already be registered")
    public String repositoryName;

    @Parameter(
        names = {"--data-stream-pattern"},
        description = "Data stream name or wildcard pattern, e.g. logs-*.  Also selects the snapshots considered for deletion")
    public String dataStreamPattern;

    @Parameter(
        names = {"--min-days-to-snapshot"},
        description = "Data streams dated more than this many days ago are snapshotted")
    public String minDaysToSnapshot;

    @Parameter(
        names = {"--delete-data-stream-after-snapshot"},
        arity = 1,
        description = "Delete each data stream once its snapshot has completed.  Defaults to false.")
    public boolean deleteDataStreamAfterSnapshot = false;

    @Parameter(
        names = {"--delete-old-snapshots"},
        arity = 1,
        description = "Delete snapshots older than --min-days-to-delete-snapshot.  Defaults to false.")
    public boolean deleteOldSnapshots = false;

    @Parameter(
        names = {"--min-days-to-delete-snapshot"},
        description = "Snapshots dated more than this many days ago are deleted.  Required with --delete-old-snapshots true")
    public String minDaysToDeleteSnapshot;

    @Parameter(
        names = {"--max-workers"},
        description = "How many data streams are snapshotted at the same time.  Defaults to 4.")
    public String maxWorkers = "4";

    @Parameter(
        names = {"--dry-run"},
        description = "Log the snapshots and deletions that would happen without changing the cluster")
    public boolean dryRun = false;
}
