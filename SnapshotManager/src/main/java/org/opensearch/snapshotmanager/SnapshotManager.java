package org.opensearch.snapshotmanager;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

import org.opensearch.snapshotmanager.arguments.ArgLogUtils;
import org.opensearch.snapshotmanager.arguments.ArgNameConstants;
import org.opensearch.snapshotmanager.common.SnapshotStoreClient;
import org.opensearch.snapshotmanager.common.SnapshotStoreException;
import org.opensearch.snapshotmanager.jcommander.EnvVarParameterPuller;
import org.opensearch.snapshotmanager.lifecycle.ConfigurationException;
import org.opensearch.snapshotmanager.lifecycle.RunConfiguration;
import org.opensearch.snapshotmanager.lifecycle.RunSummary;
import org.opensearch.snapshotmanager.lifecycle.SnapshotLifecycleWorkflow;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SnapshotManager {

    public static final String ENV_PREFIX = "ELASTIC_";
    public static final int FAILURE_EXIT_CODE = 1;
    public static final String DOTENV_DIRECTORY = ".";

    private final EnvVarParameterPuller.EnvVarGetter envVarGetter;
    private final Clock clock;

    public SnapshotManager() {
        this(withDotenvFallback(System::getenv, DOTENV_DIRECTORY), Clock.systemDefaultZone());
    }

    protected SnapshotManager(EnvVarParameterPuller.EnvVarGetter envVarGetter, Clock clock) {
        this.envVarGetter = envVarGetter;
        this.clock = clock;
    }

    /**
     * Variables set in the process environment win; anything else is looked up in a {@code .env} file
     * in {@code directory}, if there is one.
     */
    public static EnvVarParameterPuller.EnvVarGetter withDotenvFallback(
        EnvVarParameterPuller.EnvVarGetter environment,
        String directory
    ) {
        var dotenv = Dotenv.configure()
            .directory(directory)
            .ignoreIfMissing()
            .load();
        Map<String, String> fileEntries = new HashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            fileEntries.put(entry.getKey(), entry.getValue());
        }
        if (!fileEntries.isEmpty()) {
            log.atDebug().setMessage("Read {} entries from .env in {}")
                .addArgument(fileEntries.size())
                .addArgument(directory)
                .log();
        }
        return name -> {
            var value = environment.getEnv(name);
            return value != null ? value : fileEntries.get(name);
        };
    }

    public static void main(String[] args) {
        new SnapshotManager().run(args);
    }

    protected void run(String[] args) {
        System.err.println("Starting program with: "
            + ArgLogUtils.getRedactedCommandLine(args, ArgNameConstants.CENSORED_CLUSTER_ARGS));
        var arguments = EnvVarParameterPuller.injectFromEnv(new SnapshotManagerArgs(), envVarGetter, ENV_PREFIX);
        var jCommander = JCommander.newBuilder().addObject(arguments).build();
        jCommander.setProgramName("SnapshotManager");
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            log.atError().setMessage("Invalid arguments: {}").addArgument(e.getMessage()).log();
            jCommander.usage();
            exitWithCode(FAILURE_EXIT_CODE);
            return;
        }

        if (arguments.help) {
            jCommander.usage();
            return;
        }

        exitWithCode(execute(arguments));
    }

    /**
     * Runs one lifecycle pass and maps its outcome to a process exit code.
     */
    protected int execute(SnapshotManagerArgs arguments) {
        RunConfiguration config;
        try {
            config = RunConfiguration.fromArgs(arguments);
        } catch (ConfigurationException e) {
            log.atError().setMessage("Error initializing config: {}").addArgument(e.getMessage()).log();
            return FAILURE_EXIT_CODE;
        }

        try {
            RunSummary summary = createWorkflow(config).run();
            log.atInfo().setMessage("{}").addArgument(summary::asCliOutput).log();
            return summary.getExitCode();
        } catch (SnapshotStoreException e) {
            log.atError().setCause(e).setMessage("{}").addArgument(e.getMessage()).log();
            return FAILURE_EXIT_CODE;
        }
    }

    protected SnapshotLifecycleWorkflow createWorkflow(RunConfiguration config) {
        var storeClient = new SnapshotStoreClient(config.getConnectionContext(), config.getMaxWorkers());
        return new SnapshotLifecycleWorkflow(storeClient, config, clock);
    }

    protected void exitWithCode(int code) {
        System.exit(code);
    }
}
