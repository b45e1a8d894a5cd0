package org.opensearch.snapshotmanager.arguments;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ArgLogUtilsTest {
    private static final List<String> CENSORED = ArgNameConstants.CENSORED_CLUSTER_ARGS;

    @Test
    void testNoPasswordArgs() {
        String[] args = {"--target", "https://localhost:9200", "--dry-run"};

        Assertions.assertEquals(List.of(args), ArgLogUtils.getRedactedArgs(args, CENSORED));
    }

    @Test
    void testSeparatedPasswordRedacted() {
        String[] args = {"--user", "elastic", "--pass", "secret123", "--dry-run"};

        Assertions.assertEquals(
            List.of("--user", "elastic", "--pass", ArgLogUtils.CENSORED_VALUE, "--dry-run"),
            ArgLogUtils.getRedactedArgs(args, CENSORED));
    }

    @Test
    void testJoinedPasswordRedacted() {
        String[] args = {"--pass=hunter2", "--dry-run"};

        Assertions.assertEquals(
            List.of("--pass=" + ArgLogUtils.CENSORED_VALUE, "--dry-run"),
            ArgLogUtils.getRedactedArgs(args, CENSORED));
    }

    @Test
    void testPasswordFlagAtEnd() {
        String[] args = {"--pass"};

        Assertions.assertEquals(List.of("--pass"), ArgLogUtils.getRedactedArgs(args, CENSORED));
    }

    @Test
    void testCommandLineJoinsRedactedArgs() {
        String[] args = {"--pass", "s3cr3t", "--max-workers", "2"};

        Assertions.assertEquals("--pass ****** --max-workers 2", ArgLogUtils.getRedactedCommandLine(args, CENSORED));
    }
}
