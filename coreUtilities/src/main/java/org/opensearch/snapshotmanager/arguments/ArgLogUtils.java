package org.opensearch.snapshotmanager.arguments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class ArgLogUtils {

    private ArgLogUtils() {
        throw new IllegalStateException("Utility class");
    }

    public static final String CENSORED_VALUE = "******";

    /**
     * Returns a copy of the arguments where the value following any censored flag is masked.
     * Both the separated form ({@code --pass secret}) and the joined form ({@code --pass=secret})
     * are recognized.
     */
    public static List<String> getRedactedArgs(String[] args, Collection<String> censoredFlags) {
        List<String> redactedArgs = new ArrayList<>(args.length);
        boolean censorNext = false;

        for (String arg : args) {
            if (censorNext) {
                redactedArgs.add(CENSORED_VALUE);
                censorNext = false;
                continue;
            }
            var separatorIndex = arg.indexOf('=');
            var flag = separatorIndex < 0 ? arg : arg.substring(0, separatorIndex);
            if (!censoredFlags.contains(flag)) {
                redactedArgs.add(arg);
            } else if (separatorIndex < 0) {
                redactedArgs.add(arg);
                censorNext = true;
            } else {
                redactedArgs.add(flag + "=" + CENSORED_VALUE);
            }
        }

        return redactedArgs;
    }

    public static String getRedactedCommandLine(String[] args, Collection<String> censoredFlags) {
        return String.join(" ", getRedactedArgs(args, censoredFlags));
    }
}
