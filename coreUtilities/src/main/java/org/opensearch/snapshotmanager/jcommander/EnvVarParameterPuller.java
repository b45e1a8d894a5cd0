package org.opensearch.snapshotmanager.jcommander;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.opensearch.snapshotmanager.arguments.ArgNameConstants;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills JCommander parameter objects from environment variables.
 * A flag such as {@code --min-days-to-snapshot} is looked up as {@code <PREFIX>MIN_DAYS_TO_SNAPSHOT}.
 * Values are injected before the command line is parsed, so explicit flags still take precedence.
 */
@Slf4j
public class EnvVarParameterPuller {

    private static final Pattern CAMEL_CASE_PATTERN = Pattern.compile("([A-Z])");

    @FunctionalInterface
    public interface EnvVarGetter {
        String getEnv(String name);
    }

    private EnvVarParameterPuller() {
        throw new IllegalStateException("EnvVarParameterPuller utility class should not be instantiated");
    }

    /**
     * Injects environment variables into the provided parameters object using a custom getter.
     * Delegated parameter objects are processed recursively.
     *
     * @return the same {@code params} instance
     */
    public static <T> T injectFromEnv(@NonNull T params, EnvVarGetter envVarGetter, String prefix) {
        List<String> addedEnvParams = new ArrayList<>();
        injectFromEnvRecursive(params, envVarGetter, addedEnvParams, prefix);

        if (!addedEnvParams.isEmpty()) {
            log.atInfo().setMessage("Adding parameters from the following environment variables: {}")
                .addArgument(addedEnvParams)
                .log();
        }
        return params;
    }

    private static void injectFromEnvRecursive(Object params,
                                               EnvVarGetter envVarGetter,
                                               List<String> addedEnvParams,
                                               String prefix)
    {
        Class<?> clazz = params.getClass();

        while (clazz != null && clazz != Object.class) {
            for (Field field : clazz.getDeclaredFields()) {
                field.setAccessible(true);

                try {
                    if (field.isAnnotationPresent(ParametersDelegate.class)) {
                        var delegatedObject = field.get(params);
                        if (delegatedObject != null) {
                            injectFromEnvRecursive(delegatedObject, envVarGetter, addedEnvParams, prefix);
                        }
                    } else if (field.isAnnotationPresent(Parameter.class)) {
                        var annotation = field.getAnnotation(Parameter.class);
                        var nameAndValue = findEnvValue(annotation, envVarGetter, prefix);
                        if (nameAndValue.isPresent() && setFieldValue(params, field, nameAndValue.get().getValue())) {
                            addedEnvParams.add(nameAndValue.get().getKey());
                        }
                    }
                } catch (IllegalAccessException e) {
                    log.atWarn().setCause(e).setMessage("Could not access field: {}").addArgument(field.getName()).log();
                }
            }
            clazz = clazz.getSuperclass();
        }
    }

    private static Optional<Map.Entry<String, String>> findEnvValue(Parameter annotation,
                                                                   EnvVarGetter envVarGetter,
                                                                   String prefix)
    {
        for (String name : annotation.names()) {
            for (var envName : toEnvVarNames(name, prefix)) {
                var envValue = envVarGetter.getEnv(envName);
                if (envValue != null) {
                    return Optional.of(Map.entry(envName, envValue));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Converts a flag name to its environment variable names, most specific first.
     * Examples:
     *   --repository-name, ELASTIC_ -> [ELASTIC_REPOSITORY_NAME]
     *   --max-workers, ELASTIC_     -> [ELASTIC_MAX_WORKERS, MAX_WORKERS]
     */
    public static List<String> toEnvVarNames(final String argName, String prefix) {
        String normalized = argName
            .replaceAll("^-+", "")
            .replace("-", "_");

        Matcher matcher = CAMEL_CASE_PATTERN.matcher(normalized);
        String envCase = matcher.replaceAll("_$1").toUpperCase();

        var names = new ArrayList<String>();
        names.add(prefix + envCase);
        if (!prefix.isEmpty() && ArgNameConstants.UNPREFIXED_ENV_ARG_FLAG_NAMES.matcher(argName).matches()) {
            names.add(envCase);
        }
        return names;
    }

    private static boolean setFieldValue(Object params, Field field, String value) throws IllegalAccessException {
        Class<?> type = field.getType();

        try {
            if (type == String.class) {
                field.set(params, value);
            } else if (type == int.class || type == Integer.class) {
                field.set(params, Integer.parseInt(value.trim()));
            } else if (type == long.class || type == Long.class) {
                field.set(params, Long.parseLong(value.trim()));
            } else if (type == boolean.class || type == Boolean.class) {
                field.set(params, Boolean.parseBoolean(value.trim()));
            } else {
                log.atWarn().setMessage("Unsupported field type for environment variable injection: {} (field: {})")
                    .addArgument(type.getName())
                    .addArgument(field.getName())
                    .log();
                return false;
            }
            return true;
        } catch (NumberFormatException e) {
            log.atError().setCause(e)
                .setMessage("Failed to parse environment variable value '{}' for field '{}' of type {}")
                .addArgument(value)
                .addArgument(field.getName())
                .addArgument(type.getName())
                .log();
            return false;
        }
    }
}
