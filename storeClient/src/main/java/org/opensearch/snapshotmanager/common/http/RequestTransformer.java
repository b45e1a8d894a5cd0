package org.opensearch.snapshotmanager.common.http;

import java.util.List;
import java.util.Map;

/**
 * Adjusts the headers of an outgoing request, e.g. to add credentials.
 * Implementations must not mutate the map they are given.
 */
@FunctionalInterface
public interface RequestTransformer {
    RequestTransformer NO_AUTH = (method, path, headers) -> Map.copyOf(headers);

    Map<String, List<String>> transformHeaders(String method, String path, Map<String, List<String>> headers);
}
