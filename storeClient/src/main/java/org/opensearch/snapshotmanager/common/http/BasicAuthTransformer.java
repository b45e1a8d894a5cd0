package org.opensearch.snapshotmanager.common.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.ToString;

@ToString(exclude = "encodedCredentials")
public class BasicAuthTransformer implements RequestTransformer {
    public static final String AUTHORIZATION_HEADER_NAME = "Authorization";

    private final String username;
    private final String encodedCredentials;

    public BasicAuthTransformer(String username, String password) {
        this.username = username;
        this.encodedCredentials = Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Map<String, List<String>> transformHeaders(String method, String path, Map<String, List<String>> headers) {
        var newHeaders = new HashMap<>(headers);
        newHeaders.put(AUTHORIZATION_HEADER_NAME, List.of("Basic " + encodedCredentials));
        return newHeaders;
    }
}
