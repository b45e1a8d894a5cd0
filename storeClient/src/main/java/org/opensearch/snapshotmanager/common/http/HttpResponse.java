package org.opensearch.snapshotmanager.common.http;

import java.net.HttpURLConnection;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.ToString;

@AllArgsConstructor
@ToString
public class HttpResponse {
    public final int statusCode;
    public final String statusText;
    public final Map<String, String> headers;
    public final String body;

    public boolean isOk() {
        return statusCode == HttpURLConnection.HTTP_OK;
    }

    public boolean isNotFound() {
        return statusCode == HttpURLConnection.HTTP_NOT_FOUND;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    /** Status line and body, for error messages */
    public String describe() {
        return "Response Code: " + statusCode + ", Response Message: " + statusText + ", Response Body: " + body;
    }
}
