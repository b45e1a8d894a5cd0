package org.opensearch.snapshotmanager.common;

import org.opensearch.snapshotmanager.common.http.ConnectionContext;
import org.opensearch.snapshotmanager.testutils.SimpleHttpResponse;
import org.opensearch.snapshotmanager.testutils.SimpleNettyHttpServer;

import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestClientTest {

    private ConnectionContext ctx(String url) {
        var args = new ConnectionContext.ClusterArgs();
        args.host = url;
        return args.toConnectionContext();
    }

    @Test
    void getHostHeaderValue_httpDefaultPort() {
        assertEquals("localhost", RestClient.getHostHeaderValue(ctx("http://localhost")));
    }

    @Test
    void getHostHeaderValue_httpPort80() {
        assertEquals("localhost", RestClient.getHostHeaderValue(ctx("http://localhost:80")));
    }

    @Test
    void getHostHeaderValue_httpCustomPort() {
        assertEquals("localhost:9200", RestClient.getHostHeaderValue(ctx("http://localhost:9200")));
    }

    @Test
    void getHostHeaderValue_httpsPort443() {
        assertEquals("elastic.example.com", RestClient.getHostHeaderValue(ctx("https://elastic.example.com:443")));
    }

    @Test
    void getHostHeaderValue_httpsCustomPort() {
        assertEquals("elastic.example.com:9243", RestClient.getHostHeaderValue(ctx("https://elastic.example.com:9243")));
    }

    @Test
    void putAsync_sendsJsonBodyWithCredentials() throws Exception {
        try (var server = SimpleNettyHttpServer.makeServer(
            r -> SimpleHttpResponse.json(200, "OK", "{\"acknowledged\":true}"))) {
            var args = new ConnectionContext.ClusterArgs();
            args.host = server.localhostEndpoint().toString();
            args.username = "elastic";
            args.password = "changeme";
            var client = new RestClient(args.toConnectionContext());

            var response = client.putAsync("_snapshot/backups/logs-2023.01.01", "{\"partial\":false}").block();

            assertEquals(200, response.statusCode);
            assertEquals("{\"acknowledged\":true}", response.body);

            var request = server.getRequests().get(0);
            assertEquals("PUT", request.getMethod());
            assertEquals("/_snapshot/backups/logs-2023.01.01", request.getUri());
            assertEquals("{\"partial\":false}", request.getBody());
            assertEquals("application/json", request.getHeaders().get("content-type"));
            assertEquals("Basic ZWxhc3RpYzpjaGFuZ2VtZQ==", request.getHeaders().get("authorization"));
        }
    }

    @Test
    void getAsync_withoutCredentialsSendsNoAuthorization() throws Exception {
        try (var server = SimpleNettyHttpServer.makeServer(r -> SimpleHttpResponse.json(404, "Not Found", "{}"))) {
            var client = new RestClient(ctx(server.localhostEndpoint().toString()));

            var response = client.getAsync("_data_stream/logs-*").block();

            assertEquals(404, response.statusCode);
            var request = server.getRequests().get(0);
            assertEquals("GET", request.getMethod());
            assertEquals("/_data_stream/logs-*", request.getUri());
            assertNull(request.getHeaders().get("authorization"));
        }
    }

    @Test
    void putAsync_isNotResentAfterConnectionClose() throws Exception {
        try (var server = SimpleNettyHttpServer.makeServer(r -> {
            throw new IllegalStateException("drop the connection without answering");
        })) {
            var client = new RestClient(ctx(server.localhostEndpoint().toString()));

            var put = client.putAsync("_snapshot/backups/logs-2023.01.01", "{}");

            assertThrows(Exception.class, put::block);
            assertEquals(1, server.getRequests().size());
        }
    }

    @Test
    void retriesConnectionReset_onlyForReads() {
        assertTrue(RestClient.retriesConnectionReset(HttpMethod.GET));
        assertFalse(RestClient.retriesConnectionReset(HttpMethod.PUT));
        assertFalse(RestClient.retriesConnectionReset(HttpMethod.DELETE));
    }
}
