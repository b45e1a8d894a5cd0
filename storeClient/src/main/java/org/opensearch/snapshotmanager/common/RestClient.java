package org.opensearch.snapshotmanager.common;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.opensearch.snapshotmanager.common.http.ConnectionContext;
import org.opensearch.snapshotmanager.common.http.HttpResponse;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Thin asynchronous HTTP client for the cluster.  One instance is shared by all snapshot workers;
 * the underlying reactor-netty connection pool makes concurrent use safe.
 */
@Slf4j
public class RestClient {
    @Getter
    private final ConnectionContext connectionContext;
    private final HttpClient client;

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private static final String USER_AGENT_HEADER_NAME = HttpHeaderNames.USER_AGENT.toString();
    private static final String CONTENT_TYPE_HEADER_NAME = HttpHeaderNames.CONTENT_TYPE.toString();
    private static final String HOST_HEADER_NAME = HttpHeaderNames.HOST.toString();

    private static final String USER_AGENT = "DataStreamSnapshotManager-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";

    public RestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections If &gt; 0, an HttpClient will be created with a provider
     *                       that uses this value for maxConnections.  Otherwise, a client
     *                       will be created with default values provided by Reactor.
     */
    public RestClient(ConnectionContext connectionContext, int maxConnections) {
        this(connectionContext, maxConnections <= 0
            ? HttpClient.create()
            : HttpClient.create(ConnectionProvider.create("SnapshotStoreClient", maxConnections)));
    }

    protected RestClient(ConnectionContext connectionContext, HttpClient httpClient) {
        this.connectionContext = connectionContext;

        var configuredClient = httpClient;
        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            configuredClient = configuredClient.secure(connectionContext.isInsecure()
                ? getInsecureSslProvider()
                : SslProvider.defaultClientProvider());
        }

        this.client = configuredClient
            .baseUrl(connectionContext.getUri().toString())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) DEFAULT_CONNECT_TIMEOUT.toMillis())
            .responseTimeout(connectionContext.getRequestTimeout())
            .keepAlive(true);
    }

    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        String host = connectionContext.getUri().getHost();
        int port = connectionContext.getUri().getPort();
        ConnectionContext.Protocol protocol = connectionContext.getProtocol();

        if (ConnectionContext.Protocol.HTTP.equals(protocol)) {
            if (port == -1 || port == 80) {
                return host;
            }
        } else if (ConnectionContext.Protocol.HTTPS.equals(protocol)) {
            if (port == -1 || port == 443) {
                return host;
            }
        } else {
            throw new IllegalArgumentException("Unexpected protocol" + protocol);
        }
        return host + ":" + port;
    }

    public Mono<HttpResponse> asyncRequest(HttpMethod method, String path, String body) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(HOST_HEADER_NAME, List.of(getHostHeaderValue(connectionContext)));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        var requestHeaders = connectionContext.getRequestTransformer()
            .transformHeaders(method.name(), path, headers);

        return client
            .disableRetry(!retriesConnectionReset(method))
            .headers(h -> requestHeaders.forEach(h::add))
            .request(method)
            .uri("/" + path)
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle(
                (response, bytes) -> bytes.asString()
                    .singleOptional()
                    .map(bodyOp -> new HttpResponse(
                        response.status().code(),
                        response.status().reasonPhrase(),
                        extractHeaders(response.responseHeaders()),
                        bodyOp.orElse(null)
                    ))
            )
            .doOnError(t -> log.atDebug().setCause(t).setMessage("{} /{} failed")
                .addArgument(method)
                .addArgument(path)
                .log());
    }

    /**
     * Reads may be resent once after a connection reset; a PUT or DELETE is sent at most once.
     */
    static boolean retriesConnectionReset(HttpMethod method) {
        return HttpMethod.GET.equals(method) || HttpMethod.HEAD.equals(method);
    }

    private static Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest(HttpMethod.GET, path, null);
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest(HttpMethod.PUT, path, body);
    }

    public Mono<HttpResponse> deleteAsync(String path) {
        return asyncRequest(HttpMethod.DELETE, path, null);
    }

    private SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }
}
