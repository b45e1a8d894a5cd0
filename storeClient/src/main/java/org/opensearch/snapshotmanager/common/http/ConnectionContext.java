package org.opensearch.snapshotmanager.common.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

import org.opensearch.snapshotmanager.arguments.ArgNameConstants;

import com.beust.jcommander.Parameter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Stores the connection context for the Elasticsearch cluster whose data streams are managed
 */
@Getter
@EqualsAndHashCode(exclude = {"requestTransformer"})
@ToString(exclude = {"requestTransformer"})
public class ConnectionContext {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofHours(1);

    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final Duration requestTimeout;
    private final RequestTransformer requestTransformer;

    private ConnectionContext(IParams params) {
        if (params.getHost() == null) {
            throw new IllegalArgumentException("No host was found");
        }

        this.insecure = params.isInsecure();

        try {
            uri = new URI(params.getHost()); // e.g. https://localhost:9200
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format", e);
        }

        if ("http".equals(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equals(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol");
        }

        if (params.getUsername() != null ^ params.getPassword() != null) {
            throw new IllegalArgumentException("Both username and password must be provided, or neither");
        }

        if (params.getUsername() != null) {
            requestTransformer = new BasicAuthTransformer(params.getUsername(), params.getPassword());
        } else {
            requestTransformer = RequestTransformer.NO_AUTH;
        }

        if (params.getRequestTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        requestTimeout = Duration.ofSeconds(params.getRequestTimeoutSeconds());
    }

    public interface IParams {
        String getHost();

        String getUsername();

        String getPassword();

        boolean isInsecure();

        default long getRequestTimeoutSeconds() {
            return DEFAULT_REQUEST_TIMEOUT.toSeconds();
        }

        default ConnectionContext toConnectionContext() {
            return new ConnectionContext(this);
        }
    }

    @Getter
    public static class ClusterArgs implements IParams {
        @Parameter(
            names = {"--target"},
            description = "The cluster URL (e.g. https://localhost:9200)",
            required = false)
        public String host = null;

        @Parameter(
            names = {ArgNameConstants.USERNAME_ARG},
            description = "The basic auth username",
            required = false)
        public String username = null;

        @Parameter(
            names = {ArgNameConstants.PASSWORD_ARG},
            description = "The basic auth password",
            required = false)
        public String password = null;

        @Parameter(
            names = {"--verify-certs"},
            description = "Verify the cluster's TLS certificate.  Off by default, matching clusters with self-signed certs",
            required = false,
            arity = 1)
        public boolean verifyCerts = false;

        @Parameter(
            names = {"--request-timeout-seconds"},
            description = "How long to wait for any single response, including a snapshot that blocks until completion",
            required = false)
        public long requestTimeoutSeconds = DEFAULT_REQUEST_TIMEOUT.toSeconds();

        @Override
        public boolean isInsecure() {
            return !verifyCerts;
        }
    }
}
