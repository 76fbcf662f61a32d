package com.lineage.sync.graph;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Resolves and checks graph endpoint URLs. Only HTTPS targets are accepted.
 */
public final class EndpointValidator {

    public static final int DEFAULT_PORT = 8182;
    public static final String DEFAULT_PATH = "/gremlin";

    private EndpointValidator() {
    }

    /**
     * Turns a configured endpoint into a URI. A bare host name becomes
     * {@code https://<host>:8182/gremlin}; an {@code https://} URL is used as
     * given.
     *
     * @throws EndpointConfigurationException for any other scheme, a missing
     *                                        host or an unparseable value
     */
    public static URI resolve(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new EndpointConfigurationException("Graph endpoint must not be null or blank");
        }
        String trimmed = endpoint.trim();
        String candidate;
        if (trimmed.contains("://")) {
            candidate = trimmed;
        } else {
            if (trimmed.contains("/") || trimmed.contains(" ")) {
                throw new EndpointConfigurationException("Invalid graph endpoint host: " + trimmed);
            }
            candidate = "https://" + trimmed + ":" + DEFAULT_PORT + DEFAULT_PATH;
        }

        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new EndpointConfigurationException("Invalid graph endpoint: " + trimmed, e);
        }
        requireHttps(uri);
        return uri;
    }

    /**
     * Fails unless the URI uses HTTPS and names a host.
     *
     * @throws EndpointConfigurationException if the check fails
     */
    public static void requireHttps(URI uri) {
        if (uri == null) {
            throw new EndpointConfigurationException("Graph endpoint must not be null");
        }
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            throw new EndpointConfigurationException(
                    "Graph endpoint must use https, got scheme '" + uri.getScheme() + "'");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new EndpointConfigurationException("Graph endpoint has no host: " + uri);
        }
    }
}
