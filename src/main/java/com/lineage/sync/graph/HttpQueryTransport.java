package com.lineage.sync.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sends Gremlin queries to an HTTPS endpoint as {@code POST {"gremlin": "<query>"}}.
 *
 * <p>Every request is signed by the configured {@link RequestSigner} and
 * bounded by the request timeout. The target must use HTTPS; this is checked
 * at construction and again before each request.</p>
 *
 * <p>Failures are classified by {@link #classify(int, String)}.</p>
 */
public class HttpQueryTransport implements QueryTransport {
    private static final Logger log = LoggerFactory.getLogger(HttpQueryTransport.class);

    static final String CONFLICT_MARKER = "ConcurrentModificationException";

    // set by the HTTP client itself; java.net.http rejects them
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "host", "content-length", "connection", "expect", "upgrade");

    private static final int MAX_LOGGED_BODY = 500;

    private final HttpClient httpClient;
    private final URI endpoint;
    private final RequestSigner signer;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public HttpQueryTransport(EndpointOptions options, RequestSigner signer) {
        this(options, signer, HttpClient.newBuilder()
                .connectTimeout(options.getConnectTimeout())
                .build());
    }

    HttpQueryTransport(EndpointOptions options, RequestSigner signer, HttpClient httpClient) {
        Objects.requireNonNull(options, "options is required");
        EndpointValidator.requireHttps(options.getEndpoint());
        this.endpoint = options.getEndpoint();
        this.signer = Objects.requireNonNull(signer, "signer is required");
        this.requestTimeout = options.getRequestTimeout();
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.objectMapper = new ObjectMapper();
        log.info("HTTP query transport initialized for endpoint: {}", endpoint);
    }

    @Override
    public String submit(GraphQuery query) {
        EndpointValidator.requireHttps(endpoint);

        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("gremlin", query.render()));
        } catch (JsonProcessingException e) {
            throw new QueryRejectedException(0, "Cannot serialize query: " + e.getOriginalMessage());
        }

        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Content-Type", List.of("application/json"));
        Map<String, List<String>> signedHeaders = signer.sign("POST", endpoint, headers, body);

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        signedHeaders.forEach((name, values) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase())) {
                values.forEach(value -> request.header(name, value));
            }
        });

        log.debug("Submitting {} query to {}", query.getKind(), endpoint);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientQueryException("Request timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new TransientQueryException("I/O failure talking to " + endpoint + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientQueryException("Interrupted while waiting for " + endpoint, e);
        }

        GraphQueryException failure = classify(response.statusCode(), response.body());
        if (failure != null) {
            throw failure;
        }
        return response.body();
    }

    /**
     * Maps an HTTP response to the failure it represents, or null for success.
     * A body naming a concurrent modification is a conflict whatever the status;
     * other 4xx responses are rejections; 5xx and anything unexpected are transient.
     */
    static GraphQueryException classify(int status, String body) {
        if (status >= 200 && status < 300) {
            return null;
        }
        String text = body != null ? body : "";
        if (text.contains(CONFLICT_MARKER)) {
            return new ConcurrentModificationConflictException("HTTP " + status + ": " + abbreviate(text));
        }
        if (status >= 400 && status < 500) {
            return new QueryRejectedException(status, "HTTP " + status + ": " + abbreviate(text));
        }
        return new TransientQueryException("HTTP " + status + ": " + abbreviate(text));
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_LOGGED_BODY ? text : text.substring(0, MAX_LOGGED_BODY) + "...";
    }

    @Override
    public String describe() {
        return endpoint.toString();
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
