package com.lineage.sync.graph;

import com.lineage.sync.metrics.MetricsService;
import com.lineage.sync.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Idempotent upserts and aggregate queries against the remote graph store.
 *
 * <p>Only concurrent modification conflicts are retried here, with
 * exponential backoff, up to a per-path attempt limit that counts the first
 * attempt. Any other failure ends the call at once; it is the caller's job to
 * hand the unit to a recovery pass. No method throws: failures come back as a
 * {@link QueryOutcome}.</p>
 *
 * <pre>
 * NeptuneEndpointClient client = NeptuneEndpointClient.builder()
 *         .transport(new HttpQueryTransport(options, new SigV4RequestSigner("us-east-1")))
 *         .build();
 * QueryOutcome outcome = client.upsertVertex("lineage_node", "orders", Map.of("source_type", "athena"));
 * </pre>
 */
public class NeptuneEndpointClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NeptuneEndpointClient.class);

    public static final int DEFAULT_VERTEX_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_EDGE_MAX_ATTEMPTS = 5;

    private final QueryTransport transport;
    private final int vertexMaxAttempts;
    private final int edgeMaxAttempts;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final MetricsService metricsService;
    private final GraphSonParser parser;

    private NeptuneEndpointClient(Builder builder) {
        this.transport = Objects.requireNonNull(builder.transport, "transport is required");
        this.vertexMaxAttempts = builder.vertexMaxAttempts;
        this.edgeMaxAttempts = builder.edgeMaxAttempts;
        this.backoffPolicy = builder.backoffPolicy != null ? builder.backoffPolicy : new BackoffPolicy();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.parser = new GraphSonParser();
    }

    /**
     * Creates the vertex identified by (label, key) unless it already exists.
     * Properties are written only on creation.
     */
    public QueryOutcome upsertVertex(String label, String key, Map<String, Object> properties) {
        GraphQuery query;
        try {
            query = GremlinQueries.upsertVertex(label, key, properties);
        } catch (IllegalArgumentException e) {
            return invalid(e);
        }
        return execute(query, vertexMaxAttempts);
    }

    /**
     * Creates the vertex identified by its label and key property unless it
     * already exists.
     */
    public QueryOutcome upsertVertex(VertexRef vertex, Map<String, Object> properties) {
        GraphQuery query;
        try {
            query = GremlinQueries.upsertVertex(vertex, properties);
        } catch (IllegalArgumentException e) {
            return invalid(e);
        }
        return execute(query, vertexMaxAttempts);
    }

    /**
     * Creates a {@code label} edge between two vertices unless one already exists.
     */
    public QueryOutcome upsertEdge(VertexRef from, VertexRef to, String label, Map<String, Object> properties) {
        GraphQuery query;
        try {
            query = GremlinQueries.upsertEdge(from, to, label, properties);
        } catch (IllegalArgumentException e) {
            return invalid(e);
        }
        return execute(query, edgeMaxAttempts);
    }

    /**
     * Creates a {@code label} edge from {@code fromKey} to {@code toKey} unless
     * one already exists.
     */
    public QueryOutcome upsertEdge(String fromKey, String toKey, String label, Map<String, Object> properties) {
        GraphQuery query;
        try {
            query = GremlinQueries.upsertEdge(fromKey, toKey, label, properties);
        } catch (IllegalArgumentException e) {
            return invalid(e);
        }
        return execute(query, edgeMaxAttempts);
    }

    /**
     * Drops every vertex and, with them, every edge.
     */
    public QueryOutcome clearGraph() {
        return execute(GremlinQueries.dropAll(), vertexMaxAttempts);
    }

    /**
     * Runs a count query. Empty when the query fails or the response carries
     * no number.
     */
    public OptionalLong count(GraphQuery query) {
        QueryOutcome outcome = execute(query, vertexMaxAttempts);
        if (!outcome.isSuccess()) {
            log.warn("Count query failed: {}", outcome.describe());
            return OptionalLong.empty();
        }
        try {
            return parser.parseCount(outcome.body());
        } catch (IllegalArgumentException e) {
            log.warn("Cannot parse count response: {}", e.getMessage());
            return OptionalLong.empty();
        }
    }

    /**
     * Fetches up to {@code limit} (key, provenance label) pairs. Empty on failure.
     */
    public List<VertexSample> sample(int limit) {
        QueryOutcome outcome = execute(GremlinQueries.sampleVertices(limit), vertexMaxAttempts);
        if (!outcome.isSuccess()) {
            log.warn("Sample query failed: {}", outcome.describe());
            return List.of();
        }
        try {
            return parser.parseSamples(outcome.body());
        } catch (IllegalArgumentException e) {
            log.warn("Cannot parse sample response: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Submits a query, retrying conflicts up to {@code maxAttempts} attempts in total.
     */
    QueryOutcome execute(GraphQuery query, int maxAttempts) {
        long start = System.nanoTime();
        int conflictRetries = 0;
        GraphQueryException lastError = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                Duration delay = backoffPolicy.delayFor(attempt - 1);
                log.debug("Conflict on {} query, retry {}/{} in {} ms",
                        query.getKind(), attempt, maxAttempts - 1, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = new TransientQueryException("Interrupted during conflict backoff", e);
                    break;
                }
                conflictRetries++;
                metricsService.incrementConflictRetry();
            }
            try {
                String body = transport.submit(query);
                recordDuration(query, "success", start);
                return QueryOutcome.succeeded(body, conflictRetries);
            } catch (ConcurrentModificationConflictException e) {
                lastError = e;
            } catch (GraphQueryException e) {
                lastError = e;
                break;
            } catch (RuntimeException e) {
                // a transport bug must not escape into the worker pool
                lastError = new TransientQueryException("Unexpected transport failure: " + e.getMessage(), e);
                break;
            }
        }

        QueryOutcome outcome = QueryOutcome.failed(lastError, conflictRetries);
        recordDuration(query, outcome.status().name().toLowerCase(), start);
        if (outcome.status() == QueryOutcome.Status.CONFLICT_EXHAUSTED) {
            log.warn("query.conflictExhausted kind={} attempts={}", query.getKind(), maxAttempts);
        } else {
            log.debug("query.failed kind={} status={} error={}",
                    query.getKind(), outcome.status(), lastError.getMessage());
        }
        return outcome;
    }

    private void recordDuration(GraphQuery query, String outcome, long startNanos) {
        metricsService.recordQueryDuration(query.getKind().name().toLowerCase(), outcome,
                Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private QueryOutcome invalid(IllegalArgumentException e) {
        log.warn("Query could not be built: {}", e.getMessage());
        return QueryOutcome.failed(new QueryRejectedException(0, "Query could not be built: " + e.getMessage()), 0);
    }

    public String describe() {
        return transport.describe();
    }

    public int getVertexMaxAttempts() {
        return vertexMaxAttempts;
    }

    public int getEdgeMaxAttempts() {
        return edgeMaxAttempts;
    }

    @Override
    public void close() {
        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing query transport", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private QueryTransport transport;
        private int vertexMaxAttempts = DEFAULT_VERTEX_MAX_ATTEMPTS;
        private int edgeMaxAttempts = DEFAULT_EDGE_MAX_ATTEMPTS;
        private BackoffPolicy backoffPolicy;
        private Sleeper sleeper;
        private MetricsService metricsService;

        public Builder transport(QueryTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Attempts per vertex upsert, the first one included.
         */
        public Builder vertexMaxAttempts(int vertexMaxAttempts) {
            if (vertexMaxAttempts < 1) throw new IllegalArgumentException("vertexMaxAttempts must be at least 1");
            this.vertexMaxAttempts = vertexMaxAttempts;
            return this;
        }

        /**
         * Attempts per edge upsert, the first one included.
         */
        public Builder edgeMaxAttempts(int edgeMaxAttempts) {
            if (edgeMaxAttempts < 1) throw new IllegalArgumentException("edgeMaxAttempts must be at least 1");
            this.edgeMaxAttempts = edgeMaxAttempts;
            return this;
        }

        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public NeptuneEndpointClient build() {
            return new NeptuneEndpointClient(this);
        }
    }
}
