package com.lineage.sync.api;

import com.lineage.sync.core.model.MergedGraph;
import com.lineage.sync.core.model.SourceLineage;
import com.lineage.sync.graph.BackoffPolicy;
import com.lineage.sync.graph.EndpointOptions;
import com.lineage.sync.graph.HttpQueryTransport;
import com.lineage.sync.graph.NeptuneEndpointClient;
import com.lineage.sync.graph.QueryTransport;
import com.lineage.sync.graph.RequestSigner;
import com.lineage.sync.graph.SigV4RequestSigner;
import com.lineage.sync.graph.Sleeper;
import com.lineage.sync.logging.LogContext;
import com.lineage.sync.manifest.ManifestReader;
import com.lineage.sync.manifest.ManifestSource;
import com.lineage.sync.merge.LineageMerger;
import com.lineage.sync.metrics.MetricsService;
import com.lineage.sync.metrics.NoOpMetricsService;
import com.lineage.sync.report.LineageReportWriter;
import com.lineage.sync.report.ReportFiles;
import com.lineage.sync.sync.BatchScheduler;
import com.lineage.sync.sync.ProgressCallback;
import com.lineage.sync.sync.SyncOptions;
import com.lineage.sync.sync.SyncResult;
import com.lineage.sync.sync.SyncSession;
import com.lineage.sync.tracing.NoOpTracingService;
import com.lineage.sync.tracing.Span;
import com.lineage.sync.tracing.TracingService;
import com.lineage.sync.verify.GraphVerifier;
import com.lineage.sync.verify.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point: reads the source documents, merges them, writes the reports
 * and replicates the merged graph into the store.
 *
 * <pre>
 * SyncReport report = LineageSynchronizer.builder()
 *         .dataDirectory(Path.of("raw_data"))
 *         .endpoint("my-cluster.cluster-abc.us-east-1.neptune.amazonaws.com")
 *         .region("us-east-1")
 *         .build()
 *         .run();
 * </pre>
 *
 * <p>Configuration problems surface from {@link Builder#build()}; unreadable
 * input and a failed clear surface from {@link #run()}. Individual write
 * failures never do; they are counted in the returned report.</p>
 */
public class LineageSynchronizer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LineageSynchronizer.class);

    private final Path dataDirectory;
    private final List<ManifestSource> sources;
    private final Path reportDirectory;
    private final SyncOptions options;
    private final ManifestReader manifestReader;
    private final LineageMerger merger;
    private final LineageReportWriter reportWriter;
    private final NeptuneEndpointClient client;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ProgressCallback progressCallback;
    private final Sleeper sleeper;

    private LineageSynchronizer(Builder builder, NeptuneEndpointClient client) {
        this.dataDirectory = builder.dataDirectory;
        this.sources = builder.sources;
        this.reportDirectory = builder.reportDirectory != null ? builder.reportDirectory : builder.dataDirectory;
        this.options = builder.options;
        this.manifestReader = builder.manifestReader != null ? builder.manifestReader : ManifestReader.builder().build();
        this.merger = new LineageMerger();
        this.reportWriter = builder.reportWriter != null ? builder.reportWriter : new LineageReportWriter();
        this.client = client;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.progressCallback = builder.progressCallback;
        this.sleeper = builder.sleeper;
    }

    /**
     * Performs one complete run.
     *
     * @throws com.lineage.sync.manifest.ManifestException if the input cannot be read or merged
     * @throws com.lineage.sync.sync.GraphClearException   if the store cannot be cleared
     */
    public SyncReport run() {
        SyncSession session = new SyncSession();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(session.getRunId());
             Span span = tracingService.startSpan(TracingService.RUN_SPAN, Map.of("runId", session.getRunId()))) {
            try {
                SyncReport report = execute(session, span);
                span.setStatus(report.isFullySynchronized() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
                return report;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("sync.aborted runId={} error={}", session.getRunId(), e.getMessage());
                throw e;
            } finally {
                metricsService.recordRunDuration(Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    private SyncReport execute(SyncSession session, Span span) {
        List<ManifestSource> inputs = sources != null ? sources : ManifestSource.discover(dataDirectory);
        log.info("sync.input runId={} sources={}", session.getRunId(),
                inputs.stream().map(ManifestSource::sourceTag).toList());

        List<SourceLineage> lineages = manifestReader.readAll(inputs);
        MergedGraph graph = merger.merge(lineages);
        span.setAttribute("nodes", graph.nodeCount());
        span.setAttribute("edges", graph.edgeCount());
        span.addEvent("merged");

        ReportFiles reports = ReportFiles.none();
        if (options.isWriteReports() && reportDirectory != null) {
            reports = reportWriter.write(graph, reportDirectory);
        }

        BatchScheduler scheduler = BatchScheduler.builder()
                .client(client)
                .options(options)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .progressCallback(progressCallback)
                .sleeper(sleeper)
                .build();
        SyncResult result = scheduler.synchronize(graph, session);
        span.addEvent("written");

        Optional<VerificationReport> verification = Optional.empty();
        if (options.isVerifyAfterSync() && !result.statistics().cancelled()) {
            verification = Optional.of(new GraphVerifier(client, options.getSampleSize()).verify(graph));
        }

        log.info("sync.completed runId={} edgesUpserted={} unresolved={} cancelled={}",
                session.getRunId(), result.statistics().edgesUpserted(),
                result.recovery().unresolved().size(), result.statistics().cancelled());
        return new SyncReport(session.getRunId(), graph, result.statistics(), verification, reports,
                result.recovery().unresolved());
    }

    @Override
    public void close() {
        client.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path dataDirectory;
        private List<ManifestSource> sources;
        private Path reportDirectory;
        private String endpoint;
        private String region;
        private Duration requestTimeout;
        private RequestSigner requestSigner;
        private QueryTransport transport;
        private SyncOptions options = SyncOptions.defaults();
        private ManifestReader manifestReader;
        private LineageReportWriter reportWriter;
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private ProgressCallback progressCallback = ProgressCallback.NOOP;
        private Sleeper sleeper = Sleeper.SYSTEM;

        /**
         * Directory holding {@code <tag>_manifest.json} / {@code <tag>_lineage_map.json}
         * files. Reports are written here unless {@link #reportDirectory(Path)} is set.
         */
        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        /**
         * Explicit source documents, instead of discovering them in the data directory.
         */
        public Builder sources(List<ManifestSource> sources) {
            this.sources = sources != null ? List.copyOf(sources) : null;
            return this;
        }

        public Builder reportDirectory(Path reportDirectory) {
            this.reportDirectory = reportDirectory;
            return this;
        }

        /**
         * Bare host name or full {@code https://} URL of the Gremlin endpoint.
         */
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * AWS region used to sign requests.
         */
        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Overrides the SigV4 signer, e.g. for a store without IAM authentication.
         */
        public Builder requestSigner(RequestSigner requestSigner) {
            this.requestSigner = requestSigner;
            return this;
        }

        /**
         * Uses the given transport instead of HTTPS; endpoint and region are then ignored.
         */
        public Builder transport(QueryTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder options(SyncOptions options) {
            this.options = options;
            return this;
        }

        public Builder manifestReader(ManifestReader manifestReader) {
            this.manifestReader = manifestReader;
            return this;
        }

        public Builder reportWriter(LineageReportWriter reportWriter) {
            this.reportWriter = reportWriter;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        /**
         * Used for batch pacing and conflict backoff.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * @throws IllegalStateException                                  if no input is configured
         * @throws com.lineage.sync.graph.EndpointConfigurationException if the endpoint is invalid
         */
        public LineageSynchronizer build() {
            if (dataDirectory == null && (sources == null || sources.isEmpty())) {
                throw new IllegalStateException("Either dataDirectory or sources is required");
            }
            if (options == null) {
                options = SyncOptions.defaults();
            }

            QueryTransport queryTransport = transport;
            if (queryTransport == null) {
                EndpointOptions.Builder endpointOptions = EndpointOptions.builder()
                        .endpoint(endpoint)
                        .region(region);
                if (requestTimeout != null) {
                    endpointOptions.requestTimeout(requestTimeout);
                }
                EndpointOptions resolved = endpointOptions.build();
                RequestSigner signer = requestSigner != null
                        ? requestSigner
                        : new SigV4RequestSigner(region, resolved.getServiceName());
                queryTransport = new HttpQueryTransport(resolved, signer);
            }

            NeptuneEndpointClient client = NeptuneEndpointClient.builder()
                    .transport(queryTransport)
                    .vertexMaxAttempts(options.getVertexMaxAttempts())
                    .edgeMaxAttempts(options.getEdgeMaxAttempts())
                    .backoffPolicy(new BackoffPolicy(options.getBackoffBase(), options.getBackoffJitter(),
                            new SecureRandom()))
                    .sleeper(sleeper)
                    .metricsService(metricsService)
                    .build();
            return new LineageSynchronizer(this, client);
        }
    }
}
