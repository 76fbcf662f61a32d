package com.lineage.sync.api;

import com.lineage.sync.chaos.ChaosQueryTransport;
import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.graph.EndpointConfigurationException;
import com.lineage.sync.graph.GraphQuery;
import com.lineage.sync.graph.InMemoryGremlinTransport;
import com.lineage.sync.graph.RequestSigner;
import com.lineage.sync.manifest.ManifestException;
import com.lineage.sync.manifest.ManifestSource;
import com.lineage.sync.metrics.MicrometerMetricsService;
import com.lineage.sync.sync.GraphClearException;
import com.lineage.sync.sync.SyncOptions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LineageSynchronizer Tests")
class LineageSynchronizerTest {

    @TempDir
    Path dataDir;

    @TempDir
    Path reportDir;

    private InMemoryGremlinTransport store;

    @BeforeEach
    void setUp() throws IOException {
        store = new InMemoryGremlinTransport();
        Files.writeString(dataDir.resolve("athena_lineage_map.json"),
                "{\"lineage_map\": {\"orders\": [\"daily_sales\", \"returns\"]}}");
        Files.writeString(dataDir.resolve("redshift_manifest.json"),
                "{\"child_map\": {\"model.shop.orders\": [\"model.shop.daily_sales\"], \"model.shop.refunds\": []}}");
    }

    private LineageSynchronizer catalogSynchronizer(Path glue, Path redshift) {
        return LineageSynchronizer.builder()
                .sources(List.of(ManifestSource.of("glue", glue), ManifestSource.of("redshift", redshift)))
                .transport(store)
                .sleeper(d -> { })
                .options(SyncOptions.builder().writeReports(false).build())
                .build();
    }

    private LineageSynchronizer.Builder synchronizer() {
        return LineageSynchronizer.builder()
                .dataDirectory(dataDir)
                .reportDirectory(reportDir)
                .transport(store)
                .sleeper(d -> { });
    }

    // ========== End to end ==========

    @Nested
    @DisplayName("End to end")
    class EndToEnd {

        @Test
        @DisplayName("Discovers, merges, writes, verifies and reports")
        void fullRun() throws IOException {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            SyncReport report;
            try (LineageSynchronizer sync = synchronizer()
                    .metricsService(new MicrometerMetricsService(registry))
                    .build()) {
                report = sync.run();
            }

            assertTrue(report.isFullySynchronized());
            assertNotNull(report.runId());
            assertEquals(4, report.graph().nodeCount());
            assertEquals(2, report.graph().edgeCount());
            assertEquals(4, store.vertexCount());
            assertEquals(2, store.edgeCount());
            assertEquals("athena,redshift", store.vertexProperties("daily_sales").get("source_type"));
            assertEquals("redshift", store.vertexProperties("refunds").get("source_type"));

            VerificationReportAssertions.assertCounts(report, 4, 2);
            assertTrue(report.reports().json().isPresent());
            assertTrue(report.reports().csv().isPresent());
            try (var files = Files.list(reportDir)) {
                assertEquals(2, files.count());
            }
            assertEquals(1, registry.get("lineage.sync.run.duration").timer().count());
        }

        @Test
        @DisplayName("A second run without clearing leaves the store unchanged")
        void idempotentRerun() {
            SyncOptions noClear = SyncOptions.builder().clearBeforeSync(false).writeReports(false).build();

            synchronizer().options(noClear).build().run();
            SyncReport second = synchronizer().options(noClear).build().run();

            assertEquals(4, store.vertexCount());
            assertEquals(2, store.edgeCount());
            assertTrue(second.isFullySynchronized());
            VerificationReportAssertions.assertCounts(second, 4, 2);
        }

        @Test
        @DisplayName("Explicit sources replace discovery")
        void explicitSources() {
            SyncReport report = LineageSynchronizer.builder()
                    .sources(List.of(
                            ManifestSource.of("athena", dataDir.resolve("athena_lineage_map.json")),
                            ManifestSource.of("glue", dataDir.resolve("redshift_manifest.json"))))
                    .transport(store)
                    .sleeper(d -> { })
                    .options(SyncOptions.builder().writeReports(false).build())
                    .build()
                    .run();

            assertEquals("athena,glue", store.vertexProperties("orders").get("source_type"));
            assertTrue(report.reports().json().isEmpty());
        }

        @Test
        @DisplayName("Overlong and control-character attributes do not cost a node its vertex or edges")
        void awkwardAttributes() throws IOException {
            Path glue = Files.writeString(dataDir.resolve("glue_catalog.json"), "{\"lineage\": {" +
                    "\"db.orders\": {\"downstream\": [\"db.daily\"]," +
                    " \"schema\": {\"description\": \"" + "x".repeat(4500) + "\"}}}}");
            Path redshift = Files.writeString(dataDir.resolve("redshift_catalog.json"), "{\"lineage\": {" +
                    "\"db.daily\": {\"schema\": {\"comment\": \"nightly\\u0001rollup\"}}}}");

            SyncReport report = catalogSynchronizer(glue, redshift).run();

            assertTrue(report.isFullySynchronized());
            assertEquals(2, store.vertexCount());
            assertEquals(1, store.edgeCount());
            assertTrue(store.hasEdge("db.orders", "db.daily"));
            assertEquals(4000, ((String) store.vertexProperties("db.orders").get("description")).length());
            assertEquals("nightly\u0001rollup", store.vertexProperties("db.daily").get("comment"));
        }

        @Test
        @DisplayName("Column lineage from catalog exports is written with its columns")
        void columnLineage() throws IOException {
            Path glue = Files.writeString(dataDir.resolve("glue_catalog.json"), "{\"lineage\": {" +
                    "\"db.orders\": {\"downstream\": [\"db.daily\"], \"schema\": {\"fields\": [" +
                    "{\"name\": \"id\", \"type\": \"long\"}, {\"name\": \"amount\", \"type\": \"double\"}]}}}," +
                    "\"column_lineage\": {\"db.daily.total\": [{\"source_table\": \"db.orders\"," +
                    " \"source_column\": \"amount\", \"transformation\": \"sum\"}]}}");
            Path redshift = Files.writeString(dataDir.resolve("redshift_catalog.json"), "{\"lineage\": {" +
                    "\"db.daily\": {\"schema\": {\"fields\": [{\"name\": \"total\", \"type\": \"character varying\"}]}}}}");

            SyncReport report = catalogSynchronizer(glue, redshift).run();

            assertTrue(report.isFullySynchronized());
            assertEquals(3, report.statistics().totalColumns());
            assertEquals(2, store.vertexCount("lineage_node"));
            assertEquals(3, store.vertexCount("column"));
            assertEquals(3, store.edgeCount("has_column"));
            String amount = new ColumnKey("db.orders", "amount").columnId();
            String total = new ColumnKey("db.daily", "total").columnId();
            assertEquals("sum", store.columnLineageProperties(amount, total).get("transformation"));
            assertEquals("glue,redshift", store.columnProperties(total).get("source_type"));
            assertEquals("varchar", store.columnProperties(total).get("data_type"));
            assertEquals(OptionalLong.of(3), report.verification().get().columnCount());
            assertEquals(OptionalLong.of(1), report.verification().get().columnLineageEdgeCount());
            VerificationReportAssertions.assertCounts(report, 2, 1);
        }

        @Test
        @DisplayName("Verification can be disabled")
        void noVerification() {
            SyncReport report = synchronizer()
                    .options(SyncOptions.builder().verifyAfterSync(false).build())
                    .build()
                    .run();

            assertTrue(report.verification().isEmpty());
            assertEquals(0, store.submitCount(GraphQuery.Kind.SAMPLE_VERTICES));
        }

        @Test
        @DisplayName("Unresolved failures are reported, not thrown")
        void unresolvedReported() {
            ChaosQueryTransport chaos = new ChaosQueryTransport(store);
            chaos.failAlways("refunds");

            SyncReport report = synchronizer().transport(chaos).build().run();

            assertFalse(report.isFullySynchronized());
            assertEquals(1, report.unresolved().size());
            assertEquals(1, report.statistics().failures());
            assertEquals(3, store.vertexCount());
        }
    }

    // ========== Failures ==========

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Malformed input aborts before any write")
        void malformedInput() throws IOException {
            Files.writeString(dataDir.resolve("athena_lineage_map.json"), "{\"lineage_map\": [");

            assertThrows(ManifestException.class, () -> synchronizer().build().run());
            assertTrue(store.submitted().isEmpty());
        }

        @Test
        @DisplayName("A single source is refused")
        void singleSource() throws IOException {
            Files.delete(dataDir.resolve("redshift_manifest.json"));
            assertThrows(ManifestException.class, () -> synchronizer().build().run());
        }

        @Test
        @DisplayName("A failed clear is fatal")
        void clearFailure() {
            ChaosQueryTransport chaos = new ChaosQueryTransport(store);
            chaos.reject(GraphQuery.Kind.DROP_ALL);

            assertThrows(GraphClearException.class, () -> synchronizer().transport(chaos).build().run());
            assertEquals(0, store.vertexCount());
        }

        @Test
        @DisplayName("Builder requires input")
        void requiresInput() {
            assertThrows(IllegalStateException.class,
                    () -> LineageSynchronizer.builder().transport(store).build());
        }

        @Test
        @DisplayName("Builder refuses a plain http endpoint")
        void refusesHttp() {
            assertThrows(EndpointConfigurationException.class, () -> LineageSynchronizer.builder()
                    .dataDirectory(dataDir)
                    .endpoint("http://graph.internal:8182/gremlin")
                    .requestSigner(RequestSigner.UNSIGNED)
                    .build());
        }

        @Test
        @DisplayName("Builder accepts an https endpoint with a custom signer")
        void acceptsHttps() {
            assertDoesNotThrow(() -> LineageSynchronizer.builder()
                    .dataDirectory(dataDir)
                    .endpoint("graph.internal")
                    .requestSigner(RequestSigner.UNSIGNED)
                    .build()
                    .close());
        }
    }

    private static final class VerificationReportAssertions {

        static void assertCounts(SyncReport report, long vertices, long edges) {
            assertTrue(report.verification().isPresent());
            assertEquals(OptionalLong.of(vertices), report.verification().get().vertexCount());
            assertEquals(OptionalLong.of(edges), report.verification().get().edgeCount());
        }
    }
}
