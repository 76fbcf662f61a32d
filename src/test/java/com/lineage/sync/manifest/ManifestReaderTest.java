package com.lineage.sync.manifest;

import com.lineage.sync.core.model.ColumnKey;
import com.lineage.sync.core.model.ColumnMapping;
import com.lineage.sync.core.model.SourceLineage;
import com.lineage.sync.graph.QuerySanitizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ManifestReader Tests")
class ManifestReaderTest {

    private final ManifestReader reader = ManifestReader.builder().build();

    private SourceLineage read(String tag, String json) {
        return reader.read(tag, new StringReader(json));
    }

    @Nested
    @DisplayName("Pre-merged lineage map")
    class LineageMapFormat {

        @Test
        @DisplayName("Is used verbatim")
        void verbatim() {
            SourceLineage lineage = read("athena",
                    "{\"lineage_map\": {\"db.orders\": [\"db.daily_sales\"], \"db.daily_sales\": []}}");

            assertEquals("athena", lineage.getSourceTag());
            assertEquals(List.of("db.daily_sales"), lineage.getAdjacency().get("db.orders"));
            assertEquals(List.of(), lineage.getAdjacency().get("db.daily_sales"));
        }

        @Test
        @DisplayName("Duplicate children are dropped")
        void duplicateChildrenDropped() {
            SourceLineage lineage = read("athena", "{\"lineage_map\": {\"a\": [\"b\", \"b\", \"c\"]}}");
            assertEquals(List.of("b", "c"), lineage.getAdjacency().get("a"));
        }
    }

    @Nested
    @DisplayName("dbt child map")
    class ChildMapFormat {

        @Test
        @DisplayName("Identifiers are reduced to their last segment")
        void lastSegment() {
            SourceLineage lineage = read("dbt", "{\"child_map\": {" +
                    "\"model.shop.orders\": [\"model.shop.daily_sales\"]," +
                    "\"model.shop.daily_sales\": []}}");

            assertEquals(List.of("daily_sales"), lineage.getAdjacency().get("orders"));
            assertTrue(lineage.getAdjacency().containsKey("daily_sales"));
        }

        @Test
        @DisplayName("Keys colliding after normalization have their children unioned")
        void collidingKeysUnioned() {
            SourceLineage lineage = read("dbt", "{\"child_map\": {" +
                    "\"model.shop.orders\": [\"model.shop.a\"]," +
                    "\"seed.shop.orders\": [\"model.shop.b\", \"model.shop.a\"]}}");

            assertEquals(List.of("a", "b"), lineage.getAdjacency().get("orders"));
            assertEquals(1, lineage.nodeCount());
        }

        @Test
        @DisplayName("Custom normalizer is applied")
        void customNormalizer() {
            ManifestReader identity = ManifestReader.builder()
                    .childMapNormalizer(NodeNameNormalizer.IDENTITY)
                    .build();
            SourceLineage lineage = identity.read("dbt",
                    new StringReader("{\"child_map\": {\"model.shop.orders\": []}}"));
            assertTrue(lineage.getAdjacency().containsKey("model.shop.orders"));
        }
    }

    @Nested
    @DisplayName("Catalog lineage export")
    class CatalogFormat {

        private static final String DOCUMENT = "{" +
                "\"lineage\": {" +
                "  \"analytics.orders\": {" +
                "    \"downstream\": [\"analytics.daily_sales\", \"s3://bucket/exports/orders\"]," +
                "    \"schema\": {" +
                "      \"schema\": \"analytics\", \"table\": \"orders\", \"owner\": \"data-team\"," +
                "      \"fields\": [" +
                "        {\"name\": \"id\", \"type\": \"long\", \"nullable\": false}," +
                "        {\"name\": \"amount\", \"type\": \"DECIMAL\", \"precision\": 12, \"scale\": 2}]," +
                "      \"statistics\": {\"row_count\": 1200, \"size_mb\": 3.5, \"tags\": [\"pii\"]}" +
                "    }" +
                "  }," +
                "  \"analytics.daily_sales\": {\"downstream\": []}," +
                "  \"s3://bucket/exports/orders\": {}" +
                "}," +
                "\"column_lineage\": {" +
                "  \"analytics.daily_sales.order_id\": [" +
                "    {\"source_table\": \"analytics.orders\", \"source_column\": \"id\", \"transformation\": \"cast\"}]," +
                "  \"analytics.daily_sales.total\": \"analytics.orders.amount\"," +
                "  \"not_qualified\": [\"analytics.orders.id\"]," +
                "  \"analytics.daily_sales.net\": [{\"source_table\": \"analytics.orders\"}]" +
                "}" +
                "}";

        @Test
        @DisplayName("Downstream lists become children")
        void downstreamBecomesChildren() {
            SourceLineage lineage = read("glue", DOCUMENT);
            assertEquals(List.of("analytics.daily_sales", "s3://bucket/exports/orders"),
                    lineage.getAdjacency().get("analytics.orders"));
            assertEquals(3, lineage.nodeCount());
        }

        @Test
        @DisplayName("Scalar schema and statistics entries become attributes")
        void schemaAttributes() {
            Map<String, Object> attrs = read("glue", DOCUMENT).getAttributes().get("analytics.orders");

            assertEquals("table", attrs.get("dataset_type"));
            assertEquals("analytics", attrs.get("schema_name"));
            assertEquals("orders", attrs.get("table_name"));
            assertEquals("data-team", attrs.get("owner"));
            assertEquals(2, attrs.get("column_count"));
            assertEquals(1200L, attrs.get("row_count"));
            assertEquals(3.5, attrs.get("size_mb"));
            assertFalse(attrs.containsKey("tags"));
        }

        @Test
        @DisplayName("Schema fields become columns with standardized types")
        void fieldsBecomeColumns() {
            Map<ColumnKey, Map<String, Object>> columns = read("glue", DOCUMENT).getColumns();

            assertEquals(2, columns.size());
            Map<String, Object> id = columns.get(new ColumnKey("analytics.orders", "id"));
            assertEquals("bigint", id.get("data_type"));
            assertEquals(false, id.get("nullable"));
            Map<String, Object> amount = columns.get(new ColumnKey("analytics.orders", "amount"));
            assertEquals("decimal", amount.get("data_type"));
            assertEquals(true, amount.get("nullable"));
            assertEquals(12L, amount.get("precision"));
            assertEquals(2L, amount.get("scale"));
        }

        @Test
        @DisplayName("Column lineage is keyed by target column; unusable entries are skipped")
        void columnLineage() {
            List<ColumnMapping> mappings = read("glue", DOCUMENT).getColumnMappings();

            assertEquals(2, mappings.size());
            ColumnMapping cast = mappings.get(0);
            assertEquals(new ColumnKey("analytics.orders", "id"), cast.source());
            assertEquals(new ColumnKey("analytics.daily_sales", "order_id"), cast.target());
            assertEquals("cast", cast.transformation());
            ColumnMapping total = mappings.get(1);
            assertEquals(new ColumnKey("analytics.orders", "amount"), total.source());
            assertEquals(new ColumnKey("analytics.daily_sales", "total"), total.target());
            assertEquals(ColumnMapping.DIRECT, total.transformation());
        }

        @Test
        @DisplayName("Overlong attribute strings are truncated")
        void longAttributesTruncated() {
            String description = "d".repeat(4500);
            SourceLineage lineage = read("glue", "{\"lineage\": {\"db.orders\": " +
                    "{\"schema\": {\"description\": \"" + description + "\"}}}}");

            String stored = (String) lineage.getAttributes().get("db.orders").get("description");
            assertEquals(QuerySanitizer.MAX_ATTRIBUTE_LENGTH, stored.length());
        }

        @Test
        @DisplayName("A field without a name is rejected")
        void unnamedField() {
            assertThrows(ManifestException.class, () -> read("glue",
                    "{\"lineage\": {\"db.orders\": {\"schema\": {\"fields\": [{\"type\": \"int\"}]}}}}"));
        }

        @Test
        @DisplayName("Dataset type is derived from the identifier")
        void datasetType() {
            Map<String, Map<String, Object>> attrs = read("glue", DOCUMENT).getAttributes();
            assertEquals("s3", attrs.get("s3://bucket/exports/orders").get("dataset_type"));
            assertEquals("unknown", ManifestReader.datasetType("orders"));
        }
    }

    @Test
    @DisplayName("Identifiers with control characters are kept as they are")
    void controlCharactersAccepted() {
        SourceLineage lineage = read("athena", "{\"lineage_map\": {\"a\\u0001b\": []}}");
        assertTrue(lineage.getAdjacency().containsKey("a\u0001b"));
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Malformed JSON")
        void malformedJson() {
            assertThrows(ManifestException.class, () -> read("athena", "{\"lineage_map\": {"));
        }

        @Test
        @DisplayName("No recognized root key")
        void unknownFormat() {
            ManifestException e = assertThrows(ManifestException.class,
                    () -> read("athena", "{\"nodes\": []}"));
            assertTrue(e.getMessage().contains("athena"));
        }

        @Test
        @DisplayName("Children that are not an array")
        void childrenNotArray() {
            assertThrows(ManifestException.class,
                    () -> read("athena", "{\"lineage_map\": {\"a\": \"b\"}}"));
        }

        @Test
        @DisplayName("Child that is not a string")
        void childNotString() {
            assertThrows(ManifestException.class,
                    () -> read("athena", "{\"lineage_map\": {\"a\": [1]}}"));
        }

        @Test
        @DisplayName("Blank identifier")
        void blankIdentifier() {
            assertThrows(ManifestException.class,
                    () -> read("athena", "{\"lineage_map\": {\"a\": [\" \"]}}"));
        }

        @Test
        @DisplayName("Missing file")
        void missingFile(@TempDir Path dir) {
            ManifestSource source = ManifestSource.of("athena", dir.resolve("athena_lineage_map.json"));
            assertThrows(ManifestException.class, () -> reader.read(source));
        }

        @Test
        @DisplayName("Fewer than two sources")
        void fewerThanTwoSources(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("athena_lineage_map.json"), "{\"lineage_map\": {}}");
            assertThrows(ManifestException.class,
                    () -> reader.readAll(List.of(ManifestSource.of("athena", file))));
        }
    }

    @Test
    @DisplayName("Reads files from disk in the given order")
    void readAllFromDisk(@TempDir Path dir) throws IOException {
        Path athena = Files.writeString(dir.resolve("athena_lineage_map.json"),
                "{\"lineage_map\": {\"orders\": [\"daily_sales\"]}}");
        Path redshift = Files.writeString(dir.resolve("redshift_manifest.json"),
                "{\"child_map\": {\"model.x.daily_sales\": []}}");

        List<SourceLineage> lineages = reader.readAll(List.of(
                ManifestSource.of("athena", athena), ManifestSource.of("redshift", redshift)));

        assertEquals(2, lineages.size());
        assertEquals("athena", lineages.get(0).getSourceTag());
        assertTrue(lineages.get(1).getAdjacency().containsKey("daily_sales"));
    }
}
