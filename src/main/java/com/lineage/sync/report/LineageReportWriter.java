package com.lineage.sync.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lineage.sync.core.model.MergedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Writes the merged graph as a JSON analysis report and a CSV node listing.
 *
 * <p>JSON layout:</p>
 * <pre>
 * {
 *   "lineage_map":  {"orders": ["daily_sales"], "daily_sales": []},
 *   "node_sources": {"orders": ["athena", "redshift"], "daily_sales": ["redshift"]},
 *   "column_lineage": {"daily_sales.total": [{"source_table": "orders", "source_column": "amount",
 *                                             "transformation": "sum"}]},
 *   "statistics":   {"total_nodes": 2, "shared_nodes": 1, "unknown_nodes": 0,
 *                    "total_columns": 2, "column_mappings": 1,
 *                    "source_only_nodes": {"athena": 0, "redshift": 1}},
 *   "timestamp":    "2024-05-01T10:15:30.123"
 * }
 * </pre>
 *
 * <p>CSV layout:</p>
 * <pre>
 * Node,Source,Children_Count
 * orders,"athena,redshift",1
 * daily_sales,redshift,0
 * </pre>
 *
 * <p>Failures are logged and reported as missing files; they never abort a run.</p>
 */
public class LineageReportWriter {
    private static final Logger log = LoggerFactory.getLogger(LineageReportWriter.class);

    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LineageReportWriter() {
        this(Clock.systemDefaultZone());
    }

    public LineageReportWriter(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    /**
     * Writes both reports into {@code directory}.
     */
    public ReportFiles write(MergedGraph graph, Path directory) {
        LocalDateTime now = LocalDateTime.now(clock);
        String stamp = now.format(FILE_TIMESTAMP);

        Path jsonFile = directory.resolve("merged_lineage_with_sources_" + stamp + ".json");
        Path csvFile = directory.resolve("lineage_sources_" + stamp + ".csv");

        Optional<Path> json = Optional.empty();
        try (Writer writer = Files.newBufferedWriter(jsonFile, StandardCharsets.UTF_8)) {
            writeJson(graph, now, writer);
            json = Optional.of(jsonFile);
            log.info("report.written format=json file={}", jsonFile);
        } catch (IOException e) {
            log.error("report.failed format=json file={} error={}", jsonFile, e.getMessage());
        }

        Optional<Path> csv = Optional.empty();
        try (Writer writer = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8)) {
            writeCsv(graph, writer);
            csv = Optional.of(csvFile);
            log.info("report.written format=csv file={}", csvFile);
        } catch (IOException e) {
            log.error("report.failed format=csv file={} error={}", csvFile, e.getMessage());
        }

        return new ReportFiles(json, csv);
    }

    /**
     * Writes the JSON report. The writer is not closed.
     */
    public void writeJson(MergedGraph graph, LocalDateTime timestamp, Writer writer) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode lineageMap = root.putObject("lineage_map");
        graph.getAdjacency().forEach((node, children) -> {
            ArrayNode array = lineageMap.putArray(node);
            children.forEach(array::add);
        });

        ObjectNode nodeSources = root.putObject("node_sources");
        graph.getProvenance().forEach((node, provenance) -> {
            ArrayNode array = nodeSources.putArray(node);
            provenance.tags().forEach(array::add);
        });

        ObjectNode columnLineage = root.putObject("column_lineage");
        graph.getColumnMappings().forEach(mapping -> {
            ArrayNode sources = columnLineage.has(mapping.target().qualifiedName())
                    ? (ArrayNode) columnLineage.get(mapping.target().qualifiedName())
                    : columnLineage.putArray(mapping.target().qualifiedName());
            ObjectNode source = sources.addObject();
            source.put("source_table", mapping.source().dataset());
            source.put("source_column", mapping.source().column());
            source.put("transformation", mapping.transformation());
        });

        ObjectNode statistics = root.putObject("statistics");
        statistics.put("total_nodes", graph.nodeCount());
        statistics.put("shared_nodes", graph.sharedCount());
        statistics.put("unknown_nodes", graph.unknownCount());
        statistics.put("total_columns", graph.columnCount());
        statistics.put("column_mappings", graph.columnMappingCount());
        // nested so that a source tag can never shadow a fixed key
        ObjectNode sourceOnly = statistics.putObject("source_only_nodes");
        graph.sourceOnlyCounts().forEach(sourceOnly::put);

        root.put("timestamp", timestamp.toString());

        objectMapper.writeValue(writer, root);
    }

    /**
     * Writes the CSV report. The writer is flushed but not closed.
     */
    public void writeCsv(MergedGraph graph, Writer writer) throws IOException {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        pw.print("Node,Source,Children_Count\n");
        graph.getAdjacency().forEach((node, children) ->
                pw.print(csvEscape(node) + "," +
                        csvEscape(graph.provenanceOf(node).label()) + "," +
                        children.size() + "\n"));
        pw.flush();
        if (pw.checkError()) {
            throw new IOException("Failed to write CSV report");
        }
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
