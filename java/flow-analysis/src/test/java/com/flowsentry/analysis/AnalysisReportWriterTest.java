package com.flowsentry.analysis;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisReportWriterTest {

    private final AnalysisReportWriter writer = new AnalysisReportWriter();
    private WorkspaceAnalysisResult result;

    @BeforeEach
    void setUp() throws CfgFormatException {
        result = new DataflowAnalyzer(AnalysisConfig.defaults()).analyze(CfgDocumentReaderTest.fixture("command.cfg.json"));
    }

    @Test
    void reportHasEverySection() {
        Map<String, Object> report = writer.buildReport(result);

        assertEquals(Arrays.asList("summary", "config", "files", "functions", "vulnerabilities", "call_graph",
            "interprocedural_definitions", "diagnostics"), new ArrayList<>(report.keySet()));
    }

    @Test
    void jsonCarriesFunctionsAndVulnerabilities() {
        JsonObject json = JsonParser.parseString(writer.toJson(result)).getAsJsonObject();

        JsonObject summary = json.getAsJsonObject("summary");
        assertEquals(1, summary.get("files_analyzed").getAsInt());
        assertEquals(2, summary.get("functions_analyzed").getAsInt());
        assertEquals(1, summary.get("vulnerability_count").getAsInt());
        assertEquals("precise", json.getAsJsonObject("config").get("sensitivity").getAsString());

        JsonObject main = json.getAsJsonObject("functions").getAsJsonObject("main");
        assertEquals("src/command.c", main.get("file").getAsString());
        assertTrue(main.getAsJsonObject("liveness").get("converged").getAsBoolean());
        JsonObject entry = main.getAsJsonObject("reaching_definitions").getAsJsonObject("blocks").getAsJsonObject("0");
        assertTrue(entry.getAsJsonObject("out").has("cmd"));
        assertFalse(main.getAsJsonArray("taint_facts").isEmpty());

        JsonArray vulnerabilities = json.getAsJsonArray("vulnerabilities");
        assertEquals(1, vulnerabilities.size());
        JsonObject vulnerability = vulnerabilities.get(0).getAsJsonObject();
        assertEquals("code_injection", vulnerability.get("type").getAsString());
        assertEquals("system", vulnerability.get("sink_function").getAsString());
        assertEquals("line", vulnerability.get("tainted_variable").getAsString());
        assertFalse(vulnerability.getAsJsonArray("path").isEmpty());

        JsonObject callGraph = json.getAsJsonObject("call_graph");
        assertEquals(3, callGraph.getAsJsonArray("functions").size());
        assertTrue(callGraph.get("dot").getAsString().startsWith("digraph CallGraphAnalysis {"));
        assertTrue(json.getAsJsonArray("diagnostics").isEmpty());
    }

    @Test
    void writesReportAndSummaryFiles(@TempDir Path dir) throws IOException {
        Path report = dir.resolve("nested/report.json");
        Path summaryFile = dir.resolve("summary.json");
        Map<String, WorkspaceAnalysisResult> results = new LinkedHashMap<>();
        results.put("command.cfg.json", result);

        writer.write(result, report);
        writer.writeSummary(results, summaryFile);

        JsonObject written = JsonParser.parseString(new String(Files.readAllBytes(report), StandardCharsets.UTF_8))
            .getAsJsonObject();
        assertTrue(written.has("functions"));
        JsonObject summary = JsonParser.parseString(new String(Files.readAllBytes(summaryFile), StandardCharsets.UTF_8))
            .getAsJsonObject();
        assertEquals(1, summary.get("documents_analyzed").getAsInt());
        assertEquals(2, summary.get("functions_analyzed").getAsInt());
        assertEquals(1, summary.get("vulnerability_count").getAsInt());
        assertEquals("command.cfg.json", summary.getAsJsonArray("vulnerabilities").get(0).getAsJsonObject()
            .get("document").getAsString());
        assertTrue(summary.getAsJsonObject("documents").has("command.cfg.json"));
    }
}
