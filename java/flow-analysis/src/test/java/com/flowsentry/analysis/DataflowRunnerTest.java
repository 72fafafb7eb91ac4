package com.flowsentry.analysis;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataflowRunnerTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return DataflowRunner.run(args, new PrintStream(out, true), new PrintStream(err, true));
    }

    private static String fixture() {
        return CfgDocumentReaderTest.fixture("command.cfg.json").toString();
    }

    @Test
    void missingCfgPrintsUsage() {
        assertEquals(DataflowRunner.EXIT_USAGE, run());
        assertTrue(err.toString().contains("Usage"));
        assertEquals(DataflowRunner.EXIT_USAGE, run("--cfg"));
        assertEquals(DataflowRunner.EXIT_USAGE, run("--cfg", "a.json", "--verbose"));
    }

    @Test
    void unreadableDocumentFails(@TempDir Path dir) {
        assertEquals(DataflowRunner.EXIT_FAILURE, run("--cfg", dir.resolve("absent.json").toString()));
        assertTrue(err.toString().contains("Failed to load"));
    }

    @Test
    void badContextDepthIsAUsageError() {
        assertEquals(DataflowRunner.EXIT_USAGE, run("--cfg", fixture(), "--context-depth", "0"));
        assertEquals(DataflowRunner.EXIT_USAGE, run("--cfg", fixture(), "--context-depth", "two"));
    }

    @Test
    void printsReportToStdout() {
        assertEquals(DataflowRunner.EXIT_OK, run("--cfg", fixture()));

        JsonObject report = JsonParser.parseString(new String(out.toByteArray(), StandardCharsets.UTF_8))
            .getAsJsonObject();
        assertEquals(1, report.getAsJsonArray("vulnerabilities").size());
        assertEquals("precise", report.getAsJsonObject("config").get("sensitivity").getAsString());
    }

    @Test
    void writesReportAndDotFiles(@TempDir Path dir) throws IOException {
        Path report = dir.resolve("out/report.json");
        Path dot = dir.resolve("out/calls.dot");

        int status = run("--cfg", fixture(), "--out", report.toString(), "--dot", dot.toString(),
            "--sensitivity", "minimal", "--no-liveness");

        assertEquals(DataflowRunner.EXIT_OK, status);
        assertEquals(0, out.size());
        JsonObject json = JsonParser.parseString(new String(Files.readAllBytes(report), StandardCharsets.UTF_8))
            .getAsJsonObject();
        assertEquals("minimal", json.getAsJsonObject("config").get("sensitivity").getAsString());
        assertFalse(json.getAsJsonObject("config").get("liveness").getAsBoolean());
        assertTrue(new String(Files.readAllBytes(dot), StandardCharsets.UTF_8).startsWith("digraph CallGraphAnalysis {"));
    }

    @Test
    void unknownSensitivityStillRunsAtPrecise() {
        assertEquals(DataflowRunner.EXIT_OK, run("--cfg", fixture(), "--sensitivity", "paranoid"));

        JsonObject report = JsonParser.parseString(new String(out.toByteArray(), StandardCharsets.UTF_8))
            .getAsJsonObject();
        assertEquals("precise", report.getAsJsonObject("config").get("sensitivity").getAsString());
        assertEquals(1, report.getAsJsonObject("summary").get("errors").getAsInt());
    }

    @Test
    void propertiesFileIsOverriddenByFlags(@TempDir Path dir) throws IOException {
        Path properties = dir.resolve("flowsentry.properties");
        Files.write(properties, "flowsentry.sensitivity=balanced\nflowsentry.contextDepth=2\n"
            .getBytes(StandardCharsets.ISO_8859_1));
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();

        Map<String, String> options = DataflowRunner.parseArgs(new String[] {
            "--cfg", "x.json", "--config", properties.toString(), "--context-depth", "3", "--no-callgraph"});
        AnalysisConfig config = DataflowRunner.buildConfig(options, diagnostics);

        assertEquals(SensitivityLevel.BALANCED, config.getSensitivity());
        assertEquals(3, config.getContextDepth());
        assertFalse(config.isCallGraphEnabled());
        assertTrue(diagnostics.getAll().isEmpty());
    }

    @Test
    void parsesSwitchesWithoutValues() {
        Map<String, String> options = DataflowRunner.parseArgs(new String[] {"--no-rd", "--no-taint"});

        assertEquals("true", options.get("no-rd"));
        assertEquals("true", options.get("no-taint"));
        assertNull(DataflowRunner.parseArgs(new String[] {"--out"}));
        assertEquals(Collections.emptyMap(), DataflowRunner.parseArgs(new String[0]));
    }
}
