package com.flowsentry.maven;

import com.flowsentry.analysis.AnalysisConfig;
import com.flowsentry.analysis.AnalysisDiagnostics;
import com.flowsentry.analysis.SensitivityLevel;
import com.flowsentry.analysis.domain.PathHop;
import com.flowsentry.analysis.domain.Severity;
import com.flowsentry.analysis.domain.TaintSourceCategory;
import com.flowsentry.analysis.domain.Vulnerability;
import com.flowsentry.analysis.domain.VulnerabilityType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalyzeDataflowMojoTest {

    @Test
    void findsCfgDocumentsRecursivelyInSortedOrder(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("net"));
        Files.write(root.resolve("net/server.cfg.json"), "{}".getBytes());
        Files.write(root.resolve("app.cfg.json"), "{}".getBytes());
        Files.write(root.resolve("notes.json"), "{}".getBytes());

        List<Path> documents = AnalyzeDataflowMojo.findCfgDocuments(root);

        assertEquals(Arrays.asList(root.resolve("app.cfg.json"), root.resolve("net/server.cfg.json")), documents);
        assertEquals("net/server.cfg.json", AnalyzeDataflowMojo.documentName(root, documents.get(1)));
    }

    @Test
    void reportNamesAreFlattened() {
        assertEquals("net_server", AnalyzeDataflowMojo.reportBaseName("net/server.cfg.json"));
        assertEquals("app", AnalyzeDataflowMojo.reportBaseName("app.cfg.json"));
        assertEquals("odd_name.json", AnalyzeDataflowMojo.reportBaseName("odd name.json"));
    }

    @Test
    void parametersOverrideTheClasspathDefaults() {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();

        AnalysisConfig config = AnalyzeDataflowMojo.buildConfig("maximum", 2, diagnostics);

        assertEquals(SensitivityLevel.MAXIMUM, config.getSensitivity());
        assertEquals(2, config.getContextDepth());
        assertTrue(diagnostics.getAll().isEmpty());
    }

    @Test
    void unknownSensitivityParameterIsReported() {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();

        AnalysisConfig config = AnalyzeDataflowMojo.buildConfig("everything", 1, diagnostics);

        assertEquals(SensitivityLevel.PRECISE, config.getSensitivity());
        assertEquals(1, diagnostics.getErrors().size());
    }

    @Test
    void severityThresholdFiltersVulnerabilities() {
        List<Vulnerability> found = Arrays.asList(
            vulnerability("v1", VulnerabilityType.CODE_INJECTION, Severity.CRITICAL),
            vulnerability("v2", VulnerabilityType.FORMAT_STRING, Severity.MEDIUM));

        assertEquals(Severity.HIGH, AnalyzeDataflowMojo.resolveSeverity("bogus"));
        assertEquals(Severity.LOW, AnalyzeDataflowMojo.resolveSeverity(" low "));
        assertEquals(1, AnalyzeDataflowMojo.atOrAbove(found, Severity.HIGH).size());
        assertEquals("v1", AnalyzeDataflowMojo.atOrAbove(found, Severity.HIGH).get(0).getId());
        assertEquals(2, AnalyzeDataflowMojo.atOrAbove(found, Severity.MEDIUM).size());
    }

    private static Vulnerability vulnerability(String id, VulnerabilityType type, Severity severity) {
        PathHop source = new PathHop("a.c", "main", "B0", "B0_0");
        PathHop sink = new PathHop("a.c", "main", "B0", "B0_1");
        return new Vulnerability(id, type, severity, "CWE-0", source, sink, Arrays.asList(source, sink),
            "getenv", TaintSourceCategory.ENVIRONMENT, "buf", "system", false, "",
            "test finding");
    }
}
