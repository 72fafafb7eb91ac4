package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.CfgDocument;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.SourceFile;
import com.flowsentry.analysis.domain.TaintSourceCategory;
import com.flowsentry.analysis.domain.Vulnerability;
import com.flowsentry.analysis.domain.VulnerabilityType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataflowAnalyzerTest {

    @Test
    void analyzesAnExportedDocumentEndToEnd() throws CfgFormatException {
        WorkspaceAnalysisResult result = new DataflowAnalyzer(AnalysisConfig.defaults())
            .analyze(CfgDocumentReaderTest.fixture("command.cfg.json"));

        FunctionAnalysisResult main = result.getFunction("main");
        assertNotNull(main.getLiveness());
        assertNotNull(main.getReachingDefinitions());
        assertTrue(main.isTainted("cmd"));

        List<Vulnerability> vulnerabilities = result.getVulnerabilities();
        assertEquals(1, vulnerabilities.size());
        Vulnerability vulnerability = vulnerabilities.get(0);
        assertEquals(VulnerabilityType.CODE_INJECTION, vulnerability.getType());
        assertEquals("run", vulnerability.getSinkSite().getFunction());
        assertEquals(TaintSourceCategory.COMMAND_LINE, vulnerability.getSourceCategory());

        assertNotNull(result.getCallGraph());
        assertEquals(1, result.getCallGraph().getCallsFrom("main").size());
        assertTrue(result.getCallGraphDot().startsWith("digraph CallGraphAnalysis {"));
        assertNotNull(result.getInterProceduralDefinitions());
        assertTrue(result.getDiagnostics().getAll().isEmpty());
    }

    @Test
    void minimalSensitivityStaysIntraProcedural() throws CfgFormatException {
        AnalysisConfig config = AnalysisConfig.builder().sensitivity(SensitivityLevel.MINIMAL).build();

        WorkspaceAnalysisResult result = new DataflowAnalyzer(config)
            .analyze(CfgDocumentReaderTest.fixture("command.cfg.json"));

        assertTrue(result.getFunction("main").isTainted("cmd"));
        assertFalse(result.getFunction("run").isTainted("line"));
        assertTrue(result.getVulnerabilities().isEmpty());
        assertNotNull(result.getCallGraph());
    }

    @Test
    void disabledAnalysesLeaveNoResults() throws CfgFormatException {
        AnalysisConfig config = AnalysisConfig.builder()
            .liveness(false)
            .taint(false)
            .callGraph(false)
            .build();

        WorkspaceAnalysisResult result = new DataflowAnalyzer(config)
            .analyze(CfgDocumentReaderTest.fixture("command.cfg.json"));

        FunctionAnalysisResult main = result.getFunction("main");
        assertNull(main.getLiveness());
        assertNotNull(main.getReachingDefinitions());
        assertTrue(main.getTaintFacts().isEmpty());
        assertNull(result.getCallGraph());
        assertNull(result.getCallGraphDot());
        assertNull(result.getInterProceduralDefinitions());
    }

    @Test
    void invalidFunctionIsSkippedAndOthersContinue() {
        FunctionCfg broken = CfgFixtures.straightLine("broken", "x = 1;");
        broken.getBlock("B0").addSuccessor("B9");
        CfgDocument document = CfgFixtures.document(
            CfgFixtures.straightLine("main", "broken(1);", "return 0;"),
            broken);
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();

        WorkspaceAnalysisResult result = new DataflowAnalyzer(AnalysisConfig.defaults()).analyze(document, diagnostics);

        assertNotNull(result.getFunction("main"));
        assertNull(result.getFunction("broken"));
        assertFalse(diagnostics.getErrors().isEmpty());
        for (Diagnostic error : diagnostics.getErrors()) {
            assertEquals("validator", error.getComponent());
            assertEquals("broken", error.getFunctionName());
        }
        assertFalse(result.getCallGraph().getFunction("broken").isAnalyzable());
        assertFalse(result.getCallGraph().getFunction("broken").isExternal());
    }

    @Test
    void firstDefinitionOfADuplicatedNameWins() {
        CfgDocument document = new CfgDocument();
        SourceFile first = new SourceFile("first.c");
        first.addFunction(CfgFixtures.function("helper").file("first.c").block("B0", "return 1;").build());
        SourceFile second = new SourceFile("second.c");
        second.addFunction(CfgFixtures.function("helper").file("second.c").block("B0", "return 2;").build());
        document.addFile(first);
        document.addFile(second);
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        AnalysisConfig config = AnalysisConfig.builder().parallelism(2).build();

        WorkspaceAnalysisResult result = new DataflowAnalyzer(config).analyze(document, diagnostics);

        assertEquals("first.c", result.getFunction("helper").getSourceFile());
        assertEquals(1, diagnostics.getWarnings().size());
        assertEquals("orchestrator", diagnostics.getWarnings().get(0).getComponent());
        assertEquals("helper", diagnostics.getWarnings().get(0).getFunctionName());
        assertEquals(2, result.getFiles().size());
    }

    @Test
    void filesAreAnalyzedConcurrentlyWithoutLosingResults() {
        CfgDocument document = new CfgDocument();
        for (int i = 0; i < 24; i++) {
            SourceFile file = new SourceFile("unit" + i + ".c");
            file.addFunction(CfgFixtures.function("f" + i).file("unit" + i + ".c")
                .block("B0", "buf = getenv(\"IN\");", "system(buf);")
                .build());
            document.addFile(file);
        }
        AnalysisConfig config = AnalysisConfig.builder().parallelism(4).build();

        WorkspaceAnalysisResult result = new DataflowAnalyzer(config).analyze(document);

        assertEquals(24, result.getFunctions().size());
        assertEquals(24, result.getFiles().size());
        assertEquals(24, result.getVulnerabilities().size());
        assertEquals("unit0.c", result.getFiles().get(0));
        assertEquals("unit23.c", result.getFiles().get(23));
    }
}
