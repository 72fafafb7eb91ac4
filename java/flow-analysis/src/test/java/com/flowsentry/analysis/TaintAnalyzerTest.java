package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ControlDependence;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.TaintDerivation;
import com.flowsentry.analysis.domain.TaintFact;
import com.flowsentry.analysis.domain.TaintSourceCategory;
import com.flowsentry.analysis.domain.Vulnerability;
import com.flowsentry.analysis.domain.VulnerabilityType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaintAnalyzerTest {

    private static TaintAnalyzer analyzer(SensitivityLevel level) {
        return new TaintAnalyzer(AnalysisConfig.builder().sensitivity(level).build());
    }

    @Test
    void scanfIntoSprintfIsBufferOverflow() {
        FunctionCfg cfg = CfgFixtures.straightLine("format",
            "scanf(\"%s\", buf);",
            "sprintf(dest, fmt, buf);");

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        List<Vulnerability> vulnerabilities = result.getVulnerabilities();
        assertEquals(1, vulnerabilities.size());
        Vulnerability vulnerability = vulnerabilities.get(0);
        assertEquals(VulnerabilityType.BUFFER_OVERFLOW, vulnerability.getType());
        assertEquals("CWE-120", vulnerability.getCweId());
        assertEquals("buf", vulnerability.getTaintedVariable());
        assertEquals("scanf", vulnerability.getSourceFunction());
        assertEquals(TaintSourceCategory.USER_INPUT, vulnerability.getSourceCategory());
        assertEquals("sprintf", vulnerability.getSinkFunction());
        assertEquals("B0_1", vulnerability.getSinkSite().getStatementId());
        assertFalse(vulnerability.isSanitized());
    }

    @Test
    void escapingSanitizerClearsTaintBeforeSink() {
        FunctionCfg cfg = CfgFixtures.straightLine("escaped",
            "scanf(\"%s\", buf);",
            "buf = sql_escape(buf);",
            "sprintf(dest, fmt, buf);");

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertTrue(result.getVulnerabilities().isEmpty());
        boolean sanitizedFact = false;
        for (TaintFact fact : result.getFactsFor("buf")) {
            if (fact.isSanitized()) {
                sanitizedFact = true;
                assertFalse(fact.isTainted());
                assertEquals(1, fact.getSanitizationPoints().size());
            }
        }
        assertTrue(sanitizedFact);
    }

    @Test
    void conversionResultIsNotReportedButOriginalStillIs() {
        FunctionCfg cfg = CfgFixtures.straightLine("convert",
            "input = getenv(\"PORT\");",
            "port = atoi(input);",
            "system(port);",
            "system(input);");

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertEquals(1, result.getVulnerabilities().size());
        Vulnerability vulnerability = result.getVulnerabilities().get(0);
        assertEquals("input", vulnerability.getTaintedVariable());
        assertEquals("B0_3", vulnerability.getSinkSite().getStatementId());
        for (TaintFact fact : result.getFactsFor("port")) {
            assertTrue(fact.isSanitized());
        }
    }

    @Test
    void dataFlowsThroughAssignmentsAndSummaries() {
        FunctionCfg cfg = CfgFixtures.straightLine("copy",
            "name = getenv(\"USER\");",
            "len = name + 1;",
            "strcpy(dest, name);",
            "system(dest);");

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertTrue(result.isTainted("len"));
        assertTrue(result.isTainted("dest"));
        assertEquals(TaintDerivation.DATA, result.getFactsFor("dest").get(0).getDerivation());
        assertEquals(new HashSet<>(Arrays.asList(VulnerabilityType.BUFFER_OVERFLOW, VulnerabilityType.CODE_INJECTION)),
            types(result.getVulnerabilities()));
    }

    @Test
    void formatArgumentOutsideSinkPositionIsSafe() {
        FunctionCfg cfg = CfgFixtures.straightLine("echo",
            "line = getenv(\"LINE\");",
            "printf(\"%s\", line);");

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertTrue(result.getVulnerabilities().isEmpty());
    }

    @Test
    void argvParameterIsTaintedOnEntry() {
        FunctionCfg cfg = CfgFixtures.function("main", "argc", "argv")
            .block("B0", "system(argv[1]);")
            .build();

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertEquals(1, result.getVulnerabilities().size());
        Vulnerability vulnerability = result.getVulnerabilities().get(0);
        assertEquals("argv", vulnerability.getSourceFunction());
        assertEquals(TaintSourceCategory.COMMAND_LINE, vulnerability.getSourceCategory());
        assertEquals("B0_param_argv", vulnerability.getSourceSite().getStatementId());
    }

    // ============================================
    // SENSITIVITY LEVELS
    // ============================================

    private static FunctionCfg taintedCondition() {
        return CfgFixtures.function("branch")
            .block("B0", "a = getenv(\"LEVEL\");", "if (a > 0)")
            .block("B1", "x = 1;")
            .block("B2", "x = 2;")
            .block("B3", "system(x);")
            .edges("B0", "B1", "B2")
            .edge("B1", "B3")
            .edge("B2", "B3")
            .build();
    }

    @Test
    void minimalIgnoresControlDependence() {
        TaintAnalysisResult result = analyzer(SensitivityLevel.MINIMAL).analyze(taintedCondition());

        assertFalse(result.isTainted("x"));
        assertTrue(result.getControlDependences().isEmpty());
        assertTrue(result.getVulnerabilities().isEmpty());
    }

    @Test
    void conservativeTaintsAssignmentsUnderTaintedCondition() {
        TaintAnalysisResult result = analyzer(SensitivityLevel.CONSERVATIVE).analyze(taintedCondition());

        assertTrue(result.isTainted("x"));
        assertEquals(TaintDerivation.CONTROL, result.getFactsFor("x").get(0).getDerivation());
        ControlDependence dependence = result.getControlDependences().get(0);
        assertEquals("B0", dependence.getConditionBlockId());
        assertEquals("B0_1", dependence.getConditionStatementId());
        assertEquals("a", dependence.getConditionVariable());
        assertEquals(new HashSet<>(Arrays.asList("B1", "B2")), dependence.getDependentBlocks());
        assertEquals(1, result.getVulnerabilities().size());
    }

    @Test
    void balancedTaintsEveryNestedAssignment() {
        FunctionCfg cfg = CfgFixtures.function("nested", "b", "c")
            .block("B0", "a = getenv(\"LEVEL\");", "if (a)")
            .block("B1", "if (b > 0)")
            .block("B2", "if (c > 0)")
            .block("B3", "x = 1;")
            .block("B4", "y = 2;")
            .block("B5", "z = 3;")
            .block("B6", "return x;")
            .edges("B0", "B1", "B6")
            .edges("B1", "B2", "B5")
            .edges("B2", "B3", "B4")
            .edge("B3", "B4")
            .edge("B4", "B5")
            .edge("B5", "B6")
            .build();

        TaintAnalysisResult conservative = analyzer(SensitivityLevel.CONSERVATIVE).analyze(cfg);
        TaintAnalysisResult balanced = analyzer(SensitivityLevel.BALANCED).analyze(cfg);

        assertFalse(conservative.isTainted("x"));
        assertTrue(balanced.isTainted("x"));
        assertTrue(balanced.isTainted("y"));
        assertTrue(balanced.isTainted("z"));
    }

    @Test
    void preciseKeepsStructFieldsApart() {
        FunctionCfg cfg = CfgFixtures.straightLine("fields",
            "req.name = getenv(\"NAME\");",
            "system(req.id);");

        assertTrue(analyzer(SensitivityLevel.PRECISE).analyze(cfg).getVulnerabilities().isEmpty());
        assertEquals(1, analyzer(SensitivityLevel.BALANCED).analyze(cfg).getVulnerabilities().size());
    }

    @Test
    void preciseStillReportsTheTaintedField() {
        FunctionCfg cfg = CfgFixtures.straightLine("fields",
            "req.name = getenv(\"NAME\");",
            "system(req.name);");

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertEquals(1, result.getVulnerabilities().size());
        assertEquals("req.name", result.getVulnerabilities().get(0).getTaintedVariable());
    }

    @Test
    void maximumKillsTaintOnCleanRedefinition() {
        FunctionCfg cfg = CfgFixtures.straightLine("reset",
            "cmd = getenv(\"CMD\");",
            "cmd = \"ls\";",
            "system(cmd);");

        assertTrue(analyzer(SensitivityLevel.MAXIMUM).analyze(cfg).getVulnerabilities().isEmpty());
        assertEquals(1, analyzer(SensitivityLevel.PRECISE).analyze(cfg).getVulnerabilities().size());
    }

    @Test
    void taintFlowsAroundLoops() {
        FunctionCfg cfg = CfgFixtures.function("loop")
            .block("B0", "s = getenv(\"S\");", "t = 0;")
            .block("B1", "while (i < 10)")
            .block("B2", "t = s;", "i = i + 1;")
            .block("B3", "system(t);")
            .edges("B0", "B1")
            .edges("B1", "B2", "B3")
            .edge("B2", "B1")
            .build();

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertEquals(1, result.getVulnerabilities().size());
        assertEquals("t", result.getVulnerabilities().get(0).getTaintedVariable());
    }

    @Test
    void returnedTaintIsRecorded() {
        FunctionCfg cfg = CfgFixtures.straightLine("read_env",
            "value = getenv(\"HOME\");",
            "return value;");

        TaintAnalysisResult result = analyzer(SensitivityLevel.PRECISE).analyze(cfg);

        assertEquals(1, result.getReturnFacts().size());
        assertEquals("value", result.getReturnFacts().get(0).getVariable());
    }

    private static Set<VulnerabilityType> types(List<Vulnerability> vulnerabilities) {
        Set<VulnerabilityType> types = new HashSet<>();
        for (Vulnerability vulnerability : vulnerabilities) {
            types.add(vulnerability.getType());
        }
        return types;
    }
}
