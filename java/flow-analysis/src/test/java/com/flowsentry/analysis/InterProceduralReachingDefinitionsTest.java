package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.CallGraph;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.ReachingDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterProceduralReachingDefinitionsTest {

    private final CallGraphAnalyzer callGraphAnalyzer = new CallGraphAnalyzer();

    @Test
    void argumentDefinitionsSeedTheCalleeFormals() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.straightLine("main", "x = 5;", "r = helper(x);", "return r;"),
            CfgFixtures.function("helper", "p").block("B0", "q = p + 1;", "return q;").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        assertTrue(result.isConverged());
        List<ReachingDefinition> seeds = result.getParameterDefinitions("helper");
        assertEquals(1, seeds.size());
        ReachingDefinition seed = seeds.get(0);
        assertEquals("d0_param_p@main", seed.getDefinitionId());
        assertEquals("p", seed.getVariable());
        assertEquals("B0_param_p", seed.getStatementId());
        assertTrue(result.getFunction("helper").getBlock("B0").getOutDefinitionIds().contains("d0_param_p@main"));
    }

    @Test
    void returnedValuesDefineTheReceivingVariable() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.straightLine("main", "x = 5;", "r = helper(x);", "return r;"),
            CfgFixtures.function("helper", "p").block("B0", "q = p + 1;", "return q;").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        List<ReachingDefinition> returned = result.getReturnDefinitions("main");
        assertEquals(1, returned.size());
        assertEquals("helper_return_B0", returned.get(0).getDefinitionId());
        assertEquals("r", returned.get(0).getVariable());
        assertEquals("B0_1", returned.get(0).getStatementId());
        assertTrue(result.getFunction("main").getBlock("B0").getOutDefinitionIds().contains("helper_return_B0"));
        assertTrue(result.getReturnDefinitions("helper").isEmpty());
    }

    @Test
    void selfRecursionConvergesOnStableIds() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.function("down", "n").block("B0", "return down(n - 1);").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        assertTrue(result.isConverged());
        List<ReachingDefinition> seeds = result.getParameterDefinitions("down");
        assertEquals(1, seeds.size());
        assertEquals("d0_param_n@down", seeds.get(0).getDefinitionId());
    }

    @Test
    void mutualRecursionConvergesOnStableIds() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.function("ping", "n").block("B0", "pong(n);").build(),
            CfgFixtures.function("pong", "m").block("B0", "ping(m);").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        assertTrue(result.isConverged());
        assertEquals(Collections.singletonList("d0_param_n@pong"), ids(result.getParameterDefinitions("ping")));
        assertEquals(Collections.singletonList("d0_param_m@ping"), ids(result.getParameterDefinitions("pong")));
        assertTrue(result.getFunction("pong").getBlock("B0").getOutDefinitionIds().contains("d0_param_m@ping"));
    }

    // ============================================
    // REPEATED CALLS IN ONE BLOCK
    // ============================================

    @Test
    void eachCallIsResolvedAtItsOwnStatement() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.straightLine("main", "a = 1;", "helper(a);", "b = 2;", "x = helper(b);", "return x;"),
            CfgFixtures.function("helper", "p").block("B0", "q = p + 1;", "return q;").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        assertEquals(Arrays.asList("d0_param_p@main", "d1_param_p@main"),
            ids(result.getParameterDefinitions("helper")));
        List<ReachingDefinition> returned = result.getReturnDefinitions("main");
        assertEquals(1, returned.size());
        assertEquals("helper_return_B0", returned.get(0).getDefinitionId());
        assertEquals("x", returned.get(0).getVariable());
        assertEquals("B0_3", returned.get(0).getStatementId());
        assertTrue(result.getFunction("main").getBlock("B0").getOutDefinitionIds().contains("helper_return_B0"));
    }

    @Test
    void severalReceiversOfOneCalleeGetQualifiedIds() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.straightLine("main", "x = helper(1);", "y = helper(2);", "return x + y;"),
            CfgFixtures.function("helper", "p").block("B0", "return p;").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        List<ReachingDefinition> returned = result.getReturnDefinitions("main");
        assertEquals(Arrays.asList("helper_return_B0@B0_0", "helper_return_B0@B0_1"), ids(returned));
        assertEquals("x", returned.get(0).getVariable());
        assertEquals("y", returned.get(1).getVariable());
        Set<String> out = result.getFunction("main").getBlock("B0").getOutDefinitionIds();
        assertTrue(out.contains("helper_return_B0@B0_0"));
        assertTrue(out.contains("helper_return_B0@B0_1"));
    }

    @Test
    void laterRedefinitionKillsTheReturnedValue() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.straightLine("main", "a = 1;", "x = helper(a);", "x = 0;", "return x;"),
            CfgFixtures.function("helper", "p").block("B0", "return p;").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        assertEquals(Collections.singletonList("helper_return_B0"), ids(result.getReturnDefinitions("main")));
        Set<String> out = result.getFunction("main").getBlock("B0").getOutDefinitionIds();
        assertFalse(out.contains("helper_return_B0"));
        assertEquals(new HashSet<>(Arrays.asList("d0", "d2")), out);
    }

    @Test
    void rejectedCalleeIsWarnedOncePerEdge() {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.straightLine("main", "x = 1;", "broken(x);", "broken(2);"));

        InterProceduralRdResult result = analyze(functions, Collections.singleton("broken"), diagnostics);

        assertTrue(result.isConverged());
        int warnings = 0;
        for (Diagnostic diagnostic : diagnostics.getWarnings()) {
            if ("interprocedural-rd".equals(diagnostic.getComponent())) {
                warnings++;
                assertEquals("main", diagnostic.getFunctionName());
            }
        }
        assertEquals(1, warnings);
    }

    @Test
    void summarizedLibraryWritesBecomeDefinitions() {
        Map<String, FunctionCfg> functions = functions(
            CfgFixtures.function("main", "src").block("B0", "strcpy(x, src);", "puts(x);").build());

        InterProceduralRdResult result = analyze(functions, Collections.<String>emptySet(), new AnalysisDiagnostics());

        Set<String> ids = new HashSet<>();
        for (ReachingDefinition def : result.getReturnDefinitions("main")) {
            ids.add(def.getDefinitionId());
        }
        assertTrue(ids.contains("strcpy_out_x_B0_0"));
        assertTrue(result.getFunction("main").getBlock("B0").getOutDefinitionIds().contains("strcpy_out_x_B0_0"));
    }

    private static List<String> ids(List<ReachingDefinition> definitions) {
        List<String> ids = new ArrayList<>();
        for (ReachingDefinition def : definitions) {
            ids.add(def.getDefinitionId());
        }
        return ids;
    }

    private InterProceduralRdResult analyze(Map<String, FunctionCfg> functions, Set<String> rejected,
                                            AnalysisDiagnostics diagnostics) {
        CallGraph graph = callGraphAnalyzer.build(functions.values(), rejected);
        return new InterProceduralReachingDefinitions(diagnostics, null).analyze(functions, graph);
    }

    private static Map<String, FunctionCfg> functions(FunctionCfg... cfgs) {
        Map<String, FunctionCfg> functions = new LinkedHashMap<>();
        for (FunctionCfg cfg : cfgs) {
            functions.put(cfg.getName(), cfg);
        }
        return functions;
    }
}
