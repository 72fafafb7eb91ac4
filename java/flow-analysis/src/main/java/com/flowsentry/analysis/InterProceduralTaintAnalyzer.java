package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.CallGraph;
import com.flowsentry.analysis.domain.FunctionCall;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.FunctionMetadata;
import com.flowsentry.analysis.domain.PathHop;
import com.flowsentry.analysis.domain.Statement;
import com.flowsentry.analysis.domain.TaintDerivation;
import com.flowsentry.analysis.domain.TaintFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Taint across call edges.
 *
 * <p>Each analysis unit is a function in a calling context. Tainted actual arguments seed
 * the callee's formals, and the callee's return taint seeds the caller's receiving variable
 * just after the call. Below maximum sensitivity every function has a single context; at
 * maximum the context is the call string of the last k call sites.</p>
 */
public class InterProceduralTaintAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(InterProceduralTaintAnalyzer.class);

    static final String CONTEXT_SEPARATOR = ">";

    private final AnalysisConfig config;
    private final TaintAnalyzer taintAnalyzer;
    private final AnalysisDiagnostics diagnostics;

    public InterProceduralTaintAnalyzer(AnalysisConfig config, TaintAnalyzer taintAnalyzer,
                                        AnalysisDiagnostics diagnostics) {
        this.config = config != null ? config : AnalysisConfig.defaults();
        this.taintAnalyzer = taintAnalyzer;
        this.diagnostics = diagnostics != null ? diagnostics : new AnalysisDiagnostics();
    }

    public InterProceduralTaintResult analyze(Map<String, FunctionCfg> functions, CallGraph graph) {
        Set<String> userFunctions = new LinkedHashSet<>();
        for (String name : functions.keySet()) {
            FunctionMetadata metadata = graph.getFunction(name);
            if (metadata == null || metadata.isAnalyzable()) {
                userFunctions.add(name);
            }
        }

        Map<String, Unit> units = new LinkedHashMap<>();
        Set<String> worklist = new LinkedHashSet<>();
        for (String name : userFunctions) {
            Unit root = new Unit(name, "");
            units.put(root.key(), root);
            worklist.add(root.key());
        }

        boolean contextSensitive = config.getSensitivity().isContextSensitive();
        int edges = graph.getEdgeCount();
        int maxIterations = (functions.size() * edges + functions.size())
            * (contextSensitive ? config.getContextDepth() + 1 : 1);
        int iterations = 0;

        while (!worklist.isEmpty() && iterations < maxIterations) {
            Iterator<String> it = worklist.iterator();
            Unit unit = units.get(it.next());
            it.remove();
            iterations++;

            FunctionCfg cfg = functions.get(unit.function);
            TaintAnalysisResult result = taintAnalyzer.analyze(cfg, new ArrayList<>(unit.seeds.values()),
                unit.contextId, userFunctions);
            unit.result = result;

            int seedCount = unit.seeds.size();
            boolean returnsChanged = false;
            for (TaintFact fact : result.getReturnFacts()) {
                returnsChanged |= unit.addReturn(fact);
            }

            for (FunctionCall call : graph.getCallsFrom(unit.function)) {
                String callee = call.getCalleeId();
                FunctionCfg calleeCfg = functions.get(callee);
                if (calleeCfg == null || !userFunctions.contains(callee)) {
                    continue;
                }
                String calleeContext = contextSensitive
                    ? pushContext(unit.contextId, unit.function + ":" + call.getCallSite().getStatementId())
                    : "";
                Unit calleeUnit = units.get(Unit.key(callee, calleeContext));
                if (calleeUnit == null) {
                    calleeUnit = new Unit(callee, calleeContext);
                    units.put(calleeUnit.key(), calleeUnit);
                    worklist.add(calleeUnit.key());
                }
                calleeUnit.invokers.add(unit.key());

                if (seedFormals(call, result, calleeCfg, calleeUnit)) {
                    worklist.add(calleeUnit.key());
                }
                returnsChanged |= applyReturns(call, cfg, unit, calleeUnit);
            }

            if (unit.seeds.size() > seedCount) {
                worklist.add(unit.key());
            }
            if (returnsChanged) {
                worklist.addAll(unit.invokers);
            }
        }

        boolean converged = worklist.isEmpty();
        if (!converged) {
            diagnostics.warn(LOG, "interprocedural-taint", null,
                "inter-procedural taint stopped after " + maxIterations + " iterations");
        }
        LOG.debug("Inter-procedural taint: {} units, {} iterations", units.size(), iterations);

        Map<String, List<TaintAnalysisResult>> results = new LinkedHashMap<>();
        for (Unit unit : units.values()) {
            TaintAnalysisResult result = unit.result != null ? unit.result : TaintAnalysisResult.empty(unit.function);
            results.computeIfAbsent(unit.function, ignored -> new ArrayList<>()).add(result);
        }
        return new InterProceduralTaintResult(results, converged, iterations);
    }

    /**
     * Append a call site to a call string, keeping the last {@code contextDepth} sites.
     */
    String pushContext(String contextId, String callSite) {
        List<String> sites = new ArrayList<>();
        if (contextId != null && !contextId.isEmpty()) {
            sites.addAll(Arrays.asList(contextId.split(CONTEXT_SEPARATOR)));
        }
        sites.add(callSite);
        int depth = config.getContextDepth();
        if (sites.size() > depth) {
            sites = sites.subList(sites.size() - depth, sites.size());
        }
        return String.join(CONTEXT_SEPARATOR, sites);
    }

    // ============================================
    // CALL EDGES
    // ============================================

    private boolean seedFormals(FunctionCall call, TaintAnalysisResult callerResult, FunctionCfg calleeCfg,
                                Unit calleeUnit) {
        boolean changed = false;
        List<String> formals = calleeCfg.getParameters();
        String entry = calleeCfg.getEntryBlockId();
        if (entry == null) {
            return false;
        }
        for (TaintedCall tainted : callerResult.getTaintedCalls()) {
            if (!tainted.isAt(call.getCalleeId(), call.getCallSite().getBlockId(),
                    call.getCallSite().getStatementId())) {
                continue;
            }
            for (Integer index : tainted.getArgumentIndices()) {
                if (index >= formals.size()) {
                    continue;
                }
                String formal = formals.get(index);
                PathHop site = new PathHop(calleeCfg.getSourceFile(), calleeCfg.getName(), entry,
                    entry + "_param_" + formal);
                TaintFact seed = tainted.getFact()
                    .derive(taintAnalyzer.normalizeVariable(formal), site, TaintDerivation.PARAMETER)
                    .withContext(calleeUnit.contextId);
                changed |= calleeUnit.addSeed(new TaintSeed(entry, 0, seed));
            }
        }
        return changed;
    }

    /**
     * Seed the caller with the callee's return taint after the call statement.
     *
     * @return true when the caller's own return taint grew
     */
    private boolean applyReturns(FunctionCall call, FunctionCfg callerCfg, Unit caller, Unit callee) {
        if (callee.returns.isEmpty()) {
            return false;
        }
        BasicBlock block = callerCfg.getBlock(call.getCallSite().getBlockId());
        int index = statementIndex(block, call.getCallSite().getStatementId());
        if (index < 0) {
            return false;
        }
        Statement statement = block.getStatements().get(index);
        FunctionCallExtractor.ExtractedCall extracted =
            FunctionCallExtractor.findCall(statement.getText(), call.getCalleeId());
        String receiver = extracted != null ? TaintAnalyzer.receiverOf(statement, extracted) : null;
        if (receiver == null) {
            return false;
        }
        PathHop site = new PathHop(callerCfg.getSourceFile(), callerCfg.getName(), block.getId(), statement.getId());
        boolean returnsChanged = false;
        for (TaintFact returned : new ArrayList<>(callee.returns.values())) {
            if (TaintAnalyzer.RETURN_VALUE.equals(receiver)) {
                returnsChanged |= caller.addReturn(returned.derive(returned.getVariable(), site, TaintDerivation.RETURN)
                    .withContext(caller.contextId));
            } else {
                TaintFact seed = returned.derive(taintAnalyzer.normalizeVariable(receiver), site, TaintDerivation.RETURN)
                    .withContext(caller.contextId);
                caller.addSeed(new TaintSeed(block.getId(), index + 1, seed));
            }
        }
        return returnsChanged;
    }

    private static int statementIndex(BasicBlock block, String statementId) {
        if (block == null) {
            return -1;
        }
        List<Statement> statements = block.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i).getId().equals(statementId)) {
                return i;
            }
        }
        return -1;
    }

    // ============================================
    // UNIT STATE
    // ============================================

    private static final class Unit {
        private final String function;
        private final String contextId;
        private final Map<String, TaintSeed> seeds = new LinkedHashMap<>();
        private final Map<String, TaintFact> returns = new LinkedHashMap<>();
        private final Set<String> invokers = new LinkedHashSet<>();
        private TaintAnalysisResult result;

        Unit(String function, String contextId) {
            this.function = function;
            this.contextId = contextId;
        }

        static String key(String function, String contextId) {
            return function + "@" + contextId;
        }

        String key() {
            return key(function, contextId);
        }

        boolean addSeed(TaintSeed seed) {
            if (seeds.containsKey(seed.getKey())) {
                return false;
            }
            seeds.put(seed.getKey(), seed);
            return true;
        }

        /**
         * Return taint is keyed by source and variable so repeated passes do not grow it.
         */
        boolean addReturn(TaintFact fact) {
            String key = fact.getSourceSite() + "|" + fact.getVariable() + "|" + fact.isSanitized();
            if (returns.containsKey(key)) {
                return false;
            }
            returns.put(key, fact);
            return true;
        }
    }

    // ============================================
    // RESULT
    // ============================================

    /**
     * Per-function results of every context the function was analyzed in.
     */
    public static class InterProceduralTaintResult {
        private final Map<String, List<TaintAnalysisResult>> results;
        private final boolean converged;
        private final int iterations;

        InterProceduralTaintResult(Map<String, List<TaintAnalysisResult>> results, boolean converged, int iterations) {
            this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
            this.converged = converged;
            this.iterations = iterations;
        }

        public List<TaintAnalysisResult> getResults(String function) {
            List<TaintAnalysisResult> list = results.get(function);
            return list != null ? list : Collections.<TaintAnalysisResult>emptyList();
        }

        /**
         * Result for one context, or null when the function was never analyzed in it.
         */
        public TaintAnalysisResult getResult(String function, String contextId) {
            for (TaintAnalysisResult result : getResults(function)) {
                if (result.getContextId().equals(contextId)) {
                    return result;
                }
            }
            return null;
        }

        public Map<String, List<TaintAnalysisResult>> getResults() {
            return results;
        }

        public boolean isConverged() {
            return converged;
        }

        public int getIterations() {
            return iterations;
        }
    }
}
