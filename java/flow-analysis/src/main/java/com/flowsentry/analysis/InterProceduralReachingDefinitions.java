package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.CallGraph;
import com.flowsentry.analysis.domain.FunctionCall;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.FunctionMetadata;
import com.flowsentry.analysis.domain.FunctionSummary;
import com.flowsentry.analysis.domain.ParameterMapping;
import com.flowsentry.analysis.domain.ParameterSummary;
import com.flowsentry.analysis.domain.ReachingDefinition;
import com.flowsentry.analysis.domain.ReturnKind;
import com.flowsentry.analysis.domain.ReturnValueInfo;
import com.flowsentry.analysis.domain.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reaching definitions across the call graph.
 *
 * <p>Definitions reaching a call site are mapped onto the callee's formals as synthetic
 * entry definitions; each return of the callee defines the caller's receiving variable at
 * the call-site block. Upper-case globals flow from caller to callee. Functions are
 * re-solved until no seed or injection changes, bounded by
 * {@code functions * max(1, call edges)} solver runs plus one confirming run per function.</p>
 */
public class InterProceduralReachingDefinitions {

    private static final Logger LOG = LoggerFactory.getLogger(InterProceduralReachingDefinitions.class);

    private static final Pattern RECEIVER = Pattern.compile("(\\w+)\\s*=\\s*\\w+\\s*\\(");
    private static final Pattern GLOBAL_NAME = Pattern.compile("[A-Z][A-Z0-9_]+");

    private final AnalysisDiagnostics diagnostics;
    private final ReachingDefinitionsAnalyzer solver;
    private final ParameterAnalyzer parameterAnalyzer;
    private final ReturnValueAnalyzer returnAnalyzer;
    private final FunctionSummaryTable summaries;

    public InterProceduralReachingDefinitions(AnalysisDiagnostics diagnostics, FunctionSummaryTable summaries) {
        this.diagnostics = diagnostics != null ? diagnostics : new AnalysisDiagnostics();
        this.solver = new ReachingDefinitionsAnalyzer(this.diagnostics);
        this.parameterAnalyzer = new ParameterAnalyzer();
        this.returnAnalyzer = new ReturnValueAnalyzer();
        this.summaries = summaries != null ? summaries : new FunctionSummaryTable();
    }

    public InterProceduralRdResult analyze(Map<String, FunctionCfg> functions, CallGraph graph) {
        Map<String, List<ReachingDefinition>> seeds = new LinkedHashMap<>();
        Map<String, Map<String, List<ReachingDefinition>>> injections = new LinkedHashMap<>();
        Map<String, ReachingDefinitionsResult> results = new LinkedHashMap<>();
        Set<String> warned = new HashSet<>();

        for (FunctionCfg cfg : functions.values()) {
            seeds.put(cfg.getName(), new ArrayList<ReachingDefinition>());
            injections.put(cfg.getName(), new LinkedHashMap<String, List<ReachingDefinition>>());
        }
        for (FunctionCfg cfg : functions.values()) {
            injectSummaryEffects(cfg, graph, injections.get(cfg.getName()));
        }

        Set<String> worklist = new LinkedHashSet<>(functions.keySet());
        int maxIterations = functions.size() * Math.max(1, graph.getEdgeCount()) + functions.size();
        int iterations = 0;
        while (!worklist.isEmpty() && iterations < maxIterations) {
            Iterator<String> it = worklist.iterator();
            String caller = it.next();
            it.remove();
            iterations++;

            FunctionCfg callerCfg = functions.get(caller);
            ReachingDefinitionsResult callerResult =
                solver.analyze(callerCfg, seeds.get(caller), injections.get(caller));
            results.put(caller, callerResult);

            for (FunctionCall call : graph.getCallsFrom(caller)) {
                FunctionCfg calleeCfg = resolveCallee(call, graph, functions, warned);
                if (calleeCfg == null) {
                    continue;
                }
                String callee = calleeCfg.getName();
                int statementIndex = callSiteIndex(callerCfg.getBlock(call.getCallSite().getBlockId()),
                    call.getCallSite().getStatementId());
                if (statementIndex < 0) {
                    continue;
                }
                BasicBlock callBlock = callerCfg.getBlock(call.getCallSite().getBlockId());
                Statement callStatement = callBlock.getStatements().get(statementIndex);
                Map<String, List<ReachingDefinition>> reaching =
                    callerResult.reachingStatement(callerCfg, callBlock.getId(), statementIndex);

                List<ReachingDefinition> newSeeds = mapArguments(call, callerCfg, calleeCfg, callBlock.getId(), reaching);
                if (addAll(seeds.get(callee), newSeeds)) {
                    worklist.add(callee);
                }

                String receiver = receivingVariable(callStatement.getText(), callee);
                if (receiver != null) {
                    boolean qualify = receivingCalls(graph, caller, callee) > 1;
                    List<ReachingDefinition> returned =
                        returnDefinitions(calleeCfg, receiver, callBlock.getId(), callStatement.getId(), qualify);
                    List<ReachingDefinition> existing = injections.get(caller)
                        .computeIfAbsent(callBlock.getId(), ignored -> new ArrayList<>());
                    if (addAll(existing, returned)) {
                        worklist.add(caller);
                    }
                }
            }
        }

        boolean converged = worklist.isEmpty();
        if (!converged) {
            diagnostics.warn(LOG, "interprocedural-rd", null,
                "inter-procedural reaching definitions stopped after " + maxIterations + " iterations");
        }
        for (FunctionCfg cfg : functions.values()) {
            if (!results.containsKey(cfg.getName())) {
                results.put(cfg.getName(), solver.analyze(cfg, seeds.get(cfg.getName()), injections.get(cfg.getName())));
            }
        }
        LOG.debug("Inter-procedural reaching definitions: {} functions, {} iterations", functions.size(), iterations);

        Map<String, List<ReachingDefinition>> returnDefinitions = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<ReachingDefinition>>> entry : injections.entrySet()) {
            List<ReachingDefinition> all = new ArrayList<>();
            for (List<ReachingDefinition> defs : entry.getValue().values()) {
                all.addAll(defs);
            }
            returnDefinitions.put(entry.getKey(), all);
        }
        return new InterProceduralRdResult(results, seeds, returnDefinitions, converged, iterations);
    }

    // ============================================
    // CALL RESOLUTION
    // ============================================

    private FunctionCfg resolveCallee(FunctionCall call, CallGraph graph, Map<String, FunctionCfg> functions,
                                      Set<String> warned) {
        String callee = call.getCalleeId();
        FunctionMetadata metadata = graph.getFunction(callee);
        if (metadata == null) {
            warnOnce(warned, call, "callee " + callee + " is not in the call graph; edge skipped");
            return null;
        }
        if (metadata.isExternal()) {
            return null;
        }
        FunctionCfg cfg = functions.get(callee);
        if (!metadata.isAnalyzable() || cfg == null) {
            warnOnce(warned, call, "callee " + callee + " has no analyzable CFG; edge skipped");
            return null;
        }
        return cfg;
    }

    private void warnOnce(Set<String> warned, FunctionCall call, String message) {
        if (warned.add(call.getCallerId() + "->" + call.getCalleeId())) {
            diagnostics.warn(LOG, "interprocedural-rd", call.getCallerId(), message);
        }
    }

    /**
     * Index of the call-site statement in its block, or -1.
     */
    static int callSiteIndex(BasicBlock block, String statementId) {
        if (block == null || statementId == null) {
            return -1;
        }
        List<Statement> statements = block.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (statementId.equals(statements.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    // ============================================
    // CALLER TO CALLEE
    // ============================================

    private List<ReachingDefinition> mapArguments(FunctionCall call, FunctionCfg callerCfg, FunctionCfg calleeCfg,
                                                  String callBlockId, Map<String, List<ReachingDefinition>> reaching) {
        List<ReachingDefinition> created = new ArrayList<>();
        String caller = callerCfg.getName();
        String calleeEntry = calleeCfg.getEntryBlockId();
        List<String> path = Arrays.asList(callBlockId, calleeEntry);

        for (ParameterMapping mapping : parameterAnalyzer.mapParameters(calleeCfg.getName(),
                calleeCfg.getParameters(), call.getArguments())) {
            String formal = mapping.getFormalName();
            for (String used : mapping.getDerivation().getUsedVariables()) {
                List<ReachingDefinition> defs = reaching.get(used);
                if (defs == null) {
                    continue;
                }
                for (ReachingDefinition def : defs) {
                    String id = rootId(def.getDefinitionId()) + "_param_" + formal + "@" + caller;
                    created.add(new ReachingDefinition(formal, id, calleeEntry, calleeEntry + "_param_" + formal,
                        def.getBlockId(), path));
                }
            }
        }

        for (Map.Entry<String, List<ReachingDefinition>> entry : reaching.entrySet()) {
            String variable = entry.getKey();
            if (!isGlobal(variable, callerCfg) || calleeCfg.getParameters().contains(variable)) {
                continue;
            }
            for (ReachingDefinition def : entry.getValue()) {
                String id = rootId(def.getDefinitionId()) + "_via_" + calleeCfg.getName();
                created.add(new ReachingDefinition(variable, id, calleeEntry, def.getStatementId(),
                    def.getBlockId(), path));
            }
        }
        return created;
    }

    /**
     * All-uppercase names longer than one character that are not parameters of the function.
     */
    static boolean isGlobal(String variable, FunctionCfg cfg) {
        return GLOBAL_NAME.matcher(variable).matches() && !cfg.getParameters().contains(variable);
    }

    /**
     * Id of the definition a synthetic definition was derived from, so repeated passes
     * through a recursive cycle reuse the same ids.
     */
    private static String rootId(String definitionId) {
        int param = definitionId.indexOf("_param_");
        int via = definitionId.indexOf("_via_");
        int cut = param < 0 ? via : (via < 0 ? param : Math.min(param, via));
        return cut < 0 ? definitionId : definitionId.substring(0, cut);
    }

    // ============================================
    // CALLEE TO CALLER
    // ============================================

    static String receivingVariable(String statementText, String callee) {
        String text = FunctionCallExtractor.cleanStatementText(statementText);
        if (!Pattern.compile("=\\s*" + Pattern.quote(callee) + "\\s*\\(").matcher(text).find()) {
            return null;
        }
        String target = StatementFactsExtractor.assignmentTargetOf(text);
        if (target != null) {
            return target;
        }
        Matcher matcher = RECEIVER.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Number of call sites in {@code caller} that assign the result of {@code callee}.
     */
    static int receivingCalls(CallGraph graph, String caller, String callee) {
        int count = 0;
        for (FunctionCall call : graph.getCallsFrom(caller)) {
            if (callee.equals(call.getCalleeId())
                    && receivingVariable(call.getCallSite().getStatementText(), callee) != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Ids are {@code callee_return_block}; when the caller receives from the same callee at
     * several statements, each id is qualified with {@code @statementId}.
     */
    private List<ReachingDefinition> returnDefinitions(FunctionCfg calleeCfg, String receiver,
                                                       String callBlockId, String callStatementId,
                                                       boolean qualify) {
        List<ReachingDefinition> defs = new ArrayList<>();
        String exit = calleeCfg.getExitBlockId();
        for (ReturnValueInfo info : returnAnalyzer.analyze(calleeCfg)) {
            if (info.getKind() == ReturnKind.VOID) {
                continue;
            }
            String id = calleeCfg.getName() + "_return_" + info.getBlockId()
                + (qualify ? "@" + callStatementId : "");
            List<String> path = Arrays.asList(exit != null ? exit : info.getBlockId(), callBlockId);
            defs.add(new ReachingDefinition(receiver, id, callBlockId, callStatementId, info.getBlockId(), path));
        }
        return defs;
    }

    // ============================================
    // LIBRARY CALLS
    // ============================================

    /**
     * Arguments written by summarized library calls are definitions at the call block.
     */
    private void injectSummaryEffects(FunctionCfg cfg, CallGraph graph, Map<String, List<ReachingDefinition>> injected) {
        for (FunctionCall call : graph.getCallsFrom(cfg.getName())) {
            FunctionMetadata metadata = graph.getFunction(call.getCalleeId());
            FunctionSummary summary = summaries.getSummary(call.getCalleeId());
            if (metadata == null || !metadata.isExternal() || summary == null) {
                continue;
            }
            String blockId = call.getCallSite().getBlockId();
            for (ParameterSummary parameter : summary.getParameters()) {
                if (!parameter.getMode().isWritten() || parameter.getIndex() >= call.getArguments().size()) {
                    continue;
                }
                String variable = StatementFactsExtractor.argumentVariable(call.getArguments().get(parameter.getIndex()));
                if (variable == null) {
                    continue;
                }
                String id = call.getCalleeId() + "_out_" + variable + "_" + call.getCallSite().getStatementId();
                List<ReachingDefinition> defs = injected.computeIfAbsent(blockId, ignored -> new ArrayList<>());
                addAll(defs, Collections.singletonList(
                    new ReachingDefinition(variable, id, blockId, call.getCallSite().getStatementId())));
            }
        }
    }

    private static boolean addAll(List<ReachingDefinition> target, List<ReachingDefinition> additions) {
        Set<String> ids = new HashSet<>();
        for (ReachingDefinition def : target) {
            ids.add(def.getDefinitionId());
        }
        boolean changed = false;
        for (ReachingDefinition def : additions) {
            if (ids.add(def.getDefinitionId())) {
                target.add(def);
                changed = true;
            }
        }
        return changed;
    }
}
