package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.ReachingDefinition;
import com.flowsentry.analysis.domain.ReachingDefinitionsInfo;
import com.flowsentry.analysis.domain.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forward reaching-definitions analysis with propagation paths.
 *
 * <p>Definition ids are {@code d0, d1, ...}: formal parameters first, then statement
 * definitions in block and statement order. GEN keeps only the last definition of each
 * variable in a block. Parameters are generated at the entry block unless the entry block
 * redefines them.</p>
 *
 * <p>The inter-procedural solver re-runs this analysis with extra definitions: entry seeds
 * behave like parameters, block injections take effect right after the statement that
 * produced them and are killed by later redefinitions in the same block.</p>
 */
public class ReachingDefinitionsAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ReachingDefinitionsAnalyzer.class);
    private static final int ITERATIONS_PER_BLOCK = 10;

    private final AnalysisDiagnostics diagnostics;

    public ReachingDefinitionsAnalyzer(AnalysisDiagnostics diagnostics) {
        this.diagnostics = diagnostics != null ? diagnostics : new AnalysisDiagnostics();
    }

    public ReachingDefinitionsResult analyze(FunctionCfg cfg) {
        return analyze(cfg, Collections.<ReachingDefinition>emptyList(),
            Collections.<String, List<ReachingDefinition>>emptyMap());
    }

    public ReachingDefinitionsResult analyze(FunctionCfg cfg,
                                             List<ReachingDefinition> entrySeeds,
                                             Map<String, List<ReachingDefinition>> blockInjections) {
        String entryId = cfg.getEntryBlockId();
        BasicBlock entryBlock = cfg.getEntryBlock();
        Set<String> definedAtEntry = entryBlock != null ? definedIn(entryBlock) : Collections.<String>emptySet();

        // ============================================
        // NUMBER DEFINITIONS
        // ============================================
        List<ReachingDefinition> allDefinitions = new ArrayList<>();
        Map<String, List<ReachingDefinition>> definitionsByStatement = new LinkedHashMap<>();
        Map<String, Map<String, List<ReachingDefinition>>> gen = new HashMap<>();
        int counter = 0;

        Map<String, List<ReachingDefinition>> entryGen = new LinkedHashMap<>();
        Map<String, List<ReachingDefinition>> entryDefinitions = new LinkedHashMap<>();
        if (entryId != null) {
            for (String parameter : cfg.getParameters()) {
                ReachingDefinition def = new ReachingDefinition(parameter, "d" + counter++, entryId,
                    entryId + "_param_" + parameter);
                allDefinitions.add(def);
                entryDefinitions.computeIfAbsent(parameter, ignored -> new ArrayList<>()).add(def);
                if (!definedAtEntry.contains(parameter)) {
                    entryGen.put(parameter, single(def));
                }
            }
            for (ReachingDefinition seed : entrySeeds) {
                allDefinitions.add(seed);
                entryDefinitions.computeIfAbsent(seed.getVariable(), ignored -> new ArrayList<>()).add(seed);
                if (!definedAtEntry.contains(seed.getVariable())) {
                    entryGen.computeIfAbsent(seed.getVariable(), ignored -> new ArrayList<>()).add(seed);
                }
            }
        }

        for (BasicBlock block : cfg.getBasicBlocks()) {
            Map<String, List<ReachingDefinition>> blockGen = block.getId().equals(entryId)
                ? entryGen : new LinkedHashMap<String, List<ReachingDefinition>>();
            Map<String, List<ReachingDefinition>> injectedAt = injectionsByStatement(block, blockInjections);
            for (Statement statement : block.getStatements()) {
                List<ReachingDefinition> statementDefs = new ArrayList<>();
                for (String variable : statement.getDefinedVariables()) {
                    ReachingDefinition def = new ReachingDefinition(variable, "d" + counter++,
                        block.getId(), statement.getId());
                    allDefinitions.add(def);
                    statementDefs.add(def);
                    blockGen.put(variable, single(def));
                }
                List<ReachingDefinition> injected = injectedAt.remove(statement.getId());
                if (injected != null) {
                    Set<String> redefined = new HashSet<>(statement.getDefinedVariables());
                    for (ReachingDefinition def : injected) {
                        allDefinitions.add(def);
                        statementDefs.add(def);
                        if (redefined.add(def.getVariable())) {
                            blockGen.put(def.getVariable(), single(def));
                        } else {
                            addOnce(blockGen.get(def.getVariable()), def);
                        }
                    }
                }
                definitionsByStatement.put(statement.getId(), statementDefs);
            }
            // injections without a matching statement act at the end of the block
            for (List<ReachingDefinition> injected : injectedAt.values()) {
                for (ReachingDefinition def : injected) {
                    allDefinitions.add(def);
                    addOnce(blockGen.computeIfAbsent(def.getVariable(), ignored -> new ArrayList<>()), def);
                }
            }
            gen.put(block.getId(), blockGen);
        }

        Map<String, Map<String, List<ReachingDefinition>>> kill = new HashMap<>();
        for (BasicBlock block : cfg.getBasicBlocks()) {
            kill.put(block.getId(), computeKill(definedIn(block), gen.get(block.getId()), allDefinitions));
        }

        // ============================================
        // FIXED POINT
        // ============================================
        List<String> order = CfgTraversal.reversePostorder(cfg);
        Map<String, Map<String, List<ReachingDefinition>>> in = new HashMap<>();
        Map<String, Map<String, List<ReachingDefinition>>> out = new HashMap<>();
        for (String blockId : order) {
            in.put(blockId, new LinkedHashMap<String, List<ReachingDefinition>>());
            out.put(blockId, copy(gen.get(blockId)));
        }

        int maxIterations = Math.max(1, ITERATIONS_PER_BLOCK * cfg.getBlockCount());
        int iterations = 0;
        boolean changed = true;
        while (changed && iterations < maxIterations) {
            iterations++;
            changed = false;
            Map<String, Map<String, List<ReachingDefinition>>> nextIn = new HashMap<>();
            Map<String, Map<String, List<ReachingDefinition>>> nextOut = new HashMap<>();
            for (String blockId : order) {
                Map<String, List<ReachingDefinition>> newIn = mergePredecessors(cfg, blockId, out, in.get(blockId));
                Map<String, List<ReachingDefinition>> newOut = transfer(gen.get(blockId), kill.get(blockId), newIn);
                if (!ids(newIn).equals(ids(in.get(blockId))) || !ids(newOut).equals(ids(out.get(blockId)))) {
                    changed = true;
                }
                nextIn.put(blockId, newIn);
                nextOut.put(blockId, newOut);
            }
            in = nextIn;
            out = nextOut;
        }

        boolean converged = !changed;
        if (!converged) {
            diagnostics.warn(LOG, "reaching-definitions", cfg.getName(),
                "reaching definitions did not converge within " + maxIterations + " iterations");
        }
        LOG.debug("Reaching definitions for {}: {} definitions, {} iterations",
            cfg.getName(), allDefinitions.size(), iterations);

        Map<String, ReachingDefinitionsInfo> infos = new LinkedHashMap<>();
        for (BasicBlock block : cfg.getBasicBlocks()) {
            String id = block.getId();
            infos.put(id, new ReachingDefinitionsInfo(id, gen.get(id), kill.get(id), in.get(id), out.get(id)));
        }
        return new ReachingDefinitionsResult(cfg.getName(), infos, allDefinitions, definitionsByStatement,
            entryDefinitions, converged, iterations);
    }

    /**
     * Union of the predecessors' OUT. A definition id already in the previous IN keeps its
     * previous path; new ids get the block appended. The first predecessor delivering an id wins.
     */
    private static Map<String, List<ReachingDefinition>> mergePredecessors(
            FunctionCfg cfg, String blockId,
            Map<String, Map<String, List<ReachingDefinition>>> out,
            Map<String, List<ReachingDefinition>> previousIn) {
        Map<String, ReachingDefinition> previousById = new HashMap<>();
        for (List<ReachingDefinition> defs : previousIn.values()) {
            for (ReachingDefinition def : defs) {
                previousById.put(def.getDefinitionId(), def);
            }
        }
        Map<String, List<ReachingDefinition>> merged = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (String predecessor : cfg.getPredecessors(blockId)) {
            Map<String, List<ReachingDefinition>> predecessorOut = out.get(predecessor);
            if (predecessorOut == null) {
                continue;
            }
            for (List<ReachingDefinition> defs : predecessorOut.values()) {
                for (ReachingDefinition def : defs) {
                    if (!seen.add(def.getDefinitionId())) {
                        continue;
                    }
                    ReachingDefinition previous = previousById.get(def.getDefinitionId());
                    ReachingDefinition propagated = previous != null ? previous : def.propagateTo(blockId);
                    merged.computeIfAbsent(def.getVariable(), ignored -> new ArrayList<>()).add(propagated);
                }
            }
        }
        return merged;
    }

    private static Map<String, List<ReachingDefinition>> transfer(Map<String, List<ReachingDefinition>> gen,
                                                                  Map<String, List<ReachingDefinition>> kill,
                                                                  Map<String, List<ReachingDefinition>> in) {
        Map<String, List<ReachingDefinition>> result = copy(gen);
        Set<String> killed = ids(kill);
        Set<String> present = ids(gen);
        for (Map.Entry<String, List<ReachingDefinition>> entry : in.entrySet()) {
            for (ReachingDefinition def : entry.getValue()) {
                if (!killed.contains(def.getDefinitionId()) && present.add(def.getDefinitionId())) {
                    result.computeIfAbsent(entry.getKey(), ignored -> new ArrayList<>()).add(def);
                }
            }
        }
        return result;
    }

    /**
     * Every definition of a variable written in the block, other than the block's own GEN entry.
     */
    private static Map<String, List<ReachingDefinition>> computeKill(Set<String> definedVariables,
                                                                     Map<String, List<ReachingDefinition>> blockGen,
                                                                     List<ReachingDefinition> allDefinitions) {
        Set<String> generated = ids(blockGen);
        Map<String, List<ReachingDefinition>> kill = new LinkedHashMap<>();
        for (ReachingDefinition def : allDefinitions) {
            if (definedVariables.contains(def.getVariable()) && !generated.contains(def.getDefinitionId())) {
                kill.computeIfAbsent(def.getVariable(), ignored -> new ArrayList<>()).add(def);
            }
        }
        return kill;
    }

    private static Set<String> definedIn(BasicBlock block) {
        Set<String> defined = new LinkedHashSet<>();
        for (Statement statement : block.getStatements()) {
            defined.addAll(statement.getDefinedVariables());
        }
        return defined;
    }

    private static Set<String> ids(Map<String, List<ReachingDefinition>> facts) {
        Set<String> ids = new HashSet<>();
        for (List<ReachingDefinition> defs : facts.values()) {
            for (ReachingDefinition def : defs) {
                ids.add(def.getDefinitionId());
            }
        }
        return ids;
    }

    private static Map<String, List<ReachingDefinition>> injectionsByStatement(
            BasicBlock block, Map<String, List<ReachingDefinition>> blockInjections) {
        Map<String, List<ReachingDefinition>> byStatement = new LinkedHashMap<>();
        List<ReachingDefinition> injected = blockInjections.get(block.getId());
        if (injected == null) {
            return byStatement;
        }
        for (ReachingDefinition def : injected) {
            String key = def.getStatementId() != null ? def.getStatementId() : "";
            addOnce(byStatement.computeIfAbsent(key, ignored -> new ArrayList<>()), def);
        }
        return byStatement;
    }

    private static void addOnce(List<ReachingDefinition> defs, ReachingDefinition def) {
        for (ReachingDefinition existing : defs) {
            if (existing.getDefinitionId().equals(def.getDefinitionId())) {
                return;
            }
        }
        defs.add(def);
    }

    private static Map<String, List<ReachingDefinition>> copy(Map<String, List<ReachingDefinition>> source) {
        Map<String, List<ReachingDefinition>> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<ReachingDefinition>> entry : source.entrySet()) {
            result.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return result;
    }

    private static List<ReachingDefinition> single(ReachingDefinition def) {
        List<ReachingDefinition> list = new ArrayList<>();
        list.add(def);
        return list;
    }
}
