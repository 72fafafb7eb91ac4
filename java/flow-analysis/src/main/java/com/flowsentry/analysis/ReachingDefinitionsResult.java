package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.ReachingDefinition;
import com.flowsentry.analysis.domain.ReachingDefinitionsInfo;
import com.flowsentry.analysis.domain.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// ReachingDefinitionsResult: Per-block reaching definitions of one function
// ============================================
public class ReachingDefinitionsResult {
    private final String functionName;
    private final Map<String, ReachingDefinitionsInfo> blocks;
    private final List<ReachingDefinition> definitions;
    private final Map<String, List<ReachingDefinition>> definitionsByStatement;
    private final Map<String, List<ReachingDefinition>> entryDefinitions;
    private final boolean converged;
    private final int iterations;

    public ReachingDefinitionsResult(String functionName,
                                     Map<String, ReachingDefinitionsInfo> blocks,
                                     List<ReachingDefinition> definitions,
                                     Map<String, List<ReachingDefinition>> definitionsByStatement,
                                     Map<String, List<ReachingDefinition>> entryDefinitions,
                                     boolean converged, int iterations) {
        this.functionName = functionName;
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
        this.definitionsByStatement = Collections.unmodifiableMap(new LinkedHashMap<>(definitionsByStatement));
        this.entryDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(entryDefinitions));
        this.converged = converged;
        this.iterations = iterations;
    }

    public ReachingDefinitionsInfo getBlock(String blockId) {
        return blocks.get(blockId);
    }

    /**
     * Definitions reaching the statement at {@code statementIndex} of {@code blockId}, keyed
     * by variable: IN[B] updated by the block's own earlier statements.
     */
    public Map<String, List<ReachingDefinition>> reachingStatement(FunctionCfg cfg, String blockId, int statementIndex) {
        Map<String, List<ReachingDefinition>> reaching = new LinkedHashMap<>();
        ReachingDefinitionsInfo info = blocks.get(blockId);
        BasicBlock block = cfg.getBlock(blockId);
        if (info == null || block == null) {
            return reaching;
        }
        for (Map.Entry<String, List<ReachingDefinition>> entry : info.getIn().entrySet()) {
            reaching.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        if (blockId.equals(cfg.getEntryBlockId())) {
            // parameters and caller seeds are live on entry but only appear in GEN
            for (Map.Entry<String, List<ReachingDefinition>> entry : entryDefinitions.entrySet()) {
                List<ReachingDefinition> defs = reaching.computeIfAbsent(entry.getKey(), ignored -> new ArrayList<>());
                for (ReachingDefinition def : entry.getValue()) {
                    if (!defs.contains(def)) {
                        defs.add(def);
                    }
                }
            }
        }
        List<Statement> statements = block.getStatements();
        for (int i = 0; i < statementIndex && i < statements.size(); i++) {
            List<ReachingDefinition> local = definitionsByStatement.get(statements.get(i).getId());
            if (local == null) {
                continue;
            }
            Map<String, List<ReachingDefinition>> byVariable = new LinkedHashMap<>();
            for (ReachingDefinition def : local) {
                byVariable.computeIfAbsent(def.getVariable(), ignored -> new ArrayList<>()).add(def);
            }
            reaching.putAll(byVariable);
        }
        return reaching;
    }

    public String getFunctionName() {
        return functionName;
    }

    public Map<String, ReachingDefinitionsInfo> getBlocks() {
        return blocks;
    }

    public List<ReachingDefinition> getDefinitions() {
        return definitions;
    }

    public List<ReachingDefinition> getDefinitionsOf(String statementId) {
        List<ReachingDefinition> defs = definitionsByStatement.get(statementId);
        return defs != null ? defs : Collections.<ReachingDefinition>emptyList();
    }

    public boolean isConverged() {
        return converged;
    }

    public int getIterations() {
        return iterations;
    }
}
