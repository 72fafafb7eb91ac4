package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// ReachingDefinition: Definition with propagation history
// ============================================
public class ReachingDefinition {
    private final String variable;
    private final String definitionId;
    private final String blockId;
    private final String statementId;
    private final String sourceBlock;
    private final List<String> propagationPath;

    public ReachingDefinition(String variable, String definitionId, String blockId, String statementId) {
        this(variable, definitionId, blockId, statementId, blockId, Collections.singletonList(blockId));
    }

    public ReachingDefinition(String variable, String definitionId, String blockId, String statementId,
                              String sourceBlock, List<String> propagationPath) {
        this.variable = variable;
        this.definitionId = definitionId;
        this.blockId = blockId;
        this.statementId = statementId;
        this.sourceBlock = sourceBlock != null ? sourceBlock : blockId;
        this.propagationPath = propagationPath != null
            ? Collections.unmodifiableList(new ArrayList<>(propagationPath))
            : Collections.<String>emptyList();
    }

    /**
     * Copy whose path is extended by {@code nextBlockId}. When the block is already on the
     * path, the cycle is compacted into a {@code [a->b]*} marker followed by the block id.
     */
    public ReachingDefinition propagateTo(String nextBlockId) {
        List<String> path = new ArrayList<>();
        int cycleStart = propagationPath.indexOf(nextBlockId);
        if (cycleStart >= 0) {
            path.addAll(propagationPath.subList(0, cycleStart));
            path.add(cycleMarker(propagationPath.subList(cycleStart, propagationPath.size())));
        } else {
            path.addAll(propagationPath);
        }
        path.add(nextBlockId);
        return new ReachingDefinition(variable, definitionId, blockId, statementId, sourceBlock, path);
    }

    public ReachingDefinition withPath(List<String> path) {
        return new ReachingDefinition(variable, definitionId, blockId, statementId, sourceBlock, path);
    }

    public static boolean isCycleMarker(String pathEntry) {
        return pathEntry != null && pathEntry.startsWith("[") && pathEntry.endsWith("]*");
    }

    private static String cycleMarker(List<String> cycle) {
        return "[" + String.join("->", cycle) + "]*";
    }

    public String getVariable() {
        return variable;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public String getBlockId() {
        return blockId;
    }

    public String getStatementId() {
        return statementId;
    }

    public String getSourceBlock() {
        return sourceBlock;
    }

    public List<String> getPropagationPath() {
        return propagationPath;
    }

    @Override
    public String toString() {
        return variable + "@" + definitionId + " " + String.join(" -> ", propagationPath);
    }
}
