package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

// ============================================
// ReachingDefinitionsInfo: GEN/KILL/IN/OUT for one block
// ============================================
public class ReachingDefinitionsInfo {
    private final String blockId;
    private final Map<String, List<ReachingDefinition>> gen;
    private final Map<String, List<ReachingDefinition>> kill;
    private final Map<String, List<ReachingDefinition>> in;
    private final Map<String, List<ReachingDefinition>> out;

    public ReachingDefinitionsInfo(String blockId,
                                   Map<String, List<ReachingDefinition>> gen,
                                   Map<String, List<ReachingDefinition>> kill,
                                   Map<String, List<ReachingDefinition>> in,
                                   Map<String, List<ReachingDefinition>> out) {
        this.blockId = blockId;
        this.gen = freeze(gen);
        this.kill = freeze(kill);
        this.in = freeze(in);
        this.out = freeze(out);
    }

    private static Map<String, List<ReachingDefinition>> freeze(Map<String, List<ReachingDefinition>> source) {
        Map<String, List<ReachingDefinition>> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, List<ReachingDefinition>> entry : source.entrySet()) {
                copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Definition ids reaching the end of the block, for fixed-point comparison.
     */
    public Set<String> getOutDefinitionIds() {
        return definitionIds(out);
    }

    public Set<String> getInDefinitionIds() {
        return definitionIds(in);
    }

    private static Set<String> definitionIds(Map<String, List<ReachingDefinition>> facts) {
        Set<String> ids = new TreeSet<>();
        for (List<ReachingDefinition> defs : facts.values()) {
            for (ReachingDefinition def : defs) {
                ids.add(def.getDefinitionId());
            }
        }
        return ids;
    }

    public List<ReachingDefinition> getOutDefinitions(String variable) {
        List<ReachingDefinition> defs = out.get(variable);
        return defs != null ? defs : Collections.<ReachingDefinition>emptyList();
    }

    public List<ReachingDefinition> getInDefinitions(String variable) {
        List<ReachingDefinition> defs = in.get(variable);
        return defs != null ? defs : Collections.<ReachingDefinition>emptyList();
    }

    public String getBlockId() {
        return blockId;
    }

    public Map<String, List<ReachingDefinition>> getGen() {
        return gen;
    }

    public Map<String, List<ReachingDefinition>> getKill() {
        return kill;
    }

    public Map<String, List<ReachingDefinition>> getIn() {
        return in;
    }

    public Map<String, List<ReachingDefinition>> getOut() {
        return out;
    }
}
