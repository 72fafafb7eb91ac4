package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Blocks controlled by a conditional, computed from immediate post-dominators.
 *
 * <p>All exit candidates flow into a virtual exit so functions with several returns have a
 * single post-dominator root. The region of a conditional is everything reachable from its
 * successors before its immediate post-dominator (the merge point).</p>
 */
public class ControlDependenceAnalyzer {

    static final String VIRTUAL_EXIT = "<exit>";

    private final FunctionCfg cfg;
    private Map<String, String> immediatePostDominators;

    public ControlDependenceAnalyzer(FunctionCfg cfg) {
        this.cfg = cfg;
    }

    /**
     * Blocks control-dependent on the conditional ending {@code conditionBlockId}. Empty
     * blocks and the merge point are never included.
     */
    public Set<String> dependentBlocks(String conditionBlockId, SensitivityLevel level) {
        Set<String> dependent = new LinkedHashSet<>();
        BasicBlock condition = cfg.getBlock(conditionBlockId);
        if (condition == null || condition.getSuccessors().size() < 2 || !level.isControlDependenceEnabled()) {
            return dependent;
        }
        String merge = getImmediatePostDominator(conditionBlockId);

        if (!level.isNestedControlDependenceEnabled()) {
            for (String successor : condition.getSuccessors()) {
                BasicBlock block = cfg.getBlock(successor);
                if (block != null && !successor.equals(merge) && !block.isEmpty()) {
                    dependent.add(successor);
                }
            }
            return dependent;
        }

        List<Set<String>> branches = new ArrayList<>();
        Set<String> region = new LinkedHashSet<>();
        for (String successor : new LinkedHashSet<>(condition.getSuccessors())) {
            Set<String> reached = regionFrom(successor, conditionBlockId, merge);
            branches.add(reached);
            region.addAll(reached);
        }

        for (String blockId : region) {
            BasicBlock block = cfg.getBlock(blockId);
            if (block == null || block.isEmpty()) {
                continue;
            }
            if (level.isPathSensitive()) {
                int reachingBranches = 0;
                for (Set<String> branch : branches) {
                    if (branch.contains(blockId)) {
                        reachingBranches++;
                    }
                }
                if (reachingBranches == branches.size()) {
                    continue;
                }
            }
            dependent.add(blockId);
        }
        return dependent;
    }

    /**
     * Immediate post-dominator of {@code blockId}; {@link #VIRTUAL_EXIT} for blocks that
     * leave the function, null when no exit is reachable.
     */
    public String getImmediatePostDominator(String blockId) {
        if (immediatePostDominators == null) {
            immediatePostDominators = computeImmediatePostDominators();
        }
        return immediatePostDominators.get(blockId);
    }

    private Set<String> regionFrom(String start, String conditionBlockId, String merge) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(merge) || current.equals(conditionBlockId) || !reached.add(current)) {
                continue;
            }
            for (String successor : cfg.getSuccessors(current)) {
                if (cfg.getBlock(successor) != null) {
                    stack.push(successor);
                }
            }
        }
        return reached;
    }

    // ============================================
    // POST-DOMINATORS
    // ============================================

    private Map<String, String> computeImmediatePostDominators() {
        Set<String> all = new LinkedHashSet<>(cfg.getBlocks().keySet());
        all.add(VIRTUAL_EXIT);

        Map<String, List<String>> successors = new HashMap<>();
        for (BasicBlock block : cfg.getBasicBlocks()) {
            List<String> targets = new ArrayList<>();
            for (String successor : block.getSuccessors()) {
                if (cfg.getBlock(successor) != null) {
                    targets.add(successor);
                }
            }
            if (targets.isEmpty() || block.getId().equals(cfg.getExitBlockId())) {
                targets.add(VIRTUAL_EXIT);
            }
            successors.put(block.getId(), targets);
        }

        Map<String, Set<String>> postDominators = new HashMap<>();
        for (String blockId : all) {
            if (VIRTUAL_EXIT.equals(blockId)) {
                Set<String> self = new HashSet<>();
                self.add(VIRTUAL_EXIT);
                postDominators.put(blockId, self);
            } else {
                postDominators.put(blockId, new HashSet<>(all));
            }
        }

        List<String> order = CfgTraversal.reversePostorderBackward(cfg);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String blockId : order) {
                Set<String> updated = null;
                for (String successor : successors.get(blockId)) {
                    if (updated == null) {
                        updated = new HashSet<>(postDominators.get(successor));
                    } else {
                        updated.retainAll(postDominators.get(successor));
                    }
                }
                if (updated == null) {
                    updated = new HashSet<>();
                }
                updated.add(blockId);
                if (!updated.equals(postDominators.get(blockId))) {
                    postDominators.put(blockId, updated);
                    changed = true;
                }
            }
        }

        Map<String, String> immediate = new HashMap<>();
        for (String blockId : cfg.getBlocks().keySet()) {
            Set<String> dominators = postDominators.get(blockId);
            if (dominators.size() == all.size() && !dominators.isEmpty()) {
                // no path to the exit
                continue;
            }
            for (String candidate : dominators) {
                if (!candidate.equals(blockId) && postDominators.get(candidate).size() == dominators.size() - 1) {
                    immediate.put(blockId, candidate);
                    break;
                }
            }
        }
        return immediate;
    }
}
