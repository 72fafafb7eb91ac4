package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Block orderings and reachability queries over a validated {@link FunctionCfg}.
 */
public final class CfgTraversal {

    private CfgTraversal() {
    }

    /**
     * Reverse postorder from the entry block; unreachable blocks follow in declaration order.
     */
    public static List<String> reversePostorder(FunctionCfg cfg) {
        List<String> roots = new ArrayList<>();
        if (cfg.getEntryBlockId() != null) {
            roots.add(cfg.getEntryBlockId());
        }
        return withUnreachable(cfg, postorder(cfg, roots, true));
    }

    /**
     * Reverse postorder of the reversed graph, rooted at the exit candidates. Backward
     * problems converge fastest in this order.
     */
    public static List<String> reversePostorderBackward(FunctionCfg cfg) {
        return withUnreachable(cfg, postorder(cfg, cfg.getExitCandidates(), false));
    }

    /**
     * Blocks reachable from {@code start}, including {@code start}.
     */
    public static Set<String> reachableFrom(FunctionCfg cfg, String start) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (cfg.getBlock(current) == null || !seen.add(current)) {
                continue;
            }
            for (String successor : cfg.getSuccessors(current)) {
                stack.push(successor);
            }
        }
        return seen;
    }

    private static List<String> postorder(FunctionCfg cfg, List<String> roots, boolean forward) {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String root : roots) {
            if (cfg.getBlock(root) == null || !visited.add(root)) {
                continue;
            }
            // iterative DFS: each frame keeps the iterator of the edges still to visit
            Deque<String> nodes = new ArrayDeque<>();
            Deque<Iterator<String>> edges = new ArrayDeque<>();
            nodes.push(root);
            edges.push(next(cfg, root, forward).iterator());
            while (!nodes.isEmpty()) {
                Iterator<String> it = edges.peek();
                if (it.hasNext()) {
                    String child = it.next();
                    if (cfg.getBlock(child) != null && visited.add(child)) {
                        nodes.push(child);
                        edges.push(next(cfg, child, forward).iterator());
                    }
                } else {
                    order.add(nodes.pop());
                    edges.pop();
                }
            }
        }
        Collections.reverse(order);
        return order;
    }

    private static List<String> next(FunctionCfg cfg, String blockId, boolean forward) {
        return forward ? cfg.getSuccessors(blockId) : cfg.getPredecessors(blockId);
    }

    private static List<String> withUnreachable(FunctionCfg cfg, List<String> order) {
        Set<String> seen = new HashSet<>(order);
        List<String> result = new ArrayList<>(order);
        for (BasicBlock block : cfg.getBasicBlocks()) {
            if (!seen.contains(block.getId())) {
                result.add(block.getId());
            }
        }
        return result;
    }
}
