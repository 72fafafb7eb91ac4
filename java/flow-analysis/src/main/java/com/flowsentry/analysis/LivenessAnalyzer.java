package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.LivenessInfo;
import com.flowsentry.analysis.domain.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Backward live-variable analysis.
 *
 * IN[B] = USE[B] + (OUT[B] - DEF[B]) and OUT[B] = union of IN[S] over the successors of B.
 * Each round computes every block from the previous round's snapshot and commits the whole
 * round at once, so the result does not depend on the visiting order.
 */
public class LivenessAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(LivenessAnalyzer.class);
    private static final int ITERATIONS_PER_BLOCK = 10;

    private final AnalysisDiagnostics diagnostics;

    public LivenessAnalyzer(AnalysisDiagnostics diagnostics) {
        this.diagnostics = diagnostics != null ? diagnostics : new AnalysisDiagnostics();
    }

    public LivenessResult analyze(FunctionCfg cfg) {
        List<String> order = CfgTraversal.reversePostorderBackward(cfg);
        Map<String, Set<String>> use = new HashMap<>();
        Map<String, Set<String>> def = new HashMap<>();
        for (BasicBlock block : cfg.getBasicBlocks()) {
            computeUseDef(block, use, def);
        }

        Map<String, Set<String>> in = new HashMap<>();
        Map<String, Set<String>> out = new HashMap<>();
        for (String blockId : order) {
            in.put(blockId, new LinkedHashSet<String>());
            out.put(blockId, new LinkedHashSet<String>());
        }

        int maxIterations = Math.max(1, ITERATIONS_PER_BLOCK * cfg.getBlockCount());
        int iterations = 0;
        boolean changed = true;
        while (changed && iterations < maxIterations) {
            iterations++;
            changed = false;
            Map<String, Set<String>> nextIn = new HashMap<>();
            Map<String, Set<String>> nextOut = new HashMap<>();
            for (String blockId : order) {
                Set<String> newOut = new LinkedHashSet<>();
                for (String successor : cfg.getSuccessors(blockId)) {
                    Set<String> successorIn = in.get(successor);
                    if (successorIn != null) {
                        newOut.addAll(successorIn);
                    }
                }
                Set<String> newIn = new LinkedHashSet<>(use.get(blockId));
                for (String variable : newOut) {
                    if (!def.get(blockId).contains(variable)) {
                        newIn.add(variable);
                    }
                }
                if (!newIn.equals(in.get(blockId)) || !newOut.equals(out.get(blockId))) {
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
            diagnostics.warn(LOG, "liveness", cfg.getName(),
                "liveness did not converge within " + maxIterations + " iterations");
        }
        LOG.debug("Liveness for {} finished after {} iterations", cfg.getName(), iterations);

        Map<String, LivenessInfo> infos = new LinkedHashMap<>();
        for (BasicBlock block : cfg.getBasicBlocks()) {
            String id = block.getId();
            infos.put(id, new LivenessInfo(id, use.get(id), def.get(id), in.get(id), out.get(id)));
        }
        return new LivenessResult(cfg.getName(), infos, converged, iterations);
    }

    /**
     * USE holds variables read before any write in the block; DEF holds every written variable.
     */
    private static void computeUseDef(BasicBlock block, Map<String, Set<String>> use, Map<String, Set<String>> def) {
        Set<String> blockUse = new LinkedHashSet<>();
        Set<String> blockDef = new LinkedHashSet<>();
        for (Statement statement : block.getStatements()) {
            for (String variable : statement.getUsedVariables()) {
                if (!blockDef.contains(variable)) {
                    blockUse.add(variable);
                }
            }
            blockDef.addAll(statement.getDefinedVariables());
        }
        use.put(block.getId(), blockUse);
        def.put(block.getId(), blockDef);
    }
}
