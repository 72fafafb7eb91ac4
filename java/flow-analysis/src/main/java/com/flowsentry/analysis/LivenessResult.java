package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.LivenessInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

// ============================================
// LivenessResult: Per-block liveness of one function
// ============================================
public class LivenessResult {
    private final String functionName;
    private final Map<String, LivenessInfo> blocks;
    private final boolean converged;
    private final int iterations;

    public LivenessResult(String functionName, Map<String, LivenessInfo> blocks, boolean converged, int iterations) {
        this.functionName = functionName;
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
        this.converged = converged;
        this.iterations = iterations;
    }

    public LivenessInfo getBlock(String blockId) {
        return blocks.get(blockId);
    }

    public Set<String> getLiveIn(String blockId) {
        LivenessInfo info = blocks.get(blockId);
        return info != null ? info.getIn() : Collections.<String>emptySet();
    }

    public Set<String> getLiveOut(String blockId) {
        LivenessInfo info = blocks.get(blockId);
        return info != null ? info.getOut() : Collections.<String>emptySet();
    }

    public String getFunctionName() {
        return functionName;
    }

    public Map<String, LivenessInfo> getBlocks() {
        return blocks;
    }

    public boolean isConverged() {
        return converged;
    }

    public int getIterations() {
        return iterations;
    }
}
