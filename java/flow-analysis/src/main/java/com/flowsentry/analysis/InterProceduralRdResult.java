package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ReachingDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// InterProceduralRdResult: Reaching definitions after call-graph propagation
// ============================================
public class InterProceduralRdResult {
    private final Map<String, ReachingDefinitionsResult> functions;
    private final Map<String, List<ReachingDefinition>> parameterDefinitions;
    private final Map<String, List<ReachingDefinition>> returnDefinitions;
    private final boolean converged;
    private final int iterations;

    public InterProceduralRdResult(Map<String, ReachingDefinitionsResult> functions,
                                   Map<String, List<ReachingDefinition>> parameterDefinitions,
                                   Map<String, List<ReachingDefinition>> returnDefinitions,
                                   boolean converged, int iterations) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.parameterDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(parameterDefinitions));
        this.returnDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(returnDefinitions));
        this.converged = converged;
        this.iterations = iterations;
    }

    public ReachingDefinitionsResult getFunction(String name) {
        return functions.get(name);
    }

    public Map<String, ReachingDefinitionsResult> getFunctions() {
        return functions;
    }

    /**
     * Synthetic definitions of each function's formals, created from its callers.
     */
    public List<ReachingDefinition> getParameterDefinitions(String function) {
        List<ReachingDefinition> defs = parameterDefinitions.get(function);
        return defs != null ? defs : Collections.<ReachingDefinition>emptyList();
    }

    /**
     * Definitions added to each function by the values its callees return.
     */
    public List<ReachingDefinition> getReturnDefinitions(String function) {
        List<ReachingDefinition> defs = returnDefinitions.get(function);
        return defs != null ? defs : Collections.<ReachingDefinition>emptyList();
    }

    public Map<String, List<ReachingDefinition>> getParameterDefinitions() {
        return parameterDefinitions;
    }

    public Map<String, List<ReachingDefinition>> getReturnDefinitions() {
        return returnDefinitions;
    }

    public boolean isConverged() {
        return converged;
    }

    public int getIterations() {
        return iterations;
    }
}
