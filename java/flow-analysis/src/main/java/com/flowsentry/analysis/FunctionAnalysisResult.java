package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ControlDependence;
import com.flowsentry.analysis.domain.TaintFact;
import com.flowsentry.analysis.domain.Vulnerability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// ============================================
// FunctionAnalysisResult: Complete analysis of one function
// ============================================
public class FunctionAnalysisResult {
    private final String functionName;
    private final String sourceFile;
    private LivenessResult liveness;
    private ReachingDefinitionsResult reachingDefinitions;
    private final Map<String, TaintFact> taintFacts;
    private final List<Vulnerability> vulnerabilities;
    private final Map<String, ControlDependence> controlDependences;
    private final Set<String> contexts;

    public FunctionAnalysisResult(String functionName, String sourceFile) {
        this.functionName = functionName;
        this.sourceFile = sourceFile;
        this.taintFacts = new LinkedHashMap<>();
        this.vulnerabilities = new ArrayList<>();
        this.controlDependences = new LinkedHashMap<>();
        this.contexts = new LinkedHashSet<>();
    }

    /**
     * Merge one taint run; results of several contexts accumulate.
     */
    public void addTaintResult(TaintAnalysisResult result) {
        if (result == null) {
            return;
        }
        contexts.add(result.getContextId());
        for (TaintFact fact : result.getFacts()) {
            if (!taintFacts.containsKey(fact.getKey())) {
                taintFacts.put(fact.getKey(), fact);
            }
        }
        vulnerabilities.addAll(result.getVulnerabilities());
        for (ControlDependence dependence : result.getControlDependences()) {
            String key = dependence.getConditionBlockId() + ":" + dependence.getConditionVariable();
            if (!controlDependences.containsKey(key)) {
                controlDependences.put(key, dependence);
            }
        }
    }

    public void setVulnerabilities(List<Vulnerability> newVulnerabilities) {
        vulnerabilities.clear();
        if (newVulnerabilities != null) {
            vulnerabilities.addAll(newVulnerabilities);
        }
    }

    public boolean isTainted(String variable) {
        for (TaintFact fact : taintFacts.values()) {
            if (fact.getVariable().equals(variable) && fact.isTainted()) {
                return true;
            }
        }
        return false;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public LivenessResult getLiveness() {
        return liveness;
    }

    public void setLiveness(LivenessResult liveness) {
        this.liveness = liveness;
    }

    public ReachingDefinitionsResult getReachingDefinitions() {
        return reachingDefinitions;
    }

    public void setReachingDefinitions(ReachingDefinitionsResult reachingDefinitions) {
        this.reachingDefinitions = reachingDefinitions;
    }

    public List<TaintFact> getTaintFacts() {
        return new ArrayList<>(taintFacts.values());
    }

    public List<Vulnerability> getVulnerabilities() {
        return vulnerabilities;
    }

    public List<ControlDependence> getControlDependences() {
        return new ArrayList<>(controlDependences.values());
    }

    public Set<String> getContexts() {
        return contexts;
    }
}
