package com.flowsentry.analysis.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

// ============================================
// ControlDependence: Blocks governed by a tainted condition
// ============================================
public class ControlDependence {
    private final String functionName;
    private final String conditionBlockId;
    private final String conditionStatementId;
    private final String conditionVariable;
    private final Set<String> dependentBlocks;

    public ControlDependence(String functionName, String conditionBlockId, String conditionStatementId,
                             String conditionVariable, Set<String> dependentBlocks) {
        this.functionName = functionName;
        this.conditionBlockId = conditionBlockId;
        this.conditionStatementId = conditionStatementId;
        this.conditionVariable = conditionVariable;
        this.dependentBlocks = Collections.unmodifiableSet(new LinkedHashSet<>(dependentBlocks));
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getConditionBlockId() {
        return conditionBlockId;
    }

    public String getConditionStatementId() {
        return conditionStatementId;
    }

    public String getConditionVariable() {
        return conditionVariable;
    }

    public Set<String> getDependentBlocks() {
        return dependentBlocks;
    }
}
