package com.flowsentry.analysis.domain;

// ============================================
// TaintSource: Untrusted input point
// ============================================
public class TaintSource {
    private final String functionName;
    private final TaintSourceCategory category;
    private final int argumentIndex; // -1 when the return value carries the taint
    private final String description;

    public TaintSource(String functionName, TaintSourceCategory category, int argumentIndex, String description) {
        this.functionName = functionName;
        this.category = category;
        this.argumentIndex = argumentIndex;
        this.description = description;
    }

    public boolean taintsReturnValue() {
        return argumentIndex < 0;
    }

    public String getFunctionName() {
        return functionName;
    }

    public TaintSourceCategory getCategory() {
        return category;
    }

    public int getArgumentIndex() {
        return argumentIndex;
    }

    public String getDescription() {
        return description;
    }
}
