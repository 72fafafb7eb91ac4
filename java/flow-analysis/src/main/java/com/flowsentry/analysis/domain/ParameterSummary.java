package com.flowsentry.analysis.domain;

// ============================================
// ParameterSummary: Modeled effect of one library parameter
// ============================================
public class ParameterSummary {
    private final int index;
    private final String name;
    private final ParameterMode mode;
    private final boolean taintPropagation;

    public ParameterSummary(int index, String name, ParameterMode mode, boolean taintPropagation) {
        this.index = index;
        this.name = name;
        this.mode = mode;
        this.taintPropagation = taintPropagation;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public ParameterMode getMode() {
        return mode;
    }

    /**
     * True when taint in this argument flows into the written arguments.
     */
    public boolean isTaintPropagation() {
        return taintPropagation;
    }
}
