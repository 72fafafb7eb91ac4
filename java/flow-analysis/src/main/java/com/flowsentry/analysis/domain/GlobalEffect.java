package com.flowsentry.analysis.domain;

// ============================================
// GlobalEffect: Global state touched by a library call
// ============================================
public class GlobalEffect {
    private final String variable;
    private final boolean modified;
    private final boolean tainted;

    public GlobalEffect(String variable, boolean modified, boolean tainted) {
        this.variable = variable;
        this.modified = modified;
        this.tainted = tainted;
    }

    public String getVariable() {
        return variable;
    }

    public boolean isModified() {
        return modified;
    }

    public boolean isTainted() {
        return tainted;
    }
}
