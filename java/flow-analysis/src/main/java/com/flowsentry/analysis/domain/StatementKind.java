package com.flowsentry.analysis.domain;

import java.util.Locale;

/**
 * Statement kinds delivered by the CFG exporter.
 */
public enum StatementKind {
    ASSIGNMENT("assignment"),
    CONDITIONAL("conditional"),
    LOOP("loop"),
    RETURN("return"),
    DECLARATION("declaration"),
    FUNCTION_CALL("function_call"),
    OTHER("other");

    private final String label;

    StatementKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Kinds that may carry a branch condition.
     */
    public boolean isBranching() {
        return this == CONDITIONAL || this == LOOP;
    }

    /**
     * Resolve an exporter label; returns null for anything unrecognized.
     */
    public static StatementKind fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if ("call".equals(normalized)) {
            return FUNCTION_CALL;
        }
        for (StatementKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
