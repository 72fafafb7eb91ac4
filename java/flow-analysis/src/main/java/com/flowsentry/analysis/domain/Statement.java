package com.flowsentry.analysis.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

// ============================================
// Statement: One exported CFG element with use/def facts
// ============================================
public class Statement {
    private final String id;
    private final StatementKind kind;
    private final String text;
    private final Set<String> definedVariables;
    private final Set<String> usedVariables;
    private final SourceRange range;

    public Statement(String id, StatementKind kind, String text,
                     Set<String> definedVariables, Set<String> usedVariables,
                     SourceRange range) {
        this.id = id;
        this.kind = kind != null ? kind : StatementKind.OTHER;
        this.text = text != null ? text : "";
        this.definedVariables = definedVariables != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(definedVariables))
            : Collections.<String>emptySet();
        this.usedVariables = usedVariables != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(usedVariables))
            : Collections.<String>emptySet();
        this.range = range;
    }

    public String getId() {
        return id;
    }

    public StatementKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public Set<String> getDefinedVariables() {
        return definedVariables;
    }

    public Set<String> getUsedVariables() {
        return usedVariables;
    }

    public SourceRange getRange() {
        return range;
    }

    public boolean defines(String variable) {
        return definedVariables.contains(variable);
    }

    public boolean uses(String variable) {
        return usedVariables.contains(variable);
    }

    public boolean isReturn() {
        return kind == StatementKind.RETURN || text.trim().matches("return\\b.*");
    }

    @Override
    public String toString() {
        return id + ": " + text;
    }
}
