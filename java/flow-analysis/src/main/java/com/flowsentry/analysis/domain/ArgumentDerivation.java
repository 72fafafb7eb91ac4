package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// ============================================
// ArgumentDerivation: What an actual argument reads and how
// ============================================
public class ArgumentDerivation {
    private final String expression;
    private final DerivationType type;
    private final String baseVariable;
    private final List<String> transformations;
    private final Set<String> usedVariables;

    public ArgumentDerivation(String expression, DerivationType type, String baseVariable,
                              List<String> transformations, Set<String> usedVariables) {
        this.expression = expression;
        this.type = type;
        this.baseVariable = baseVariable;
        this.transformations = transformations != null
            ? Collections.unmodifiableList(new ArrayList<>(transformations))
            : Collections.<String>emptyList();
        this.usedVariables = usedVariables != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(usedVariables))
            : Collections.<String>emptySet();
    }

    public String getExpression() {
        return expression;
    }

    public DerivationType getType() {
        return type;
    }

    public String getBaseVariable() {
        return baseVariable;
    }

    public List<String> getTransformations() {
        return transformations;
    }

    public Set<String> getUsedVariables() {
        return usedVariables;
    }
}
