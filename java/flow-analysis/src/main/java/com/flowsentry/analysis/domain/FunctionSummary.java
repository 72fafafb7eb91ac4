package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// FunctionSummary: Hand-written model of a library function
// ============================================
public class FunctionSummary {
    private final String name;
    private final List<ParameterSummary> parameters;
    private final boolean returnTainted;
    private final List<Integer> returnDependsOn;
    private final List<GlobalEffect> globalEffects;
    private final String category;

    public FunctionSummary(String name, List<ParameterSummary> parameters, boolean returnTainted,
                           List<Integer> returnDependsOn, List<GlobalEffect> globalEffects, String category) {
        this.name = name;
        this.parameters = copy(parameters);
        this.returnTainted = returnTainted;
        this.returnDependsOn = copy(returnDependsOn);
        this.globalEffects = copy(globalEffects);
        this.category = category;
    }

    private static <T> List<T> copy(List<T> values) {
        return values != null
            ? Collections.unmodifiableList(new ArrayList<>(values))
            : Collections.<T>emptyList();
    }

    public ParameterSummary getParameter(int index) {
        for (ParameterSummary parameter : parameters) {
            if (parameter.getIndex() == index) {
                return parameter;
            }
        }
        return null;
    }

    /**
     * Whether a tainted argument at {@code argumentIndex} taints the return value.
     */
    public boolean returnTaintedBy(int argumentIndex) {
        return returnTainted && returnDependsOn.contains(argumentIndex);
    }

    public String getName() {
        return name;
    }

    public List<ParameterSummary> getParameters() {
        return parameters;
    }

    public boolean isReturnTainted() {
        return returnTainted;
    }

    public List<Integer> getReturnDependsOn() {
        return returnDependsOn;
    }

    public List<GlobalEffect> getGlobalEffects() {
        return globalEffects;
    }

    public String getCategory() {
        return category;
    }
}
