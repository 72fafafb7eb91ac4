package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.FunctionSummary;
import com.flowsentry.analysis.domain.GlobalEffect;
import com.flowsentry.analysis.domain.ParameterMode;
import com.flowsentry.analysis.domain.ParameterSummary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hand-written taint models of library functions. Names without a model are an
 * unknown-effect boundary for callers.
 */
public class FunctionSummaryTable {

    private final Map<String, FunctionSummary> summaries = new ConcurrentHashMap<>();

    public FunctionSummaryTable() {
        registerDefaults();
    }

    public void register(FunctionSummary summary) {
        if (summary == null || summary.getName() == null) {
            throw new IllegalArgumentException("summary needs a function name");
        }
        summaries.put(summary.getName(), summary);
    }

    /**
     * Model for {@code functionName}, or null when the function is not modeled.
     */
    public FunctionSummary getSummary(String functionName) {
        return functionName != null ? summaries.get(functionName) : null;
    }

    public boolean hasSummary(String functionName) {
        return functionName != null && summaries.containsKey(functionName);
    }

    public Map<String, FunctionSummary> getSummaries() {
        return Collections.unmodifiableMap(summaries);
    }

    /**
     * Variables tainted by a call given which argument positions carry taint.
     *
     * @param arguments actual arguments of the call
     * @param taintedArguments positions of the tainted arguments
     * @param receiver variable assigned the call's result, or null
     */
    public Set<String> propagate(FunctionSummary summary, List<String> arguments,
                                 Set<Integer> taintedArguments, String receiver) {
        Set<String> tainted = new LinkedHashSet<>();
        boolean inputTainted = false;
        for (ParameterSummary parameter : summary.getParameters()) {
            if (parameter.getMode().isRead() && parameter.isTaintPropagation()
                && taintedArguments.contains(parameter.getIndex())) {
                inputTainted = true;
            }
        }
        if (inputTainted) {
            for (ParameterSummary parameter : summary.getParameters()) {
                if (parameter.getMode().isWritten() && parameter.getIndex() < arguments.size()) {
                    String variable = StatementFactsExtractor.argumentVariable(arguments.get(parameter.getIndex()));
                    if (variable != null) {
                        tainted.add(variable);
                    }
                }
            }
        }
        if (receiver != null) {
            for (Integer index : taintedArguments) {
                if (summary.returnTaintedBy(index)) {
                    tainted.add(receiver);
                    break;
                }
            }
        }
        return tainted;
    }

    // ============================================
    // BUILT-IN MODELS
    // ============================================

    private void registerDefaults() {
        register(summary("strcpy", "string", true, Collections.singletonList(1),
            param(0, "dest", ParameterMode.OUT, false),
            param(1, "src", ParameterMode.IN, true)));
        register(summary("strcat", "string", true, Collections.singletonList(1),
            param(0, "dest", ParameterMode.INOUT, false),
            param(1, "src", ParameterMode.IN, true)));
        register(summary("sprintf", "string", false, Collections.<Integer>emptyList(),
            param(0, "str", ParameterMode.OUT, false),
            param(1, "format", ParameterMode.IN, true)));

        register(summary("malloc", "memory", false, Collections.<Integer>emptyList(),
            param(0, "size", ParameterMode.IN, false)));
        register(summary("free", "memory", false, Collections.<Integer>emptyList(),
            param(0, "ptr", ParameterMode.IN, false)));
        register(summary("memcpy", "memory", true, Collections.singletonList(1),
            param(0, "dest", ParameterMode.OUT, false),
            param(1, "src", ParameterMode.IN, true),
            param(2, "n", ParameterMode.IN, false)));

        register(summary("printf", "io", false, Collections.<Integer>emptyList(),
            param(0, "format", ParameterMode.IN, false)));
        register(summary("scanf", "io", false, Collections.<Integer>emptyList(),
            param(0, "format", ParameterMode.IN, false)));
        register(summary("fopen", "io", true, Collections.singletonList(0),
            param(0, "filename", ParameterMode.IN, true),
            param(1, "mode", ParameterMode.IN, false)));
        register(summary("fread", "io", false, Collections.<Integer>emptyList(),
            param(0, "ptr", ParameterMode.OUT, false),
            param(1, "size", ParameterMode.IN, false),
            param(2, "nmemb", ParameterMode.IN, false),
            param(3, "stream", ParameterMode.IN, true)));
    }

    private static FunctionSummary summary(String name, String category, boolean returnTainted,
                                           List<Integer> returnDependsOn, ParameterSummary... parameters) {
        return new FunctionSummary(name, new ArrayList<>(Arrays.asList(parameters)), returnTainted,
            returnDependsOn, Collections.<GlobalEffect>emptyList(), category);
    }

    private static ParameterSummary param(int index, String name, ParameterMode mode, boolean taintPropagation) {
        return new ParameterSummary(index, name, mode, taintPropagation);
    }
}
