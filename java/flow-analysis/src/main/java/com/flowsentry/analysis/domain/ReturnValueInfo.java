package com.flowsentry.analysis.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

// ============================================
// ReturnValueInfo: One return site of a function
// ============================================
public class ReturnValueInfo {
    private final String functionName;
    private final String blockId;
    private final String statementId;
    private final String expression;
    private final ReturnKind kind;
    private final Set<String> usedVariables;
    private final String inferredType;

    public ReturnValueInfo(String functionName, String blockId, String statementId, String expression,
                           ReturnKind kind, Set<String> usedVariables, String inferredType) {
        this.functionName = functionName;
        this.blockId = blockId;
        this.statementId = statementId;
        this.expression = expression;
        this.kind = kind;
        this.usedVariables = usedVariables != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(usedVariables))
            : Collections.<String>emptySet();
        this.inferredType = inferredType;
    }

    public boolean isConditional() {
        return kind == ReturnKind.CONDITIONAL;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getBlockId() {
        return blockId;
    }

    public String getStatementId() {
        return statementId;
    }

    public String getExpression() {
        return expression;
    }

    public ReturnKind getKind() {
        return kind;
    }

    public Set<String> getUsedVariables() {
        return usedVariables;
    }

    public String getInferredType() {
        return inferredType;
    }
}
