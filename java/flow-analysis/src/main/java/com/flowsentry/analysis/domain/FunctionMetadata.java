package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// FunctionMetadata: Call graph node
// ============================================
public class FunctionMetadata {
    private final String name;
    private final List<String> parameters;
    private final boolean external;
    private final boolean analyzable;
    private ExternalFunctionCategory externalCategory;
    private String returnType;
    private boolean recursive;
    private boolean tailRecursive;
    private int callsCount;
    private int recursionDepth;

    public FunctionMetadata(String name, List<String> parameters, boolean external, boolean analyzable) {
        this.name = name;
        this.parameters = parameters != null
            ? Collections.unmodifiableList(new ArrayList<>(parameters))
            : Collections.<String>emptyList();
        this.external = external;
        this.analyzable = analyzable;
        this.returnType = "auto";
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public boolean isExternal() {
        return external;
    }

    /**
     * False for functions that were declared but rejected at ingestion.
     */
    public boolean isAnalyzable() {
        return analyzable;
    }

    public ExternalFunctionCategory getExternalCategory() {
        return externalCategory;
    }

    public void setExternalCategory(ExternalFunctionCategory externalCategory) {
        this.externalCategory = externalCategory;
    }

    public String getReturnType() {
        return returnType;
    }

    public void setReturnType(String returnType) {
        this.returnType = returnType;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public boolean isTailRecursive() {
        return tailRecursive;
    }

    public void setTailRecursive(boolean tailRecursive) {
        this.tailRecursive = tailRecursive;
    }

    public int getCallsCount() {
        return callsCount;
    }

    public void setCallsCount(int callsCount) {
        this.callsCount = callsCount;
    }

    public int getRecursionDepth() {
        return recursionDepth;
    }

    public void setRecursionDepth(int recursionDepth) {
        this.recursionDepth = recursionDepth;
    }
}
