package com.flowsentry.analysis.domain;

// ============================================
// SanitizerFunction: Call that cleans or checks tainted data
// ============================================
public class SanitizerFunction {
    private final String functionName;
    private final SanitizationType type;
    private final boolean removesTaint;
    private final int inputIndex;
    private final int outputIndex; // -1 when the sanitized value is returned
    private final String description;

    public SanitizerFunction(String functionName, SanitizationType type, boolean removesTaint,
                             int inputIndex, int outputIndex, String description) {
        this.functionName = functionName;
        this.type = type;
        this.removesTaint = removesTaint;
        this.inputIndex = inputIndex;
        this.outputIndex = outputIndex;
        this.description = description;
    }

    public boolean returnsSanitizedValue() {
        return outputIndex < 0;
    }

    public String getFunctionName() {
        return functionName;
    }

    public SanitizationType getType() {
        return type;
    }

    public boolean isRemovesTaint() {
        return removesTaint;
    }

    public int getInputIndex() {
        return inputIndex;
    }

    public int getOutputIndex() {
        return outputIndex;
    }

    public String getDescription() {
        return description;
    }
}
