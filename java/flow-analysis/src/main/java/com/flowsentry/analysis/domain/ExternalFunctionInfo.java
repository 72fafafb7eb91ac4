package com.flowsentry.analysis.domain;

// ============================================
// ExternalFunctionInfo: Library function called but not defined
// ============================================
public class ExternalFunctionInfo {
    public static final int VARIADIC = -1;

    private final String name;
    private final ExternalFunctionCategory category;
    private final String description;
    private final boolean safe;
    private final int parameterCount;
    private final String returnType;

    public ExternalFunctionInfo(String name, ExternalFunctionCategory category, String description,
                                boolean safe, int parameterCount, String returnType) {
        this.name = name;
        this.category = category != null ? category : ExternalFunctionCategory.UNKNOWN;
        this.description = description;
        this.safe = safe;
        this.parameterCount = parameterCount;
        this.returnType = returnType != null ? returnType : "auto";
    }

    public String getName() {
        return name;
    }

    public ExternalFunctionCategory getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSafe() {
        return safe;
    }

    /**
     * Number of declared parameters, or {@link #VARIADIC} when unknown or variadic.
     */
    public int getParameterCount() {
        return parameterCount;
    }

    public String getReturnType() {
        return returnType;
    }
}
