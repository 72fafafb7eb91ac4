package com.flowsentry.analysis.domain;

public enum ExternalFunctionCategory {
    STDLIB("stdlib"),
    CSTDLIB("cstdlib"),
    POSIX("posix"),
    SYSTEM("system"),
    UNKNOWN("unknown");

    private final String label;

    ExternalFunctionCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
