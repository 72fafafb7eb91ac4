package com.flowsentry.analysis.domain;

public enum ParameterMode {
    IN,
    OUT,
    INOUT;

    public boolean isWritten() {
        return this == OUT || this == INOUT;
    }

    public boolean isRead() {
        return this == IN || this == INOUT;
    }
}
