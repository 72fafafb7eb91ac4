package com.flowsentry.analysis.domain;

public enum ReturnKind {
    VARIABLE,
    EXPRESSION,
    CALL,
    CONSTANT,
    CONDITIONAL,
    VOID
}
