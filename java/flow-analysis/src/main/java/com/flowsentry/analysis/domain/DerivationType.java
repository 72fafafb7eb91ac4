package com.flowsentry.analysis.domain;

/**
 * Shape of an actual argument expression.
 */
public enum DerivationType {
    DIRECT,
    EXPRESSION,
    CALL,
    ADDRESS,
    DEREFERENCE,
    ARRAY_ACCESS,
    MEMBER_ACCESS
}
