package com.flowsentry.analysis.domain;

/**
 * How a taint fact came to exist.
 */
public enum TaintDerivation {
    SOURCE,
    DATA,
    CONTROL,
    PARAMETER,
    RETURN
}
