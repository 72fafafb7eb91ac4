package com.flowsentry.analysis.domain;

/**
 * Provenance labels carried by taint facts. A variable tainted from several sources
 * carries several labels.
 */
public enum TaintLabel {
    USER_INPUT,
    FILE_CONTENT,
    NETWORK_DATA,
    ENVIRONMENT,
    COMMAND_LINE,
    DATABASE,
    CONFIGURATION,
    DERIVED
}
