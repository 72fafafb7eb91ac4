package com.flowsentry.analysis.domain;

public enum TaintSourceCategory {
    USER_INPUT("user_input", TaintLabel.USER_INPUT),
    FILE_IO("file_io", TaintLabel.FILE_CONTENT),
    NETWORK("network", TaintLabel.NETWORK_DATA),
    ENVIRONMENT("environment", TaintLabel.ENVIRONMENT),
    COMMAND_LINE("command_line", TaintLabel.COMMAND_LINE),
    DATABASE("database", TaintLabel.DATABASE),
    CONFIGURATION("configuration", TaintLabel.CONFIGURATION),
    PARAMETER("parameter", TaintLabel.DERIVED);

    private final String label;
    private final TaintLabel taintLabel;

    TaintSourceCategory(String label, TaintLabel taintLabel) {
        this.label = label;
        this.taintLabel = taintLabel;
    }

    public String getLabel() {
        return label;
    }

    public TaintLabel getTaintLabel() {
        return taintLabel;
    }
}
