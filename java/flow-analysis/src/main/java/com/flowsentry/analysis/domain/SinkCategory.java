package com.flowsentry.analysis.domain;

/**
 * Sink categories with the vulnerability type and CWE they imply.
 */
public enum SinkCategory {
    SQL("sql", VulnerabilityType.SQL_INJECTION, "CWE-89", Severity.CRITICAL),
    COMMAND("command", VulnerabilityType.COMMAND_INJECTION, "CWE-78", Severity.CRITICAL),
    FORMAT_STRING("format_string", VulnerabilityType.FORMAT_STRING, "CWE-134", Severity.HIGH),
    PATH("path", VulnerabilityType.PATH_TRAVERSAL, "CWE-22", Severity.HIGH),
    BUFFER("buffer", VulnerabilityType.BUFFER_OVERFLOW, "CWE-120", Severity.CRITICAL),
    CODE("code", VulnerabilityType.CODE_INJECTION, "CWE-94", Severity.CRITICAL),
    INTEGER_OVERFLOW("integer_overflow", VulnerabilityType.INTEGER_OVERFLOW, "CWE-190", Severity.MEDIUM);

    private final String label;
    private final VulnerabilityType vulnerabilityType;
    private final String defaultCweId;
    private final Severity defaultSeverity;

    SinkCategory(String label, VulnerabilityType vulnerabilityType, String defaultCweId, Severity defaultSeverity) {
        this.label = label;
        this.vulnerabilityType = vulnerabilityType;
        this.defaultCweId = defaultCweId;
        this.defaultSeverity = defaultSeverity;
    }

    public String getLabel() {
        return label;
    }

    public VulnerabilityType getVulnerabilityType() {
        return vulnerabilityType;
    }

    public String getDefaultCweId() {
        return defaultCweId;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
