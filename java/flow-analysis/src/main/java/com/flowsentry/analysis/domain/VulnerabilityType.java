package com.flowsentry.analysis.domain;

public enum VulnerabilityType {
    SQL_INJECTION("sql_injection", "SQL Injection"),
    COMMAND_INJECTION("command_injection", "Command Injection"),
    FORMAT_STRING("format_string", "Format String Vulnerability"),
    PATH_TRAVERSAL("path_traversal", "Path Traversal"),
    BUFFER_OVERFLOW("buffer_overflow", "Buffer Overflow"),
    CODE_INJECTION("code_injection", "Code Injection"),
    INTEGER_OVERFLOW("integer_overflow", "Integer Overflow");

    private final String id;
    private final String displayName;

    VulnerabilityType(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }
}
