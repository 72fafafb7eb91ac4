package com.flowsentry.analysis;

// ============================================
// Diagnostic: Recoverable problem recorded during analysis
// ============================================
public class Diagnostic {

    public enum Level {
        WARNING,
        ERROR
    }

    private final Level level;
    private final String component;
    private final String functionName;
    private final String message;

    public Diagnostic(Level level, String component, String functionName, String message) {
        this.level = level;
        this.component = component;
        this.functionName = functionName;
        this.message = message;
    }

    public Level getLevel() {
        return level;
    }

    public String getComponent() {
        return component;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return level + " [" + component + "]" + (functionName != null ? " " + functionName + ":" : "") + " " + message;
    }
}
