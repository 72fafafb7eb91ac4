package com.flowsentry.analysis;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects warnings and errors raised while analyzing, and forwards each one to the
 * reporting component's logger. Shared between concurrent file tasks.
 */
public class AnalysisDiagnostics {

    private final List<Diagnostic> entries = Collections.synchronizedList(new ArrayList<Diagnostic>());

    public void warn(Logger log, String component, String functionName, String message) {
        entries.add(new Diagnostic(Diagnostic.Level.WARNING, component, functionName, message));
        if (functionName != null) {
            log.warn("{}: {}", functionName, message);
        } else {
            log.warn(message);
        }
    }

    public void error(Logger log, String component, String functionName, String message) {
        entries.add(new Diagnostic(Diagnostic.Level.ERROR, component, functionName, message));
        if (functionName != null) {
            log.error("{}: {}", functionName, message);
        } else {
            log.error(message);
        }
    }

    public List<Diagnostic> getAll() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    public List<Diagnostic> getWarnings() {
        return filter(Diagnostic.Level.WARNING);
    }

    public List<Diagnostic> getErrors() {
        return filter(Diagnostic.Level.ERROR);
    }

    public boolean hasErrors() {
        return !getErrors().isEmpty();
    }

    private List<Diagnostic> filter(Diagnostic.Level level) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic diagnostic : getAll()) {
            if (diagnostic.getLevel() == level) {
                result.add(diagnostic);
            }
        }
        return result;
    }
}
