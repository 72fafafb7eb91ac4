package com.flowsentry.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Cumulative precision levels of the taint engine. Each level enables everything the
 * previous one does.
 */
public enum SensitivityLevel {
    MINIMAL,
    CONSERVATIVE,
    BALANCED,
    PRECISE,
    MAXIMUM;

    private static final Logger LOG = LoggerFactory.getLogger(SensitivityLevel.class);

    public static final SensitivityLevel DEFAULT = PRECISE;

    /** Taint flows from a tainted condition into the blocks it directly controls. */
    public boolean isControlDependenceEnabled() {
        return atLeast(CONSERVATIVE);
    }

    /** Control dependence follows nested conditionals down to the merge point. */
    public boolean isNestedControlDependenceEnabled() {
        return atLeast(BALANCED);
    }

    public boolean isInterProceduralEnabled() {
        return atLeast(BALANCED);
    }

    /** A block is control-dependent only if some, but not all, branches reach it. */
    public boolean isPathSensitive() {
        return atLeast(PRECISE);
    }

    /** Struct fields are tracked as separate access paths. */
    public boolean isFieldSensitive() {
        return atLeast(PRECISE);
    }

    /** Callee taint state is kept per k-limited call string. */
    public boolean isContextSensitive() {
        return atLeast(MAXIMUM);
    }

    /** A redefinition from clean data kills the taint of the variable. */
    public boolean isFlowSensitive() {
        return atLeast(MAXIMUM);
    }

    public boolean atLeast(SensitivityLevel other) {
        return compareTo(other) >= 0;
    }

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a configured value. Blank or missing values select the default silently; any
     * other unrecognized value records one error and falls back to {@link #PRECISE}.
     */
    public static SensitivityLevel resolve(String value, AnalysisDiagnostics diagnostics) {
        if (value == null || value.trim().isEmpty()) {
            return DEFAULT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (SensitivityLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        String message = "Unknown sensitivity '" + value + "', falling back to " + PRECISE.getLabel();
        if (diagnostics != null) {
            diagnostics.error(LOG, "config", null, message);
        } else {
            LOG.error(message);
        }
        return PRECISE;
    }
}
