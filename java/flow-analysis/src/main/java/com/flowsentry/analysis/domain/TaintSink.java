package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// TaintSink: Dangerous operation
// ============================================
public class TaintSink {
    private final String functionName;
    private final SinkCategory category;
    private final List<Integer> argumentIndices;
    private final Severity severity;
    private final String cweId;
    private final String description;

    public TaintSink(String functionName, SinkCategory category, List<Integer> argumentIndices,
                     Severity severity, String cweId, String description) {
        this.functionName = functionName;
        this.category = category;
        this.argumentIndices = argumentIndices != null
            ? Collections.unmodifiableList(new ArrayList<>(argumentIndices))
            : Collections.<Integer>emptyList();
        this.severity = severity != null ? severity : category.getDefaultSeverity();
        this.cweId = cweId != null ? cweId : category.getDefaultCweId();
        this.description = description;
    }

    public String getFunctionName() {
        return functionName;
    }

    public SinkCategory getCategory() {
        return category;
    }

    public List<Integer> getArgumentIndices() {
        return argumentIndices;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCweId() {
        return cweId;
    }

    public String getDescription() {
        return description;
    }
}
