package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// Vulnerability: Tainted data reaching a sink
// ============================================
public class Vulnerability {
    private final String id;
    private final VulnerabilityType type;
    private final Severity severity;
    private final String cweId;
    private final PathHop sourceSite;
    private final PathHop sinkSite;
    private final List<PathHop> path;
    private final String sourceFunction;
    private final TaintSourceCategory sourceCategory;
    private final String taintedVariable;
    private final String sinkFunction;
    private final boolean sanitized;
    private final String contextId;
    private final String description;

    public Vulnerability(String id, VulnerabilityType type, Severity severity, String cweId,
                         PathHop sourceSite, PathHop sinkSite, List<PathHop> path,
                         String sourceFunction, TaintSourceCategory sourceCategory,
                         String taintedVariable, String sinkFunction, boolean sanitized,
                         String contextId, String description) {
        this.id = id;
        this.type = type;
        this.severity = severity;
        this.cweId = cweId;
        this.sourceSite = sourceSite;
        this.sinkSite = sinkSite;
        this.path = path != null
            ? Collections.unmodifiableList(new ArrayList<>(path))
            : Collections.<PathHop>emptyList();
        this.sourceFunction = sourceFunction;
        this.sourceCategory = sourceCategory;
        this.taintedVariable = taintedVariable;
        this.sinkFunction = sinkFunction;
        this.sanitized = sanitized;
        this.contextId = contextId != null ? contextId : "";
        this.description = description;
    }

    /**
     * Source/sink identity used for deduplication.
     */
    public String getDeduplicationKey() {
        return sourceSite + "->" + sinkSite + "|" + taintedVariable + "|" + type.getId();
    }

    public String getId() {
        return id;
    }

    public VulnerabilityType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCweId() {
        return cweId;
    }

    public PathHop getSourceSite() {
        return sourceSite;
    }

    public PathHop getSinkSite() {
        return sinkSite;
    }

    public List<PathHop> getPath() {
        return path;
    }

    public String getSourceFunction() {
        return sourceFunction;
    }

    public TaintSourceCategory getSourceCategory() {
        return sourceCategory;
    }

    public String getTaintedVariable() {
        return taintedVariable;
    }

    public String getSinkFunction() {
        return sinkFunction;
    }

    public boolean isSanitized() {
        return sanitized;
    }

    public String getContextId() {
        return contextId;
    }

    public String getDescription() {
        return description;
    }
}
