package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

// ============================================
// TaintFact: Taint state of one variable at one program point
// ============================================
public class TaintFact {
    private final String variable;
    private final String functionName;
    private final String blockId;
    private final String statementId;
    private final String sourceFunction;
    private final TaintSourceCategory sourceCategory;
    private final PathHop sourceSite;
    private final String sourceVariable;
    private final boolean tainted;
    private final boolean sanitized;
    private final List<PathHop> hops;
    private final List<String> sanitizationPoints;
    private final Set<TaintLabel> labels;
    private final TaintDerivation derivation;
    private final String contextId;

    private TaintFact(String variable, String functionName, String blockId, String statementId,
                      String sourceFunction, TaintSourceCategory sourceCategory, PathHop sourceSite,
                      String sourceVariable, boolean tainted, boolean sanitized, List<PathHop> hops,
                      List<String> sanitizationPoints, Set<TaintLabel> labels,
                      TaintDerivation derivation, String contextId) {
        this.variable = variable;
        this.functionName = functionName;
        this.blockId = blockId;
        this.statementId = statementId;
        this.sourceFunction = sourceFunction;
        this.sourceCategory = sourceCategory;
        this.sourceSite = sourceSite;
        this.sourceVariable = sourceVariable;
        this.tainted = tainted;
        this.sanitized = sanitized;
        this.hops = Collections.unmodifiableList(new ArrayList<>(hops));
        this.sanitizationPoints = Collections.unmodifiableList(new ArrayList<>(sanitizationPoints));
        this.labels = Collections.unmodifiableSet(labels.isEmpty()
            ? EnumSet.noneOf(TaintLabel.class) : EnumSet.copyOf(labels));
        this.derivation = derivation;
        this.contextId = contextId != null ? contextId : "";
    }

    /**
     * Fact created at a source site.
     */
    public static TaintFact fromSource(String variable, String sourceFunction, TaintSourceCategory category,
                                       PathHop site, TaintDerivation derivation, String contextId) {
        List<PathHop> hops = new ArrayList<>();
        hops.add(site);
        return new TaintFact(variable, site.getFunction(), site.getBlockId(), site.getStatementId(),
            sourceFunction, category, site, variable, true, false, hops,
            Collections.<String>emptyList(), EnumSet.of(category.getTaintLabel()), derivation, contextId);
    }

    /**
     * Copy for {@code newVariable}, extended by one hop.
     */
    public TaintFact derive(String newVariable, PathHop step, TaintDerivation newDerivation) {
        List<PathHop> path = new ArrayList<>(hops);
        if (path.isEmpty() || !path.get(path.size() - 1).equals(step)) {
            path.add(step);
        }
        Set<TaintLabel> derivedLabels = EnumSet.noneOf(TaintLabel.class);
        derivedLabels.addAll(labels);
        if (!newVariable.equals(sourceVariable)) {
            derivedLabels.add(TaintLabel.DERIVED);
        }
        return new TaintFact(newVariable, step.getFunction(), step.getBlockId(), step.getStatementId(),
            sourceFunction, sourceCategory, sourceSite, sourceVariable, tainted, sanitized, path,
            sanitizationPoints, derivedLabels, newDerivation, contextId);
    }

    /**
     * Copy with taint removed or confirmed clean at {@code point}.
     */
    public TaintFact sanitize(String sanitizedVariable, PathHop point, boolean removesTaint) {
        List<PathHop> path = new ArrayList<>(hops);
        path.add(point);
        List<String> points = new ArrayList<>(sanitizationPoints);
        points.add(point.toPathEntry());
        return new TaintFact(sanitizedVariable, point.getFunction(), point.getBlockId(), point.getStatementId(),
            sourceFunction, sourceCategory, sourceSite, sourceVariable, tainted && !removesTaint, true, path,
            points, labels, derivation, contextId);
    }

    public TaintFact withContext(String newContextId) {
        return new TaintFact(variable, functionName, blockId, statementId, sourceFunction, sourceCategory,
            sourceSite, sourceVariable, tainted, sanitized, hops, sanitizationPoints, labels, derivation,
            newContextId);
    }

    /**
     * Dedup key: one fact per variable, source site and establishing point.
     */
    public String getKey() {
        return variable + "|" + sourceSite + "|" + blockId + ":" + statementId + "|" + contextId
            + "|" + tainted;
    }

    public List<String> getPropagationPath() {
        List<String> path = new ArrayList<>();
        for (PathHop hop : hops) {
            path.add(hop.toPathEntry());
        }
        return path;
    }

    public String getVariable() {
        return variable;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getBlockId() {
        return blockId;
    }

    public String getStatementId() {
        return statementId;
    }

    public String getSourceFunction() {
        return sourceFunction;
    }

    public TaintSourceCategory getSourceCategory() {
        return sourceCategory;
    }

    public PathHop getSourceSite() {
        return sourceSite;
    }

    public String getSourceVariable() {
        return sourceVariable;
    }

    public boolean isTainted() {
        return tainted;
    }

    public boolean isSanitized() {
        return sanitized;
    }

    public List<PathHop> getHops() {
        return hops;
    }

    public List<String> getSanitizationPoints() {
        return sanitizationPoints;
    }

    public Set<TaintLabel> getLabels() {
        return labels;
    }

    public TaintDerivation getDerivation() {
        return derivation;
    }

    public String getContextId() {
        return contextId;
    }

    @Override
    public String toString() {
        return variable + (tainted ? " tainted by " : " clean from ") + sourceFunction
            + (sanitized ? " (sanitized)" : "") + " " + getPropagationPath();
    }
}
