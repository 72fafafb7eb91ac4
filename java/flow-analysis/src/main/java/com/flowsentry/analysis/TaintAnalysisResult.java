package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ControlDependence;
import com.flowsentry.analysis.domain.TaintFact;
import com.flowsentry.analysis.domain.Vulnerability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// ============================================
// TaintAnalysisResult: Facts and findings for one function in one context
// ============================================
public class TaintAnalysisResult {
    private final String functionName;
    private final String contextId;
    private final List<TaintFact> facts;
    private final List<Vulnerability> vulnerabilities;
    private final List<ControlDependence> controlDependences;
    private final List<TaintedCall> taintedCalls;
    private final List<TaintFact> returnFacts;
    private final int itemsProcessed;

    public TaintAnalysisResult(String functionName, String contextId, List<TaintFact> facts,
                               List<Vulnerability> vulnerabilities, List<ControlDependence> controlDependences,
                               List<TaintedCall> taintedCalls, List<TaintFact> returnFacts, int itemsProcessed) {
        this.functionName = functionName;
        this.contextId = contextId != null ? contextId : "";
        this.facts = Collections.unmodifiableList(new ArrayList<>(facts));
        this.vulnerabilities = Collections.unmodifiableList(new ArrayList<>(vulnerabilities));
        this.controlDependences = Collections.unmodifiableList(new ArrayList<>(controlDependences));
        this.taintedCalls = Collections.unmodifiableList(new ArrayList<>(taintedCalls));
        this.returnFacts = Collections.unmodifiableList(new ArrayList<>(returnFacts));
        this.itemsProcessed = itemsProcessed;
    }

    public static TaintAnalysisResult empty(String functionName) {
        List<TaintFact> noFacts = Collections.emptyList();
        return new TaintAnalysisResult(functionName, "", noFacts, Collections.<Vulnerability>emptyList(),
            Collections.<ControlDependence>emptyList(), Collections.<TaintedCall>emptyList(), noFacts, 0);
    }

    public List<TaintFact> getFactsFor(String variable) {
        List<TaintFact> matching = new ArrayList<>();
        for (TaintFact fact : facts) {
            if (fact.getVariable().equals(variable)) {
                matching.add(fact);
            }
        }
        return matching;
    }

    /**
     * Whether some fact for {@code variable} is still tainted.
     */
    public boolean isTainted(String variable) {
        for (TaintFact fact : facts) {
            if (fact.getVariable().equals(variable) && fact.isTainted()) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getTaintedVariables() {
        Set<String> variables = new LinkedHashSet<>();
        for (TaintFact fact : facts) {
            if (fact.isTainted()) {
                variables.add(fact.getVariable());
            }
        }
        return variables;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getContextId() {
        return contextId;
    }

    public List<TaintFact> getFacts() {
        return facts;
    }

    public List<Vulnerability> getVulnerabilities() {
        return vulnerabilities;
    }

    public List<ControlDependence> getControlDependences() {
        return controlDependences;
    }

    public List<TaintedCall> getTaintedCalls() {
        return taintedCalls;
    }

    /**
     * Facts flowing out through return statements.
     */
    public List<TaintFact> getReturnFacts() {
        return returnFacts;
    }

    public int getItemsProcessed() {
        return itemsProcessed;
    }
}
