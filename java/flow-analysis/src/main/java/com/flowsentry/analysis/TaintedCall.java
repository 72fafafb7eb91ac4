package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.PathHop;
import com.flowsentry.analysis.domain.TaintFact;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

// ============================================
// TaintedCall: Tainted arguments passed to an analyzable user function
// ============================================
public class TaintedCall {
    private final String calleeName;
    private final Set<Integer> argumentIndices;
    private final TaintFact fact;
    private final PathHop callSite;

    public TaintedCall(String calleeName, Set<Integer> argumentIndices, TaintFact fact, PathHop callSite) {
        this.calleeName = calleeName;
        this.argumentIndices = Collections.unmodifiableSet(new TreeSet<>(argumentIndices));
        this.fact = fact;
        this.callSite = callSite;
    }

    public boolean isAt(String callee, String blockId, String statementId) {
        return calleeName.equals(callee) && callSite.getBlockId().equals(blockId)
            && callSite.getStatementId().equals(statementId);
    }

    public String getCalleeName() {
        return calleeName;
    }

    public Set<Integer> getArgumentIndices() {
        return argumentIndices;
    }

    public TaintFact getFact() {
        return fact;
    }

    public PathHop getCallSite() {
        return callSite;
    }
}
