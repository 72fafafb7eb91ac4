package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// FunctionCall: One caller -> callee edge occurrence
// ============================================
public class FunctionCall {
    private final String callerId;
    private final String calleeId;
    private final CallSite callSite;
    private final List<String> arguments;
    private final List<String> argumentTypes;
    private final boolean returnValueUsed;

    public FunctionCall(String callerId, String calleeId, CallSite callSite,
                        List<String> arguments, List<String> argumentTypes, boolean returnValueUsed) {
        this.callerId = callerId;
        this.calleeId = calleeId;
        this.callSite = callSite;
        this.arguments = arguments != null
            ? Collections.unmodifiableList(new ArrayList<>(arguments))
            : Collections.<String>emptyList();
        this.argumentTypes = argumentTypes != null
            ? Collections.unmodifiableList(new ArrayList<>(argumentTypes))
            : Collections.<String>emptyList();
        this.returnValueUsed = returnValueUsed;
    }

    /**
     * Stable id of the call site: {@code caller_block_statement}.
     */
    public String getCallSiteId() {
        return callerId + "_" + callSite.getBlockId() + "_" + callSite.getStatementId();
    }

    public String getCallerId() {
        return callerId;
    }

    public String getCalleeId() {
        return calleeId;
    }

    public CallSite getCallSite() {
        return callSite;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public List<String> getArgumentTypes() {
        return argumentTypes;
    }

    public boolean isReturnValueUsed() {
        return returnValueUsed;
    }

    @Override
    public String toString() {
        return callerId + " -> " + calleeId + " @ " + callSite;
    }
}
