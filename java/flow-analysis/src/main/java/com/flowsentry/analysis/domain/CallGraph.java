package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// ============================================
// CallGraph: Functions, call records and derived indexes
// ============================================
public class CallGraph {
    private final Map<String, FunctionMetadata> functions;
    private final List<FunctionCall> calls;
    private final Map<String, List<FunctionCall>> callsFrom;
    private final Map<String, List<FunctionCall>> callsTo;
    private final List<List<String>> recursiveComponents;
    private final List<List<String>> mutualRecursionCycles;

    public CallGraph() {
        this.functions = new LinkedHashMap<>();
        this.calls = new ArrayList<>();
        this.callsFrom = new LinkedHashMap<>();
        this.callsTo = new LinkedHashMap<>();
        this.recursiveComponents = new ArrayList<>();
        this.mutualRecursionCycles = new ArrayList<>();
    }

    public void addFunction(FunctionMetadata metadata) {
        if (metadata != null) {
            functions.put(metadata.getName(), metadata);
        }
    }

    public void addCall(FunctionCall call) {
        if (call == null) {
            return;
        }
        calls.add(call);
        callsFrom.computeIfAbsent(call.getCallerId(), ignored -> new ArrayList<>()).add(call);
        callsTo.computeIfAbsent(call.getCalleeId(), ignored -> new ArrayList<>()).add(call);
    }

    public void addRecursiveComponent(List<String> component) {
        if (component != null && !component.isEmpty()) {
            recursiveComponents.add(Collections.unmodifiableList(new ArrayList<>(component)));
        }
    }

    public void addMutualRecursionCycle(List<String> cycle) {
        if (cycle != null && cycle.size() > 1) {
            mutualRecursionCycles.add(Collections.unmodifiableList(new ArrayList<>(cycle)));
        }
    }

    public FunctionMetadata getFunction(String name) {
        return functions.get(name);
    }

    public boolean containsFunction(String name) {
        return functions.containsKey(name);
    }

    public List<FunctionCall> getCallsFrom(String caller) {
        List<FunctionCall> result = callsFrom.get(caller);
        return result != null ? Collections.unmodifiableList(result) : Collections.<FunctionCall>emptyList();
    }

    public List<FunctionCall> getCallsTo(String callee) {
        List<FunctionCall> result = callsTo.get(callee);
        return result != null ? Collections.unmodifiableList(result) : Collections.<FunctionCall>emptyList();
    }

    public Set<String> getCallees(String caller) {
        Set<String> callees = new LinkedHashSet<>();
        for (FunctionCall call : getCallsFrom(caller)) {
            callees.add(call.getCalleeId());
        }
        return callees;
    }

    public Set<String> getCallers(String callee) {
        Set<String> callers = new LinkedHashSet<>();
        for (FunctionCall call : getCallsTo(callee)) {
            callers.add(call.getCallerId());
        }
        return callers;
    }

    /**
     * Distinct caller -> callee pairs.
     */
    public int getEdgeCount() {
        Set<String> edges = new LinkedHashSet<>();
        for (FunctionCall call : calls) {
            edges.add(call.getCallerId() + "->" + call.getCalleeId());
        }
        return edges.size();
    }

    public Map<String, FunctionMetadata> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public List<FunctionCall> getCalls() {
        return Collections.unmodifiableList(calls);
    }

    public List<List<String>> getRecursiveComponents() {
        return Collections.unmodifiableList(recursiveComponents);
    }

    public List<List<String>> getMutualRecursionCycles() {
        return Collections.unmodifiableList(mutualRecursionCycles);
    }
}
