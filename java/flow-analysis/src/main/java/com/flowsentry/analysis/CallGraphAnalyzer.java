package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.CallGraph;
import com.flowsentry.analysis.domain.CallGraphStatistics;
import com.flowsentry.analysis.domain.CallSite;
import com.flowsentry.analysis.domain.ExternalFunctionInfo;
import com.flowsentry.analysis.domain.FunctionCall;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.FunctionMetadata;
import com.flowsentry.analysis.domain.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the workspace call graph from statement text and classifies recursion.
 *
 * Every call found by {@link FunctionCallExtractor} becomes a {@link FunctionCall}. Callees
 * without a CFG are added as external nodes, categorized by {@link ExternalFunctionCatalog}.
 * Recursion comes from Tarjan's strongly connected components: a function is recursive
 * when its component has more than one member or it calls itself.
 */
public class CallGraphAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CallGraphAnalyzer.class);

    private static final Pattern RETURNS_INT = Pattern.compile("return\\s+\\d+");
    private static final Pattern RETURNS_NULLPTR = Pattern.compile("return\\s+nullptr");
    private static final Pattern RETURNS_BOOL = Pattern.compile("return\\s+(true|false)\\b");

    private final ExternalFunctionCatalog catalog;

    public CallGraphAnalyzer() {
        this(new ExternalFunctionCatalog());
    }

    public CallGraphAnalyzer(ExternalFunctionCatalog catalog) {
        this.catalog = catalog;
    }

    public CallGraph build(Collection<FunctionCfg> functions) {
        return build(functions, Collections.<String>emptySet());
    }

    /**
     * @param functions validated function CFGs
     * @param rejectedFunctions functions present in the input but rejected by validation;
     *                          they become non-analyzable nodes instead of externals
     */
    public CallGraph build(Collection<FunctionCfg> functions, Set<String> rejectedFunctions) {
        CallGraph graph = new CallGraph();
        Map<String, FunctionCfg> cfgs = new LinkedHashMap<>();
        for (FunctionCfg cfg : functions) {
            cfgs.put(cfg.getName(), cfg);
            FunctionMetadata metadata = new FunctionMetadata(cfg.getName(), cfg.getParameters(), false, true);
            metadata.setReturnType(inferReturnType(cfg));
            graph.addFunction(metadata);
        }
        for (String rejected : rejectedFunctions) {
            if (!graph.containsFunction(rejected)) {
                graph.addFunction(new FunctionMetadata(rejected, null, false, false));
            }
        }

        for (FunctionCfg cfg : cfgs.values()) {
            extractCalls(cfg, graph);
        }
        addExternalFunctions(graph);
        for (FunctionMetadata metadata : graph.getFunctions().values()) {
            metadata.setCallsCount(graph.getCallsFrom(metadata.getName()).size());
        }

        markRecursion(graph);
        for (List<String> cycle : findMutualRecursionCycles(graph)) {
            graph.addMutualRecursionCycle(cycle);
        }
        for (FunctionMetadata metadata : graph.getFunctions().values()) {
            FunctionCfg cfg = cfgs.get(metadata.getName());
            if (metadata.isRecursive() && cfg != null) {
                metadata.setTailRecursive(isTailRecursive(cfg));
            }
        }

        LOG.debug("Call graph: {} functions, {} calls, {} recursive components",
            graph.getFunctions().size(), graph.getCalls().size(), graph.getRecursiveComponents().size());
        return graph;
    }

    // ============================================
    // CALL EXTRACTION
    // ============================================

    private void extractCalls(FunctionCfg cfg, CallGraph graph) {
        for (BasicBlock block : cfg.getBasicBlocks()) {
            for (Statement statement : block.getStatements()) {
                for (FunctionCallExtractor.ExtractedCall call : FunctionCallExtractor.extractCalls(statement.getText())) {
                    CallSite site = new CallSite(block.getId(), statement.getId(), statement.getText());
                    graph.addCall(new FunctionCall(
                        cfg.getName(),
                        call.getName(),
                        site,
                        call.getArguments(),
                        FunctionCallExtractor.inferArgumentTypes(call.getArguments()),
                        FunctionCallExtractor.isReturnValueUsed(statement.getText(), call.getName())
                    ));
                }
            }
        }
    }

    private void addExternalFunctions(CallGraph graph) {
        for (FunctionCall call : graph.getCalls()) {
            String callee = call.getCalleeId();
            if (graph.containsFunction(callee)) {
                continue;
            }
            ExternalFunctionInfo info = catalog.describe(callee);
            FunctionMetadata metadata = new FunctionMetadata(callee, null, true, false);
            metadata.setExternalCategory(info.getCategory());
            metadata.setReturnType(info.getReturnType());
            graph.addFunction(metadata);
        }
    }

    // ============================================
    // RECURSION
    // ============================================

    private void markRecursion(CallGraph graph) {
        for (List<String> component : findStronglyConnectedComponents(graph)) {
            String first = component.get(0);
            if (component.size() > 1 || graph.getCallees(first).contains(first)) {
                graph.addRecursiveComponent(component);
                for (String name : component) {
                    FunctionMetadata metadata = graph.getFunction(name);
                    metadata.setRecursive(true);
                    metadata.setRecursionDepth(component.size());
                }
            }
        }
    }

    /**
     * Tarjan's algorithm over the caller to callee edges, iterating functions in insertion order.
     */
    List<List<String>> findStronglyConnectedComponents(CallGraph graph) {
        TarjanState state = new TarjanState();
        for (String name : graph.getFunctions().keySet()) {
            if (!state.index.containsKey(name)) {
                strongConnect(name, graph, state);
            }
        }
        return state.components;
    }

    private void strongConnect(String node, CallGraph graph, TarjanState state) {
        state.index.put(node, state.counter);
        state.lowLink.put(node, state.counter);
        state.counter++;
        state.stack.push(node);
        state.onStack.add(node);

        for (String callee : graph.getCallees(node)) {
            if (!state.index.containsKey(callee)) {
                strongConnect(callee, graph, state);
                state.lowLink.put(node, Math.min(state.lowLink.get(node), state.lowLink.get(callee)));
            } else if (state.onStack.contains(callee)) {
                state.lowLink.put(node, Math.min(state.lowLink.get(node), state.index.get(callee)));
            }
        }

        if (state.lowLink.get(node).equals(state.index.get(node))) {
            List<String> component = new ArrayList<>();
            String member;
            do {
                member = state.stack.pop();
                state.onStack.remove(member);
                component.add(member);
            } while (!member.equals(node));
            Collections.reverse(component);
            state.components.add(component);
        }
    }

    private static class TarjanState {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;
    }

    /**
     * Cycles through at least two functions, found as back edges of a depth-first search.
     * Each cycle is reported once, whatever function it was entered from.
     */
    List<List<String>> findMutualRecursionCycles(CallGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String name : graph.getFunctions().keySet()) {
            if (!visited.contains(name)) {
                collectCycles(name, graph, new ArrayList<String>(), visited, seen, cycles);
            }
        }
        return cycles;
    }

    private void collectCycles(String node, CallGraph graph, List<String> path, Set<String> visited,
                               Set<Set<String>> seen, List<List<String>> cycles) {
        visited.add(node);
        path.add(node);
        for (String callee : graph.getCallees(node)) {
            int onPath = path.indexOf(callee);
            if (onPath >= 0) {
                List<String> cycle = new ArrayList<>(path.subList(onPath, path.size()));
                if (cycle.size() > 1 && seen.add(new HashSet<>(cycle))) {
                    cycles.add(cycle);
                }
            } else if (!visited.contains(callee)) {
                collectCycles(callee, graph, path, visited, seen, cycles);
            }
        }
        path.remove(path.size() - 1);
    }

    /**
     * True when some return statement consists of nothing but a call to the function itself.
     */
    boolean isTailRecursive(FunctionCfg cfg) {
        Pattern tailCall = Pattern.compile("^return\\s+" + Pattern.quote(cfg.getName()) + "\\s*\\(");
        for (BasicBlock block : cfg.getBasicBlocks()) {
            for (Statement statement : block.getStatements()) {
                String text = FunctionCallExtractor.cleanStatementText(statement.getText());
                if (!tailCall.matcher(text).find()) {
                    continue;
                }
                String expression = text.substring("return".length()).trim();
                if (expression.endsWith(";")) {
                    expression = expression.substring(0, expression.length() - 1).trim();
                }
                FunctionCallExtractor.ExtractedCall call = FunctionCallExtractor.firstCall(expression);
                if (call != null && call.getName().equals(cfg.getName())
                    && call.getCallExpression().equals(expression)) {
                    return true;
                }
            }
        }
        return false;
    }

    static String inferReturnType(FunctionCfg cfg) {
        for (BasicBlock block : cfg.getBasicBlocks()) {
            for (Statement statement : block.getStatements()) {
                String text = statement.getText();
                if (!text.contains("return")) {
                    continue;
                }
                if (RETURNS_INT.matcher(text).find()) {
                    return "int";
                }
                if (RETURNS_NULLPTR.matcher(text).find()) {
                    return "void*";
                }
                if (RETURNS_BOOL.matcher(text).find()) {
                    return "bool";
                }
            }
        }
        return "auto";
    }

    // ============================================
    // STATISTICS AND RENDERING
    // ============================================

    public CallGraphStatistics computeStatistics(CallGraph graph) {
        int totalFunctions = graph.getFunctions().size();
        int totalCalls = graph.getCalls().size();
        int external = 0;
        int recursive = 0;
        int recursionDepthSum = 0;
        int maxCalls = 0;
        String mostCalled = null;
        int mostCalledCount = 0;
        for (FunctionMetadata metadata : graph.getFunctions().values()) {
            if (metadata.isExternal()) {
                external++;
            }
            if (metadata.isRecursive()) {
                recursive++;
                recursionDepthSum += metadata.getRecursionDepth();
            }
            maxCalls = Math.max(maxCalls, graph.getCallsFrom(metadata.getName()).size());
            int callers = graph.getCallsTo(metadata.getName()).size();
            if (callers > mostCalledCount) {
                mostCalledCount = callers;
                mostCalled = metadata.getName();
            }
        }
        double averageCalls = totalFunctions > 0 ? (double) totalCalls / totalFunctions : 0.0;
        double averageDepth = recursive > 0 ? (double) recursionDepthSum / recursive : 0.0;
        return new CallGraphStatistics(totalFunctions, totalCalls, external, recursive, averageCalls, maxCalls,
            mostCalled, mostCalledCount, deepestCallChain(graph), averageDepth);
    }

    /**
     * Longest caller to callee chain, measured on the component graph so the result does not
     * depend on iteration order. A recursive component counts one edge per member: the chain
     * walks through it and re-enters it once.
     */
    int deepestCallChain(CallGraph graph) {
        List<List<String>> components = findStronglyConnectedComponents(graph);
        Map<String, Integer> componentOf = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            for (String name : components.get(i)) {
                componentOf.put(name, i);
            }
        }
        // Tarjan emits a component only after every component it reaches
        int[] depth = new int[components.size()];
        int deepest = 0;
        for (int i = 0; i < components.size(); i++) {
            List<String> component = components.get(i);
            String first = component.get(0);
            boolean recursive = component.size() > 1 || graph.getCallees(first).contains(first);
            int below = 0;
            for (String name : component) {
                for (String callee : graph.getCallees(name)) {
                    Integer target = componentOf.get(callee);
                    if (target != null && target != i) {
                        below = Math.max(below, 1 + depth[target]);
                    }
                }
            }
            depth[i] = (recursive ? component.size() : 0) + below;
            deepest = Math.max(deepest, depth[i]);
        }
        return deepest;
    }

    /**
     * Graphviz rendering: externals dotted gray, recursive functions red (orange when tail
     * recursive), busy callers blue. Repeated edges carry an {@code Nx} label.
     */
    public String toDot(CallGraph graph) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph CallGraphAnalysis {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box];\n");
        dot.append("  graph [bgcolor=white];\n\n");

        for (FunctionMetadata metadata : graph.getFunctions().values()) {
            int callCount = graph.getCallsFrom(metadata.getName()).size();
            String attrs = "";
            if (metadata.isExternal()) {
                attrs = "[style=dotted, color=gray] ";
            } else if (metadata.isRecursive()) {
                attrs = metadata.isTailRecursive()
                    ? "[color=orange, style=filled, fillcolor=lightyellow] "
                    : "[color=red, style=filled, fillcolor=lightpink] ";
            } else if (callCount > 5) {
                attrs = "[color=blue, style=filled, fillcolor=lightblue] ";
            }
            dot.append("  \"").append(escape(metadata.getName())).append("\" ").append(attrs)
                .append("[label=\"").append(escape(metadata.getName())).append("\\n(")
                .append(callCount).append(" calls)\"];\n");
        }
        dot.append('\n');

        Map<String, Integer> edgeCounts = new LinkedHashMap<>();
        for (FunctionCall call : graph.getCalls()) {
            String edge = "\"" + escape(call.getCallerId()) + "\" -> \"" + escape(call.getCalleeId()) + "\"";
            Integer count = edgeCounts.get(edge);
            edgeCounts.put(edge, count == null ? 1 : count + 1);
        }
        for (Map.Entry<String, Integer> edge : edgeCounts.entrySet()) {
            dot.append("  ").append(edge.getKey());
            if (edge.getValue() > 1) {
                dot.append(" [label=\"").append(edge.getValue()).append("x\"]");
            }
            dot.append(";\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String escape(String value) {
        Matcher matcher = Pattern.compile("[\"\\\\]").matcher(value);
        return matcher.replaceAll("\\\\$0");
    }
}
