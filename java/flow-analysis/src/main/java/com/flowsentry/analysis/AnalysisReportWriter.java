package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.CallGraph;
import com.flowsentry.analysis.domain.CallGraphStatistics;
import com.flowsentry.analysis.domain.ControlDependence;
import com.flowsentry.analysis.domain.FunctionCall;
import com.flowsentry.analysis.domain.FunctionMetadata;
import com.flowsentry.analysis.domain.LivenessInfo;
import com.flowsentry.analysis.domain.ReachingDefinition;
import com.flowsentry.analysis.domain.ReachingDefinitionsInfo;
import com.flowsentry.analysis.domain.Severity;
import com.flowsentry.analysis.domain.TaintFact;
import com.flowsentry.analysis.domain.TaintLabel;
import com.flowsentry.analysis.domain.Vulnerability;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link WorkspaceAnalysisResult} to JSON. The report is assembled as plain
 * maps and lists so the output is always an acyclic tree.
 */
public class AnalysisReportWriter {

    private final Gson gson;

    public AnalysisReportWriter() {
        this.gson = new GsonBuilder()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .serializeNulls()
            .create();
    }

    public String toJson(WorkspaceAnalysisResult result) {
        return gson.toJson(buildReport(result));
    }

    public void write(WorkspaceAnalysisResult result, Writer writer) {
        gson.toJson(buildReport(result), writer);
    }

    public void write(WorkspaceAnalysisResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
    }

    /**
     * Aggregate report over several analyzed documents, keyed by document name.
     */
    public void writeSummary(Map<String, WorkspaceAnalysisResult> results, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            gson.toJson(buildSummary(results), writer);
        }
    }

    public Map<String, Object> buildSummary(Map<String, WorkspaceAnalysisResult> results) {
        Map<String, Object> summary = new LinkedHashMap<>();
        int functions = 0;
        int errors = 0;
        List<Object> vulnerabilities = new ArrayList<>();
        Map<String, Object> documents = new LinkedHashMap<>();
        for (Map.Entry<String, WorkspaceAnalysisResult> entry : results.entrySet()) {
            WorkspaceAnalysisResult result = entry.getValue();
            functions += result.getFunctions().size();
            errors += result.getDiagnostics().getErrors().size();
            for (Vulnerability vulnerability : result.getVulnerabilities()) {
                Map<String, Object> item = vulnerability(vulnerability);
                item.put("document", entry.getKey());
                vulnerabilities.add(item);
            }
            documents.put(entry.getKey(), summary(result));
        }
        summary.put("documents_analyzed", results.size());
        summary.put("functions_analyzed", functions);
        summary.put("vulnerability_count", vulnerabilities.size());
        summary.put("errors", errors);
        summary.put("documents", documents);
        summary.put("vulnerabilities", vulnerabilities);
        return summary;
    }

    // ============================================
    // REPORT TREE
    // ============================================

    public Map<String, Object> buildReport(WorkspaceAnalysisResult result) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("summary", summary(result));
        report.put("config", config(result.getConfig()));
        report.put("files", result.getFiles());

        Map<String, Object> functions = new LinkedHashMap<>();
        for (FunctionAnalysisResult function : result.getFunctions().values()) {
            functions.put(function.getFunctionName(), function(function));
        }
        report.put("functions", functions);

        List<Object> vulnerabilities = new ArrayList<>();
        for (Vulnerability vulnerability : result.getVulnerabilities()) {
            vulnerabilities.add(vulnerability(vulnerability));
        }
        report.put("vulnerabilities", vulnerabilities);

        if (result.getCallGraph() != null) {
            report.put("call_graph", callGraph(result));
        }
        if (result.getInterProceduralDefinitions() != null) {
            report.put("interprocedural_definitions", interProcedural(result.getInterProceduralDefinitions()));
        }

        List<Object> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : result.getDiagnostics().getAll()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("level", diagnostic.getLevel().name().toLowerCase());
            entry.put("component", diagnostic.getComponent());
            entry.put("function", diagnostic.getFunctionName());
            entry.put("message", diagnostic.getMessage());
            diagnostics.add(entry);
        }
        report.put("diagnostics", diagnostics);
        return report;
    }

    private Map<String, Object> summary(WorkspaceAnalysisResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        List<Vulnerability> vulnerabilities = result.getVulnerabilities();
        summary.put("files_analyzed", result.getFiles().size());
        summary.put("functions_analyzed", result.getFunctions().size());
        summary.put("vulnerability_count", vulnerabilities.size());
        Map<String, Object> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            int count = 0;
            for (Vulnerability vulnerability : vulnerabilities) {
                if (vulnerability.getSeverity() == severity) {
                    count++;
                }
            }
            bySeverity.put(severity.name().toLowerCase(), count);
        }
        summary.put("by_severity", bySeverity);
        summary.put("warnings", result.getDiagnostics().getWarnings().size());
        summary.put("errors", result.getDiagnostics().getErrors().size());
        return summary;
    }

    private Map<String, Object> config(AnalysisConfig config) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sensitivity", config.getSensitivity().getLabel());
        map.put("liveness", config.isLivenessEnabled());
        map.put("reaching_definitions", config.isReachingDefinitionsEnabled());
        map.put("taint", config.isTaintEnabled());
        map.put("interprocedural", config.isInterProceduralEnabled());
        map.put("call_graph", config.isCallGraphEnabled());
        map.put("context_depth", config.getContextDepth());
        return map;
    }

    // ============================================
    // PER FUNCTION
    // ============================================

    private Map<String, Object> function(FunctionAnalysisResult function) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", function.getSourceFile());

        LivenessResult liveness = function.getLiveness();
        if (liveness != null) {
            Map<String, Object> blocks = new LinkedHashMap<>();
            for (LivenessInfo info : liveness.getBlocks().values()) {
                Map<String, Object> block = new LinkedHashMap<>();
                block.put("use", new ArrayList<>(info.getUse()));
                block.put("def", new ArrayList<>(info.getDef()));
                block.put("in", new ArrayList<>(info.getIn()));
                block.put("out", new ArrayList<>(info.getOut()));
                blocks.put(info.getBlockId(), block);
            }
            Map<String, Object> section = new LinkedHashMap<>();
            section.put("converged", liveness.isConverged());
            section.put("iterations", liveness.getIterations());
            section.put("blocks", blocks);
            map.put("liveness", section);
        }

        ReachingDefinitionsResult definitions = function.getReachingDefinitions();
        if (definitions != null) {
            Map<String, Object> blocks = new LinkedHashMap<>();
            for (ReachingDefinitionsInfo info : definitions.getBlocks().values()) {
                Map<String, Object> block = new LinkedHashMap<>();
                block.put("gen", definitionMap(info.getGen()));
                block.put("kill", definitionMap(info.getKill()));
                block.put("in", definitionMap(info.getIn()));
                block.put("out", definitionMap(info.getOut()));
                blocks.put(info.getBlockId(), block);
            }
            Map<String, Object> section = new LinkedHashMap<>();
            section.put("converged", definitions.isConverged());
            section.put("iterations", definitions.getIterations());
            section.put("blocks", blocks);
            map.put("reaching_definitions", section);
        }

        List<Object> facts = new ArrayList<>();
        for (TaintFact fact : function.getTaintFacts()) {
            facts.add(fact(fact));
        }
        map.put("taint_facts", facts);

        List<Object> dependences = new ArrayList<>();
        for (ControlDependence dependence : function.getControlDependences()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("condition_block", dependence.getConditionBlockId());
            entry.put("condition_statement", dependence.getConditionStatementId());
            entry.put("variable", dependence.getConditionVariable());
            entry.put("dependent_blocks", new ArrayList<>(dependence.getDependentBlocks()));
            dependences.add(entry);
        }
        map.put("control_dependences", dependences);

        List<Object> vulnerabilityIds = new ArrayList<>();
        for (Vulnerability vulnerability : function.getVulnerabilities()) {
            vulnerabilityIds.add(vulnerability.getId());
        }
        map.put("vulnerabilities", vulnerabilityIds);
        map.put("contexts", new ArrayList<>(function.getContexts()));
        return map;
    }

    private Map<String, Object> definitionMap(Map<String, List<ReachingDefinition>> byVariable) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, List<ReachingDefinition>> entry : byVariable.entrySet()) {
            map.put(entry.getKey(), definitions(entry.getValue()));
        }
        return map;
    }

    private List<Object> definitions(Collection<ReachingDefinition> definitions) {
        List<Object> list = new ArrayList<>();
        for (ReachingDefinition definition : definitions) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", definition.getDefinitionId());
            entry.put("variable", definition.getVariable());
            entry.put("block", definition.getBlockId());
            entry.put("statement", definition.getStatementId());
            entry.put("source_block", definition.getSourceBlock());
            entry.put("path", new ArrayList<>(definition.getPropagationPath()));
            list.add(entry);
        }
        return list;
    }

    private Map<String, Object> fact(TaintFact fact) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("variable", fact.getVariable());
        map.put("tainted", fact.isTainted());
        map.put("sanitized", fact.isSanitized());
        map.put("source_function", fact.getSourceFunction());
        map.put("source_category", fact.getSourceCategory().getLabel());
        map.put("derivation", fact.getDerivation().name().toLowerCase());
        List<Object> labels = new ArrayList<>();
        for (TaintLabel label : fact.getLabels()) {
            labels.add(label.name().toLowerCase());
        }
        map.put("labels", labels);
        map.put("path", fact.getPropagationPath());
        map.put("sanitization_points", new ArrayList<>(fact.getSanitizationPoints()));
        map.put("context", fact.getContextId());
        return map;
    }

    private Map<String, Object> vulnerability(Vulnerability vulnerability) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", vulnerability.getId());
        map.put("type", vulnerability.getType().getId());
        map.put("severity", vulnerability.getSeverity().name().toLowerCase());
        map.put("cwe", vulnerability.getCweId());
        map.put("source_function", vulnerability.getSourceFunction());
        map.put("source_category", vulnerability.getSourceCategory().getLabel());
        map.put("sink_function", vulnerability.getSinkFunction());
        map.put("tainted_variable", vulnerability.getTaintedVariable());
        map.put("sanitized", vulnerability.isSanitized());
        map.put("context", vulnerability.getContextId());
        map.put("description", vulnerability.getDescription());
        map.put("path", VulnerabilitySynthesizer.materializePath(vulnerability));
        return map;
    }

    // ============================================
    // WHOLE PROGRAM
    // ============================================

    private Map<String, Object> callGraph(WorkspaceAnalysisResult result) {
        CallGraph graph = result.getCallGraph();
        Map<String, Object> map = new LinkedHashMap<>();

        List<Object> functions = new ArrayList<>();
        for (FunctionMetadata metadata : graph.getFunctions().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", metadata.getName());
            entry.put("parameters", new ArrayList<>(metadata.getParameters()));
            entry.put("external", metadata.isExternal());
            entry.put("analyzable", metadata.isAnalyzable());
            entry.put("category", metadata.getExternalCategory() != null
                ? metadata.getExternalCategory().name().toLowerCase() : null);
            entry.put("return_type", metadata.getReturnType());
            entry.put("recursive", metadata.isRecursive());
            entry.put("tail_recursive", metadata.isTailRecursive());
            entry.put("recursion_depth", metadata.getRecursionDepth());
            entry.put("calls_count", metadata.getCallsCount());
            functions.add(entry);
        }
        map.put("functions", functions);

        List<Object> calls = new ArrayList<>();
        for (FunctionCall call : graph.getCalls()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("caller", call.getCallerId());
            entry.put("callee", call.getCalleeId());
            entry.put("block", call.getCallSite().getBlockId());
            entry.put("statement", call.getCallSite().getStatementId());
            entry.put("arguments", new ArrayList<>(call.getArguments()));
            entry.put("return_value_used", call.isReturnValueUsed());
            calls.add(entry);
        }
        map.put("calls", calls);
        map.put("recursive_components", copyNested(graph.getRecursiveComponents()));
        map.put("mutual_recursion_cycles", copyNested(graph.getMutualRecursionCycles()));

        CallGraphStatistics statistics = result.getCallGraphStatistics();
        if (statistics != null) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("total_functions", statistics.getTotalFunctions());
            stats.put("total_calls", statistics.getTotalCalls());
            stats.put("external_functions", statistics.getExternalFunctions());
            stats.put("recursive_functions", statistics.getRecursiveFunctions());
            stats.put("average_calls_per_function", statistics.getAverageCallsPerFunction());
            stats.put("max_calls_per_function", statistics.getMaxCallsPerFunction());
            stats.put("most_called_function", statistics.getMostCalledFunction());
            stats.put("most_called_count", statistics.getMostCalledCount());
            stats.put("deepest_call_chain", statistics.getDeepestCallChain());
            stats.put("average_recursion_depth", statistics.getAverageRecursionDepth());
            map.put("statistics", stats);
        }
        map.put("dot", result.getCallGraphDot());
        return map;
    }

    private Map<String, Object> interProcedural(InterProceduralRdResult definitions) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("converged", definitions.isConverged());
        map.put("iterations", definitions.getIterations());
        Map<String, Object> functions = new LinkedHashMap<>();
        for (String name : definitions.getFunctions().keySet()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("parameter_definitions", definitions(definitions.getParameterDefinitions(name)));
            entry.put("return_definitions", definitions(definitions.getReturnDefinitions(name)));
            functions.put(name, entry);
        }
        map.put("functions", functions);
        return map;
    }

    private static List<Object> copyNested(List<List<String>> lists) {
        List<Object> copy = new ArrayList<>();
        for (List<String> list : lists) {
            copy.add(new ArrayList<>(list));
        }
        return copy;
    }
}
