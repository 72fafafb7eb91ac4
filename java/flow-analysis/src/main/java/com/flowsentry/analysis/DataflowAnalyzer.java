package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.CallGraph;
import com.flowsentry.analysis.domain.CfgDocument;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every enabled analysis over a CFG document.
 *
 * <p>Files are validated and solved intra-procedurally as independent tasks on a fixed
 * thread pool. The call graph, inter-procedural reaching definitions and inter-procedural
 * taint then run once over all valid functions.</p>
 */
public class DataflowAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(DataflowAnalyzer.class);

    private final AnalysisConfig config;
    private final TaintSourceRegistry sources;
    private final TaintSinkRegistry sinks;
    private final SanitizationRegistry sanitizers;
    private final FunctionSummaryTable summaries;
    private final CfgValidator validator;
    private final CallGraphAnalyzer callGraphAnalyzer;
    private final VulnerabilitySynthesizer synthesizer;

    public DataflowAnalyzer(AnalysisConfig config) {
        this(config, new TaintSourceRegistry(), new TaintSinkRegistry(), new SanitizationRegistry(),
            new FunctionSummaryTable());
    }

    public DataflowAnalyzer(AnalysisConfig config, TaintSourceRegistry sources, TaintSinkRegistry sinks,
                            SanitizationRegistry sanitizers, FunctionSummaryTable summaries) {
        this.config = config != null ? config : AnalysisConfig.defaults();
        this.sources = sources;
        this.sinks = sinks;
        this.sanitizers = sanitizers;
        this.summaries = summaries;
        this.validator = new CfgValidator();
        this.callGraphAnalyzer = new CallGraphAnalyzer();
        this.synthesizer = new VulnerabilitySynthesizer();
    }

    // ============================================
    // PUBLIC API
    // ============================================

    public WorkspaceAnalysisResult analyze(Path cfgDocument) throws CfgFormatException {
        return analyze(new CfgDocumentReader().read(cfgDocument), new AnalysisDiagnostics());
    }

    public WorkspaceAnalysisResult analyze(CfgDocument document) {
        return analyze(document, new AnalysisDiagnostics());
    }

    public WorkspaceAnalysisResult analyze(CfgDocument document, AnalysisDiagnostics diagnostics) {
        LOG.info("Analyzing {} functions in {} files ({})", document.getFunctionCount(),
            document.getFiles().size(), config);
        WorkspaceAnalysisResult result = new WorkspaceAnalysisResult(config, diagnostics);
        Set<String> rejected = ConcurrentHashMap.newKeySet();

        runFileTasks(document, result, diagnostics, rejected);

        Map<String, FunctionCfg> valid = new LinkedHashMap<>();
        for (SourceFile file : document.getFiles()) {
            for (FunctionCfg cfg : file.getFunctions()) {
                FunctionAnalysisResult analyzed = result.getFunction(cfg.getName());
                if (analyzed != null && !valid.containsKey(cfg.getName())
                    && Objects.equals(analyzed.getSourceFile(), cfg.getSourceFile())) {
                    valid.put(cfg.getName(), cfg);
                }
            }
        }

        if (config.isCallGraphEnabled()) {
            analyzeCallGraph(valid, rejected, result, diagnostics);
        }

        List<String> vulnerable = new ArrayList<>();
        for (FunctionAnalysisResult function : result.getFunctions().values()) {
            if (!function.getVulnerabilities().isEmpty()) {
                vulnerable.add(function.getFunctionName());
            }
        }
        LOG.info("Analysis complete: {} functions, {} vulnerabilities in {}, {} warnings, {} errors",
            result.getFunctions().size(), result.getVulnerabilities().size(), vulnerable,
            diagnostics.getWarnings().size(), diagnostics.getErrors().size());
        return result;
    }

    // ============================================
    // PER-FILE PHASE
    // ============================================

    /**
     * Files are solved concurrently and merged in document order, so the first definition
     * of a duplicated name is the one kept.
     */
    private void runFileTasks(CfgDocument document, WorkspaceAnalysisResult result, AnalysisDiagnostics diagnostics,
                              Set<String> rejected) {
        List<SourceFile> files = document.getFiles();
        if (files.isEmpty()) {
            return;
        }
        int threads = Math.max(1, Math.min(config.getParallelism(), files.size()));
        ExecutorService taskExecutor = Executors.newFixedThreadPool(threads);
        List<Future<List<FunctionAnalysisResult>>> pending = new ArrayList<>();
        for (SourceFile file : files) {
            pending.add(taskExecutor.submit(new FileTask(file, diagnostics, rejected)));
        }
        taskExecutor.shutdown();
        try {
            for (int i = 0; i < files.size(); i++) {
                String path = files.get(i).getPath();
                try {
                    for (String duplicate : result.mergeFile(path, pending.get(i).get())) {
                        diagnostics.warn(LOG, "orchestrator", duplicate,
                            "function defined again in " + path + "; later definition skipped");
                    }
                } catch (ExecutionException e) {
                    diagnostics.error(LOG, "orchestrator", null, "Analysis of " + path + " failed: " + e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            taskExecutor.shutdownNow();
            diagnostics.error(LOG, "orchestrator", null, "Interrupted while waiting for file tasks");
        }
    }

    private class FileTask implements Callable<List<FunctionAnalysisResult>> {
        private final SourceFile file;
        private final AnalysisDiagnostics diagnostics;
        private final Set<String> rejected;

        FileTask(SourceFile file, AnalysisDiagnostics diagnostics, Set<String> rejected) {
            this.file = file;
            this.diagnostics = diagnostics;
            this.rejected = rejected;
        }

        @Override
        public List<FunctionAnalysisResult> call() {
            LOG.debug("Analyzing file {}", file.getPath());
            List<FunctionAnalysisResult> results = new ArrayList<>();
            for (FunctionCfg cfg : file.getFunctions()) {
                FunctionAnalysisResult analyzed = analyzeFunction(cfg, diagnostics);
                if (analyzed == null) {
                    rejected.add(cfg.getName());
                } else {
                    results.add(analyzed);
                }
            }
            return results;
        }
    }

    /**
     * Validate and solve one function; null when validation rejected it.
     */
    FunctionAnalysisResult analyzeFunction(FunctionCfg cfg, AnalysisDiagnostics diagnostics) {
        List<String> violations = validator.validate(cfg);
        if (!violations.isEmpty()) {
            for (String violation : violations) {
                diagnostics.error(LOG, "validator", cfg.getName(), violation);
            }
            return null;
        }
        FunctionAnalysisResult analyzed = new FunctionAnalysisResult(cfg.getName(), cfg.getSourceFile());
        if (config.isLivenessEnabled()) {
            analyzed.setLiveness(new LivenessAnalyzer(diagnostics).analyze(cfg));
        }
        if (config.isReachingDefinitionsEnabled()) {
            analyzed.setReachingDefinitions(new ReachingDefinitionsAnalyzer(diagnostics).analyze(cfg));
        }
        if (config.isTaintEnabled() && !config.isInterProceduralTaintEnabled()) {
            analyzed.addTaintResult(newTaintAnalyzer().analyze(cfg));
        }
        return analyzed;
    }

    // ============================================
    // WHOLE-PROGRAM PHASE
    // ============================================

    private void analyzeCallGraph(Map<String, FunctionCfg> valid, Set<String> rejected,
                                  WorkspaceAnalysisResult result, AnalysisDiagnostics diagnostics) {
        CallGraph graph = callGraphAnalyzer.build(valid.values(), rejected);
        result.setCallGraph(graph, callGraphAnalyzer.computeStatistics(graph), callGraphAnalyzer.toDot(graph));

        if (config.isInterProceduralEnabled() && config.isReachingDefinitionsEnabled()) {
            InterProceduralRdResult definitions =
                new InterProceduralReachingDefinitions(diagnostics, summaries).analyze(valid, graph);
            result.setInterProceduralDefinitions(definitions);
        }

        if (config.isTaintEnabled() && config.isInterProceduralTaintEnabled()) {
            InterProceduralTaintAnalyzer.InterProceduralTaintResult taint =
                new InterProceduralTaintAnalyzer(config, newTaintAnalyzer(), diagnostics).analyze(valid, graph);
            for (String name : valid.keySet()) {
                FunctionAnalysisResult function = result.getFunction(name);
                for (TaintAnalysisResult unit : taint.getResults(name)) {
                    function.addTaintResult(unit);
                }
                function.setVulnerabilities(synthesizer.deduplicate(function.getVulnerabilities()));
            }
        }
    }

    private TaintAnalyzer newTaintAnalyzer() {
        return new TaintAnalyzer(config, sources, sinks, sanitizers, summaries);
    }

    public AnalysisConfig getConfig() {
        return config;
    }
}
