package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.CallGraph;
import com.flowsentry.analysis.domain.CallGraphStatistics;
import com.flowsentry.analysis.domain.Severity;
import com.flowsentry.analysis.domain.Vulnerability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Results for a whole CFG document. Per-file tasks merge into it concurrently; every
 * mutation holds {@link #lock}.
 */
public class WorkspaceAnalysisResult {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, FunctionAnalysisResult> functions = new LinkedHashMap<>();
    private final List<String> files = new ArrayList<>();
    private final AnalysisDiagnostics diagnostics;
    private final AnalysisConfig config;
    private CallGraph callGraph;
    private CallGraphStatistics callGraphStatistics;
    private String callGraphDot;
    private InterProceduralRdResult interProceduralDefinitions;

    public WorkspaceAnalysisResult(AnalysisConfig config, AnalysisDiagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * Add the functions of one file. A name already present from another file keeps its
     * first result.
     *
     * @return the names that were already taken
     */
    public List<String> mergeFile(String file, List<FunctionAnalysisResult> results) {
        List<String> duplicates = new ArrayList<>();
        lock.lock();
        try {
            files.add(file);
            for (FunctionAnalysisResult result : results) {
                if (functions.containsKey(result.getFunctionName())) {
                    duplicates.add(result.getFunctionName());
                } else {
                    functions.put(result.getFunctionName(), result);
                }
            }
        } finally {
            lock.unlock();
        }
        return duplicates;
    }

    public void setCallGraph(CallGraph callGraph, CallGraphStatistics statistics, String dot) {
        lock.lock();
        try {
            this.callGraph = callGraph;
            this.callGraphStatistics = statistics;
            this.callGraphDot = dot;
        } finally {
            lock.unlock();
        }
    }

    public void setInterProceduralDefinitions(InterProceduralRdResult interProceduralDefinitions) {
        lock.lock();
        try {
            this.interProceduralDefinitions = interProceduralDefinitions;
        } finally {
            lock.unlock();
        }
    }

    public FunctionAnalysisResult getFunction(String name) {
        lock.lock();
        try {
            return functions.get(name);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, FunctionAnalysisResult> getFunctions() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        } finally {
            lock.unlock();
        }
    }

    public List<String> getFiles() {
        lock.lock();
        try {
            return new ArrayList<>(files);
        } finally {
            lock.unlock();
        }
    }

    public List<Vulnerability> getVulnerabilities() {
        List<Vulnerability> all = new ArrayList<>();
        for (FunctionAnalysisResult function : getFunctions().values()) {
            all.addAll(function.getVulnerabilities());
        }
        return all;
    }

    /**
     * Vulnerabilities at or above {@code threshold}.
     */
    public List<Vulnerability> getVulnerabilities(Severity threshold) {
        List<Vulnerability> matching = new ArrayList<>();
        for (Vulnerability vulnerability : getVulnerabilities()) {
            if (vulnerability.getSeverity().isAtLeast(threshold)) {
                matching.add(vulnerability);
            }
        }
        return matching;
    }

    public AnalysisDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }

    public CallGraphStatistics getCallGraphStatistics() {
        return callGraphStatistics;
    }

    public String getCallGraphDot() {
        return callGraphDot;
    }

    public InterProceduralRdResult getInterProceduralDefinitions() {
        return interProceduralDefinitions;
    }
}
