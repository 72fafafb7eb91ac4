package com.flowsentry.maven;

import com.flowsentry.analysis.AnalysisConfig;
import com.flowsentry.analysis.AnalysisDiagnostics;
import com.flowsentry.analysis.AnalysisReportWriter;
import com.flowsentry.analysis.CfgDocumentReader;
import com.flowsentry.analysis.DataflowAnalyzer;
import com.flowsentry.analysis.Diagnostic;
import com.flowsentry.analysis.SensitivityLevel;
import com.flowsentry.analysis.WorkspaceAnalysisResult;
import com.flowsentry.analysis.domain.Severity;
import com.flowsentry.analysis.domain.Vulnerability;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Mojo(name = "analyze-dataflow", defaultPhase = LifecyclePhase.VERIFY)
public class AnalyzeDataflowMojo extends AbstractMojo {

    static final String CFG_SUFFIX = ".cfg.json";
    static final String REPORT_DIRECTORY = "flowsentry-reports";

    @Parameter(defaultValue = "${project}", required = true, readonly = true)
    private MavenProject project;

    @Parameter(defaultValue = "${project.build.directory}", required = true)
    private File buildDirectory;

    @Parameter(defaultValue = "${project.build.directory}/cfg")
    private File cfgDirectory;

    @Parameter(defaultValue = "precise")
    private String sensitivity;

    @Parameter(defaultValue = "1")
    private int contextDepth;

    @Parameter(defaultValue = "json,dot")
    private String reportFormat;

    @Parameter(defaultValue = "false")
    private boolean failOnVulnerability;

    @Parameter(defaultValue = "HIGH")
    private String failSeverity;

    @Parameter(defaultValue = "false", property = "flowsentry.skip")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("FlowSentry dataflow analysis skipped");
            return;
        }
        getLog().info("FlowSentry dataflow analysis starting...");

        Map<String, WorkspaceAnalysisResult> results = new LinkedHashMap<>();
        try {
            Path cfgRoot = cfgDirectory.toPath();
            if (!Files.exists(cfgRoot)) {
                getLog().warn("CFG directory not found: " + cfgRoot);
                return;
            }
            List<Path> documents = findCfgDocuments(cfgRoot);
            if (documents.isEmpty()) {
                getLog().warn("No *" + CFG_SUFFIX + " files under " + cfgRoot);
                return;
            }

            CfgDocumentReader reader = new CfgDocumentReader();
            for (Path document : documents) {
                getLog().debug("Analyzing: " + document);
                AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
                AnalysisConfig config = buildConfig(sensitivity, contextDepth, diagnostics);
                WorkspaceAnalysisResult result = new DataflowAnalyzer(config).analyze(reader.read(document), diagnostics);
                for (Diagnostic diagnostic : diagnostics.getErrors()) {
                    getLog().warn(documentName(cfgRoot, document) + ": " + diagnostic);
                }
                results.put(documentName(cfgRoot, document), result);
            }

            generateReports(results);
        } catch (Exception e) {
            throw new MojoExecutionException("Analysis failed", e);
        }

        List<Vulnerability> vulnerabilities = new ArrayList<>();
        for (WorkspaceAnalysisResult result : results.values()) {
            vulnerabilities.addAll(result.getVulnerabilities());
        }
        getLog().info("Found " + vulnerabilities.size() + " vulnerabilities in " + results.size() + " CFG documents");

        Severity threshold = resolveSeverity(failSeverity);
        List<Vulnerability> blocking = atOrAbove(vulnerabilities, threshold);
        if (failOnVulnerability && !blocking.isEmpty()) {
            throw new MojoFailureException(blocking.size() + " vulnerabilities at or above "
                + threshold + " (first: " + describe(blocking.get(0)) + ")");
        }
        getLog().info("Analysis complete");
    }

    private void generateReports(Map<String, WorkspaceAnalysisResult> results) throws IOException {
        Path reportDir = Paths.get(buildDirectory.getAbsolutePath(), REPORT_DIRECTORY);
        Files.createDirectories(reportDir);
        AnalysisReportWriter writer = new AnalysisReportWriter();

        if (reportFormat.contains("json")) {
            for (Map.Entry<String, WorkspaceAnalysisResult> entry : results.entrySet()) {
                writer.write(entry.getValue(), reportDir.resolve(reportBaseName(entry.getKey()) + ".json"));
            }
            writer.writeSummary(results, reportDir.resolve("summary.json"));
        }

        if (reportFormat.contains("dot")) {
            for (Map.Entry<String, WorkspaceAnalysisResult> entry : results.entrySet()) {
                String dot = entry.getValue().getCallGraphDot();
                if (dot != null) {
                    Files.write(reportDir.resolve(reportBaseName(entry.getKey()) + ".dot"),
                        dot.getBytes(StandardCharsets.UTF_8));
                }
            }
        }
        getLog().info("Reports written to " + reportDir);
    }

    // ============================================
    // HELPERS
    // ============================================

    static List<Path> findCfgDocuments(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(CFG_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    static AnalysisConfig buildConfig(String sensitivity, int contextDepth, AnalysisDiagnostics diagnostics) {
        return AnalysisConfig.loadDefault(diagnostics).toBuilder()
            .sensitivity(SensitivityLevel.resolve(sensitivity, diagnostics))
            .contextDepth(contextDepth)
            .build();
    }

    /**
     * Unknown names fall back to HIGH.
     */
    static Severity resolveSeverity(String name) {
        Severity severity = Severity.fromName(name);
        return severity != null ? severity : Severity.HIGH;
    }

    static List<Vulnerability> atOrAbove(List<Vulnerability> vulnerabilities, Severity threshold) {
        List<Vulnerability> matching = new ArrayList<>();
        for (Vulnerability vulnerability : vulnerabilities) {
            if (vulnerability.getSeverity().isAtLeast(threshold)) {
                matching.add(vulnerability);
            }
        }
        return matching;
    }

    static String documentName(Path root, Path document) {
        return root.relativize(document).toString().replace(File.separatorChar, '/');
    }

    /**
     * Flattens a relative document name into a report file stem.
     */
    static String reportBaseName(String documentName) {
        String base = documentName.endsWith(CFG_SUFFIX)
            ? documentName.substring(0, documentName.length() - CFG_SUFFIX.length())
            : documentName;
        return base.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String describe(Vulnerability vulnerability) {
        return vulnerability.getType().getDisplayName() + " in " + vulnerability.getSinkSite().getFunction()
            + " via " + vulnerability.getSinkFunction();
    }
}
