package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.CfgDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Command line entry point: reads a CFG export, runs the configured analyses and prints
 * the JSON report.
 */
public class DataflowRunner {

    static final String USAGE = "Usage: --cfg <export.json> [--out <report.json>] [--dot <callgraph.dot>]"
        + " [--config <flowsentry.properties>] [--sensitivity minimal|conservative|balanced|precise|maximum]"
        + " [--context-depth <k>] [--no-liveness] [--no-rd] [--no-taint] [--no-interprocedural] [--no-callgraph]";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> options = parseArgs(args);
        if (options == null || !options.containsKey("cfg")) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        AnalysisConfig config;
        try {
            config = buildConfig(options, diagnostics);
        } catch (IOException exc) {
            err.println("Failed to read config " + options.get("config") + ": " + exc.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException exc) {
            err.println("Invalid --context-depth " + options.get("context-depth") + ": " + exc.getMessage());
            return EXIT_USAGE;
        }

        WorkspaceAnalysisResult result;
        try {
            CfgDocument document = new CfgDocumentReader().read(Paths.get(options.get("cfg")));
            result = new DataflowAnalyzer(config).analyze(document, diagnostics);
        } catch (CfgFormatException exc) {
            err.println("Failed to load " + options.get("cfg") + ": " + exc.getMessage());
            return EXIT_FAILURE;
        }

        AnalysisReportWriter writer = new AnalysisReportWriter();
        try {
            if (options.containsKey("out")) {
                writer.write(result, Paths.get(options.get("out")));
            } else {
                Writer stdout = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                writer.write(result, stdout);
                stdout.write(System.lineSeparator());
                stdout.flush();
            }
            if (options.containsKey("dot") && result.getCallGraphDot() != null) {
                Path dot = Paths.get(options.get("dot"));
                Path parent = dot.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(dot, result.getCallGraphDot().getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException exc) {
            err.println("Failed to write report: " + exc.getMessage());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    /**
     * Options keyed without the leading dashes; switches map to "true". Null on an
     * unknown argument or a value flag without its value.
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--cfg".equals(arg) || "--out".equals(arg) || "--dot".equals(arg) || "--config".equals(arg)
                || "--sensitivity".equals(arg) || "--context-depth".equals(arg)) {
                if (i + 1 >= args.length) {
                    return null;
                }
                options.put(arg.substring(2), args[++i]);
            } else if ("--no-liveness".equals(arg) || "--no-rd".equals(arg) || "--no-taint".equals(arg)
                || "--no-interprocedural".equals(arg) || "--no-callgraph".equals(arg)) {
                options.put(arg.substring(2), "true");
            } else {
                return null;
            }
        }
        return options;
    }

    /**
     * Properties file (or the classpath default) first, then command line overrides.
     */
    static AnalysisConfig buildConfig(Map<String, String> options, AnalysisDiagnostics diagnostics)
        throws IOException {
        AnalysisConfig base;
        if (options.containsKey("config")) {
            Properties properties = new Properties();
            try (InputStream in = Files.newInputStream(Paths.get(options.get("config")))) {
                properties.load(in);
            }
            base = AnalysisConfig.fromProperties(properties, diagnostics);
        } else {
            base = AnalysisConfig.loadDefault(diagnostics);
        }

        AnalysisConfig.Builder builder = base.toBuilder();
        if (options.containsKey("sensitivity")) {
            builder.sensitivity(SensitivityLevel.resolve(options.get("sensitivity"), diagnostics));
        }
        if (options.containsKey("context-depth")) {
            builder.contextDepth(Integer.parseInt(options.get("context-depth").trim()));
        }
        if (options.containsKey("no-liveness")) {
            builder.liveness(false);
        }
        if (options.containsKey("no-rd")) {
            builder.reachingDefinitions(false);
        }
        if (options.containsKey("no-taint")) {
            builder.taint(false);
        }
        if (options.containsKey("no-interprocedural")) {
            builder.interProcedural(false);
        }
        if (options.containsKey("no-callgraph")) {
            builder.callGraph(false);
        }
        return builder.build();
    }
}
