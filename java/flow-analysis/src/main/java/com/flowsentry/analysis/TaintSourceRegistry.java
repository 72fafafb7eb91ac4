package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.TaintSource;
import com.flowsentry.analysis.domain.TaintSourceCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class TaintSourceRegistry {
    private final Map<String, TaintSource> sources = new ConcurrentHashMap<>();

    public TaintSourceRegistry() {
        registerDefaults();
    }

    /**
     * Registers a source; a later registration for the same function replaces the earlier one.
     */
    public void register(String functionName, TaintSourceCategory category, int argumentIndex, String description) {
        register(new TaintSource(functionName, category, argumentIndex, description));
    }

    public void register(TaintSource source) {
        if (source == null || source.getFunctionName() == null) {
            throw new IllegalArgumentException("taint source needs a function name");
        }
        sources.put(source.getFunctionName(), source);
    }

    public void unregister(String functionName) {
        if (functionName != null) {
            sources.remove(functionName);
        }
    }

    public boolean isSource(String functionName) {
        return functionName != null && sources.containsKey(functionName);
    }

    public TaintSource getSource(String functionName) {
        return functionName != null ? sources.get(functionName) : null;
    }

    public List<TaintSource> getSourcesByCategory(TaintSourceCategory category) {
        List<TaintSource> result = new ArrayList<>();
        for (TaintSource source : sources.values()) {
            if (source.getCategory() == category) {
                result.add(source);
            }
        }
        return result;
    }

    public Map<String, TaintSource> getSources() {
        return Collections.unmodifiableMap(sources);
    }

    /**
     * Variables receiving untrusted data from {@code call}.
     *
     * @param statementText full statement, used to find the assignment target
     */
    public Set<String> targetVariables(TaintSource source, FunctionCallExtractor.ExtractedCall call, String statementText) {
        Set<String> targets = new LinkedHashSet<>();
        String name = source.getFunctionName();
        if ("scanf".equals(name)) {
            addArgumentsFrom(call, 1, targets);
        } else if ("fscanf".equals(name)) {
            addArgumentsFrom(call, 2, targets);
        } else if ("gets".equals(name) || "fgets".equals(name)) {
            addArgument(call, 0, targets);
        } else if (source.taintsReturnValue()) {
            addIfPresent(StatementFactsExtractor.assignmentTargetOf(statementText), targets);
        } else {
            addArgument(call, source.getArgumentIndex(), targets);
        }
        if (targets.isEmpty()) {
            addIfPresent(StatementFactsExtractor.assignmentTargetOf(statementText), targets);
            addressArguments(call, targets);
        }
        return targets;
    }

    private static void addressArguments(FunctionCallExtractor.ExtractedCall call, Set<String> targets) {
        for (String argument : call.getArguments()) {
            if (argument.trim().startsWith("&")) {
                addIfPresent(StatementFactsExtractor.argumentVariable(argument), targets);
            }
        }
    }

    private static void addArgumentsFrom(FunctionCallExtractor.ExtractedCall call, int first, Set<String> targets) {
        for (int i = first; i < call.getArguments().size(); i++) {
            addArgument(call, i, targets);
        }
    }

    private static void addArgument(FunctionCallExtractor.ExtractedCall call, int index, Set<String> targets) {
        addIfPresent(StatementFactsExtractor.argumentVariable(call.getArgument(index)), targets);
    }

    private static void addIfPresent(String variable, Set<String> targets) {
        if (variable != null) {
            targets.add(variable);
        }
    }

    // ============================================
    // DEFAULT SOURCES
    // ============================================

    private void registerDefaults() {
        register("scanf", TaintSourceCategory.USER_INPUT, 1, "Formatted read from stdin");
        register("gets", TaintSourceCategory.USER_INPUT, 0, "Unbounded line read from stdin");
        register("fgets", TaintSourceCategory.USER_INPUT, 0, "Line read from a stream");
        register("getchar", TaintSourceCategory.USER_INPUT, -1, "Character read from stdin");
        register("getline", TaintSourceCategory.USER_INPUT, 0, "Line read from a stream");
        register("read", TaintSourceCategory.USER_INPUT, 1, "Read from a file descriptor");
        register("readline", TaintSourceCategory.USER_INPUT, 0, "Interactive line read");
        register("cin", TaintSourceCategory.USER_INPUT, 0, "C++ standard input stream");
        register("getline", TaintSourceCategory.USER_INPUT, 1, "C++ getline from a stream");

        register("fread", TaintSourceCategory.FILE_IO, 0, "Block read from a file");
        register("fscanf", TaintSourceCategory.FILE_IO, 1, "Formatted read from a file");
        register("fgets", TaintSourceCategory.FILE_IO, 0, "Line read from a file");
        register("read", TaintSourceCategory.FILE_IO, 1, "Read from a file descriptor");
        register("pread", TaintSourceCategory.FILE_IO, 1, "Positional file read");
        register("mmap", TaintSourceCategory.FILE_IO, -1, "Memory-mapped file contents");
        register("pread64", TaintSourceCategory.FILE_IO, 1, "64-bit positional file read");
        register("ifstream", TaintSourceCategory.FILE_IO, 0, "C++ input file stream");

        register("recv", TaintSourceCategory.NETWORK, 1, "Socket receive");
        register("recvfrom", TaintSourceCategory.NETWORK, 1, "Socket receive with sender address");
        register("recvmsg", TaintSourceCategory.NETWORK, 1, "Socket message receive");
        register("read", TaintSourceCategory.NETWORK, 1, "Read from a socket descriptor");
        register("SSL_read", TaintSourceCategory.NETWORK, 1, "TLS read");
        register("SSL_recv", TaintSourceCategory.NETWORK, 1, "TLS receive");
        register("recv_ex", TaintSourceCategory.NETWORK, 1, "Extended socket receive");

        register("getenv", TaintSourceCategory.ENVIRONMENT, -1, "Environment variable value");
        register("secure_getenv", TaintSourceCategory.ENVIRONMENT, -1, "Environment variable value");
        register("environ", TaintSourceCategory.ENVIRONMENT, 0, "Process environment array");

        register("argv", TaintSourceCategory.COMMAND_LINE, 0, "Command line arguments");
        register("argc", TaintSourceCategory.COMMAND_LINE, -1, "Command line argument count");

        register("sqlite3_column_text", TaintSourceCategory.DATABASE, -1, "SQLite text column");
        register("sqlite3_column_blob", TaintSourceCategory.DATABASE, -1, "SQLite blob column");
        register("mysql_fetch_row", TaintSourceCategory.DATABASE, 0, "MySQL result row");
        register("PQgetvalue", TaintSourceCategory.DATABASE, -1, "PostgreSQL field value");

        register("json_parse", TaintSourceCategory.CONFIGURATION, 0, "Parsed JSON document");
        register("yaml_parse", TaintSourceCategory.CONFIGURATION, 0, "Parsed YAML document");
        register("xml_parse", TaintSourceCategory.CONFIGURATION, 0, "Parsed XML document");
        register("ini_parse", TaintSourceCategory.CONFIGURATION, 0, "Parsed INI file");
    }
}
