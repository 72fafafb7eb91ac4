package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.Severity;
import com.flowsentry.analysis.domain.SinkCategory;
import com.flowsentry.analysis.domain.TaintSink;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class TaintSinkRegistry {
    private final Map<String, TaintSink> sinks = new ConcurrentHashMap<>();

    public TaintSinkRegistry() {
        registerDefaults();
    }

    /**
     * Registers a sink; a later registration for the same function replaces the earlier one.
     */
    public void register(TaintSink sink) {
        if (sink == null || sink.getFunctionName() == null) {
            throw new IllegalArgumentException("taint sink needs a function name");
        }
        sinks.put(sink.getFunctionName(), sink);
    }

    public void unregister(String functionName) {
        if (functionName != null) {
            sinks.remove(functionName);
        }
    }

    public boolean isSink(String functionName) {
        return functionName != null && sinks.containsKey(functionName);
    }

    public TaintSink getSink(String functionName) {
        return functionName != null ? sinks.get(functionName) : null;
    }

    public List<TaintSink> getSinksByCategory(SinkCategory category) {
        List<TaintSink> result = new ArrayList<>();
        for (TaintSink sink : sinks.values()) {
            if (sink.getCategory() == category) {
                result.add(sink);
            }
        }
        return result;
    }

    public Map<String, TaintSink> getSinks() {
        return Collections.unmodifiableMap(sinks);
    }

    /**
     * Whether taint in argument {@code argumentIndex} reaches the sink. Indices outside the
     * sink's declared range match any argument.
     */
    public static boolean isDangerousArgument(TaintSink sink, int argumentIndex, int argumentCount) {
        List<Integer> indices = sink.getArgumentIndices();
        boolean anyInRange = false;
        for (Integer index : indices) {
            if (index < argumentCount) {
                anyInRange = true;
            }
        }
        return !anyInRange || indices.contains(argumentIndex);
    }

    // ============================================
    // DEFAULT SINKS
    // ============================================

    private void registerDefaults() {
        sink("sprintf", SinkCategory.SQL, Severity.CRITICAL, "SQL query built with sprintf", 0, 1);
        sink("snprintf", SinkCategory.SQL, Severity.CRITICAL, "SQL query built with snprintf", 0, 1);
        sink("sqlite3_exec", SinkCategory.SQL, Severity.CRITICAL, "SQLite query execution", 1);
        sink("sqlite3_prepare_v2", SinkCategory.SQL, Severity.CRITICAL, "SQLite statement preparation", 1);
        sink("mysql_query", SinkCategory.SQL, Severity.CRITICAL, "MySQL query execution", 1);
        sink("PQexec", SinkCategory.SQL, Severity.CRITICAL, "PostgreSQL query execution", 1);

        sink("system", SinkCategory.COMMAND, Severity.CRITICAL, "Shell command execution", 0);
        sink("popen", SinkCategory.COMMAND, Severity.CRITICAL, "Shell pipe", 0);
        sink("exec", SinkCategory.COMMAND, Severity.CRITICAL, "Program execution", 0);
        sink("execve", SinkCategory.COMMAND, Severity.CRITICAL, "Program execution", 0);
        sink("execl", SinkCategory.COMMAND, Severity.CRITICAL, "Program execution", 0);
        sink("execvp", SinkCategory.COMMAND, Severity.CRITICAL, "Program execution", 0);
        sink("execv", SinkCategory.COMMAND, Severity.CRITICAL, "Program execution", 0);

        sink("printf", SinkCategory.FORMAT_STRING, Severity.HIGH, "Untrusted format string", 0);
        sink("fprintf", SinkCategory.FORMAT_STRING, Severity.HIGH, "Untrusted format string", 1);
        sink("sprintf", SinkCategory.FORMAT_STRING, Severity.HIGH, "Untrusted format string", 1);
        sink("snprintf", SinkCategory.FORMAT_STRING, Severity.HIGH, "Untrusted format string", 2);
        sink("syslog", SinkCategory.FORMAT_STRING, Severity.HIGH, "Untrusted format string", 1);

        sink("fopen", SinkCategory.PATH, Severity.HIGH, "File opened from untrusted path", 0);
        sink("open", SinkCategory.PATH, Severity.HIGH, "File opened from untrusted path", 0);
        sink("openat", SinkCategory.PATH, Severity.HIGH, "File opened from untrusted path", 1);
        sink("chmod", SinkCategory.PATH, Severity.HIGH, "Permissions changed on untrusted path", 0);
        sink("chown", SinkCategory.PATH, Severity.HIGH, "Owner changed on untrusted path", 0);
        sink("unlink", SinkCategory.PATH, Severity.HIGH, "File removed by untrusted path", 0);
        sink("remove", SinkCategory.PATH, Severity.HIGH, "File removed by untrusted path", 0);

        sink("strcpy", SinkCategory.BUFFER, Severity.CRITICAL, "Unbounded string copy", 1);
        sink("strcat", SinkCategory.BUFFER, Severity.CRITICAL, "Unbounded string concatenation", 1);
        sink("sprintf", SinkCategory.BUFFER, Severity.CRITICAL, "Unbounded formatted write", 2);
        sink("gets", SinkCategory.BUFFER, Severity.CRITICAL, "Unbounded line read", 0);
        sink("scanf", SinkCategory.BUFFER, Severity.HIGH, "Unbounded formatted read", 1);

        sink("eval", SinkCategory.CODE, Severity.CRITICAL, "Dynamic code evaluation", 0);
        sink("system", SinkCategory.CODE, Severity.CRITICAL, "Dynamic code evaluation", 0);
    }

    private void sink(String functionName, SinkCategory category, Severity severity, String description,
                      Integer... argumentIndices) {
        register(new TaintSink(functionName, category, Arrays.asList(argumentIndices), severity,
            category.getDefaultCweId(), description));
    }
}
