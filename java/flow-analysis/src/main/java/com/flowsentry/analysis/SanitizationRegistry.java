package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.SanitizationType;
import com.flowsentry.analysis.domain.SanitizerFunction;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class SanitizationRegistry {
    private final Map<String, SanitizerFunction> sanitizers = new ConcurrentHashMap<>();

    public SanitizationRegistry() {
        registerDefaults();
    }

    public void register(SanitizerFunction sanitizer) {
        if (sanitizer == null || sanitizer.getFunctionName() == null) {
            throw new IllegalArgumentException("sanitizer needs a function name");
        }
        sanitizers.put(sanitizer.getFunctionName(), sanitizer);
    }

    public void unregister(String functionName) {
        if (functionName != null) {
            sanitizers.remove(functionName);
        }
    }

    public boolean isSanitizer(String functionName) {
        return functionName != null && sanitizers.containsKey(functionName);
    }

    public SanitizerFunction getSanitizer(String functionName) {
        return functionName != null ? sanitizers.get(functionName) : null;
    }

    public Map<String, SanitizerFunction> getSanitizers() {
        return Collections.unmodifiableMap(sanitizers);
    }

    /**
     * Variable read by the sanitizer, or null when the argument names no variable.
     */
    public String inputVariable(SanitizerFunction sanitizer, FunctionCallExtractor.ExtractedCall call) {
        return StatementFactsExtractor.argumentVariable(call.getArgument(sanitizer.getInputIndex()));
    }

    /**
     * Variable holding the sanitized value: the assignment target for value-returning
     * sanitizers (the input itself when the result is discarded), otherwise the output argument.
     */
    public String outputVariable(SanitizerFunction sanitizer, FunctionCallExtractor.ExtractedCall call,
                                 String statementText) {
        if (sanitizer.returnsSanitizedValue()) {
            String target = StatementFactsExtractor.assignmentTargetOf(statementText);
            return target != null ? target : inputVariable(sanitizer, call);
        }
        return StatementFactsExtractor.argumentVariable(call.getArgument(sanitizer.getOutputIndex()));
    }

    // ============================================
    // DEFAULT SANITIZERS
    // ============================================

    private void registerDefaults() {
        for (String name : new String[] {"isalnum", "isdigit", "isalpha", "isxdigit", "strspn", "strcspn"}) {
            sanitizer(name, SanitizationType.VALIDATION, false, 0, -1, "Character class validation");
        }
        for (String name : new String[] {"url_encode", "htmlspecialchars", "base64_encode", "json_encode"}) {
            sanitizer(name, SanitizationType.ENCODING, true, 0, -1, "Output encoding");
        }
        for (String name : new String[] {"sql_escape", "shell_escape", "addslashes", "mysql_real_escape_string",
            "sqlite3_mprintf"}) {
            sanitizer(name, SanitizationType.ESCAPING, true, 0, -1, "Metacharacter escaping");
        }
        for (String name : new String[] {"strpbrk", "strtok"}) {
            sanitizer(name, SanitizationType.WHITELIST, false, 0, -1, "Character set filtering");
        }
        for (String name : new String[] {"atoi", "atol", "strtol", "strtoul"}) {
            sanitizer(name, SanitizationType.CONVERSION, false, 0, -1, "Numeric conversion");
        }
        for (String name : new String[] {"strncpy", "strncat", "strlcpy", "strlcat"}) {
            sanitizer(name, SanitizationType.LENGTH_LIMIT, false, 1, 0, "Bounded copy");
        }
        sanitizer("snprintf", SanitizationType.LENGTH_LIMIT, false, 2, 0, "Bounded formatted write");
    }

    private void sanitizer(String name, SanitizationType type, boolean removesTaint, int inputIndex,
                           int outputIndex, String description) {
        register(new SanitizerFunction(name, type, removesTaint, inputIndex, outputIndex, description));
    }
}
