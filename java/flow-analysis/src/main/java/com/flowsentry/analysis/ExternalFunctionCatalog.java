package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ExternalFunctionCategory;
import com.flowsentry.analysis.domain.ExternalFunctionInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Known library functions, with a name-pattern fallback for everything else.
 */
public class ExternalFunctionCatalog {

    private static final Pattern POSIX_PREFIX = Pattern.compile("^(pthread|sem|fork|exec|socket|bind|listen)");
    private static final Pattern POSIX_SUFFIX = Pattern.compile("_(read|write|open|close)$");
    private static final Pattern SYSTEM_PREFIX = Pattern.compile("^(system|exec|fork|spawn)");

    private final Map<String, ExternalFunctionInfo> functions = new LinkedHashMap<>();

    public ExternalFunctionCatalog() {
        registerDefaults();
    }

    public void register(ExternalFunctionInfo info) {
        if (info == null || info.getName() == null) {
            throw new IllegalArgumentException("external function needs a name");
        }
        functions.put(info.getName(), info);
    }

    public boolean isKnown(String name) {
        return functions.containsKey(name);
    }

    /**
     * Catalog entry, or a generic unsafe entry categorized by name pattern.
     */
    public ExternalFunctionInfo describe(String name) {
        ExternalFunctionInfo known = functions.get(name);
        if (known != null) {
            return known;
        }
        return new ExternalFunctionInfo(name, categorize(name), "Unknown external function", false,
            ExternalFunctionInfo.VARIADIC, "auto");
    }

    public ExternalFunctionCategory categorize(String name) {
        ExternalFunctionInfo known = functions.get(name);
        if (known != null) {
            return known.getCategory();
        }
        if (name.startsWith("std::")) {
            return ExternalFunctionCategory.CSTDLIB;
        }
        if (POSIX_PREFIX.matcher(name).find() || POSIX_SUFFIX.matcher(name).find()) {
            return ExternalFunctionCategory.POSIX;
        }
        if (SYSTEM_PREFIX.matcher(name).find()) {
            return ExternalFunctionCategory.SYSTEM;
        }
        return ExternalFunctionCategory.UNKNOWN;
    }

    public Map<String, ExternalFunctionInfo> getKnownFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    private void registerDefaults() {
        stdlib("printf", "Print formatted output", true, ExternalFunctionInfo.VARIADIC, "int");
        stdlib("scanf", "Read formatted input", false, ExternalFunctionInfo.VARIADIC, "int");
        stdlib("malloc", "Allocate memory", false, 1, "void*");
        stdlib("free", "Deallocate memory", false, 1, "void");
        stdlib("strcpy", "Copy string", false, 2, "char*");
        stdlib("memcpy", "Copy memory", false, 3, "void*");

        register(new ExternalFunctionInfo("open", ExternalFunctionCategory.POSIX, "Open file", false,
            ExternalFunctionInfo.VARIADIC, "int"));
        register(new ExternalFunctionInfo("read", ExternalFunctionCategory.POSIX, "Read from file", false, 3, "ssize_t"));
        register(new ExternalFunctionInfo("write", ExternalFunctionCategory.POSIX, "Write to file", false, 3, "ssize_t"));
        register(new ExternalFunctionInfo("close", ExternalFunctionCategory.POSIX, "Close file", true, 1, "int"));

        register(new ExternalFunctionInfo("system", ExternalFunctionCategory.SYSTEM, "Execute shell command", false, 1, "int"));
        register(new ExternalFunctionInfo("exit", ExternalFunctionCategory.SYSTEM, "Exit program", true, 1, "void"));
    }

    private void stdlib(String name, String description, boolean safe, int parameters, String returnType) {
        register(new ExternalFunctionInfo(name, ExternalFunctionCategory.STDLIB, description, safe, parameters, returnType));
    }
}
