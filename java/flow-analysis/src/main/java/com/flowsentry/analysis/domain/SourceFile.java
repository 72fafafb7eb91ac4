package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// SourceFile: Functions exported from one translation unit
// ============================================
public class SourceFile {
    private final String path;
    private final List<FunctionCfg> functions;

    public SourceFile(String path) {
        this.path = path != null ? path : "<unknown>";
        this.functions = new ArrayList<>();
    }

    public void addFunction(FunctionCfg function) {
        if (function != null) {
            functions.add(function);
        }
    }

    public String getPath() {
        return path;
    }

    public List<FunctionCfg> getFunctions() {
        return Collections.unmodifiableList(functions);
    }
}
