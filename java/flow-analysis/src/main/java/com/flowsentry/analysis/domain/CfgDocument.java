package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// CfgDocument: Workspace-level exporter output
// ============================================
public class CfgDocument {
    private final List<SourceFile> files;

    public CfgDocument() {
        this.files = new ArrayList<>();
    }

    public void addFile(SourceFile file) {
        if (file != null) {
            files.add(file);
        }
    }

    public List<SourceFile> getFiles() {
        return Collections.unmodifiableList(files);
    }

    public SourceFile getFile(String path) {
        for (SourceFile file : files) {
            if (file.getPath().equals(path)) {
                return file;
            }
        }
        return null;
    }

    /**
     * All functions keyed by name; a later file wins on a name clash.
     */
    public Map<String, FunctionCfg> getFunctionsByName() {
        Map<String, FunctionCfg> byName = new LinkedHashMap<>();
        for (SourceFile file : files) {
            for (FunctionCfg function : file.getFunctions()) {
                byName.put(function.getName(), function);
            }
        }
        return byName;
    }

    public int getFunctionCount() {
        int count = 0;
        for (SourceFile file : files) {
            count += file.getFunctions().size();
        }
        return count;
    }
}
