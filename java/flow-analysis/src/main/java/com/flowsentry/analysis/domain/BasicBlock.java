package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// BasicBlock: Unit of CFG analysis
// ============================================
public class BasicBlock {
    private final String id;
    private final String label;
    private final List<Statement> statements;
    private final List<String> predecessors;
    private final List<String> successors;
    private Boolean entryMarker;
    private Boolean exitMarker;

    public BasicBlock(String id, String label) {
        this.id = id;
        this.label = label != null ? label : id;
        this.statements = new ArrayList<>();
        this.predecessors = new ArrayList<>();
        this.successors = new ArrayList<>();
    }

    public void addStatement(Statement statement) {
        if (statement != null) {
            statements.add(statement);
        }
    }

    public void addPredecessor(String blockId) {
        if (blockId != null && !predecessors.contains(blockId)) {
            predecessors.add(blockId);
        }
    }

    public void addSuccessor(String blockId) {
        if (blockId != null && !successors.contains(blockId)) {
            successors.add(blockId);
        }
    }

    public void setEntryMarker(Boolean entryMarker) {
        this.entryMarker = entryMarker;
    }

    public void setExitMarker(Boolean exitMarker) {
        this.exitMarker = exitMarker;
    }

    public Statement getLastStatement() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    /**
     * Explicit marker when present, otherwise "no predecessors".
     */
    public boolean isEntryCandidate() {
        return entryMarker != null ? entryMarker : predecessors.isEmpty();
    }

    /**
     * Explicit marker when present, otherwise "no successors".
     */
    public boolean isExitCandidate() {
        return exitMarker != null ? exitMarker : successors.isEmpty();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public List<String> getPredecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    public List<String> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public Boolean getEntryMarker() {
        return entryMarker;
    }

    public Boolean getExitMarker() {
        return exitMarker;
    }
}
