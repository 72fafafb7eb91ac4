package com.flowsentry.analysis.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// FunctionCfg: Control flow graph of one function
// ============================================
public class FunctionCfg {
    private final String name;
    private final String sourceFile;
    private final Map<String, BasicBlock> blocks;
    private final List<String> parameters;
    private final List<String> ingestionProblems;
    private String entryBlockId;
    private String exitBlockId;

    public FunctionCfg(String name, String sourceFile) {
        this.name = name;
        this.sourceFile = sourceFile != null ? sourceFile : "<unknown>";
        this.blocks = new LinkedHashMap<>();
        this.parameters = new ArrayList<>();
        this.ingestionProblems = new ArrayList<>();
    }

    public void addBasicBlock(BasicBlock block) {
        if (block == null) {
            return;
        }
        blocks.put(block.getId(), block);
    }

    public void addParameter(String parameter) {
        if (parameter != null && !parameter.isEmpty()) {
            parameters.add(parameter);
        }
    }

    public void addIngestionProblem(String problem) {
        if (problem != null) {
            ingestionProblems.add(problem);
        }
    }

    public void setEntryBlockId(String entryBlockId) {
        this.entryBlockId = entryBlockId;
    }

    public void setExitBlockId(String exitBlockId) {
        this.exitBlockId = exitBlockId;
    }

    public BasicBlock getBlock(String blockId) {
        return blocks.get(blockId);
    }

    public BasicBlock getEntryBlock() {
        return entryBlockId != null ? blocks.get(entryBlockId) : null;
    }

    public BasicBlock getExitBlock() {
        return exitBlockId != null ? blocks.get(exitBlockId) : null;
    }

    public List<String> getSuccessors(String blockId) {
        BasicBlock block = blocks.get(blockId);
        return block != null ? block.getSuccessors() : Collections.<String>emptyList();
    }

    public List<String> getPredecessors(String blockId) {
        BasicBlock block = blocks.get(blockId);
        return block != null ? block.getPredecessors() : Collections.<String>emptyList();
    }

    /**
     * Blocks with the exit marker, or without successors when unmarked.
     */
    public List<String> getExitCandidates() {
        List<String> exits = new ArrayList<>();
        for (BasicBlock block : blocks.values()) {
            if (block.isExitCandidate()) {
                exits.add(block.getId());
            }
        }
        if (exitBlockId != null && blocks.containsKey(exitBlockId) && !exits.contains(exitBlockId)) {
            exits.add(exitBlockId);
        }
        return exits;
    }

    public Collection<BasicBlock> getBasicBlocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public Map<String, BasicBlock> getBlocks() {
        return Collections.unmodifiableMap(blocks);
    }

    public int getBlockCount() {
        return blocks.size();
    }

    public String getName() {
        return name;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public String getEntryBlockId() {
        return entryBlockId;
    }

    public String getExitBlockId() {
        return exitBlockId;
    }

    public List<String> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * Problems seen while reading the export, such as duplicate ids.
     */
    public List<String> getIngestionProblems() {
        return Collections.unmodifiableList(ingestionProblems);
    }
}
