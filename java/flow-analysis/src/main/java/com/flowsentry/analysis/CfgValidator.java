package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks run before any solver touches a function. A function with violations
 * is skipped; the rest of the workspace is still analyzed.
 */
public class CfgValidator {

    public List<String> validate(FunctionCfg cfg) {
        List<String> violations = new ArrayList<>(cfg.getIngestionProblems());
        if (cfg.getBlockCount() == 0) {
            violations.add("function has no basic blocks");
            return violations;
        }

        if (cfg.getEntryBlockId() == null) {
            violations.add("no entry block");
        } else if (cfg.getBlock(cfg.getEntryBlockId()) == null) {
            violations.add("entry block " + cfg.getEntryBlockId() + " does not exist");
        }
        if (cfg.getExitBlockId() == null) {
            violations.add("no exit block");
        } else if (cfg.getBlock(cfg.getExitBlockId()) == null) {
            violations.add("exit block " + cfg.getExitBlockId() + " does not exist");
        }

        boolean hasEntryCandidate = false;
        boolean hasExitCandidate = false;
        for (BasicBlock block : cfg.getBasicBlocks()) {
            hasEntryCandidate |= block.isEntryCandidate();
            hasExitCandidate |= block.isExitCandidate();
            for (String successor : block.getSuccessors()) {
                BasicBlock target = cfg.getBlock(successor);
                if (target == null) {
                    violations.add("block " + block.getId() + " has unknown successor " + successor);
                } else if (!target.getPredecessors().contains(block.getId())) {
                    violations.add("edge " + block.getId() + "->" + successor
                        + " is missing from the predecessors of " + successor);
                }
            }
            for (String predecessor : block.getPredecessors()) {
                BasicBlock source = cfg.getBlock(predecessor);
                if (source == null) {
                    violations.add("block " + block.getId() + " has unknown predecessor " + predecessor);
                } else if (!source.getSuccessors().contains(block.getId())) {
                    violations.add("edge " + predecessor + "->" + block.getId()
                        + " is missing from the successors of " + predecessor);
                }
            }
        }
        if (!hasEntryCandidate) {
            violations.add("no block qualifies as entry");
        }
        if (!hasExitCandidate) {
            violations.add("no block qualifies as exit");
        }
        return violations;
    }

    public boolean isValid(FunctionCfg cfg) {
        return validate(cfg).isEmpty();
    }
}
