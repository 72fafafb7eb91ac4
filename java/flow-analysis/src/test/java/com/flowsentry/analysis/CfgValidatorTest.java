package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CfgValidatorTest {

    private final CfgValidator validator = new CfgValidator();

    @Test
    void acceptsWellFormedFunction() {
        FunctionCfg cfg = CfgFixtures.function("ok")
            .block("B0", "x = 1;")
            .block("B1", "return x;")
            .edge("B0", "B1")
            .build();

        assertTrue(validator.isValid(cfg));
    }

    @Test
    void rejectsFunctionWithoutBlocks() {
        List<String> violations = validator.validate(new FunctionCfg("empty", "test.c"));

        assertEquals(1, violations.size());
        assertEquals("function has no basic blocks", violations.get(0));
    }

    @Test
    void reportsDanglingAndOneSidedEdges() {
        FunctionCfg cfg = new FunctionCfg("broken", "test.c");
        BasicBlock b0 = new BasicBlock("B0", "B0");
        BasicBlock b1 = new BasicBlock("B1", "B1");
        b0.addSuccessor("B1");
        b0.addSuccessor("B9");
        cfg.addBasicBlock(b0);
        cfg.addBasicBlock(b1);
        cfg.setEntryBlockId("B0");
        cfg.setExitBlockId("B1");

        List<String> violations = validator.validate(cfg);

        assertTrue(violations.contains("block B0 has unknown successor B9"));
        assertTrue(violations.contains("edge B0->B1 is missing from the predecessors of B1"));
        assertFalse(validator.isValid(cfg));
    }

    @Test
    void reportsMissingEntryAndExit() {
        FunctionCfg cfg = new FunctionCfg("loop", "test.c");
        BasicBlock b0 = new BasicBlock("B0", "B0");
        b0.addSuccessor("B0");
        b0.addPredecessor("B0");
        cfg.addBasicBlock(b0);

        List<String> violations = validator.validate(cfg);

        assertTrue(violations.contains("no entry block"));
        assertTrue(violations.contains("no exit block"));
        assertTrue(violations.contains("no block qualifies as entry"));
        assertTrue(violations.contains("no block qualifies as exit"));
    }

    @Test
    void carriesIngestionProblems() {
        FunctionCfg cfg = CfgFixtures.straightLine("dup", "return 0;");
        cfg.addIngestionProblem("duplicate block id B0");

        assertEquals(1, validator.validate(cfg).size());
        assertEquals("duplicate block id B0", validator.validate(cfg).get(0));
    }
}
