package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.FunctionSummary;
import com.flowsentry.analysis.domain.GlobalEffect;
import com.flowsentry.analysis.domain.ParameterMode;
import com.flowsentry.analysis.domain.ParameterSummary;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionSummaryTableTest {

    private final FunctionSummaryTable table = new FunctionSummaryTable();

    @Test
    void strcpyTaintsDestinationAndResult() {
        FunctionSummary strcpy = table.getSummary("strcpy");
        List<String> arguments = Arrays.asList("dest", "src");

        Set<String> tainted = table.propagate(strcpy, arguments, Collections.singleton(1), "copy");

        assertEquals(2, tainted.size());
        assertTrue(tainted.contains("dest"));
        assertTrue(tainted.contains("copy"));
    }

    @Test
    void taintedDestinationDoesNotFlowBackwards() {
        FunctionSummary strcpy = table.getSummary("strcpy");

        assertTrue(table.propagate(strcpy, Arrays.asList("dest", "src"), Collections.singleton(0), null).isEmpty());
    }

    @Test
    void sprintfFormatTaintsOutputButNotResult() {
        FunctionSummary sprintf = table.getSummary("sprintf");

        Set<String> tainted = table.propagate(sprintf, Arrays.asList("out", "fmt", "arg"),
            Collections.singleton(1), "written");

        assertEquals(Collections.singleton("out"), tainted);
        assertFalse(sprintf.isReturnTainted());
    }

    @Test
    void fopenResultDependsOnPath() {
        FunctionSummary fopen = table.getSummary("fopen");

        assertTrue(fopen.returnTaintedBy(0));
        assertFalse(fopen.returnTaintedBy(1));
        assertEquals(Collections.singleton("fp"),
            table.propagate(fopen, Arrays.asList("path", "\"r\""), Collections.singleton(0), "fp"));
    }

    @Test
    void freeIsModelledAsNoEffect() {
        FunctionSummary free = table.getSummary("free");

        assertTrue(table.propagate(free, Collections.singletonList("p"), Collections.singleton(0), null).isEmpty());
        assertEquals(ParameterMode.IN, free.getParameter(0).getMode());
        assertNull(free.getParameter(1));
    }

    @Test
    void customSummaryReplacesBuiltIn() {
        table.register(new FunctionSummary("malloc",
            Collections.singletonList(new ParameterSummary(0, "size", ParameterMode.IN, true)),
            true, Collections.singletonList(0), Collections.<GlobalEffect>emptyList(), "memory"));

        assertTrue(table.getSummary("malloc").returnTaintedBy(0));
        assertFalse(table.hasSummary("unknown_fn"));
        assertNull(table.getSummary("unknown_fn"));
    }
}
