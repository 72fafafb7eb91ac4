package com.flowsentry.analysis;

import com.flowsentry.analysis.FunctionCallExtractor.ExtractedCall;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionCallExtractorTest {

    @Test
    void extractsOuterCallsBeforeNestedOnes() {
        List<ExtractedCall> calls = FunctionCallExtractor.extractCalls("x = f(g(a), b);");

        assertEquals(2, calls.size());
        assertEquals("f", calls.get(0).getName());
        assertEquals(Arrays.asList("g(a)", "b"), calls.get(0).getArguments());
        assertEquals("f(g(a), b)", calls.get(0).getCallExpression());
        assertEquals("g", calls.get(1).getName());
        assertEquals(Arrays.asList("a"), calls.get(1).getArguments());
    }

    @Test
    void skipsKeywordsAndParenthesesInsideStrings() {
        List<ExtractedCall> calls = FunctionCallExtractor.extractCalls("if (check(\"a(b, c)\", n)) ");

        assertEquals(1, calls.size());
        assertEquals("check", calls.get(0).getName());
        assertEquals(Arrays.asList("\"a(b, c)\"", "n"), calls.get(0).getArguments());
    }

    @Test
    void stripsExporterArtifacts() {
        assertEquals("foo(x, y)", FunctionCallExtractor.cleanStatementText("<recovery-expr>(foo, x, y)"));
        assertEquals("bar(n)", FunctionCallExtractor.cleanStatementText("[B1.2](bar)(n)"));
        assertEquals("baz(p)", FunctionCallExtractor.cleanStatementText("(ImplicitCastExpr, FunctionToPointerDecay)baz(p)"));
    }

    @Test
    void splitsOnlyAtTopLevelCommas() {
        assertEquals(Arrays.asList("a[i, j]", "f(x, y)", "\"p, q\""),
            FunctionCallExtractor.splitArguments("a[i, j], f(x, y), \"p, q\""));
        assertTrue(FunctionCallExtractor.splitArguments("  ").isEmpty());
    }

    @Test
    void detectsConsumedReturnValues() {
        assertTrue(FunctionCallExtractor.isReturnValueUsed("n = read_int();", "read_int"));
        assertTrue(FunctionCallExtractor.isReturnValueUsed("if (ready(fd))", "ready"));
        assertTrue(FunctionCallExtractor.isReturnValueUsed("return next(it);", "next"));
        assertTrue(FunctionCallExtractor.isReturnValueUsed("total = 1 + size(v);", "size"));
        assertFalse(FunctionCallExtractor.isReturnValueUsed("flush(out);", "flush"));
    }

    @Test
    void guessesArgumentTypesFromLiterals() {
        assertEquals(Arrays.asList("int", "double", "const char*", "array", "pointer", "auto"),
            FunctionCallExtractor.inferArgumentTypes(Arrays.asList("42", "3.5", "\"s\"", "buf[2]", "*p", "x")));
    }

    @Test
    void findsNamedCall() {
        ExtractedCall call = FunctionCallExtractor.findCall("r = open(path, flags);", "open");

        assertEquals(Arrays.asList("path", "flags"), call.getArguments());
        assertNull(call.getArgument(2));
        assertNull(FunctionCallExtractor.findCall("r = open(path, flags);", "close"));
        assertNull(FunctionCallExtractor.firstCall("x = y + 1;"));
    }
}
