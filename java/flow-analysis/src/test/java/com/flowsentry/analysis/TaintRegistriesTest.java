package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.SanitizationType;
import com.flowsentry.analysis.domain.SanitizerFunction;
import com.flowsentry.analysis.domain.Severity;
import com.flowsentry.analysis.domain.SinkCategory;
import com.flowsentry.analysis.domain.TaintSink;
import com.flowsentry.analysis.domain.TaintSource;
import com.flowsentry.analysis.domain.TaintSourceCategory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaintRegistriesTest {

    // ============================================
    // SOURCES
    // ============================================

    @Test
    void laterSourceRegistrationWins() {
        TaintSourceRegistry sources = new TaintSourceRegistry();

        assertEquals(TaintSourceCategory.NETWORK, sources.getSource("read").getCategory());
        sources.register("read", TaintSourceCategory.DATABASE, 1, "custom");
        assertEquals(TaintSourceCategory.DATABASE, sources.getSource("read").getCategory());
        sources.unregister("read");
        assertFalse(sources.isSource("read"));
        assertNull(sources.getSource(null));
    }

    @Test
    void scanfTaintsEveryArgumentAfterTheFormat() {
        TaintSourceRegistry sources = new TaintSourceRegistry();
        String text = "scanf(\"%d %s\", &count, name);";

        Set<String> targets = sources.targetVariables(sources.getSource("scanf"),
            FunctionCallExtractor.firstCall(text), text);

        assertEquals(new LinkedHashSet<>(Arrays.asList("count", "name")), targets);
    }

    @Test
    void returnValueSourceTaintsAssignmentTarget() {
        TaintSourceRegistry sources = new TaintSourceRegistry();
        String text = "home = getenv(\"HOME\");";
        TaintSource getenv = sources.getSource("getenv");

        assertTrue(getenv.taintsReturnValue());
        assertEquals(Collections.singleton("home"),
            sources.targetVariables(getenv, FunctionCallExtractor.firstCall(text), text));
    }

    @Test
    void bufferSourceTaintsItsArgument() {
        TaintSourceRegistry sources = new TaintSourceRegistry();
        String text = "n = recv(sock, packet, sizeof(packet), 0);";

        assertEquals(Collections.singleton("packet"),
            sources.targetVariables(sources.getSource("recv"), FunctionCallExtractor.firstCall(text), text));
    }

    @Test
    void rejectsSourceWithoutName() {
        assertThrows(IllegalArgumentException.class,
            () -> new TaintSourceRegistry().register(null, TaintSourceCategory.USER_INPUT, 0, "nameless"));
    }

    // ============================================
    // SINKS
    // ============================================

    @Test
    void lastRegistrationDefinesTheSink() {
        TaintSinkRegistry sinks = new TaintSinkRegistry();

        TaintSink sprintf = sinks.getSink("sprintf");
        assertEquals(SinkCategory.BUFFER, sprintf.getCategory());
        assertEquals(Collections.singletonList(2), sprintf.getArgumentIndices());
        assertEquals(Severity.CRITICAL, sprintf.getSeverity());
        assertEquals(SinkCategory.CODE, sinks.getSink("system").getCategory());
        assertEquals(SinkCategory.BUFFER, sinks.getSink("scanf").getCategory());
        assertEquals(Severity.HIGH, sinks.getSink("scanf").getSeverity());
        assertEquals("CWE-22", sinks.getSink("fopen").getCweId());
    }

    @Test
    void dangerousArgumentsFollowDeclaredIndices() {
        TaintSink sprintf = new TaintSinkRegistry().getSink("sprintf");

        assertTrue(TaintSinkRegistry.isDangerousArgument(sprintf, 2, 3));
        assertFalse(TaintSinkRegistry.isDangerousArgument(sprintf, 1, 3));
        // no declared index fits a two-argument call, so any argument counts
        assertTrue(TaintSinkRegistry.isDangerousArgument(sprintf, 1, 2));
    }

    @Test
    void sinksCanBeQueriedByCategory() {
        TaintSinkRegistry sinks = new TaintSinkRegistry();

        assertTrue(sinks.getSinksByCategory(SinkCategory.SQL).size() >= 4);
        sinks.unregister("mysql_query");
        assertFalse(sinks.isSink("mysql_query"));
    }

    // ============================================
    // SANITIZERS
    // ============================================

    @Test
    void escapingSanitizersReturnCleanValues() {
        SanitizationRegistry sanitizers = new SanitizationRegistry();
        SanitizerFunction escape = sanitizers.getSanitizer("sql_escape");
        String text = "safe = sql_escape(raw);";
        FunctionCallExtractor.ExtractedCall call = FunctionCallExtractor.firstCall(text);

        assertTrue(escape.isRemovesTaint());
        assertTrue(escape.returnsSanitizedValue());
        assertEquals("raw", sanitizers.inputVariable(escape, call));
        assertEquals("safe", sanitizers.outputVariable(escape, call, text));
    }

    @Test
    void discardedResultSanitizesTheInputItself() {
        SanitizationRegistry sanitizers = new SanitizationRegistry();
        SanitizerFunction escape = sanitizers.getSanitizer("shell_escape");
        String text = "shell_escape(cmd);";

        assertEquals("cmd", sanitizers.outputVariable(escape, FunctionCallExtractor.firstCall(text), text));
    }

    @Test
    void boundedCopyWritesItsDestination() {
        SanitizationRegistry sanitizers = new SanitizationRegistry();
        SanitizerFunction strncpy = sanitizers.getSanitizer("strncpy");
        String text = "strncpy(dest, src, sizeof(dest));";
        FunctionCallExtractor.ExtractedCall call = FunctionCallExtractor.firstCall(text);

        assertEquals(SanitizationType.LENGTH_LIMIT, strncpy.getType());
        assertFalse(strncpy.isRemovesTaint());
        assertEquals("src", sanitizers.inputVariable(strncpy, call));
        assertEquals("dest", sanitizers.outputVariable(strncpy, call, text));
    }

    @Test
    void conversionsKeepTaint() {
        SanitizerFunction atoi = new SanitizationRegistry().getSanitizer("atoi");

        assertEquals(SanitizationType.CONVERSION, atoi.getType());
        assertFalse(atoi.isRemovesTaint());
    }
}
