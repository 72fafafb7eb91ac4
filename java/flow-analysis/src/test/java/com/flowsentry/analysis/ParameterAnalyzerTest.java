package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ArgumentDerivation;
import com.flowsentry.analysis.domain.DerivationType;
import com.flowsentry.analysis.domain.ParameterMapping;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ParameterAnalyzerTest {

    private final ParameterAnalyzer analyzer = new ParameterAnalyzer();

    @Test
    void classifiesPointerArguments() {
        ArgumentDerivation address = analyzer.analyzeArgument("&count");
        assertEquals(DerivationType.ADDRESS, address.getType());
        assertEquals("count", address.getBaseVariable());
        assertEquals(Collections.singletonList("&"), address.getTransformations());

        ArgumentDerivation deref = analyzer.analyzeArgument("*cursor");
        assertEquals(DerivationType.DEREFERENCE, deref.getType());
        assertEquals(Collections.singleton("cursor"), deref.getUsedVariables());
    }

    @Test
    void classifiesCallArguments() {
        ArgumentDerivation call = analyzer.analyzeArgument("strlen(name)");

        assertEquals(DerivationType.CALL, call.getType());
        assertEquals("strlen", call.getBaseVariable());
        assertEquals(Collections.singleton("name"), call.getUsedVariables());
    }

    @Test
    void classifiesArrayAndMemberAccess() {
        ArgumentDerivation array = analyzer.analyzeArgument("buf[i + 1]");
        assertEquals(DerivationType.ARRAY_ACCESS, array.getType());
        assertEquals("buf", array.getBaseVariable());
        assertEquals(Collections.singletonList("[i + 1]"), array.getTransformations());
        assertEquals(new HashSet<>(Arrays.asList("buf", "i")), array.getUsedVariables());

        ArgumentDerivation member = analyzer.analyzeArgument("req->name");
        assertEquals(DerivationType.MEMBER_ACCESS, member.getType());
        assertEquals("req", member.getBaseVariable());
        assertEquals(Collections.singletonList("name"), member.getTransformations());
        assertEquals(new HashSet<>(Arrays.asList("req", "req.name")), member.getUsedVariables());
    }

    @Test
    void classifiesExpressionsAndIdentifiers() {
        ArgumentDerivation expression = analyzer.analyzeArgument("n - 1");
        assertEquals(DerivationType.EXPRESSION, expression.getType());
        assertEquals("n", expression.getBaseVariable());

        ArgumentDerivation direct = analyzer.analyzeArgument(" total ");
        assertEquals(DerivationType.DIRECT, direct.getType());
        assertEquals("total", direct.getBaseVariable());

        ArgumentDerivation literal = analyzer.analyzeArgument("42");
        assertEquals(DerivationType.EXPRESSION, literal.getType());
        assertEquals(Collections.<String>emptySet(), literal.getUsedVariables());
    }

    @Test
    void mapsActualsToFormalsByPosition() {
        List<ParameterMapping> mappings = analyzer.mapParameters("store",
            Arrays.asList("key", "value"), Arrays.asList("k", "v + 1", "extra"));

        assertEquals(2, mappings.size());
        assertEquals("value", mappings.get(1).getFormalName());
        assertEquals("v + 1", mappings.get(1).getActualArgument());
        assertEquals(1, mappings.get(1).getPosition());
        assertEquals(DerivationType.EXPRESSION, mappings.get(1).getDerivation().getType());
        assertEquals(1, analyzer.mapParameters("store", Arrays.asList("key", "value"),
            Collections.singletonList("k")).size());
    }
}
