package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.ArgumentDerivation;
import com.flowsentry.analysis.domain.DerivationType;
import com.flowsentry.analysis.domain.ParameterMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies actual arguments and binds them to formal parameters by position.
 */
public class ParameterAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterAnalyzer.class);

    private static final Pattern ARRAY_ACCESS = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\[([^\\]]+)\\]");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/%<>=!&|]");
    private static final Pattern IDENTIFIER = Pattern.compile("^\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*$");
    private static final Pattern FIRST_IDENTIFIER = Pattern.compile("\\b([a-zA-Z_][a-zA-Z0-9_]*)\\b");

    /**
     * Checks, in order: address-of, dereference, call, array index, member access, operator
     * expression, plain identifier. Anything else is an expression.
     */
    public ArgumentDerivation analyzeArgument(String argument) {
        String trimmed = argument != null ? argument.trim() : "";

        if (trimmed.startsWith("&")) {
            String base = trimmed.substring(1).trim();
            return new ArgumentDerivation(trimmed, DerivationType.ADDRESS, base,
                Collections.singletonList("&"), variablesOf(base));
        }
        if (trimmed.startsWith("*")) {
            String base = trimmed.substring(1).trim();
            return new ArgumentDerivation(trimmed, DerivationType.DEREFERENCE, base,
                Collections.singletonList("*"), variablesOf(base));
        }

        FunctionCallExtractor.ExtractedCall call = FunctionCallExtractor.firstCall(trimmed);
        if (call != null) {
            Set<String> used = new LinkedHashSet<>();
            for (String nested : call.getArguments()) {
                used.addAll(variablesOf(nested));
            }
            return new ArgumentDerivation(trimmed, DerivationType.CALL, call.getName(),
                Collections.singletonList("call"), used);
        }

        Matcher array = ARRAY_ACCESS.matcher(trimmed);
        if (array.find()) {
            Set<String> used = new LinkedHashSet<>();
            used.add(array.group(1));
            used.addAll(variablesOf(array.group(2)));
            return new ArgumentDerivation(trimmed, DerivationType.ARRAY_ACCESS, array.group(1),
                Collections.singletonList("[" + array.group(2) + "]"), used);
        }

        if (trimmed.contains(".") || trimmed.contains("->")) {
            String separator = trimmed.contains("->") && !trimmed.contains(".") ? "->" : ".";
            String[] parts = trimmed.split(Pattern.quote(separator));
            if (parts.length >= 2 && IDENTIFIER.matcher(parts[0]).matches()) {
                String base = parts[0].trim();
                List<String> members = new ArrayList<>();
                for (int i = 1; i < parts.length; i++) {
                    members.add(parts[i].trim());
                }
                Set<String> used = new LinkedHashSet<>();
                used.add(base);
                used.add(StatementFactsExtractor.normalize(trimmed));
                return new ArgumentDerivation(trimmed, DerivationType.MEMBER_ACCESS, base, members, used);
            }
        }

        if (OPERATOR.matcher(trimmed).find()) {
            Matcher primary = FIRST_IDENTIFIER.matcher(trimmed);
            String base = primary.find() ? primary.group(1) : trimmed;
            return new ArgumentDerivation(trimmed, DerivationType.EXPRESSION, base,
                Collections.singletonList("arithmetic"), variablesOf(trimmed));
        }

        Matcher identifier = IDENTIFIER.matcher(trimmed);
        if (identifier.matches()) {
            String name = identifier.group(1);
            return new ArgumentDerivation(trimmed, DerivationType.DIRECT, name,
                Collections.<String>emptyList(), Collections.singleton(name));
        }

        return new ArgumentDerivation(trimmed, DerivationType.EXPRESSION, trimmed,
            Collections.<String>emptyList(), variablesOf(trimmed));
    }

    /**
     * Pairs formals with actuals by position, for as many positions as both lists have.
     */
    public List<ParameterMapping> mapParameters(String callee, List<String> formals, List<String> actuals) {
        List<ParameterMapping> mappings = new ArrayList<>();
        int count = Math.min(formals.size(), actuals.size());
        for (int i = 0; i < count; i++) {
            String actual = actuals.get(i);
            mappings.add(new ParameterMapping(i, formals.get(i), actual, analyzeArgument(actual)));
        }
        if (actuals.size() > formals.size()) {
            LOG.debug("{} called with {} arguments but declares {} parameters; extra arguments ignored",
                callee, actuals.size(), formals.size());
        }
        return mappings;
    }

    private static Set<String> variablesOf(String expression) {
        return StatementFactsExtractor.usedVariables(expression);
    }
}
