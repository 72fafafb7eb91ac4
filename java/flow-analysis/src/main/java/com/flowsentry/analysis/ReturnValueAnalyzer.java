package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.ReturnKind;
import com.flowsentry.analysis.domain.ReturnValueInfo;
import com.flowsentry.analysis.domain.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and classifies the return statements of a function.
 */
public class ReturnValueAnalyzer {

    private static final Pattern RETURN_VALUE = Pattern.compile("return\\s+(.+?);?$");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/%<>=!&|]");
    private static final Pattern IDENTIFIER = Pattern.compile("^\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*$");
    private static final Pattern INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d+\\.\\d+");

    public List<ReturnValueInfo> analyze(FunctionCfg cfg) {
        List<ReturnValueInfo> returns = new ArrayList<>();
        for (BasicBlock block : cfg.getBasicBlocks()) {
            for (Statement statement : block.getStatements()) {
                if (statement.isReturn()) {
                    returns.add(classify(cfg.getName(), block.getId(), statement));
                }
            }
        }
        return returns;
    }

    public ReturnValueInfo classify(String functionName, String blockId, Statement statement) {
        String text = FunctionCallExtractor.cleanStatementText(statement.getText());
        Matcher matcher = RETURN_VALUE.matcher(text);
        if (!matcher.find()) {
            return new ReturnValueInfo(functionName, blockId, statement.getId(), "", ReturnKind.VOID,
                Collections.<String>emptySet(), "void");
        }
        String value = matcher.group(1).trim();
        String type = inferType(value);

        FunctionCallExtractor.ExtractedCall call = FunctionCallExtractor.firstCall(value);
        if (call != null) {
            Set<String> used = new LinkedHashSet<>();
            for (String argument : call.getArguments()) {
                used.addAll(StatementFactsExtractor.usedVariables(argument));
            }
            return info(functionName, blockId, statement, value, ReturnKind.CALL, used, type);
        }
        if (value.contains("?") && value.contains(":")) {
            return info(functionName, blockId, statement, value, ReturnKind.CONDITIONAL,
                StatementFactsExtractor.usedVariables(value), type);
        }
        if (OPERATOR.matcher(value).find()) {
            return info(functionName, blockId, statement, value, ReturnKind.EXPRESSION,
                StatementFactsExtractor.usedVariables(value), type);
        }
        if (isConstant(value)) {
            return info(functionName, blockId, statement, value, ReturnKind.CONSTANT,
                Collections.<String>emptySet(), type);
        }
        Matcher identifier = IDENTIFIER.matcher(value);
        if (identifier.matches()) {
            return info(functionName, blockId, statement, value, ReturnKind.VARIABLE,
                Collections.singleton(identifier.group(1)), type);
        }
        return info(functionName, blockId, statement, value, ReturnKind.EXPRESSION,
            StatementFactsExtractor.usedVariables(value), type);
    }

    public boolean hasMultipleReturnPaths(FunctionCfg cfg) {
        return analyze(cfg).size() > 1;
    }

    public boolean hasConditionalReturns(FunctionCfg cfg) {
        for (ReturnValueInfo info : analyze(cfg)) {
            if (info.isConditional()) {
                return true;
            }
        }
        return false;
    }

    static String inferType(String value) {
        String trimmed = value != null ? value.trim() : "";
        if (trimmed.isEmpty()) {
            return "void";
        }
        if (INTEGER.matcher(trimmed).matches()) {
            return "int";
        }
        if (DECIMAL.matcher(trimmed).find()) {
            return "double";
        }
        if ("true".equals(trimmed) || "false".equals(trimmed)) {
            return "bool";
        }
        if ("nullptr".equals(trimmed) || "NULL".equals(trimmed)) {
            return "void*";
        }
        if (trimmed.length() > 1 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return "const char*";
        }
        if (trimmed.length() > 1 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return "char";
        }
        return "auto";
    }

    private static boolean isConstant(String value) {
        return INTEGER.matcher(value).matches() || value.matches("^\\d+\\.\\d+$")
            || "true".equals(value) || "false".equals(value)
            || "nullptr".equals(value) || "NULL".equals(value);
    }

    private static ReturnValueInfo info(String functionName, String blockId, Statement statement, String value,
                                        ReturnKind kind, Set<String> used, String type) {
        return new ReturnValueInfo(functionName, blockId, statement.getId(), value, kind, used, type);
    }
}
