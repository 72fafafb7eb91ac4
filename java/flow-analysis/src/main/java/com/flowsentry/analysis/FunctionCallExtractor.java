package com.flowsentry.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds call expressions in exported statement text.
 *
 * Calls are located with an {@code identifier(} scan and paren-depth matching, so nested
 * calls such as {@code f(g(x, y), h(z))} yield {@code f}, {@code g} and {@code h} with
 * correctly split arguments. String literals are masked before scanning.
 */
public final class FunctionCallExtractor {

    private static final Pattern CALL_NAME = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\(");
    private static final Pattern RECOVERY_EXPR = Pattern.compile("<recovery-expr>\\s*\\(([^,]+),\\s*(.+)\\)");
    private static final Pattern BLOCK_REFERENCE = Pattern.compile("\\[B\\d+\\.\\d+\\]\\s*\\(([^)]+)\\)");
    private static final Pattern CAST_ANNOTATION = Pattern.compile(
        "\\((?:ImplicitCastExpr|LValueToRValue|FunctionToPointerDecay|ArrayToPointerDecay)[^)]*\\)");

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
        "if", "else", "for", "while", "do", "switch", "case", "default",
        "break", "continue", "return", "goto", "try", "catch", "throw",
        "new", "delete", "this", "nullptr", "true", "false",
        "int", "float", "double", "char", "bool", "void", "auto", "long", "short",
        "unsigned", "signed", "const", "static", "extern", "volatile", "mutable",
        "class", "struct", "union", "enum", "namespace", "using",
        "public", "private", "protected", "virtual", "override", "final",
        "template", "typename", "operator",
        "sizeof", "typeid", "alignof", "decltype",
        "dynamic_cast", "static_cast", "const_cast", "reinterpret_cast"
    ));

    private FunctionCallExtractor() {
    }

    // ============================================
    // EXTRACTED CALL
    // ============================================

    public static class ExtractedCall {
        private final String name;
        private final String callExpression;
        private final List<String> arguments;
        private final int start;

        ExtractedCall(String name, String callExpression, List<String> arguments, int start) {
            this.name = name;
            this.callExpression = callExpression;
            this.arguments = Collections.unmodifiableList(arguments);
            this.start = start;
        }

        public String getName() {
            return name;
        }

        public String getCallExpression() {
            return callExpression;
        }

        public List<String> getArguments() {
            return arguments;
        }

        public int getStart() {
            return start;
        }

        public String getArgument(int index) {
            return index >= 0 && index < arguments.size() ? arguments.get(index) : null;
        }
    }

    // ============================================
    // PUBLIC API
    // ============================================

    /**
     * All calls in {@code text}, outer calls before the calls nested in their arguments.
     */
    public static List<ExtractedCall> extractCalls(String text) {
        List<ExtractedCall> calls = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return calls;
        }
        collectCalls(cleanStatementText(text), calls, 0);
        return calls;
    }

    public static ExtractedCall firstCall(String text) {
        List<ExtractedCall> calls = extractCalls(text);
        return calls.isEmpty() ? null : calls.get(0);
    }

    public static ExtractedCall findCall(String text, String functionName) {
        for (ExtractedCall call : extractCalls(text)) {
            if (call.getName().equals(functionName)) {
                return call;
            }
        }
        return null;
    }

    public static boolean isKeyword(String identifier) {
        return KEYWORDS.contains(identifier);
    }

    /**
     * Strip exporter artifacts: recovery expressions, block references and implicit casts.
     */
    public static String cleanStatementText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = RECOVERY_EXPR.matcher(text).replaceAll("$1($2)");
        cleaned = BLOCK_REFERENCE.matcher(cleaned).replaceAll("$1");
        cleaned = CAST_ANNOTATION.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }

    /**
     * Split an argument list at top-level commas.
     */
    public static List<String> splitArguments(String argumentList) {
        List<String> args = new ArrayList<>();
        if (argumentList == null || argumentList.trim().isEmpty()) {
            return args;
        }
        String masked = maskStringLiterals(argumentList);
        int depth = 0;
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                args.add(argumentList.substring(start, i).trim());
                start = i + 1;
            }
        }
        String last = argumentList.substring(start).trim();
        if (!last.isEmpty()) {
            args.add(last);
        }
        return args;
    }

    /**
     * Whether the value returned by {@code functionName} is consumed in {@code statement}:
     * assigned, tested in an if, returned, or used as an arithmetic operand.
     */
    public static boolean isReturnValueUsed(String statement, String functionName) {
        if (statement == null || functionName == null) {
            return false;
        }
        String name = Pattern.quote(functionName);
        return Pattern.compile("\\w+\\s*=\\s*" + name + "\\s*\\(").matcher(statement).find()
            || Pattern.compile("if\\s*\\(.*" + name + "\\s*\\(").matcher(statement).find()
            || Pattern.compile("return\\s+" + name + "\\s*\\(").matcher(statement).find()
            || Pattern.compile("[+*]\\s*" + name + "\\s*\\(").matcher(statement).find();
    }

    /**
     * Literal-based type guesses for actual arguments.
     */
    public static List<String> inferArgumentTypes(List<String> arguments) {
        List<String> types = new ArrayList<>();
        for (String arg : arguments) {
            String trimmed = arg.trim();
            if (trimmed.matches("\\d+")) {
                types.add("int");
            } else if (trimmed.matches("\\d+\\.\\d+")) {
                types.add("double");
            } else if (trimmed.matches("\".*\"")) {
                types.add("const char*");
            } else if (trimmed.contains("[")) {
                types.add("array");
            } else if (trimmed.startsWith("*")) {
                types.add("pointer");
            } else {
                types.add("auto");
            }
        }
        return types;
    }

    /**
     * Replace the contents of string and character literals with blanks, keeping offsets.
     */
    public static String maskStringLiterals(String text) {
        StringBuilder masked = new StringBuilder(text.length());
        char quote = 0;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                    masked.append(' ');
                } else if (c == '\\') {
                    escaped = true;
                    masked.append(' ');
                } else if (c == quote) {
                    quote = 0;
                    masked.append(c);
                } else {
                    masked.append(' ');
                }
            } else {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                masked.append(c);
            }
        }
        return masked.toString();
    }

    // ============================================
    // SCANNING
    // ============================================

    private static void collectCalls(String text, List<ExtractedCall> calls, int offset) {
        String masked = maskStringLiterals(text);
        Matcher matcher = CALL_NAME.matcher(masked);
        int from = 0;
        while (from < masked.length() && matcher.find(from)) {
            String name = matcher.group(1);
            int nameStart = matcher.start(1);
            from = matcher.end();
            if (isKeyword(name)) {
                continue;
            }
            int open = matcher.end() - 1;
            int close = findClosingParen(masked, open);
            if (close < 0) {
                continue;
            }
            String argumentText = text.substring(open + 1, close);
            List<String> args = splitArguments(argumentText);
            calls.add(new ExtractedCall(name, text.substring(nameStart, close + 1), args, offset + nameStart));
            collectCalls(argumentText, calls, offset + open + 1);
            from = close + 1;
        }
    }

    private static int findClosingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
