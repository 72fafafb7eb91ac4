package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.StatementKind;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives statement kinds and use/def facts from statement text when the exporter did not
 * deliver them. Variables are returned as access paths ({@code s.field}, with {@code ->}
 * normalized to {@code .}).
 */
public final class StatementFactsExtractor {

    private static final Pattern ACCESS_PATH = Pattern.compile(
        "[A-Za-z_][A-Za-z0-9_]*(?:\\s*(?:\\.|->)\\s*[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Pattern MEMBER_SEPARATOR = Pattern.compile("\\s*(?:\\.|->)\\s*");
    private static final Pattern INCREMENT = Pattern.compile(
        "(?:\\+\\+|--)\\s*([A-Za-z_][A-Za-z0-9_.>-]*)|([A-Za-z_][A-Za-z0-9_.>-]*)\\s*(?:\\+\\+|--)");

    private static final Set<String> TYPE_WORDS = new HashSet<>(Arrays.asList(
        "int", "char", "float", "double", "long", "short", "unsigned", "signed", "void", "bool",
        "const", "static", "extern", "volatile", "register", "struct", "union", "enum", "auto",
        "size_t", "ssize_t", "FILE", "uint8_t", "uint16_t", "uint32_t", "uint64_t",
        "int8_t", "int16_t", "int32_t", "int64_t", "std::string", "string"
    ));

    private static final Set<String> NON_VARIABLES = new HashSet<>(Arrays.asList(
        "NULL", "nullptr", "true", "false", "if", "else", "while", "for", "do", "switch", "case",
        "default", "return", "break", "continue", "goto", "sizeof", "new", "delete", "this", "std"
    ));

    private StatementFactsExtractor() {
    }

    /**
     * Best-effort kind from statement text.
     */
    public static StatementKind inferKind(String text) {
        String trimmed = text != null ? text.trim() : "";
        if (startsWithWord(trimmed, "if") || startsWithWord(trimmed, "switch")) {
            return StatementKind.CONDITIONAL;
        }
        if (startsWithWord(trimmed, "while") || startsWithWord(trimmed, "for") || startsWithWord(trimmed, "do")) {
            return StatementKind.LOOP;
        }
        if (startsWithWord(trimmed, "return")) {
            return StatementKind.RETURN;
        }
        boolean declaration = startsWithTypeWord(trimmed);
        if (assignmentOperator(trimmed) >= 0) {
            return declaration ? StatementKind.DECLARATION : StatementKind.ASSIGNMENT;
        }
        if (declaration) {
            return StatementKind.DECLARATION;
        }
        if (FunctionCallExtractor.firstCall(trimmed) != null) {
            return StatementKind.FUNCTION_CALL;
        }
        return StatementKind.OTHER;
    }

    /**
     * Variables written by the statement.
     */
    public static Set<String> definedVariables(String text) {
        Set<String> defined = new LinkedHashSet<>();
        String cleaned = prepare(text);
        int assign = assignmentOperator(cleaned);
        if (assign >= 0) {
            String target = assignmentTarget(cleaned.substring(0, assign));
            if (target != null) {
                defined.add(target);
            }
        }
        Matcher increment = INCREMENT.matcher(cleaned);
        while (increment.find()) {
            String name = increment.group(1) != null ? increment.group(1) : increment.group(2);
            defined.add(normalize(name));
        }
        return defined;
    }

    /**
     * Variables read by the statement, excluding called function names.
     */
    public static Set<String> usedVariables(String text) {
        Set<String> used = new LinkedHashSet<>();
        String cleaned = prepare(text);
        int assign = assignmentOperator(cleaned);
        if (assign >= 0) {
            String lhs = cleaned.substring(0, assign);
            boolean compound = assign > 0 && "+-*/%&|^<>".indexOf(cleaned.charAt(assign - 1)) >= 0;
            String target = assignmentTarget(lhs);
            // index and dereference expressions on the left are reads
            for (String name : collectPaths(lhs)) {
                if (!name.equals(target) || compound) {
                    used.add(name);
                }
            }
            used.addAll(collectPaths(cleaned.substring(assign + 1)));
        } else {
            used.addAll(collectPaths(cleaned));
        }
        Matcher increment = INCREMENT.matcher(cleaned);
        while (increment.find()) {
            String name = increment.group(1) != null ? increment.group(1) : increment.group(2);
            used.add(normalize(name));
        }
        return used;
    }

    /**
     * Variable named by a call argument: address-of, dereference and casts are stripped and
     * the first access path is returned. Null for literals and empty arguments.
     */
    public static String argumentVariable(String argument) {
        if (argument == null) {
            return null;
        }
        String stripped = prepare(argument).replaceAll("^\\([^()]*\\)\\s*", "");
        while (stripped.startsWith("&") || stripped.startsWith("*")) {
            stripped = stripped.substring(1).trim();
        }
        Matcher matcher = ACCESS_PATH.matcher(stripped);
        while (matcher.find()) {
            String path = normalize(matcher.group());
            boolean isNumberSuffix = matcher.start() > 0 && Character.isDigit(stripped.charAt(matcher.start() - 1));
            if (!isNumberSuffix && !TYPE_WORDS.contains(path) && !NON_VARIABLES.contains(path)) {
                return path;
            }
        }
        return null;
    }

    /**
     * Target of a plain or compound assignment, or null when the statement assigns nothing.
     */
    public static String assignmentTargetOf(String text) {
        String cleaned = prepare(text);
        int assign = assignmentOperator(cleaned);
        return assign >= 0 ? assignmentTarget(cleaned.substring(0, assign)) : null;
    }

    /**
     * Index of the plain or compound assignment operator, or -1.
     */
    static int assignmentOperator(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '=' && depth == 0) {
                char prev = i > 0 ? text.charAt(i - 1) : ' ';
                char next = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
                if (next == '=') {
                    i++;
                    continue;
                }
                if (prev == '=' || prev == '!' || ((prev == '<' || prev == '>')
                    && !(i > 1 && text.charAt(i - 2) == prev))) {
                    continue;
                }
                return i;
            }
        }
        return -1;
    }

    static String normalize(String accessPath) {
        return MEMBER_SEPARATOR.matcher(accessPath.trim()).replaceAll(".");
    }

    private static String assignmentTarget(String lhs) {
        String trimmed = lhs.trim();
        if (!trimmed.isEmpty() && "+-*/%&|^<>".indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
            if (trimmed.endsWith("<") || trimmed.endsWith(">")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
            }
        }
        int bracket = trimmed.indexOf('[');
        if (bracket >= 0) {
            trimmed = trimmed.substring(0, bracket);
        }
        String target = null;
        Matcher matcher = ACCESS_PATH.matcher(trimmed);
        while (matcher.find()) {
            String candidate = normalize(matcher.group());
            if (!TYPE_WORDS.contains(candidate) && !NON_VARIABLES.contains(candidate)) {
                target = candidate;
            }
        }
        return target;
    }

    private static Set<String> collectPaths(String text) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = ACCESS_PATH.matcher(text);
        while (matcher.find()) {
            String path = normalize(matcher.group());
            int after = matcher.end();
            while (after < text.length() && Character.isWhitespace(text.charAt(after))) {
                after++;
            }
            boolean isCall = after < text.length() && text.charAt(after) == '(' && !path.contains(".");
            boolean isNumberSuffix = matcher.start() > 0 && Character.isDigit(text.charAt(matcher.start() - 1));
            if (isCall || isNumberSuffix || TYPE_WORDS.contains(path) || NON_VARIABLES.contains(path)
                || FunctionCallExtractor.isKeyword(path)) {
                continue;
            }
            names.add(path);
        }
        return names;
    }

    private static String prepare(String text) {
        String cleaned = FunctionCallExtractor.cleanStatementText(text);
        String masked = FunctionCallExtractor.maskStringLiterals(cleaned);
        StringBuilder withoutLiterals = new StringBuilder(masked.length());
        char quote = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (quote == 0 && (c == '"' || c == '\'')) {
                quote = c;
                withoutLiterals.append(' ');
            } else if (quote != 0 && c == quote) {
                quote = 0;
                withoutLiterals.append(' ');
            } else {
                withoutLiterals.append(quote != 0 ? ' ' : c);
            }
        }
        String result = withoutLiterals.toString().trim();
        if (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static boolean startsWithWord(String text, String word) {
        return text.startsWith(word)
            && (text.length() == word.length() || !Character.isJavaIdentifierPart(text.charAt(word.length())));
    }

    private static boolean startsWithTypeWord(String text) {
        Matcher matcher = ACCESS_PATH.matcher(text);
        return matcher.lookingAt() && TYPE_WORDS.contains(matcher.group());
    }
}
