package com.sopflow.compiler.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the small boolean-expression subset used for constant folding:
 * <pre>
 * or      := and (("OR" | "or" | "||") and)*
 * and     := not (("AND" | "and" | "&amp;&amp;") not)*
 * not     := ("NOT" | "not" | "!") not | cmp
 * cmp     := operand (("==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=") operand)?
 * operand := "(" or ")" | number | string | true | false | identifier("." identifier)* | {{name}}
 * </pre>
 * Text outside the subset yields {@link Optional#empty()} and stays opaque.
 */
public final class ConditionParser {

    private static final List<String> SYMBOLS = List.of("==", "!=", "<=", ">=", "&&", "||", "<", ">", "!", "(", ")");

    private final List<String> tokens;
    private int position;

    private ConditionParser(List<String> tokens) {
        this.tokens = tokens;
    }

    public static Optional<ConditionNode> parse(String condition) {
        if (condition == null || condition.isBlank()) {
            return Optional.empty();
        }
        List<String> tokens = tokenize(condition);
        if (tokens == null) {
            return Optional.empty();
        }
        ConditionParser parser = new ConditionParser(tokens);
        ConditionNode node = parser.parseOr();
        if (node == null || parser.position != tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    private ConditionNode parseOr() {
        ConditionNode left = parseAnd();
        while (left != null && (accept("||") || acceptWord("or"))) {
            ConditionNode right = parseAnd();
            left = right == null ? null : new ConditionNode.Binary("||", left, right);
        }
        return left;
    }

    private ConditionNode parseAnd() {
        ConditionNode left = parseNot();
        while (left != null && (accept("&&") || acceptWord("and"))) {
            ConditionNode right = parseNot();
            left = right == null ? null : new ConditionNode.Binary("&&", left, right);
        }
        return left;
    }

    private ConditionNode parseNot() {
        if (accept("!") || acceptWord("not")) {
            ConditionNode operand = parseNot();
            return operand == null ? null : new ConditionNode.Not(operand);
        }
        return parseComparison();
    }

    private ConditionNode parseComparison() {
        ConditionNode left = parseOperand();
        if (left == null) {
            return null;
        }
        for (String operator : List.of("==", "!=", "<=", ">=", "<", ">")) {
            if (accept(operator)) {
                ConditionNode right = parseOperand();
                return right == null ? null : new ConditionNode.Binary(operator, left, right);
            }
        }
        return left;
    }

    private ConditionNode parseOperand() {
        if (position >= tokens.size()) {
            return null;
        }
        if (accept("(")) {
            ConditionNode inner = parseOr();
            return inner != null && accept(")") ? inner : null;
        }

        String token = tokens.get(position);
        if (SYMBOLS.contains(token) || isKeyword(token)) {
            return null;
        }
        position++;

        char first = token.charAt(0);
        if (first == '"' || first == '\'') {
            return new ConditionNode.Constant(token.substring(1, token.length() - 1));
        }
        if (token.startsWith("{{")) {
            return new ConditionNode.Placeholder(token.substring(2, token.length() - 2).strip());
        }
        if (first == '-' || first == '+' || first == '.' || Character.isDigit(first)) {
            return number(token);
        }
        String lower = token.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return new ConditionNode.Constant(Boolean.parseBoolean(lower));
        }
        return token.matches("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*")
                ? new ConditionNode.Identifier(token)
                : null;
    }

    private static ConditionNode number(String token) {
        if (token.matches("[+-]?\\d+")) {
            try {
                return new ConditionNode.Constant(Long.parseLong(token));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (token.matches("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+(?=[eE]))([eE][+-]?\\d+)?")) {
            return new ConditionNode.Constant(Double.parseDouble(token));
        }
        return null;
    }

    private boolean accept(String symbol) {
        if (position < tokens.size() && tokens.get(position).equals(symbol)) {
            position++;
            return true;
        }
        return false;
    }

    private boolean acceptWord(String keyword) {
        if (position < tokens.size() && isWord(tokens.get(position), keyword)) {
            position++;
            return true;
        }
        return false;
    }

    private static boolean isWord(String token, String keyword) {
        return token.equals(keyword) || token.equals(keyword.toUpperCase(Locale.ROOT));
    }

    private static boolean isKeyword(String token) {
        return isWord(token, "and") || isWord(token, "or") || isWord(token, "not");
    }

    /**
     * Splits into symbols, quoted strings, placeholders and words; {@code null} on a stray
     * character or an unterminated quote or placeholder.
     */
    private static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '"' || c == '\'') {
                int end = text.indexOf(c, i + 1);
                if (end < 0) {
                    return null;
                }
                tokens.add(text.substring(i, end + 1));
                i = end + 1;
                continue;
            }
            if (text.startsWith("{{", i)) {
                int end = text.indexOf("}}", i + 2);
                if (end < 0) {
                    return null;
                }
                tokens.add(text.substring(i, end + 2));
                i = end + 2;
                continue;
            }
            String symbol = symbolAt(text, i);
            if (symbol != null) {
                tokens.add(symbol);
                i += symbol.length();
                continue;
            }
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '+') {
                int start = i;
                while (i < text.length() && isWordChar(text, i, start)) {
                    i++;
                }
                tokens.add(text.substring(start, i));
                continue;
            }
            return null;
        }
        return tokens;
    }

    private static boolean isWordChar(String text, int i, int start) {
        char c = text.charAt(i);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
            return true;
        }
        if (c == '-' || c == '+') {
            // sign at the start of a number or after an exponent marker
            return i == start || (i > start && (text.charAt(i - 1) == 'e' || text.charAt(i - 1) == 'E')
                    && Character.isDigit(text.charAt(start)));
        }
        return false;
    }

    private static String symbolAt(String text, int i) {
        for (String symbol : SYMBOLS) {
            if (text.startsWith(symbol, i)) {
                return symbol;
            }
        }
        return null;
    }
}
