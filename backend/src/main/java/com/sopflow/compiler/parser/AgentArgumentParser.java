package com.sopflow.compiler.parser;

import com.sopflow.compiler.ast.AgentCall;
import com.sopflow.compiler.ast.AgentParameter;
import com.sopflow.compiler.exception.StructuralException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the argument of {@code @agent Name(key=value, ...)}. Values are kept as raw text;
 * commas inside quotes or nested brackets do not split parameters.
 */
final class AgentArgumentParser {

    private static final Pattern AGENT_NAME = Pattern.compile("^([A-Za-z_][A-Za-z0-9_.\\-]*)");
    private static final Pattern PARAMETER_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private AgentArgumentParser() {
    }

    static AgentCall parse(String argument, int line) throws StructuralException {
        Matcher nameMatcher = AGENT_NAME.matcher(argument);
        if (!nameMatcher.find()) {
            throw new StructuralException("@agent requires an agent name", line);
        }

        String name = nameMatcher.group(1);
        String rest = argument.substring(nameMatcher.end()).strip();
        if (rest.isEmpty()) {
            return new AgentCall(name, List.of(), line);
        }
        if (rest.charAt(0) != '(') {
            throw new StructuralException("Malformed agent call '" + argument + "': expected '(' after " + name, line);
        }

        int close = findClosingParenthesis(rest, line);
        if (close != rest.length() - 1) {
            throw new StructuralException(
                    "Malformed agent call '" + argument + "': unexpected text after ')'", line);
        }

        String inner = rest.substring(1, close);
        return new AgentCall(name, parseParameters(inner, line), line);
    }

    private static int findClosingParenthesis(String text, int line) throws StructuralException {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> {
                    depth--;
                    if (depth == 0) {
                        if (c != ')') {
                            throw new StructuralException("Unbalanced brackets in agent arguments", line);
                        }
                        return i;
                    }
                    if (depth < 0) {
                        throw new StructuralException("Unbalanced brackets in agent arguments", line);
                    }
                }
                default -> {
                }
            }
        }
        if (quote != 0) {
            throw new StructuralException("Unterminated quote in agent arguments", line);
        }
        throw new StructuralException("Missing ')' in agent arguments", line);
    }

    private static List<AgentParameter> parseParameters(String inner, int line) throws StructuralException {
        List<AgentParameter> parameters = new ArrayList<>();
        if (inner.isBlank()) {
            return parameters;
        }

        for (String piece : splitTopLevel(inner, ',')) {
            String trimmed = piece.strip();
            if (trimmed.isEmpty()) {
                throw new StructuralException("Empty parameter in agent arguments", line);
            }

            List<String> keyAndValue = splitTopLevel(trimmed, '=');
            if (keyAndValue.size() < 2) {
                throw new StructuralException("Agent parameter '" + trimmed + "' is missing '='", line);
            }

            String key = keyAndValue.get(0).strip();
            if (!PARAMETER_KEY.matcher(key).matches()) {
                throw new StructuralException("Invalid agent parameter name '" + key + "'", line);
            }

            String value = trimmed.substring(trimmed.indexOf('=') + 1).strip();
            parameters.add(new AgentParameter(key, value));
        }
        return parameters;
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> pieces = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                pieces.add(text.substring(start, i));
                start = i + 1;
                if (separator == '=') {
                    break;
                }
            }
        }
        pieces.add(text.substring(start));
        return pieces;
    }
}
