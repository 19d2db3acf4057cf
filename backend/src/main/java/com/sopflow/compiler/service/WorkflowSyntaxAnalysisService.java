package com.sopflow.compiler.service;

import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.Terminal;
import com.sopflow.compiler.ast.VariableDecl;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.config.SopCompilerProperties;
import com.sopflow.compiler.dto.SyntaxAnalysisRequest;
import com.sopflow.compiler.dto.SyntaxAnalysisResponse;
import com.sopflow.compiler.dto.SyntaxToken;
import com.sopflow.compiler.dto.SyntaxToken.TokenType;
import com.sopflow.compiler.exception.CompilationException;
import com.sopflow.compiler.exception.SemanticException;
import com.sopflow.compiler.lexer.DirectiveKind;
import com.sopflow.compiler.lexer.Lexer;
import com.sopflow.compiler.lexer.SourceNormalizer;
import com.sopflow.compiler.parser.Parser;
import com.sopflow.compiler.semantic.LiteralInference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Editor highlighting. A line-based static pass classifies every range; when the source lexes
 * and parses, declared variables and tasks enrich the tokens with semantic info and undeclared
 * references are marked as errors.
 */
@Service
public class WorkflowSyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowSyntaxAnalysisService.class);

    private static final Pattern DIRECTIVE_PATTERN = Pattern.compile("^@([A-Za-z][A-Za-z0-9_]*)");
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]*?)\\s*\\}\\}");
    private static final Pattern WORD_PATTERN = Pattern.compile("\\S+");
    private static final Pattern STRING_PATTERN = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("(?<![\\w.])[+-]?\\d+(?:\\.\\d+)?(?![\\w.])");
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Pattern OPERATOR_PATTERN = Pattern.compile("==|!=|<=|>=|&&|\\|\\||[<>!()=,]");
    private static final Pattern AGENT_KEY_PATTERN = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*=");

    private final SopCompilerProperties properties;

    public WorkflowSyntaxAnalysisService(SopCompilerProperties properties) {
        this.properties = properties;
    }

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();

        try {
            String source = new SourceNormalizer(properties.tabWidth()).normalize(request.sourceCode());
            List<SyntaxToken> tokens = performStaticLexicalAnalysis(source);
            logger.debug("Static analysis produced {} tokens", tokens.size());

            WorkflowFile file;
            try {
                file = new Parser("editor", new Lexer("editor").tokenize(source)).parse();
            } catch (CompilationException e) {
                logger.debug("Source does not parse, using static tokens only: {}", e.getMessage());
                return SyntaxAnalysisResponse.withError(markErrorLine(tokens, e.getLine()), e.getMessage(),
                        e.getLine(), System.currentTimeMillis() - startTime);
            }

            List<SyntaxToken> enhanced = enhanceTokensWithSemanticInfo(tokens, file);
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Syntax analysis completed in {}ms with {} tokens", analysisTime, enhanced.size());
            return SyntaxAnalysisResponse.success(enhanced, analysisTime);

        } catch (RuntimeException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Syntax analysis failed", e);
            return SyntaxAnalysisResponse.error("Syntax analysis failed: " + e.getMessage(), analysisTime);
        }
    }

    List<SyntaxToken> performStaticLexicalAnalysis(String source) {
        List<SyntaxToken> tokens = new ArrayList<>();
        String[] lines = source.split("\n", -1);
        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            analyzeLine(lines[lineNum], lineNum, tokens);
        }
        return tokens;
    }

    private void analyzeLine(String line, int lineNum, List<SyntaxToken> tokens) {
        int start = 0;
        while (start < line.length() && line.charAt(start) == ' ') {
            start++;
        }
        if (start == line.length()) {
            return;
        }
        String content = line.substring(start);

        if (content.charAt(0) == '#') {
            tokens.add(token(lineNum, start, line.length(), TokenType.COMMENT, content));
            return;
        }

        Matcher directive = DIRECTIVE_PATTERN.matcher(content);
        if (!directive.find()) {
            addTextTokens(line, lineNum, start, line.length(), tokens);
            return;
        }

        int keywordEnd = start + directive.end();
        Optional<DirectiveKind> kind = DirectiveKind.fromKeyword(directive.group(1));
        if (kind.isEmpty()) {
            tokens.add(token(lineNum, start, keywordEnd, TokenType.ERROR, directive.group()));
            return;
        }
        tokens.add(token(lineNum, start, keywordEnd, TokenType.DIRECTIVE, directive.group()));

        switch (kind.get()) {
            case VAR -> analyzeVariable(line, lineNum, keywordEnd, tokens);
            case TASK -> analyzeNameAndRest(line, lineNum, keywordEnd, TokenType.TASK_ID, TokenType.TASK_TITLE, tokens);
            case TOOL -> analyzeNameAndRest(line, lineNum, keywordEnd, TokenType.TOOL_NAME, TokenType.TEXT, tokens);
            case AGENT -> analyzeAgent(line, lineNum, keywordEnd, tokens);
            case IF -> analyzeExpression(line, lineNum, keywordEnd, line.length(), true, tokens);
            case NEXT -> analyzeNameAndRest(line, lineNum, keywordEnd, TokenType.TASK_ID, TokenType.ERROR, tokens);
            case LANG -> analyzeNameAndRest(line, lineNum, keywordEnd, TokenType.STRING_LITERAL, TokenType.ERROR, tokens);
            case ELSE -> {
                // no argument
            }
        }
    }

    private void analyzeVariable(String line, int lineNum, int from, List<SyntaxToken> tokens) {
        Matcher name = WORD_PATTERN.matcher(line);
        if (!name.find(from)) {
            return;
        }
        int nameEnd = name.end();
        int equals = line.indexOf('=', name.start());
        if (equals >= 0) {
            nameEnd = Math.min(nameEnd, equals);
        }
        tokens.add(token(lineNum, name.start(), nameEnd, TokenType.VARIABLE, line.substring(name.start(), nameEnd)));
        if (equals < 0) {
            return;
        }
        tokens.add(token(lineNum, equals, equals + 1, TokenType.OPERATOR, "="));

        int valueStart = equals + 1;
        while (valueStart < line.length() && line.charAt(valueStart) == ' ') {
            valueStart++;
        }
        if (valueStart < line.length()) {
            String value = line.substring(valueStart);
            tokens.add(token(lineNum, valueStart, line.length(), literalType(value), value));
        }
    }

    private void analyzeNameAndRest(String line, int lineNum, int from, TokenType nameType, TokenType restType,
                                    List<SyntaxToken> tokens) {
        Matcher name = WORD_PATTERN.matcher(line);
        if (!name.find(from)) {
            return;
        }
        tokens.add(token(lineNum, name.start(), name.end(), nameType, name.group()));

        Matcher rest = WORD_PATTERN.matcher(line);
        if (rest.find(name.end())) {
            if (restType == TokenType.TEXT) {
                addTextTokens(line, lineNum, rest.start(), line.length(), tokens);
            } else {
                tokens.add(token(lineNum, rest.start(), line.length(), restType, line.substring(rest.start())));
            }
        }
    }

    private void analyzeAgent(String line, int lineNum, int from, List<SyntaxToken> tokens) {
        Matcher name = IDENTIFIER_PATTERN.matcher(line);
        if (!name.find(from)) {
            return;
        }
        tokens.add(token(lineNum, name.start(), name.end(), TokenType.AGENT_NAME, name.group()));

        int open = line.indexOf('(', name.end());
        if (open < 0) {
            return;
        }
        Matcher key = AGENT_KEY_PATTERN.matcher(line);
        int searchFrom = open + 1;
        while (key.find(searchFrom)) {
            tokens.add(token(lineNum, key.start(1), key.end(1), TokenType.PARAMETER, key.group(1)));
            searchFrom = key.end();
        }
        analyzeExpression(line, lineNum, open, line.length(), false, tokens);
    }

    /**
     * Placeholders, literals, identifiers and operators of a condition or an agent argument list.
     * Agent keys are tokenized by the caller, so identifiers are skipped there.
     */
    private void analyzeExpression(String line, int lineNum, int from, int to, boolean identifiers,
                                   List<SyntaxToken> tokens) {
        String segment = line.substring(0, to);
        List<int[]> taken = new ArrayList<>();

        Matcher placeholder = PLACEHOLDER_PATTERN.matcher(segment);
        placeholder.region(from, to);
        while (placeholder.find()) {
            taken.add(new int[] { placeholder.start(), placeholder.end() });
            tokens.add(token(lineNum, placeholder.start(), placeholder.end(), TokenType.PLACEHOLDER, placeholder.group()));
        }

        Matcher string = STRING_PATTERN.matcher(segment);
        string.region(from, to);
        while (string.find()) {
            if (!isTaken(string.start(), taken)) {
                taken.add(new int[] { string.start(), string.end() });
                tokens.add(token(lineNum, string.start(), string.end(), TokenType.STRING_LITERAL, string.group()));
            }
        }

        Matcher number = NUMBER_PATTERN.matcher(segment);
        number.region(from, to);
        while (number.find()) {
            if (!isTaken(number.start(), taken)) {
                tokens.add(token(lineNum, number.start(), number.end(), TokenType.NUMBER_LITERAL, number.group()));
            }
        }

        Matcher identifier = IDENTIFIER_PATTERN.matcher(segment);
        identifier.region(from, to);
        while (identifiers && identifier.find()) {
            if (isTaken(identifier.start(), taken)
                    || (identifier.start() > 0 && Character.isDigit(segment.charAt(identifier.start() - 1)))) {
                continue;
            }
            tokens.add(token(lineNum, identifier.start(), identifier.end(), classifyIdentifier(identifier.group()),
                    identifier.group()));
        }

        Matcher operator = OPERATOR_PATTERN.matcher(segment);
        operator.region(from, to);
        while (operator.find()) {
            if (!isTaken(operator.start(), taken)) {
                tokens.add(token(lineNum, operator.start(), operator.end(), TokenType.OPERATOR, operator.group()));
            }
        }
    }

    private void addTextTokens(String line, int lineNum, int from, int to, List<SyntaxToken> tokens) {
        tokens.add(token(lineNum, from, to, TokenType.TEXT, line.substring(from, to)));
        Matcher placeholder = PLACEHOLDER_PATTERN.matcher(line);
        placeholder.region(from, to);
        while (placeholder.find()) {
            tokens.add(token(lineNum, placeholder.start(), placeholder.end(), TokenType.PLACEHOLDER, placeholder.group()));
        }
    }

    private TokenType classifyIdentifier(String identifier) {
        return switch (identifier) {
            case "true", "false", "TRUE", "FALSE", "True", "False" -> TokenType.BOOLEAN_LITERAL;
            case "and", "or", "not", "AND", "OR", "NOT" -> TokenType.OPERATOR;
            default -> TokenType.PREDICATE;
        };
    }

    private static TokenType literalType(String value) {
        String trimmed = value.strip();
        if (STRING_PATTERN.matcher(trimmed).matches()) {
            return TokenType.STRING_LITERAL;
        }
        if (trimmed.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
            return TokenType.NUMBER_LITERAL;
        }
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
            return TokenType.BOOLEAN_LITERAL;
        }
        return TokenType.TEXT;
    }

    private List<SyntaxToken> enhanceTokensWithSemanticInfo(List<SyntaxToken> tokens, WorkflowFile file) {
        Map<String, String> variables = new HashMap<>();
        for (VariableDecl variable : file.variables()) {
            variables.put(variable.name(), describe(variable));
        }
        Map<String, String> tasks = new HashMap<>();
        for (TaskDecl task : file.tasks()) {
            tasks.put(task.id(), "task at line " + task.line() + (task.title() != null ? ": " + task.title() : ""));
        }

        List<SyntaxToken> enhanced = new ArrayList<>(tokens.size());
        for (SyntaxToken token : tokens) {
            TokenType type = TokenType.valueOf(token.tokenType());
            enhanced.add(switch (type) {
                case VARIABLE, PREDICATE -> variables.containsKey(token.value())
                        ? new SyntaxToken(token.startLine(), token.startColumn(), token.endLine(), token.endColumn(),
                                TokenType.VARIABLE.name(), token.value(), variables.get(token.value()))
                        : token;
                case PLACEHOLDER -> {
                    String name = token.value().substring(2, token.value().length() - 2).strip();
                    yield variables.containsKey(name)
                            ? token.withSemanticInfo(variables.get(name))
                            : retype(token, TokenType.ERROR, "undeclared variable '" + name + "'");
                }
                case TASK_ID -> {
                    if (tasks.containsKey(token.value())) {
                        yield token.withSemanticInfo(tasks.get(token.value()));
                    }
                    yield Terminal.is(token.value())
                            ? token.withSemanticInfo("terminal")
                            : retype(token, TokenType.ERROR, "undeclared task '" + token.value() + "'");
                }
                default -> token;
            });
        }
        return enhanced;
    }

    private static String describe(VariableDecl variable) {
        try {
            VariableDecl typed = LiteralInference.annotate(variable);
            return typed.type().label() + " = " + typed.rawValue().strip();
        } catch (SemanticException e) {
            return "invalid literal: " + e.getMessage();
        }
    }

    private static List<SyntaxToken> markErrorLine(List<SyntaxToken> tokens, int errorLine) {
        if (errorLine <= 0) {
            return tokens;
        }
        List<SyntaxToken> marked = new ArrayList<>(tokens);
        for (int i = 0; i < marked.size(); i++) {
            if (marked.get(i).startLine() == errorLine - 1) {
                marked.set(i, retype(marked.get(i), TokenType.ERROR, "error on this line"));
                break;
            }
        }
        return marked;
    }

    private static SyntaxToken retype(SyntaxToken token, TokenType type, String info) {
        return new SyntaxToken(token.startLine(), token.startColumn(), token.endLine(), token.endColumn(),
                type.name(), token.value(), info);
    }

    private static boolean isTaken(int position, List<int[]> ranges) {
        return ranges.stream().anyMatch(range -> position >= range[0] && position < range[1]);
    }

    private static SyntaxToken token(int lineNum, int start, int end, TokenType type, String value) {
        return new SyntaxToken(lineNum, start, lineNum, end, type.name(), value, null);
    }
}
