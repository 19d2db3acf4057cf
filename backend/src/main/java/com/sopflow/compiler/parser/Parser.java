package com.sopflow.compiler.parser;

import com.sopflow.compiler.ast.BodyItem;
import com.sopflow.compiler.ast.Branch;
import com.sopflow.compiler.ast.Conditional;
import com.sopflow.compiler.ast.Jump;
import com.sopflow.compiler.ast.NextAction;
import com.sopflow.compiler.ast.TaskDecl;
import com.sopflow.compiler.ast.TextLine;
import com.sopflow.compiler.ast.ToolCall;
import com.sopflow.compiler.ast.VariableDecl;
import com.sopflow.compiler.ast.WorkflowFile;
import com.sopflow.compiler.exception.StructuralException;
import com.sopflow.compiler.lexer.DirectiveKind;
import com.sopflow.compiler.lexer.Token;
import com.sopflow.compiler.lexer.TokenKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser from the token list to a {@link WorkflowFile}.
 * <p>
 * Top level: {@code @var}, {@code @task}, at most one {@code @lang}, an optional
 * {@code @next <task>} before the first task overriding the entry point, and free preamble
 * text before the first task. Task bodies are INDENT/DEDENT blocks.
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern VARIABLE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*(?:=\\s*(.*))?$");
    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");

    private final String sourceName;
    private final List<Token> tokens;
    private int position;

    public Parser(String sourceName, List<Token> tokens) {
        this.sourceName = sourceName;
        this.tokens = tokens;
    }

    public WorkflowFile parse() throws StructuralException {
        position = 0;

        String language = null;
        String entryPoint = null;
        boolean entryDeclared = false;
        int entryLine = 0;
        List<VariableDecl> variables = new ArrayList<>();
        List<TaskDecl> tasks = new ArrayList<>();
        List<TextLine> preamble = new ArrayList<>();

        while (!peek().is(TokenKind.EOF)) {
            Token token = advance();
            switch (token.kind()) {
                case TEXT -> {
                    if (!tasks.isEmpty()) {
                        throw new StructuralException(
                                "Text outside any task body; indent it under a @task", token.line());
                    }
                    preamble.add(new TextLine(token.text(), token.line()));
                    rejectBlock(token);
                }
                case INDENT -> throw new StructuralException("Unexpected indented block", token.line());
                case DEDENT -> throw new StructuralException("Unexpected end of block", token.line());
                case EOF -> throw new IllegalStateException("EOF consumed inside the top-level loop");
                case DIRECTIVE -> {
                    switch (token.directive()) {
                        case VAR -> {
                            variables.add(parseVariable(token));
                            rejectBlock(token);
                        }
                        case TASK -> tasks.add(parseTask(token));
                        case LANG -> {
                            if (language != null) {
                                throw new StructuralException("Duplicate @lang directive", token.line());
                            }
                            language = requireArgument(token, "@lang requires a language tag");
                            rejectBlock(token);
                        }
                        case NEXT -> {
                            if (!tasks.isEmpty()) {
                                throw new StructuralException(
                                        "@next outside a task body; only one entry override is allowed "
                                                + "before the first @task", token.line());
                            }
                            if (entryDeclared) {
                                throw new StructuralException("Duplicate entry point override", token.line());
                            }
                            entryPoint = parseTarget(token);
                            entryDeclared = true;
                            entryLine = token.line();
                            rejectBlock(token);
                        }
                        case TOOL, AGENT, IF, ELSE -> throw new StructuralException(
                                token.directive() + " must appear inside a task body", token.line());
                    }
                }
            }
        }

        if (!entryDeclared && !tasks.isEmpty()) {
            entryPoint = tasks.get(0).id();
            entryLine = tasks.get(0).line();
        }

        logger.debug("Parsed {}: {} variables, {} tasks, entry point {}",
                sourceName, variables.size(), tasks.size(), entryPoint);

        return new WorkflowFile(sourceName, language, entryPoint, entryDeclared, entryLine,
                variables, tasks, preamble);
    }

    private VariableDecl parseVariable(Token token) throws StructuralException {
        Matcher matcher = VARIABLE.matcher(token.text());
        if (!matcher.matches()) {
            throw new StructuralException("Invalid variable declaration '@var " + token.text() + "'", token.line());
        }
        return VariableDecl.declared(matcher.group(1), matcher.group(2), token.line());
    }

    private TaskDecl parseTask(Token header) throws StructuralException {
        String argument = requireArgument(header, "@task requires a task id");
        String[] parts = argument.split("\\s+", 2);
        String id = parts[0];
        if (!IDENTIFIER.matcher(id).matches()) {
            throw new StructuralException("Invalid task id '" + id + "'", header.line());
        }
        String title = parts.length > 1 ? parts[1].strip() : null;

        List<BodyItem> body = new ArrayList<>();
        if (peek().is(TokenKind.INDENT)) {
            advance();
            parseBlock(body, false);
            expectDedent();
        }
        return new TaskDecl(id, title, body, header.line());
    }

    private void parseBlock(List<BodyItem> body, boolean inBranch) throws StructuralException {
        while (!peek().is(TokenKind.DEDENT) && !peek().is(TokenKind.EOF)) {
            Token token = advance();
            switch (token.kind()) {
                case TEXT -> {
                    body.add(new TextLine(token.text(), token.line()));
                    if (peek().is(TokenKind.INDENT)) {
                        parseTextContinuation(body);
                    }
                }
                case INDENT -> throw new StructuralException("Unexpected indentation", token.line());
                case DEDENT, EOF -> throw new IllegalStateException("Block terminator consumed as an item");
                case DIRECTIVE -> body.add(parseDirectiveItem(token, inBranch));
            }
        }
    }

    private BodyItem parseDirectiveItem(Token token, boolean inBranch) throws StructuralException {
        switch (token.directive()) {
            case TOOL -> {
                ToolCall call = parseTool(token);
                rejectBlock(token);
                return call;
            }
            case AGENT -> {
                BodyItem call = AgentArgumentParser.parse(
                        requireArgument(token, "@agent requires an agent name"), token.line());
                rejectBlock(token);
                return call;
            }
            case IF -> {
                return parseConditional(token);
            }
            case NEXT -> {
                String target = parseTarget(token);
                rejectBlock(token);
                return inBranch ? new Jump(target, token.line()) : new NextAction(target, token.line());
            }
            case ELSE -> throw new StructuralException("@else without a preceding @if", token.line());
            case VAR -> throw new StructuralException(
                    "@var is only allowed at the top level; variables are global", token.line());
            case LANG -> throw new StructuralException("@lang is only allowed at the top level", token.line());
            case TASK -> throw new StructuralException(
                    "@task cannot be nested inside another task", token.line());
            default -> throw new IllegalStateException("Unhandled directive " + token.directive());
        }
    }

    private ToolCall parseTool(Token token) throws StructuralException {
        String argument = requireArgument(token, "@tool requires a tool name");
        String[] parts = argument.split("\\s+", 2);
        if (!TOOL_NAME.matcher(parts[0]).matches()) {
            throw new StructuralException("Invalid tool name '" + parts[0] + "'", token.line());
        }
        String description = parts.length > 1 ? parts[1].strip() : null;
        return new ToolCall(parts[0], description, token.line());
    }

    private Conditional parseConditional(Token ifToken) throws StructuralException {
        String condition = requireArgument(ifToken, "@if requires a condition");
        List<Branch> branches = new ArrayList<>();
        branches.add(new Branch(condition, parseBranchBody(), ifToken.line()));

        if (peek().is(DirectiveKind.ELSE)) {
            Token elseToken = advance();
            if (!elseToken.text().isEmpty()) {
                throw new StructuralException(
                        "@else takes no condition; else-if chaining is not supported", elseToken.line());
            }
            branches.add(Branch.otherwise(parseBranchBody(), elseToken.line()));

            if (peek().is(DirectiveKind.ELSE)) {
                throw new StructuralException(
                        "Duplicate @else for the @if at line " + ifToken.line(), peek().line());
            }
        }
        return new Conditional(branches, ifToken.line());
    }

    private List<BodyItem> parseBranchBody() throws StructuralException {
        List<BodyItem> body = new ArrayList<>();
        if (peek().is(TokenKind.INDENT)) {
            advance();
            parseBlock(body, true);
            expectDedent();
        }
        return body;
    }

    /**
     * Lines indented under a text line continue it; each becomes a text line of its own.
     */
    private void parseTextContinuation(List<BodyItem> body) throws StructuralException {
        advance();
        while (!peek().is(TokenKind.DEDENT) && !peek().is(TokenKind.EOF)) {
            Token token = advance();
            if (token.is(TokenKind.TEXT)) {
                body.add(new TextLine(token.text(), token.line()));
                if (peek().is(TokenKind.INDENT)) {
                    parseTextContinuation(body);
                }
            } else {
                throw new StructuralException(
                        "Only text may be indented under a text line", token.line());
            }
        }
        expectDedent();
    }

    private String parseTarget(Token token) throws StructuralException {
        String target = requireArgument(token, "@next requires a target task");
        if (!IDENTIFIER.matcher(target).matches()) {
            throw new StructuralException("Invalid @next target '" + target + "'", token.line());
        }
        return target;
    }

    private String requireArgument(Token token, String message) throws StructuralException {
        if (token.text() == null || token.text().isBlank()) {
            throw new StructuralException(message, token.line());
        }
        return token.text();
    }

    private void rejectBlock(Token owner) throws StructuralException {
        if (peek().is(TokenKind.INDENT)) {
            String what = owner.is(TokenKind.TEXT) ? "preamble text" : owner.directive().toString();
            throw new StructuralException("Unexpected indented block under " + what, peek().line());
        }
    }

    private void expectDedent() throws StructuralException {
        Token token = peek();
        if (token.is(TokenKind.DEDENT)) {
            advance();
            return;
        }
        if (!token.is(TokenKind.EOF)) {
            throw new StructuralException("Expected end of block", token.line());
        }
    }

    private Token peek() {
        return tokens.get(Math.min(position, tokens.size() - 1));
    }

    private Token advance() {
        Token token = peek();
        if (position < tokens.size() - 1) {
            position++;
        }
        return token;
    }
}
