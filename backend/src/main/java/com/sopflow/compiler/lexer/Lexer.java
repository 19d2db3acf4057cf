package com.sopflow.compiler.lexer;

import com.sopflow.compiler.exception.LexicalException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Turns normalized source text into an indentation-aware token list.
 * <p>
 * Each non-blank, non-comment line yields one DIRECTIVE or TEXT token, preceded by the
 * INDENT/DEDENT tokens implied by its indentation width. Blank and comment lines never
 * change the indentation state. {@code {{name}}} spans stay inside the text.
 */
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private static final char COMMENT = '#';

    private final String sourceName;

    public Lexer(String sourceName) {
        this.sourceName = sourceName;
    }

    public List<Token> tokenize(String source) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        Deque<Integer> widths = new ArrayDeque<>();
        widths.push(0);

        String[] lines = source.split("\n", -1);
        int lastLine = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNum = i + 1;

            if (line.isBlank()) {
                continue;
            }

            int width = indentationWidth(line, lineNum);
            String content = line.substring(width).stripTrailing();
            if (content.charAt(0) == COMMENT) {
                continue;
            }

            adjustIndentation(width, lineNum, widths, tokens);
            int depth = widths.size() - 1;

            if (isDirective(content)) {
                tokens.add(readDirective(content, lineNum, depth));
            } else {
                tokens.add(Token.text(content, lineNum, depth));
            }
            lastLine = lineNum;
        }

        while (widths.size() > 1) {
            widths.pop();
            tokens.add(Token.dedent(lastLine, widths.size() - 1));
        }
        tokens.add(Token.eof(lastLine + 1));

        logger.debug("Lexed {} into {} tokens", sourceName, tokens.size());
        return Collections.unmodifiableList(tokens);
    }

    private int indentationWidth(String line, int lineNum) throws LexicalException {
        int width = 0;
        while (width < line.length() && line.charAt(width) == ' ') {
            width++;
        }
        if (width < line.length() && line.charAt(width) == '\t') {
            throw new LexicalException("Tab character in indentation", lineNum);
        }
        return width;
    }

    private void adjustIndentation(int width, int lineNum, Deque<Integer> widths, List<Token> tokens)
            throws LexicalException {
        if (width > widths.peek()) {
            widths.push(width);
            tokens.add(Token.indent(lineNum, widths.size() - 1));
            return;
        }

        while (width < widths.peek()) {
            widths.pop();
            tokens.add(Token.dedent(lineNum, widths.size() - 1));
        }

        if (width != widths.peek()) {
            throw new LexicalException(
                    "Indentation of " + width + " spaces does not match any enclosing block", lineNum);
        }
    }

    private static boolean isDirective(String content) {
        return content.length() > 1
                && content.charAt(0) == DirectiveKind.SIGIL
                && Character.isLetter(content.charAt(1));
    }

    private Token readDirective(String content, int lineNum, int depth) throws LexicalException {
        int end = 1;
        while (end < content.length() && isKeywordChar(content.charAt(end))) {
            end++;
        }

        String keyword = content.substring(1, end);
        Optional<DirectiveKind> kind = DirectiveKind.fromKeyword(keyword);
        if (kind.isEmpty()) {
            throw new LexicalException("Unknown directive '" + DirectiveKind.SIGIL + keyword + "'", lineNum);
        }

        String rest = content.substring(end);
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0))) {
            throw new LexicalException(
                    "Malformed directive '" + content + "': expected whitespace after " + kind.get(), lineNum);
        }

        return Token.directive(kind.get(), rest.strip(), lineNum, depth);
    }

    private static boolean isKeywordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
