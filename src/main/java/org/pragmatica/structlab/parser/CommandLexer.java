package org.pragmatica.structlab.parser;

import org.pragmatica.structlab.syntax.SourceLocation;
import org.pragmatica.structlab.syntax.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for command text. Produces words, signed integers, double-quoted strings and
 * the punctuation {@code , : .}; whitespace separates tokens and is dropped.
 */
public final class CommandLexer {
    private static final int MAX_INPUT_SIZE = 64_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private CommandLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Tokenize command text. The returned list always ends with {@link CommandToken.Eof};
     * lexical problems are reported as {@link CommandToken.Error} tokens in place.
     */
    public static List<CommandToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Command input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new CommandLexer(input).tokenizeAll();
    }

    private List<CommandToken> tokenizeAll() {
        var tokens = new ArrayList<CommandToken>();
        while (!isAtEnd()) {
            skipWhitespace();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new CommandToken.Eof(SourceSpan.at(currentLocation())));
        return tokens;
    }

    private CommandToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isWordStart(c)) {
            return scanWord(start);
        }
        if (isDigit(c) || (c == '-' && isDigitAt(pos + 1))) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        advance();
        return switch (c) {
            case ',' -> new CommandToken.Comma(span(start));
            case ':' -> new CommandToken.Colon(span(start));
            case '.' -> new CommandToken.Dot(span(start));
            default -> new CommandToken.Error(span(start), "Unexpected character '" + c + "'");
        };
    }

    private CommandToken scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isWordPart(peek())) {
            sb.append(advance());
        }
        return new CommandToken.Word(span(start), sb.toString());
    }

    private CommandToken scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        if (peek() == '-') {
            sb.append(advance());
        }
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        return new CommandToken.Number(span(start), sb.toString());
    }

    private CommandToken scanString(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                // skip backslash
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return new CommandToken.Error(span(start), "Unterminated string");
        }
        advance();
        // skip closing quote
        return new CommandToken.StringLiteral(span(start), sb.toString());
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isDigitAt(int index) {
        return index < input.length() && isDigit(input.charAt(index));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }
}
