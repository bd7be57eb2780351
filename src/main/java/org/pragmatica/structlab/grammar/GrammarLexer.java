package org.pragmatica.structlab.grammar;

import org.pragmatica.structlab.syntax.SourceLocation;
import org.pragmatica.structlab.syntax.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits grammar notation into {@link GrammarToken}s.
 *
 * <p>Recognizes rule names, quoted keywords, {@code <-}, {@code /}, suffix operators,
 * parentheses and {@code #} line comments. Lexical problems become {@link GrammarToken.Error}
 * tokens; the parser reports the first of them.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 100_000;

    private final String text;
    private int offset;
    private int line = 1;
    private int column = 1;

    private GrammarLexer(String text) {
        this.text = text;
    }

    public static List<GrammarToken> tokenize(String text) {
        if (text.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("Grammar text longer than " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(text).run();
    }

    private List<GrammarToken> run() {
        var tokens = new ArrayList<GrammarToken>();
        for (skipBlanks(); hasMore(); skipBlanks()) {
            tokens.add(token(location()));
        }
        tokens.add(new GrammarToken.Eof(SourceSpan.at(location())));
        return tokens;
    }

    private GrammarToken token(SourceLocation start) {
        var c = current();
        if (Character.isLetter(c) || c == '_') {
            var name = takeWhile(ch -> Character.isLetterOrDigit(ch) || ch == '_');
            return new GrammarToken.Identifier(spanFrom(start), name);
        }
        if (c == '\'' || c == '"') {
            return quoted(start);
        }
        consume();
        switch (c) {
            case '/':
                return new GrammarToken.Slash(spanFrom(start));
            case '?':
                return new GrammarToken.Question(spanFrom(start));
            case '*':
                return new GrammarToken.Star(spanFrom(start));
            case '+':
                return new GrammarToken.Plus(spanFrom(start));
            case '(':
                return new GrammarToken.LParen(spanFrom(start));
            case ')':
                return new GrammarToken.RParen(spanFrom(start));
            case '<':
                if (hasMore() && current() == '-') {
                    consume();
                    return new GrammarToken.LeftArrow(spanFrom(start));
                }
                return new GrammarToken.Error(spanFrom(start), "Expected '<-'");
            default:
                return new GrammarToken.Error(spanFrom(start), "Unexpected character: " + c);
        }
    }

    private GrammarToken quoted(SourceLocation start) {
        var quote = consume();
        var value = takeWhile(ch -> ch != quote && ch != '\n');
        if (!hasMore() || current() != quote) {
            return new GrammarToken.Error(spanFrom(start), "Unterminated literal");
        }
        consume();
        return value.isEmpty()
               ? new GrammarToken.Error(spanFrom(start), "Empty literal")
               : new GrammarToken.Literal(spanFrom(start), value);
    }

    private void skipBlanks() {
        while (hasMore()) {
            if (current() == '#') {
                takeWhile(ch -> ch != '\n');
            } else if (Character.isWhitespace(current())) {
                consume();
            } else {
                return;
            }
        }
    }

    private interface CharTest {
        boolean test(char c);
    }

    private String takeWhile(CharTest test) {
        var from = offset;
        while (hasMore() && test.test(current())) {
            consume();
        }
        return text.substring(from, offset);
    }

    private boolean hasMore() {
        return offset < text.length();
    }

    private char current() {
        return text.charAt(offset);
    }

    private char consume() {
        var c = text.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation location() {
        return SourceLocation.at(line, column, offset);
    }

    private SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location());
    }
}
