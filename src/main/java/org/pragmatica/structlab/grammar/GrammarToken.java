package org.pragmatica.structlab.grammar;

import org.pragmatica.structlab.syntax.SourceSpan;

/**
 * Lexical unit of the grammar notation.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    /**
     * Human readable form used in error messages.
     */
    default String describe() {
        if (this instanceof Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (this instanceof Literal literal) {
            return "literal '" + literal.value() + "'";
        }
        if (this instanceof Eof) {
            return "end of input";
        }
        if (this instanceof Error error) {
            return "error (" + error.message() + ")";
        }
        return "'" + symbol() + "'";
    }

    private String symbol() {
        if (this instanceof LeftArrow) {
            return "<-";
        }
        if (this instanceof Slash) {
            return "/";
        }
        if (this instanceof Question) {
            return "?";
        }
        if (this instanceof Star) {
            return "*";
        }
        if (this instanceof Plus) {
            return "+";
        }
        return this instanceof LParen ? "(" : ")";
    }

    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    record Literal(SourceSpan span, String value) implements GrammarToken {}

    /** {@code <-} */
    record LeftArrow(SourceSpan span) implements GrammarToken {}

    record Slash(SourceSpan span) implements GrammarToken {}

    record Question(SourceSpan span) implements GrammarToken {}

    record Star(SourceSpan span) implements GrammarToken {}

    record Plus(SourceSpan span) implements GrammarToken {}

    record LParen(SourceSpan span) implements GrammarToken {}

    record RParen(SourceSpan span) implements GrammarToken {}

    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}
}
