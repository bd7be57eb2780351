package org.pragmatica.structlab.grammar;

import org.pragmatica.structlab.syntax.SourceSpan;

import java.util.List;

/**
 * Right-hand side of a grammar rule. Terminals match whole command tokens, never single characters.
 */
public sealed interface Expression {
    SourceSpan span();

    /**
     * Keyword or punctuation such as {@code 'create'} or {@code ','}, compared case-insensitively.
     */
    record Literal(SourceSpan span, String text) implements Expression {}

    /**
     * Any token of one lexical class.
     */
    record TokenClass(SourceSpan span, TokenKind kind) implements Expression {}

    record Reference(SourceSpan span, String ruleName) implements Expression {}

    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {}

    /**
     * First matching alternative wins; later ones are tried only after backtracking.
     */
    record Choice(SourceSpan span, List<Expression> alternatives) implements Expression {}

    record ZeroOrMore(SourceSpan span, Expression expression) implements Expression {}

    record OneOrMore(SourceSpan span, Expression expression) implements Expression {}

    record Optional(SourceSpan span, Expression expression) implements Expression {}

    /** Parenthesized sub-expression. */
    record Group(SourceSpan span, Expression expression) implements Expression {}
}
