package org.pragmatica.structlab.grammar;

import org.pragmatica.structlab.error.ParseError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.syntax.SourceLocation;
import org.pragmatica.structlab.syntax.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads command grammar notation and produces a validated {@link Grammar}.
 *
 * <pre>
 * Create   &lt;- 'create' Type ('with' Values)?
 * Values   &lt;- Value (',' Value)*
 * Value    &lt;- NUMBER
 * </pre>
 *
 * Upper-case names of {@link TokenKind} constants match a token class, other names refer to rules.
 */
public final class GrammarParser {
    private final List<GrammarToken> tokens;
    private int pos;

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
    }

    public static Result<Grammar> parse(String grammarText) {
        var tokens = GrammarLexer.tokenize(grammarText);
        var lexError = tokens.stream()
                             .filter(GrammarToken.Error.class::isInstance)
                             .map(GrammarToken.Error.class::cast)
                             .findFirst();
        if (lexError.isPresent()) {
            var error = lexError.get();
            return Result.failure(new ParseError.SemanticError(error.span()
                                                                    .start(),
                                                               error.message()));
        }
        return new GrammarParser(tokens).rules()
                                        .flatMap(Grammar::validate);
    }

    private Result<Grammar> rules() {
        var rules = new ArrayList<Rule>();
        while (!(peek() instanceof GrammarToken.Eof)) {
            if (!(peek() instanceof GrammarToken.Identifier)) {
                return unexpected("rule definition");
            }
            var rule = rule();
            if (rule.isFailure()) {
                return rule.fold(Result::failure, unused -> null);
            }
            rules.add(rule.unwrap());
        }
        return Result.success(new Grammar(List.copyOf(rules)));
    }

    private Result<Rule> rule() {
        var start = here();
        var name = ((GrammarToken.Identifier) next()).name();
        if (!accept(GrammarToken.LeftArrow.class)) {
            return unexpected("'<-'");
        }
        return choice().map(body -> new Rule(spanFrom(start), name, body));
    }

    private Result<Expression> choice() {
        var start = here();
        var alternatives = new ArrayList<Expression>();
        do {
            var alternative = sequence();
            if (alternative.isFailure()) {
                return alternative;
            }
            alternatives.add(alternative.unwrap());
        } while (accept(GrammarToken.Slash.class));

        return alternatives.size() == 1
               ? Result.success(alternatives.get(0))
               : Result.success(new Expression.Choice(spanFrom(start), List.copyOf(alternatives)));
    }

    private Result<Expression> sequence() {
        var start = here();
        var elements = new ArrayList<Expression>();
        while (startsElement()) {
            var element = suffixed();
            if (element.isFailure()) {
                return element;
            }
            elements.add(element.unwrap());
        }
        if (elements.isEmpty()) {
            return unexpected("expression");
        }
        return elements.size() == 1
               ? Result.success(elements.get(0))
               : Result.success(new Expression.Sequence(spanFrom(start), List.copyOf(elements)));
    }

    // An identifier directly followed by '<-' opens the next rule.
    private boolean startsElement() {
        var token = peek();
        if (token instanceof GrammarToken.Identifier) {
            return pos + 1 >= tokens.size() || !(tokens.get(pos + 1) instanceof GrammarToken.LeftArrow);
        }
        return token instanceof GrammarToken.Literal || token instanceof GrammarToken.LParen;
    }

    private Result<Expression> suffixed() {
        var start = here();
        return primary().map(primary -> {
            var expr = primary;
            while (true) {
                if (accept(GrammarToken.Star.class)) {
                    expr = new Expression.ZeroOrMore(spanFrom(start), expr);
                } else if (accept(GrammarToken.Plus.class)) {
                    expr = new Expression.OneOrMore(spanFrom(start), expr);
                } else if (accept(GrammarToken.Question.class)) {
                    expr = new Expression.Optional(spanFrom(start), expr);
                } else {
                    return expr;
                }
            }
        });
    }

    private Result<Expression> primary() {
        var start = here();
        var token = peek();
        if (token instanceof GrammarToken.Identifier id) {
            next();
            var span = spanFrom(start);
            return Result.success(TokenKind.byName(id.name())
                                           .<Expression>map(kind -> new Expression.TokenClass(span, kind))
                                           .orElseGet(() -> new Expression.Reference(span, id.name())));
        }
        if (token instanceof GrammarToken.Literal literal) {
            next();
            return Result.success(new Expression.Literal(spanFrom(start), literal.value()));
        }
        if (!accept(GrammarToken.LParen.class)) {
            return unexpected("expression");
        }
        return choice().flatMap(inner -> accept(GrammarToken.RParen.class)
                                         ? Result.success(new Expression.Group(spanFrom(start), inner))
                                         : unexpected("')'"));
    }

    private <T> Result<T> unexpected(String expected) {
        return Result.failure(new ParseError.UnexpectedInput(here(), peek().describe(), expected));
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private GrammarToken next() {
        var token = peek();
        if (!(token instanceof GrammarToken.Eof)) {
            pos++;
        }
        return token;
    }

    private boolean accept(Class<? extends GrammarToken> type) {
        if (type.isInstance(peek())) {
            next();
            return true;
        }
        return false;
    }

    private SourceLocation here() {
        return peek().span()
                     .start();
    }

    private SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, here());
    }
}
