package org.pragmatica.structlab.parser;

import org.pragmatica.structlab.error.ParseError;
import org.pragmatica.structlab.grammar.Expression;
import org.pragmatica.structlab.grammar.Grammar;
import org.pragmatica.structlab.grammar.Rule;
import org.pragmatica.structlab.grammar.TokenKind;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.syntax.SourceSpan;
import org.pragmatica.structlab.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Grammar interpreter working on command tokens.
 *
 * <p>Ordered choice with full backtracking; every rule reference becomes a
 * {@link SyntaxNode.NonTerminal} named after the rule, every matched terminal a
 * {@link SyntaxNode.Terminal}. On failure the farthest position reached is reported together
 * with everything that would have been accepted there.
 */
public final class TokenEngine implements Parser {
    private static final int FAIL = -1;

    private final Grammar grammar;
    private final Map<String, Rule> rules;

    private TokenEngine(Grammar grammar) {
        this.grammar = grammar;
        this.rules = grammar.ruleMap();
    }

    /**
     * Create an engine for an already validated grammar.
     */
    public static Result<Parser> create(Grammar grammar) {
        return grammar.validate()
                      .map(validated -> (Parser) new TokenEngine(validated));
    }

    @Override
    public Result<SyntaxNode> parse(String input) {
        return parse(CommandLexer.tokenize(input));
    }

    @Override
    public Result<SyntaxNode> parse(String input, String startRule) {
        return parse(CommandLexer.tokenize(input), startRule);
    }

    @Override
    public Result<SyntaxNode> parse(List<CommandToken> tokens) {
        return parse(tokens, grammar.startRule()
                                    .map(Rule::name)
                                    .orElseThrow());
    }

    private Result<SyntaxNode> parse(List<CommandToken> tokens, String startRule) {
        for (var token : tokens) {
            if (token instanceof CommandToken.Error error) {
                return Result.failure(new ParseError.SemanticError(error.span()
                                                                        .start(),
                                                                   error.message()));
            }
        }
        if (!rules.containsKey(startRule)) {
            return Result.failure(new ParseError.SemanticError(tokens.get(0)
                                                                     .span()
                                                                     .start(),
                                                               "Unknown start rule: '" + startRule + "'"));
        }
        return new Run(tokens).parse(startRule);
    }

    /**
     * State of a single parse: token list and farthest failure.
     */
    private final class Run {
        private final List<CommandToken> tokens;
        private final Set<String> expected = new LinkedHashSet<>();
        private int farthest = -1;

        private Run(List<CommandToken> tokens) {
            this.tokens = tokens;
        }

        private Result<SyntaxNode> parse(String startRule) {
            var nodes = new ArrayList<SyntaxNode>();
            var end = match(new Expression.Reference(SourceSpan.at(tokens.get(0)
                                                                         .span()
                                                                         .start()),
                                                     startRule),
                            0,
                            nodes);
            if (end != FAIL && tokens.get(end) instanceof CommandToken.Eof) {
                return Result.success(nodes.get(0));
            }
            if (end != FAIL) {
                expect(end, "end of input");
            }
            return Result.failure(failure());
        }

        private ParseError failure() {
            var token = tokens.get(farthest);
            var location = token.span()
                                .start();
            var description = String.join(" or ", expected);
            if (token instanceof CommandToken.Eof) {
                return new ParseError.UnexpectedEof(location, description);
            }
            return new ParseError.UnexpectedInput(location, describe(token), description);
        }

        private int match(Expression expr, int pos, List<SyntaxNode> out) {
            if (expr instanceof Expression.Literal literal) {
                return matchLiteral(literal, pos, out);
            }
            if (expr instanceof Expression.TokenClass tokenClass) {
                return matchTokenClass(tokenClass.kind(), pos, out);
            }
            if (expr instanceof Expression.Reference ref) {
                return matchReference(ref.ruleName(), pos, out);
            }
            if (expr instanceof Expression.Sequence seq) {
                return matchSequence(seq.elements(), pos, out);
            }
            if (expr instanceof Expression.Choice choice) {
                return matchChoice(choice.alternatives(), pos, out);
            }
            if (expr instanceof Expression.ZeroOrMore zom) {
                return matchRepeated(zom.expression(), pos, out);
            }
            if (expr instanceof Expression.OneOrMore oom) {
                var first = match(oom.expression(), pos, out);
                return first == FAIL
                       ? FAIL
                       : matchRepeated(oom.expression(), first, out);
            }
            if (expr instanceof Expression.Optional opt) {
                var mark = out.size();
                var end = match(opt.expression(), pos, out);
                if (end == FAIL) {
                    truncate(out, mark);
                    return pos;
                }
                return end;
            }
            if (expr instanceof Expression.Group group) {
                return match(group.expression(), pos, out);
            }
            throw new IllegalStateException("Unsupported expression: " + expr);
        }

        private int matchLiteral(Expression.Literal literal, int pos, List<SyntaxNode> out) {
            var token = tokens.get(pos);
            var matches = (token instanceof CommandToken.Word
                           || token instanceof CommandToken.Comma
                           || token instanceof CommandToken.Colon
                           || token instanceof CommandToken.Dot)
                          && token.text()
                                  .equalsIgnoreCase(literal.text());
            if (!matches) {
                return expect(pos, "'" + literal.text() + "'");
            }
            out.add(new SyntaxNode.Terminal(token.span(),
                                            "'" + literal.text() + "'",
                                            token.text()));
            return pos + 1;
        }

        private int matchTokenClass(TokenKind kind, int pos, List<SyntaxNode> out) {
            var token = tokens.get(pos);
            if (!isOfKind(token, kind)) {
                return expect(pos, kind.name()
                                       .toLowerCase());
            }
            out.add(new SyntaxNode.Terminal(token.span(), kind.name(), token.text()));
            return pos + 1;
        }

        private int matchReference(String ruleName, int pos, List<SyntaxNode> out) {
            var children = new ArrayList<SyntaxNode>();
            var end = match(rules.get(ruleName)
                                 .expression(),
                            pos,
                            children);
            if (end == FAIL) {
                return FAIL;
            }
            out.add(new SyntaxNode.NonTerminal(spanOf(pos, end), ruleName, List.copyOf(children)));
            return end;
        }

        private int matchSequence(List<Expression> elements, int pos, List<SyntaxNode> out) {
            var mark = out.size();
            var current = pos;
            for (var element : elements) {
                current = match(element, current, out);
                if (current == FAIL) {
                    truncate(out, mark);
                    return FAIL;
                }
            }
            return current;
        }

        private int matchChoice(List<Expression> alternatives, int pos, List<SyntaxNode> out) {
            for (var alternative : alternatives) {
                var mark = out.size();
                var end = match(alternative, pos, out);
                if (end != FAIL) {
                    return end;
                }
                truncate(out, mark);
            }
            return FAIL;
        }

        private int matchRepeated(Expression expression, int pos, List<SyntaxNode> out) {
            var current = pos;
            while (true) {
                var mark = out.size();
                var end = match(expression, current, out);
                if (end == FAIL) {
                    truncate(out, mark);
                    return current;
                }
                if (end == current) {
                    return current;
                }
                current = end;
            }
        }

        private int expect(int pos, String what) {
            if (pos > farthest) {
                farthest = pos;
                expected.clear();
            }
            if (pos == farthest) {
                expected.add(what);
            }
            return FAIL;
        }

        private SourceSpan spanOf(int startPos, int endPos) {
            var start = tokens.get(startPos)
                              .span()
                              .start();
            if (endPos <= startPos) {
                return SourceSpan.at(start);
            }
            return SourceSpan.of(start,
                                 tokens.get(endPos - 1)
                                       .span()
                                       .end());
        }
    }

    private static boolean isOfKind(CommandToken token, TokenKind kind) {
        return switch (kind) {
            case NUMBER -> token instanceof CommandToken.Number;
            case WORD -> token instanceof CommandToken.Word;
            case STRING -> token instanceof CommandToken.StringLiteral;
        };
    }

    private static String describe(CommandToken token) {
        if (token instanceof CommandToken.StringLiteral string) {
            return "string \"" + string.text() + "\"";
        }
        if (token instanceof CommandToken.Number number) {
            return "number " + number.text();
        }
        return "'" + token.text() + "'";
    }

    private static void truncate(List<SyntaxNode> nodes, int size) {
        while (nodes.size() > size) {
            nodes.remove(nodes.size() - 1);
        }
    }
}
