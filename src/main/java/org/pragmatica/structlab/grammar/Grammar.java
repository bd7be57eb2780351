package org.pragmatica.structlab.grammar;

import org.pragmatica.structlab.error.ParseError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.syntax.SourceLocation;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A complete command grammar. The first rule is the start rule.
 */
public record Grammar(List<Rule> rules) {
    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * The rule parsing starts from.
     */
    public Optional<Rule> startRule() {
        return rules.isEmpty()
               ? Optional.empty()
               : Optional.of(rules.get(0));
    }

    /**
     * Build a lookup map for efficient rule access.
     */
    public Map<String, Rule> ruleMap() {
        return rules.stream()
                    .collect(Collectors.toMap(Rule::name, r -> r));
    }

    /**
     * Validate the grammar: at least one rule, no duplicate rule names, no undefined references.
     */
    public Result<Grammar> validate() {
        if (rules.isEmpty()) {
            return Result.failure(new ParseError.SemanticError(
            SourceLocation.START, "Grammar has no rules"));
        }
        var ruleNames = new HashSet<String>();
        for (var rule : rules) {
            if (!ruleNames.add(rule.name())) {
                return Result.failure(new ParseError.SemanticError(
                rule.span()
                    .start(),
                "Duplicate rule: '" + rule.name() + "'"));
            }
        }
        for (var rule : rules) {
            var undefinedRef = findUndefinedReference(rule.expression(), ruleNames);
            if (undefinedRef.isPresent()) {
                var ref = undefinedRef.get();
                return Result.failure(new ParseError.SemanticError(
                ref.span()
                   .start(),
                "Undefined rule reference: '" + ref.ruleName() + "'"));
            }
        }
        return Result.success(this);
    }

    /**
     * Recursively find the first undefined rule reference in an expression.
     */
    private Optional<Expression.Reference> findUndefinedReference(Expression expr, Set<String> ruleNames) {
        if (expr instanceof Expression.Reference ref) {
            return ruleNames.contains(ref.ruleName())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return firstUndefined(seq.elements(), ruleNames);
        }
        if (expr instanceof Expression.Choice choice) {
            return firstUndefined(choice.alternatives(), ruleNames);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return findUndefinedReference(zom.expression(), ruleNames);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return findUndefinedReference(oom.expression(), ruleNames);
        }
        if (expr instanceof Expression.Optional opt) {
            return findUndefinedReference(opt.expression(), ruleNames);
        }
        if (expr instanceof Expression.Group grp) {
            return findUndefinedReference(grp.expression(), ruleNames);
        }
        // Terminals - no nested expressions
        return Optional.empty();
    }

    private Optional<Expression.Reference> firstUndefined(List<Expression> expressions, Set<String> ruleNames) {
        return expressions.stream()
                          .map(e -> findUndefinedReference(e, ruleNames))
                          .filter(Optional::isPresent)
                          .map(Optional::get)
                          .findFirst();
    }
}
