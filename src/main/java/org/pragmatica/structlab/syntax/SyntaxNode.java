package org.pragmatica.structlab.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Concrete syntax tree of one command. Non-terminals are named after the grammar rule that
 * produced them; terminals keep the matched token text.
 */
public sealed interface SyntaxNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * The rule name that produced this node. For terminals this is the token class
     * ({@code NUMBER}, {@code WORD}, ...) or the quoted literal ({@code 'at'}).
     */
    String rule();

    /**
     * Matched text. For non-terminals, the terminal texts joined by single spaces.
     */
    String text();

    /**
     * Direct children, empty for terminals.
     */
    List<SyntaxNode> children();

    default boolean isTerminal() {
        return this instanceof Terminal;
    }

    /**
     * First direct child produced by the given rule.
     */
    default Optional<SyntaxNode> child(String rule) {
        return children().stream()
                         .filter(node -> node.rule().equals(rule))
                         .findFirst();
    }

    /**
     * All direct children produced by the given rule, in source order.
     */
    default List<SyntaxNode> children(String rule) {
        return children().stream()
                         .filter(node -> node.rule().equals(rule))
                         .toList();
    }

    /**
     * Whether a direct terminal child matched the given keyword (case-insensitive).
     */
    default boolean hasKeyword(String keyword) {
        return children().stream()
                         .anyMatch(node -> node.isTerminal() && node.text().equalsIgnoreCase(keyword));
    }

    /**
     * Depth-first search for the first node produced by the given rule, this node included.
     */
    default Optional<SyntaxNode> find(String rule) {
        if (rule().equals(rule)) {
            return Optional.of(this);
        }
        for (var child : children()) {
            var found = child.find(rule);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    record Terminal(SourceSpan span, String rule, String text) implements SyntaxNode {
        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }
    }

    record NonTerminal(SourceSpan span, String rule, List<SyntaxNode> children) implements SyntaxNode {
        @Override
        public String text() {
            var parts = new ArrayList<String>();
            collectText(this, parts);
            return String.join(" ", parts);
        }

        private static void collectText(SyntaxNode node, List<String> parts) {
            if (node instanceof Terminal terminal) {
                parts.add(terminal.text());
                return;
            }
            node.children()
                .forEach(child -> collectText(child, parts));
        }
    }
}
