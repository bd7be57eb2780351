package org.pragmatica.structlab.parser;

import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.syntax.SyntaxNode;

import java.util.List;

/**
 * Parses command text according to one grammar.
 */
public interface Parser {

    /**
     * Parse command text starting from the grammar's first rule.
     */
    Result<SyntaxNode> parse(String input);

    /**
     * Parse command text starting from a specific rule.
     */
    Result<SyntaxNode> parse(String input, String startRule);

    /**
     * Parse already tokenized command text starting from the grammar's first rule.
     */
    Result<SyntaxNode> parse(List<CommandToken> tokens);
}
