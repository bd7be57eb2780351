package org.pragmatica.structlab.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.error.ParseError;
import org.pragmatica.structlab.lang.Cause;

import static org.junit.jupiter.api.Assertions.*;

class GrammarParserTest {

    @Test
    void parse_simpleRule_succeeds() {
        var result = GrammarParser.parse("Value <- NUMBER");

        assertTrue(result.isSuccess());
        var grammar = result.unwrap();
        assertEquals(1, grammar.rules().size());

        var rule = grammar.rules().get(0);
        assertEquals("Value", rule.name());
        assertInstanceOf(Expression.TokenClass.class, rule.expression());
        assertEquals(TokenKind.NUMBER, ((Expression.TokenClass) rule.expression()).kind());
    }

    @Test
    void parse_sequence_createsSequence() {
        var result = GrammarParser.parse("Push <- 'push' NUMBER 'to' 'stack'");

        assertTrue(result.isSuccess());
        var expr = result.unwrap().rules().get(0).expression();
        assertInstanceOf(Expression.Sequence.class, expr);
        assertEquals(4, ((Expression.Sequence) expr).elements().size());
    }

    @Test
    void parse_choice_createsChoice() {
        var result = GrammarParser.parse("Order <- 'preorder' / 'inorder' / 'postorder'");

        assertTrue(result.isSuccess());
        var expr = result.unwrap().rules().get(0).expression();
        assertInstanceOf(Expression.Choice.class, expr);
        assertEquals(3, ((Expression.Choice) expr).alternatives().size());
    }

    @Test
    void parse_repetition_createsSuffixes() {
        var result = GrammarParser.parse("""
            ZeroMore <- 'a'*
            OneMore <- 'b'+
            Maybe <- 'c'?
            """);

        assertTrue(result.isSuccess());
        var rules = result.unwrap().rules();
        assertInstanceOf(Expression.ZeroOrMore.class, rules.get(0).expression());
        assertInstanceOf(Expression.OneOrMore.class, rules.get(1).expression());
        assertInstanceOf(Expression.Optional.class, rules.get(2).expression());
    }

    @Test
    void parse_groupAndReference_resolvesAcrossRules() {
        var result = GrammarParser.parse("""
            Values <- Value (',' Value)*
            Value  <- NUMBER
            """);

        assertTrue(result.isSuccess());
        var grammar = result.unwrap();
        assertEquals("Values", grammar.startRule().orElseThrow().name());
        assertTrue(grammar.rule("Value").isPresent());
    }

    @Test
    void parse_commentsAndDoubleQuotedLiterals_areAccepted() {
        var result = GrammarParser.parse("""
            # a comment line
            Clear <- "clear"   # trailing comment
            """);

        assertTrue(result.isSuccess());
        var expr = result.unwrap().rules().get(0).expression();
        assertEquals("clear", ((Expression.Literal) expr).text());
    }

    // === Errors ===

    @Test
    void parse_undefinedReference_fails() {
        var result = GrammarParser.parse("Command <- Missing");

        assertTrue(result.isFailure());
        assertTrue(result.fold(Cause::message, grammar -> "").contains("Undefined rule reference: 'Missing'"));
    }

    @Test
    void parse_duplicateRule_fails() {
        var result = GrammarParser.parse("""
            Value <- NUMBER
            Value <- WORD
            """);

        assertTrue(result.isFailure());
        assertTrue(result.fold(Cause::message, grammar -> "").contains("Duplicate rule: 'Value'"));
    }

    @Test
    void parse_unterminatedLiteral_fails() {
        var result = GrammarParser.parse("Clear <- 'clear");

        var cause = result.fold(c -> c, grammar -> null);
        assertInstanceOf(ParseError.SemanticError.class, cause);
        assertTrue(cause.message().contains("Unterminated literal"));
    }

    @Test
    void parse_missingArrow_reportsExpectedArrow() {
        var result = GrammarParser.parse("Clear 'clear'");

        var cause = result.fold(c -> c, grammar -> null);
        assertInstanceOf(ParseError.UnexpectedInput.class, cause);
        assertEquals("'<-'", ((ParseError.UnexpectedInput) cause).expected());
    }

    @Test
    void parse_emptyGrammar_fails() {
        var result = GrammarParser.parse("   # nothing here\n");

        assertTrue(result.isFailure());
        assertTrue(result.fold(Cause::message, grammar -> "").contains("Grammar has no rules"));
    }
}
