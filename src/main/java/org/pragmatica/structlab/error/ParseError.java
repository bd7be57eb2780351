package org.pragmatica.structlab.error;

import org.pragmatica.structlab.syntax.SourceLocation;

/**
 * Malformed text: command or grammar does not match the expected syntax.
 */
public sealed interface ParseError extends CommandError {
    SourceLocation location();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Text is well-formed but cannot be accepted (unterminated string,
     * undefined rule reference in a grammar).
     */
    record SemanticError(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * Literal that is lexically valid but does not fit its target type.
     */
    record InvalidLiteral(
    SourceLocation location,
    String literal,
    String reason) implements ParseError {
        @Override
        public String message() {
            return "Invalid literal '" + literal + "' at " + location + ": " + reason;
        }
    }
}
