package org.pragmatica.structlab.parser;

import org.pragmatica.structlab.syntax.SourceSpan;

/**
 * Tokens of a single command line.
 */
public sealed interface CommandToken {
    SourceSpan span();

    /**
     * Text the grammar compares against. Strings yield their unquoted content.
     */
    String text();

    // Words and literals
    record Word(SourceSpan span, String text) implements CommandToken {}

    record Number(SourceSpan span, String text) implements CommandToken {}

    record StringLiteral(SourceSpan span, String text) implements CommandToken {}

    // Punctuation
    record Comma(SourceSpan span) implements CommandToken {
        @Override
        public String text() {
            return ",";
        }
    }

    record Colon(SourceSpan span) implements CommandToken {
        @Override
        public String text() {
            return ":";
        }
    }

    record Dot(SourceSpan span) implements CommandToken {
        @Override
        public String text() {
            return ".";
        }
    }

    // Special
    record Eof(SourceSpan span) implements CommandToken {
        @Override
        public String text() {
            return "";
        }
    }

    record Error(SourceSpan span, String message) implements CommandToken {
        @Override
        public String text() {
            return "";
        }
    }
}
