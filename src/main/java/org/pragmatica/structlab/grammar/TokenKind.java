package org.pragmatica.structlab.grammar;

import java.util.Arrays;
import java.util.Optional;

/**
 * Token classes a grammar can refer to by upper-case name.
 */
public enum TokenKind {
    /** Signed decimal integer, also used for bit strings. */
    NUMBER,
    /** Letter-initial word: keywords, structure names. */
    WORD,
    /** Double-quoted text. */
    STRING;

    public static Optional<TokenKind> byName(String name) {
        return Arrays.stream(values())
                     .filter(kind -> kind.name()
                                         .equals(name))
                     .findFirst();
    }
}
