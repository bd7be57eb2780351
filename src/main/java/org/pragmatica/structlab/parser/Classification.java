package org.pragmatica.structlab.parser;

import org.pragmatica.structlab.command.Family;

import java.util.Optional;

/**
 * Outcome of command classification.
 */
public enum Classification {
    GLOBAL(Family.GLOBAL),
    LINEAR(Family.LINEAR),
    TREE(Family.TREE),
    UNKNOWN(null);

    private final Family family;

    Classification(Family family) {
        this.family = family;
    }

    /**
     * Family the command belongs to, empty for {@link #UNKNOWN}.
     */
    public Optional<Family> family() {
        return Optional.ofNullable(family);
    }
}
