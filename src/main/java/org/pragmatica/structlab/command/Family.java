package org.pragmatica.structlab.command;

/**
 * Command family. Each family owns at most one live structure; {@code GLOBAL} addresses both.
 */
public enum Family {
    LINEAR,
    TREE,
    GLOBAL;

    public String label() {
        return name().toLowerCase();
    }
}
