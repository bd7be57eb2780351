package org.pragmatica.structlab.lang;

/**
 * Result payload for operations that produce no value.
 */
public enum Unit {
    UNIT;

    @Override
    public String toString() {
        return "()";
    }
}
