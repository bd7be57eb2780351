package org.pragmatica.structlab.engine.tree;

/**
 * One step of a root-relative path: {@code 0} goes left, {@code 1} goes right.
 */
public enum Direction {
    LEFT,
    RIGHT;

    public int bit() {
        return this == LEFT ? 0 : 1;
    }
}
