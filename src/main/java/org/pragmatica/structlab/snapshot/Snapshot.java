package org.pragmatica.structlab.snapshot;

/**
 * Serializable, type-tagged view of a structure at one moment.
 */
public sealed interface Snapshot permits LinearSnapshot, TreeSnapshot {
    /**
     * Canonical structure type name, e.g. {@code avl_tree}.
     */
    String type();

    int size();
}
