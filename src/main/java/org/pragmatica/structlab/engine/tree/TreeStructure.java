package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.TreeSnapshot;

/**
 * Operations shared by all tree engines.
 */
public interface TreeStructure {
    /**
     * Canonical type name, as used in snapshots.
     */
    String type();

    int size();

    /**
     * Number of levels; 0 for an empty tree.
     */
    int height();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Remove all nodes. Node ids are not reused afterwards.
     */
    void clear();

    TreeSnapshot snapshot();
}
