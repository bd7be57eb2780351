package org.pragmatica.structlab.engine.tree;

import java.util.List;

/**
 * Outcome of an ordered search: whether the value was found, and the visited nodes from the root.
 */
public record SearchResult(int value, boolean found, List<Integer> pathValues, List<Integer> pathIds) {
    public SearchResult {
        pathValues = List.copyOf(pathValues);
        pathIds = List.copyOf(pathIds);
    }
}
