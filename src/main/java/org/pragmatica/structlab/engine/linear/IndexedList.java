package org.pragmatica.structlab.engine.linear;

import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.lang.Unit;

/**
 * Linear structure with positional insert and delete.
 */
public interface IndexedList extends LinearStructure {
    /**
     * Insert before {@code index}; {@code index == size()} appends.
     */
    Result<Unit> insert(int index, int value);

    /**
     * Remove the element at {@code index} and return it.
     */
    Result<Integer> delete(int index);

    default Result<Unit> append(int value) {
        return insert(size(), value);
    }
}
