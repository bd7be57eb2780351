package org.pragmatica.structlab.engine.linear;

import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.snapshot.LinearSnapshot;

import java.util.List;

/**
 * Operations shared by all linear engines. A failed operation leaves the structure unchanged.
 */
public interface LinearStructure {
    /**
     * Canonical type name, as used in snapshots.
     */
    String type();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Element at {@code index}, counted from the first inserted (bottom for a stack).
     */
    Result<Integer> get(int index);

    /**
     * Index of the first element equal to {@code value}.
     */
    Result<Integer> indexOf(int value);

    void clear();

    List<Integer> toList();

    LinearSnapshot snapshot();
}
