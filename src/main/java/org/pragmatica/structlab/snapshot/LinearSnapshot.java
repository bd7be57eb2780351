package org.pragmatica.structlab.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Ordered element values of a linear structure. {@code capacity} is present for array-backed kinds only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinearSnapshot(String type, List<Integer> elements, int size, Integer capacity) implements Snapshot {
    public LinearSnapshot {
        elements = List.copyOf(elements);
    }
}
