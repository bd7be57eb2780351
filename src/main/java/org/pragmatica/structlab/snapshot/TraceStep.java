package org.pragmatica.structlab.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Optional;

/**
 * One captured frame of a {@link StepTrace}. {@code detail} is null for plain frames.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceStep(int index,
                        String action,
                        String description,
                        Snapshot snapshot,
                        List<Integer> highlightedIds,
                        StepDetail detail) {
    public TraceStep {
        highlightedIds = List.copyOf(highlightedIds);
    }

    public Optional<StepDetail> stepDetail() {
        return Optional.ofNullable(detail);
    }
}
