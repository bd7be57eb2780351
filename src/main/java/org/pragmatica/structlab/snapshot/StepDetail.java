package org.pragmatica.structlab.snapshot;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed annotation of a trace step.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StepDetail.Rotation.class, name = "rotation"),
    @JsonSubTypes.Type(value = StepDetail.Merge.class, name = "merge"),
    @JsonSubTypes.Type(value = StepDetail.Codes.class, name = "codes")
})
public sealed interface StepDetail {
    /**
     * AVL rotation. {@code rotationCase} is one of {@code LL}, {@code LR}, {@code RR}, {@code RL};
     * {@code pivotId} is the unbalanced node.
     */
    record Rotation(String rotationCase, int pivotId) implements StepDetail {}

    /**
     * Huffman merge: queue content before the merge, the two merged roots (left first), and the new parent.
     */
    record Merge(List<Integer> queueIds, List<Integer> mergedIds, int newNodeId) implements StepDetail {
        public Merge {
            queueIds = List.copyOf(queueIds);
            mergedIds = List.copyOf(mergedIds);
        }
    }

    record Codes(Map<Character, String> codes) implements StepDetail {
        public Codes {
            codes = Collections.unmodifiableMap(new LinkedHashMap<>(codes));
        }
    }
}
