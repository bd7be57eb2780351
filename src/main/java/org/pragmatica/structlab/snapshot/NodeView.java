package org.pragmatica.structlab.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One node in a {@link TreeSnapshot}. Integer trees fill {@code value}; Huffman trees fill
 * {@code weight} and, on leaves, {@code symbol}. {@code parentId} is null on roots.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeView(int id,
                       Integer value,
                       String symbol,
                       Integer weight,
                       Integer parentId,
                       int depth,
                       int height,
                       int balance) {
    public static NodeView valueNode(int id, int value, Integer parentId, int depth, int height, int balance) {
        return new NodeView(id, value, null, null, parentId, depth, height, balance);
    }

    public static NodeView weightNode(int id, String symbol, int weight, Integer parentId, int depth, int height, int balance) {
        return new NodeView(id, null, symbol, weight, parentId, depth, height, balance);
    }
}
