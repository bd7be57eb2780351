package org.pragmatica.structlab.snapshot;

import java.util.List;
import java.util.Optional;

/**
 * Node and edge lists of a tree (or of a forest, while a Huffman tree is being built).
 * Nodes are listed in pre-order of each root, roots in their own order.
 */
public record TreeSnapshot(String type, List<NodeView> nodes, List<EdgeView> edges, int size, int height)
    implements Snapshot {
    public TreeSnapshot {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static TreeSnapshot empty(String type) {
        return new TreeSnapshot(type, List.of(), List.of(), 0, 0);
    }

    public Optional<NodeView> node(int id) {
        return nodes.stream()
                    .filter(node -> node.id() == id)
                    .findFirst();
    }

    /**
     * Nodes without a parent. A finished tree has at most one.
     */
    public List<NodeView> roots() {
        return nodes.stream()
                    .filter(node -> node.parentId() == null)
                    .toList();
    }
}
