package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.EdgeView;
import org.pragmatica.structlab.snapshot.NodeView;
import org.pragmatica.structlab.snapshot.TreeSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures trees and forests as {@link TreeSnapshot}s. Heights, balances, depths and parent ids
 * are computed during the walk.
 */
final class TreeSnapshots {
    private TreeSnapshots() {}

    static <N extends TreeNode<N>> TreeSnapshot of(String type, N root) {
        return root == null
               ? TreeSnapshot.empty(type)
               : forest(type, List.of(root));
    }

    static <N extends TreeNode<N>> TreeSnapshot forest(String type, List<N> roots) {
        var heights = new HashMap<Integer, Integer>();
        var maxHeight = 0;
        for (var root : roots) {
            maxHeight = Math.max(maxHeight, collectHeights(root, heights));
        }
        var nodes = new ArrayList<NodeView>();
        var edges = new ArrayList<EdgeView>();
        for (var root : roots) {
            walk(root, null, 0, heights, nodes, edges);
        }
        return new TreeSnapshot(type, nodes, edges, nodes.size(), maxHeight);
    }

    static <N extends TreeNode<N>> int height(N node) {
        return node == null
               ? 0
               : 1 + Math.max(height(node.left()), height(node.right()));
    }

    private static <N extends TreeNode<N>> int collectHeights(N node, Map<Integer, Integer> heights) {
        if (node == null) {
            return 0;
        }
        var height = 1 + Math.max(collectHeights(node.left(), heights), collectHeights(node.right(), heights));
        heights.put(node.id(), height);
        return height;
    }

    private static <N extends TreeNode<N>> void walk(N node,
                                                     Integer parentId,
                                                     int depth,
                                                     Map<Integer, Integer> heights,
                                                     List<NodeView> nodes,
                                                     List<EdgeView> edges) {
        var balance = heightOf(node.left(), heights) - heightOf(node.right(), heights);
        nodes.add(node.view(parentId, depth, heights.get(node.id()), balance));
        if (node.left() != null) {
            edges.add(new EdgeView(node.id(), node.left().id(), EdgeView.LEFT));
            walk(node.left(), node.id(), depth + 1, heights, nodes, edges);
        }
        if (node.right() != null) {
            edges.add(new EdgeView(node.id(), node.right().id(), EdgeView.RIGHT));
            walk(node.right(), node.id(), depth + 1, heights, nodes, edges);
        }
    }

    private static <N extends TreeNode<N>> int heightOf(N node, Map<Integer, Integer> heights) {
        return node == null
               ? 0
               : heights.get(node.id());
    }
}
