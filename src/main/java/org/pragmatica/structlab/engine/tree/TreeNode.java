package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.NodeView;

/**
 * Node shape seen by the snapshot walk.
 */
interface TreeNode<N extends TreeNode<N>> {
    int id();

    N left();

    N right();

    NodeView view(Integer parentId, int depth, int height, int balance);

    default boolean isLeaf() {
        return left() == null && right() == null;
    }
}
