package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.NodeView;

/**
 * Integer-valued node owned by its parent. {@code height} is maintained by the AVL engine only.
 */
final class IntNode implements TreeNode<IntNode> {
    private final int id;
    int value;
    IntNode left;
    IntNode right;
    int height = 1;

    IntNode(int id, int value) {
        this.id = id;
        this.value = value;
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public IntNode left() {
        return left;
    }

    @Override
    public IntNode right() {
        return right;
    }

    @Override
    public NodeView view(Integer parentId, int depth, int height, int balance) {
        return NodeView.valueNode(id, value, parentId, depth, height, balance);
    }

    @Override
    public String toString() {
        return "#" + id + "(" + value + ")";
    }
}
