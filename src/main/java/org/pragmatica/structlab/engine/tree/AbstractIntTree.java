package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.TreeSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Base of the integer-valued trees: node ownership, id sequence, traversals and snapshots.
 */
public abstract sealed class AbstractIntTree implements TreeStructure permits BinaryTreeStructure, OrderedTree {
    IntNode root;
    int size;
    private int nextId = 1;

    @Override
    public int size() {
        return size;
    }

    @Override
    public int height() {
        return TreeSnapshots.height(root);
    }

    @Override
    public void clear() {
        root = null;
        size = 0;
    }

    @Override
    public TreeSnapshot snapshot() {
        return TreeSnapshots.of(type(), root);
    }

    /**
     * Values in the requested traversal order.
     */
    public List<Integer> traverse(TraversalOrder order) {
        var values = new ArrayList<Integer>(size);
        switch (order) {
            case PREORDER -> preorder(root, values);
            case INORDER -> inorder(root, values);
            case POSTORDER -> postorder(root, values);
            case LEVELORDER -> levelOrder().forEach(node -> values.add(node.value));
        }
        return values;
    }

    IntNode newNode(int value) {
        return new IntNode(nextId++, value);
    }

    List<IntNode> levelOrder() {
        var nodes = new ArrayList<IntNode>(size);
        if (root == null) {
            return nodes;
        }
        var queue = new ArrayDeque<IntNode>();
        queue.add(root);
        while (!queue.isEmpty()) {
            var node = queue.poll();
            nodes.add(node);
            if (node.left != null) {
                queue.add(node.left);
            }
            if (node.right != null) {
                queue.add(node.right);
            }
        }
        return nodes;
    }

    /**
     * Parent of {@code target}, or null for the root. Found by walking from the root.
     */
    IntNode parentOf(IntNode target) {
        for (var node : levelOrder()) {
            if (node.left == target || node.right == target) {
                return node;
            }
        }
        return null;
    }

    /**
     * Put {@code replacement} where {@code current} hangs, including the root slot.
     */
    void replaceChild(IntNode parent, IntNode current, IntNode replacement) {
        if (parent == null) {
            root = replacement;
        } else if (parent.left == current) {
            parent.left = replacement;
        } else {
            parent.right = replacement;
        }
    }

    private static void preorder(IntNode node, List<Integer> values) {
        if (node == null) {
            return;
        }
        values.add(node.value);
        preorder(node.left, values);
        preorder(node.right, values);
    }

    private static void inorder(IntNode node, List<Integer> values) {
        if (node == null) {
            return;
        }
        inorder(node.left, values);
        values.add(node.value);
        inorder(node.right, values);
    }

    private static void postorder(IntNode node, List<Integer> values) {
        if (node == null) {
            return;
        }
        postorder(node.left, values);
        postorder(node.right, values);
        values.add(node.value);
    }
}
