package org.pragmatica.structlab.engine.tree;

import java.util.List;

/**
 * Unbalanced binary search tree. Re-inserting a present value and deleting an absent one are no-ops.
 */
public final class BinarySearchTree extends OrderedTree {
    public static final String TYPE = "bst";

    private BinarySearchTree() {}

    public static BinarySearchTree create(List<Integer> values) {
        var tree = new BinarySearchTree();
        values.forEach(tree::insert);
        return tree;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public TreeMutation insert(int value) {
        return TreeMutation.of(insertOrdered(value) != null);
    }

    @Override
    public TreeMutation delete(int value) {
        return TreeMutation.of(deleteOrdered(value) != null);
    }
}
