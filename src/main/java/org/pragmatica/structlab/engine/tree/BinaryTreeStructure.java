package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;

import java.util.List;
import java.util.OptionalInt;

/**
 * Plain binary tree with level-order and path-addressed placement.
 */
public final class BinaryTreeStructure extends AbstractIntTree {
    public static final String TYPE = "binary_tree";

    private BinaryTreeStructure() {}

    public static BinaryTreeStructure create() {
        return new BinaryTreeStructure();
    }

    /**
     * Tree with {@code values} placed in level order.
     */
    public static BinaryTreeStructure build(List<Integer> values) {
        var tree = new BinaryTreeStructure();
        values.forEach(tree::insert);
        return tree;
    }

    @Override
    public String type() {
        return TYPE;
    }

    /**
     * Place the value in the first node missing a child, scanning breadth-first, left before right.
     *
     * @return id of the new node
     */
    public int insert(int value) {
        var node = newNode(value);
        size++;
        if (root == null) {
            root = node;
            return node.id();
        }
        for (var candidate : levelOrder()) {
            if (candidate.left == null) {
                candidate.left = node;
                return node.id();
            }
            if (candidate.right == null) {
                candidate.right = node;
                return node.id();
            }
        }
        throw new IllegalStateException("No free slot in a finite tree");
    }

    /**
     * Place the value at {@code path}, the full root-relative path of the new node. Every prefix
     * must resolve to an existing node and the final slot must be empty.
     *
     * @return id of the new node
     */
    public Result<Integer> insert(int value, TreePath path) {
        if (path.isRoot()) {
            if (root != null) {
                return new CommandError.InvalidArgument("Root is occupied; insert at a child path").result();
            }
            return Result.success(insert(value));
        }
        var parent = resolve(path.parent());
        if (parent == null) {
            return new CommandError.OutOfRange("Path " + path + " does not resolve: no node at "
                                               + path.parent()).result();
        }
        var slot = path.last() == Direction.LEFT
                   ? parent.left
                   : parent.right;
        if (slot != null) {
            return new CommandError.InvalidArgument("Slot at path " + path + " is occupied by " + slot.value)
                .result();
        }
        var node = newNode(value);
        if (path.last() == Direction.LEFT) {
            parent.left = node;
        } else {
            parent.right = node;
        }
        size++;
        return Result.success(node.id());
    }

    /**
     * Remove the node at {@code path}. The deepest, right-most node is detached and takes the
     * removed node's place.
     *
     * @param expected value the addressed node must hold, if given
     * @return the removed value
     */
    public Result<Integer> delete(TreePath path, OptionalInt expected) {
        var target = resolve(path);
        if (target == null) {
            return new CommandError.OutOfRange("No node at path " + path).result();
        }
        if (expected.isPresent() && expected.getAsInt() != target.value) {
            return new CommandError.NotFound("Node at path " + path + " holds " + target.value + ", not "
                                             + expected.getAsInt()).result();
        }
        var removed = target.value;
        var nodes = levelOrder();
        var last = nodes.get(nodes.size() - 1);
        replaceChild(parentOf(last), last, null);
        if (last != target) {
            target.value = last.value;
        }
        size--;
        return Result.success(removed);
    }

    /**
     * Value at {@code path}, if a node is there.
     */
    public OptionalInt valueAt(TreePath path) {
        var node = resolve(path);
        return node == null
               ? OptionalInt.empty()
               : OptionalInt.of(node.value);
    }

    private IntNode resolve(TreePath path) {
        var node = root;
        for (var step : path.steps()) {
            if (node == null) {
                return null;
            }
            node = step == Direction.LEFT
                   ? node.left
                   : node.right;
        }
        return node;
    }
}
