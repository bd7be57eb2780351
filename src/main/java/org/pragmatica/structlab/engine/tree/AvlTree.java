package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.StepDetail;
import org.pragmatica.structlab.snapshot.StepTrace;

import java.util.List;

/**
 * Self-balancing search tree.
 *
 * <p>After each structural change heights are recomputed and the tree is scanned breadth-first
 * for nodes with {@code |balance| > 1}. The first one found is rotated and the scan repeats
 * until the tree is balanced. Every insert and delete returns a trace: the
 * initial frame, the raw structural change, one frame per rotation, and a closing frame.
 */
public final class AvlTree extends OrderedTree {
    public static final String TYPE = "avl_tree";

    private AvlTree() {}

    public static AvlTree create(List<Integer> values) {
        var tree = new AvlTree();
        values.forEach(tree::insert);
        return tree;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public TreeMutation insert(int value) {
        var recorder = StepTrace.recorder("insert")
                                .record("initial", "Insert " + value, snapshot(), List.of());
        var node = insertOrdered(value);
        if (node == null) {
            recorder.record("complete", value + " already present, nothing to do", snapshot(), List.of());
            return TreeMutation.traced(false, recorder.build());
        }
        recorder.record("insert", "Inserted " + value, snapshot(), List.of(node.id()));
        rebalance(recorder);
        recorder.record("complete", "Insert of " + value + " complete", snapshot(), List.of(node.id()));
        return TreeMutation.traced(true, recorder.build());
    }

    @Override
    public TreeMutation delete(int value) {
        var recorder = StepTrace.recorder("delete")
                                .record("initial", "Delete " + value, snapshot(), searchPath(value));
        var touched = deleteOrdered(value);
        if (touched == null) {
            recorder.record("complete", value + " not present, nothing to do", snapshot(), List.of());
            return TreeMutation.traced(false, recorder.build());
        }
        recorder.record("delete", "Removed " + value, snapshot(), touched);
        rebalance(recorder);
        recorder.record("complete", "Delete of " + value + " complete", snapshot(), touched);
        return TreeMutation.traced(true, recorder.build());
    }

    /**
     * Whether every node satisfies {@code |balance| <= 1}.
     */
    public boolean isBalanced() {
        updateHeight(root);
        return levelOrder().stream()
                           .allMatch(node -> Math.abs(balance(node)) <= 1);
    }

    private List<Integer> searchPath(int value) {
        return search(value).pathIds();
    }

    private void rebalance(StepTrace.Recorder recorder) {
        for (int guard = 0; guard <= size; guard++) {
            updateHeight(root);
            var pivot = firstUnbalanced();
            if (pivot == null) {
                return;
            }
            rotate(pivot, recorder);
        }
        throw new IllegalStateException("AVL rebalancing did not converge");
    }

    private IntNode firstUnbalanced() {
        for (var node : levelOrder()) {
            if (Math.abs(balance(node)) > 1) {
                return node;
            }
        }
        return null;
    }

    private void rotate(IntNode pivot, StepTrace.Recorder recorder) {
        var parent = parentOf(pivot);
        var balance = balance(pivot);
        String rotationCase;
        IntNode newTop;
        if (balance > 1) {
            var child = pivot.left;
            if (balance(child) >= 0) {
                rotationCase = "LL";
            } else {
                rotationCase = "LR";
                pivot.left = rotateLeft(child);
            }
            newTop = rotateRight(pivot);
        } else {
            var child = pivot.right;
            if (balance(child) <= 0) {
                rotationCase = "RR";
            } else {
                rotationCase = "RL";
                pivot.right = rotateRight(child);
            }
            newTop = rotateLeft(pivot);
        }
        replaceChild(parent, pivot, newTop);
        updateHeight(root);
        var involved = newTop.left == null || newTop.right == null
                       ? List.of(newTop.id(), pivot.id())
                       : List.of(newTop.id(), newTop.left.id(), newTop.right.id());
        recorder.record("rotate",
                        rotationCase + " rotation at " + pivot.value + ", " + newTop.value + " moves up",
                        snapshot(),
                        involved,
                        new StepDetail.Rotation(rotationCase, pivot.id()));
    }

    private static IntNode rotateRight(IntNode z) {
        var y = z.left;
        z.left = y.right;
        y.right = z;
        return y;
    }

    private static IntNode rotateLeft(IntNode z) {
        var y = z.right;
        z.right = y.left;
        y.left = z;
        return y;
    }

    private static int updateHeight(IntNode node) {
        if (node == null) {
            return 0;
        }
        node.height = 1 + Math.max(updateHeight(node.left), updateHeight(node.right));
        return node.height;
    }

    private static int height(IntNode node) {
        return node == null
               ? 0
               : node.height;
    }

    private static int balance(IntNode node) {
        return height(node.left) - height(node.right);
    }
}
