package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.StepTrace;
import org.pragmatica.structlab.snapshot.TraceStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree keeping strict ordering {@code left < node < right}. Shares search and step-wise
 * building between the BST and AVL engines.
 */
public abstract sealed class OrderedTree extends AbstractIntTree permits BinarySearchTree, AvlTree {

    public abstract TreeMutation insert(int value);

    public abstract TreeMutation delete(int value);

    public boolean contains(int value) {
        return search(value).found();
    }

    /**
     * Walk from the root towards {@code value}, recording every visited node.
     */
    public SearchResult search(int value) {
        var values = new ArrayList<Integer>();
        var ids = new ArrayList<Integer>();
        var node = root;
        while (node != null) {
            values.add(node.value);
            ids.add(node.id());
            if (value == node.value) {
                return new SearchResult(value, true, values, ids);
            }
            node = value < node.value
                   ? node.left
                   : node.right;
        }
        return new SearchResult(value, false, values, ids);
    }

    /**
     * Search with one frame per visited node, highlighting the walk so far.
     */
    public StepTrace searchWithSteps(int value) {
        var result = search(value);
        var snapshot = snapshot();
        var recorder = StepTrace.recorder("search")
                                .record("initial", "Search for " + value, snapshot, List.of());
        for (int i = 0; i < result.pathIds()
                                  .size(); i++) {
            var visited = result.pathValues()
                                .get(i);
            var description = visited == value
                              ? "Found " + value
                              : "Visit " + visited + ", go " + (value < visited
                                                               ? "left"
                                                               : "right");
            recorder.record("visit",
                            description,
                            snapshot,
                            result.pathIds()
                                  .subList(0, i + 1));
        }
        if (!result.found()) {
            return recorder.record("complete", value + " not found", snapshot, List.of())
                           .build();
        }
        var ids = result.pathIds();
        return recorder.record("complete",
                               value + " found after " + ids.size() + " comparisons",
                               snapshot,
                               List.of(ids.get(ids.size() - 1)))
                       .build();
    }

    /**
     * Replace the content by inserting {@code values} in order, capturing the progress.
     * Per-insert frames of engines that trace their inserts are spliced in without their
     * own opening and closing frames.
     */
    public StepTrace buildWithSteps(List<Integer> values) {
        clear();
        var recorder = StepTrace.recorder("build")
                                .record("initial", "Build " + type() + " from " + values, snapshot(), List.of());
        for (var value : values) {
            var mutation = insert(value);
            if (mutation.trace()
                        .isPresent()) {
                var steps = mutation.trace()
                                    .get()
                                    .steps();
                for (TraceStep step : steps.subList(1, steps.size() - 1)) {
                    recorder.append(step);
                }
            } else if (mutation.changed()) {
                var path = search(value).pathIds();
                recorder.record("insert", "Inserted " + value, snapshot(), List.of(path.get(path.size() - 1)));
            } else {
                recorder.record("insert", value + " already present, skipped", snapshot(), List.of());
            }
        }
        return recorder.record("complete", "Build complete: " + size + " nodes", snapshot(), List.of())
                       .build();
    }

    /**
     * Plain ordered insertion without rebalancing.
     *
     * @return the new node, or null if the value is already present
     */
    IntNode insertOrdered(int value) {
        if (root == null) {
            root = newNode(value);
            size++;
            return root;
        }
        var node = root;
        while (true) {
            if (value == node.value) {
                return null;
            }
            if (value < node.value) {
                if (node.left == null) {
                    node.left = newNode(value);
                    size++;
                    return node.left;
                }
                node = node.left;
            } else {
                if (node.right == null) {
                    node.right = newNode(value);
                    size++;
                    return node.right;
                }
                node = node.right;
            }
        }
    }

    /**
     * Ordered removal: a leaf is dropped, a single child is spliced in, and a node with two
     * children takes its in-order successor's value before the successor is removed from the
     * right subtree.
     *
     * @return ids of the nodes where the tree changed: the node that took the successor's value,
     * or the parent of the removed node (the promoted child when the root was removed); null if
     * the value is absent
     */
    List<Integer> deleteOrdered(int value) {
        IntNode parent = null;
        var node = root;
        while (node != null && node.value != value) {
            parent = node;
            node = value < node.value
                   ? node.left
                   : node.right;
        }
        if (node == null) {
            return null;
        }
        size--;
        if (node.left != null && node.right != null) {
            var successorParent = node;
            var successor = node.right;
            while (successor.left != null) {
                successorParent = successor;
                successor = successor.left;
            }
            node.value = successor.value;
            replaceChild(successorParent, successor, successor.right);
            return List.of(node.id());
        }
        var child = node.left != null
                    ? node.left
                    : node.right;
        replaceChild(parent, node, child);
        if (parent != null) {
            return List.of(parent.id());
        }
        return child == null
               ? List.of()
               : List.of(child.id());
    }
}
