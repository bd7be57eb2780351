package org.pragmatica.structlab.cli;

import org.pragmatica.structlab.snapshot.LinearSnapshot;
import org.pragmatica.structlab.snapshot.NodeView;
import org.pragmatica.structlab.snapshot.Snapshot;
import org.pragmatica.structlab.snapshot.TreeSnapshot;

import java.util.stream.Collectors;

/**
 * One-line text rendering of snapshots for the shell.
 */
final class Render {
    private Render() {}

    static String snapshot(Snapshot snapshot) {
        if (snapshot instanceof LinearSnapshot linear) {
            var text = linear.type() + " " + linear.elements();
            return linear.capacity() == null
                   ? text
                   : text + " size=" + linear.size() + " capacity=" + linear.capacity();
        }
        var tree = (TreeSnapshot) snapshot;
        if (tree.nodes()
                .isEmpty()) {
            return tree.type() + " (empty)";
        }
        return tree.type() + " height=" + tree.height() + " " + tree.nodes()
                                                                .stream()
                                                                .map(Render::node)
                                                                .collect(Collectors.joining(" "));
    }

    private static String node(NodeView node) {
        var label = node.value() != null
                    ? String.valueOf(node.value())
                    : (node.symbol() == null
                       ? ""
                       : node.symbol() + ":") + node.weight();
        return node.parentId() == null
               ? "[" + label + "]"
               : label + "^" + node.parentId();
    }
}
