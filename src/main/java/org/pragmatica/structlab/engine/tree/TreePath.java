package org.pragmatica.structlab.engine.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Root-relative sequence of left/right steps. The empty path addresses the root.
 */
public record TreePath(List<Direction> steps) {
    public static final TreePath ROOT = new TreePath(List.of());

    public TreePath {
        steps = List.copyOf(steps);
    }

    public static TreePath of(Direction... steps) {
        return new TreePath(List.of(steps));
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    /**
     * Path to the parent slot. The root path is its own parent.
     */
    public TreePath parent() {
        return isRoot() ? this : new TreePath(steps.subList(0, steps.size() - 1));
    }

    public Direction last() {
        return steps.get(steps.size() - 1);
    }

    @Override
    public String toString() {
        return isRoot()
               ? "root"
               : steps.stream()
                      .map(step -> String.valueOf(step.bit()))
                      .collect(Collectors.joining(","));
    }
}
