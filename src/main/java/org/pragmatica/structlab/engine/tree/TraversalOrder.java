package org.pragmatica.structlab.engine.tree;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four classical tree traversals.
 */
public enum TraversalOrder {
    PREORDER,
    INORDER,
    POSTORDER,
    LEVELORDER;

    public String keyword() {
        return name().toLowerCase();
    }

    public static Optional<TraversalOrder> byKeyword(String keyword) {
        return Arrays.stream(values())
                     .filter(order -> order.keyword()
                                           .equalsIgnoreCase(keyword))
                     .findFirst();
    }
}
