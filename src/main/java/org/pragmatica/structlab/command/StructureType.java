package org.pragmatica.structlab.command;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The seven structure kinds with their canonical names and accepted surface spellings.
 */
public enum StructureType {
    ARRAY_LIST(Family.LINEAR, "array_list", List.of("arraylist", "array_list")),
    LINKED_LIST(Family.LINEAR, "linked_list", List.of("linkedlist", "linked_list")),
    STACK(Family.LINEAR, "stack", List.of("stack")),
    BINARY_TREE(Family.TREE, "binary_tree", List.of("binarytree", "binary_tree")),
    BST(Family.TREE, "bst", List.of("bst")),
    AVL(Family.TREE, "avl_tree", List.of("avl", "avltree", "avl_tree")),
    HUFFMAN(Family.TREE, "huffman_tree", List.of("huffman", "huffmantree", "huffman_tree"));

    private final Family family;
    private final String canonicalName;
    private final List<String> aliases;

    StructureType(Family family, String canonicalName, List<String> aliases) {
        this.family = family;
        this.canonicalName = canonicalName;
        this.aliases = aliases;
    }

    public Family family() {
        return family;
    }

    public String canonicalName() {
        return canonicalName;
    }

    /**
     * Whether the structure keeps an array with explicit capacity.
     */
    public boolean hasCapacity() {
        return this == ARRAY_LIST || this == STACK;
    }

    /**
     * Resolve any accepted spelling (case-insensitive) to its structure type.
     */
    public static Optional<StructureType> byName(String name) {
        var lower = name.toLowerCase();
        return Arrays.stream(values())
                     .filter(type -> type.aliases.contains(lower))
                     .findFirst();
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
