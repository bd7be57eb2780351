package org.pragmatica.structlab.command;

import org.pragmatica.structlab.engine.tree.TraversalOrder;
import org.pragmatica.structlab.engine.tree.TreePath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Normalized command: one record per operation, immutable, with canonical structure types.
 */
public sealed interface Command {
    Family family();

    /**
     * Operation keyword, e.g. {@code insert}.
     */
    String op();

    /**
     * Structure type named by the command, if any.
     */
    Optional<StructureType> structureType();

    /**
     * Linear-family commands name their structure.
     */
    sealed interface LinearCommand extends Command {
        StructureType type();

        @Override
        default Family family() {
            return Family.LINEAR;
        }

        @Override
        default Optional<StructureType> structureType() {
            return Optional.of(type());
        }
    }

    sealed interface TreeCommand extends Command {
        @Override
        default Family family() {
            return Family.TREE;
        }
    }

    /**
     * Tree-family commands which always name their structure.
     */
    sealed interface TypedTreeCommand extends TreeCommand {
        StructureType type();

        @Override
        default Optional<StructureType> structureType() {
            return Optional.of(type());
        }
    }

    /**
     * Commands operating on the Huffman tree only.
     */
    sealed interface HuffmanCommand extends TreeCommand {
        @Override
        default Optional<StructureType> structureType() {
            return Optional.of(StructureType.HUFFMAN);
        }
    }

    // === Linear ===

    record CreateLinear(StructureType type, List<Integer> values, OptionalInt capacity) implements LinearCommand {
        public CreateLinear {
            values = List.copyOf(values);
        }

        @Override
        public String op() {
            return "create";
        }
    }

    /**
     * Insert; an absent position means append.
     */
    record InsertLinear(StructureType type, int value, OptionalInt position) implements LinearCommand {
        @Override
        public String op() {
            return "insert";
        }
    }

    record DeleteLinear(StructureType type, Target target) implements LinearCommand {
        @Override
        public String op() {
            return "delete";
        }
    }

    record GetLinear(StructureType type, Target target) implements LinearCommand {
        @Override
        public String op() {
            return "get";
        }
    }

    record Push(StructureType type, int value) implements LinearCommand {
        @Override
        public String op() {
            return "push";
        }
    }

    record Pop(StructureType type) implements LinearCommand {
        @Override
        public String op() {
            return "pop";
        }
    }

    record Peek(StructureType type) implements LinearCommand {
        @Override
        public String op() {
            return "peek";
        }
    }

    record ClearLinear(StructureType type) implements LinearCommand {
        @Override
        public String op() {
            return "clear";
        }
    }

    // === Tree ===

    record CreateTree(StructureType type, List<Integer> values) implements TypedTreeCommand {
        public CreateTree {
            values = List.copyOf(values);
        }

        @Override
        public String op() {
            return "create";
        }
    }

    record BuildTree(StructureType type, List<Integer> values) implements TypedTreeCommand {
        public BuildTree {
            values = List.copyOf(values);
        }

        @Override
        public String op() {
            return "build";
        }
    }

    /**
     * Create a Huffman tree at once. Frequencies keep their declaration order.
     */
    record CreateHuffman(Map<Character, Integer> frequencies) implements HuffmanCommand {
        public CreateHuffman {
            frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        }

        @Override
        public String op() {
            return "create";
        }
    }

    /**
     * Build a Huffman tree step by step.
     */
    record BuildHuffman(Map<Character, Integer> frequencies) implements HuffmanCommand {
        public BuildHuffman {
            frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        }

        @Override
        public String op() {
            return "build";
        }
    }

    record InsertTree(StructureType type, int value, Optional<TreePath> path) implements TypedTreeCommand {
        @Override
        public String op() {
            return "insert";
        }
    }

    record DeleteTree(StructureType type, OptionalInt value, Optional<TreePath> path) implements TypedTreeCommand {
        @Override
        public String op() {
            return "delete";
        }
    }

    record Search(StructureType type, int value) implements TypedTreeCommand {
        @Override
        public String op() {
            return "search";
        }
    }

    /**
     * Traverse the live tree; the structure name is optional.
     */
    record Traverse(TraversalOrder order, Optional<StructureType> structureType) implements TreeCommand {
        @Override
        public String op() {
            return "traverse";
        }
    }

    record Encode(String text) implements HuffmanCommand {
        @Override
        public String op() {
            return "encode";
        }
    }

    record Decode(String bits) implements HuffmanCommand {
        @Override
        public String op() {
            return "decode";
        }
    }

    record ClearTree(StructureType type) implements TypedTreeCommand {
        @Override
        public String op() {
            return "clear";
        }
    }

    // === Global ===

    record ClearAll() implements Command {
        @Override
        public Family family() {
            return Family.GLOBAL;
        }

        @Override
        public String op() {
            return "clear";
        }

        @Override
        public Optional<StructureType> structureType() {
            return Optional.empty();
        }
    }
}
