package org.pragmatica.structlab.command;

import org.pragmatica.structlab.engine.tree.Direction;
import org.pragmatica.structlab.engine.tree.TraversalOrder;
import org.pragmatica.structlab.engine.tree.TreePath;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.error.ParseError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.syntax.SyntaxNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Turns a family syntax tree into a {@link Command}.
 *
 * <p>Resolves position-or-value targets, canonicalizes structure names, converts numeric
 * literals and validates paths and Huffman frequency pairs. Type compatibility with the live
 * structure is left to the dispatcher.
 */
public final class Normalizer {
    private Normalizer() {}

    /**
     * Normalize the root {@code Command} node produced by the grammar of the given family.
     */
    public static Result<Command> normalize(Family family, SyntaxNode root) {
        var operation = root.children()
                            .isEmpty()
                        ? root
                        : root.children()
                              .get(0);
        return switch (family) {
            case LINEAR -> linear(operation);
            case TREE -> tree(operation);
            case GLOBAL -> Result.success(new Command.ClearAll());
        };
    }

    // === Linear ===

    private static Result<Command> linear(SyntaxNode op) {
        var type = structure(op);
        return switch (op.rule()) {
            case "Create" -> createLinear(op, type);
            case "Insert" -> intOf(op, "Value").flatMap(value -> optionalInt(op, "Position")
                                                                     .map(position -> new Command.InsertLinear(type,
                                                                                                               value,
                                                                                                               position)));
            case "Delete" -> target(op).map(target -> new Command.DeleteLinear(type, target));
            case "Get" -> target(op).map(target -> new Command.GetLinear(type, target));
            case "Push" -> intOf(op, "Value").map(value -> new Command.Push(type, value));
            case "Pop" -> Result.success(new Command.Pop(type));
            case "Peek" -> Result.success(new Command.Peek(type));
            case "Clear" -> Result.success(new Command.ClearLinear(type));
            default -> unsupported(op);
        };
    }

    private static Result<Command> createLinear(SyntaxNode op, StructureType type) {
        return values(op).flatMap(values -> capacity(op, type).map(capacity -> new Command.CreateLinear(type,
                                                                                                          values,
                                                                                                          capacity)));
    }

    private static Result<OptionalInt> capacity(SyntaxNode op, StructureType type) {
        return optionalInt(op, "Capacity").flatMap(capacity -> {
            if (capacity.isEmpty()) {
                return Result.success(capacity);
            }
            if (!type.hasCapacity()) {
                return new CommandError.InvalidArgument(type + " has no capacity").result();
            }
            if (capacity.getAsInt() < 1) {
                return new CommandError.InvalidArgument("Capacity must be positive, got " + capacity.getAsInt())
                    .result();
            }
            return Result.success(capacity);
        });
    }

    private static Result<Target> target(SyntaxNode op) {
        var target = op.child("Target");
        if (target.isEmpty()) {
            return new CommandError.Normalization(op.rule()
                                                    .toLowerCase()
                                                  + " needs a position ('at <index>') or a value").result();
        }
        var node = target.get();
        if (node.hasKeyword("at")) {
            return intOf(node, "Position").map(Target.Position::new);
        }
        return intOf(node, "Value").map(Target.Value::new);
    }

    // === Tree ===

    private static Result<Command> tree(SyntaxNode op) {
        return switch (op.rule()) {
            case "Create" -> createTree(op);
            case "Build" -> buildTree(op);
            case "Insert" -> insertTree(op);
            case "Delete" -> deleteTree(op);
            case "Search" -> intOf(op, "Value").map(value -> new Command.Search(structure(op), value));
            case "Traverse" -> Result.success(new Command.Traverse(order(op), op.child("Structure")
                                                                                .map(Normalizer::structureOf)));
            case "Encode" -> Result.success(new Command.Encode(required(op, "Text").text()));
            case "Decode" -> bits(required(op, "Bits").text());
            case "Clear" -> Result.success(new Command.ClearTree(structure(op)));
            case "Legacy" -> legacy(op);
            default -> unsupported(op);
        };
    }

    private static Result<Command> createTree(SyntaxNode op) {
        if (op.child("HuffmanType")
              .isPresent()) {
            return pairs(op).map(Command.CreateHuffman::new);
        }
        return values(op).map(values -> new Command.CreateTree(structure(op), values));
    }

    private static Result<Command> buildTree(SyntaxNode op) {
        if (op.child("HuffmanType")
              .isPresent()) {
            return pairs(op).map(Command.BuildHuffman::new);
        }
        return values(op).map(values -> new Command.BuildTree(structure(op), values));
    }

    private static Result<Command> insertTree(SyntaxNode op) {
        var type = structure(op);
        return intOf(op, "Value").flatMap(value -> path(op).flatMap(path -> {
            if (path.isPresent() && type != StructureType.BINARY_TREE) {
                return new CommandError.Normalization("Insert paths apply to binary_tree only, not " + type)
                    .result();
            }
            return Result.success(new Command.InsertTree(type, value, path));
        }));
    }

    private static Result<Command> deleteTree(SyntaxNode op) {
        return optionalInt(op, "Value").flatMap(value -> path(op).flatMap(path -> deleteTree(structure(op),
                                                                                              value,
                                                                                              path)));
    }

    private static Result<Command> deleteTree(StructureType type, OptionalInt value, Optional<TreePath> path) {
        if (value.isEmpty() && path.isEmpty()) {
            return new CommandError.Normalization("delete needs a value or a path ('at <path>')").result();
        }
        if (type == StructureType.BINARY_TREE && path.isEmpty()) {
            return new CommandError.Normalization("binary_tree delete needs a path ('at <path>')").result();
        }
        if ((type == StructureType.BST || type == StructureType.AVL) && value.isEmpty()) {
            return new CommandError.Normalization(type + " delete needs a value").result();
        }
        if ((type == StructureType.BST || type == StructureType.AVL) && path.isPresent()) {
            return new CommandError.Normalization(type + " delete is by value only, paths apply to binary_tree")
                .result();
        }
        return Result.success(new Command.DeleteTree(type, value, path));
    }

    private static Result<Command> legacy(SyntaxNode op) {
        var type = structure(op);
        var legacyOp = required(op, "LegacyOp").children()
                                               .get(0);
        return switch (legacyOp.rule()) {
            case "LegacyCreate" -> values(legacyOp).map(values -> new Command.CreateTree(type, values));
            case "LegacyInsert" -> intOf(legacyOp, "Value").map(value -> new Command.InsertTree(type,
                                                                                                value,
                                                                                                Optional.empty()));
            case "LegacySearch" -> intOf(legacyOp, "Value").map(value -> new Command.Search(type, value));
            case "LegacyDelete" -> intOf(legacyOp, "Value").flatMap(value -> deleteTree(type,
                                                                                        OptionalInt.of(value),
                                                                                        Optional.empty()));
            case "LegacyTraverse" -> Result.success(new Command.Traverse(order(legacyOp), Optional.of(type)));
            default -> unsupported(legacyOp);
        };
    }

    private static Result<Optional<TreePath>> path(SyntaxNode op) {
        var pathNode = op.child("Path");
        if (pathNode.isEmpty()) {
            return Result.success(Optional.empty());
        }
        if (pathNode.get()
                    .hasKeyword("root")) {
            return Result.success(Optional.of(TreePath.ROOT));
        }
        var steps = pathNode.get()
                            .children("Step")
                            .stream()
                            .map(Normalizer::direction)
                            .toList();
        return Result.allOf(steps)
                     .map(directions -> Optional.of(new TreePath(directions)));
    }

    private static Result<Direction> direction(SyntaxNode step) {
        var text = step.text();
        if ("0".equals(text)) {
            return Result.success(Direction.LEFT);
        }
        if ("1".equals(text)) {
            return Result.success(Direction.RIGHT);
        }
        return new CommandError.Normalization("Path steps must be 0 or 1, got '" + text + "'").result();
    }

    private static Result<Map<Character, Integer>> pairs(SyntaxNode op) {
        var frequencies = new LinkedHashMap<Character, Integer>();
        var total = 0;
        var pairs = op.child("Pairs");
        if (pairs.isEmpty()) {
            return Result.success(frequencies);
        }
        for (var pair : pairs.get()
                             .children("Pair")) {
            var symbol = required(pair, "Symbol").text();
            if (symbol.length() != 1) {
                return new CommandError.InvalidArgument("Huffman symbol must be a single character, got '"
                                                        + symbol + "'").result();
            }
            var weight = intOf(pair, "Weight");
            if (weight.isFailure()) {
                return weight.fold(Result::failure, unused -> null);
            }
            if (weight.unwrap() <= 0) {
                return new CommandError.InvalidArgument("Frequency of '" + symbol + "' must be positive, got "
                                                        + weight.unwrap()).result();
            }
            if (frequencies.putIfAbsent(symbol.charAt(0), weight.unwrap()) != null) {
                return new CommandError.InvalidArgument("Duplicate Huffman symbol '" + symbol + "'").result();
            }
            try {
                total = Math.addExact(total, weight.unwrap());
            } catch (ArithmeticException e) {
                return new CommandError.InvalidArgument("Total Huffman frequency exceeds " + Integer.MAX_VALUE)
                    .result();
            }
        }
        return Result.success(frequencies);
    }

    private static Result<Command> bits(String bits) {
        for (var i = 0; i < bits.length(); i++) {
            var c = bits.charAt(i);
            if (c != '0' && c != '1') {
                return new CommandError.InvalidArgument("Bit string may contain only 0 and 1, got '" + bits + "'")
                    .result();
            }
        }
        return Result.success(new Command.Decode(bits));
    }

    private static TraversalOrder order(SyntaxNode op) {
        var keyword = required(op, "Order").text();
        return TraversalOrder.byKeyword(keyword)
                             .orElseThrow(() -> new IllegalStateException("Unknown traversal order " + keyword));
    }

    // === Shared ===

    private static Result<List<Integer>> values(SyntaxNode op) {
        return op.child("Values")
                 .map(values -> Result.allOf(values.children("Value")
                                                   .stream()
                                                   .map(Normalizer::parseInt)
                                                   .toList()))
                 .orElseGet(() -> Result.success(List.of()));
    }

    private static Result<Integer> intOf(SyntaxNode op, String rule) {
        return parseInt(required(op, rule));
    }

    private static Result<OptionalInt> optionalInt(SyntaxNode op, String rule) {
        return op.child(rule)
                 .map(node -> parseInt(node).map(OptionalInt::of))
                 .orElseGet(() -> Result.success(OptionalInt.empty()));
    }

    private static Result<Integer> parseInt(SyntaxNode node) {
        var text = node.text();
        try {
            return Result.success(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            return new ParseError.InvalidLiteral(node.span()
                                                     .start(),
                                                 text,
                                                 "integer out of range").result();
        }
    }

    private static StructureType structure(SyntaxNode op) {
        return structureOf(required(op, "Structure"));
    }

    private static StructureType structureOf(SyntaxNode node) {
        return StructureType.byName(node.text())
                            .orElseThrow(() -> new IllegalStateException("Unknown structure " + node.text()));
    }

    private static SyntaxNode required(SyntaxNode op, String rule) {
        return op.child(rule)
                 .orElseThrow(() -> new IllegalStateException(op.rule() + " has no " + rule));
    }

    private static Result<Command> unsupported(SyntaxNode op) {
        return new CommandError.Normalization("Unsupported command '" + op.text() + "'").result();
    }
}
