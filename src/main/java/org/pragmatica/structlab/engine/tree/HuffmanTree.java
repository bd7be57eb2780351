package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.snapshot.StepDetail;
import org.pragmatica.structlab.snapshot.StepTrace;
import org.pragmatica.structlab.snapshot.TreeSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Huffman tree built greedily from a frequency table.
 *
 * <p>The build queue is ordered by weight, then by sequence number: leaves are numbered in
 * table order and every merged node takes the next number. The first node taken becomes the
 * left child. Codes use {@code 0} for left and {@code 1} for right; a tree with a single leaf
 * uses the configured single-symbol code.
 */
public final class HuffmanTree implements TreeStructure {
    public static final String TYPE = "huffman_tree";

    private final String singleSymbolCode;
    private HuffmanNode root;
    private int size;
    private CodeTable codes = CodeTable.EMPTY;
    private int nextId = 1;

    private HuffmanTree(String singleSymbolCode) {
        if (singleSymbolCode == null || singleSymbolCode.isEmpty()) {
            throw new IllegalArgumentException("Single-symbol code must not be empty");
        }
        this.singleSymbolCode = singleSymbolCode;
    }

    public static HuffmanTree create(String singleSymbolCode) {
        return new HuffmanTree(singleSymbolCode);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int height() {
        return TreeSnapshots.height(root);
    }

    @Override
    public void clear() {
        root = null;
        size = 0;
        codes = CodeTable.EMPTY;
    }

    @Override
    public TreeSnapshot snapshot() {
        return TreeSnapshots.of(TYPE, root);
    }

    public CodeTable codeTable() {
        return codes;
    }

    /**
     * Rebuild the tree from {@code frequencies}, in their iteration order.
     *
     * @return initial frame with the leaf queue, one frame per merge and a final frame with the codes
     */
    public StepTrace build(Map<Character, Integer> frequencies) {
        clear();
        var queue = new PriorityQueue<HuffmanNode>();
        var sequence = 0;
        for (var entry : frequencies.entrySet()) {
            queue.add(HuffmanNode.leaf(nextId++, entry.getKey(), entry.getValue(), sequence++));
        }
        size = queue.size();
        var recorder = StepTrace.recorder("build")
                                .record("initial",
                                        "Queue of " + queue.size() + " leaves",
                                        forest(queue),
                                        ids(ordered(queue)));
        while (queue.size() > 1) {
            var queueIds = ids(ordered(queue));
            var left = queue.poll();
            var right = queue.poll();
            var merged = HuffmanNode.merge(nextId++, sequence++, left, right);
            queue.add(merged);
            size++;
            recorder.record("merge",
                            "Merge " + left.label() + " and " + right.label() + " into " + merged.weight(),
                            forest(queue),
                            List.of(left.id(), right.id(), merged.id()),
                            new StepDetail.Merge(queueIds, List.of(left.id(), right.id()), merged.id()));
        }
        root = queue.poll();
        codes = generateCodes(frequencies);
        return recorder.record("complete",
                               "Codes: " + describe(codes),
                               snapshot(),
                               root == null
                               ? List.of()
                               : List.of(root.id()),
                               new StepDetail.Codes(codes.codes()))
                       .build();
    }

    /**
     * Concatenated codes of the symbols of {@code text}; symbols without a code are skipped.
     */
    public String encode(String text) {
        var bits = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            codes.code(text.charAt(i))
                 .ifPresent(bits::append);
        }
        return bits.toString();
    }

    /**
     * Greedy prefix decoding of a 0/1 string.
     */
    public Result<String> decode(String bits, DecodeMode mode) {
        if (codes.isEmpty() && !bits.isEmpty()) {
            return new CommandError.InvalidArgument("Huffman tree has no codes").result();
        }
        var symbols = new HashMap<String, Character>();
        codes.codes()
             .forEach((symbol, code) -> symbols.put(code, symbol));
        var maxLength = codes.maxLength();
        var decoded = new StringBuilder();
        var pendingStart = 0;
        for (int i = 0; i < bits.length(); i++) {
            var bit = bits.charAt(i);
            if (bit != '0' && bit != '1') {
                return new CommandError.InvalidArgument("Bit string may contain only 0 and 1, got '" + bits + "'")
                    .result();
            }
            var symbol = symbols.get(bits.substring(pendingStart, i + 1));
            if (symbol != null) {
                decoded.append(symbol);
                pendingStart = i + 1;
            } else if (i + 1 - pendingStart >= maxLength) {
                break;
            }
        }
        if (pendingStart < bits.length() && mode == DecodeMode.STRICT) {
            return new CommandError.InvalidArgument("Bits from position " + pendingStart + " do not form a code: '"
                                                    + bits.substring(pendingStart) + "'").result();
        }
        return Result.success(decoded.toString());
    }

    private CodeTable generateCodes(Map<Character, Integer> frequencies) {
        if (root == null) {
            return CodeTable.EMPTY;
        }
        var assigned = new HashMap<Character, String>();
        if (root.isLeaf()) {
            assigned.put(root.symbol(), singleSymbolCode);
        } else {
            assignCodes(root, "", assigned);
        }
        var table = new LinkedHashMap<Character, String>();
        frequencies.keySet()
                   .forEach(symbol -> table.put(symbol, assigned.get(symbol)));
        return new CodeTable(table);
    }

    private static void assignCodes(HuffmanNode node, String prefix, Map<Character, String> table) {
        if (node.isLeaf()) {
            table.put(node.symbol(), prefix);
            return;
        }
        assignCodes(node.left(), prefix + "0", table);
        assignCodes(node.right(), prefix + "1", table);
    }

    private static TreeSnapshot forest(PriorityQueue<HuffmanNode> queue) {
        return TreeSnapshots.forest(TYPE, ordered(queue));
    }

    private static List<HuffmanNode> ordered(PriorityQueue<HuffmanNode> queue) {
        var nodes = new ArrayList<>(queue);
        nodes.sort(null);
        return nodes;
    }

    private static List<Integer> ids(List<HuffmanNode> nodes) {
        return nodes.stream()
                    .map(HuffmanNode::id)
                    .toList();
    }

    private static String describe(CodeTable codes) {
        return codes.codes()
                    .entrySet()
                    .stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining(", "));
    }
}
