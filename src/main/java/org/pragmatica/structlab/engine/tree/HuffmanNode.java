package org.pragmatica.structlab.engine.tree;

import org.pragmatica.structlab.snapshot.NodeView;

/**
 * Huffman node. Leaves carry a symbol; internal nodes always have two children.
 * {@code sequence} orders nodes of equal weight in the build queue.
 */
final class HuffmanNode implements TreeNode<HuffmanNode>, Comparable<HuffmanNode> {
    private final int id;
    private final Character symbol;
    private final int weight;
    private final int sequence;
    private final HuffmanNode left;
    private final HuffmanNode right;

    private HuffmanNode(int id, Character symbol, int weight, int sequence, HuffmanNode left, HuffmanNode right) {
        this.id = id;
        this.symbol = symbol;
        this.weight = weight;
        this.sequence = sequence;
        this.left = left;
        this.right = right;
    }

    static HuffmanNode leaf(int id, char symbol, int weight, int sequence) {
        return new HuffmanNode(id, symbol, weight, sequence, null, null);
    }

    static HuffmanNode merge(int id, int sequence, HuffmanNode left, HuffmanNode right) {
        return new HuffmanNode(id, null, Math.addExact(left.weight, right.weight), sequence, left, right);
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public HuffmanNode left() {
        return left;
    }

    @Override
    public HuffmanNode right() {
        return right;
    }

    char symbol() {
        return symbol;
    }

    int weight() {
        return weight;
    }

    @Override
    public NodeView view(Integer parentId, int depth, int height, int balance) {
        return NodeView.weightNode(id,
                                   symbol == null
                                   ? null
                                   : String.valueOf(symbol),
                                   weight,
                                   parentId,
                                   depth,
                                   height,
                                   balance);
    }

    @Override
    public int compareTo(HuffmanNode other) {
        var byWeight = Integer.compare(weight, other.weight);
        return byWeight != 0
               ? byWeight
               : Integer.compare(sequence, other.sequence);
    }

    String label() {
        return symbol == null
               ? String.valueOf(weight)
               : "'" + symbol + "'(" + weight + ")";
    }
}
