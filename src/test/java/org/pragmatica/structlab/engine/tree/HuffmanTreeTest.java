package org.pragmatica.structlab.engine.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Cause;
import org.pragmatica.structlab.snapshot.StepDetail;
import org.pragmatica.structlab.snapshot.TreeSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HuffmanTreeTest {

    private static Map<Character, Integer> frequencies() {
        var frequencies = new LinkedHashMap<Character, Integer>();
        frequencies.put('a', 5);
        frequencies.put('b', 9);
        frequencies.put('c', 12);
        return frequencies;
    }

    private static HuffmanTree built() {
        var tree = HuffmanTree.create("0");
        tree.build(frequencies());
        return tree;
    }

    @Test
    void build_mergesLightestFirst() {
        var tree = HuffmanTree.create("0");

        var trace = tree.build(frequencies());

        assertEquals(4, trace.length());
        var first = (StepDetail.Merge) trace.step(1).detail();
        assertEquals(List.of(1, 2, 3), first.queueIds());
        assertEquals(List.of(1, 2), first.mergedIds());
        assertEquals(4, first.newNodeId());
        var second = (StepDetail.Merge) trace.step(2).detail();
        assertEquals(List.of(3, 4), second.queueIds());
        assertEquals(List.of(3, 4), second.mergedIds());
        assertEquals(5, second.newNodeId());
        assertEquals(5, tree.size());
        assertEquals(3, tree.height());
    }

    @Test
    void build_weightSumOverflow_throwsInsteadOfReordering() {
        var frequencies = new LinkedHashMap<Character, Integer>();
        frequencies.put('a', Integer.MAX_VALUE);
        frequencies.put('b', Integer.MAX_VALUE);
        frequencies.put('c', 1);

        assertThrows(ArithmeticException.class, () -> HuffmanTree.create("0").build(frequencies));
    }

    @Test
    void build_framesShowForestUntilComplete() {
        var trace = HuffmanTree.create("0").build(frequencies());

        var initial = (TreeSnapshot) trace.step(0).snapshot();
        assertEquals(3, initial.roots().size());
        var afterFirstMerge = (TreeSnapshot) trace.step(1).snapshot();
        assertEquals(2, afterFirstMerge.roots().size());
        assertEquals(List.of(1, 2, 4), trace.step(1).highlightedIds());
        var done = (TreeSnapshot) trace.lastStep().snapshot();
        assertEquals(1, done.roots().size());
        assertEquals(26, done.roots().get(0).weight());
    }

    @Test
    void build_codesFollowTableOrder() {
        var tree = built();

        assertEquals(Map.of('a', "10", 'b', "11", 'c', "0"), tree.codeTable().codes());
        assertThat(tree.codeTable().codes().keySet()).containsExactly('a', 'b', 'c');
        assertEquals(2, tree.codeTable().maxLength());
    }

    @Test
    void build_completeFrameCarriesCodes() {
        var trace = HuffmanTree.create("0").build(frequencies());

        var codes = (StepDetail.Codes) trace.lastStep().detail();
        assertEquals("0", codes.codes().get('c'));
        assertEquals("Codes: a=10, b=11, c=0", trace.lastStep().description());
    }

    @Test
    void build_equalWeights_breakTiesByTableOrder() {
        var frequencies = new LinkedHashMap<Character, Integer>();
        frequencies.put('x', 1);
        frequencies.put('y', 1);
        var tree = HuffmanTree.create("0");

        tree.build(frequencies);

        assertEquals("0", tree.codeTable().code('x').orElseThrow());
        assertEquals("1", tree.codeTable().code('y').orElseThrow());
    }

    @Test
    void build_singleSymbol_usesConfiguredCode() {
        var tree = HuffmanTree.create("1");

        var trace = tree.build(Map.of('x', 3));

        assertEquals(2, trace.length());
        assertEquals("1", tree.codeTable().code('x').orElseThrow());
        assertEquals("111", tree.encode("xxx"));
        assertEquals("xx", tree.decode("11", DecodeMode.STRICT).unwrap());
    }

    @Test
    void build_empty_hasNoCodes() {
        var tree = HuffmanTree.create("0");

        tree.build(Map.of());

        assertTrue(tree.codeTable().isEmpty());
        assertEquals(0, tree.size());
        assertEquals("", tree.decode("", DecodeMode.STRICT).unwrap());
        assertInstanceOf(CommandError.InvalidArgument.class,
                         tree.decode("1", DecodeMode.STRICT).fold(c -> c, text -> null));
    }

    // === Encode and decode ===

    @Test
    void encode_concatenatesCodes() {
        assertEquals("10110", built().encode("abc"));
    }

    @Test
    void encode_unknownSymbols_areSkipped() {
        assertEquals("100", built().encode("a?c"));
    }

    @Test
    void decode_roundTripsEncodedText() {
        var tree = built();

        assertEquals("cabbac", tree.decode(tree.encode("cabbac"), DecodeMode.STRICT).unwrap());
    }

    @Test
    void decode_strictRejectsTrailingBits() {
        var result = built().decode("101", DecodeMode.STRICT);

        assertInstanceOf(CommandError.InvalidArgument.class, result.fold(c -> c, text -> null));
        assertEquals("Bits from position 2 do not form a code: '1'", result.fold(Cause::message, text -> ""));
    }

    @Test
    void decode_partialKeepsDecodedPrefix() {
        assertEquals("a", built().decode("101", DecodeMode.PARTIAL).unwrap());
    }

    @Test
    void decode_nonBinaryCharacter_isInvalidArgument() {
        assertTrue(built().decode("10x", DecodeMode.PARTIAL).isFailure());
    }

    @Test
    void clear_dropsCodes() {
        var tree = built();

        tree.clear();

        assertTrue(tree.codeTable().isEmpty());
        assertEquals(TreeSnapshot.empty("huffman_tree"), tree.snapshot());
    }
}
