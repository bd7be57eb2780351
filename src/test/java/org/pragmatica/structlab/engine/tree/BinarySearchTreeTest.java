package org.pragmatica.structlab.engine.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BinarySearchTreeTest {

    private static BinarySearchTree sample() {
        return BinarySearchTree.create(List.of(50, 30, 70, 20, 40, 60, 80));
    }

    @Test
    void create_keepsOrderingInvariant() {
        var tree = sample();

        assertEquals(List.of(20, 30, 40, 50, 60, 70, 80), tree.traverse(TraversalOrder.INORDER));
        assertEquals(List.of(50, 30, 20, 40, 70, 60, 80), tree.traverse(TraversalOrder.PREORDER));
        assertEquals(3, tree.height());
    }

    @Test
    void insert_duplicate_isNoOp() {
        var tree = sample();

        var mutation = tree.insert(40);

        assertFalse(mutation.changed());
        assertTrue(mutation.trace().isEmpty());
        assertEquals(7, tree.size());
    }

    @Test
    void delete_nodeWithTwoChildren_usesSuccessor() {
        var tree = sample();

        assertTrue(tree.delete(30).changed());

        assertEquals(List.of(20, 40, 50, 60, 70, 80), tree.traverse(TraversalOrder.INORDER));
        assertEquals(List.of(50, 40, 20, 70, 60, 80), tree.traverse(TraversalOrder.PREORDER));
    }

    @Test
    void delete_rootAndLeaf() {
        var tree = sample();

        tree.delete(50);
        tree.delete(20);

        assertEquals(List.of(30, 40, 60, 70, 80), tree.traverse(TraversalOrder.INORDER));
        assertEquals(60, tree.traverse(TraversalOrder.PREORDER).get(0));
    }

    @Test
    void delete_absent_isNoOp() {
        var tree = sample();

        assertFalse(tree.delete(99).changed());
        assertEquals(7, tree.size());
    }

    // === Search ===

    @Test
    void search_recordsVisitedPath() {
        var result = sample().search(60);

        assertTrue(result.found());
        assertEquals(List.of(50, 70, 60), result.pathValues());
        assertTrue(sample().contains(60));
        assertFalse(sample().contains(65));
        assertEquals(3, result.pathIds().size());
    }

    @Test
    void search_miss_reportsWalk() {
        var result = sample().search(45);

        assertFalse(result.found());
        assertEquals(List.of(50, 30, 40), result.pathValues());
    }

    @Test
    void searchWithSteps_oneFramePerVisit() {
        var tree = BinarySearchTree.create(List.of(50, 30, 70));

        var trace = tree.searchWithSteps(30);

        assertThat(trace.steps()).extracting(step -> step.action())
                                 .containsExactly("initial", "visit", "visit", "complete");
        assertEquals(List.of(1, 2), trace.step(2).highlightedIds());
        assertEquals(List.of(2), trace.lastStep().highlightedIds());
        assertEquals("Found 30", trace.step(2).description());
    }

    @Test
    void buildWithSteps_framePerInsert() {
        var tree = BinarySearchTree.create(List.of(1));

        var trace = tree.buildWithSteps(List.of(5, 3, 8, 3));

        assertEquals("build", trace.operation());
        assertEquals(6, trace.length());
        assertEquals("initial", trace.step(0).action());
        assertEquals(0, trace.step(0).snapshot().size());
        assertEquals("3 already present, skipped", trace.step(4).description());
        assertEquals(3, trace.lastStep().snapshot().size());
        assertEquals(List.of(3, 5, 8), tree.traverse(TraversalOrder.INORDER));
    }
}
