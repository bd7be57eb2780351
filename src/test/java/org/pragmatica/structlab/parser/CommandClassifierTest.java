package org.pragmatica.structlab.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.command.Family;

import static org.junit.jupiter.api.Assertions.*;

class CommandClassifierTest {

    @Test
    void classify_linearKeywords_routeToLinear() {
        assertEquals(Classification.LINEAR, CommandClassifier.classify("create arraylist with 1,2,3"));
        assertEquals(Classification.LINEAR, CommandClassifier.classify("push 5 to stack"));
        assertEquals(Classification.LINEAR, CommandClassifier.classify("delete at 0 from LinkedList"));
    }

    @Test
    void classify_treeKeywords_routeToTree() {
        assertEquals(Classification.TREE, CommandClassifier.classify("insert 5 in bst"));
        assertEquals(Classification.TREE, CommandClassifier.classify("traverse inorder"));
        assertEquals(Classification.TREE, CommandClassifier.classify("decode 0110 using huffman"));
    }

    @Test
    void classify_dottedTreeForm_routesToTree() {
        assertEquals(Classification.TREE, CommandClassifier.classify("tree.avl.insert 4"));
    }

    @Test
    void classify_bareClear_isGlobal() {
        assertEquals(Classification.GLOBAL, CommandClassifier.classify("  CLEAR "));
        assertEquals(Classification.LINEAR, CommandClassifier.classify("clear stack"));
        assertEquals(Classification.TREE, CommandClassifier.classify("clear bst"));
    }

    @Test
    void classify_keywordInsideString_isIgnored() {
        assertEquals(Classification.TREE, CommandClassifier.classify("encode \"stack\" using huffman"));
        assertEquals(Classification.UNKNOWN, CommandClassifier.classify("say \"push\""));
    }

    @Test
    void classify_unknownOrBlank_isUnknown() {
        assertEquals(Classification.UNKNOWN, CommandClassifier.classify("make coffee"));
        assertEquals(Classification.UNKNOWN, CommandClassifier.classify(""));
        assertTrue(Classification.UNKNOWN.family().isEmpty());
    }

    @Test
    void family_mapsRoutableClassifications() {
        assertEquals(Family.LINEAR, Classification.LINEAR.family().orElseThrow());
        assertEquals(Family.TREE, Classification.TREE.family().orElseThrow());
        assertEquals(Family.GLOBAL, Classification.GLOBAL.family().orElseThrow());
    }
}
