package org.pragmatica.structlab.parser;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.error.ParseError;

import static org.junit.jupiter.api.Assertions.*;

class CommandGrammarsTest {

    @ParameterizedTest
    @ValueSource(strings = {"create arraylist",
                            "create array_list with 1, 2, 3 size 8",
                            "create stack capacity 4",
                            "insert 4 in linkedlist",
                            "insert 4 at 0 in arraylist",
                            "delete 7 from linked_list",
                            "delete at 2 from arraylist",
                            "get at 0 from arraylist",
                            "get 3 from linkedlist",
                            "push 9 to stack",
                            "push 9 onto stack",
                            "pop stack",
                            "pop from stack",
                            "peek from stack",
                            "clear linkedlist"})
    void linear_acceptsCommand(String command) {
        var result = CommandGrammars.linear().parse(command);

        assertTrue(result.isSuccess(), () -> command + ": " + result);
    }

    @ParameterizedTest
    @ValueSource(strings = {"create bst",
                            "create avl with 3, 2, 1",
                            "create huffman",
                            "create huffman_tree with a:5, b:9, c:12",
                            "build bst with 5, 3, 8",
                            "build huffman with a:1, \" \":2",
                            "insert 5 in binarytree",
                            "insert 5 at 0,1 in binary_tree",
                            "insert 5 at root in binarytree",
                            "delete 3 from bst",
                            "delete at 1,0 from binarytree",
                            "delete 4 at 0 from binarytree",
                            "search 4 in avl",
                            "search for 4 in avl_tree",
                            "traverse levelorder",
                            "traverse inorder of binarytree",
                            "encode \"abc\" using huffman",
                            "decode 0110 using huffman",
                            "decode \"0110\" using huffmantree",
                            "clear bst",
                            "tree.bst.create 1, 2",
                            "tree.avl.insert 4",
                            "tree.bst.remove 4",
                            "tree.binarytree.traverse preorder"})
    void tree_acceptsCommand(String command) {
        var result = CommandGrammars.tree().parse(command);

        assertTrue(result.isSuccess(), () -> command + ": " + result);
    }

    @Test
    void global_acceptsOnlyBareClear() {
        assertTrue(CommandGrammars.global().parse("clear").isSuccess());
        assertTrue(CommandGrammars.global().parse("clear stack").isFailure());
    }

    // === Rejections ===

    @Test
    void linear_missingValues_expectsNumber() {
        var cause = CommandGrammars.linear()
                                   .parse("create arraylist with")
                                   .fold(c -> c, node -> null);

        var eof = assertInstanceOf(ParseError.UnexpectedEof.class, cause);
        assertEquals("number", eof.expected());
    }

    @Test
    void linear_treeStructureName_isRejected() {
        var cause = CommandGrammars.linear()
                                   .parse("push 1 to bst")
                                   .fold(c -> c, node -> null);

        var unexpected = assertInstanceOf(ParseError.UnexpectedInput.class, cause);
        assertEquals("'bst'", unexpected.found());
        assertTrue(unexpected.expected().contains("'stack'"));
    }

    @Test
    void tree_encodeNeedsQuotedText() {
        var cause = CommandGrammars.tree()
                                   .parse("encode abc using huffman")
                                   .fold(c -> c, node -> null);

        var unexpected = assertInstanceOf(ParseError.UnexpectedInput.class, cause);
        assertEquals("string", unexpected.expected());
    }

    @Test
    void tree_unknownOrder_isRejected() {
        assertTrue(CommandGrammars.tree().parse("traverse sideways").isFailure());
    }
}
