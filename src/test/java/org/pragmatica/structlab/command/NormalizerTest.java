package org.pragmatica.structlab.command;

import org.junit.jupiter.api.Test;
import org.pragmatica.structlab.engine.tree.Direction;
import org.pragmatica.structlab.engine.tree.TraversalOrder;
import org.pragmatica.structlab.engine.tree.TreePath;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.error.ParseError;
import org.pragmatica.structlab.lang.Cause;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.parser.CommandGrammars;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class NormalizerTest {

    private static Result<Command> linear(String text) {
        return Normalizer.normalize(Family.LINEAR, CommandGrammars.linear().parse(text).unwrap());
    }

    private static Result<Command> tree(String text) {
        return Normalizer.normalize(Family.TREE, CommandGrammars.tree().parse(text).unwrap());
    }

    private static Cause causeOf(Result<Command> result) {
        return result.fold(cause -> cause, command -> null);
    }

    // === Linear ===

    @Test
    void normalize_createWithCapacity_canonicalizesType() {
        var command = linear("create arraylist with 1, 2, 3 size 3").unwrap();

        assertEquals(new Command.CreateLinear(StructureType.ARRAY_LIST, List.of(1, 2, 3), OptionalInt.of(3)), command);
        assertEquals(Family.LINEAR, command.family());
        assertEquals("create", command.op());
    }

    @Test
    void normalize_createWithoutValues_isEmpty() {
        var command = linear("create LinkedList").unwrap();

        assertEquals(new Command.CreateLinear(StructureType.LINKED_LIST, List.of(), OptionalInt.empty()), command);
    }

    @Test
    void normalize_capacityOnLinkedList_isInvalidArgument() {
        var cause = causeOf(linear("create linkedlist with 1 capacity 4"));

        assertInstanceOf(CommandError.InvalidArgument.class, cause);
        assertEquals("linked_list has no capacity", cause.message());
    }

    @Test
    void normalize_zeroCapacity_isInvalidArgument() {
        assertInstanceOf(CommandError.InvalidArgument.class, causeOf(linear("create stack size 0")));
    }

    @Test
    void normalize_insertWithAndWithoutPosition() {
        assertEquals(new Command.InsertLinear(StructureType.ARRAY_LIST, 4, OptionalInt.of(0)),
                     linear("insert 4 at 0 in arraylist").unwrap());
        assertEquals(new Command.InsertLinear(StructureType.LINKED_LIST, 4, OptionalInt.empty()),
                     linear("insert 4 in linkedlist").unwrap());
    }

    @Test
    void normalize_deleteTargets_distinguishPositionFromValue() {
        assertEquals(new Command.DeleteLinear(StructureType.ARRAY_LIST, new Target.Position(2)),
                     linear("delete at 2 from arraylist").unwrap());
        assertEquals(new Command.DeleteLinear(StructureType.ARRAY_LIST, new Target.Value(2)),
                     linear("delete 2 from arraylist").unwrap());
        assertEquals(new Command.GetLinear(StructureType.LINKED_LIST, new Target.Value(9)),
                     linear("get 9 from linked_list").unwrap());
    }

    @Test
    void normalize_deleteWithoutTarget_isNormalizationError() {
        var cause = causeOf(linear("delete from arraylist"));

        assertInstanceOf(CommandError.Normalization.class, cause);
        assertTrue(cause.message().startsWith("delete needs a position"));
    }

    @Test
    void normalize_stackOperations() {
        assertEquals(new Command.Push(StructureType.STACK, 5), linear("push 5 onto stack").unwrap());
        assertEquals(new Command.Pop(StructureType.STACK), linear("pop from stack").unwrap());
        assertEquals(new Command.Peek(StructureType.STACK), linear("peek stack").unwrap());
        assertEquals(new Command.ClearLinear(StructureType.STACK), linear("clear stack").unwrap());
    }

    @Test
    void normalize_integerOverflow_isInvalidLiteral() {
        var cause = causeOf(linear("push 99999999999 to stack"));

        var literal = assertInstanceOf(ParseError.InvalidLiteral.class, cause);
        assertEquals("99999999999", literal.literal());
    }

    // === Tree ===

    @Test
    void normalize_createAndBuildTrees() {
        assertEquals(new Command.CreateTree(StructureType.AVL, List.of(3, 2, 1)),
                     tree("create avltree with 3, 2, 1").unwrap());
        assertEquals(new Command.BuildTree(StructureType.BST, List.of(5, 3, 8)),
                     tree("build bst with 5, 3, 8").unwrap());
    }

    @Test
    void normalize_huffmanPairs_keepDeclarationOrder() {
        var command = (Command.CreateHuffman) tree("create huffman with c:12, a:5, b:9").unwrap();

        assertEquals(List.of('c', 'a', 'b'), List.copyOf(command.frequencies().keySet()));
        assertEquals(Map.of('a', 5, 'b', 9, 'c', 12), command.frequencies());
        assertEquals(StructureType.HUFFMAN, command.structureType().orElseThrow());
    }

    @Test
    void normalize_huffmanPairs_quotedSpaceAndDigitSymbols() {
        var command = (Command.BuildHuffman) tree("build huffman with \" \":3, 7:1").unwrap();

        assertEquals(3, command.frequencies().get(' '));
        assertEquals(1, command.frequencies().get('7'));
    }

    @Test
    void normalize_invalidPairs_areInvalidArguments() {
        assertInstanceOf(CommandError.InvalidArgument.class, causeOf(tree("create huffman with ab:3")));
        assertInstanceOf(CommandError.InvalidArgument.class, causeOf(tree("create huffman with a:0")));
        assertInstanceOf(CommandError.InvalidArgument.class, causeOf(tree("create huffman with a:1, a:2")));
    }

    @Test
    void normalize_huffmanTotalAboveIntRange_isInvalidArgument() {
        var cause = causeOf(tree("build huffman with a:2147483647, b:2147483647, c:1"));

        assertInstanceOf(CommandError.InvalidArgument.class, cause);
        assertTrue(cause.message().contains("Total Huffman frequency"));
    }

    @Test
    void normalize_huffmanTotalAtIntLimit_isAccepted() {
        var command = (Command.BuildHuffman) tree("build huffman with a:2147483646, b:1").unwrap();

        assertEquals(Integer.MAX_VALUE, command.frequencies().get('a') + command.frequencies().get('b'));
    }

    @Test
    void normalize_insertPath_parsesSteps() {
        var command = tree("insert 5 at 0, 1 in binarytree").unwrap();

        assertEquals(new Command.InsertTree(StructureType.BINARY_TREE,
                                            5,
                                            Optional.of(TreePath.of(Direction.LEFT, Direction.RIGHT))),
                     command);
        assertEquals(new Command.InsertTree(StructureType.BINARY_TREE, 1, Optional.of(TreePath.ROOT)),
                     tree("insert 1 at root in binary_tree").unwrap());
    }

    @Test
    void normalize_pathStepOutsideBinary_isNormalizationError() {
        var cause = causeOf(tree("insert 5 at 0, 2 in binarytree"));

        assertInstanceOf(CommandError.Normalization.class, cause);
        assertEquals("Path steps must be 0 or 1, got '2'", cause.message());
    }

    @Test
    void normalize_pathOnOrderedTree_isNormalizationError() {
        assertInstanceOf(CommandError.Normalization.class, causeOf(tree("insert 5 at 0 in bst")));
        assertInstanceOf(CommandError.Normalization.class, causeOf(tree("delete 5 at 0 from avl")));
    }

    @Test
    void normalize_deleteRules() {
        assertEquals(new Command.DeleteTree(StructureType.BST, OptionalInt.of(4), Optional.empty()),
                     tree("delete 4 from bst").unwrap());
        assertEquals(new Command.DeleteTree(StructureType.BINARY_TREE,
                                            OptionalInt.empty(),
                                            Optional.of(TreePath.of(Direction.RIGHT))),
                     tree("delete at 1 from binarytree").unwrap());
        assertInstanceOf(CommandError.Normalization.class, causeOf(tree("delete 4 from binarytree")));
        assertInstanceOf(CommandError.Normalization.class, causeOf(tree("delete from bst")));
    }

    @Test
    void normalize_searchAndTraverse() {
        assertEquals(new Command.Search(StructureType.AVL, 4), tree("search for 4 in avl").unwrap());
        assertEquals(new Command.Traverse(TraversalOrder.LEVELORDER, Optional.empty()),
                     tree("traverse levelorder").unwrap());
        assertEquals(new Command.Traverse(TraversalOrder.INORDER, Optional.of(StructureType.BINARY_TREE)),
                     tree("traverse inorder in binarytree").unwrap());
    }

    @Test
    void normalize_encodeAndDecode() {
        assertEquals(new Command.Encode("a b"), tree("encode \"a b\" using huffman").unwrap());
        assertEquals(new Command.Decode("0110"), tree("decode 0110 using huffman").unwrap());
        assertEquals(new Command.Decode("01"), tree("decode \"01\" using huffman_tree").unwrap());
    }

    @Test
    void normalize_decodeNonBinaryDigits_isInvalidArgument() {
        assertInstanceOf(CommandError.InvalidArgument.class, causeOf(tree("decode 0120 using huffman")));
    }

    @Test
    void normalize_dottedForms_mapToRegularCommands() {
        assertEquals(new Command.CreateTree(StructureType.BST, List.of(1, 2)), tree("tree.bst.create 1, 2").unwrap());
        assertEquals(new Command.InsertTree(StructureType.AVL, 4, Optional.empty()), tree("tree.avl.insert 4").unwrap());
        assertEquals(new Command.Search(StructureType.BST, 4), tree("tree.bst.search 4").unwrap());
        assertEquals(new Command.DeleteTree(StructureType.BST, OptionalInt.of(4), Optional.empty()),
                     tree("tree.bst.remove 4").unwrap());
        assertEquals(new Command.Traverse(TraversalOrder.PREORDER, Optional.of(StructureType.BINARY_TREE)),
                     tree("tree.binarytree.traverse preorder").unwrap());
    }

    @Test
    void normalize_dottedDeleteOnBinaryTree_needsPath() {
        assertInstanceOf(CommandError.Normalization.class, causeOf(tree("tree.binarytree.delete 4")));
    }

    // === Global ===

    @Test
    void normalize_globalClear() {
        var command = Normalizer.normalize(Family.GLOBAL, CommandGrammars.global().parse("clear").unwrap()).unwrap();

        assertEquals(new Command.ClearAll(), command);
    }
}
