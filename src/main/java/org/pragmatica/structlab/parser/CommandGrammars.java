package org.pragmatica.structlab.parser;

import org.pragmatica.structlab.grammar.GrammarParser;

/**
 * Grammar texts of the command families and the parsers built from them.
 *
 * <p>Grammars are parsed and validated once, on first use. An invalid grammar text is a
 * programming error and fails class initialization.
 */
public final class CommandGrammars {
    private CommandGrammars() {}

    public static final String LINEAR = """
        # Linear family: array_list, linked_list, stack
        Command   <- Create / Insert / Delete / Get / Push / Pop / Peek / Clear
        Create    <- 'create' Structure ('with' Values)? (('size' / 'capacity') Capacity)?
        Insert    <- 'insert' Value ('at' Position)? 'in' Structure
        Delete    <- 'delete' Target? 'from' Structure
        Get       <- 'get' Target? 'from' Structure
        Push      <- 'push' Value ('to' / 'onto') Structure
        Pop       <- 'pop' 'from'? Structure
        Peek      <- 'peek' 'from'? Structure
        Clear     <- 'clear' Structure

        Target    <- 'at' Position / Value
        Values    <- Value (',' Value)*
        Value     <- NUMBER
        Position  <- NUMBER
        Capacity  <- NUMBER
        Structure <- 'arraylist' / 'array_list' / 'linkedlist' / 'linked_list' / 'stack'
        """;

    public static final String TREE = """
        # Tree family: binary_tree, bst, avl_tree, huffman_tree
        Command   <- Legacy / Create / Insert / Delete / Search / Traverse / Build / Encode / Decode / Clear
        Create    <- 'create' (HuffmanType ('with' Pairs)? / Structure ('with' Values)?)
        Insert    <- 'insert' Value ('at' Path)? 'in' Structure
        Delete    <- 'delete' Value? ('at' Path)? 'from' Structure
        Search    <- 'search' 'for'? Value 'in' Structure
        Traverse  <- 'traverse' Order (('in' / 'of') Structure)?
        Build     <- 'build' (HuffmanType 'with' Pairs / Structure 'with' Values)
        Encode    <- 'encode' Text 'using' HuffmanType
        Decode    <- 'decode' Bits 'using' HuffmanType
        Clear     <- 'clear' Structure

        # Dotted form: tree.bst.insert 5
        Legacy         <- 'tree' '.' Structure '.' LegacyOp
        LegacyOp       <- LegacyCreate / LegacyInsert / LegacySearch / LegacyDelete / LegacyTraverse
        LegacyCreate   <- 'create' Values?
        LegacyInsert   <- 'insert' Value
        LegacySearch   <- 'search' Value
        LegacyDelete   <- ('delete' / 'remove') Value
        LegacyTraverse <- 'traverse' Order

        Pairs     <- Pair (',' Pair)*
        Pair      <- Symbol ':' Weight
        Symbol    <- WORD / NUMBER / STRING
        Weight    <- NUMBER
        Values    <- Value (',' Value)*
        Value     <- NUMBER
        Path      <- 'root' / Step (',' Step)*
        Step      <- NUMBER
        Text      <- STRING
        Bits      <- NUMBER / STRING
        Order     <- 'preorder' / 'inorder' / 'postorder' / 'levelorder'
        Structure <- 'binarytree' / 'binary_tree' / 'bst' / 'avltree' / 'avl_tree' / 'avl'
                   / 'huffmantree' / 'huffman_tree' / 'huffman'
        HuffmanType <- 'huffmantree' / 'huffman_tree' / 'huffman'
        """;

    public static final String GLOBAL = """
        Command  <- ClearAll
        ClearAll <- 'clear'
        """;

    private static final class Holder {
        static final Parser LINEAR_PARSER = build(LINEAR);
        static final Parser TREE_PARSER = build(TREE);
        static final Parser GLOBAL_PARSER = build(GLOBAL);
    }

    public static Parser linear() {
        return Holder.LINEAR_PARSER;
    }

    public static Parser tree() {
        return Holder.TREE_PARSER;
    }

    public static Parser global() {
        return Holder.GLOBAL_PARSER;
    }

    private static Parser build(String grammarText) {
        return GrammarParser.parse(grammarText)
                            .flatMap(TokenEngine::create)
                            .fold(cause -> {
                                      throw new IllegalArgumentException("Invalid command grammar: " + cause.message());
                                  },
                                  parser -> parser);
    }
}
