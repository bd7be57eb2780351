package org.pragmatica.structlab.parser;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword-driven routing of command text to a family grammar.
 *
 * <p>Works on lexed tokens, so keywords inside quoted strings are never considered.
 * The first family keyword wins; commands naming no family keyword are {@link Classification#UNKNOWN}.
 */
public final class CommandClassifier {
    private CommandClassifier() {}

    private static final Set<String> LINEAR_KEYWORDS = Set.of("arraylist",
                                                              "array_list",
                                                              "linkedlist",
                                                              "linked_list",
                                                              "stack",
                                                              "push",
                                                              "pop",
                                                              "peek");

    private static final Set<String> TREE_KEYWORDS = Set.of("tree",
                                                            "binarytree",
                                                            "binary_tree",
                                                            "bst",
                                                            "avl",
                                                            "avltree",
                                                            "avl_tree",
                                                            "huffman",
                                                            "huffmantree",
                                                            "huffman_tree",
                                                            "search",
                                                            "traverse",
                                                            "build",
                                                            "encode",
                                                            "decode",
                                                            "preorder",
                                                            "inorder",
                                                            "postorder",
                                                            "levelorder");

    public static Classification classify(String text) {
        if (text == null || text.isBlank()) {
            return Classification.UNKNOWN;
        }
        return classify(CommandLexer.tokenize(text));
    }

    public static Classification classify(List<CommandToken> tokens) {
        var words = tokens.stream()
                          .filter(token -> !(token instanceof CommandToken.Eof))
                          .toList();
        if (words.size() == 1 && isWord(words.get(0), "clear")) {
            return Classification.GLOBAL;
        }
        if (words.size() >= 2 && isWord(words.get(0), "tree") && words.get(1) instanceof CommandToken.Dot) {
            return Classification.TREE;
        }
        for (var token : words) {
            if (!(token instanceof CommandToken.Word)) {
                continue;
            }
            var keyword = token.text()
                               .toLowerCase(Locale.ROOT);
            if (LINEAR_KEYWORDS.contains(keyword)) {
                return Classification.LINEAR;
            }
            if (TREE_KEYWORDS.contains(keyword)) {
                return Classification.TREE;
            }
        }
        return Classification.UNKNOWN;
    }

    private static boolean isWord(CommandToken token, String keyword) {
        return token instanceof CommandToken.Word && token.text()
                                                          .equalsIgnoreCase(keyword);
    }
}
