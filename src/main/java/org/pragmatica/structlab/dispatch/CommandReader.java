package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.command.Command;
import org.pragmatica.structlab.command.Family;
import org.pragmatica.structlab.command.Normalizer;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.parser.CommandClassifier;
import org.pragmatica.structlab.parser.CommandGrammars;
import org.pragmatica.structlab.parser.CommandLexer;
import org.pragmatica.structlab.parser.Parser;

/**
 * Text to {@link Command}: classify, parse with the family grammar, normalize.
 */
public final class CommandReader {
    private CommandReader() {}

    public static Result<Command> read(String text) {
        var tokens = CommandLexer.tokenize(text);
        var family = CommandClassifier.classify(tokens)
                                      .family();
        if (family.isEmpty()) {
            return new CommandError.Classification(text.strip()).result();
        }
        return parser(family.get()).parse(tokens)
                                   .flatMap(root -> Normalizer.normalize(family.get(), root));
    }

    private static Parser parser(Family family) {
        return switch (family) {
            case LINEAR -> CommandGrammars.linear();
            case TREE -> CommandGrammars.tree();
            case GLOBAL -> CommandGrammars.global();
        };
    }
}
