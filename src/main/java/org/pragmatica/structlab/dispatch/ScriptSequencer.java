package org.pragmatica.structlab.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a multi-command script through a dispatcher, one command at a time. A failing command
 * never stops the script.
 *
 * <p>Commands are separated by newlines and by {@code ;} outside double quotes. Blank lines and
 * lines starting with {@code #} or {@code //} are skipped.
 */
public final class ScriptSequencer {
    private static final Logger log = LoggerFactory.getLogger(ScriptSequencer.class);

    private final Dispatcher dispatcher;

    private ScriptSequencer(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public static ScriptSequencer create(Dispatcher dispatcher) {
        return new ScriptSequencer(dispatcher);
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public ScriptReport run(String script) {
        var entries = new ArrayList<ScriptReport.Entry>();
        for (var command : split(script)) {
            var result = dispatcher.submit(command);
            entries.add(new ScriptReport.Entry(command, result));
            if (dispatcher.config()
                          .autoCompleteBuilds() && dispatcher.isBuilding()) {
                dispatcher.completeBuild()
                          .ifPresent(step -> step.replayed()
                                                 .forEach(replayed -> entries.add(new ScriptReport.Entry(
                                                     "(replayed) " + replayed.command(),
                                                     replayed.result()))));
            }
        }
        var report = new ScriptReport(entries);
        log.info("Script finished: {} command(s), {} succeeded, {} failed",
                 entries.size(),
                 report.succeeded(),
                 report.failed());
        return report;
    }

    /**
     * Individual commands of a script, trimmed, without blanks and comments.
     */
    public static List<String> split(String script) {
        var commands = new ArrayList<String>();
        for (var line : script.split("\\R")) {
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("//")) {
                continue;
            }
            splitLine(trimmed, commands);
        }
        return commands;
    }

    private static void splitLine(String line, List<String> commands) {
        var current = new StringBuilder();
        var quoted = false;
        for (int i = 0; i < line.length(); i++) {
            var c = line.charAt(i);
            if (quoted && c == '\\' && i + 1 < line.length()) {
                current.append(c)
                       .append(line.charAt(++i));
                continue;
            }
            if (c == '"') {
                quoted = !quoted;
            }
            if (c == ';' && !quoted) {
                addCommand(current, commands);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addCommand(current, commands);
    }

    private static void addCommand(CharSequence text, List<String> commands) {
        var command = text.toString()
                          .strip();
        if (!command.isEmpty()) {
            commands.add(command);
        }
    }
}
