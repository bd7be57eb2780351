package org.pragmatica.structlab.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.structlab.dispatch.BuildStep;
import org.pragmatica.structlab.dispatch.CommandResult;
import org.pragmatica.structlab.dispatch.Dispatcher;
import org.pragmatica.structlab.dispatch.ScriptReport;
import org.pragmatica.structlab.dispatch.ScriptSequencer;
import org.pragmatica.structlab.dispatch.StructLab;
import org.pragmatica.structlab.snapshot.SnapshotJson;
import org.pragmatica.structlab.snapshot.TraceStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line-oriented driver: reads commands from standard input or a script file and prints results.
 *
 * <pre>
 * structlab [--json] [--script &lt;file&gt;]
 * </pre>
 *
 * Interactive meta commands: {@code :next} plays one build frame, {@code :finish} completes the
 * build, {@code :quit} exits.
 */
public final class StructLabShell {
    private static final Logger log = LoggerFactory.getLogger(StructLabShell.class);
    static final String PROMPT = "structlab> ";

    private final Dispatcher dispatcher;
    private final boolean json;
    private final PrintStream out;

    StructLabShell(Dispatcher dispatcher, boolean json, PrintStream out) {
        this.dispatcher = dispatcher;
        this.json = json;
        this.out = out;
    }

    public static void main(String[] args) {
        var json = false;
        Path script = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--json" -> json = true;
                case "--script" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("--script requires a file");
                        System.exit(2);
                    }
                    script = Path.of(args[++i]);
                }
                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    System.err.println("Usage: structlab [--json] [--script <file>]");
                    System.exit(2);
                }
            }
        }
        var shell = new StructLabShell(StructLab.dispatcher(), json, System.out);
        if (script != null) {
            System.exit(shell.runScript(script));
        }
        shell.repl(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    /**
     * Run a script file and print every result.
     *
     * @return process exit code: 0 if all commands succeeded, 1 otherwise
     */
    int runScript(Path script) {
        String text;
        try {
            text = Files.readString(script);
        } catch (IOException e) {
            log.error("Cannot read script {}", script, e);
            return 1;
        }
        var report = ScriptSequencer.create(dispatcher)
                                    .run(text);
        report.entries()
              .forEach(this::print);
        if (!json) {
            out.println(report.succeeded() + " succeeded, " + report.failed() + " failed");
        }
        return report.allSucceeded()
               ? 0
               : 1;
    }

    void repl(BufferedReader input) {
        out.print(PROMPT);
        try {
            String line;
            while ((line = input.readLine()) != null) {
                if (!handle(line.strip())) {
                    return;
                }
                out.print(PROMPT);
            }
        } catch (IOException e) {
            log.error("Fatal I/O error", e);
        }
    }

    /**
     * @return false when the shell should exit
     */
    boolean handle(String line) {
        if (line.isEmpty()) {
            return true;
        }
        switch (line) {
            case ":quit", ":exit" -> {
                return false;
            }
            case ":next" -> dispatcher.advanceBuild()
                                      .ifPresentOrElse(this::print, () -> out.println("No build in progress"));
            case ":finish" -> dispatcher.completeBuild()
                                        .ifPresentOrElse(this::print, () -> out.println("No build in progress"));
            default -> ScriptSequencer.split(line)
                                      .forEach(command -> print(new ScriptReport.Entry(command,
                                                                                       dispatcher.submit(command))));
        }
        return true;
    }

    private void print(ScriptReport.Entry entry) {
        var result = entry.result();
        if (json) {
            var node = toJson(result);
            node.put("command", entry.command());
            printJson(node);
            return;
        }
        out.println((result.isSuccess()
                     ? "ok    "
                     : "error ") + result.message());
        result.snapshot()
              .ifPresent(snapshot -> out.println("      " + Render.snapshot(snapshot)));
    }

    private void print(BuildStep step) {
        if (json) {
            var node = SnapshotJson.objectNode();
            step.step()
                .ifPresent(frame -> node.set("step", SnapshotJson.toTree(frame)));
            node.put("finished", step.finished());
            var replayed = node.putArray("replayed");
            step.replayed()
                .forEach(entry -> replayed.add(toJson(entry.result()).put("command", entry.command())));
            printJson(node);
            return;
        }
        step.step()
            .ifPresent(this::printFrame);
        if (step.finished()) {
            out.println("build finished");
        }
        step.replayed()
            .forEach(entry -> print(new ScriptReport.Entry("(replayed) " + entry.command(), entry.result())));
    }

    private void printFrame(TraceStep frame) {
        out.println("step " + frame.index() + " [" + frame.action() + "] " + frame.description());
        out.println("      " + Render.snapshot(frame.snapshot()));
    }

    private static ObjectNode toJson(CommandResult result) {
        var node = SnapshotJson.objectNode();
        node.put("outcome", result.outcome()
                                  .name());
        node.put("message", result.message());
        result.target()
              .ifPresentOrElse(target -> node.put("target", target.name()), () -> node.putNull("target"));
        result.snapshot()
              .ifPresent(snapshot -> node.set("snapshot", SnapshotJson.toTree(snapshot)));
        result.trace()
              .ifPresent(trace -> node.set("trace", SnapshotJson.toTree(trace)));
        result.cause()
              .ifPresent(cause -> node.put("error",
                                           cause.getClass()
                                                .getSimpleName()));
        return node;
    }

    private void printJson(ObjectNode node) {
        SnapshotJson.toJson(node)
                    .onSuccess(out::println)
                    .onFailure(cause -> log.error("Cannot render result: {}", cause.message()));
    }
}
