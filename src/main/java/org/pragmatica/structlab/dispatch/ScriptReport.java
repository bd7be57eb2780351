package org.pragmatica.structlab.dispatch;

import java.util.List;

/**
 * Per-command results of a script run, in execution order.
 */
public record ScriptReport(List<Entry> entries) {
    public ScriptReport {
        entries = List.copyOf(entries);
    }

    /**
     * One executed command. Results replayed after a build are listed under the text of the
     * command that started the build, prefixed with {@code (replayed)}.
     */
    public record Entry(String command, CommandResult result) {}

    public long succeeded() {
        return entries.stream()
                      .filter(entry -> entry.result()
                                            .isSuccess())
                      .count();
    }

    public long failed() {
        return entries.size() - succeeded();
    }

    public boolean allSucceeded() {
        return failed() == 0;
    }
}
