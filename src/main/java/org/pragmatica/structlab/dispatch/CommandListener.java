package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.command.Command;

/**
 * Observer of executed commands, e.g. an operation history.
 */
@FunctionalInterface
public interface CommandListener {
    CommandListener NONE = (command, result) -> {};

    void onResult(Command command, CommandResult result);
}
