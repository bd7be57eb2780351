package org.pragmatica.structlab.command;

/**
 * Normalized argument of {@code delete}/{@code get}: either a position or a value.
 */
public sealed interface Target {
    int value();

    String kind();

    record Position(int value) implements Target {
        @Override
        public String kind() {
            return "position";
        }
    }

    record Value(int value) implements Target {
        @Override
        public String kind() {
            return "value";
        }
    }
}
