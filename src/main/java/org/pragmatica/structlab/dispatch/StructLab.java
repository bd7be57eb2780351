package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.engine.tree.DecodeMode;
import org.pragmatica.structlab.lang.Result;

/**
 * Entry point for creating dispatchers and script sequencers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var dispatcher = StructLab.dispatcher();
 * dispatcher.submit("create bst with 50,30,70");
 * var result = dispatcher.submit("search 30 in bst");
 *
 * var report = StructLab.sequencer().run("""
 *     build huffman with a:5,b:9,c:12
 *     encode "abc" using huffman
 *     """);
 * }</pre>
 */
public final class StructLab {
    private StructLab() {}

    /**
     * Create a dispatcher with default configuration.
     */
    public static Dispatcher dispatcher() {
        return Dispatcher.create(EngineConfig.DEFAULT);
    }

    /**
     * Create a dispatcher with custom configuration.
     */
    public static Result<Dispatcher> dispatcher(EngineConfig config) {
        return config.validate()
                     .map(validated -> Dispatcher.create(validated));
    }

    /**
     * Create a script sequencer over a fresh dispatcher with default configuration.
     */
    public static ScriptSequencer sequencer() {
        return ScriptSequencer.create(dispatcher());
    }

    /**
     * Create a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int defaultCapacity = EngineConfig.DEFAULT.defaultCapacity();
        private int minimumCapacity = EngineConfig.DEFAULT.minimumCapacity();
        private String singleSymbolCode = EngineConfig.DEFAULT.singleSymbolCode();
        private DecodeMode decodeMode = EngineConfig.DEFAULT.decodeMode();
        private boolean autoCompleteBuilds = EngineConfig.DEFAULT.autoCompleteBuilds();
        private CommandListener listener = CommandListener.NONE;

        private Builder() {}

        public Builder capacity(int capacity) {
            this.defaultCapacity = capacity;
            return this;
        }

        public Builder minimumCapacity(int capacity) {
            this.minimumCapacity = capacity;
            return this;
        }

        public Builder singleSymbolCode(String code) {
            this.singleSymbolCode = code;
            return this;
        }

        public Builder decodeMode(DecodeMode mode) {
            this.decodeMode = mode;
            return this;
        }

        public Builder autoCompleteBuilds(boolean enabled) {
            this.autoCompleteBuilds = enabled;
            return this;
        }

        public Builder listener(CommandListener listener) {
            this.listener = listener;
            return this;
        }

        public Result<EngineConfig> config() {
            return new EngineConfig(defaultCapacity,
                                    minimumCapacity,
                                    singleSymbolCode,
                                    decodeMode,
                                    autoCompleteBuilds).validate();
        }

        public Result<Dispatcher> build() {
            return config().map(config -> Dispatcher.create(config, listener));
        }
    }
}
