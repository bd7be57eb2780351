package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.engine.tree.DecodeMode;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Result;

/**
 * Engine and dispatcher configuration options.
 *
 * @param defaultCapacity    initial capacity of array-backed structures created without {@code size}
 * @param minimumCapacity    floor below which array-backed structures never shrink
 * @param singleSymbolCode   code of the only symbol of a one-leaf Huffman tree
 * @param decodeMode         handling of trailing bits in Huffman decoding
 * @param autoCompleteBuilds whether the script sequencer drives builds to completion
 */
public record EngineConfig(
    int defaultCapacity,
    int minimumCapacity,
    String singleSymbolCode,
    DecodeMode decodeMode,
    boolean autoCompleteBuilds
) {
    public static final EngineConfig DEFAULT = new EngineConfig(
        10,
        4,
        "0",
        DecodeMode.STRICT,
        true
    );

    public Result<EngineConfig> validate() {
        if (defaultCapacity < 1) {
            return new CommandError.InvalidArgument("Default capacity must be positive, got " + defaultCapacity)
                .result();
        }
        if (minimumCapacity < 1) {
            return new CommandError.InvalidArgument("Minimum capacity must be positive, got " + minimumCapacity)
                .result();
        }
        if (singleSymbolCode == null || singleSymbolCode.isEmpty() || !singleSymbolCode.matches("[01]+")) {
            return new CommandError.InvalidArgument("Single-symbol code must be a non-empty 0/1 string").result();
        }
        if (decodeMode == null) {
            return new CommandError.InvalidArgument("Decode mode must be set").result();
        }
        return Result.success(this);
    }
}
