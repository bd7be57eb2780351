package org.pragmatica.structlab.engine.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable symbol to bit-string mapping of one Huffman tree. Regenerated on every build.
 */
public record CodeTable(Map<Character, String> codes) {
    public static final CodeTable EMPTY = new CodeTable(Map.of());

    public CodeTable {
        codes = Collections.unmodifiableMap(new LinkedHashMap<>(codes));
    }

    public Optional<String> code(char symbol) {
        return Optional.ofNullable(codes.get(symbol));
    }

    public boolean isEmpty() {
        return codes.isEmpty();
    }

    /**
     * Length of the longest code, 0 for an empty table.
     */
    public int maxLength() {
        return codes.values()
                    .stream()
                    .mapToInt(String::length)
                    .max()
                    .orElse(0);
    }
}
