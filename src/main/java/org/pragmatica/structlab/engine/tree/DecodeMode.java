package org.pragmatica.structlab.engine.tree;

/**
 * Handling of trailing bits that do not complete a code.
 */
public enum DecodeMode {
    /**
     * Unmatched trailing bits fail the decode.
     */
    STRICT,
    /**
     * Decoding stops at the first unmatched bit; the decoded prefix is returned.
     */
    PARTIAL
}
