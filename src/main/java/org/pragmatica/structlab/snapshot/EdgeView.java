package org.pragmatica.structlab.snapshot;

/**
 * Parent-to-child edge; {@code side} is {@code left} or {@code right}.
 */
public record EdgeView(int from, int to, String side) {
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
}
