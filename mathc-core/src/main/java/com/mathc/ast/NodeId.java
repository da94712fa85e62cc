package com.mathc.ast;

/**
 * Handle to a node stored in an {@link Ast} arena.
 *
 * Handles are only meaningful for the arena that produced them. {@link #NONE}
 * marks an absent node and is never a valid lookup target.
 */
public record NodeId(int index) {
    public static final NodeId NONE = new NodeId(-1);

    public boolean isNone() {
        return index < 0;
    }

    @Override
    public String toString() {
        return isNone() ? "#none" : "#" + index;
    }
}
