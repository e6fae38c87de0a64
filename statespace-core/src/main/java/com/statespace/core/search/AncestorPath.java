package com.statespace.core.search;

/**
 * Persistent set of the identifiers on the current root-to-node path of a depth-first traversal.
 *
 * <p>{@link #extend(long)} never modifies the receiver, so every branch point hands its children
 * an independent value. Sibling subtrees, including ones running on other threads, therefore never
 * observe each other's exclusions.
 */
public final class AncestorPath {

    private static final AncestorPath EMPTY = new AncestorPath(0L, null);

    private final long identifier;
    private final AncestorPath parent;

    private AncestorPath(long identifier, AncestorPath parent) {
        this.identifier = identifier;
        this.parent = parent;
    }

    public static AncestorPath empty() {
        return EMPTY;
    }

    /**
     * Returns a path that holds every identifier of this one plus {@code identifier}.
     */
    public AncestorPath extend(long identifier) {
        return new AncestorPath(identifier, this);
    }

    public boolean contains(long identifier) {
        for (AncestorPath node = this; node != EMPTY; node = node.parent) {
            if (node.identifier == identifier) {
                return true;
            }
        }
        return false;
    }
}
