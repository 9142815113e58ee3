package com.vgen.dialogue.state;

import java.util.Objects;

/**
 * Bounds on path search. All values must be positive.
 */
public final class TraversalLimits {

    /** Default: paths up to 200 nodes, at most 5000 explored paths. */
    public static final TraversalLimits DEFAULT = new TraversalLimits(200, 5000);

    private final int maxDepth;
    private final int maxPaths;

    public TraversalLimits(int maxDepth, int maxPaths) {
        this.maxDepth = requirePositive(maxDepth, "max_depth");
        this.maxPaths = requirePositive(maxPaths, "max_paths");
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    /** Paths with more nodes than this are discarded without expansion. */
    public int getMaxDepth() {
        return maxDepth;
    }

    /** Search stops after this many paths have been taken off the frontier. */
    public int getMaxPaths() {
        return maxPaths;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraversalLimits that = (TraversalLimits) o;
        return maxDepth == that.maxDepth && maxPaths == that.maxPaths;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxDepth, maxPaths);
    }
}
