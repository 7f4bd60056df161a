package work.lcod.config.error;

import work.lcod.config.runtime.LeafPath;

/**
 * The longest dependency chain below {@link #path()} is longer than the configured maximum.
 */
public final class MaxDepthExceededException extends ResolutionException {
    private final LeafPath path;
    private final int depth;
    private final int maxDepth;

    public MaxDepthExceededException(LeafPath path, int depth, int maxDepth) {
        super(
            "max_depth_exceeded",
            "Maximum reference depth (" + maxDepth + ") exceeded: '" + path + "' has a dependency chain of depth " + depth
        );
        this.path = path;
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public LeafPath path() {
        return path;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
