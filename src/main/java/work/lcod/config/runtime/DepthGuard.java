package work.lcod.config.runtime;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.config.error.MaxDepthExceededException;

/**
 * Bounds the longest dependency chain of an acyclic graph.
 *
 * <p>A node's depth is one more than the deepest node it depends on; values that are not nodes count as zero.
 */
public final class DepthGuard {
    private DepthGuard() {}

    /**
     * Computes every node's depth and rejects the deepest one when it is over {@code maxDepth}.
     * Must only run on a graph already proven acyclic.
     *
     * @return depth per node, in discovery order
     * @throws MaxDepthExceededException naming the deepest node (first discovered on ties)
     */
    public static Map<LeafPath, Integer> check(ReferenceGraph graph, int maxDepth) {
        var memo = new HashMap<LeafPath, Integer>();
        var depths = new LinkedHashMap<LeafPath, Integer>();
        LeafPath deepest = null;
        int deepestDepth = 0;
        for (var node : graph.nodes()) {
            int depth = depthOf(graph, node.path(), memo);
            depths.put(node.path(), depth);
            if (depth > deepestDepth) {
                deepest = node.path();
                deepestDepth = depth;
            }
        }
        if (deepest != null && deepestDepth > maxDepth) {
            throw new MaxDepthExceededException(deepest, deepestDepth, maxDepth);
        }
        return depths;
    }

    private static int depthOf(ReferenceGraph graph, LeafPath path, Map<LeafPath, Integer> memo) {
        var known = memo.get(path);
        if (known != null) {
            return known;
        }
        int deepestDependency = 0;
        for (var dependency : graph.dependenciesOf(path)) {
            deepestDependency = Math.max(deepestDependency, depthOf(graph, dependency, memo));
        }
        int depth = deepestDependency + 1;
        memo.put(path, depth);
        return depth;
    }
}
