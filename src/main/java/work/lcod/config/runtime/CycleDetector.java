package work.lcod.config.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import work.lcod.config.error.CircularDependencyException;

/**
 * Depth-first search over every node of a {@link ReferenceGraph}, each unvisited node used as a root.
 */
public final class CycleDetector {
    private enum Mark { ON_STACK, DONE }

    private record Frame(LeafPath node, Iterator<LeafPath> dependencies) {}

    private CycleDetector() {}

    /**
     * @throws CircularDependencyException carrying the cycle, first and last element being the same node
     */
    public static void check(ReferenceGraph graph) {
        var marks = new HashMap<LeafPath, Mark>();
        for (var node : graph.nodes()) {
            if (!marks.containsKey(node.path())) {
                traverse(graph, node.path(), marks);
            }
        }
    }

    private static void traverse(ReferenceGraph graph, LeafPath root, Map<LeafPath, Mark> marks) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<LeafPath> trail = new ArrayList<>();
        push(graph, root, stack, trail, marks);
        while (!stack.isEmpty()) {
            var frame = stack.peek();
            if (!frame.dependencies().hasNext()) {
                marks.put(frame.node(), Mark.DONE);
                trail.remove(trail.size() - 1);
                stack.pop();
                continue;
            }
            var next = frame.dependencies().next();
            var mark = marks.get(next);
            if (mark == Mark.ON_STACK) {
                var cycle = new ArrayList<>(trail.subList(trail.indexOf(next), trail.size()));
                cycle.add(next);
                throw new CircularDependencyException(cycle);
            }
            if (mark == null) {
                push(graph, next, stack, trail, marks);
            }
        }
    }

    private static void push(ReferenceGraph graph, LeafPath node, Deque<Frame> stack, List<LeafPath> trail, Map<LeafPath, Mark> marks) {
        marks.put(node, Mark.ON_STACK);
        trail.add(node);
        stack.push(new Frame(node, graph.dependenciesOf(node).iterator()));
    }
}
