package work.lcod.config.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Kahn's algorithm over an acyclic {@link ReferenceGraph}. Among nodes ready at the same time the one
 * discovered first in the tree walk goes first, so the order is reproducible.
 */
public final class TopologicalSorter {
    private TopologicalSorter() {}

    public static List<LeafPath> sort(ReferenceGraph graph) {
        var pending = new HashMap<LeafPath, Integer>();
        var dependents = new LinkedHashMap<LeafPath, List<DependencyNode>>();
        var ready = new PriorityQueue<DependencyNode>(Comparator.comparingInt(DependencyNode::discoveryIndex));

        for (var node : graph.nodes()) {
            var dependencies = graph.dependenciesOf(node.path());
            pending.put(node.path(), dependencies.size());
            for (var dependency : dependencies) {
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(node);
            }
            if (dependencies.isEmpty()) {
                ready.add(node);
            }
        }

        var order = new ArrayList<LeafPath>(graph.size());
        while (!ready.isEmpty()) {
            var node = ready.poll();
            order.add(node.path());
            for (var dependent : dependents.getOrDefault(node.path(), List.of())) {
                int remaining = pending.merge(dependent.path(), -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != graph.size()) {
            throw new IllegalStateException("Dependency graph is not acyclic; sorted " + order.size() + " of " + graph.size() + " nodes");
        }
        return order;
    }
}
