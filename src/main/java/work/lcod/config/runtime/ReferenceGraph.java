package work.lcod.config.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency nodes of one document keyed by leaf path, plus node-to-node edges.
 * Built once per resolution run by {@link GraphBuilder}.
 */
public final class ReferenceGraph {
    private final Map<LeafPath, DependencyNode> nodes;
    private final Map<LeafPath, Set<LeafPath>> edges;

    ReferenceGraph(Map<LeafPath, DependencyNode> nodes, Map<LeafPath, Set<LeafPath>> edges) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
    }

    /**
     * Nodes in discovery order.
     */
    public Collection<DependencyNode> nodes() {
        return nodes.values();
    }

    public DependencyNode node(LeafPath path) {
        var node = nodes.get(path);
        if (node == null) {
            throw new IllegalArgumentException("No dependency node at '" + path + "'");
        }
        return node;
    }

    public boolean contains(LeafPath path) {
        return nodes.containsKey(path);
    }

    /**
     * Nodes that must resolve before {@code path}.
     */
    public Set<LeafPath> dependenciesOf(LeafPath path) {
        return edges.getOrDefault(path, Set.of());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Node-to-node edges per node, in discovery order.
     */
    public Map<LeafPath, List<LeafPath>> edgeList() {
        var list = new LinkedHashMap<LeafPath, List<LeafPath>>();
        for (var path : nodes.keySet()) {
            list.put(path, List.copyOf(new ArrayList<>(dependenciesOf(path))));
        }
        return list;
    }
}
