package work.lcod.config.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.config.runtime.LeafPath;

/**
 * What a resolution run computed: node edges, evaluation order, pass count and chain depth per node.
 */
public record ResolutionDiagnostics(
    Map<LeafPath, List<LeafPath>> edges,
    List<LeafPath> order,
    int passes,
    Map<LeafPath, Integer> depths
) {
    public static final ResolutionDiagnostics EMPTY = new ResolutionDiagnostics(Map.of(), List.of(), 0, Map.of());

    public ResolutionDiagnostics {
        edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        order = List.copyOf(order);
        depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
    }

    public int nodeCount() {
        return edges.size();
    }

    public Map<String, Object> toSerializableMap() {
        var edgeMap = new LinkedHashMap<String, Object>();
        for (var entry : edges.entrySet()) {
            var targets = new ArrayList<String>();
            entry.getValue().forEach(target -> targets.add(target.toString()));
            edgeMap.put(entry.getKey().toString(), targets);
        }
        var depthMap = new LinkedHashMap<String, Object>();
        depths.forEach((path, depth) -> depthMap.put(path.toString(), depth));
        var orderList = new ArrayList<String>();
        order.forEach(path -> orderList.add(path.toString()));

        var serializable = new LinkedHashMap<String, Object>();
        serializable.put("nodes", nodeCount());
        serializable.put("edges", edgeMap);
        serializable.put("order", orderList);
        serializable.put("passes", passes);
        serializable.put("depths", depthMap);
        return serializable;
    }
}
