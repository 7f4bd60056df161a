package work.lcod.config.runtime;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import work.lcod.config.error.TemplateSyntaxException;
import work.lcod.config.filter.FilterRegistry;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.ListValue;
import work.lcod.config.value.MapValue;
import work.lcod.config.value.StringValue;

/**
 * Walks a document, registers a {@link DependencyNode} per string leaf holding expressions and wires
 * node-to-node edges. Referenced paths are not checked for existence here.
 *
 * <p>A reference depends on every node at, below or above the referenced path: naming a map waits for
 * the nodes inside it, naming a path inside a node's value waits for that node.
 */
public final class GraphBuilder {
    private final ExpressionScanner scanner;
    private final FilterRegistry filters;

    public GraphBuilder(ExpressionScanner scanner, FilterRegistry filters) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.filters = Objects.requireNonNull(filters, "filters");
    }

    public ReferenceGraph build(ConfigValue root) {
        var nodes = new LinkedHashMap<LeafPath, DependencyNode>();
        walk(LeafPath.ROOT, root, nodes);

        var index = new TreeMap<LeafPath, DependencyNode>(nodes);
        var edges = new LinkedHashMap<LeafPath, Set<LeafPath>>();
        for (var node : nodes.values()) {
            var targets = new TreeMap<Integer, LeafPath>();
            for (var reference : node.references()) {
                collectTargets(reference, index, targets);
            }
            edges.put(node.path(), new LinkedHashSet<>(targets.values()));
        }
        return new ReferenceGraph(nodes, edges);
    }

    /**
     * Adds the nodes above {@code reference} and the sorted range at and below it, keyed by discovery index.
     */
    private static void collectTargets(LeafPath reference, NavigableMap<LeafPath, DependencyNode> index, Map<Integer, LeafPath> targets) {
        for (int length = 1; length < reference.length(); length++) {
            var ancestor = index.get(reference.prefix(length));
            if (ancestor != null) {
                targets.put(ancestor.discoveryIndex(), ancestor.path());
            }
        }
        for (var entry : index.tailMap(reference, true).entrySet()) {
            if (!reference.contains(entry.getKey())) {
                break;
            }
            targets.put(entry.getValue().discoveryIndex(), entry.getKey());
        }
    }

    private void walk(LeafPath path, ConfigValue value, Map<LeafPath, DependencyNode> nodes) {
        if (value instanceof MapValue map) {
            for (var entry : map.entries().entrySet()) {
                walk(path.child(entry.getKey()), entry.getValue(), nodes);
            }
        } else if (value instanceof ListValue list) {
            for (int i = 0; i < list.size(); i++) {
                walk(path.child(i), list.get(i), nodes);
            }
        } else if (value instanceof StringValue str) {
            var expressions = scanner.scan(path, str.value());
            if (expressions.isEmpty()) {
                return;
            }
            for (var expression : expressions) {
                validateFilters(path, expression);
            }
            nodes.put(path, new DependencyNode(path, nodes.size(), str.value(), expressions));
        }
    }

    private void validateFilters(LeafPath path, ReferenceExpression expression) {
        for (var call : expression.filters()) {
            var entry = filters.get(call.name())
                .orElseThrow(() -> new TemplateSyntaxException(path, expression.rawText(), "unknown filter '" + call.name() + "'"));
            if (!entry.accepts(call.arguments().size())) {
                throw new TemplateSyntaxException(
                    path,
                    expression.rawText(),
                    "filter '" + call.name() + "' takes " + entry.arity() + " argument(s), got " + call.arguments().size()
                );
            }
        }
    }
}
