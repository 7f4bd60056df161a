package work.lcod.config.runtime;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.config.value.ConfigValue;

/**
 * A string leaf holding at least one reference expression. Resolves exactly once.
 */
public final class DependencyNode {
    private final LeafPath path;
    private final int discoveryIndex;
    private final String raw;
    private final List<ReferenceExpression> expressions;
    private final Set<LeafPath> references;
    private boolean resolved;
    private ConfigValue value;

    DependencyNode(LeafPath path, int discoveryIndex, String raw, List<ReferenceExpression> expressions) {
        this.path = Objects.requireNonNull(path, "path");
        this.discoveryIndex = discoveryIndex;
        this.raw = Objects.requireNonNull(raw, "raw");
        this.expressions = List.copyOf(expressions);
        var refs = new LinkedHashSet<LeafPath>();
        for (var expression : this.expressions) {
            refs.add(expression.reference());
        }
        this.references = Collections.unmodifiableSet(refs);
    }

    public LeafPath path() {
        return path;
    }

    /**
     * Position of the leaf in the tree walk; breaks ordering ties.
     */
    public int discoveryIndex() {
        return discoveryIndex;
    }

    public String raw() {
        return raw;
    }

    public List<ReferenceExpression> expressions() {
        return expressions;
    }

    /**
     * Paths named by the expressions, in order of first appearance, existing or not.
     */
    public Set<LeafPath> references() {
        return references;
    }

    public boolean isResolved() {
        return resolved;
    }

    public ConfigValue value() {
        if (!resolved) {
            throw new IllegalStateException("Node not resolved yet: " + path);
        }
        return value;
    }

    void markResolved(ConfigValue resolvedValue) {
        if (resolved) {
            throw new IllegalStateException("Node already resolved: " + path);
        }
        this.value = Objects.requireNonNull(resolvedValue, "resolvedValue");
        this.resolved = true;
    }

    @Override
    public String toString() {
        return path + " -> " + references;
    }
}
