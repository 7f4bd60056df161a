package work.lcod.config.error;

import java.util.List;
import java.util.stream.Collectors;
import work.lcod.config.runtime.LeafPath;

/**
 * A dependency cycle; {@link #cycle()} starts and ends with the same node.
 */
public final class CircularDependencyException extends ResolutionException {
    private final List<LeafPath> cycle;

    public CircularDependencyException(List<LeafPath> cycle) {
        super("circular_dependency", "Circular dependency detected: " + display(cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<LeafPath> cycle() {
        return cycle;
    }

    private static String display(List<LeafPath> cycle) {
        return cycle.stream().map(LeafPath::toString).collect(Collectors.joining(" → "));
    }
}
