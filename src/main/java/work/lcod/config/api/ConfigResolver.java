package work.lcod.config.api;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.config.error.ResolutionException;
import work.lcod.config.runtime.CycleDetector;
import work.lcod.config.runtime.DepthGuard;
import work.lcod.config.runtime.ExpressionRenderer;
import work.lcod.config.runtime.ExpressionScanner;
import work.lcod.config.runtime.GraphBuilder;
import work.lcod.config.runtime.LeafPath;
import work.lcod.config.runtime.ResolutionContext;
import work.lcod.config.runtime.TopologicalSorter;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.ListValue;
import work.lcod.config.value.MapValue;

/**
 * Public entry point: resolves every {@code {{ values.* }}} reference of a document in dependency order.
 *
 * <p>A run builds the reference graph, rejects cycles, bounds chain depth, sorts the nodes and renders them
 * one by one. Any {@link ResolutionException} aborts the run; no partial document is ever returned.
 * Instances hold no per-run state and can be reused.
 */
public final class ConfigResolver {
    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    private final ResolverOptions options;

    public ConfigResolver() {
        this(ResolverOptions.defaults());
    }

    public ConfigResolver(ResolverOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @throws ResolutionException on the first syntax error, cycle, missing reference, excessive depth or
     *                             non-stringifiable interpolation
     * @throws IllegalArgumentException when the document root is neither a map nor a list
     */
    public ResolutionResult resolve(ConfigValue tree) {
        Objects.requireNonNull(tree, "tree");
        if (!options.enabled()) {
            log.debug("Resolution disabled; returning document unchanged");
            return ResolutionResult.passThrough(tree);
        }
        if (!(tree instanceof MapValue) && !(tree instanceof ListValue)) {
            throw new IllegalArgumentException("Document root must be a map or a list, got " + tree.typeName());
        }

        var graph = new GraphBuilder(new ExpressionScanner(options.delimiters()), options.filters()).build(tree);
        log.debug("Built dependency graph with {} node(s)", graph.size());
        if (graph.isEmpty()) {
            return ResolutionResult.resolved(tree, ResolutionDiagnostics.EMPTY);
        }
        if (log.isDebugEnabled()) {
            graph.edgeList().forEach((path, deps) -> log.debug("  {} depends on: {}", path, join(deps)));
        }

        CycleDetector.check(graph);
        var depths = DepthGuard.check(graph, options.maxDepth());
        var order = TopologicalSorter.sort(graph);
        log.debug("Resolution order: {}", order.stream().map(LeafPath::toString).collect(Collectors.joining(" → ")));

        var context = new ResolutionContext(tree);
        var renderer = new ExpressionRenderer(options.filters());
        for (var path : order) {
            var value = renderer.resolve(graph.node(path), context);
            log.trace("  {} = {}", path, value);
        }
        log.debug("Resolution completed in 1 pass");

        var diagnostics = new ResolutionDiagnostics(graph.edgeList(), order, 1, depths);
        return ResolutionResult.resolved(context.toTree(), diagnostics);
    }

    private static String join(List<LeafPath> paths) {
        return paths.isEmpty() ? "(none)" : paths.stream().map(LeafPath::toString).collect(Collectors.joining(", "));
    }
}
