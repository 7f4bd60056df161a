package work.lcod.config.runtime;

import java.util.Objects;
import work.lcod.config.error.NonStringifiableValueException;
import work.lcod.config.error.ReferenceNotFoundException;
import work.lcod.config.error.TemplateSyntaxException;
import work.lcod.config.filter.FilterRegistry;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.Scalars;
import work.lcod.config.value.StringValue;

/**
 * Evaluates the expressions of one node against a {@link ResolutionContext}.
 *
 * <p>A pure expression yields the filtered referenced value unchanged in type; otherwise every
 * expression is rendered to text and spliced into the surrounding literal text.
 */
public final class ExpressionRenderer {
    private final FilterRegistry filters;

    public ExpressionRenderer(FilterRegistry filters) {
        this.filters = Objects.requireNonNull(filters, "filters");
    }

    /**
     * Renders {@code node}, marks it resolved and publishes its value to {@code context}.
     */
    public ConfigValue resolve(DependencyNode node, ResolutionContext context) {
        var value = render(node, context);
        node.markResolved(value);
        context.record(node.path(), value);
        return value;
    }

    public ConfigValue render(DependencyNode node, ResolutionContext context) {
        var expressions = node.expressions();
        if (expressions.size() == 1 && expressions.get(0).pure()) {
            return evaluate(node, expressions.get(0), context);
        }
        var raw = node.raw();
        var out = new StringBuilder(raw.length());
        int cursor = 0;
        for (var expression : expressions) {
            out.append(raw, cursor, expression.start());
            var value = evaluate(node, expression, context);
            var text = Scalars.text(value)
                .orElseThrow(() -> new NonStringifiableValueException(node.path(), expression.rawText(), value.typeName()));
            out.append(text);
            cursor = expression.end();
        }
        out.append(raw, cursor, raw.length());
        return new StringValue(out.toString());
    }

    private ConfigValue evaluate(DependencyNode node, ReferenceExpression expression, ResolutionContext context) {
        var value = context.lookup(expression.reference())
            .orElseThrow(() -> new ReferenceNotFoundException(expression.reference(), node.path()));
        for (var call : expression.filters()) {
            var entry = filters.get(call.name())
                .orElseThrow(() -> new TemplateSyntaxException(node.path(), expression.rawText(), "unknown filter '" + call.name() + "'"));
            try {
                value = entry.filter().apply(value, call.arguments());
            } catch (IllegalArgumentException ex) {
                throw new TemplateSyntaxException(node.path(), expression.rawText(), ex.getMessage(), ex);
            }
            if (value == null) {
                throw new IllegalStateException("Filter '" + call.name() + "' returned no value");
            }
        }
        return value;
    }
}
