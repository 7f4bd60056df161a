package work.lcod.config.api;

import java.util.Objects;
import work.lcod.config.filter.FilterRegistry;
import work.lcod.config.runtime.Delimiters;

/**
 * Immutable configuration of a {@link ConfigResolver}.
 *
 * @param maxDepth   longest dependency chain allowed (default 10)
 * @param delimiters expression markers (default {@code {{ }}})
 * @param enabled    when false the resolver returns documents untouched
 * @param filters    filters expressions may use (default {@link FilterRegistry#standard()})
 */
public record ResolverOptions(int maxDepth, Delimiters delimiters, boolean enabled, FilterRegistry filters) {
    public static final int DEFAULT_MAX_DEPTH = 10;

    public ResolverOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        Objects.requireNonNull(delimiters, "delimiters");
        Objects.requireNonNull(filters, "filters");
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Delimiters delimiters = Delimiters.DEFAULT;
        private boolean enabled = true;
        private FilterRegistry filters;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder delimiters(Delimiters delimiters) {
            this.delimiters = delimiters;
            return this;
        }

        public Builder delimiters(String open, String close) {
            this.delimiters = new Delimiters(open, close);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder filters(FilterRegistry filters) {
            this.filters = filters;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(
                maxDepth,
                delimiters,
                enabled,
                filters == null ? FilterRegistry.standard() : filters
            );
        }
    }
}
