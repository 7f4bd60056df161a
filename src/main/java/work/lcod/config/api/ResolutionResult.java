package work.lcod.config.api;

import java.util.Objects;
import work.lcod.config.value.ConfigValue;

/**
 * Outcome of {@link ConfigResolver#resolve(ConfigValue)}: the fully resolved document and how it was computed.
 */
public record ResolutionResult(ConfigValue tree, ResolutionDiagnostics diagnostics, boolean resolutionEnabled) {
    public ResolutionResult {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(diagnostics, "diagnostics");
    }

    static ResolutionResult passThrough(ConfigValue tree) {
        return new ResolutionResult(tree, ResolutionDiagnostics.EMPTY, false);
    }

    static ResolutionResult resolved(ConfigValue tree, ResolutionDiagnostics diagnostics) {
        return new ResolutionResult(tree, diagnostics, true);
    }
}
