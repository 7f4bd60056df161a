package work.lcod.config.error;

import work.lcod.config.runtime.LeafPath;

public final class ReferenceNotFoundException extends ResolutionException {
    private final LeafPath reference;
    private final LeafPath referencedFrom;

    public ReferenceNotFoundException(LeafPath reference, LeafPath referencedFrom) {
        super(
            "reference_not_found",
            "Reference 'values." + reference + "' not found (referenced from '" + referencedFrom + "')"
        );
        this.reference = reference;
        this.referencedFrom = referencedFrom;
    }

    public LeafPath reference() {
        return reference;
    }

    public LeafPath referencedFrom() {
        return referencedFrom;
    }
}
