package work.lcod.config.runtime;

import java.util.List;
import java.util.Objects;

/**
 * A delimited expression found inside a string leaf.
 *
 * @param rawText   text between (and including) the delimiters, as written
 * @param reference referenced path, without the {@code values.} namespace
 * @param filters   filter pipeline, applied left to right
 * @param start     offset of the open delimiter in the leaf
 * @param end       offset just past the close delimiter
 * @param pure      whether the expression is the whole (trimmed) leaf
 */
public record ReferenceExpression(
    String rawText,
    LeafPath reference,
    List<FilterCall> filters,
    int start,
    int end,
    boolean pure
) {
    public ReferenceExpression {
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(reference, "reference");
        filters = List.copyOf(filters);
    }
}
