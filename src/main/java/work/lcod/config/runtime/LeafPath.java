package work.lcod.config.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Dotted address of one value in a configuration tree ({@code services.api.name}, {@code items.0}).
 * List elements are addressed by their numeric index.
 *
 * <p>Paths sort segment by segment, a path before everything below it, so the descendants of a path
 * form one contiguous range in a sorted collection.
 */
public record LeafPath(List<String> segments) implements Comparable<LeafPath> {
    public static final LeafPath ROOT = new LeafPath(List.of());
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_-]+");

    public LeafPath {
        segments = List.copyOf(segments);
    }

    /**
     * Parses a dotted path; every segment must be made of letters, digits, {@code _} or {@code -}.
     *
     * @throws IllegalArgumentException on empty or malformed segments
     */
    public static LeafPath parse(String dotted) {
        Objects.requireNonNull(dotted, "dotted");
        if (dotted.isEmpty()) {
            throw new IllegalArgumentException("Path is empty");
        }
        var parts = dotted.split("\\.", -1);
        for (var part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                throw new IllegalArgumentException("Invalid path segment '" + part + "' in '" + dotted + "'");
            }
        }
        return new LeafPath(List.of(parts));
    }

    public static LeafPath of(String... segments) {
        return new LeafPath(List.of(segments));
    }

    public LeafPath child(String segment) {
        var next = new ArrayList<String>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new LeafPath(next);
    }

    public LeafPath child(int index) {
        return child(Integer.toString(index));
    }

    public LeafPath prefix(int length) {
        return new LeafPath(segments.subList(0, length));
    }

    public int length() {
        return segments.size();
    }

    /**
     * True when {@code other} equals this path or lies below it.
     */
    public boolean contains(LeafPath other) {
        return other.segments.size() >= segments.size()
            && other.segments.subList(0, segments.size()).equals(segments);
    }

    @Override
    public int compareTo(LeafPath other) {
        int shared = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < shared; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
