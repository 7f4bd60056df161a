package work.lcod.config.runtime;

import java.util.Objects;

/**
 * Open/close markers around reference expressions.
 */
public record Delimiters(String open, String close) {
    public static final Delimiters DEFAULT = new Delimiters("{{", "}}");

    public Delimiters {
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(close, "close");
        if (open.isBlank() || close.isBlank()) {
            throw new IllegalArgumentException("Delimiters must not be blank");
        }
        if (open.equals(close)) {
            throw new IllegalArgumentException("Open and close delimiters must differ: " + open);
        }
    }
}
