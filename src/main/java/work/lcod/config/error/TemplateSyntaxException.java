package work.lcod.config.error;

import work.lcod.config.runtime.LeafPath;

/**
 * Malformed expression, unterminated delimiter, unknown filter or bad filter arguments.
 */
public final class TemplateSyntaxException extends ResolutionException {
    private final LeafPath path;
    private final String expression;
    private final String detail;

    public TemplateSyntaxException(LeafPath path, String expression, String detail) {
        this(path, expression, detail, null);
    }

    public TemplateSyntaxException(LeafPath path, String expression, String detail, Throwable cause) {
        super("template_syntax", format(path, expression, detail), cause);
        this.path = path;
        this.expression = expression;
        this.detail = detail;
    }

    /**
     * Leaf the expression was found in; {@code null} when raised outside of a document walk.
     */
    public LeafPath path() {
        return path;
    }

    public String expression() {
        return expression;
    }

    public String detail() {
        return detail;
    }

    private static String format(LeafPath path, String expression, String detail) {
        var location = path == null ? "" : " at '" + path + "'";
        return "Invalid template syntax" + location + ": " + detail + " in '" + expression + "'";
    }
}
