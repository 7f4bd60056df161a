package work.lcod.config.runtime;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.config.error.TemplateSyntaxException;
import work.lcod.config.value.BooleanValue;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.NullValue;
import work.lcod.config.value.NumberValue;
import work.lcod.config.value.StringValue;

/**
 * Lexical scan of a string leaf for {@code {{ values.path | filter(args) }}} expressions.
 * Performs no lookup and no filter dispatch.
 */
public final class ExpressionScanner {
    static final String NAMESPACE = "values";

    private final Delimiters delimiters;

    public ExpressionScanner(Delimiters delimiters) {
        this.delimiters = Objects.requireNonNull(delimiters, "delimiters");
    }

    /**
     * Returns the expressions of {@code text} in order of appearance; empty when the leaf holds none.
     *
     * @param path leaf being scanned, used in error reports
     * @throws TemplateSyntaxException on unmatched delimiters or a malformed expression body
     */
    public List<ReferenceExpression> scan(LeafPath path, String text) {
        var open = delimiters.open();
        var close = delimiters.close();
        var found = new ArrayList<ParsedBody>();
        int pos = 0;
        while (pos < text.length()) {
            int openIdx = text.indexOf(open, pos);
            int strayClose = text.indexOf(close, pos);
            if (strayClose >= 0 && (openIdx < 0 || strayClose < openIdx)) {
                throw new TemplateSyntaxException(path, text, "unmatched '" + close + "'");
            }
            if (openIdx < 0) {
                break;
            }
            int bodyStart = openIdx + open.length();
            int closeIdx = text.indexOf(close, bodyStart);
            if (closeIdx < 0) {
                throw new TemplateSyntaxException(path, text.substring(openIdx), "unterminated expression, missing '" + close + "'");
            }
            int nested = text.indexOf(open, bodyStart);
            if (nested >= 0 && nested < closeIdx) {
                throw new TemplateSyntaxException(path, text.substring(openIdx, closeIdx + close.length()), "nested '" + open + "'");
            }
            int end = closeIdx + close.length();
            var raw = text.substring(openIdx, end);
            found.add(new ParsedBody(raw, openIdx, end, new BodyParser(path, raw, text.substring(bodyStart, closeIdx)).parse()));
            pos = end;
        }

        boolean single = found.size() == 1;
        var expressions = new ArrayList<ReferenceExpression>(found.size());
        for (var body : found) {
            boolean pure = single && text.strip().equals(body.raw());
            expressions.add(new ReferenceExpression(body.raw(), body.parsed().reference(), body.parsed().filters(), body.start(), body.end(), pure));
        }
        return expressions;
    }

    private record ParsedBody(String raw, int start, int end, Body parsed) {}

    private record Body(LeafPath reference, List<FilterCall> filters) {}

    /**
     * Recursive-descent parser over the text between the delimiters.
     */
    private static final class BodyParser {
        private final LeafPath leaf;
        private final String raw;
        private final String body;
        private int pos;

        BodyParser(LeafPath leaf, String raw, String body) {
            this.leaf = leaf;
            this.raw = raw;
            this.body = body;
        }

        Body parse() {
            skipSpaces();
            if (atEnd()) {
                throw error("empty expression");
            }
            var reference = parsePath();
            var filters = new ArrayList<FilterCall>();
            skipSpaces();
            while (!atEnd()) {
                if (peek() != '|') {
                    throw error("unexpected '" + remainingToken() + "'");
                }
                pos++;
                skipSpaces();
                filters.add(parseFilter());
                skipSpaces();
            }
            return new Body(reference, filters);
        }

        private LeafPath parsePath() {
            var head = identifier("reference");
            if (!NAMESPACE.equals(head)) {
                throw error("references must start with '" + NAMESPACE + ".', found '" + head + "'");
            }
            var segments = new ArrayList<String>();
            while (!atEnd() && peek() == '.') {
                pos++;
                int start = pos;
                while (!atEnd() && isSegmentChar(peek())) {
                    pos++;
                }
                if (start == pos) {
                    throw error("empty path segment");
                }
                segments.add(body.substring(start, pos));
            }
            if (segments.isEmpty()) {
                throw error("missing path after '" + NAMESPACE + "'");
            }
            return new LeafPath(segments);
        }

        private FilterCall parseFilter() {
            var name = identifier("filter name");
            var arguments = new ArrayList<ConfigValue>();
            skipSpaces();
            if (!atEnd() && peek() == '(') {
                pos++;
                skipSpaces();
                if (!atEnd() && peek() == ')') {
                    pos++;
                    return new FilterCall(name, arguments);
                }
                while (true) {
                    skipSpaces();
                    arguments.add(parseLiteral());
                    skipSpaces();
                    if (atEnd()) {
                        throw error("unclosed argument list of filter '" + name + "'");
                    }
                    char c = body.charAt(pos++);
                    if (c == ')') {
                        break;
                    }
                    if (c != ',') {
                        throw error("expected ',' or ')' in arguments of filter '" + name + "'");
                    }
                }
            }
            return new FilterCall(name, arguments);
        }

        private ConfigValue parseLiteral() {
            if (atEnd()) {
                throw error("missing argument");
            }
            char c = peek();
            if (c == '\'' || c == '"') {
                return parseString(c);
            }
            if (c == '-' || Character.isDigit(c)) {
                return parseNumber();
            }
            var word = identifier("argument");
            switch (word) {
                case "true":
                case "True":
                    return BooleanValue.TRUE;
                case "false":
                case "False":
                    return BooleanValue.FALSE;
                case "null":
                case "none":
                case "None":
                    return NullValue.INSTANCE;
                default:
                    throw error("unsupported argument '" + word + "', only literals are allowed");
            }
        }

        private ConfigValue parseString(char quote) {
            pos++;
            var out = new StringBuilder();
            while (!atEnd()) {
                char c = body.charAt(pos++);
                if (c == '\\' && !atEnd()) {
                    out.append(body.charAt(pos++));
                } else if (c == quote) {
                    return new StringValue(out.toString());
                } else {
                    out.append(c);
                }
            }
            throw error("unterminated string literal");
        }

        private ConfigValue parseNumber() {
            int start = pos;
            if (peek() == '-') {
                pos++;
            }
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.' || peek() == 'e' || peek() == 'E')) {
                pos++;
            }
            var text = body.substring(start, pos);
            try {
                if (text.contains(".") || text.contains("e") || text.contains("E")) {
                    return new NumberValue(Double.parseDouble(text));
                }
                var big = new BigInteger(text);
                if (big.bitLength() < 32) {
                    return new NumberValue(big.intValue());
                }
                if (big.bitLength() < 64) {
                    return new NumberValue(big.longValue());
                }
                return new NumberValue(big);
            } catch (NumberFormatException ex) {
                throw new TemplateSyntaxException(leaf, raw, "malformed number '" + text + "'", ex);
            }
        }

        private String identifier(String what) {
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                pos++;
            }
            if (start == pos) {
                throw error("expected " + what + (atEnd() ? "" : " at '" + remainingToken() + "'"));
            }
            return body.substring(start, pos);
        }

        private String remainingToken() {
            int end = pos;
            while (end < body.length() && !Character.isWhitespace(body.charAt(end))) {
                end++;
            }
            return end == pos ? String.valueOf(body.charAt(pos)) : body.substring(pos, end);
        }

        private static boolean isSegmentChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-';
        }

        private void skipSpaces() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        private char peek() {
            return body.charAt(pos);
        }

        private boolean atEnd() {
            return pos >= body.length();
        }

        private TemplateSyntaxException error(String detail) {
            return new TemplateSyntaxException(leaf, raw, detail);
        }
    }
}
