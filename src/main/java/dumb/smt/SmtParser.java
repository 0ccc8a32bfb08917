package dumb.smt;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent reader for SMT-LIB S-expressions.
 * <p>
 * The parser reads one expression at a time from a fixed source string and
 * remembers where it stopped, so a caller can resume from {@link #position()}.
 * Atoms are returned as views into the source.
 */
public class SmtParser {
    private static final int CONTEXT_SIZE = 50;

    private final String data;
    private final boolean strict;
    private int pos;

    public SmtParser(String data) {
        this(data, 0, false);
    }

    /**
     * @param strict when set, a list still open at end of input is an error
     *               instead of being closed implicitly
     */
    public SmtParser(String data, int pos, boolean strict) {
        this.data = data;
        this.pos = pos;
        this.strict = strict;
    }

    public static boolean isWhitespace(int c) {
        return c == ' ' || c == '\n' || c == '\t' || c == '\r';
    }

    /** Every top-level expression of {@code text}, in order. */
    public static List<Term> parseAll(String text) throws ParseException {
        var parser = new SmtParser(text);
        var terms = new ArrayList<Term>();
        while (parser.hasMore())
            terms.add(parser.parseExpression());
        return terms;
    }

    /**
     * Drops {@code ;} line comments together with their terminating newline.
     * Runs over the whole input before parsing; a {@code ;} inside a quoted
     * symbol is treated as a comment too.
     */
    public static String removeComments(String input) {
        var result = new StringBuilder(input.length());
        var n = input.length();
        var i = 0;
        while (i < n) {
            var c = input.charAt(i);
            if (c == ';') {
                while (i < n && input.charAt(i) != '\n') i++;
                if (i < n) i++;
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    public Term parseExpression() throws ParseException {
        skipWhitespace();
        if (token() == '(') {
            var listStart = pos;
            advance();
            var terms = new ArrayList<Term>();
            while (token() != 0 && token() != ')') {
                terms.add(parseExpression());
                skipWhitespace();
            }
            if (token() == ')')
                advance();
            else if (strict)
                throw parseException("Unterminated list opened at offset " + listStart + ", found EOF");
            return new Term.Lst(terms);
        }
        return parseToken();
    }

    /** True while anything other than whitespace is left. */
    public boolean hasMore() {
        for (var i = pos; i < data.length(); i++)
            if (!isWhitespace(data.charAt(i))) return true;
        return false;
    }

    public int position() {
        return pos;
    }

    public String remainingInput() {
        return data.substring(pos);
    }

    private Term.Atom parseToken() {
        skipWhitespace();
        var start = pos;
        if (token() == ')') {
            // unmatched close paren: yields an empty atom and is skipped so parsing moves on
            advance();
            return new Term.Atom(data, start, start);
        }
        var isPipe = token() == '|';
        while (pos < data.length()) {
            var c = token();
            if (isPipe && pos > start && c == '|') {
                advance();
                break;
            } else if (!isPipe && (isWhitespace(c) || c == '(' || c == ')'))
                break;
            advance();
        }
        return new Term.Atom(data, start, pos);
    }

    private void skipWhitespace() {
        while (isWhitespace(token()))
            advance();
    }

    private char token() {
        return pos < data.length() ? data.charAt(pos) : 0;
    }

    private void advance() {
        pos++;
    }

    private ParseException parseException(String message) {
        var line = 1;
        var col = 0;
        for (var i = 0; i < pos && i < data.length(); i++) {
            if (data.charAt(i) == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        var context = data.substring(Math.max(0, pos - CONTEXT_SIZE), Math.min(pos, data.length()));
        return new ParseException(message, line, col, context);
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
