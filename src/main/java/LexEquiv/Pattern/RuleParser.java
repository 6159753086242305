package LexEquiv.Pattern;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Recursive-descent parser for re2c-style rule blocks.
 * <p>
 * A block is a list of rules, each a pattern followed by an action body. Action bodies are skipped without
 * interpretation; only the pattern text contributes to the block's language. Supported pattern syntax:
 * <ul>
 *     <li>{@code "text"}: literal, {@code ""} is the empty string</li>
 *     <li>{@code [a-z_]}, {@code [^...]}: character classes, {@code [^]} is any character</li>
 *     <li>{@code .}: any character except newline</li>
 *     <li>{@code p?}, {@code p{m,n}}, {@code p{n}}: optional and bounded repetition</li>
 *     <li>{@code p q}, {@code p | q}, {@code ( p )}: concatenation, alternation, grouping</li>
 * </ul>
 * An opening brace directly followed by a digit is a repetition; any other opening brace starts an action.
 */
public final class RuleParser {
    private static final int EOF = -1;

    private final String text;
    private int pos;

    private RuleParser(String text) {
        this.text = text;
        this.pos = 0;
    }

    /**
     * Parses a rule block into the union of its rules' patterns.
     *
     * @param blockText raw text of one rule block
     * @return a {@link Pattern.Union} with one child per rule, in source order
     * @throws RuleSyntaxException if the block is malformed or contains no rule
     */
    public static Pattern compileBlock(String blockText) throws RuleSyntaxException {
        return new Pattern.Union(parseRules(blockText));
    }

    /**
     * Parses a rule block into its individual rule patterns.
     */
    public static List<Pattern> parseRules(String blockText) throws RuleSyntaxException {
        return new RuleParser(blockText).block();
    }

    private List<Pattern> block() throws RuleSyntaxException {
        List<Pattern> rules = new ArrayList<>();
        skipBlanks();
        while (peek() != EOF) {
            rules.add(rule());
            skipBlanks();
        }
        if (rules.isEmpty()) {
            throw error("Empty rule list", 0);
        }
        return rules;
    }

    private Pattern rule() throws RuleSyntaxException {
        Pattern pattern = alternation();
        skipBlanks();
        int c = peek();
        if (c == '{') {
            skipAction();
        } else if (c == ':' && peek(1) == '=') {
            skipLineAction();
        } else if (c == ')') {
            throw error("Unbalanced ')'", pos);
        } else if (c != EOF) {
            throw error("Unexpected character '" + (char) c + "'", pos);
        }
        return pattern;
    }

    private Pattern alternation() throws RuleSyntaxException {
        List<Pattern> branches = new ArrayList<>();
        branches.add(sequence());
        while (peek() == '|') {
            pos++;
            branches.add(sequence());
        }
        return branches.size() == 1 ? branches.get(0) : new Pattern.Union(branches);
    }

    private Pattern sequence() throws RuleSyntaxException {
        Pattern result = null;
        int start = pos;
        while (true) {
            skipBlanks();
            int c = peek();
            if (c == '"' || c == '[' || c == '.' || c == '(') {
                Pattern atom = quantified(atom());
                result = result == null ? atom : new Pattern.Concat(result, atom);
            } else if (c == '?' || c == '*' || c == '+' || (c == '{' && isDigit(peek(1)))) {
                throw error("Quantifier without a preceding atom", pos);
            } else {
                break;
            }
        }
        if (result == null) {
            throw error("Empty alternative", peek() == EOF ? start : pos);
        }
        return result;
    }

    private Pattern atom() throws RuleSyntaxException {
        int c = peek();
        switch (c) {
            case '"':
                return literal();
            case '[':
                return charClass();
            case '.':
                pos++;
                BitSet newline = new BitSet();
                newline.set('\n');
                return new Pattern.CharClass(newline, true);
            case '(':
                int open = pos++;
                Pattern inner = alternation();
                skipBlanks();
                if (peek() != ')') {
                    throw error("Unterminated group", open);
                }
                pos++;
                return inner;
            default:
                throw new IllegalStateException("Not an atom start: " + (char) c);
        }
    }

    private Pattern quantified(Pattern atom) throws RuleSyntaxException {
        Pattern result = atom;
        while (true) {
            skipBlanks();
            int c = peek();
            if (c == '?') {
                pos++;
                result = new Pattern.Optional(result);
            } else if (c == '{' && isDigit(peek(1))) {
                result = repetition(result);
            } else if (c == '*' || c == '+') {
                throw error("Unbounded repetition '" + (char) c + "' is not supported", pos);
            } else {
                return result;
            }
        }
    }

    private Pattern repetition(Pattern child) throws RuleSyntaxException {
        int open = pos++;
        int min = number();
        int max;
        skipSpaces();
        if (peek() == ',') {
            pos++;
            skipSpaces();
            if (peek() == '}') {
                throw error("Unbounded repetition '{" + min + ",}' is not supported", open);
            }
            if (!isDigit(peek())) {
                throw error("Malformed repetition bounds", pos);
            }
            max = number();
            skipSpaces();
        } else {
            max = min;
        }
        if (peek() != '}') {
            throw error(peek() == EOF ? "Unterminated repetition" : "Malformed repetition bounds",
                        peek() == EOF ? open : pos);
        }
        pos++;
        if (min > max) {
            throw error("Repetition lower bound " + min + " exceeds upper bound " + max, open);
        }
        return new Pattern.Repeat(child, min, max);
    }

    private int number() throws RuleSyntaxException {
        int start = pos;
        long value = 0;
        while (isDigit(peek())) {
            value = value * 10 + (next() - '0');
            if (value > Integer.MAX_VALUE) {
                throw error("Repetition bound too large", start);
            }
        }
        return (int) value;
    }

    private Pattern literal() throws RuleSyntaxException {
        int open = pos++;
        List<Pattern.CharClass> positions = new ArrayList<>();
        while (true) {
            int c = peek();
            if (c == EOF || c == '\n') {
                throw error("Unterminated literal", open);
            }
            pos++;
            if (c == '"') {
                return new Pattern.Literal(positions);
            }
            positions.add(Pattern.CharClass.singleton(c == '\\' ? escape(open) : c));
        }
    }

    private Pattern charClass() throws RuleSyntaxException {
        int open = pos++;
        boolean negated = false;
        if (peek() == '^') {
            negated = true;
            pos++;
        }
        BitSet chars = new BitSet();
        while (true) {
            int c = peek();
            if (c == EOF || c == '\n') {
                throw error("Unterminated character class", open);
            }
            if (c == ']') {
                pos++;
                return new Pattern.CharClass(chars, negated);
            }
            int rangeStart = pos;
            int lo = classChar(open);
            if (peek() == '-' && peek(1) != ']' && peek(1) != EOF) {
                pos++;
                int hi = classChar(open);
                if (lo > hi) {
                    throw error("Invalid range", rangeStart);
                }
                chars.set(lo, hi + 1);
            } else {
                chars.set(lo);
            }
        }
    }

    private int classChar(int open) throws RuleSyntaxException {
        int c = next();
        if (c == EOF || c == '\n') {
            throw error("Unterminated character class", open);
        }
        return c == '\\' ? escape(open) : c;
    }

    /**
     * Decodes the escape sequence after a consumed backslash.
     */
    private int escape(int open) throws RuleSyntaxException {
        int start = pos - 1;
        int c = next();
        switch (c) {
            case EOF:
                throw error("Unterminated escape sequence", open);
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case 'f':
                return '\f';
            case 'v':
                return 0x0B;
            case 'a':
                return 0x07;
            case 'b':
                return '\b';
            case 'x':
                return hex(2, start);
            case 'u':
                return hex(4, start);
            default:
                if (c >= '0' && c <= '7') {
                    int value = c - '0';
                    for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
                        value = value * 8 + (next() - '0');
                    }
                    return value;
                }
                return c;
        }
    }

    private int hex(int digits, int start) throws RuleSyntaxException {
        int value = 0;
        for (int i = 0; i < digits; i++) {
            int d = Character.digit(peek(), 16);
            if (peek() == EOF || d < 0) {
                throw error("Malformed hexadecimal escape", start);
            }
            pos++;
            value = value * 16 + d;
        }
        return value;
    }

    /**
     * Skips a brace-delimited action body. Nested braces, C string and character literals and comments inside
     * the body are honored so that a quoted brace does not end the action early.
     */
    private void skipAction() throws RuleSyntaxException {
        int open = pos++;
        int depth = 1;
        while (depth > 0) {
            int c = next();
            switch (c) {
                case EOF:
                    throw error("Unterminated action body", open);
                case '{':
                    depth++;
                    break;
                case '}':
                    depth--;
                    break;
                case '"':
                case '\'':
                    skipQuoted(c, open);
                    break;
                case '/':
                    if (peek() == '/' || peek() == '*') {
                        pos--;
                        if (!skipComment()) {
                            throw error("Unterminated action body", open);
                        }
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private void skipQuoted(int quote, int open) throws RuleSyntaxException {
        while (true) {
            int c = next();
            if (c == EOF) {
                throw error("Unterminated action body", open);
            }
            if (c == '\\') {
                next();
            } else if (c == quote) {
                return;
            }
        }
    }

    private void skipLineAction() {
        while (peek() != EOF && peek() != '\n') {
            pos++;
        }
    }

    private void skipSpaces() {
        while (peek() == ' ' || peek() == '\t') {
            pos++;
        }
    }

    /**
     * Skips whitespace and comments.
     */
    private void skipBlanks() throws RuleSyntaxException {
        while (true) {
            int c = peek();
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && (peek(1) == '/' || peek(1) == '*')) {
                int start = pos;
                if (!skipComment()) {
                    throw error("Unterminated comment", start);
                }
            } else {
                return;
            }
        }
    }

    /**
     * Skips a comment starting at the current position.
     *
     * @return false if a block comment runs to the end of the text
     */
    private boolean skipComment() {
        if (peek(1) == '/') {
            skipLineAction();
            return true;
        }
        int end = text.indexOf("*/", pos + 2);
        if (end < 0) {
            pos = text.length();
            return false;
        }
        pos = end + 2;
        return true;
    }

    private int peek() {
        return peek(0);
    }

    private int peek(int ahead) {
        int i = pos + ahead;
        return i < text.length() ? text.charAt(i) : EOF;
    }

    private int next() {
        int c = peek();
        if (c != EOF) {
            pos++;
        }
        return c;
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private RuleSyntaxException error(String description, int index) {
        return new RuleSyntaxException(description, text, index);
    }
}
