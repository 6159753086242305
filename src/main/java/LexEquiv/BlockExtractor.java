package LexEquiv;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a source file into its re2c rule blocks: the bodies of {@code !re2c} comments, including the
 * {@code !rules:re2c}, {@code !local:re2c} and {@code !use:re2c} variants. Configuration lines such as
 * {@code re2c:define:YYCTYPE = char;} are removed from each body.
 */
public class BlockExtractor {
    private static final Pattern BLOCK_START = Pattern.compile("/\\*!(?:[a-z]+:)?re2c(?::[\\w:]*)?");
    private static final Pattern CONFIGURATION = Pattern.compile("(?m)^[ \\t]*re2c:[^;\\n]*;[ \\t]*$");

    private BlockExtractor() {}

    /**
     * @return the rule blocks in order of appearance
     * @throws IllegalArgumentException if a block is not closed
     */
    public static List<String> extract(String source) {
        final List<String> blocks = new ArrayList<>();
        final Matcher m = BLOCK_START.matcher(source);
        int from = 0;
        while (m.find(from)) {
            final int end = source.indexOf("*/", m.end());
            if (end < 0) {
                throw new IllegalArgumentException("Unterminated re2c block starting at index " + m.start());
            }
            blocks.add(CONFIGURATION.matcher(source.substring(m.end(), end)).replaceAll(""));
            from = end + 2;
        }
        return blocks;
    }
}
