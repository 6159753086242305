package LexEquiv;

import LexEquiv.Pattern.Pattern;
import net.automatalib.common.util.random.RandomUtil;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

/**
 * Random pattern trees over the letters {@code a}, {@code b} and {@code c}. Negated classes also match any other
 * character, so inputs should include at least one letter outside that set.
 */
public class RandomPatterns {
    private static final String LETTERS = "abc";
    private static final int MAX_REPEAT_SPAN = 2;

    private RandomPatterns() {}

    /**
     * @param r
     *      random instance
     * @param depth
     *      maximal nesting of non-leaf nodes
     * @return
     *      a pattern tree; bounded repetitions are always well-formed
     */
    public static Pattern generate(Random r, int depth) {
        if (depth == 0 || r.nextInt(4) == 0) {
            return r.nextBoolean() ? literal(r) : charClass(r);
        }
        switch (r.nextInt(4)) {
            case 0:
                return new Pattern.Concat(generate(r, depth - 1), generate(r, depth - 1));
            case 1:
                List<Pattern> children = new ArrayList<>();
                int n = 2 + r.nextInt(2);
                for (int i = 0; i < n; i++) {
                    children.add(generate(r, depth - 1));
                }
                return new Pattern.Union(children);
            case 2:
                return new Pattern.Optional(generate(r, depth - 1));
            default:
                int min = r.nextInt(3);
                return new Pattern.Repeat(generate(r, depth - 1), min, min + r.nextInt(MAX_REPEAT_SPAN + 1));
        }
    }

    private static Pattern literal(Random r) {
        StringBuilder sb = new StringBuilder();
        int length = r.nextInt(3);
        for (int i = 0; i < length; i++) {
            sb.append(LETTERS.charAt(r.nextInt(LETTERS.length())));
        }
        return Pattern.Literal.of(sb.toString());
    }

    private static Pattern charClass(Random r) {
        BitSet chars = new BitSet();
        for (int i : RandomUtil.distinctIntegers(r, r.nextInt(LETTERS.length()), 0, LETTERS.length())) {
            chars.set(LETTERS.charAt(i));
        }
        return new Pattern.CharClass(chars, r.nextInt(3) == 0);
    }
}
