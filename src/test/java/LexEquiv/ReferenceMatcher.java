package LexEquiv;

import LexEquiv.Pattern.Pattern;

import java.util.BitSet;

/**
 * Direct interpretation of a pattern tree on one input, independent of any automaton: each node maps the set of
 * positions it may start at to the set of positions it may end at.
 */
public class ReferenceMatcher {
    private final String input;

    private ReferenceMatcher(String input) {
        this.input = input;
    }

    public static boolean matches(Pattern pattern, String input) {
        BitSet start = new BitSet();
        start.set(0);
        return new ReferenceMatcher(input).ends(pattern, start).get(input.length());
    }

    private BitSet ends(Pattern pattern, BitSet starts) {
        return pattern.accept(new Pattern.Visitor<BitSet>() {
            @Override
            public BitSet visitLiteral(Pattern.Literal literal) {
                BitSet curr = starts;
                for (Pattern.CharClass position : literal.positions()) {
                    curr = step(position, curr);
                }
                return curr;
            }

            @Override
            public BitSet visitCharClass(Pattern.CharClass charClass) {
                return step(charClass, starts);
            }

            @Override
            public BitSet visitConcat(Pattern.Concat concat) {
                return ends(concat.right(), ends(concat.left(), starts));
            }

            @Override
            public BitSet visitUnion(Pattern.Union union) {
                BitSet result = new BitSet();
                for (Pattern child : union.children()) {
                    result.or(ends(child, starts));
                }
                return result;
            }

            @Override
            public BitSet visitOptional(Pattern.Optional optional) {
                BitSet result = ends(optional.child(), starts);
                result.or(starts);
                return result;
            }

            @Override
            public BitSet visitRepeat(Pattern.Repeat repeat) {
                BitSet curr = starts;
                for (int i = 0; i < repeat.min(); i++) {
                    curr = ends(repeat.child(), curr);
                }
                BitSet result = (BitSet) curr.clone();
                for (int i = repeat.min(); i < repeat.max(); i++) {
                    curr = ends(repeat.child(), curr);
                    result.or(curr);
                }
                return result;
            }
        });
    }

    private BitSet step(Pattern.CharClass charClass, BitSet starts) {
        BitSet result = new BitSet();
        for (int i = starts.nextSetBit(0); i >= 0 && i < input.length(); i = starts.nextSetBit(i + 1)) {
            if (charClass.matches(input.charAt(i))) {
                result.set(i + 1);
            }
        }
        return result;
    }
}
