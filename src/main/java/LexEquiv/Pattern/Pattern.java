package LexEquiv.Pattern;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Immutable pattern tree of one lexer rule block.
 * <p>
 * The variants are closed; consumers dispatch through {@link Visitor} so that adding a node kind is a compile-time
 * checked change for every pass over the tree.
 */
public sealed interface Pattern
        permits Pattern.Literal, Pattern.CharClass, Pattern.Concat, Pattern.Union, Pattern.Optional, Pattern.Repeat {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLiteral(Literal literal);

        R visitCharClass(CharClass charClass);

        R visitConcat(Concat concat);

        R visitUnion(Union union);

        R visitOptional(Optional optional);

        R visitRepeat(Repeat repeat);
    }

    /**
     * Fixed-length concatenation of single-position matchers. An empty position list matches the empty string.
     */
    record Literal(List<CharClass> positions) implements Pattern {
        public Literal {
            positions = List.copyOf(positions);
        }

        public static Literal of(String text) {
            List<CharClass> positions = new ArrayList<>(text.length());
            for (int i = 0; i < text.length(); i++) {
                positions.add(CharClass.singleton(text.charAt(i)));
            }
            return new Literal(positions);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("\"");
            for (CharClass c : positions) {
                sb.append(c.chars().cardinality() == 1 && !c.negated() ? Character.toString(c.chars().nextSetBit(0)) : c);
            }
            return sb.append('"').toString();
        }
    }

    /**
     * Matches one character: a member of {@code chars}, or any character outside it if {@code negated}.
     */
    record CharClass(BitSet chars, boolean negated) implements Pattern {
        public CharClass {
            chars = (BitSet) chars.clone();
        }

        public static CharClass singleton(int c) {
            BitSet b = new BitSet();
            b.set(c);
            return new CharClass(b, false);
        }

        public static CharClass wildcard() {
            return new CharClass(new BitSet(), true);
        }

        public boolean isWildcard() {
            return negated && chars.isEmpty();
        }

        public boolean matches(int c) {
            return chars.get(c) != negated;
        }

        @Override
        public BitSet chars() {
            return (BitSet) chars.clone();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCharClass(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("[");
            if (negated) {
                sb.append('^');
            }
            for (int c = chars.nextSetBit(0); c >= 0; c = chars.nextSetBit(c + 1)) {
                int end = chars.nextClearBit(c) - 1;
                sb.append(printable(c));
                if (end > c) {
                    sb.append('-').append(printable(end));
                }
                c = end;
            }
            return sb.append(']').toString();
        }

        private static String printable(int c) {
            return c >= 0x20 && c < 0x7F ? Character.toString(c) : String.format("\\x%02X", c);
        }
    }

    record Concat(Pattern left, Pattern right) implements Pattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConcat(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + right + ")";
        }
    }

    /**
     * Alternatives in source order. The order carries no meaning for the recognized language.
     */
    record Union(List<Pattern> children) implements Pattern {
        public Union {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnion(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(" | ");
                }
                sb.append(children.get(i));
            }
            return sb.append(')').toString();
        }
    }

    record Optional(Pattern child) implements Pattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOptional(this);
        }

        @Override
        public String toString() {
            return child + "?";
        }
    }

    /**
     * Bounded repetition, {@code min..max} inclusive. Bounds are checked when the repetition is expanded or compiled,
     * not here, so that hand-built trees reach the automaton builder's own validation.
     */
    record Repeat(Pattern child, int min, int max) implements Pattern {

        /**
         * Rewrites this repetition as {@code child^min} followed by {@code max - min} nested optional copies,
         * {@code (child (child ...)?)?}, so any count between the bounds is accepted.
         *
         * @return an equivalent tree without a top-level {@code Repeat}
         * @throws IllegalArgumentException if {@code min < 0} or {@code min > max}
         */
        public Pattern expand() {
            if (min < 0 || min > max) {
                throw new IllegalArgumentException("Invalid repetition bounds {" + min + "," + max + "}");
            }
            Pattern tail = null;
            for (int i = min; i < max; i++) {
                tail = new Optional(tail == null ? child : new Concat(child, tail));
            }
            Pattern head = null;
            for (int i = 0; i < min; i++) {
                head = head == null ? child : new Concat(head, child);
            }
            if (head == null) {
                return tail == null ? new Literal(List.of()) : tail;
            }
            return tail == null ? head : new Concat(head, tail);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }

        @Override
        public String toString() {
            return child + "{" + min + "," + max + "}";
        }
    }
}
