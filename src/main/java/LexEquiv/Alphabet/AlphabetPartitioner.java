package LexEquiv.Alphabet;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;

import LexEquiv.Pattern.Pattern;

/**
 * Computes the joint {@link AlphabetPartition} of several pattern trees.
 * <p>
 * Every character that occurs in a literal or in an explicit class (negated or not) is a boundary character. No
 * node can distinguish two characters that are both absent from every literal and class, so all of them share the
 * catch-all class.
 */
public final class AlphabetPartitioner implements Pattern.Visitor<Void> {
    private final BitSet boundary = new BitSet();

    private AlphabetPartitioner() {}

    public static AlphabetPartition partition(CharUniverse universe, Pattern... trees) {
        return partition(universe, Arrays.asList(trees));
    }

    /**
     * @throws AlphabetException if a tree mentions a character outside {@code universe}
     */
    public static AlphabetPartition partition(CharUniverse universe, Collection<? extends Pattern> trees) {
        final AlphabetPartitioner collector = new AlphabetPartitioner();
        for (Pattern tree : trees) {
            tree.accept(collector);
        }
        final int outside = collector.boundary.nextSetBit(universe.size());
        if (outside >= 0) {
            throw new AlphabetException("Pattern character " + AlphabetPartition.describe(outside)
                                        + " is outside the " + universe + " universe");
        }
        return new AlphabetPartition(universe, collector.boundary);
    }

    @Override
    public Void visitLiteral(Pattern.Literal literal) {
        for (Pattern.CharClass position : literal.positions()) {
            visitCharClass(position);
        }
        return null;
    }

    @Override
    public Void visitCharClass(Pattern.CharClass charClass) {
        boundary.or(charClass.chars());
        return null;
    }

    @Override
    public Void visitConcat(Pattern.Concat concat) {
        concat.left().accept(this);
        concat.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnion(Pattern.Union union) {
        for (Pattern child : union.children()) {
            child.accept(this);
        }
        return null;
    }

    @Override
    public Void visitOptional(Pattern.Optional optional) {
        optional.child().accept(this);
        return null;
    }

    @Override
    public Void visitRepeat(Pattern.Repeat repeat) {
        repeat.child().accept(this);
        return null;
    }
}
