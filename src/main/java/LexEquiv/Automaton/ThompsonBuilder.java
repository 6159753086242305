package LexEquiv.Automaton;

import LexEquiv.Alphabet.AlphabetPartition;
import LexEquiv.Pattern.Pattern;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Structural (Thompson) construction of an {@link EpsilonNFA} from a pattern tree. Every sub-pattern compiles to a
 * fragment with one entry and one exit state; the exit of the root fragment is the only accepting state.
 */
public final class ThompsonBuilder implements Pattern.Visitor<ThompsonBuilder.Fragment> {
    private final AlphabetPartition partition;
    private final EpsilonNFA nfa;

    private ThompsonBuilder(AlphabetPartition partition) {
        this.partition = partition;
        this.nfa = new EpsilonNFA(partition.size());
    }

    /**
     * @throws ConstructionException if the tree holds repetition bounds the parser would have rejected
     */
    public static EpsilonNFA build(Pattern pattern, AlphabetPartition partition) {
        final ThompsonBuilder builder = new ThompsonBuilder(partition);
        final Fragment root = pattern.accept(builder);
        builder.nfa.setInitial(root.entry());
        builder.nfa.setAccepting(root.exit(), true);
        return builder.nfa;
    }

    record Fragment(int entry, int exit) { }

    @Override
    public Fragment visitLiteral(Pattern.Literal literal) {
        final int entry = nfa.addState();
        int current = entry;
        for (Pattern.CharClass position : literal.positions()) {
            final int next = nfa.addState();
            addClassTransitions(current, position, next);
            current = next;
        }
        return new Fragment(entry, current);
    }

    @Override
    public Fragment visitCharClass(Pattern.CharClass charClass) {
        final int entry = nfa.addState();
        final int exit = nfa.addState();
        addClassTransitions(entry, charClass, exit);
        return new Fragment(entry, exit);
    }

    @Override
    public Fragment visitConcat(Pattern.Concat concat) {
        final Fragment left = concat.left().accept(this);
        final Fragment right = concat.right().accept(this);
        nfa.addEpsilon(left.exit(), right.entry());
        return new Fragment(left.entry(), right.exit());
    }

    @Override
    public Fragment visitUnion(Pattern.Union union) {
        final int entry = nfa.addState();
        final int exit = nfa.addState();
        for (Pattern child : union.children()) {
            final Fragment f = child.accept(this);
            nfa.addEpsilon(entry, f.entry());
            nfa.addEpsilon(f.exit(), exit);
        }
        return new Fragment(entry, exit);
    }

    @Override
    public Fragment visitOptional(Pattern.Optional optional) {
        final int entry = nfa.addState();
        final int exit = nfa.addState();
        final Fragment f = optional.child().accept(this);
        nfa.addEpsilon(entry, f.entry());
        nfa.addEpsilon(f.exit(), exit);
        nfa.addEpsilon(entry, exit); // bypass
        return new Fragment(entry, exit);
    }

    @Override
    public Fragment visitRepeat(Pattern.Repeat repeat) {
        if (repeat.min() < 0 || repeat.min() > repeat.max()) {
            throw new ConstructionException(
                "Repetition bounds {" + repeat.min() + "," + repeat.max() + "} must satisfy 0 <= min <= max");
        }
        // child^min followed by max - min copies that may each end the repetition early
        final int entry = nfa.addState();
        final int exit = nfa.addState();
        int current = entry;
        for (int i = 0; i < repeat.max(); i++) {
            if (i >= repeat.min()) {
                nfa.addEpsilon(current, exit);
            }
            final Fragment f = repeat.child().accept(this);
            nfa.addEpsilon(current, f.entry());
            current = f.exit();
        }
        nfa.addEpsilon(current, exit);
        return new Fragment(entry, exit);
    }

    private void addClassTransitions(int from, Pattern.CharClass charClass, int to) {
        final IntList classes = partition.classesMatching(charClass);
        for (int i = 0; i < classes.size(); i++) {
            nfa.addTransition(from, classes.getInt(i), to);
        }
    }
}
