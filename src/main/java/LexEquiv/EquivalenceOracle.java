package LexEquiv;

import java.util.ArrayList;
import java.util.List;

import LexEquiv.Automaton.LexerDFA;
import LexEquiv.Model.EquivalenceResult;
import LexEquiv.Model.WitnessOrder;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayFIFOQueue;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import net.automatalib.word.Word;
import net.automatalib.word.WordBuilder;

/**
 * Decides language equivalence of two DFAs over the same alphabet partition by walking their product automaton.
 * <p>
 * Product states are pairs {@code (p, q)} packed into one {@code long}. A pair where exactly one component accepts
 * proves the languages differ; the path leading to it, rendered through the class representatives, is the witness.
 */
public class EquivalenceOracle {
    private static final long NO_PARENT = -1L;

    private final LexerDFA left;
    private final LexerDFA right;
    private final int numInputs;

    // breadth-first tree of the explored product
    private final Long2LongOpenHashMap parent = new Long2LongOpenHashMap();
    private final Long2IntOpenHashMap via = new Long2IntOpenHashMap();
    private final LongArrayList visitOrder = new LongArrayList();

    private EquivalenceOracle(LexerDFA left, LexerDFA right) {
        if (left.getPartition() != right.getPartition()) {
            throw new IllegalArgumentException("DFAs must be built over the same alphabet partition");
        }
        this.left = left;
        this.right = right;
        this.numInputs = left.numInputs();
    }

    public static EquivalenceResult checkEquivalence(LexerDFA left, LexerDFA right) {
        return checkEquivalence(left, right, WitnessOrder.SHORTLEX);
    }

    /**
     * @throws IllegalArgumentException if the DFAs do not share one {@link LexEquiv.Alphabet.AlphabetPartition}
     */
    public static EquivalenceResult checkEquivalence(LexerDFA left, LexerDFA right, WitnessOrder order) {
        final EquivalenceOracle oracle = new EquivalenceOracle(left, right);
        final boolean exhaustive = order == WitnessOrder.LEXICOGRAPHIC;
        final long[] mismatches = oracle.breadthFirst(exhaustive);

        String onlyLeft = null;
        String onlyRight = null;
        if (mismatches[0] != NO_PARENT) {
            Word<Integer> w = exhaustive ? oracle.smallestWitness(true) : null;
            onlyLeft = oracle.render(w != null ? w : oracle.pathTo(mismatches[0]));
        }
        if (mismatches[1] != NO_PARENT) {
            Word<Integer> w = exhaustive ? oracle.smallestWitness(false) : null;
            onlyRight = oracle.render(w != null ? w : oracle.pathTo(mismatches[1]));
        }
        return EquivalenceResult.of(onlyLeft, onlyRight);
    }

    /**
     * Breadth-first traversal of the product from the pair of initial states, expanding classes in ascending order.
     *
     * @param exhaustive whether to explore every reachable pair even after both witnesses are found
     * @return the first pair accepted only on the left and the first accepted only on the right, or
     *         {@link #NO_PARENT} where none exists
     */
    private long[] breadthFirst(boolean exhaustive) {
        long firstOnlyLeft = NO_PARENT;
        long firstOnlyRight = NO_PARENT;

        final long start = pack(left.getInitialState(), right.getInitialState());
        final LongArrayFIFOQueue queue = new LongArrayFIFOQueue();
        parent.put(start, NO_PARENT);
        queue.enqueue(start);

        while (!queue.isEmpty()) {
            final long pair = queue.dequeueLong();
            visitOrder.add(pair);
            final int p = leftOf(pair);
            final int q = rightOf(pair);
            final boolean leftAcc = left.isAccepting(p);
            final boolean rightAcc = right.isAccepting(q);
            if (leftAcc && !rightAcc && firstOnlyLeft == NO_PARENT) {
                firstOnlyLeft = pair;
            } else if (rightAcc && !leftAcc && firstOnlyRight == NO_PARENT) {
                firstOnlyRight = pair;
            }
            if (!exhaustive && firstOnlyLeft != NO_PARENT && firstOnlyRight != NO_PARENT) {
                break;
            }
            for (int a = 0; a < numInputs; a++) {
                final long succ = pack(left.getSuccessor(p, a), right.getSuccessor(q, a));
                if (!parent.containsKey(succ)) {
                    parent.put(succ, pair);
                    via.put(succ, a);
                    queue.enqueue(succ);
                }
            }
        }
        return new long[] {firstOnlyLeft, firstOnlyRight};
    }

    /**
     * Lexicographically smallest string accepted only by the left ({@code onlyLeft}) or only by the right DFA.
     * Requires an exhaustive {@link #breadthFirst(boolean)} first.
     *
     * @return the witness, or {@code null} if the witnesses have no lexicographic minimum
     */
    private Word<Integer> smallestWitness(boolean onlyLeft) {
        final LongSet live = liveFor(onlyLeft);
        final LongSet onPath = new LongOpenHashSet();
        final WordBuilder<Integer> word = new WordBuilder<>();

        long pair = pack(left.getInitialState(), right.getInitialState());
        while (!isMismatch(pair, onlyLeft)) {
            if (!onPath.add(pair)) {
                return null; // every extension keeps cycling: a*b has no smallest member
            }
            final int p = leftOf(pair);
            final int q = rightOf(pair);
            long next = NO_PARENT;
            for (int a = 0; a < numInputs && next == NO_PARENT; a++) {
                final long succ = pack(left.getSuccessor(p, a), right.getSuccessor(q, a));
                if (live.contains(succ)) {
                    next = succ;
                    word.append(a);
                }
            }
            if (next == NO_PARENT) {
                throw new IllegalStateException("Live product state without live successor");
            }
            pair = next;
        }
        return word.toWord();
    }

    /**
     * Pairs from which a mismatch of the requested direction is reachable.
     */
    private LongSet liveFor(boolean onlyLeft) {
        final LongSet live = new LongOpenHashSet();
        for (int i = 0; i < visitOrder.size(); i++) {
            if (isMismatch(visitOrder.getLong(i), onlyLeft)) {
                live.add(visitOrder.getLong(i));
            }
        }
        boolean changed = !live.isEmpty();
        while (changed) {
            changed = false;
            for (int i = visitOrder.size() - 1; i >= 0; i--) {
                final long pair = visitOrder.getLong(i);
                if (live.contains(pair)) {
                    continue;
                }
                final int p = leftOf(pair);
                final int q = rightOf(pair);
                for (int a = 0; a < numInputs; a++) {
                    if (live.contains(pack(left.getSuccessor(p, a), right.getSuccessor(q, a)))) {
                        live.add(pair);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return live;
    }

    private boolean isMismatch(long pair, boolean onlyLeft) {
        final boolean leftAcc = left.isAccepting(leftOf(pair));
        final boolean rightAcc = right.isAccepting(rightOf(pair));
        return onlyLeft ? leftAcc && !rightAcc : rightAcc && !leftAcc;
    }

    private Word<Integer> pathTo(long pair) {
        final IntArrayList reversed = new IntArrayList();
        for (long curr = pair; parent.get(curr) != NO_PARENT; curr = parent.get(curr)) {
            reversed.add(via.get(curr));
        }
        final List<Integer> symbols = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            symbols.add(reversed.getInt(i));
        }
        return Word.fromList(symbols);
    }

    private String render(Word<Integer> word) {
        return left.getPartition().render(word);
    }

    private static long pack(int p, int q) {
        return ((long) p << 32) | (q & 0xFFFFFFFFL);
    }

    private static int leftOf(long pair) {
        return (int) (pair >>> 32);
    }

    private static int rightOf(long pair) {
        return (int) pair;
    }
}
