package LexEquiv.Alphabet;

import java.util.BitSet;

import LexEquiv.Pattern.Pattern;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.word.Word;

/**
 * Partition of a {@link CharUniverse} into classes of characters that no pattern under consideration can tell
 * apart: one singleton class per boundary character and one catch-all class for every other character.
 * <p>
 * Class indices double as the input symbols of the automata built over this partition, so classes are numbered in
 * ascending order of their representative character.
 */
public final class AlphabetPartition {
    public static final int NO_CLASS = -1;

    private final CharUniverse universe;
    private final BitSet boundary;
    private final int[] representatives;
    private final Int2IntMap classOfBoundaryChar;
    private final int catchAllClass;
    private final Alphabet<Integer> inputs;

    AlphabetPartition(CharUniverse universe, BitSet boundary) {
        this.universe = universe;
        this.boundary = (BitSet) boundary.clone();

        final int firstUnmentioned = boundary.nextClearBit(0);
        final boolean hasCatchAll = universe.contains(firstUnmentioned);
        final int numClasses = boundary.cardinality() + (hasCatchAll ? 1 : 0);

        this.representatives = new int[numClasses];
        this.classOfBoundaryChar = new Int2IntOpenHashMap(boundary.cardinality());
        int catchAll = NO_CLASS;
        int idx = 0;
        for (int c = boundary.nextSetBit(0); c >= 0; c = boundary.nextSetBit(c + 1)) {
            if (catchAll == NO_CLASS && hasCatchAll && firstUnmentioned < c) {
                catchAll = idx;
                representatives[idx++] = firstUnmentioned;
            }
            classOfBoundaryChar.put(c, idx);
            representatives[idx++] = c;
        }
        if (catchAll == NO_CLASS && hasCatchAll) {
            catchAll = idx;
            representatives[idx] = firstUnmentioned;
        }
        this.catchAllClass = catchAll;
        this.classOfBoundaryChar.defaultReturnValue(catchAll);
        this.inputs = Alphabets.integers(0, numClasses - 1);
    }

    public CharUniverse getUniverse() {
        return universe;
    }

    /**
     * Number of classes, which is also the size of {@link #getInputAlphabet()}.
     */
    public int size() {
        return representatives.length;
    }

    public Alphabet<Integer> getInputAlphabet() {
        return inputs;
    }

    /**
     * @return the characters mentioned by any pattern, each of which forms its own class
     */
    public BitSet getBoundary() {
        return (BitSet) boundary.clone();
    }

    public boolean hasCatchAll() {
        return catchAllClass != NO_CLASS;
    }

    /**
     * @return index of the catch-all class, or {@link #NO_CLASS} if every universe character is mentioned
     */
    public int getCatchAllClass() {
        return catchAllClass;
    }

    /**
     * @throws AlphabetException if {@code c} lies outside the universe
     */
    public int classOf(int c) {
        if (!universe.contains(c)) {
            throw new AlphabetException("Character " + describe(c) + " is outside the " + universe + " universe");
        }
        return classOfBoundaryChar.get(c);
    }

    public int representative(int classIndex) {
        return representatives[classIndex];
    }

    /**
     * @return every universe character belonging to the class
     */
    public BitSet members(int classIndex) {
        BitSet result = new BitSet();
        if (classIndex == catchAllClass) {
            result.set(0, universe.size());
            result.andNot(boundary);
        } else {
            result.set(representatives[classIndex]);
        }
        return result;
    }

    /**
     * Class indices, ascending, of the classes whose characters are matched by a character-class node.
     *
     * @throws AlphabetException if the node distinguishes characters that this partition merges
     */
    public IntList classesMatching(Pattern.CharClass charClass) {
        BitSet chars = charClass.chars();
        BitSet unknown = (BitSet) chars.clone();
        unknown.andNot(boundary);
        if (!unknown.isEmpty()) {
            throw new AlphabetException("Character class " + charClass + " mentions " + describe(unknown.nextSetBit(0))
                                        + " which is not a boundary character of this partition");
        }
        IntList result = new IntArrayList();
        for (int i = 0; i < representatives.length; i++) {
            if (charClass.matches(representatives[i])) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Renders a sequence of classes as the string of their representatives.
     */
    public String render(Word<Integer> word) {
        StringBuilder sb = new StringBuilder(word.length());
        for (int classIndex : word) {
            sb.appendCodePoint(representatives[classIndex]);
        }
        return sb.toString();
    }

    /**
     * Maps each character of {@code s} to its class.
     *
     * @throws AlphabetException if a character lies outside the universe
     */
    public Word<Integer> classify(String s) {
        Integer[] symbols = new Integer[s.length()];
        for (int i = 0; i < s.length(); i++) {
            symbols[i] = classOf(s.charAt(i));
        }
        return Word.fromSymbols(symbols);
    }

    public String describeClass(int classIndex) {
        if (classIndex == catchAllClass) {
            return "<other:" + describe(representatives[classIndex]) + ">";
        }
        return describe(representatives[classIndex]);
    }

    static String describe(int c) {
        return c >= 0x20 && c < 0x7F ? "'" + (char) c + "'" : String.format("0x%02X", c);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AlphabetPartition[").append(universe).append(':');
        for (int i = 0; i < representatives.length; i++) {
            sb.append(i == 0 ? " " : ", ").append(describeClass(i));
        }
        return sb.append(']').toString();
    }
}
