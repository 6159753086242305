package LexEquiv.Automaton;

import LexEquiv.Alphabet.AlphabetPartition;
import LexEquiv.Alphabet.AlphabetPartitioner;
import LexEquiv.Alphabet.CharUniverse;
import LexEquiv.Pattern.Pattern;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class ThompsonBuilderTest {
  private static final int OTHER = 0;
  private static final int A = 1;

  @Test
  void testRepetitionBounds() {
    Pattern p = new Pattern.Repeat(Pattern.Literal.of("a"), 2, 4);
    AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, p);
    EpsilonNFA nfa = ThompsonBuilder.build(p, partition);

    Assertions.assertEquals(2, nfa.numInputs());
    Assertions.assertFalse(nfa.accepts());
    Assertions.assertFalse(nfa.accepts(A));
    Assertions.assertTrue(nfa.accepts(A, A));
    Assertions.assertTrue(nfa.accepts(A, A, A));
    Assertions.assertTrue(nfa.accepts(A, A, A, A));
    Assertions.assertFalse(nfa.accepts(A, A, A, A, A));
    Assertions.assertFalse(nfa.accepts(A, OTHER));
  }

  @Test
  void testRepetitionMatchesExpansion() {
    Pattern child = new Pattern.Union(List.of(Pattern.Literal.of("a"), Pattern.Literal.of("")));
    int[][] bounds = {{0, 0}, {0, 1}, {1, 1}, {0, 3}, {2, 2}, {1, 4}};
    for (int[] b : bounds) {
      Pattern.Repeat repeat = new Pattern.Repeat(child, b[0], b[1]);
      AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, repeat);
      EpsilonNFA looped = ThompsonBuilder.build(repeat, partition);
      EpsilonNFA expanded = ThompsonBuilder.build(repeat.expand(), partition);
      int[] word = new int[0];
      for (int len = 0; len <= 6; len++) {
        Assertions.assertEquals(expanded.accepts(word), looped.accepts(word), b[0] + "," + b[1] + "; " + len);
        Assertions.assertFalse(looped.accepts(append(word, OTHER)));
        word = append(word, A);
      }
    }
  }

  @Test
  void testLargeRepetitionIsNotRecursive() {
    Pattern p = new Pattern.Repeat(Pattern.Literal.of("a"), 0, 5000);
    AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, p);
    EpsilonNFA nfa = ThompsonBuilder.build(p, partition);
    int[] word = new int[5000];
    Arrays.fill(word, A);
    Assertions.assertTrue(nfa.accepts(word));
    Assertions.assertFalse(nfa.accepts(append(word, A)));
  }

  private static int[] append(int[] word, int symbol) {
    int[] result = Arrays.copyOf(word, word.length + 1);
    result[word.length] = symbol;
    return result;
  }

  @Test
  void testWildcard() {
    Pattern p = Pattern.CharClass.wildcard();
    AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, p, Pattern.Literal.of("a"));
    EpsilonNFA nfa = ThompsonBuilder.build(p, partition);
    Assertions.assertTrue(nfa.accepts(OTHER));
    Assertions.assertTrue(nfa.accepts(A));
    Assertions.assertFalse(nfa.accepts());
    Assertions.assertFalse(nfa.accepts(A, A));
  }

  @Test
  void testOptionalAndUnion() {
    Pattern p = new Pattern.Union(List.of(
        new Pattern.Optional(Pattern.Literal.of("a")),
        new Pattern.Concat(Pattern.Literal.of("a"), Pattern.CharClass.wildcard())));
    AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, p);
    EpsilonNFA nfa = ThompsonBuilder.build(p, partition);
    Assertions.assertTrue(nfa.accepts());
    Assertions.assertTrue(nfa.accepts(A));
    Assertions.assertTrue(nfa.accepts(A, OTHER));
    Assertions.assertTrue(nfa.accepts(A, A));
    Assertions.assertFalse(nfa.accepts(OTHER));
    Assertions.assertFalse(nfa.accepts(A, A, A));
  }

  @Test
  void testEmptyUnionAcceptsNothing() {
    Pattern p = new Pattern.Union(List.of());
    AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, p);
    EpsilonNFA nfa = ThompsonBuilder.build(p, partition);
    Assertions.assertEquals(1, nfa.numInputs());
    Assertions.assertFalse(nfa.accepts());
    Assertions.assertFalse(nfa.accepts(OTHER));
  }

  @Test
  void testEpsilonClosure() {
    Pattern p = new Pattern.Optional(new Pattern.Optional(Pattern.Literal.of("")));
    AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, p);
    EpsilonNFA nfa = ThompsonBuilder.build(p, partition);
    // every state is epsilon-reachable from the initial state
    Assertions.assertEquals(nfa.size(), nfa.initialClosure().cardinality());
    Assertions.assertTrue(nfa.isAccepting(nfa.initialClosure()));
    Assertions.assertTrue(nfa.successor(nfa.initialClosure(), OTHER).isEmpty());
  }

  @Test
  void testInvalidRepeat() {
    Pattern p = new Pattern.Repeat(Pattern.Literal.of("a"), 3, 1);
    AlphabetPartition partition = AlphabetPartitioner.partition(CharUniverse.BYTE, p);
    assertThrows(ConstructionException.class, () -> ThompsonBuilder.build(p, partition));

    EpsilonNFA nfa = new EpsilonNFA(2);
    nfa.addState();
    assertThrows(IndexOutOfBoundsException.class, () -> nfa.addTransition(0, 2, 0));
  }
}
