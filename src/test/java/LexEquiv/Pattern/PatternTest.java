package LexEquiv.Pattern;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

class PatternTest {
  private static final Pattern A = Pattern.Literal.of("a");

  @Test
  void testRepeatExpansion() {
    Pattern expected = new Pattern.Concat(
        new Pattern.Concat(A, A),
        new Pattern.Optional(new Pattern.Concat(A, new Pattern.Optional(A))));
    Assertions.assertEquals(expected, new Pattern.Repeat(A, 2, 4).expand());

    Assertions.assertEquals(new Pattern.Literal(List.of()), new Pattern.Repeat(A, 0, 0).expand());
    Assertions.assertEquals(A, new Pattern.Repeat(A, 1, 1).expand());
    Assertions.assertEquals(new Pattern.Optional(A), new Pattern.Repeat(A, 0, 1).expand());

    assertThrows(IllegalArgumentException.class, () -> new Pattern.Repeat(A, 3, 1).expand());
    assertThrows(IllegalArgumentException.class, () -> new Pattern.Repeat(A, -1, 1).expand());
  }

  @Test
  void testCharClassIsImmutable() {
    BitSet chars = new BitSet();
    chars.set('a', 'd');
    Pattern.CharClass cc = new Pattern.CharClass(chars, false);
    chars.clear();
    cc.chars().clear();
    Assertions.assertEquals(3, cc.chars().cardinality());
    Assertions.assertTrue(cc.matches('b'));
    Assertions.assertFalse(cc.matches('z'));
    Assertions.assertFalse(cc.isWildcard());
    Assertions.assertEquals("[a-c]", cc.toString());

    Pattern.CharClass any = Pattern.CharClass.wildcard();
    Assertions.assertTrue(any.matches(0));
    Assertions.assertTrue(any.matches(0xFFFF));
    Assertions.assertEquals("[^]", any.toString());
  }

  @Test
  void testToString() {
    Pattern p = new Pattern.Union(List.of(new Pattern.Repeat(Pattern.Literal.of("ab"), 1, 2), A));
    Assertions.assertEquals("(\"ab\"{1,2} | \"a\")", p.toString());
  }
}
