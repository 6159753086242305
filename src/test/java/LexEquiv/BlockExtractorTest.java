package LexEquiv;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

class BlockExtractorTest {
  @Test
  void testBlocksInOrder() {
    String source = "int x;\n/*!re2c \"a\" {} */ int y; /* plain comment */\n/*!re2c\n\"b\" {}\n*/\n";
    Assertions.assertEquals(List.of(" \"a\" {} ", "\n\"b\" {}\n"), BlockExtractor.extract(source));
  }

  @Test
  void testVariants() {
    String source = "/*!rules:re2c:main \"a\" {} */\n/*!local:re2c \"b\" {} */\n/*!use:re2c:main */";
    List<String> blocks = BlockExtractor.extract(source);
    Assertions.assertEquals(3, blocks.size());
    Assertions.assertEquals(" \"a\" {} ", blocks.get(0));
    Assertions.assertEquals(" \"b\" {} ", blocks.get(1));
    Assertions.assertEquals(" ", blocks.get(2));
  }

  @Test
  void testConfigurationRemoved() {
    String source = "/*!re2c\n  re2c:define:YYCTYPE = \"unsigned char\";\n  re2c:yyfill:enable = 0;\n  \"a\" {}\n*/";
    Assertions.assertEquals(List.of("\n\n\n  \"a\" {}\n"), BlockExtractor.extract(source));
  }

  @Test
  void testNoBlocks() {
    Assertions.assertTrue(BlockExtractor.extract("int main() { return 0; }").isEmpty());
    Assertions.assertTrue(BlockExtractor.extract("/* re2c */").isEmpty());
  }

  @Test
  void testUnterminated() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> BlockExtractor.extract("x /*!re2c \"a\" {}"));
    Assertions.assertEquals("Unterminated re2c block starting at index 2", e.getMessage());
  }
}
