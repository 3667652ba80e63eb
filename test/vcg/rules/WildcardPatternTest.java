package vcg.rules;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WildcardPatternTest {

  @Test
  void testExactPattern() {
    WildcardPattern pattern = WildcardPattern.compile("clk");
    Assertions.assertFalse(pattern.hasWildcard());
    Assertions.assertEquals(List.of(), pattern.match("clk").orElseThrow());
    Assertions.assertFalse(pattern.matches("clk2"));
  }

  @Test
  void testCaptures() {
    Assertions.assertEquals(List.of("data"), WildcardPattern.compile("*_in").match("data_in").orElseThrow());
    Assertions.assertEquals(List.of("SYS", "CLK"), WildcardPattern.compile("*_*_sig").match("SYS_CLK_sig").orElseThrow());
    Assertions.assertEquals(List.of(""), WildcardPattern.compile("in_*").match("in_").orElseThrow());
  }

  @Test
  void testGreedyFirstCapture() {
    Assertions.assertEquals(List.of("a_b", "c"), WildcardPattern.compile("*_*").match("a_b_c").orElseThrow());
  }

  @Test
  void testSpecialCharactersAreLiteral() {
    WildcardPattern pattern = WildcardPattern.compile("data[*]");
    Assertions.assertEquals(List.of("3"), pattern.match("data[3]").orElseThrow());
    Assertions.assertFalse(WildcardPattern.compile("a.b").matches("axb"));
  }

  @Test
  void testNoMatch() {
    Assertions.assertFalse(WildcardPattern.compile("*_test_*").matches("just_test"));
    Assertions.assertFalse(WildcardPattern.compile("start_*_middle_*_end").matches("start_test_middle"));
    Assertions.assertFalse(WildcardPattern.compile("x").matches(null));
  }
}
