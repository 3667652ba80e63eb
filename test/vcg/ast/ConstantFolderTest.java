package vcg.ast;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConstantFolderTest {

  @Test
  void testLiterals() {
    Assertions.assertEquals(42L, ConstantFolder.literalValue("42").get());
    Assertions.assertEquals(255L, ConstantFolder.literalValue("8'hFF").get());
    Assertions.assertEquals(10L, ConstantFolder.literalValue("'d10").get());
    Assertions.assertEquals(10L, ConstantFolder.literalValue("4'b1010").get());
    Assertions.assertEquals(1000L, ConstantFolder.literalValue("1_000").get());
    Assertions.assertTrue(ConstantFolder.literalValue("WIDTH").isEmpty());
    Assertions.assertTrue(ConstantFolder.literalValue(null).isEmpty());
  }

  @Test
  void testArithmetic() {
    Assertions.assertEquals(20L, ConstantFolder.evaluateArithmetic("(2+3)*4").get());
    Assertions.assertEquals(7L, ConstantFolder.evaluateArithmetic("8 - 1").get());
    Assertions.assertEquals(3L, ConstantFolder.evaluateArithmetic("7/2").get());
    Assertions.assertEquals(7L, ConstantFolder.fold("8-1").get());
  }

  @ParameterizedTest
  @ValueSource(strings = {"8/0", "WIDTH-1", "(1+2", "1+", "$clog2(8)"})
  void testNotFoldable(String text) {
    Assertions.assertTrue(ConstantFolder.fold(text).isEmpty());
  }
}
