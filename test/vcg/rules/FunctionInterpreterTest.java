package vcg.rules;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class FunctionInterpreterTest {

  private static String eval(String expression, String... groups) throws FunctionCallException {
    return new FunctionInterpreter(List.of(groups)).evaluate(expression);
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', quoteCharacter = '"', value = {"upper(*0)|data_bus|DATA_BUS", "lower(*0)|DATA|data", "title(*0)|data_bus|Data_Bus",
                                       "capitalize(*0)|dATA bus|Data bus", "strip(*0)|\"  x  \"|x", "lstrip(*0, '_')|__x_|x_",
                                       "rstrip(*0, '_')|__x_|__x", "replace(*0, '_', '')|a_b_c|abc", "replace(*0, '_', '', 1)|a_b_c|ab_c",
                                       "str(*0)|v|v"})
  void testTransforms(String expression, String group, String expected) throws FunctionCallException {
    Assertions.assertEquals(expected, eval(expression, group));
  }

  @Test
  void testReferences() throws FunctionCallException {
    Assertions.assertEquals("SYS_clk", eval("upper(*0) + '_' + lower(*1)", "sys", "CLK"));
    Assertions.assertEquals("sys", eval("*", "sys", "CLK"));
    Assertions.assertEquals("CLK", eval("(*1)", "sys", "CLK"));
  }

  @Test
  void testMethodForm() throws FunctionCallException {
    Assertions.assertEquals("DATA", eval("*0.upper()", "data"));
    Assertions.assertEquals("D_T_", eval("*0.upper().replace('A', '_')", "data"));
    Assertions.assertEquals("x\"y", eval("\"x\\\"y\""));
  }

  @ParameterizedTest
  @ValueSource(strings = {"invalid_function()", "upper()", "upper(*0, *0)", "*3", "__import__('os')", "upper(*0", "open('f')", "x",
                          "upper(*0) junk", "'unterminated"})
  void testRejected(String expression) {
    Assertions.assertThrows(FunctionCallException.class, () -> eval(expression, "a"));
  }

  @Test
  void testAllowList() {
    Assertions.assertEquals(9, FunctionInterpreter.getFunctionNames().size());
    Assertions.assertTrue(FunctionInterpreter.getFunctionNames().contains("upper"));
    Assertions.assertFalse(FunctionInterpreter.getFunctionNames().contains("eval"));
  }

  @Test
  void testCaseMappingIgnoresDefaultLocale() throws FunctionCallException {
    Locale saved = Locale.getDefault();
    try {
      Locale.setDefault(new Locale("tr", "TR"));
      FunctionInterpreter interpreter = new FunctionInterpreter(List.of("valid_i"));
      Assertions.assertEquals("VALID_I", interpreter.evaluate("upper(*0)"));
      Assertions.assertEquals("valid_i", interpreter.evaluate("lower('VALID_I')"));
      Assertions.assertEquals("Valid_i", interpreter.evaluate("capitalize('VALID_I')"));
    } finally {
      Locale.setDefault(saved);
    }
  }
}
