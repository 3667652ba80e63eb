package vcg.script;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ScriptParserTest {

  private static List<ScriptCall> parse(String text) throws VCGScriptException { return new ScriptParser(text).parse(); }

  @Test
  void testCallsAndArguments() throws VCGScriptException {
    List<ScriptCall> calls = parse("Connect('clk', \"sys_clk\")\n" +
                                   "# comment line\n" +
                                   "\n" +
                                   "Instance('a.v', 'a', instance_name='u_a')  # trailing comment\n");
    Assertions.assertEquals(2, calls.size());
    Assertions.assertEquals(new ScriptCall("Connect", List.of("clk", "sys_clk"), Map.of(), 1), calls.get(0));
    ScriptCall instance = calls.get(1);
    Assertions.assertEquals("Instance", instance.function());
    Assertions.assertEquals(List.of("a.v", "a"), instance.positional());
    Assertions.assertEquals(Map.of("instance_name", "u_a"), instance.keywords());
    Assertions.assertEquals(4, instance.line());
    Assertions.assertEquals(3, instance.argumentCount());
  }

  @Test
  void testMultiLineCall() throws VCGScriptException {
    List<ScriptCall> calls = parse("WiresRule(\n  'data_*',\n  'w_*',\n  width=8,\n)\nprint('x')");
    Assertions.assertEquals(2, calls.size());
    Assertions.assertEquals(List.of("data_*", "w_*"), calls.get(0).positional());
    Assertions.assertEquals(Map.of("width", "8"), calls.get(0).keywords());
    Assertions.assertEquals(6, calls.get(1).line());
  }

  @Test
  void testLiterals() throws VCGScriptException {
    ScriptCall call = parse("print(None, True, -3, 'a' 'b', 'c' + \"d\", 'q\\'s\\n', \"x\\\\y\")").get(0);
    Assertions.assertEquals(Arrays.asList(null, "True", "-3", "ab", "cd", "q's\n", "x\\y"), call.positional());
  }

  @Test
  void testStatementSeparators() throws VCGScriptException {
    List<ScriptCall> calls = parse("Connect('a', 'b'); Connect('c', 'd')\nConnect('e', \\\n 'f')");
    Assertions.assertEquals(3, calls.size());
    Assertions.assertEquals(List.of("e", "f"), calls.get(2).positional());
  }

  @Test
  void testEmptyScript() throws VCGScriptException {
    Assertions.assertTrue(parse("").isEmpty());
    Assertions.assertTrue(parse(null).isEmpty());
    Assertions.assertTrue(parse("# nothing\n\n").isEmpty());
  }

  @Test
  void testSyntaxErrorMessages() {
    VCGScriptException e = Assertions.assertThrows(VCGScriptException.class, () -> parse("Connect('a', 'b')\nConnect(x='a', 'b')"));
    Assertions.assertEquals("Syntax error at line 2: positional argument follows keyword argument", e.getMessage());
    e = Assertions.assertThrows(VCGScriptException.class, () -> parse("Connect(port, 'b')"));
    Assertions.assertEquals("Syntax error at line 1: variables are not supported: port", e.getMessage());
    e = Assertions.assertThrows(VCGScriptException.class, () -> parse("print('abc)"));
    Assertions.assertEquals("Syntax error at line 1: unterminated string literal", e.getMessage());
    e = Assertions.assertThrows(VCGScriptException.class, () -> parse("print(a='1', a='2')"));
    Assertions.assertEquals("Syntax error at line 1: keyword argument repeated: a", e.getMessage());
  }

  @ParameterizedTest
  @ValueSource(strings = {"Connect('a' 'b'", "Connect('a',, 'b')", "import os", "x = 1", "Connect('a').upper()", "print(1 + 2)",
                          "Connect('a') Connect('b')", "print([1])", "f(lambda: 0)"})
  void testRejectedScripts(String script) {
    VCGScriptException e = Assertions.assertThrows(VCGScriptException.class, () -> parse(script));
    Assertions.assertTrue(e.getMessage().startsWith("Syntax error at line 1: "), e.getMessage());
  }
}
