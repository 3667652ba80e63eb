package vcg.preprocess;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import vcg.frontend.ParseContext;

class VerilogPreprocessorTest {

  private static final String GUARDED = String.join("\n", "module m(", "`ifdef DEBUG", "  input dbg_in,", "`else", "  input rel_in,", "`endif",
                                                    "  output q", ");", "endmodule");

  private static String reduce(String text, MacroSet macros) throws PreprocessException {
    return new VerilogPreprocessor(macros, new ParseContext("test.v")).reduce(text);
  }

  @Test
  void testIfdefTakesFirstBranchWhenDefined() throws PreprocessException {
    String reduced = reduce(GUARDED, MacroSet.parse("DEBUG"));
    Assertions.assertTrue(reduced.contains("dbg_in"));
    Assertions.assertFalse(reduced.contains("rel_in"));
  }

  @Test
  void testIfdefTakesElseBranchWhenUndefined() throws PreprocessException {
    String reduced = reduce(GUARDED, MacroSet.empty());
    Assertions.assertFalse(reduced.contains("dbg_in"));
    Assertions.assertTrue(reduced.contains("rel_in"));
  }

  @Test
  void testNestedConditionals() throws PreprocessException {
    String text = String.join("\n", "module m(", "`ifdef A", "`ifdef B", "  input ab,", "`else", "  input a_only,", "`endif", "`elsif C",
                              "  input c,", "`else", "  input none,", "`endif", "  output q);", "endmodule");
    Assertions.assertTrue(reduce(text, MacroSet.parse("A,B")).contains("input ab,"));
    String aOnly = reduce(text, MacroSet.parse("A"));
    Assertions.assertTrue(aOnly.contains("a_only"));
    Assertions.assertFalse(aOnly.contains("input c,"));
    String cOnly = reduce(text, MacroSet.parse("C"));
    Assertions.assertTrue(cOnly.contains("input c,"));
    Assertions.assertFalse(cOnly.contains("none"));
    Assertions.assertTrue(reduce(text, MacroSet.empty()).contains("none"));
  }

  @Test
  void testBodyKeepsOnlyDeclarations() throws PreprocessException {
    String text = String.join("\n", "`timescale 1ns/1ps", "// header comment", "module m(a, q);", "  input a;", "  output [3:0]", "    q;",
                              "  assign q = {4{a}};", "  always @(*) begin", "  end", "endmodule", "module other(input x);", "endmodule");
    String reduced = reduce(text, MacroSet.empty());
    Assertions.assertEquals(String.join("\n", "module m(a, q);", "  input a;", "  output [3:0]", "    q;", "endmodule"), reduced);
  }

  @Test
  void testDefineInsideFile() throws PreprocessException {
    String text = String.join("\n", "`define WIDE", "module m(", "`ifdef WIDE", "  input [63:0] d", "`else", "  input [31:0] d", "`endif", ");",
                              "endmodule");
    MacroSet external = MacroSet.empty();
    String reduced = reduce(text, external);
    Assertions.assertTrue(reduced.contains("[63:0]"));
    // external macros are not modified
    Assertions.assertFalse(external.isDefined("WIDE"));
  }

  @Test
  void testUndef() throws PreprocessException {
    String text = String.join("\n", "`undef DEBUG", "module m(", "`ifndef DEBUG", "  input rel,", "`endif", "  input clk);", "endmodule");
    Assertions.assertTrue(reduce(text, MacroSet.parse("DEBUG")).contains("rel"));
  }

  @Test
  void testBodyConditionalDeclarations() throws PreprocessException {
    String text = String.join("\n", "module m(a, b);", "  input a;", "`ifdef OUT_B", "  output b;", "`else", "  input b;", "`endif",
                              "endmodule");
    String reduced = reduce(text, MacroSet.parse("OUT_B"));
    Assertions.assertTrue(reduced.contains("output b;"));
    Assertions.assertFalse(reduced.contains("input b;"));
  }

  @Test
  void testNoModule() throws PreprocessException {
    Assertions.assertEquals("", reduce("// just a comment\nwire x;\n", MacroSet.empty()));
  }

  @Test
  void testUnbalancedDirectivesWarn() throws PreprocessException {
    ParseContext context = new ParseContext("test.v");
    String text = String.join("\n", "module m(", "`endif", "`ifdef X", "  input a);", "endmodule");
    new VerilogPreprocessor(MacroSet.empty(), context).reduce(text);
    Assertions.assertEquals(2, context.getDiagnostics(ParseContext.Severity.Warning).size());
    Assertions.assertEquals(0, context.getErrorCount());
  }

  @Test
  void testIncludeGuard() throws PreprocessException {
    ParseContext context = new ParseContext("test.v");
    String text = String.join("\n", "`ifndef M_V", "`define M_V", "module m(input a);", "endmodule", "`endif", "");
    String reduced = new VerilogPreprocessor(MacroSet.empty(), context).reduce(text);
    Assertions.assertEquals("module m(input a);\nendmodule", reduced);
    Assertions.assertTrue(context.getDiagnostics().isEmpty());
  }
}
