package vcg.gen;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vcg.ast.NetKind;
import vcg.ast.ParameterKind;
import vcg.ast.PortDirection;
import vcg.ast.RangeExpression;
import vcg.rules.RuleEngine;
import vcg.signature.ModuleSignature;
import vcg.signature.ParameterInfo;
import vcg.signature.PortInfo;

class InstanceGeneratorTest {
  private RuleEngine rules;
  private ModuleSignature fifo;

  @BeforeEach
  void setUp() {
    rules = new RuleEngine();
    fifo = new ModuleSignature("fifo",
                               List.of(PortInfo.of("clk", PortDirection.Input, "1"),
                                       new PortInfo("data", PortDirection.Input, NetKind.Wire, RangeExpression.simplify("WIDTH-1", "0"), null),
                                       PortInfo.of("valid", PortDirection.Output, "1")),
                               List.of(new ParameterInfo("WIDTH", ParameterKind.Parameter, "8", null),
                                       new ParameterInfo("DEPTH", ParameterKind.Parameter, "4", null),
                                       new ParameterInfo("ADDR", ParameterKind.Localparam, "2", null)));
  }

  @Test
  void testPlainInstance() {
    String expected = "fifo u_fifo (\n" +
                      "    .clk" + " ".repeat(15) + "(clk)," + " ".repeat(11) + "// input\n" +
                      "    .data" + " ".repeat(14) + "(data)," + " ".repeat(10) + "// input [WIDTH-1:0]\n" +
                      "    .valid" + " ".repeat(13) + "(valid)" + " ".repeat(10) + "// output\n" +
                      ");";
    Assertions.assertEquals(expected, new InstanceGenerator(rules).generate(fifo, "fifo", "u_fifo"));
  }

  @Test
  void testRulesAndParameterOverrides() {
    rules.addParamRule("WIDTH", "32");
    rules.addParamRule("ADDR", "3");
    rules.addSignalRule("clk", "sys_clk");
    rules.addSignalRule("data", "bus");
    rules.addSignalRule("valid", "0");
    String expected = "fifo #(\n" +
                      "    .WIDTH" + " ".repeat(13) + "(32)\n" +
                      ") u_fifo (\n" +
                      "    .clk" + " ".repeat(15) + "(sys_clk)," + " ".repeat(7) + "// input\n" +
                      "    .data" + " ".repeat(14) + "(bus)," + " ".repeat(11) + "// input [WIDTH-1:0]\n" +
                      "    .valid" + " ".repeat(13) + "(1'b0)" + " ".repeat(11) + "// output\n" +
                      ");";
    Assertions.assertEquals(expected, new InstanceGenerator(rules).generate(fifo, "fifo", "u_fifo"));
  }

  @Test
  void testSeveralParametersAreSeparated() {
    rules.addParamRule("*", "P_*");
    String text = new InstanceGenerator(rules).generate(fifo, "fifo", "u");
    Assertions.assertTrue(text.startsWith("fifo #(\n    .WIDTH" + " ".repeat(13) + "(P_WIDTH),\n    .DEPTH" + " ".repeat(13) + "(P_DEPTH)\n) u (\n"));
  }

  @Test
  void testCustomLayout() {
    ModuleSignature sig = new ModuleSignature("m", List.of(PortInfo.of("a", PortDirection.Input, "1")), List.of());
    Assertions.assertEquals("m i (\n  .a    (a) // input\n);", new InstanceGenerator(rules, 5, "  ").generate(sig, "m", "i"));
  }

  @Test
  void testPortWithoutDirectionHasNoComment() {
    ModuleSignature sig = new ModuleSignature("m", List.of(PortInfo.of("a", null, "1"), PortInfo.of("b", PortDirection.Inout, "4")), List.of());
    String expected = "m i (\n" +
                      "    .a" + " ".repeat(17) + "(a),\n" +
                      "    .b" + " ".repeat(17) + "(b)" + " ".repeat(14) + "// inout [3:0]\n" +
                      ");";
    Assertions.assertEquals(expected, new InstanceGenerator(rules).generate(sig, "m", "i"));
  }

  @Test
  void testEmptyModule() {
    Assertions.assertEquals("m i (\n);", new InstanceGenerator(rules).generate(new ModuleSignature("m", List.of(), List.of()), "m", "i"));
  }
}
