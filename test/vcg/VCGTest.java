package vcg;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vcg.ast.PortDirection;
import vcg.frontend.ParseContext;
import vcg.frontend.ParseResult;
import vcg.preprocess.MacroSet;
import vcg.preprocess.PreprocessException;
import vcg.script.VCGScriptException;
import vcg.signature.ModuleSignature;
import vcg.signature.PortInfo;
import vcg.signature.SignatureExtractor;
import vcg.ui.VCGConfig;

class VCGTest {
  @TempDir
  Path dir;

  private static final String ALU = "module alu #(parameter WIDTH = 8, parameter DEPTH = 4) (\n" +
                                    "  input  wire             clk,\n" +
                                    "`ifdef DEBUG\n" +
                                    "  output wire [3:0]       dbg,\n" +
                                    "`endif\n" +
                                    "  input  wire [WIDTH-1:0] a,\n" +
                                    "  output reg  [WIDTH-1:0] y\n" +
                                    ");\n" +
                                    "  always @(posedge clk) y <= a;\n" +
                                    "endmodule\n";

  private static final String TOP = "module top;\n" +
                                    "  //VCG_BEGIN\n" +
                                    "  // ConnectParam('WIDTH', '16')\n" +
                                    "  // Connect('*', '*_s')\n" +
                                    "  // Connect('clk', 'sys_clk')\n" +
                                    "  // WiresRule('*', 'alu_*')\n" +
                                    "  // WiresDef('alu.v', 'alu', 'output', 'greedy')\n" +
                                    "  // Instance('alu.v', 'alu', 'u_alu')\n" +
                                    "  //VCG_END\n" +
                                    "endmodule\n";

  @Test
  void testParseModule() throws VCGException {
    ModuleSignature sig =
        new VCG().parseModule("module m #(parameter WIDTH=8)(input wire [WIDTH-1:0] data_in, output reg valid);\nendmodule", "m.v");
    Assertions.assertEquals(1, sig.getParameters().size());
    Assertions.assertEquals("8", sig.findParameter("WIDTH").orElseThrow().defaultValue());
    Assertions.assertEquals(2, sig.getPortCount());
    PortInfo dataIn = sig.getPorts().get(0);
    Assertions.assertEquals("data_in", dataIn.name());
    Assertions.assertEquals(PortDirection.Input, dataIn.direction());
    Assertions.assertEquals("WIDTH", dataIn.width());
    PortInfo valid = sig.getPorts().get(1);
    Assertions.assertEquals(PortDirection.Output, valid.direction());
    Assertions.assertEquals(1L, valid.getWidthValue().orElseThrow());
  }

  @Test
  void testParseFailure() {
    VCGParseException e = Assertions.assertThrows(VCGParseException.class, () -> new VCG().parseModule("wire x;\n", "bad.v"));
    Assertions.assertEquals("Cannot parse Verilog module: bad.v", e.getMessage());
  }

  @Test
  void testMacrosSelectPorts() throws IOException, VCGException {
    Path alu = dir.resolve("alu.v");
    Files.writeString(alu, ALU);
    Assertions.assertEquals(3, new VCG().parseFile(alu).getPortCount());

    ModuleSignature debug = new VCG(new VCGConfig(), MacroSet.parse("DEBUG")).parseFile(alu);
    Assertions.assertEquals(4, debug.getPortCount());
    Assertions.assertEquals("[3:0]", debug.findPort("dbg").orElseThrow().getRangeDescription());

    VCGConfig cfg = new VCGConfig();
    cfg.macros.put("DEBUG", null);
    Assertions.assertEquals(4, new VCG(cfg, null).parseFile(alu).getPortCount());
  }

  @Test
  void testReadFiles() throws IOException, VCGException {
    Path latin = dir.resolve("latin.v");
    Files.write(latin, "// café\nmodule l(input a);\nendmodule\n".getBytes(StandardCharsets.ISO_8859_1));
    Assertions.assertEquals("l", new VCG().parseFile(latin).getName());

    Path missing = dir.resolve("missing.v");
    VCGFileException e = Assertions.assertThrows(VCGFileException.class, () -> new VCG().parseFile(missing));
    Assertions.assertEquals("Cannot find Verilog file: " + missing, e.getMessage());
  }

  @Test
  void testProcessFile() throws IOException, VCGException {
    Files.writeString(dir.resolve("alu.v"), ALU);
    Path top = dir.resolve("top.v");
    Files.writeString(top, TOP);

    Assertions.assertEquals(1, new VCG().processFile(top, null));
    String expected = TOP.replace("  //VCG_END\n",
                                  "  //VCG_END\n" +
                                  "//VCG_GEN_BEGIN_0\n" +
                                  "wire [WIDTH-1:0] alu_y;\n" +
                                  "alu #(\n" +
                                  "    .WIDTH" + " ".repeat(13) + "(16)\n" +
                                  ") u_alu (\n" +
                                  "    .clk" + " ".repeat(15) + "(sys_clk)," + " ".repeat(7) + "// input\n" +
                                  "    .a" + " ".repeat(17) + "(a_s)," + " ".repeat(11) + "// input [WIDTH-1:0]\n" +
                                  "    .y" + " ".repeat(17) + "(y_s)" + " ".repeat(12) + "// output [WIDTH-1:0]\n" +
                                  ");\n" +
                                  "//VCG_GEN_END_0\n");
    String generated = Files.readString(top);
    Assertions.assertEquals(expected, generated);

    // a second run reproduces the same file
    new VCG().processFile(top, null);
    Assertions.assertEquals(generated, Files.readString(top));
  }

  @Test
  void testProcessFileWithOutput() throws IOException, VCGException {
    Files.writeString(dir.resolve("alu.v"), ALU);
    Path top = dir.resolve("top.v");
    Files.writeString(top, TOP);
    Path out = dir.resolve("out/top.v");

    new VCG(new VCGConfig(), MacroSet.parse("DEBUG")).processFile(top, out);
    Assertions.assertEquals(TOP, Files.readString(top));
    Assertions.assertTrue(Files.readString(out).contains("wire [3:0]     alu_dbg;\nwire [WIDTH-1:0] alu_y;\n"));
  }

  @Test
  void testFailingBlock() throws IOException {
    Path top = dir.resolve("top.v");
    String source = "//VCG_BEGIN\n//Connect('a')\n//VCG_END\n";
    Files.writeString(top, source);
    VCGScriptException e = Assertions.assertThrows(VCGScriptException.class, () -> new VCG().processFile(top, null));
    Assertions.assertEquals("Exec Error: Line 1: Connect() missing required argument 'target_pattern'", e.getMessage());
    Assertions.assertEquals(source, Files.readString(top));
  }

  @Test
  void testMissingModuleFile() throws IOException {
    Path top = dir.resolve("top.v");
    Files.writeString(top, "//VCG_BEGIN\n//Instance('nowhere.v', 'x', 'u')\n//VCG_END\n");
    Assertions.assertThrows(VCGFileException.class, () -> new VCG().processFile(top, null));
  }

  /** Macro set whose copy fails, which aborts preprocessing after the module has been located. */
  private static MacroSet failingMacros() {
    return new MacroSet() {
      @Override
      public MacroSet copy() {
        throw new IllegalStateException("macro table unavailable");
      }
    };
  }

  @Test
  void testPreprocessFailureFallsBackToRawText() throws VCGException {
    String text = "module m(input a, output [3:0] q);\n  assign q = {4{a}};\nendmodule\n";
    ParseContext context = new ParseContext("m.v");
    ParseResult result = new VCG().parse(text, failingMacros(), context);
    ModuleSignature sig = SignatureExtractor.extract(result.designUnit()).orElseThrow();
    Assertions.assertEquals("m", sig.getName());
    Assertions.assertEquals(2, sig.getPortCount());
    Assertions.assertEquals("4", sig.findPort("q").orElseThrow().width());
  }

  @Test
  void testPreprocessFailureWithoutFallback() {
    VCGConfig cfg = new VCGConfig();
    cfg.preprocess_fallback = false;
    VCG vcg = new VCG(cfg, null);
    PreprocessException e =
        Assertions.assertThrows(PreprocessException.class, () -> vcg.parse("module m(input a);\nendmodule\n", failingMacros(), new ParseContext("m.v")));
    Assertions.assertEquals("Preprocess Failed: macro table unavailable", e.getMessage());
    Assertions.assertTrue(e.getCause() instanceof IllegalStateException);
  }
}
