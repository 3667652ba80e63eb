package vcg.script;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class OutputCollectorTest {

  @Test
  void testFragmentsInOrder() {
    OutputCollector output = new OutputCollector();
    output.addText("// header  \n");
    output.addInstance("m u (\n);");
    output.addText("\n");
    output.addWires("wire a;");
    Assertions.assertEquals(List.of("// header", "m u (\n);", "", "wire a;"), output.getOutputs());
    Assertions.assertEquals("// header\nm u (\n);\n\nwire a;", output.getFinalOutput());
  }

  @Test
  void testBlankFragmentsAreDropped() {
    OutputCollector output = new OutputCollector();
    output.addText("   ");
    output.addText("");
    output.addText(null);
    output.addInstance("  \n");
    output.addWires("");
    output.addWires(null);
    Assertions.assertTrue(output.getOutputs().isEmpty());
    Assertions.assertEquals("", output.getFinalOutput());
  }

  @Test
  void testClear() {
    OutputCollector output = new OutputCollector();
    output.addText("x");
    output.clear();
    Assertions.assertTrue(output.getOutputs().isEmpty());
  }
}
