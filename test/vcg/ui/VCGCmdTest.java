package vcg.ui;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VCGCmdTest {
  @TempDir
  Path dir;

  private static final String SOURCE = "module top;\n//VCG_BEGIN\n//print('`ifdef OK')\n//VCG_END\nendmodule\n";

  @Test
  void testArgumentErrors() {
    Assertions.assertEquals(2, VCGCmd.run(new String[] {}));
    Assertions.assertEquals(2, VCGCmd.run(new String[] {"a.v", "b.v"}));
    Assertions.assertEquals(2, VCGCmd.run(new String[] {"--unknown", "a.v"}));
    Assertions.assertEquals(2, VCGCmd.run(new String[] {"a.v", "-c"}));
    Assertions.assertEquals(0, VCGCmd.run(new String[] {"-h"}));
  }

  @Test
  void testMissingInput() {
    Assertions.assertEquals(1, VCGCmd.run(new String[] {"-q", dir.resolve("none.v").toString()}));
  }

  @Test
  void testInPlace() throws IOException {
    Path file = dir.resolve("top.v");
    Files.writeString(file, SOURCE);
    Assertions.assertEquals(0, VCGCmd.run(new String[] {"-q", file.toString()}));
    Assertions.assertTrue(Files.readString(file).contains("//VCG_GEN_BEGIN_0\n`ifdef OK\n//VCG_GEN_END_0\n"));
  }

  @Test
  void testOutputAndLogFile() throws IOException {
    Path file = dir.resolve("top.v");
    Files.writeString(file, SOURCE);
    Path out = dir.resolve("top_gen.v");
    Path log = dir.resolve("vcg.log");
    Assertions.assertEquals(0, VCGCmd.run(new String[] {"-o", out.toString(), "-l", log.toString(), "-m", "A,B=2", file.toString()}));
    Assertions.assertEquals(SOURCE, Files.readString(file));
    Assertions.assertTrue(Files.readString(out).contains("`ifdef OK"));
  }

  @Test
  void testConfigAndScriptErrors() throws IOException {
    Path file = dir.resolve("top.v");
    Files.writeString(file, "//VCG_BEGIN\n//Instance('missing.v', 'm', 'u')\n//VCG_END\n");
    Assertions.assertEquals(1, VCGCmd.run(new String[] {"-q", file.toString()}));

    Path cfg = dir.resolve("cfg.yaml");
    Files.writeString(cfg, "wire_spacing: [1]\n");
    Assertions.assertEquals(1, VCGCmd.run(new String[] {"-q", "-c", cfg.toString(), file.toString()}));
    Assertions.assertEquals(1, VCGCmd.run(new String[] {"-q", "-m", "=1", file.toString()}));
  }
}
