package vcg.preprocess;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MacroSetTest {

  @Test
  void testParse() {
    MacroSet macros = MacroSet.parse("DEBUG, WIDTH=32,EMPTY=");
    Assertions.assertEquals(3, macros.size());
    Assertions.assertEquals("1", macros.get("DEBUG").get());
    Assertions.assertEquals("32", macros.get("WIDTH").get());
    Assertions.assertEquals("1", macros.get("EMPTY").get());
    Assertions.assertThrows(IllegalArgumentException.class, () -> MacroSet.parse("=3"));
  }

  @Test
  void testNamesAndMaps() {
    MacroSet fromNames = MacroSet.of(List.of("A", "B"));
    Assertions.assertTrue(fromNames.isDefined("A"));
    Assertions.assertEquals("1", fromNames.get("B").get());

    MacroSet fromMap = new MacroSet(Map.of("X", "4"));
    Assertions.assertEquals("4", fromMap.get("X").get());
    Assertions.assertFalse(fromMap.isDefined("A"));
  }

  @Test
  void testCopyIsIndependent() {
    MacroSet macros = MacroSet.parse("A");
    MacroSet copy = macros.copy();
    copy.define("B", null);
    copy.undefine("A");
    Assertions.assertTrue(macros.isDefined("A"));
    Assertions.assertFalse(macros.isDefined("B"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> macros.asMap().put("C", "1"));
  }

  @Test
  void testPutAllOverrides() {
    MacroSet macros = MacroSet.parse("A=1,B=2");
    macros.putAll(MacroSet.parse("B=3"));
    Assertions.assertEquals("3", macros.get("B").get());
  }
}
