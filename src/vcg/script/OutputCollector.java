package vcg.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects generated fragments in statement order.
 */
public class OutputCollector {
  private final List<String> outputs = new ArrayList<>();

  /**
   * Adds printed text. A text consisting only of whitespace with a line break adds an empty line,
   * other text is added with trailing whitespace removed.
   */
  public void addText(String text) {
    if (text == null || text.isEmpty())
      return;
    if (!text.isBlank())
      outputs.add(text.stripTrailing());
    else if (text.contains("\n"))
      outputs.add("");
  }

  public void addInstance(String instanceCode) {
    if (instanceCode != null && !instanceCode.isBlank())
      outputs.add(instanceCode);
  }

  public void addWires(String wiresCode) {
    if (wiresCode != null && !wiresCode.isBlank())
      outputs.add(wiresCode);
  }

  public List<String> getOutputs() { return Collections.unmodifiableList(outputs); }

  /** @return all fragments joined by line breaks */
  public String getFinalOutput() { return String.join("\n", outputs); }

  public void clear() { outputs.clear(); }
}
