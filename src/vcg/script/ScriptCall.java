package vcg.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One parsed generator statement. Argument values are plain strings; {@code None} is represented by null.
 *
 * @param function   the called name, e.g. {@code Connect}
 * @param positional positional arguments in call order
 * @param keywords   keyword arguments in call order
 * @param line       1-based line of the call within its script
 */
public record ScriptCall(String function, List<String> positional, Map<String, String> keywords, int line) {
  public ScriptCall {
    positional = Collections.unmodifiableList(positional);
    keywords = Collections.unmodifiableMap(keywords);
  }

  public int argumentCount() { return positional.size() + keywords.size(); }
}
