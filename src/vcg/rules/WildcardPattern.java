package vcg.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name pattern where each <code>*</code> captures a substring, numbered from 0 in order of appearance.
 * All other characters match literally. A pattern without <code>*</code> matches only the identical name.
 */
public final class WildcardPattern {
  private final String text;
  private final Pattern regex;

  private WildcardPattern(String text, Pattern regex) {
    this.text = text;
    this.regex = regex;
  }

  public static WildcardPattern compile(String text) {
    if (text == null)
      throw new IllegalArgumentException("Pattern must not be null");
    if (text.indexOf('*') < 0)
      return new WildcardPattern(text, null);
    StringBuilder regex = new StringBuilder("^");
    int start = 0;
    int star;
    while ((star = text.indexOf('*', start)) >= 0) {
      if (star > start)
        regex.append(Pattern.quote(text.substring(start, star)));
      regex.append("(.*)");
      start = star + 1;
    }
    if (start < text.length())
      regex.append(Pattern.quote(text.substring(start)));
    regex.append("$");
    return new WildcardPattern(text, Pattern.compile(regex.toString(), Pattern.DOTALL));
  }

  public String getText() { return text; }

  public boolean hasWildcard() { return regex != null; }

  /**
   * Matches the whole name.
   * @return the captured groups (empty list for exact patterns), or empty if the name does not match
   */
  public Optional<List<String>> match(String name) {
    if (name == null)
      return Optional.empty();
    if (regex == null)
      return text.equals(name) ? Optional.of(List.of()) : Optional.empty();
    Matcher m = regex.matcher(name);
    if (!m.matches())
      return Optional.empty();
    List<String> groups = new ArrayList<>(m.groupCount());
    for (int i = 1; i <= m.groupCount(); ++i)
      groups.add(m.group(i));
    return Optional.of(groups);
  }

  public boolean matches(String name) { return match(name).isPresent(); }

  @Override
  public String toString() {
    return text;
  }
}
