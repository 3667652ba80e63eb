package vcg.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves <code>/* ... *&#47;</code> comments out of a target pattern so that their text is not taken for
 * wildcards or function calls, and puts them back afterwards.
 */
public final class InlineComments {
  private static final Pattern COMMENT = Pattern.compile("/\\*([^*]*(?:\\*(?!/)[^*]*)*)\\*/");
  private static final Pattern PLACEHOLDER = Pattern.compile("__COMMENT_(\\d+)__");

  /**
   * @param text pattern text with each comment replaced by <code>__COMMENT_i__</code>
   * @param comments comment bodies without delimiters, indexed by placeholder number
   */
  public record Extracted(String text, List<String> comments) {
    public Extracted {
      comments = List.copyOf(comments);
    }

    public boolean hasComments() { return !comments.isEmpty(); }
  }

  private InlineComments() {}

  public static Extracted extract(String pattern) {
    if (pattern == null)
      return new Extracted(null, List.of());
    List<String> comments = new ArrayList<>();
    Matcher m = COMMENT.matcher(pattern);
    StringBuilder text = new StringBuilder();
    while (m.find()) {
      m.appendReplacement(text, Matcher.quoteReplacement(placeholder(comments.size())));
      comments.add(m.group(1));
    }
    m.appendTail(text);
    return new Extracted(text.toString(), comments);
  }

  public static String placeholder(int index) { return "__COMMENT_" + index + "__"; }

  /** Replaces each placeholder with its original comment. */
  public static String restore(String text, List<String> comments) {
    String result = text;
    for (int i = 0; i < comments.size(); ++i)
      result = result.replace(placeholder(i), "/*" + comments.get(i) + "*/");
    return result;
  }

  /** Removes all placeholders. */
  public static String strip(String text) { return PLACEHOLDER.matcher(text).replaceAll(""); }

  /** All comments in their original form, separated by spaces. */
  public static String render(List<String> comments) {
    StringBuilder text = new StringBuilder();
    for (String comment : comments) {
      if (text.length() > 0)
        text.append(' ');
      text.append("/*").append(comment).append("*/");
    }
    return text.toString();
  }
}
