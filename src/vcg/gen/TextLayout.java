package vcg.gen;

/** Column helpers for generated Verilog text. */
final class TextLayout {
  private TextLayout() {}

  /** Pads the text with spaces to at least the given width. */
  static String padRight(String text, int width) {
    if (text.length() >= width)
      return text;
    return text + " ".repeat(width - text.length());
  }
}
