package io.markpeg.parser.internal_api.grammar;

/**
 * Line-oriented helpers over a text buffer. Positions are offsets into the buffer; a line runs up
 * to, but not including, its {@code '\n'} (and a {@code '\r'} right before it). The last line of a
 * buffer may lack a newline.
 */
final class Lines {
  private Lines() {}

  /** @return the offset of the newline ending the line at {@code pos}, or the buffer length */
  static int lineEnd(String s, int pos) {
    int nl = s.indexOf('\n', pos);
    return nl < 0 ? s.length() : nl;
  }

  /** @return the offset of the line following the one at {@code pos} */
  static int nextLine(String s, int pos) {
    int end = lineEnd(s, pos);
    return end < s.length() ? end + 1 : end;
  }

  /** @return the text of the line at {@code pos}, without line terminator */
  static String line(String s, int pos) {
    int end = lineEnd(s, pos);
    if (end > pos && s.charAt(end - 1) == '\r') {
      end--;
    }
    return s.substring(pos, end);
  }

  /** @return {@literal true} if the line at {@code pos} holds only blanks */
  static boolean isBlank(String s, int pos) {
    int end = lineEnd(s, pos);
    for (int i = pos; i < end; i++) {
      char c = s.charAt(i);
      if (c != ' ' && c != '\t' && c != '\r') {
        return false;
      }
    }
    return true;
  }

  /** @return the number of leading spaces of the line at {@code pos} */
  static int indent(String s, int pos) {
    int end = lineEnd(s, pos);
    int i = pos;
    while (i < end && s.charAt(i) == ' ') {
      i++;
    }
    return i - pos;
  }

  /** @return the offset of the first line at or after {@code pos} that is not blank */
  static int skipBlank(String s, int pos) {
    while (pos < s.length() && isBlank(s, pos)) {
      pos = nextLine(s, pos);
    }
    return pos;
  }

  /** @return the line at {@code pos} with up to {@code max} leading spaces removed */
  static String stripIndent(String s, int pos, int max) {
    String line = line(s, pos);
    int n = 0;
    while (n < max && n < line.length() && line.charAt(n) == ' ') {
      n++;
    }
    return line.substring(n);
  }

  /** @return offset just past up to three leading spaces at {@code pos}, the non-indent space */
  static int nonIndentSpace(String s, int pos) {
    int ind = indent(s, pos);
    return ind <= 3 ? pos + ind : -1;
  }

  static boolean isSpaceChar(char c) {
    return c == ' ' || c == '\t';
  }

  /**
   * Matches a horizontal rule: three or more {@code *}, {@code -} or {@code _} characters, spaces
   * allowed between them, nothing else on the line.
   */
  static boolean isHorizontalRule(String s, int pos) {
    int p = nonIndentSpace(s, pos);
    if (p < 0) {
      return false;
    }
    int end = lineEnd(s, pos);
    if (p >= end) {
      return false;
    }
    char c = s.charAt(p);
    if (c != '*' && c != '-' && c != '_') {
      return false;
    }
    int count = 0;
    for (int i = p; i < end; i++) {
      char ch = s.charAt(i);
      if (ch == c) {
        count++;
      } else if (!isSpaceChar(ch) && ch != '\r') {
        return false;
      }
    }
    return count >= 3;
  }

  /** Matches a Setext underline: a run of {@code =} or {@code -} optionally followed by spaces. */
  static int setextLevel(String s, int pos) {
    if (pos >= s.length()) {
      return 0;
    }
    String line = line(s, pos).stripTrailing();
    if (line.isEmpty()) {
      return 0;
    }
    char c = line.charAt(0);
    if (c != '=' && c != '-') {
      return 0;
    }
    for (int i = 1; i < line.length(); i++) {
      if (line.charAt(i) != c) {
        return 0;
      }
    }
    return c == '=' ? 1 : 2;
  }
}
