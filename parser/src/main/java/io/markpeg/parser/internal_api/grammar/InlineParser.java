package io.markpeg.parser.internal_api.grammar;

import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.LinkTarget;
import io.markpeg.parser.api.MarkdownOptions;
import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.RawContent;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the inline content of a paragraph, heading or definition title into arena elements.
 *
 * <p>Every position either starts an inline construct or is consumed as literal text, so parsing
 * always terminates. Adjacent literal runs are merged into one {@code STR} element.
 */
final class InlineParser {
  private static final Pattern AUTOLINK_URL =
      Pattern.compile("<([A-Za-z][A-Za-z0-9.+-]*://[^>\\s]+)>");
  private static final Pattern AUTOLINK_EMAIL =
      Pattern.compile("<(?:mailto:)?([-A-Za-z0-9+_./!%~$]+@[^>\\s@]+)>", Pattern.CASE_INSENSITIVE);
  private static final Pattern HTML_TAG =
      Pattern.compile("<!--.*?-->|</?[A-Za-z][A-Za-z0-9]*(?:\\s[^>]*)?/?>", Pattern.DOTALL);
  private static final Pattern ENTITY =
      Pattern.compile("&(?:#[xX][0-9a-fA-F]+|#[0-9]+|[A-Za-z][A-Za-z0-9]*);");
  private static final String ESCAPABLE = "-\\`|*_{}[]()#+.!><";

  private final BlockGrammar grammar;
  private final MarkdownOptions options;
  private final ElementArena arena;

  InlineParser(BlockGrammar grammar, ElementArena arena) {
    this.grammar = grammar;
    this.options = grammar.options();
    this.arena = arena;
  }

  /** @return ids of the inline elements of {@code text}; trailing whitespace is dropped */
  IntArrayList parse(String text) {
    return inlines(text.stripTrailing());
  }

  private IntArrayList inlines(String s) {
    IntArrayList out = new IntArrayList();
    int i = 0;
    while (i < s.length()) {
      int next = inline(s, i, out);
      i = next > i ? next : literal(s, i, out);
    }
    return out;
  }

  /** @return the offset after the construct at {@code i}, or -1 if none starts there */
  private int inline(String s, int i, IntArrayList out) {
    char c = s.charAt(i);
    switch (c) {
      case ' ':
      case '\t':
      case '\r':
      case '\n':
        return whitespace(s, i, out);
      case '\\':
        if (i + 1 < s.length() && ESCAPABLE.indexOf(s.charAt(i + 1)) >= 0) {
          addStr(out, String.valueOf(s.charAt(i + 1)));
          return i + 2;
        }
        return -1;
      case '`':
        return code(s, i, out);
      case '*':
      case '_':
        return emphasis(s, i, out);
      case '!':
        return i + 1 < s.length() && s.charAt(i + 1) == '['
            ? link(s, i + 1, ElementKind.IMAGE, out)
            : -1;
      case '[':
        if (options.notes() && s.startsWith("[^", i)) {
          int end = noteReference(s, i, out);
          if (end > 0) {
            return end;
          }
        }
        return link(s, i, ElementKind.LINK, out);
      case '^':
        return options.notes() && s.startsWith("^[", i) ? inlineNote(s, i, out) : -1;
      case '<':
        return angle(s, i, out);
      case '&':
        return entity(s, i, out);
      case '.':
      case '-':
      case '\'':
      case '"':
        return options.smart() ? smart(s, i, out) : -1;
      default:
        return -1;
    }
  }

  private boolean isSpecial(char c) {
    switch (c) {
      case ' ':
      case '\t':
      case '\r':
      case '\n':
      case '\\':
      case '`':
      case '*':
      case '_':
      case '!':
      case '[':
      case '<':
      case '&':
        return true;
      case '^':
        return options.notes();
      case '.':
      case '-':
      case '\'':
      case '"':
        return options.smart();
      default:
        return false;
    }
  }

  private int literal(String s, int i, IntArrayList out) {
    int j = i + 1;
    while (j < s.length() && !isSpecial(s.charAt(j))) {
      j++;
    }
    addStr(out, s.substring(i, j));
    return j;
  }

  private void addStr(IntArrayList out, String text) {
    if (!out.isEmpty()) {
      int last = out.getInt(out.size() - 1);
      if (arena.kind(last) == ElementKind.STR) {
        arena.setContents(last, arena.contents(last) + text);
        return;
      }
    }
    out.add(arena.addText(ElementKind.STR, text));
  }

  private int whitespace(String s, int i, IntArrayList out) {
    int j = i;
    while (j < s.length() && Character.isWhitespace(s.charAt(j))) {
      j++;
    }
    if (j >= s.length()) {
      return j;
    }
    int nl = s.indexOf('\n', i);
    if (nl >= 0 && nl < j) {
      int spaces = 0;
      for (int k = i; k < nl; k++) {
        if (s.charAt(k) == ' ') {
          spaces++;
        }
      }
      out.add(
          spaces >= 2
              ? arena.add(ElementKind.LINEBREAK)
              : arena.addText(ElementKind.SPACE, "\n"));
    } else {
      out.add(arena.addText(ElementKind.SPACE, " "));
    }
    return j;
  }

  private static int runLength(String s, int i, char c) {
    int j = i;
    while (j < s.length() && s.charAt(j) == c) {
      j++;
    }
    return j - i;
  }

  /** @return the offset just past the code span starting at {@code i}, or -1 */
  private static int codeSpanEnd(String s, int i) {
    int ticks = runLength(s, i, '`');
    int j = i + ticks;
    while (j < s.length()) {
      int close = s.indexOf('`', j);
      if (close < 0) {
        return -1;
      }
      int run = runLength(s, close, '`');
      if (run == ticks) {
        return close + run;
      }
      j = close + run;
    }
    return -1;
  }

  private int code(String s, int i, IntArrayList out) {
    int ticks = runLength(s, i, '`');
    int end = codeSpanEnd(s, i);
    if (end < 0) {
      addStr(out, s.substring(i, i + ticks));
      return i + ticks;
    }
    out.add(arena.addText(ElementKind.CODE, s.substring(i + ticks, end - ticks).strip()));
    return end;
  }

  private int emphasis(String s, int i, IntArrayList out) {
    char c = s.charAt(i);
    if (c == '_' && i > 0 && Character.isLetterOrDigit(s.charAt(i - 1))) {
      return -1;
    }
    int width = runLength(s, i, c) >= 2 ? 2 : 1;
    int end = emphasis(s, i, c, width, out);
    if (end < 0 && width == 2) {
      end = emphasis(s, i, c, 1, out);
    }
    return end;
  }

  private int emphasis(String s, int i, char c, int width, IntArrayList out) {
    int open = i + width;
    if (open >= s.length() || Character.isWhitespace(s.charAt(open))) {
      return -1;
    }
    int close = closer(s, open, c, width);
    if (close < 0) {
      return -1;
    }
    ElementKind kind = width == 2 ? ElementKind.STRONG : ElementKind.EMPH;
    out.add(arena.addContainer(kind, inlines(s.substring(open, close))));
    return close + width;
  }

  private static int closer(String s, int from, char c, int width) {
    int j = from;
    while (j < s.length()) {
      char ch = s.charAt(j);
      if (ch == '\\') {
        j += 2;
      } else if (ch == '`') {
        int end = codeSpanEnd(s, j);
        j = end < 0 ? j + 1 : end;
      } else if (ch == c) {
        int run = runLength(s, j, c);
        int at = width == 2 ? j + run - 2 : (run == 2 ? -1 : j + run - 1);
        if (at > from
            && run >= width
            && !Character.isWhitespace(s.charAt(j - 1))
            && (c != '_'
                || j + run >= s.length()
                || !Character.isLetterOrDigit(s.charAt(j + run)))) {
          return at;
        }
        j += run;
      } else {
        j++;
      }
    }
    return -1;
  }

  // ---- links

  private static int labelEnd(String s, int i) {
    int depth = 0;
    int j = i;
    while (j < s.length()) {
      char ch = s.charAt(j);
      if (ch == '\\') {
        j += 2;
        continue;
      }
      if (ch == '`') {
        int end = codeSpanEnd(s, j);
        if (end > 0) {
          j = end;
          continue;
        }
      } else if (ch == '[') {
        depth++;
      } else if (ch == ']' && --depth == 0) {
        return j;
      }
      j++;
    }
    return -1;
  }

  private int link(String s, int i, ElementKind kind, IntArrayList out) {
    int k = labelEnd(s, i);
    if (k < 0) {
      return -1;
    }
    String label = s.substring(i + 1, k);
    LinkTarget target = null;
    int end = -1;
    if (k + 1 < s.length() && s.charAt(k + 1) == '(') {
      int close = parenEnd(s, k + 1);
      if (close > 0) {
        target = inlineTarget(s.substring(k + 2, close).strip());
        end = close + 1;
      }
    } else {
      int r = k + 1;
      if (r < s.length() && (s.charAt(r) == ' ' || s.charAt(r) == '\n')) {
        r++;
      }
      int refEnd = r < s.length() && s.charAt(r) == '[' ? labelEnd(s, r) : -1;
      if (refEnd > 0) {
        String ref = s.substring(r + 1, refEnd);
        target = grammar.reference(ref.isBlank() ? label : ref);
        end = refEnd + 1;
      } else if (!label.isBlank()) {
        target = grammar.reference(label);
        end = k + 1;
      }
    }
    if (target == null) {
      return -1;
    }
    int id = arena.addLink(kind, target);
    arena.appendChildren(id, inlines(label));
    out.add(id);
    return end;
  }

  private static int parenEnd(String s, int i) {
    int depth = 0;
    for (int j = i; j < s.length(); j++) {
      char ch = s.charAt(j);
      if (ch == '\\') {
        j++;
      } else if (ch == '(') {
        depth++;
      } else if (ch == ')' && --depth == 0) {
        return j;
      }
    }
    return -1;
  }

  private static LinkTarget inlineTarget(String inner) {
    String url;
    String rest;
    if (inner.startsWith("<")) {
      int gt = inner.indexOf('>');
      if (gt < 0) {
        return null;
      }
      url = inner.substring(1, gt);
      rest = inner.substring(gt + 1).strip();
    } else {
      int sp = 0;
      while (sp < inner.length() && !Character.isWhitespace(inner.charAt(sp))) {
        sp++;
      }
      url = inner.substring(0, sp);
      rest = inner.substring(sp).strip();
    }
    if (rest.isEmpty()) {
      return new LinkTarget(url, "");
    }
    String title = BlockParser.quotedTitle(rest);
    return title == null ? null : new LinkTarget(url, title);
  }

  // ---- notes

  private int noteReference(String s, int i, IntArrayList out) {
    int close = s.indexOf(']', i + 2);
    if (close <= i + 2) {
      return -1;
    }
    String label = s.substring(i + 2, close);
    String body = grammar.note(label);
    if (body == null) {
      return -1;
    }
    if (grammar.insideNote(label)) {
      // a note reached again from its own body stays literal
      addStr(out, s.substring(i, close + 1));
      return close + 1;
    }
    int id = arena.addText(ElementKind.NOTE, label);
    arena.appendChild(id, arena.addRaw(RawContent.of(body)));
    out.add(id);
    return close + 1;
  }

  private int inlineNote(String s, int i, IntArrayList out) {
    int close = labelEnd(s, i + 1);
    if (close < 0) {
      return -1;
    }
    out.add(arena.addContainer(ElementKind.NOTE, inlines(s.substring(i + 2, close))));
    return close + 1;
  }

  // ---- angle brackets and entities

  private int angle(String s, int i, IntArrayList out) {
    Matcher m = AUTOLINK_URL.matcher(s).region(i, s.length());
    if (m.lookingAt()) {
      out.add(autolink(m.group(1), m.group(1)));
      return m.end();
    }
    m = AUTOLINK_EMAIL.matcher(s).region(i, s.length());
    if (m.lookingAt()) {
      out.add(autolink("mailto:" + m.group(1), m.group(1)));
      return m.end();
    }
    m = HTML_TAG.matcher(s).region(i, s.length());
    if (m.lookingAt()) {
      if (!options.filterHtml()) {
        out.add(arena.addText(ElementKind.HTML, m.group()));
      }
      return m.end();
    }
    return -1;
  }

  private int autolink(String url, String text) {
    int id = arena.addLink(ElementKind.LINK, new LinkTarget(url, ""));
    arena.appendChild(id, arena.addText(ElementKind.STR, text));
    return id;
  }

  private int entity(String s, int i, IntArrayList out) {
    Matcher m = ENTITY.matcher(s).region(i, s.length());
    if (!m.lookingAt()) {
      return -1;
    }
    out.add(arena.addText(ElementKind.HTML, m.group()));
    return m.end();
  }

  // ---- smart punctuation

  private int smart(String s, int i, IntArrayList out) {
    char c = s.charAt(i);
    switch (c) {
      case '.':
        if (s.startsWith("...", i)) {
          out.add(arena.add(ElementKind.ELLIPSIS));
          return i + 3;
        }
        if (s.startsWith(". . .", i)) {
          out.add(arena.add(ElementKind.ELLIPSIS));
          return i + 5;
        }
        return -1;
      case '-':
        if (s.startsWith("---", i)) {
          out.add(arena.add(ElementKind.EMDASH));
          return i + 3;
        }
        if (s.startsWith("--", i)) {
          out.add(arena.add(ElementKind.EMDASH));
          return i + 2;
        }
        if (i + 1 < s.length() && Character.isDigit(s.charAt(i + 1))) {
          out.add(arena.add(ElementKind.ENDASH));
          return i + 1;
        }
        return -1;
      case '\'':
        return singleQuoted(s, i, out);
      case '"':
        return doubleQuoted(s, i, out);
      default:
        return -1;
    }
  }

  private int singleQuoted(String s, int i, IntArrayList out) {
    boolean opens =
        (i == 0 || !Character.isLetterOrDigit(s.charAt(i - 1)))
            && i + 1 < s.length()
            && !Character.isWhitespace(s.charAt(i + 1));
    if (opens) {
      for (int j = i + 2; j < s.length(); j++) {
        if (s.charAt(j) == '\''
            && !Character.isWhitespace(s.charAt(j - 1))
            && (j + 1 >= s.length() || !Character.isLetterOrDigit(s.charAt(j + 1)))) {
          out.add(arena.addContainer(ElementKind.SINGLEQUOTED, inlines(s.substring(i + 1, j))));
          return j + 1;
        }
      }
    }
    out.add(arena.add(ElementKind.APOSTROPHE));
    return i + 1;
  }

  private int doubleQuoted(String s, int i, IntArrayList out) {
    int close = s.indexOf('"', i + 1);
    if (close <= i + 1) {
      return -1;
    }
    out.add(arena.addContainer(ElementKind.DOUBLEQUOTED, inlines(s.substring(i + 1, close))));
    return close + 1;
  }
}
