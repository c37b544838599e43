package io.markpeg.parser.internal_api.grammar;

import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.GrammarException;
import io.markpeg.parser.api.LinkTarget;
import io.markpeg.parser.api.MarkdownOptions;
import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.RawContent;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent matcher for block structure over one buffer.
 *
 * <p>Block rules are tried in a fixed order after skipping blank lines; paragraphs come last and
 * always match, so every call to {@link #block()} at a non-blank position consumes input. Nested
 * block content (block quotes, list items, definition data) is not parsed here: it is captured as
 * a RAW element and resolved later by re-parsing its text as a document of its own.
 */
final class BlockParser {
  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "address", "blockquote", "center", "dir", "div", "dl", "fieldset", "form", "h1", "h2",
          "h3", "h4", "h5", "h6", "hr", "isindex", "menu", "noframes", "noscript", "ol", "p", "pre",
          "table", "ul", "dd", "dt", "frameset", "li", "tbody", "td", "tfoot", "th", "thead", "tr",
          "script", "style");

  record ReferenceDef(String label, LinkTarget target, int end) {}

  record NoteDef(String label, String body, int end) {}

  record ItemBody(RawContent content, int end, boolean blankInside) {}

  record HtmlSpan(String tag, int end) {}

  private final BlockGrammar grammar;
  private final MarkdownOptions options;
  private final String src;
  private final int len;
  private final ElementArena arena;
  private final InlineParser inlines;
  private int pos;

  BlockParser(BlockGrammar grammar, String src, int pos, ElementArena arena) {
    this.grammar = grammar;
    this.options = grammar.options();
    this.src = src;
    this.len = src.length();
    this.pos = pos;
    this.arena = arena;
    this.inlines = arena != null ? new InlineParser(grammar, arena) : null;
  }

  int position() {
    return pos;
  }

  /** Parses blocks up to the end of the buffer. */
  IntArrayList document() throws GrammarException {
    IntArrayList ids = new IntArrayList();
    int id;
    while ((id = block()) >= 0) {
      ids.add(id);
    }
    return ids;
  }

  /**
   * Skips blank lines and parses the next block.
   *
   * @return the block id, or -1 if nothing but blank lines was left
   */
  int block() throws GrammarException {
    pos = Lines.skipBlank(src, pos);
    if (pos >= len) {
      return -1;
    }
    int start = pos;
    int id = blockQuote();
    if (id < 0) id = verbatim();
    if (id < 0 && options.notes()) id = noteBlock();
    if (id < 0) id = referenceBlock();
    if (id < 0) id = horizontalRule();
    if (id < 0) id = heading();
    if (id < 0) id = list();
    if (id < 0) id = htmlBlock();
    if (id < 0 && options.definitionLists()) id = definitionList();
    if (id < 0) id = paragraph();
    if (pos <= start) {
      throw GrammarException.noMatch("Block", start, src.substring(start));
    }
    return id;
  }

  /** Registers every link reference definition found at a line start. */
  void scanReferences(LabelTable<LinkTarget> table) {
    while (pos < len) {
      ReferenceDef ref = Lines.isBlank(src, pos) ? null : matchReference(pos);
      if (ref != null) {
        table.define(ref.label(), ref.target());
        pos = ref.end();
      } else {
        pos = Lines.nextLine(src, pos);
      }
    }
  }

  /** Registers every footnote definition found at a line start. */
  void scanNotes(LabelTable<String> table) {
    while (pos < len) {
      NoteDef note = Lines.isBlank(src, pos) ? null : matchNote(pos);
      if (note != null) {
        table.define(note.label(), note.body());
        pos = note.end();
      } else {
        pos = Lines.nextLine(src, pos);
      }
    }
  }

  // ---- block quotes

  private int quoteMark(int p) {
    int q = Lines.nonIndentSpace(src, p);
    return q >= 0 && q < Lines.lineEnd(src, p) && src.charAt(q) == '>' ? q : -1;
  }

  private int blockQuote() {
    if (quoteMark(pos) < 0) {
      return -1;
    }
    StringBuilder raw = new StringBuilder();
    int q;
    while (pos < len && (q = quoteMark(pos)) >= 0) {
      int p = q + 1;
      if (p < Lines.lineEnd(src, pos) && src.charAt(p) == ' ') {
        p++;
      }
      raw.append(Lines.line(src, p)).append('\n');
      pos = Lines.nextLine(src, pos);
      while (pos < len && !Lines.isBlank(src, pos) && quoteMark(pos) < 0) {
        raw.append(Lines.line(src, pos)).append('\n');
        pos = Lines.nextLine(src, pos);
      }
      while (pos < len && Lines.isBlank(src, pos)) {
        raw.append('\n');
        pos = Lines.nextLine(src, pos);
      }
    }
    int id = arena.add(ElementKind.BLOCKQUOTE);
    arena.appendChild(id, arena.addRaw(RawContent.of(raw.toString())));
    return id;
  }

  // ---- indented code

  private boolean isCodeLine(int p) {
    return !Lines.isBlank(src, p) && Lines.indent(src, p) >= 4;
  }

  private int verbatim() {
    if (!isCodeLine(pos)) {
      return -1;
    }
    StringBuilder text = new StringBuilder();
    while (true) {
      while (pos < len && isCodeLine(pos)) {
        text.append(Lines.stripIndent(src, pos, 4)).append('\n');
        pos = Lines.nextLine(src, pos);
      }
      int q = Lines.skipBlank(src, pos);
      if (q > pos && q < len && isCodeLine(q)) {
        for (int b = pos; b < q; b = Lines.nextLine(src, b)) {
          text.append('\n');
        }
        pos = q;
      } else {
        break;
      }
    }
    return arena.addText(ElementKind.VERBATIM, text.toString());
  }

  // ---- definitions

  private int noteBlock() {
    NoteDef note = matchNote(pos);
    if (note == null) {
      return -1;
    }
    pos = note.end();
    return arena.addText(ElementKind.NOTE, note.label());
  }

  NoteDef matchNote(int p) {
    int q = Lines.nonIndentSpace(src, p);
    if (q < 0 || !src.startsWith("[^", q)) {
      return null;
    }
    int end = Lines.lineEnd(src, p);
    int close = src.indexOf(']', q + 2);
    if (close < 0
        || close >= end
        || close == q + 2
        || close + 1 >= end
        || src.charAt(close + 1) != ':') {
      return null;
    }
    String label = src.substring(q + 2, close);
    StringBuilder body = new StringBuilder(Lines.line(src, close + 2).strip()).append('\n');
    int r = Lines.nextLine(src, p);
    while (true) {
      while (r < len && !Lines.isBlank(src, r)) {
        body.append(optionallyIndented(r)).append('\n');
        r = Lines.nextLine(src, r);
      }
      int s = Lines.skipBlank(src, r);
      for (int b = r; b < s; b = Lines.nextLine(src, b)) {
        body.append('\n');
      }
      r = s;
      if (r >= len || Lines.indent(src, r) < 4) {
        break;
      }
    }
    return new NoteDef(label, body.toString(), r);
  }

  private int referenceBlock() {
    ReferenceDef ref = matchReference(pos);
    if (ref == null) {
      return -1;
    }
    pos = ref.end();
    int id = arena.addLink(ElementKind.REFERENCE, ref.target());
    arena.setContents(id, ref.label());
    return id;
  }

  ReferenceDef matchReference(int p) {
    int q = Lines.nonIndentSpace(src, p);
    if (q < 0) {
      return null;
    }
    String line = Lines.line(src, q);
    if (!line.startsWith("[")
        || line.startsWith("[]")
        || (options.notes() && line.startsWith("[^"))) {
      return null;
    }
    int close = line.indexOf(']');
    int nested = line.indexOf('[', 1);
    if (close < 0 || (nested >= 0 && nested < close)
        || close + 1 >= line.length() || line.charAt(close + 1) != ':') {
      return null;
    }
    String label = line.substring(1, close);
    String rest = line.substring(close + 2).strip();
    int next = Lines.nextLine(src, p);
    if (rest.isEmpty()) {
      if (next >= len || Lines.isBlank(src, next)) {
        return null;
      }
      rest = Lines.line(src, next).strip();
      next = Lines.nextLine(src, next);
    }
    String url;
    String after;
    if (rest.startsWith("<")) {
      int gt = rest.indexOf('>');
      if (gt < 0) {
        return null;
      }
      url = rest.substring(1, gt);
      after = rest.substring(gt + 1).strip();
    } else {
      int sp = indexOfWhitespace(rest);
      url = sp < 0 ? rest : rest.substring(0, sp);
      after = sp < 0 ? "" : rest.substring(sp).strip();
    }
    if (url.isEmpty()) {
      return null;
    }
    String title = "";
    if (!after.isEmpty()) {
      title = quotedTitle(after);
      if (title == null) {
        return null;
      }
    } else if (next < len && !Lines.isBlank(src, next)) {
      String candidate = quotedTitle(Lines.line(src, next).strip());
      if (candidate != null) {
        title = candidate;
        next = Lines.nextLine(src, next);
      }
    }
    return new ReferenceDef(label, new LinkTarget(url, title), Lines.skipBlank(src, next));
  }

  static String quotedTitle(String s) {
    if (s.length() < 2) {
      return null;
    }
    char open = s.charAt(0);
    char close = s.charAt(s.length() - 1);
    if ((open == '"' && close == '"')
        || (open == '\'' && close == '\'')
        || (open == '(' && close == ')')) {
      return s.substring(1, s.length() - 1);
    }
    return null;
  }

  private static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  // ---- rules and headings

  private int horizontalRule() {
    if (!Lines.isHorizontalRule(src, pos)) {
      return -1;
    }
    int next = Lines.nextLine(src, pos);
    if (next < len && !Lines.isBlank(src, next)) {
      return -1;
    }
    pos = Lines.skipBlank(src, next);
    return arena.add(ElementKind.HRULE);
  }

  private int heading() {
    if (src.charAt(pos) == '#') {
      String line = Lines.line(src, pos);
      int level = 0;
      while (level < 6 && level < line.length() && line.charAt(level) == '#') {
        level++;
      }
      String text = line.substring(level).strip().replaceFirst("\\s*#+$", "");
      if (text.isEmpty()) {
        return -1;
      }
      pos = Lines.nextLine(src, pos);
      return arena.addContainer(ElementKind.heading(level), inlines.parse(text));
    }
    int next = Lines.nextLine(src, pos);
    int level = next < len ? Lines.setextLevel(src, next) : 0;
    if (level == 0) {
      return -1;
    }
    String text = Lines.line(src, pos).strip();
    pos = Lines.nextLine(src, next);
    return arena.addContainer(ElementKind.heading(level), inlines.parse(text));
  }

  // ---- lists

  /** @return the content offset of a bullet or enumerator item at {@code p}, or -1 */
  private int markerEnd(int p) {
    int q = Lines.nonIndentSpace(src, p);
    return q < 0 ? -1 : markerAt(p, q);
  }

  /** Like {@link #markerEnd(int)} but for a marker that may carry one extra level of indent. */
  private int indentedMarkerEnd(int p) {
    int ind = Lines.indent(src, p);
    if (ind < 4) {
      return markerEnd(p);
    }
    return ind - 4 <= 3 ? markerAt(p, p + ind) : -1;
  }

  private int markerAt(int p, int q) {
    int end = Lines.lineEnd(src, p);
    if (q >= end) {
      return -1;
    }
    char c = src.charAt(q);
    int r;
    if (c == '*' || c == '+' || c == '-') {
      if (Lines.isHorizontalRule(src, p)) {
        return -1;
      }
      r = q + 1;
    } else if (isDigit(c)) {
      r = q;
      while (r < end && isDigit(src.charAt(r))) {
        r++;
      }
      if (r >= end || src.charAt(r) != '.') {
        return -1;
      }
      r++;
    } else {
      return -1;
    }
    if (r >= end || !Lines.isSpaceChar(src.charAt(r))) {
      return -1;
    }
    while (r < end && Lines.isSpaceChar(src.charAt(r))) {
      r++;
    }
    return r < end && src.charAt(r) != '\r' ? r : -1;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private int list() {
    int content = markerEnd(pos);
    if (content < 0) {
      return -1;
    }
    boolean ordered = isDigit(src.charAt(Lines.nonIndentSpace(src, pos)));
    List<ItemBody> items = new ArrayList<>();
    boolean loose = false;
    while (true) {
      ItemBody item = itemBody(content, p -> markerEnd(p) >= 0);
      items.add(item);
      loose |= item.blankInside();
      pos = item.end();
      int q = Lines.skipBlank(src, pos);
      content = q < len ? markerEnd(q) : -1;
      if (content < 0) {
        pos = q;
        break;
      }
      loose |= q > pos;
      pos = q;
    }
    IntArrayList ids = new IntArrayList(items.size());
    for (ItemBody item : items) {
      RawContent raw = loose ? item.content().withSuffix("\n\n") : item.content();
      int li = arena.add(ElementKind.LISTITEM);
      arena.appendChild(li, arena.addRaw(raw));
      ids.add(li);
    }
    return arena.addContainer(ordered ? ElementKind.ORDEREDLIST : ElementKind.BULLETLIST, ids);
  }

  /**
   * Captures the text of one list item (or definition) starting at its content offset.
   *
   * <p>The first block runs until a blank line, a new item or a rule. Blocks indented by four
   * spaces that follow belong to the item too. When such a block opens with a list marker right
   * after the first block, with no blank line between them, the item text is split into a new
   * segment there, so each part is parsed on its own.
   */
  private ItemBody itemBody(int contentStart, IntPredicate itemStart) {
    List<String> segments = new ArrayList<>(2);
    StringBuilder cur = new StringBuilder();
    cur.append(Lines.line(src, contentStart)).append('\n');
    int p = Lines.nextLine(src, contentStart);
    boolean firstBlock = true;
    boolean blankInside = false;
    while (p < len) {
      if (Lines.isBlank(src, p)) {
        int q = Lines.skipBlank(src, p);
        if (q < len && Lines.indent(src, q) >= 4) {
          for (int b = p; b < q; b = Lines.nextLine(src, b)) {
            cur.append('\n');
          }
          p = q;
          firstBlock = false;
          blankInside = true;
          continue;
        }
        break;
      }
      int ind = Lines.indent(src, p);
      if (ind < 4 && (itemStart.test(p) || Lines.isHorizontalRule(src, p))) {
        break;
      }
      if (ind >= 4 && indentedMarkerEnd(p) >= 0 && firstBlock) {
        segments.add(cur.toString());
        cur.setLength(0);
        firstBlock = false;
      }
      cur.append(optionallyIndented(p)).append('\n');
      p = Lines.nextLine(src, p);
    }
    segments.add(cur.toString());
    return new ItemBody(new RawContent(segments), p, blankInside);
  }

  private String optionallyIndented(int p) {
    return Lines.indent(src, p) >= 4 ? Lines.stripIndent(src, p, 4) : Lines.line(src, p);
  }

  // ---- raw HTML

  private int htmlBlock() {
    if (src.charAt(pos) != '<') {
      return -1;
    }
    HtmlSpan span = htmlSpan(pos);
    if (span == null) {
      return -1;
    }
    int lineEnd = Lines.lineEnd(src, span.end());
    if (!src.substring(span.end(), lineEnd).isBlank()) {
      return -1;
    }
    int next = lineEnd < len ? lineEnd + 1 : lineEnd;
    if (next < len && !Lines.isBlank(src, next)) {
      return -1;
    }
    String html = src.substring(pos, span.end());
    pos = Lines.skipBlank(src, next);
    boolean filtered = "style".equals(span.tag()) ? options.filterStyles() : options.filterHtml();
    return filtered ? arena.add(ElementKind.LIST) : arena.addText(ElementKind.HTMLBLOCK, html);
  }

  private HtmlSpan htmlSpan(int p) {
    if (src.startsWith("<!--", p)) {
      int close = src.indexOf("-->", p + 4);
      return close < 0 ? null : new HtmlSpan("!--", close + 3);
    }
    int i = p + 1;
    while (i < len && Character.isLetterOrDigit(src.charAt(i))) {
      i++;
    }
    String tag = src.substring(p + 1, i).toLowerCase(Locale.ROOT);
    if (!BLOCK_TAGS.contains(tag) || i >= len) {
      return null;
    }
    char after = src.charAt(i);
    if (after != '>' && after != '/' && !Character.isWhitespace(after)) {
      return null;
    }
    int gt = src.indexOf('>', i);
    if (gt < 0) {
      return null;
    }
    if (src.charAt(gt - 1) == '/' || tag.equals("hr")) {
      return new HtmlSpan(tag, gt + 1);
    }
    Matcher m =
        Pattern.compile("<(/?)" + tag + "(?=[\\s>/])", Pattern.CASE_INSENSITIVE).matcher(src);
    int depth = 1;
    int from = gt + 1;
    while (m.find(from)) {
      depth += m.group(1).isEmpty() ? 1 : -1;
      int close = src.indexOf('>', m.end());
      if (close < 0) {
        return null;
      }
      if (depth == 0) {
        return new HtmlSpan(tag, close + 1);
      }
      from = close + 1;
    }
    return null;
  }

  // ---- definition lists

  private int defMarkEnd(int p) {
    int q = Lines.nonIndentSpace(src, p);
    int end = Lines.lineEnd(src, p);
    if (q < 0 || q + 1 >= end) {
      return -1;
    }
    char c = src.charAt(q);
    if ((c != ':' && c != '~') || !Lines.isSpaceChar(src.charAt(q + 1))) {
      return -1;
    }
    int r = q + 1;
    while (r < end && Lines.isSpaceChar(src.charAt(r))) {
      r++;
    }
    return r < end && src.charAt(r) != '\r' ? r : -1;
  }

  private boolean startsDefinition(int p) {
    if (p >= len || Lines.isBlank(src, p) || defMarkEnd(p) >= 0) {
      return false;
    }
    int q = p;
    while (q < len && !Lines.isBlank(src, q) && defMarkEnd(q) < 0) {
      q = Lines.nextLine(src, q);
    }
    return q < len && defMarkEnd(q) >= 0;
  }

  private int definitionList() {
    if (!startsDefinition(pos)) {
      return -1;
    }
    IntArrayList ids = new IntArrayList();
    while (startsDefinition(pos)) {
      while (!Lines.isBlank(src, pos) && defMarkEnd(pos) < 0) {
        IntArrayList title = inlines.parse(Lines.line(src, pos).strip());
        ids.add(arena.addContainer(ElementKind.DEFTITLE, title));
        pos = Lines.nextLine(src, pos);
      }
      int content;
      while (pos < len && (content = defMarkEnd(pos)) >= 0) {
        ItemBody data = itemBody(content, p -> defMarkEnd(p) >= 0 || markerEnd(p) >= 0);
        int dd = arena.add(ElementKind.DEFDATA);
        arena.appendChild(dd, arena.addRaw(data.content()));
        ids.add(dd);
        pos = data.end();
      }
      pos = Lines.skipBlank(src, pos);
    }
    return arena.addContainer(ElementKind.DEFINITIONLIST, ids);
  }

  // ---- paragraphs

  private boolean endsParagraph(int p) {
    if (Lines.isBlank(src, p)) {
      return true;
    }
    char c = src.charAt(p);
    if (c == '>' || c == '#') {
      return true;
    }
    int next = Lines.nextLine(src, p);
    return next < len && Lines.setextLevel(src, next) > 0;
  }

  private int paragraph() {
    StringBuilder text = new StringBuilder(Lines.line(src, pos).stripLeading());
    int p = Lines.nextLine(src, pos);
    while (p < len && !endsParagraph(p)) {
      text.append('\n').append(Lines.line(src, p).stripLeading());
      p = Lines.nextLine(src, p);
    }
    ElementKind kind = ElementKind.PLAIN;
    if (p < len && Lines.isBlank(src, p)) {
      kind = ElementKind.PARA;
      p = Lines.skipBlank(src, p);
    }
    pos = p;
    return arena.addContainer(kind, inlines.parse(text.toString()));
  }
}
