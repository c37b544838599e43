package io.markpeg.parser.api;

import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.RawContent;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered run of top-level elements produced by one document-level grammar invocation.
 *
 * <p>This is the unit handed to {@link Formatter#formatBlock(ElementTree)}. It may be empty when
 * the grammar matched nothing but blank lines.
 */
public final class ElementTree {
  private final ElementArena arena;
  private final IntArrayList roots;

  public ElementTree(ElementArena arena, IntList roots) {
    this.arena = arena;
    this.roots = new IntArrayList(roots);
  }

  public static ElementTree empty(ElementArena arena) {
    return new ElementTree(arena, IntLists.emptyList());
  }

  public ElementArena arena() {
    return arena;
  }

  /** @return the root ids in document order, read-only */
  public IntList rootIds() {
    return IntLists.unmodifiable(roots);
  }

  public List<Element> roots() {
    List<Element> list = new ArrayList<>(roots.size());
    for (int i = 0; i < roots.size(); i++) {
      list.add(new Element(arena, roots.getInt(i)));
    }
    return list;
  }

  public boolean isEmpty() {
    return roots.isEmpty();
  }

  public int size() {
    return roots.size();
  }

  /**
   * @param kind the kind to look for
   * @return {@literal true} if any element of the tree, at any depth, has the given kind
   */
  public boolean contains(ElementKind kind) {
    for (Element root : roots()) {
      if (root.contains(kind)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Renders the structure as indented text, one element per line, e.g. {@code PARA} followed by
   * {@code   STR "text"}. Meant for diagnostics and tests.
   *
   * @return the outline
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    for (Element root : roots()) {
      describe(root, 0, sb);
    }
    return sb.toString();
  }

  private static void describe(Element e, int depth, StringBuilder sb) {
    sb.append("  ".repeat(depth)).append(e.kind());
    RawContent raw = e.raw();
    if (raw != null) {
      sb.append(' ').append(quote(raw.toMarked()));
    } else if (e.contents() != null) {
      sb.append(' ').append(quote(e.contents()));
    }
    LinkTarget target = e.target();
    if (target != null) {
      sb.append(" -> ").append(target.url());
      if (!target.title().isEmpty()) {
        sb.append(' ').append(quote(target.title()));
      }
    }
    sb.append('\n');
    for (Element child : e.children()) {
      describe(child, depth + 1, sb);
    }
  }

  private static String quote(String s) {
    return '"'
        + s.replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace(String.valueOf(RawContent.BOUNDARY_MARKER), "\\u0001")
        + '"';
  }

  @Override
  public String toString() {
    return "ElementTree{roots=" + roots + '}';
  }
}
