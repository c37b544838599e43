package io.markpeg.parser.api;

import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.RawContent;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.AbstractList;
import java.util.List;

/**
 * A read-only view of one element of a parsed document.
 *
 * <p>Views are cheap and created on demand; two views are equal when they address the same element
 * of the same arena. A view stays valid as long as the arena it came from is not cleared.
 */
public final class Element {
  private final ElementArena arena;
  private final int id;

  public Element(ElementArena arena, int id) {
    this.arena = arena;
    this.id = id;
  }

  public int id() {
    return id;
  }

  public ElementKind kind() {
    return arena.kind(id);
  }

  /** @return the text payload, or null for kinds without one */
  public String contents() {
    return arena.contents(id);
  }

  /** @return the link destination for {@code LINK} and {@code IMAGE}, null otherwise */
  public LinkTarget target() {
    return arena.target(id);
  }

  /** @return the deferred segments of a RAW element, null once resolved */
  public RawContent raw() {
    return arena.raw(id);
  }

  public boolean hasChildren() {
    return arena.hasChildren(id);
  }

  public List<Element> children() {
    IntList ids = arena.children(id);
    return new AbstractList<>() {
      @Override
      public Element get(int index) {
        return new Element(arena, ids.getInt(index));
      }

      @Override
      public int size() {
        return ids.size();
      }
    };
  }

  /**
   * Concatenates the text of this element and its descendants in document order. Smart
   * punctuation elements contribute their plain-text equivalent.
   *
   * @return the plain text
   */
  public String text() {
    StringBuilder sb = new StringBuilder();
    appendText(sb);
    return sb.toString();
  }

  private void appendText(StringBuilder sb) {
    switch (kind()) {
      case LINEBREAK:
        sb.append('\n');
        break;
      case ELLIPSIS:
        sb.append("...");
        break;
      case EMDASH:
        sb.append("---");
        break;
      case ENDASH:
        sb.append("--");
        break;
      case APOSTROPHE:
        sb.append('\'');
        break;
      case RAW:
        sb.append(raw().text());
        break;
      default:
        if (kind().carriesText() && contents() != null) {
          sb.append(contents());
        }
    }
    for (Element child : children()) {
      child.appendText(sb);
    }
  }

  /**
   * @param kind the kind to look for
   * @return {@literal true} if this element or any descendant has the given kind
   */
  public boolean contains(ElementKind kind) {
    if (kind() == kind) {
      return true;
    }
    for (Element child : children()) {
      if (child.contains(kind)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Element)) return false;
    Element that = (Element) o;
    return arena == that.arena && id == that.id;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(arena) + id;
  }

  @Override
  public String toString() {
    return "Element{" + "id=" + id + ", kind=" + kind() + '}';
  }
}
