package io.markpeg.parser.internal_api;

import io.markpeg.parser.api.Element;
import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.LinkTarget;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Index-addressed storage for the elements of one document.
 *
 * <p>Every element is an {@code int} id into parallel columns. Children are kept as an ordered id
 * list per parent; there are no sibling pointers. Each element can be attached to at most one
 * parent and never below itself, so child chains cannot cycle.
 *
 * <p>Not thread-safe.
 */
public final class ElementArena {
  private static final int NO_PARENT = -1;
  private static final IntList NO_CHILDREN = IntLists.emptyList();

  private final ObjectArrayList<ElementKind> kinds = new ObjectArrayList<>();
  private final ObjectArrayList<String> contents = new ObjectArrayList<>();
  private final ObjectArrayList<RawContent> raw = new ObjectArrayList<>();
  private final ObjectArrayList<LinkTarget> targets = new ObjectArrayList<>();
  private final ObjectArrayList<IntArrayList> children = new ObjectArrayList<>();
  private final IntArrayList parents = new IntArrayList();

  public int add(ElementKind kind) {
    int id = kinds.size();
    kinds.add(kind);
    contents.add(null);
    raw.add(null);
    targets.add(null);
    children.add(null);
    parents.add(NO_PARENT);
    return id;
  }

  public int addText(ElementKind kind, String text) {
    int id = add(kind);
    contents.set(id, text);
    return id;
  }

  public int addRaw(RawContent content) {
    int id = add(ElementKind.RAW);
    raw.set(id, content);
    return id;
  }

  public int addLink(ElementKind kind, LinkTarget target) {
    int id = add(kind);
    targets.set(id, target);
    return id;
  }

  /**
   * Creates a container element and attaches the given children to it.
   *
   * @param kind the container kind
   * @param childIds the children, in order
   * @return the container id
   */
  public int addContainer(ElementKind kind, IntList childIds) {
    int id = add(kind);
    appendChildren(id, childIds);
    return id;
  }

  public int size() {
    return kinds.size();
  }

  public ElementKind kind(int id) {
    return kinds.get(id);
  }

  public void setKind(int id, ElementKind kind) {
    kinds.set(id, kind);
  }

  public String contents(int id) {
    return contents.get(id);
  }

  public void setContents(int id, String text) {
    contents.set(id, text);
  }

  /** @return the RAW payload, or null if the element is not (or no longer) RAW */
  public RawContent raw(int id) {
    return raw.get(id);
  }

  public void clearRaw(int id) {
    raw.set(id, null);
  }

  public LinkTarget target(int id) {
    return targets.get(id);
  }

  /** @return a read-only view of the children of {@code id} */
  public IntList children(int id) {
    IntArrayList list = children.get(id);
    return list == null ? NO_CHILDREN : IntLists.unmodifiable(list);
  }

  public boolean hasChildren(int id) {
    IntArrayList list = children.get(id);
    return list != null && !list.isEmpty();
  }

  public int parent(int id) {
    return parents.getInt(id);
  }

  public void appendChild(int parent, int child) {
    if (parents.getInt(child) != NO_PARENT) {
      throw new IllegalStateException("Element " + child + " already has a parent");
    }
    for (int p = parent; p != NO_PARENT; p = parents.getInt(p)) {
      if (p == child) {
        throw new IllegalStateException("Element " + child + " is an ancestor of " + parent);
      }
    }
    IntArrayList list = children.get(parent);
    if (list == null) {
      list = new IntArrayList(4);
      children.set(parent, list);
    }
    list.add(child);
    parents.set(child, parent);
  }

  public void appendChildren(int parent, IntList childIds) {
    for (int i = 0; i < childIds.size(); i++) {
      appendChild(parent, childIds.getInt(i));
    }
  }

  /** Detaches all children of {@code parent}; they become free to be attached elsewhere. */
  public void clearChildren(int parent) {
    IntArrayList list = children.get(parent);
    if (list == null) {
      return;
    }
    for (int i = 0; i < list.size(); i++) {
      parents.set(list.getInt(i), NO_PARENT);
    }
    list.clear();
  }

  public Element element(int id) {
    if (id < 0 || id >= kinds.size()) {
      throw new IndexOutOfBoundsException("No element " + id);
    }
    return new Element(this, id);
  }

  /**
   * Wraps a root id sequence as a tree over this arena.
   *
   * @param roots the root ids, in document order
   * @return the tree
   */
  public ElementTree tree(IntList roots) {
    return new ElementTree(this, roots);
  }
}
