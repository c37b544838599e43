package io.markpeg.parser.internal_api;

import static org.junit.jupiter.api.Assertions.*;

import io.markpeg.parser.api.Element;
import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.LinkTarget;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ElementArenaTest {

  private ElementArena arena;

  @BeforeEach
  void setUp() {
    arena = new ElementArena();
  }

  @Test
  void idsAreDense() {
    assertEquals(0, arena.add(ElementKind.HRULE));
    assertEquals(1, arena.addText(ElementKind.STR, "x"));
    assertEquals(2, arena.addRaw(RawContent.of("raw")));
    assertEquals(3, arena.size());
  }

  @Test
  void containerKeepsChildOrder() {
    int a = arena.addText(ElementKind.STR, "a");
    int b = arena.addText(ElementKind.STR, "b");
    int c = arena.addText(ElementKind.STR, "c");
    int para = arena.addContainer(ElementKind.PARA, IntList.of(a, b, c));

    assertEquals(IntList.of(a, b, c), arena.children(para));
    assertEquals(para, arena.parent(b));
    assertEquals("abc", arena.element(para).text());
  }

  @Test
  void childrenViewIsReadOnly() {
    int para = arena.addContainer(ElementKind.PARA, IntList.of(arena.add(ElementKind.SPACE)));

    assertThrows(UnsupportedOperationException.class, () -> arena.children(para).add(5));
  }

  @Test
  void elementCannotHaveTwoParents() {
    int child = arena.addText(ElementKind.STR, "x");
    arena.addContainer(ElementKind.PARA, IntList.of(child));
    int other = arena.add(ElementKind.PLAIN);

    assertThrows(IllegalStateException.class, () -> arena.appendChild(other, child));
  }

  @Test
  void cyclesAreRejected() {
    int outer = arena.add(ElementKind.BLOCKQUOTE);
    int inner = arena.add(ElementKind.LIST);
    arena.appendChild(outer, inner);

    assertThrows(IllegalStateException.class, () -> arena.appendChild(inner, outer));
    assertThrows(IllegalStateException.class, () -> arena.appendChild(inner, inner));
  }

  @Test
  void clearedChildrenCanMove() {
    int child = arena.addText(ElementKind.STR, "x");
    int first = arena.addContainer(ElementKind.PARA, IntList.of(child));
    int second = arena.add(ElementKind.PLAIN);

    arena.clearChildren(first);
    arena.appendChild(second, child);

    assertFalse(arena.hasChildren(first));
    assertEquals(second, arena.parent(child));
  }

  @Test
  void linkTargetsAndRawPayloadsAreStored() {
    int link = arena.addLink(ElementKind.LINK, new LinkTarget("/u", "t"));
    int raw = arena.addRaw(RawContent.of("a", "b"));

    assertEquals(new LinkTarget("/u", "t"), arena.target(link));
    assertEquals(RawContent.of("a", "b"), arena.raw(raw));
    arena.clearRaw(raw);
    assertNull(arena.raw(raw));
  }

  @Test
  void treeDescribesStructure() {
    int link = arena.addLink(ElementKind.LINK, new LinkTarget("http://e.org", "Home"));
    arena.appendChild(link, arena.addText(ElementKind.STR, "site"));
    int see = arena.addText(ElementKind.STR, "see\n");
    int para = arena.addContainer(ElementKind.PARA, IntList.of(see, link));
    ElementTree tree = arena.tree(IntList.of(para));

    assertEquals(
        "PARA\n  STR \"see\\n\"\n  LINK -> http://e.org \"Home\"\n    STR \"site\"\n",
        tree.describe());
    assertTrue(tree.contains(ElementKind.LINK));
    assertFalse(tree.contains(ElementKind.RAW));
  }

  @Test
  void elementsAreViewsOverTheArena() {
    int id = arena.addText(ElementKind.STR, "x");
    Element e = arena.element(id);

    arena.setContents(id, "y");

    assertEquals("y", e.contents());
    assertEquals(e, arena.element(id));
    assertThrows(IndexOutOfBoundsException.class, () -> arena.element(99));
  }

  @Test
  void treeCopiesRootList() {
    IntArrayList roots = new IntArrayList();
    roots.add(arena.add(ElementKind.HRULE));
    ElementTree tree = arena.tree(roots);

    roots.add(arena.add(ElementKind.HRULE));

    assertEquals(1, tree.size());
  }
}
