package io.markpeg.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import io.markpeg.parser.api.Element;
import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.MarkdownOptions;
import io.markpeg.parser.api.ResolutionException;
import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.GrammarRule;
import io.markpeg.parser.internal_api.RawContent;
import io.markpeg.parser.internal_api.grammar.BlockGrammar;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RawBlockResolverTest {

  private ElementArena arena;
  private BlockGrammar grammar;
  private List<String> parsedSegments;
  private List<Set<String>> enclosingNotes;
  private RawBlockResolver resolver;

  @BeforeEach
  void setUp() {
    arena = new ElementArena();
    grammar = new BlockGrammar(MarkdownOptions.DEFAULT);
    parsedSegments = new ArrayList<>();
    enclosingNotes = new ArrayList<>();
    resolver =
        new RawBlockResolver(
            (segment, notes) -> {
              parsedSegments.add(segment);
              enclosingNotes.add(notes);
              grammar.resetBuffer(segment);
              return grammar.parse(GrammarRule.DOC, arena);
            });
  }

  private ElementTree rawTree(RawContent content) {
    return arena.tree(IntLists.singleton(arena.addRaw(content)));
  }

  @Test
  void markedSegmentsBecomeSiblingLists() throws Exception {
    ElementTree tree = rawTree(RawContent.fromMarked("- a\u0001- b"));

    resolver.resolve(tree);

    Element root = tree.roots().get(0);
    assertEquals(ElementKind.LIST, root.kind());
    assertEquals(2, root.children().size());
    assertEquals(ElementKind.BULLETLIST, root.children().get(0).kind());
    assertEquals(ElementKind.BULLETLIST, root.children().get(1).kind());
    assertEquals("a", root.children().get(0).text());
    assertEquals("b", root.children().get(1).text());
    assertFalse(tree.contains(ElementKind.RAW));
  }

  @Test
  void segmentsAreParsedInOrder() throws Exception {
    resolver.resolve(rawTree(RawContent.of("first\n", "second\n", "third\n")));

    assertThat(parsedSegments).containsExactly("first\n", "second\n", "third\n");
  }

  @Test
  void segmentsBelowNotesSeeEnclosingLabels() throws Exception {
    int outer = arena.addText(ElementKind.NOTE, "a");
    arena.appendChild(outer, arena.addRaw(RawContent.of("outer\n")));
    int inner = arena.addText(ElementKind.NOTE, "b");
    arena.appendChild(inner, arena.addRaw(RawContent.of("inner\n")));
    arena.appendChild(outer, inner);
    IntArrayList roots = new IntArrayList();
    roots.add(outer);
    roots.add(arena.addRaw(RawContent.of("after\n")));

    resolver.resolve(arena.tree(roots));

    assertThat(parsedSegments).containsExactly("outer\n", "inner\n", "after\n");
    assertThat(enclosingNotes).containsExactly(Set.of("a"), Set.of("a", "b"), Set.of());
  }

  @Test
  void nestedRawElementsAreResolvedToo() throws Exception {
    ElementTree tree = rawTree(RawContent.of("> quoted\n>\n> - item\n"));

    resolver.resolve(tree);

    assertFalse(tree.contains(ElementKind.RAW));
    assertTrue(tree.contains(ElementKind.BLOCKQUOTE));
    assertTrue(tree.contains(ElementKind.LISTITEM));
  }

  @Test
  void siblingPositionsArePreserved() throws Exception {
    IntArrayList roots = new IntArrayList();
    roots.add(arena.addText(ElementKind.STR, "before"));
    roots.add(arena.addRaw(RawContent.of("middle\n")));
    roots.add(arena.addText(ElementKind.STR, "after"));
    ElementTree tree = arena.tree(roots);

    resolver.resolve(tree);

    List<Element> resolved = tree.roots();
    assertEquals(3, resolved.size());
    assertEquals("before", resolved.get(0).contents());
    assertEquals(ElementKind.LIST, resolved.get(1).kind());
    assertEquals("middle", resolved.get(1).text());
    assertEquals("after", resolved.get(2).contents());
  }

  @Test
  void resolvingTwiceChangesNothing() throws Exception {
    ElementTree tree = rawTree(RawContent.of("- one\n- two\n\n> three\n"));
    resolver.resolve(tree);
    String once = tree.describe();
    int parsed = parsedSegments.size();

    resolver.resolve(tree);

    assertEquals(once, tree.describe());
    assertEquals(parsed, parsedSegments.size());
  }

  @Test
  void resolvedRawLosesItsPayload() throws Exception {
    ElementTree tree = rawTree(RawContent.of("text\n"));

    resolver.resolve(tree);

    Element root = tree.roots().get(0);
    assertNull(root.raw());
    assertNull(root.contents());
  }

  @Test
  void growingSegmentsHitDepthLimit() {
    RawBlockResolver runaway =
        new RawBlockResolver(
            (segment, notes) ->
                arena.tree(IntLists.singleton(arena.addRaw(RawContent.of(segment + ">")))),
            5);

    ResolutionException e =
        assertThrows(ResolutionException.class, () -> runaway.resolve(rawTree(RawContent.of("x"))));
    assertEquals("RESOLUTION", e.getErrorCode());
    assertTrue(e.getMessage().contains("5"));
  }

  @Test
  void segmentReproducingItselfIsRejected() {
    RawBlockResolver stuck =
        new RawBlockResolver(
            (segment, notes) ->
                arena.tree(IntLists.singleton(arena.addRaw(RawContent.of(segment)))));

    ResolutionException e =
        assertThrows(
            ResolutionException.class, () -> stuck.resolve(rawTree(RawContent.of("loop\n"))));
    assertEquals("loop\\n", e.getContext());
  }

  @Test
  void depthLimitMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new RawBlockResolver((s, n) -> null, 0));
  }
}
