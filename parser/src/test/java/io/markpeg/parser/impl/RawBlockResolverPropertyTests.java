package io.markpeg.parser.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.markpeg.parser.api.Element;
import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.MarkdownOptions;
import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.GrammarRule;
import io.markpeg.parser.internal_api.RawContent;
import io.markpeg.parser.internal_api.grammar.BlockGrammar;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.List;
import java.util.stream.Collectors;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

/** Resolving RAW elements built from plain-text segments keeps their text and its order. */
@PropertyDefaults(tries = 200, shrinking = ShrinkingMode.FULL)
public class RawBlockResolverPropertyTests {

  @Provide
  Arbitrary<String> words() {
    return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(8);
  }

  @Provide
  Arbitrary<String> segment() {
    Arbitrary<String> line = words().list().ofMinSize(1).ofMaxSize(5).map(w -> String.join(" ", w));
    return line.list().ofMinSize(1).ofMaxSize(3).map(l -> String.join("\n", l) + "\n");
  }

  @Property
  void resolvedTextFollowsSegmentOrder(
      @ForAll @Size(min = 1, max = 6) List<@From("segment") String> segments)
      throws Exception {
    ElementArena arena = new ElementArena();
    BlockGrammar grammar = new BlockGrammar(MarkdownOptions.DEFAULT);
    RawBlockResolver resolver =
        new RawBlockResolver(
            (segment, notes) -> {
              grammar.resetBuffer(segment);
              return grammar.parse(GrammarRule.DOC, arena);
            });
    ElementTree tree = arena.tree(IntLists.singleton(arena.addRaw(new RawContent(segments))));

    resolver.resolve(tree);

    Element root = tree.roots().get(0);
    String expected =
        segments.stream().map(s -> s.substring(0, s.length() - 1)).collect(Collectors.joining());
    assertEquals(expected, root.text());
    assertEquals(segments.size(), root.children().size());
    assertFalse(tree.contains(ElementKind.RAW));
  }
}
