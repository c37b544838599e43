package io.markpeg.parser.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import io.markpeg.parser.api.BufferStateException;
import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.Formatter;
import io.markpeg.parser.api.GrammarException;
import io.markpeg.parser.api.MarkdownException;
import io.markpeg.parser.api.MarkdownIOException;
import io.markpeg.parser.api.MarkdownOptions;
import io.markpeg.parser.api.MarkdownParser;
import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.GrammarEngine;
import io.markpeg.parser.internal_api.GrammarRule;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

/** Tests for the document driver, with the real grammar and with a mocked engine. */
class MarkdownParserImplTest {

  @Mock private GrammarEngine engine;
  @Mock private Formatter formatter;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
  }

  /** Collects blocks for inspection. */
  private static final class Collector implements Formatter {
    final List<ElementTree> blocks = new ArrayList<>();
    int finished;

    @Override
    public void formatBlock(ElementTree block) {
      blocks.add(block);
    }

    @Override
    public void finish() {
      finished++;
    }
  }

  private void stubEmptyTrees() throws GrammarException {
    when(engine.parse(any(GrammarRule.class), any(ElementArena.class)))
        .thenAnswer(inv -> ElementTree.empty(inv.getArgument(1)));
  }

  @Test
  void titleAndParagraphArriveAsTwoBlocks() throws MarkdownException {
    Collector collector = new Collector();

    MarkdownParser.create().markdown("# Title\n\nPara one.\n", collector);

    assertEquals(2, collector.blocks.size());
    assertEquals(ElementKind.H1, collector.blocks.get(0).roots().get(0).kind());
    assertEquals("Title", collector.blocks.get(0).roots().get(0).text());
    assertEquals(ElementKind.PARA, collector.blocks.get(1).roots().get(0).kind());
    assertEquals("Para one.", collector.blocks.get(1).roots().get(0).text());
    assertEquals(1, collector.finished);
  }

  @Test
  void blankInputTerminatesWithoutBlocks() throws MarkdownException {
    Collector collector = new Collector();

    MarkdownParser.create().markdown("\n\n", collector);

    assertTrue(collector.blocks.isEmpty());
    assertEquals(1, collector.finished);
  }

  @Test
  void noteReferencingItselfRendersAndLeavesParserClean() throws MarkdownException {
    MarkdownParser parser = MarkdownParser.create(MarkdownOptions.builder().notes(true).build());
    Collector first = new Collector();
    Collector second = new Collector();

    parser.markdown("Text[^1].\n\n[^1]: See also [^1].\n", first);
    parser.markdown("x[^1]\n\n[^1]: body [^2]\n\n[^2]: two\n", second);

    assertEquals(1, first.finished);
    String self = first.blocks.get(0).describe();
    assertTrue(self.contains("STR \"[^1].\""), self);
    assertFalse(self.contains("RAW"), self);
    String next = second.blocks.get(0).describe();
    assertTrue(next.contains("NOTE \"1\"\n    LIST"), next);
    assertTrue(next.contains("NOTE \"2\"\n"), next);
    assertFalse(next.contains("[^"), next);
  }

  @Test
  void emptyInputTerminatesWithoutBlocks() throws MarkdownException {
    Collector collector = new Collector();

    MarkdownParser.create().markdown("", collector);

    assertTrue(collector.blocks.isEmpty());
    assertEquals(1, collector.finished);
  }

  @Test
  void blocksNeverContainRaw() throws MarkdownException {
    Collector collector = new Collector();
    String doc = "> quote\n>\n> - nested\n\n- a\n    - b\n\ntext\n\n1. one\n2. two\n";

    MarkdownParser.create().markdown(doc, collector);

    assertEquals(4, collector.blocks.size());
    for (ElementTree block : collector.blocks) {
      assertFalse(block.contains(ElementKind.RAW), block.describe());
    }
  }

  @Test
  void treesStayReadableAfterTheCall() throws MarkdownException {
    Collector collector = new Collector();
    MarkdownParser parser = MarkdownParser.create();

    parser.markdown("first\n", collector);
    parser.markdown("second\n", new Collector());

    assertEquals("first", collector.blocks.get(0).roots().get(0).text());
  }

  @Test
  void leftoverBufferIsReported() throws Exception {
    when(engine.resetBuffer(anyString())).thenReturn("stale");
    MarkdownParserImpl parser = new MarkdownParserImpl(MarkdownOptions.DEFAULT, engine);

    BufferStateException e =
        assertThrows(BufferStateException.class, () -> parser.markdown("text", formatter));

    assertEquals("BUFFER", e.getErrorCode());
    assertTrue(e.getMessage().contains("REFERENCES"));
    verify(formatter, never()).finish();
    verify(engine).reset();
    assertEquals(MarkdownParserImpl.State.IDLE, parser.state());
  }

  @Test
  void grammarFailureStopsTheDocument() throws Exception {
    when(engine.resetBuffer(anyString())).thenReturn("");
    stubEmptyTrees();
    doThrow(new GrammarException("no block"))
        .when(engine)
        .parse(eq(GrammarRule.DOCBLOCK), any(ElementArena.class));
    MarkdownParserImpl parser = new MarkdownParserImpl(MarkdownOptions.DEFAULT, engine);

    assertThrows(GrammarException.class, () -> parser.markdown("text", formatter));

    verify(formatter, never()).formatBlock(any());
    verify(formatter, never()).finish();
    assertEquals(MarkdownParserImpl.State.IDLE, parser.state());
  }

  @Test
  void blockRuleThatConsumesNothingIsReported() throws Exception {
    when(engine.resetBuffer(anyString())).thenReturn("", "", "abc\n\n");
    stubEmptyTrees();
    MarkdownParserImpl parser = new MarkdownParserImpl(MarkdownOptions.DEFAULT, engine);

    GrammarException e =
        assertThrows(GrammarException.class, () -> parser.markdown("abc", formatter));

    assertEquals("GRAMMAR", e.getErrorCode());
    assertTrue(e.getMessage().contains("DOCBLOCK"));
  }

  @Test
  void notesPassRunsOnlyWhenEnabled() throws Exception {
    when(engine.resetBuffer(anyString())).thenReturn("");
    stubEmptyTrees();

    new MarkdownParserImpl(MarkdownOptions.DEFAULT, engine).markdown("x", formatter);
    verify(engine, never()).parse(eq(GrammarRule.NOTES), any(ElementArena.class));

    MarkdownOptions notes = MarkdownOptions.builder().notes(true).build();
    new MarkdownParserImpl(notes, engine).markdown("x", formatter);
    verify(engine).parse(eq(GrammarRule.NOTES), any(ElementArena.class));
  }

  @Test
  void passesRunInOrder() throws Exception {
    when(engine.resetBuffer(anyString())).thenReturn("");
    stubEmptyTrees();
    MarkdownOptions notes = MarkdownOptions.builder().notes(true).build();

    new MarkdownParserImpl(notes, engine).markdown("x", formatter);

    var order = inOrder(engine, formatter);
    order.verify(engine).parse(eq(GrammarRule.REFERENCES), any(ElementArena.class));
    order.verify(engine).parse(eq(GrammarRule.NOTES), any(ElementArena.class));
    order.verify(engine).parse(eq(GrammarRule.DOCBLOCK), any(ElementArena.class));
    order.verify(formatter).finish();
  }

  @Test
  void emptyTreesAreNotForwarded() throws Exception {
    when(engine.resetBuffer(anyString())).thenReturn("");
    stubEmptyTrees();

    new MarkdownParserImpl(MarkdownOptions.DEFAULT, engine).markdown("x", formatter);

    verify(formatter, never()).formatBlock(any());
    verify(formatter, times(1)).finish();
  }

  @Test
  void formatterFailureIsWrapped() throws Exception {
    doThrow(new IOException("disk full")).when(formatter).formatBlock(any());
    MarkdownParser parser = MarkdownParser.create();

    MarkdownIOException e =
        assertThrows(MarkdownIOException.class, () -> parser.markdown("a\n\nb\n", formatter));

    assertEquals("IO", e.getErrorCode());
    assertEquals("block-1", e.getContext());
    assertInstanceOf(IOException.class, e.getCause());
    verify(formatter, never()).finish();
  }

  @Test
  void finishFailureIsWrapped() throws Exception {
    doThrow(new IOException("closed")).when(formatter).finish();

    MarkdownIOException e =
        assertThrows(
            MarkdownIOException.class, () -> MarkdownParser.create().markdown("a\n", formatter));

    assertEquals("finish", e.getContext());
  }

  @Test
  void unreadableInputIsWrapped() {
    InputStream broken =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("boom");
          }
        };

    MarkdownIOException e =
        assertThrows(
            MarkdownIOException.class, () -> MarkdownParser.create().markdown(broken, formatter));

    assertEquals("INPUT", e.getContext());
  }

  @Test
  void parserIsReusableAfterFailure() throws Exception {
    doThrow(new IOException("disk full")).when(formatter).formatBlock(any());
    MarkdownParser parser = MarkdownParser.create();
    assertThrows(MarkdownIOException.class, () -> parser.markdown("a\n", formatter));

    assertEquals("<p>b</p>\n", parser.toHtml("b\n\n"));
  }

  @Test
  void reentrantUseIsRejected() throws Exception {
    MarkdownParser parser = MarkdownParser.create();
    Formatter nested =
        block -> {
          try {
            parser.markdown("inner", new Collector());
          } catch (MarkdownException e) {
            throw new AssertionError(e);
          }
        };

    assertThrows(IllegalStateException.class, () -> parser.markdown("outer\n", nested));
    assertEquals("<p>after</p>\n", parser.toHtml("after\n\n"));
  }

  @Test
  void nullArgumentsAreRejected() {
    MarkdownParser parser = MarkdownParser.create();

    assertThrows(NullPointerException.class, () -> parser.markdown((InputStream) null, formatter));
    assertThrows(
        NullPointerException.class,
        () -> parser.markdown(new ByteArrayInputStream(new byte[0]), null));
  }
}
