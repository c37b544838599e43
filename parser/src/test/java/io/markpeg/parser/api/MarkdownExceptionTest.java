package io.markpeg.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class MarkdownExceptionTest {

  @Test
  void messageCarriesContextAndCode() {
    MarkdownException e = new MarkdownException("Broken", "here", "CODE");

    assertEquals("Broken [Context: here] [Error Code: CODE]", e.getMessage());
    assertEquals("here", e.getContext());
    assertEquals("CODE", e.getErrorCode());
  }

  @Test
  void plainMessageHasNoDecorations() {
    assertEquals("Broken", new MarkdownException("Broken").getMessage());
  }

  @Test
  void noMatchShowsOffsetAndExcerpt() {
    GrammarException e = GrammarException.noMatch("DOCBLOCK", 12, "line one\nline two");

    assertEquals("GRAMMAR", e.getErrorCode());
    assertEquals("line one\\nline two", e.getContext());
    assertTrue(e.getMessage().startsWith("Rule DOCBLOCK matched nothing at offset 12"));
  }

  @Test
  void longRemaindersAreTruncated() {
    BufferStateException e = BufferStateException.bufferNotEmpty("DOC", "x".repeat(100));

    assertEquals("BUFFER", e.getErrorCode());
    assertEquals(40, e.getContext().length());
    assertTrue(e.getContext().endsWith("..."));
    assertTrue(e.getMessage().contains("100 chars left"));
  }

  @Test
  void ioErrorsKeepTheirCause() {
    IOException cause = new IOException("gone");

    MarkdownIOException read = MarkdownIOException.readError(cause);
    MarkdownIOException block = MarkdownIOException.formatterError(3, cause);

    assertSame(cause, read.getCause());
    assertEquals("INPUT", read.getContext());
    assertEquals("block-3", block.getContext());
    assertEquals("finish", MarkdownIOException.formatterError(0, cause).getContext());
  }

  @Test
  void resolutionFailures() {
    assertEquals("RESOLUTION", ResolutionException.tooDeep(64).getErrorCode());
    assertTrue(ResolutionException.tooDeep(64).getMessage().contains("64"));
    assertEquals("seg\\r\\n", ResolutionException.notShrinking("seg\r\n").getContext());
  }
}
