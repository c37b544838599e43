package io.markpeg.parser.internal_api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class RawContentTest {

  @Test
  void markedTextSplitsOnBoundary() {
    RawContent raw = RawContent.fromMarked("- a\u0001- b");

    assertEquals(List.of("- a", "- b"), raw.segments());
    assertEquals("- a\u0001- b", raw.toMarked());
    assertEquals("- a- b", raw.text());
  }

  @Test
  void emptySegmentsAreKept() {
    assertEquals(List.of("", "x", ""), RawContent.fromMarked("\u0001x\u0001").segments());
    assertEquals(List.of(""), RawContent.fromMarked("").segments());
  }

  @Test
  void suffixGoesToLastSegment() {
    RawContent raw = RawContent.of("a\n", "b\n").withSuffix("\n\n");

    assertEquals(List.of("a\n", "b\n\n\n"), raw.segments());
  }

  @Test
  void needsAtLeastOneSegment() {
    assertThrows(IllegalArgumentException.class, () -> new RawContent(List.of()));
    assertThrows(NullPointerException.class, () -> new RawContent(null));
  }

  @Test
  void segmentsAreImmutable() {
    RawContent raw = RawContent.of("a");

    assertThrows(UnsupportedOperationException.class, () -> raw.segments().add("b"));
  }
}
