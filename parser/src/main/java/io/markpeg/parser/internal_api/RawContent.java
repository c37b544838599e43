package io.markpeg.parser.internal_api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Payload of a RAW element: block text the grammar could not settle in one pass, already divided
 * into the segments that must be re-parsed independently.
 *
 * <p>Segment boundaries are the points between sibling blocks of a list item that were not
 * separated by a blank line. They are kept structurally; {@link #fromMarked(String)} and {@link
 * #toMarked()} convert from and to the legacy single-string form where {@link #BOUNDARY_MARKER}
 * separates the segments.
 *
 * @param segments the segments in document order, never empty
 */
public record RawContent(List<String> segments) {
  /** Legacy in-band boundary marker. */
  public static final char BOUNDARY_MARKER = '\u0001';

  public RawContent {
    Objects.requireNonNull(segments, "segments must not be null");
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("RAW content needs at least one segment");
    }
    segments = List.copyOf(segments);
  }

  public static RawContent of(String... segments) {
    return new RawContent(List.of(segments));
  }

  /**
   * Splits legacy marked text on {@link #BOUNDARY_MARKER}. Empty segments are kept, so {@code n}
   * markers always give {@code n + 1} segments.
   *
   * @param marked the marked text
   * @return the content
   */
  public static RawContent fromMarked(String marked) {
    List<String> parts = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < marked.length(); i++) {
      if (marked.charAt(i) == BOUNDARY_MARKER) {
        parts.add(marked.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(marked.substring(start));
    return new RawContent(parts);
  }

  /** @return the segments joined with {@link #BOUNDARY_MARKER} */
  public String toMarked() {
    return String.join(String.valueOf(BOUNDARY_MARKER), segments);
  }

  /** @return the segments joined without any marker */
  public String text() {
    return String.join("", segments);
  }

  /**
   * Returns a copy with {@code suffix} appended to the last segment.
   *
   * @param suffix the text to append
   * @return the new content
   */
  public RawContent withSuffix(String suffix) {
    List<String> copy = new ArrayList<>(segments);
    int last = copy.size() - 1;
    copy.set(last, copy.get(last) + suffix);
    return new RawContent(copy);
  }
}
