package io.markpeg.parser.impl;

import io.markpeg.parser.api.ElementKind;
import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.MarkdownException;
import io.markpeg.parser.api.ResolutionException;
import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.RawContent;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces RAW placeholder elements with the result of parsing their text as Markdown.
 *
 * <p>Each RAW element becomes a {@link ElementKind#LIST} container in place: every segment of its
 * {@link RawContent} is parsed as an independent document and the resulting top-level elements are
 * appended, in segment order, as the container's children. The walk then descends into every
 * element that has children, so RAW elements produced by the re-parse are resolved too. Sibling
 * positions never change.
 *
 * <p>Segments below a note reference are parsed with the labels of all enclosing notes, so the
 * grammar can refuse to expand a note inside its own body.
 *
 * <p>Re-parsing must make progress. Resolution fails with a {@link ResolutionException} when RAW
 * elements nest deeper than the configured limit or when a segment re-parses into a RAW element
 * holding that very segment.
 */
public final class RawBlockResolver {
  private static final Logger log = LoggerFactory.getLogger(RawBlockResolver.class);

  /** Default limit of nested RAW resolutions along one path. */
  public static final int DEFAULT_MAX_DEPTH = 64;

  /** Parses one RAW segment as a self-contained document. */
  @FunctionalInterface
  public interface SegmentParser {
    /**
     * @param segment the segment text
     * @param enclosingNotes labels of the note references above the segment
     * @return the parsed top-level elements
     */
    ElementTree parse(String segment, Set<String> enclosingNotes) throws MarkdownException;
  }

  private final SegmentParser segmentParser;
  private final int maxDepth;
  private final List<String> openNotes = new ObjectArrayList<>();

  public RawBlockResolver(SegmentParser segmentParser) {
    this(segmentParser, DEFAULT_MAX_DEPTH);
  }

  public RawBlockResolver(SegmentParser segmentParser, int maxDepth) {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
    this.segmentParser = segmentParser;
    this.maxDepth = maxDepth;
  }

  /**
   * Resolves every RAW element of {@code tree} in place.
   *
   * @param tree the tree to resolve
   * @return the same tree, now free of RAW elements
   * @throws MarkdownException if a segment cannot be parsed or resolution does not converge
   */
  public ElementTree resolve(ElementTree tree) throws MarkdownException {
    resolve(tree.arena(), tree.rootIds(), 0);
    return tree;
  }

  private void resolve(ElementArena arena, IntList ids, int depth) throws MarkdownException {
    for (int i = 0; i < ids.size(); i++) {
      int id = ids.getInt(i);
      int childDepth = depth;
      if (arena.kind(id) == ElementKind.RAW) {
        if (depth >= maxDepth) {
          throw ResolutionException.tooDeep(maxDepth);
        }
        RawContent raw = arena.raw(id);
        arena.setKind(id, ElementKind.LIST);
        arena.clearRaw(id);
        arena.setContents(id, null);
        arena.clearChildren(id);
        Set<String> enclosing = Set.copyOf(openNotes);
        for (String segment : raw.segments()) {
          ElementTree parsed = segmentParser.parse(segment, enclosing);
          if (reemits(arena, parsed.rootIds(), segment)) {
            throw ResolutionException.notShrinking(segment);
          }
          arena.appendChildren(id, parsed.rootIds());
        }
        if (log.isTraceEnabled()) {
          log.trace(
              "Resolved RAW element {} ({} segments) into {} children at depth {}",
              id,
              raw.segments().size(),
              arena.children(id).size(),
              depth);
        }
        childDepth = depth + 1;
      }
      if (arena.hasChildren(id)) {
        String note = arena.kind(id) == ElementKind.NOTE ? arena.contents(id) : null;
        if (note != null) {
          openNotes.add(note);
        }
        try {
          resolve(arena, arena.children(id), childDepth);
        } finally {
          if (note != null) {
            openNotes.remove(openNotes.size() - 1);
          }
        }
      }
    }
  }

  private static boolean reemits(ElementArena arena, IntList ids, String segment) {
    for (int i = 0; i < ids.size(); i++) {
      int id = ids.getInt(i);
      RawContent raw = arena.raw(id);
      if (raw != null && raw.segments().size() == 1 && raw.segments().get(0).equals(segment)) {
        return true;
      }
      if (arena.hasChildren(id) && reemits(arena, arena.children(id), segment)) {
        return true;
      }
    }
    return false;
  }
}
