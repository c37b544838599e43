package io.markpeg.parser.internal_api;

import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.GrammarException;
import java.util.Set;

/**
 * Rule-matching engine driven by the document parser.
 *
 * <p>The engine owns a working buffer. Each {@link #parse(GrammarRule, ElementArena)} call matches
 * the rule as a prefix of the buffer and consumes it; whatever is left is handed back by the next
 * {@link #resetBuffer(String)} call. Side tables filled by {@link GrammarRule#REFERENCES} and
 * {@link GrammarRule#NOTES} stay available to later rules until {@link #reset()}.
 *
 * <p>Implementations are single-threaded.
 */
public interface GrammarEngine {
  /**
   * Replaces the working buffer.
   *
   * @param text the new buffer contents
   * @return the text the previous invocation left unconsumed
   */
  String resetBuffer(String text);

  /**
   * Matches {@code rule} against the start of the working buffer.
   *
   * @param rule the rule to match
   * @param arena the arena new elements are allocated in
   * @return the produced elements; empty for rules that produce no tree or when nothing but blank
   *     lines matched
   * @throws GrammarException if the rule cannot be matched
   */
  ElementTree parse(GrammarRule rule, ElementArena arena) throws GrammarException;

  /**
   * Declares the notes whose bodies enclose the text parsed next. A reference to one of these
   * notes is kept as literal text instead of being expanded again. Stays in effect until the next
   * call or {@link #reset()}.
   *
   * @param labels labels of the enclosing notes, empty outside any note body
   */
  default void enclosingNotes(Set<String> labels) {}

  /** Clears the working buffer and all side tables. */
  void reset();
}
