package io.markpeg.parser.impl;

import io.markpeg.parser.api.BufferStateException;
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
import io.markpeg.parser.internal_api.grammar.BlockGrammar;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-pass document driver.
 *
 * <p>For each document the driver walks these states:
 *
 * <ol>
 *   <li>{@link State#INIT}: normalize the input with the {@link Preformatter}
 *   <li>{@link State#REFERENCES_PASS}: let the grammar register link reference definitions
 *   <li>{@link State#NOTES_PASS}: the same for footnote definitions, only with the notes extension
 *   <li>{@link State#BLOCK_LOOP}: consume one top-level block per iteration, resolve its RAW
 *       elements and hand it to the formatter, until the remainder is one of {@link
 *       #TERMINAL_REMAINDERS}
 *   <li>{@link State#DONE}: call {@link Formatter#finish()} and drop per-document state
 * </ol>
 *
 * <p>The working buffer must be fully consumed before each rule invocation; a leftover remainder
 * is reported as a {@link BufferStateException}.
 */
public final class MarkdownParserImpl implements MarkdownParser {
  private static final Logger log = LoggerFactory.getLogger(MarkdownParserImpl.class);

  /** Remainders that mean the whole document has been consumed. */
  static final Set<String> TERMINAL_REMAINDERS =
      Set.of("", "\n", "\r\n", "\n\n", "\r\n\n", "\n\n\n", "\r\n\n\n");

  enum State {
    IDLE,
    INIT,
    REFERENCES_PASS,
    NOTES_PASS,
    BLOCK_LOOP,
    DONE
  }

  private final MarkdownOptions options;
  private final GrammarEngine engine;
  private final Preformatter preformatter = new Preformatter();

  private State state = State.IDLE;
  private ElementArena arena;

  public MarkdownParserImpl(MarkdownOptions options) {
    this(options, new BlockGrammar(options));
  }

  MarkdownParserImpl(MarkdownOptions options, GrammarEngine engine) {
    this.options = Objects.requireNonNull(options, "options must not be null");
    this.engine = Objects.requireNonNull(engine, "engine must not be null");
  }

  @Override
  public MarkdownOptions options() {
    return options;
  }

  @Override
  public void markdown(InputStream src, Formatter formatter) throws MarkdownException {
    Objects.requireNonNull(src, "src must not be null");
    Objects.requireNonNull(formatter, "formatter must not be null");
    if (state != State.IDLE) {
      throw new IllegalStateException("Parser is already processing a document (" + state + ")");
    }
    try {
      run(src, formatter);
    } finally {
      engine.reset();
      arena = null;
      state = State.IDLE;
    }
  }

  private void run(InputStream src, Formatter formatter) throws MarkdownException {
    transition(State.INIT);
    arena = new ElementArena();
    String text;
    try {
      text = preformatter.preformat(src);
    } catch (IOException e) {
      throw MarkdownIOException.readError(e);
    }

    transition(State.REFERENCES_PASS);
    parseRule(GrammarRule.REFERENCES, text);
    if (options.notes()) {
      transition(State.NOTES_PASS);
      parseRule(GrammarRule.NOTES, text);
    }

    transition(State.BLOCK_LOOP);
    RawBlockResolver resolver = new RawBlockResolver(this::parseSegment);
    String remainder = text;
    int blocks = 0;
    while (true) {
      String input = remainder;
      ElementTree tree = parseRule(GrammarRule.DOCBLOCK, input);
      remainder = engine.resetBuffer("");
      if (remainder.length() >= input.length()) {
        throw GrammarException.noMatch(
            GrammarRule.DOCBLOCK.name(), text.length() - input.length(), input);
      }
      resolver.resolve(tree);
      if (!tree.isEmpty()) {
        blocks++;
        try {
          formatter.formatBlock(tree);
        } catch (IOException e) {
          throw MarkdownIOException.formatterError(blocks, e);
        }
      }
      if (TERMINAL_REMAINDERS.contains(remainder)) {
        break;
      }
    }

    transition(State.DONE);
    log.debug("Formatted {} blocks using {} elements", blocks, arena.size());
    try {
      formatter.finish();
    } catch (IOException e) {
      throw MarkdownIOException.formatterError(0, e);
    }
  }

  private ElementTree parseSegment(String segment, Set<String> enclosingNotes)
      throws MarkdownException {
    engine.enclosingNotes(enclosingNotes);
    try {
      return parseRule(GrammarRule.DOC, segment);
    } finally {
      engine.enclosingNotes(Set.of());
    }
  }

  private ElementTree parseRule(GrammarRule rule, String text) throws MarkdownException {
    String leftover = engine.resetBuffer(text);
    if (!leftover.isEmpty()) {
      throw BufferStateException.bufferNotEmpty(rule.name(), leftover);
    }
    return engine.parse(rule, arena);
  }

  private void transition(State next) {
    log.debug("{} -> {}", state, next);
    state = next;
  }

  /** @return the current driver state, {@code IDLE} between documents */
  State state() {
    return state;
  }
}
