package io.markpeg.parser.internal_api.grammar;

import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.GrammarException;
import io.markpeg.parser.api.LinkTarget;
import io.markpeg.parser.api.MarkdownOptions;
import io.markpeg.parser.internal_api.ElementArena;
import io.markpeg.parser.internal_api.GrammarEngine;
import io.markpeg.parser.internal_api.GrammarRule;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Markdown grammar engine.
 *
 * <p>Holds the working buffer together with the link reference and footnote tables filled by the
 * definition passes. Each rule invocation advances the buffer position; whatever was not consumed
 * is handed back by the next {@link #resetBuffer(String)}.
 */
public final class BlockGrammar implements GrammarEngine {
  private static final Logger log = LoggerFactory.getLogger(BlockGrammar.class);

  private final MarkdownOptions options;
  private final LabelTable<LinkTarget> references = new LabelTable<>();
  private final LabelTable<String> notes = new LabelTable<>();
  private final Set<String> enclosingNotes = new ObjectOpenHashSet<>();

  private String buffer = "";
  private int position;

  public BlockGrammar(MarkdownOptions options) {
    this.options = Objects.requireNonNull(options, "options must not be null");
  }

  @Override
  public String resetBuffer(String text) {
    Objects.requireNonNull(text, "text must not be null");
    String remainder = buffer.substring(position);
    buffer = text;
    position = 0;
    return remainder;
  }

  @Override
  public ElementTree parse(GrammarRule rule, ElementArena arena) throws GrammarException {
    Objects.requireNonNull(arena, "arena must not be null");
    log.trace("Parsing {} at {}/{}", rule, position, buffer.length());
    switch (rule) {
      case REFERENCES:
        {
          BlockParser scanner = new BlockParser(this, buffer, position, null);
          scanner.scanReferences(references);
          position = scanner.position();
          log.debug("Registered {} link references", references.size());
          return ElementTree.empty(arena);
        }
      case NOTES:
        {
          BlockParser scanner = new BlockParser(this, buffer, position, null);
          scanner.scanNotes(notes);
          position = scanner.position();
          log.debug("Registered {} notes", notes.size());
          return ElementTree.empty(arena);
        }
      case DOCBLOCK:
        {
          BlockParser parser = new BlockParser(this, buffer, position, arena);
          int id = parser.block();
          position = parser.position();
          return id < 0 ? ElementTree.empty(arena) : arena.tree(IntLists.singleton(id));
        }
      case DOC:
        {
          BlockParser parser = new BlockParser(this, buffer, position, arena);
          ElementTree tree = arena.tree(parser.document());
          position = parser.position();
          return tree;
        }
      default:
        throw new GrammarException("Unsupported rule " + rule, rule.name());
    }
  }

  @Override
  public void enclosingNotes(Set<String> labels) {
    enclosingNotes.clear();
    for (String label : labels) {
      enclosingNotes.add(LabelTable.normalize(label));
    }
  }

  @Override
  public void reset() {
    buffer = "";
    position = 0;
    enclosingNotes.clear();
    references.clear();
    notes.clear();
  }

  MarkdownOptions options() {
    return options;
  }

  LinkTarget reference(String label) {
    return references.lookup(label);
  }

  String note(String label) {
    return notes.lookup(label);
  }

  boolean insideNote(String label) {
    return enclosingNotes.contains(LabelTable.normalize(label));
  }
}
