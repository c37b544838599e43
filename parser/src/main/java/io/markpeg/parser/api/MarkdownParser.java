package io.markpeg.parser.api;

import io.markpeg.parser.format.HtmlFormatter;
import io.markpeg.parser.impl.MarkdownParserImpl;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point for Markdown parsing sessions.
 *
 * <p>A parser owns its normalization buffer and grammar engine. Create one per thread and reuse it
 * for as many documents as needed; buffers are reset, not reallocated, between documents. A parser
 * must not be used for two documents at the same time, including re-entrantly from inside a
 * {@link Formatter} callback.
 *
 * <p>Every failure is reported as a {@link MarkdownException} for the document at hand; the parser
 * itself stays usable afterwards.
 *
 * <pre>{@code
 * MarkdownParser parser = MarkdownParser.create(MarkdownOptions.builder().smart(true).build());
 * StringBuilder html = new StringBuilder();
 * parser.markdown(Files.newInputStream(path), new HtmlFormatter(html));
 * }</pre>
 */
public interface MarkdownParser {
  /**
   * Creates a parser with every extension disabled.
   *
   * @return a new parser
   */
  static MarkdownParser create() {
    return create(MarkdownOptions.DEFAULT);
  }

  /**
   * Creates a parser with the given extensions.
   *
   * @param options the session options
   * @return a new parser
   */
  static MarkdownParser create(MarkdownOptions options) {
    return new MarkdownParserImpl(options);
  }

  /** @return the options this parser was created with */
  MarkdownOptions options();

  /**
   * Parses a whole document and sends its blocks to the formatter.
   *
   * @param src the Markdown bytes; read to the end but not closed
   * @param formatter receives the resolved blocks and the final {@code finish()} call
   * @throws MarkdownException if the input cannot be read, the grammar fails, or the formatter
   *     fails; {@code finish()} is not called in that case
   */
  void markdown(InputStream src, Formatter formatter) throws MarkdownException;

  /**
   * Parses a document held in memory.
   *
   * @param text the Markdown text
   * @param formatter receives the resolved blocks
   * @throws MarkdownException if parsing or formatting fails
   */
  default void markdown(String text, Formatter formatter) throws MarkdownException {
    markdown(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), formatter);
  }

  /**
   * Converts a document to HTML with {@link HtmlFormatter}.
   *
   * @param text the Markdown text
   * @return the HTML
   * @throws MarkdownException if parsing fails
   */
  default String toHtml(String text) throws MarkdownException {
    StringBuilder out = new StringBuilder();
    markdown(text, new HtmlFormatter(out));
    return out.toString();
  }
}
