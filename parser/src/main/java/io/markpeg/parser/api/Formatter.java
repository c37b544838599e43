package io.markpeg.parser.api;

import java.io.IOException;

/**
 * Receives the parsed document from {@linkplain MarkdownParser#markdown(java.io.InputStream,
 * Formatter)} one top-level block at a time.
 *
 * <p>Blocks arrive in document order with every RAW element already resolved. {@link #finish()} is
 * called exactly once after the last block, and only when the whole document parsed successfully.
 */
public interface Formatter {
  /**
   * Called for each resolved top-level block.
   *
   * @param block the block; never empty and never containing {@link ElementKind#RAW}
   * @throws IOException if the formatter cannot write its output
   */
  void formatBlock(ElementTree block) throws IOException;

  /**
   * Called once after the last block.
   *
   * @throws IOException if the formatter cannot write its output
   */
  default void finish() throws IOException {}
}
