package io.markpeg.parser.impl;

import it.unimi.dsi.fastutil.io.FastByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Copies raw Markdown input into one text buffer, expanding tabs and appending a blank line.
 *
 * <p>Tab stops are every {@link #TAB_STOP} columns, counted from the start of each physical line.
 * Columns are counted in bytes. The output always ends with {@code "\n\n"}, which the top-level
 * grammar rules rely on as a terminator.
 *
 * <p>The bytes are decoded as UTF-8 once the whole input is read. Malformed sequences are not an
 * error: each one is replaced by U+FFFD and the rest of the text passes through unchanged.
 *
 * <p>The output and read buffers are reused across calls; an instance is not thread-safe.
 */
public final class Preformatter {
  public static final int TAB_STOP = 4;
  static final int CHUNK_SIZE = 32768;

  private final byte[] chunk;
  private final FastByteArrayOutputStream out;

  public Preformatter() {
    this(CHUNK_SIZE);
  }

  Preformatter(int chunkSize) {
    this.chunk = new byte[chunkSize];
    this.out = new FastByteArrayOutputStream(CHUNK_SIZE);
  }

  /**
   * Reads {@code src} to the end and returns the normalized text.
   *
   * @param src the input; not closed
   * @return the normalized text, ending with a blank line
   * @throws IOException if reading fails
   */
  public String preformat(InputStream src) throws IOException {
    out.reset();
    int charsToTab = TAB_STOP;
    int n;
    while ((n = src.read(chunk)) != -1) {
      int pending = 0;
      for (int i = 0; i < n; i++) {
        switch (chunk[i]) {
          case '\t':
            out.write(chunk, pending, i - pending);
            for (; charsToTab > 0; charsToTab--) {
              out.write(' ');
            }
            pending = i + 1;
            break;
          case '\n':
            out.write(chunk, pending, i + 1 - pending);
            pending = i + 1;
            charsToTab = TAB_STOP;
            break;
          default:
            charsToTab--;
        }
        if (charsToTab == 0) {
          charsToTab = TAB_STOP;
        }
      }
      out.write(chunk, pending, n - pending);
    }
    out.write('\n');
    out.write('\n');
    return new String(out.array, 0, out.length, StandardCharsets.UTF_8);
  }

  /** @return the capacity of the reusable output buffer, in bytes */
  int capacity() {
    return out.array.length;
  }
}
