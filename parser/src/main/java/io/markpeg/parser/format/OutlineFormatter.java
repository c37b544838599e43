package io.markpeg.parser.format;

import io.markpeg.parser.api.ElementTree;
import io.markpeg.parser.api.Formatter;
import java.io.IOException;
import java.util.Objects;

/** Writes the element outline of every block, one block after the other. Handy for debugging. */
public final class OutlineFormatter implements Formatter {
  private final Appendable out;
  private int blocks;

  public OutlineFormatter(Appendable out) {
    this.out = Objects.requireNonNull(out, "out must not be null");
  }

  @Override
  public void formatBlock(ElementTree block) throws IOException {
    out.append("# block ").append(String.valueOf(++blocks)).append('\n');
    out.append(block.describe());
  }

  public int blocks() {
    return blocks;
  }
}
