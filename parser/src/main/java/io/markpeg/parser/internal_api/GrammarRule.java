package io.markpeg.parser.internal_api;

/** Named entry points of the grammar engine. */
public enum GrammarRule {
  /** Registers link reference definitions; consumes the whole buffer and produces no tree. */
  REFERENCES,
  /** Registers footnote definitions; consumes the whole buffer and produces no tree. */
  NOTES,
  /** Consumes leading blank lines and the next top-level block. */
  DOCBLOCK,
  /** Consumes the whole buffer as a sequence of blocks. */
  DOC
}
