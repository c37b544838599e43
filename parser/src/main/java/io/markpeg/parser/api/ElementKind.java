package io.markpeg.parser.api;

/** Tag of a document element. */
public enum ElementKind {
  /** Generic container; its children are rendered in order. */
  LIST,
  /**
   * Deferred block text awaiting a re-parse. Pipeline-internal: never handed to a {@link
   * Formatter}.
   */
  RAW,
  SPACE,
  LINEBREAK,
  ELLIPSIS,
  EMDASH,
  ENDASH,
  APOSTROPHE,
  SINGLEQUOTED,
  DOUBLEQUOTED,
  STR,
  LINK,
  IMAGE,
  CODE,
  HTML,
  EMPH,
  STRONG,
  PLAIN,
  PARA,
  LISTITEM,
  BULLETLIST,
  ORDEREDLIST,
  H1,
  H2,
  H3,
  H4,
  H5,
  H6,
  BLOCKQUOTE,
  VERBATIM,
  HTMLBLOCK,
  HRULE,
  REFERENCE,
  NOTE,
  DEFINITIONLIST,
  DEFTITLE,
  DEFDATA;

  private static final ElementKind[] HEADINGS = {H1, H2, H3, H4, H5, H6};

  /**
   * Returns the heading kind for a level.
   *
   * @param level heading level, 1 to 6
   * @return the matching {@code H1}..{@code H6} kind
   * @throws IllegalArgumentException if the level is out of range
   */
  public static ElementKind heading(int level) {
    if (level < 1 || level > HEADINGS.length) {
      throw new IllegalArgumentException("Invalid heading level: " + level);
    }
    return HEADINGS[level - 1];
  }

  /** @return the heading level (1-6), or 0 for non-heading kinds */
  public int headingLevel() {
    return this.ordinal() >= H1.ordinal() && this.ordinal() <= H6.ordinal()
        ? this.ordinal() - H1.ordinal() + 1
        : 0;
  }

  /** @return {@literal true} if elements of this kind carry their text in the contents payload */
  public boolean carriesText() {
    switch (this) {
      case RAW:
      case STR:
      case SPACE:
      case CODE:
      case HTML:
      case HTMLBLOCK:
      case VERBATIM:
        return true;
      default:
        return false;
    }
  }
}
