package io.markpeg.parser.api;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Extension switches for a parsing session. Fixed at parser construction.
 *
 * @param smart typographic substitutions (quotes, dashes, ellipsis)
 * @param notes footnote definitions and references
 * @param filterHtml drop raw HTML blocks and inline HTML
 * @param filterStyles drop {@code <style>} blocks
 * @param definitionLists definition-list blocks
 */
public record MarkdownOptions(
    boolean smart,
    boolean notes,
    boolean filterHtml,
    boolean filterStyles,
    boolean definitionLists) {

  /** Every extension disabled. */
  public static final MarkdownOptions DEFAULT =
      new MarkdownOptions(false, false, false, false, false);

  static final String PREFIX = "markdown.";

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads options from properties. Recognized keys are {@code markdown.smart}, {@code
   * markdown.notes}, {@code markdown.filterHtml}, {@code markdown.filterStyles} and {@code
   * markdown.dlists}; anything else is ignored and missing keys leave the option disabled.
   *
   * @param props the properties to read
   * @return the options
   */
  public static MarkdownOptions fromProperties(Properties props) {
    return new MarkdownOptions(
        flag(props, "smart"),
        flag(props, "notes"),
        flag(props, "filterHtml"),
        flag(props, "filterStyles"),
        flag(props, "dlists"));
  }

  /**
   * Loads options from a properties file.
   *
   * @param path the properties file
   * @return the options
   * @throws IOException if the file cannot be read
   */
  public static MarkdownOptions load(Path path) throws IOException {
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  private static boolean flag(Properties props, String name) {
    return Boolean.parseBoolean(props.getProperty(PREFIX + name, "false").trim());
  }

  /** Returns a builder initialized from these options. */
  public Builder toBuilder() {
    return new Builder()
        .smart(smart)
        .notes(notes)
        .filterHtml(filterHtml)
        .filterStyles(filterStyles)
        .definitionLists(definitionLists);
  }

  public static class Builder {
    private boolean smart;
    private boolean notes;
    private boolean filterHtml;
    private boolean filterStyles;
    private boolean definitionLists;

    public Builder smart(boolean value) {
      this.smart = value;
      return this;
    }

    public Builder notes(boolean value) {
      this.notes = value;
      return this;
    }

    public Builder filterHtml(boolean value) {
      this.filterHtml = value;
      return this;
    }

    public Builder filterStyles(boolean value) {
      this.filterStyles = value;
      return this;
    }

    public Builder definitionLists(boolean value) {
      this.definitionLists = value;
      return this;
    }

    public MarkdownOptions build() {
      return new MarkdownOptions(smart, notes, filterHtml, filterStyles, definitionLists);
    }
  }
}
