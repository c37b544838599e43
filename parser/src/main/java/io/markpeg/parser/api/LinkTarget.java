package io.markpeg.parser.api;

import java.util.Objects;

/**
 * Destination of a {@link ElementKind#LINK} or {@link ElementKind#IMAGE} element, and the value
 * stored for a link reference definition.
 *
 * @param url the link destination, never null
 * @param title the optional title, empty when absent
 */
public record LinkTarget(String url, String title) {
  public LinkTarget {
    Objects.requireNonNull(url, "url must not be null");
    title = title == null ? "" : title;
  }
}
