package io.markpeg.parser.internal_api.grammar;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Definitions keyed by label, matched case-insensitively with runs of whitespace collapsed. The
 * first definition of a label wins.
 *
 * @param <V> the definition value
 */
final class LabelTable<V> {
  private final Map<String, V> entries = new HashMap<>();

  static String normalize(String label) {
    return label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  void define(String label, V value) {
    entries.putIfAbsent(normalize(label), value);
  }

  V lookup(String label) {
    return entries.get(normalize(label));
  }

  int size() {
    return entries.size();
  }

  void clear() {
    entries.clear();
  }
}
