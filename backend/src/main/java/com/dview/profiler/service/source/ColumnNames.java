package com.dview.profiler.service.source;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Header normalization shared by the readers. Report columns are keyed by name, so blank headers
 * become {@code Unnamed: <index>} and repeats get a {@code .1}, {@code .2} suffix.
 */
final class ColumnNames {

  private ColumnNames() {}

  static List<String> deduplicate(List<String> headers) {
    List<String> names = new ArrayList<>(headers.size());
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i);
      String base = header == null || header.trim().isEmpty() ? "Unnamed: " + i : header.trim();
      String name = base;
      int suffix = 1;
      while (!seen.add(name)) {
        name = base + "." + suffix++;
      }
      names.add(name);
    }
    return names;
  }
}
