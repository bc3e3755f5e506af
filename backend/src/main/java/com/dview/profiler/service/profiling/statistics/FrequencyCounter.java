package com.dview.profiler.service.profiling.statistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts keys in insertion order. {@link #top(int)} ranks by descending count; keys with equal
 * counts keep the order in which they were first seen.
 */
final class FrequencyCounter<K> {

  private final Map<K, long[]> counts = new LinkedHashMap<>();

  void add(K key) {
    counts.computeIfAbsent(key, k -> new long[1])[0]++;
  }

  List<Map.Entry<K, Long>> top(int limit) {
    List<Map.Entry<K, Long>> entries = new ArrayList<>(counts.size());
    for (Map.Entry<K, long[]> entry : counts.entrySet()) {
      entries.add(Map.entry(entry.getKey(), entry.getValue()[0]));
    }
    entries.sort((a, b) -> Long.compare(b.getValue(), a.getValue()));
    return entries.subList(0, Math.min(Math.max(limit, 0), entries.size()));
  }
}
