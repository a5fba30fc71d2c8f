package dev.hybridir.fusion;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Queries that some runs have no results for. Such queries are still fused from the runs that do
 * have them; this report collects them so they can be reported once per batch.
 *
 * @param missingSystems for each affected query, the systems that have no list for it
 */
public record ConsistencyReport(SortedMap<String, List<String>> missingSystems) {

  public ConsistencyReport {
    SortedMap<String, List<String>> copy = new TreeMap<>();
    missingSystems.forEach((query, systems) -> copy.put(query, List.copyOf(systems)));
    missingSystems = Collections.unmodifiableSortedMap(copy);
  }

  public static ConsistencyReport of(Map<String, List<String>> missingSystems) {
    return new ConsistencyReport(new TreeMap<>(missingSystems));
  }

  public boolean isConsistent() {
    return missingSystems.isEmpty();
  }

  public List<String> affectedQueries() {
    return List.copyOf(missingSystems.keySet());
  }
}
