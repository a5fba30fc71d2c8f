package dev.hybridir.run;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * All ranked lists one retrieval system produced across the queries of an experiment.
 *
 * <p>Queries are kept in lexicographic order of their ids, which is the canonical order used when
 * writing runs.
 */
public final class Run {

  private final String system;
  private final SortedMap<String, RankedList> lists;

  public Run(String system, Map<String, RankedList> lists) {
    this.system = system;
    this.lists = Collections.unmodifiableSortedMap(new TreeMap<>(lists));
  }

  public static Run of(String system, List<RankedList> lists) {
    Map<String, RankedList> byQuery = new TreeMap<>();
    for (RankedList list : lists) {
      if (byQuery.putIfAbsent(list.queryId(), list) != null) {
        throw new IllegalArgumentException(
            "Run %s has more than one list for query %s".formatted(system, list.queryId()));
      }
    }
    return new Run(system, byQuery);
  }

  public String system() {
    return system;
  }

  public Optional<RankedList> list(String queryId) {
    return Optional.ofNullable(lists.get(queryId));
  }

  public Set<String> queryIds() {
    return lists.keySet();
  }

  public int queryCount() {
    return lists.size();
  }
}
