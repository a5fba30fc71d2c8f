package dev.hybridir.eval;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/** Relevance judgments of an experiment, by query id. */
public final class Qrels {

  private final SortedMap<String, List<RelevanceJudgment>> judgments;

  public Qrels(Map<String, List<RelevanceJudgment>> judgments) {
    SortedMap<String, List<RelevanceJudgment>> copy = new TreeMap<>();
    judgments.forEach((query, list) -> copy.put(query, List.copyOf(list)));
    this.judgments = Collections.unmodifiableSortedMap(copy);
  }

  /** Judgments for the query; empty when the query was not judged. */
  public List<RelevanceJudgment> judgments(String queryId) {
    return judgments.getOrDefault(queryId, List.of());
  }

  public boolean isJudged(String queryId) {
    return judgments.containsKey(queryId);
  }

  public Set<String> queryIds() {
    return judgments.keySet();
  }

  /** Number of documents judged relevant for the query. */
  public int relevantCount(String queryId) {
    return (int) judgments(queryId).stream().filter(RelevanceJudgment::isRelevant).count();
  }
}
