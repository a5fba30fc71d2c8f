package dev.hybridir.fusion;

import dev.hybridir.run.RankedDocument;
import dev.hybridir.run.RankedList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The candidate set of one query: the union of document ids over all input lists, with explicit
 * presence per (document, system).
 *
 * <p>A document a system did not retrieve is <em>absent</em> for that system, which is different
 * from being retrieved with a score of zero: {@link #rank} and {@link #normalizedScore} return an
 * empty optional rather than a zero value.
 *
 * <p>Instances are confined to the thread fusing the query; normalised scores are computed on
 * first use.
 */
public final class CandidatePool {

  private final String queryId;
  private final List<RankedList> lists;
  private final SortedSet<String> docIds;
  private final Map<Integer, Map<String, Double>> normalized = new HashMap<>();

  private CandidatePool(String queryId, List<RankedList> lists) {
    this.queryId = queryId;
    this.lists = List.copyOf(lists);
    SortedSet<String> union = new TreeSet<>();
    for (RankedList list : this.lists) {
      for (RankedDocument document : list.documents()) {
        union.add(document.docId());
      }
    }
    this.docIds = Collections.unmodifiableSortedSet(union);
  }

  /**
   * Builds the pool for one query. System indexes follow the order of {@code lists}.
   *
   * @throws IllegalArgumentException if a list belongs to another query
   */
  public static CandidatePool of(String queryId, List<RankedList> lists) {
    for (RankedList list : lists) {
      if (!queryId.equals(list.queryId())) {
        throw new IllegalArgumentException(
            "List of system %s is for query %s, not %s"
                .formatted(list.system(), list.queryId(), queryId));
      }
    }
    return new CandidatePool(queryId, lists);
  }

  public String queryId() {
    return queryId;
  }

  public int systemCount() {
    return lists.size();
  }

  public RankedList list(int system) {
    return lists.get(system);
  }

  /** Candidate document ids in lexicographic order. */
  public SortedSet<String> docIds() {
    return docIds;
  }

  public boolean isPresent(int system, String docId) {
    return lists.get(system).find(docId).isPresent();
  }

  /** Number of systems that retrieved the document. */
  public int presenceCount(String docId) {
    int count = 0;
    for (int system = 0; system < lists.size(); system++) {
      if (isPresent(system, docId)) {
        count++;
      }
    }
    return count;
  }

  /** Rank the system gave the document, empty when absent. */
  public OptionalInt rank(int system, String docId) {
    Optional<RankedDocument> document = lists.get(system).find(docId);
    return document.isPresent() ? OptionalInt.of(document.get().rank()) : OptionalInt.empty();
  }

  /** Min-max normalised score of the document within the system's list, empty when absent. */
  public OptionalDouble normalizedScore(int system, String docId) {
    Double score =
        normalized
            .computeIfAbsent(system, s -> ScoreNormalizer.minMax(lists.get(s)))
            .get(docId);
    return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
  }
}
