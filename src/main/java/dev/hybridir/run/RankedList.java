package dev.hybridir.run;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The ordered result list that one retrieval system produced for one query.
 *
 * <p>Document ids are unique and ranks are strictly increasing in list order. Scores are expected
 * to be non-increasing but are not checked: rank-based fusion only trusts the rank.
 */
public final class RankedList {

  private final String system;
  private final String queryId;
  private final List<RankedDocument> documents;
  private final Map<String, RankedDocument> byDocId;

  public RankedList(String system, String queryId, List<RankedDocument> documents) {
    this.system = system;
    this.queryId = queryId;
    this.documents = List.copyOf(documents);
    this.byDocId = index(this.documents);
  }

  /** A list for a query the system returned nothing for. */
  public static RankedList empty(String system, String queryId) {
    return new RankedList(system, queryId, List.of());
  }

  private static Map<String, RankedDocument> index(List<RankedDocument> documents) {
    Map<String, RankedDocument> index = new LinkedHashMap<>();
    int previousRank = 0;
    for (RankedDocument document : documents) {
      if (document.rank() <= previousRank) {
        throw new IllegalArgumentException(
            "Ranks must be strictly increasing but %d follows %d"
                .formatted(document.rank(), previousRank));
      }
      if (index.putIfAbsent(document.docId(), document) != null) {
        throw new IllegalArgumentException("Duplicate document id: " + document.docId());
      }
      previousRank = document.rank();
    }
    return Collections.unmodifiableMap(index);
  }

  public String system() {
    return system;
  }

  public String queryId() {
    return queryId;
  }

  public List<RankedDocument> documents() {
    return documents;
  }

  public int size() {
    return documents.size();
  }

  public boolean isEmpty() {
    return documents.isEmpty();
  }

  /** Looks up a document by id; empty when this system did not retrieve it. */
  public Optional<RankedDocument> find(String docId) {
    return Optional.ofNullable(byDocId.get(docId));
  }

  public Set<String> docIds() {
    return new HashSet<>(byDocId.keySet());
  }

  @Override
  public String toString() {
    return "RankedList[system=%s, queryId=%s, size=%d]".formatted(system, queryId, size());
  }
}
