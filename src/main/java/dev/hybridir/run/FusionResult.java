package dev.hybridir.run;

import java.util.List;

/**
 * The fused ranking of one query, ordered by final rank. Created per fusion call and never mutated.
 *
 * @param queryId the query identifier
 * @param documents the fused documents; ranks are {@code 1..documents.size()}
 */
public record FusionResult(String queryId, List<FusedDocument> documents) {

  public FusionResult {
    documents = List.copyOf(documents);
  }

  public int size() {
    return documents.size();
  }

  /** Document ids in rank order. */
  public List<String> docIds() {
    return documents.stream().map(FusedDocument::docId).toList();
  }
}
