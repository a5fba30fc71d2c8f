package dev.hybridir.run;

/**
 * One entry of a system's ranked result list for a query.
 *
 * @param docId the document identifier as written by the producing system
 * @param rank the 1-based rank assigned by the producing system
 * @param score the raw retrieval score; only comparable within the same system and query
 */
public record RankedDocument(String docId, int rank, double score) {

  public RankedDocument {
    if (docId == null || docId.isBlank()) {
      throw new IllegalArgumentException("docId must not be blank");
    }
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be positive but was " + rank);
    }
  }
}
