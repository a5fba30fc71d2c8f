package dev.hybridir.run;

/**
 * A document in a fused ranking.
 *
 * @param docId the document identifier
 * @param score the combined score; its magnitude depends on the fusion method and the query
 * @param rank the final 1-based rank
 */
public record FusedDocument(String docId, double score, int rank) {}
