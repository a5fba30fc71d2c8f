package dev.hybridir.fusion;

import dev.hybridir.run.RankedDocument;
import dev.hybridir.run.RankedList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Min-max normalisation of one system's scores for one query.
 *
 * <p>Scores map to {@code (score - min) / (max - min)}. When {@code max == min} (a single document,
 * or all documents tied) every document normalises to {@code 1.0}. Documents the system did not
 * retrieve get no entry.
 */
public final class ScoreNormalizer {

  private ScoreNormalizer() {}

  /**
   * Normalises the scores of a ranked list to [0, 1].
   *
   * @param list one system's list for one query
   * @return normalised score per document id, in rank order; empty for an empty list
   */
  public static Map<String, Double> minMax(RankedList list) {
    Map<String, Double> normalised = new LinkedHashMap<>();
    if (list.isEmpty()) {
      return normalised;
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (RankedDocument document : list.documents()) {
      min = Math.min(min, document.score());
      max = Math.max(max, document.score());
    }
    for (RankedDocument document : list.documents()) {
      normalised.put(document.docId(), normalise(document.score(), min, max));
    }
    return normalised;
  }

  /**
   * Min-max normalises a score to [0, 1]. If max == min, returns 1.0. Operands are halved first so
   * that a range spanning most of the double range does not overflow.
   *
   * @param score the raw score to normalise
   * @param min the minimum score in the list
   * @param max the maximum score in the list
   * @return normalised score in [0, 1]
   */
  static double normalise(double score, double min, double max) {
    if (max == min) {
      return 1.0;
    }
    return (score / 2 - min / 2) / (max / 2 - min / 2);
  }
}
