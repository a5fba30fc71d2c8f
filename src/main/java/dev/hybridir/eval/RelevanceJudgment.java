package dev.hybridir.eval;

/**
 * A graded relevance judgment for one document of one query.
 *
 * @param docId the judged document
 * @param grade relevance grade; grades of 1 and above count as relevant, 0 and below as not
 *     relevant
 */
public record RelevanceJudgment(String docId, int grade) {

  public boolean isRelevant() {
    return grade >= 1;
  }
}
