package dev.hybridir.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.hybridir.fixture.RankedListBuilder;
import dev.hybridir.run.RankedList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class CandidatePoolTest {

  private static final RankedList BM25 =
      new RankedListBuilder("bm25", "q1").doc("b", 10.0).doc("a", 5.0).build();
  private static final RankedList DENSE =
      new RankedListBuilder("dense", "q1").doc("c", 0.9).doc("a", 0.8).build();

  @Test
  void candidate_set_is_union_in_lexicographic_order() {
    CandidatePool pool = CandidatePool.of("q1", List.of(BM25, DENSE));

    assertThat(pool.docIds()).containsExactly("a", "b", "c");
    assertThat(pool.systemCount()).isEqualTo(2);
  }

  @Test
  void absence_is_distinct_from_a_zero_score() {
    CandidatePool pool = CandidatePool.of("q1", List.of(BM25, DENSE));

    // "a" is last in bm25 so it normalises to 0.0 but is still present
    assertThat(pool.normalizedScore(0, "a")).isEqualTo(OptionalDouble.of(0.0));
    assertThat(pool.isPresent(0, "a")).isTrue();
    // "c" was never retrieved by bm25
    assertThat(pool.normalizedScore(0, "c")).isEmpty();
    assertThat(pool.isPresent(0, "c")).isFalse();
  }

  @Test
  void rank_is_reported_only_for_present_documents() {
    CandidatePool pool = CandidatePool.of("q1", List.of(BM25, DENSE));

    assertThat(pool.rank(1, "a")).isEqualTo(OptionalInt.of(2));
    assertThat(pool.rank(1, "b")).isEmpty();
  }

  @Test
  void presence_count_counts_retrieving_systems() {
    CandidatePool pool = CandidatePool.of("q1", List.of(BM25, DENSE));

    assertThat(pool.presenceCount("a")).isEqualTo(2);
    assertThat(pool.presenceCount("b")).isEqualTo(1);
    assertThat(pool.presenceCount("c")).isEqualTo(1);
  }

  @Test
  void lists_of_another_query_are_rejected() {
    RankedList other = RankedList.empty("dense", "q2");

    assertThatThrownBy(() -> CandidatePool.of("q1", List.of(BM25, other)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("is for query q2, not q1");
  }
}
