package dev.hybridir.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.hybridir.fixture.RankedListBuilder;
import dev.hybridir.run.RankedList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LinearCombinationTest {

  private static final double TOLERANCE = 1e-12;

  // A: x=10, y=5 -> x=1.0, y=0.0; B: x=2, y=8 -> x=0.0, y=1.0
  private static final RankedList A =
      new RankedListBuilder("A", "q1").doc("x", 10.0).doc("y", 5.0).build();
  private static final RankedList B =
      new RankedListBuilder("B", "q1").doc("y", 8.0).doc("x", 2.0).build();

  private static final CandidatePool POOL = CandidatePool.of("q1", List.of(A, B));

  @Nested
  class Linear {

    @Test
    void equal_weights_give_the_mean_normalised_score() {
      Map<String, Double> scores = new LinearCombination(List.of(0.5, 0.5)).fuse(POOL);

      assertThat(scores.get("x")).isCloseTo(0.5, within(TOLERANCE));
      assertThat(scores.get("y")).isCloseTo(0.5, within(TOLERANCE));
    }

    @Test
    void default_weights_are_equal() {
      assertThat(new LinearCombination().fuse(POOL))
          .isEqualTo(new LinearCombination(List.of(0.5, 0.5)).fuse(POOL));
    }

    @Test
    void default_weights_adapt_to_three_systems() {
      RankedList c = new RankedListBuilder("C", "q1").doc("z", 1.0).build();

      Map<String, Double> scores =
          new LinearCombination().fuse(CandidatePool.of("q1", List.of(A, B, c)));

      // z is alone in C -> normalised 1.0, weight 1/3
      assertThat(scores.get("z")).isCloseTo(1.0 / 3.0, within(TOLERANCE));
    }

    @Test
    void unequal_weights_favour_the_heavier_system() {
      Map<String, Double> scores = new LinearCombination(List.of(0.8, 0.2)).fuse(POOL);

      assertThat(scores.get("x")).isCloseTo(0.8, within(TOLERANCE));
      assertThat(scores.get("y")).isCloseTo(0.2, within(TOLERANCE));
    }

    @Test
    void absent_documents_contribute_zero() {
      RankedList c = new RankedListBuilder("C", "q1").doc("z", 3.0).doc("w", 1.0).build();

      Map<String, Double> scores =
          new LinearCombination(List.of(0.5, 0.5)).fuse(CandidatePool.of("q1", List.of(A, c)));

      assertThat(scores.get("x")).isCloseTo(0.5, within(TOLERANCE));
      assertThat(scores.get("z")).isCloseTo(0.5, within(TOLERANCE));
      assertThat(scores.get("w")).isCloseTo(0.0, within(TOLERANCE));
    }

    @Test
    void weights_within_tolerance_are_accepted() {
      assertThat(new LinearCombination(List.of(0.3333333, 0.3333333, 0.3333334)).weights())
          .hasSize(3);
    }

    @Test
    void weights_not_summing_to_one_are_rejected_not_renormalised() {
      assertThatThrownBy(() -> new LinearCombination(List.of(0.6, 0.6)))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessageContaining("must sum to 1.0");
    }

    @Test
    void empty_weights_are_rejected() {
      assertThatThrownBy(() -> new LinearCombination(List.of()))
          .isInstanceOf(FusionConfigurationException.class);
    }

    @Test
    void weight_count_must_match_system_count() {
      LinearCombination linear = new LinearCombination(List.of(0.2, 0.3, 0.5));

      assertThatThrownBy(() -> linear.fuse(POOL))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessage("Got 3 weights for 2 runs");
    }
  }

  @Nested
  class Weighted {

    @Test
    void alpha_weights_first_system_and_complement_weights_second() {
      Map<String, Double> scores = new WeightedCombination(0.7).fuse(POOL);

      assertThat(scores.get("x")).isCloseTo(0.7, within(TOLERANCE));
      assertThat(scores.get("y")).isCloseTo(0.3, within(TOLERANCE));
    }

    @Test
    void alpha_equals_linear_combination_with_alpha_and_complement() {
      assertThat(new WeightedCombination(0.25).fuse(POOL))
          .isEqualTo(new LinearCombination(List.of(0.25, 0.75)).fuse(POOL));
    }

    @Test
    void alpha_zero_uses_only_the_second_system() {
      Map<String, Double> scores = new WeightedCombination(0.0).fuse(POOL);

      assertThat(scores.get("x")).isEqualTo(0.0);
      assertThat(scores.get("y")).isEqualTo(1.0);
    }

    @Test
    void alpha_outside_unit_interval_is_rejected() {
      assertThatThrownBy(() -> new WeightedCombination(1.5))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessageContaining("alpha");
      assertThatThrownBy(() -> new WeightedCombination(-0.1))
          .isInstanceOf(FusionConfigurationException.class);
      assertThatThrownBy(() -> new WeightedCombination(Double.NaN))
          .isInstanceOf(FusionConfigurationException.class);
    }

    @Test
    void requires_exactly_two_systems() {
      CandidatePool single = CandidatePool.of("q1", List.of(A));

      assertThatThrownBy(() -> new WeightedCombination(0.5).fuse(single))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessageContaining("exactly 2 runs");
    }
  }
}
