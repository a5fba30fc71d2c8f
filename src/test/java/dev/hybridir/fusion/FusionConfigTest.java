package dev.hybridir.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FusionConfigTest {

  @Nested
  class Defaults {

    @Test
    void of_uses_k_sixty_equal_weights_half_alpha_and_top_thousand() {
      FusionConfig config = FusionConfig.of(FusionMethod.RRF);

      assertThat(config.rrfK()).isEqualTo(60);
      assertThat(config.weights()).isEmpty();
      assertThat(config.alpha()).isEqualTo(0.5);
      assertThat(config.topK()).isEqualTo(1000);
      assertThat(config.runId()).isNull();
    }

    @Test
    void blank_run_id_means_derived() {
      assertThat(FusionConfig.of(FusionMethod.RRF).withRunId("  ").runId()).isNull();
    }

    @Test
    void run_id_with_inner_whitespace_is_rejected() {
      assertThatThrownBy(() -> FusionConfig.of(FusionMethod.RRF).withRunId("my\trun"))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessageContaining("single token");
    }
  }

  @Nested
  class Validation {

    @Test
    void missing_method_is_rejected() {
      assertThatThrownBy(() -> new FusionConfig(null, 60, List.of(), 0.5, 10, null))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessage("Fusion method must be set");
    }

    @Test
    void non_positive_rrf_k_is_rejected() {
      assertThatThrownBy(() -> FusionConfig.of(FusionMethod.RRF).withRrfK(0))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessage("rrf-k must be positive but was 0");
    }

    @Test
    void alpha_outside_unit_interval_is_rejected() {
      assertThatThrownBy(() -> FusionConfig.of(FusionMethod.WEIGHTED).withAlpha(1.5))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessageStartingWith("alpha must be in [0.0, 1.0]");
      assertThatThrownBy(() -> FusionConfig.of(FusionMethod.WEIGHTED).withAlpha(Double.NaN))
          .isInstanceOf(FusionConfigurationException.class);
    }

    @Test
    void non_positive_top_k_is_rejected() {
      assertThatThrownBy(() -> FusionConfig.of(FusionMethod.COMBSUM).withTopK(0))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessage("top-k must be positive but was 0");
    }

    @Test
    void weights_not_summing_to_one_are_rejected() {
      assertThatThrownBy(() -> FusionConfig.of(FusionMethod.LINEAR).withWeights(List.of(0.5, 0.6)))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessageContaining("must sum to 1.0");
    }

    @Test
    void settings_unused_by_the_method_are_still_validated() {
      assertThatThrownBy(() -> FusionConfig.of(FusionMethod.RRF).withAlpha(-0.1))
          .isInstanceOf(FusionConfigurationException.class);
    }
  }

  @Nested
  class RunCount {

    @Test
    void zero_runs_are_rejected_for_every_method() {
      for (FusionMethod method : FusionMethod.values()) {
        assertThatThrownBy(() -> FusionConfig.of(method).checkRunCount(0))
            .isInstanceOf(FusionConfigurationException.class)
            .hasMessage("At least one run is required");
      }
    }

    @Test
    void linear_weights_must_match_run_count() {
      FusionConfig config = FusionConfig.of(FusionMethod.LINEAR).withWeights(List.of(0.3, 0.7));

      assertThatCode(() -> config.checkRunCount(2)).doesNotThrowAnyException();
      assertThatThrownBy(() -> config.checkRunCount(3))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessage("Got 2 weights for 3 runs");
    }

    @Test
    void linear_with_equal_weights_accepts_any_run_count() {
      assertThatCode(() -> FusionConfig.of(FusionMethod.LINEAR).checkRunCount(5))
          .doesNotThrowAnyException();
    }

    @Test
    void weighted_requires_exactly_two_runs() {
      FusionConfig config = FusionConfig.of(FusionMethod.WEIGHTED);

      assertThatCode(() -> config.checkRunCount(2)).doesNotThrowAnyException();
      assertThatThrownBy(() -> config.checkRunCount(3))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessage("Weighted fusion combines exactly 2 runs but got 3");
    }
  }

  @Test
  void strategy_matches_method() {
    assertThat(FusionConfig.of(FusionMethod.RRF).withRrfK(10).strategy())
        .isInstanceOfSatisfying(
            ReciprocalRankFusion.class, rrf -> assertThat(rrf.k()).isEqualTo(10));
    assertThat(FusionConfig.of(FusionMethod.LINEAR).strategy())
        .isInstanceOf(LinearCombination.class);
    assertThat(FusionConfig.of(FusionMethod.WEIGHTED).strategy())
        .isInstanceOf(WeightedCombination.class);
    assertThat(FusionConfig.of(FusionMethod.COMBSUM).strategy()).isInstanceOf(CombSum.class);
    assertThat(FusionConfig.of(FusionMethod.COMBMNZ).strategy()).isInstanceOf(CombMnz.class);
  }

  @Test
  void every_strategy_reports_its_method() {
    for (FusionMethod method : FusionMethod.values()) {
      assertThat(FusionConfig.of(method).strategy().method()).isEqualTo(method);
    }
  }

  @Nested
  class MethodNames {

    @Test
    void names_resolve_ignoring_case_and_whitespace() {
      assertThat(FusionMethod.fromName("RRF")).isEqualTo(FusionMethod.RRF);
      assertThat(FusionMethod.fromName(" combMNZ ")).isEqualTo(FusionMethod.COMBMNZ);
      assertThat(FusionMethod.fromName("weighted")).isEqualTo(FusionMethod.WEIGHTED);
    }

    @Test
    void unknown_name_lists_the_supported_methods() {
      assertThatThrownBy(() -> FusionMethod.fromName("borda"))
          .isInstanceOf(FusionConfigurationException.class)
          .hasMessage(
              "Unknown fusion method 'borda', expected one of: "
                  + "rrf, linear, weighted, combsum, combmnz");
    }

    @Test
    void null_name_is_unknown() {
      assertThatThrownBy(() -> FusionMethod.fromName(null))
          .isInstanceOf(FusionConfigurationException.class);
    }
  }
}
