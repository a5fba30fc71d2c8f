package dev.hybridir.fusion;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class FusionPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
          .withUserConfiguration(FusionProperties.class);

  @Test
  void kebab_case_properties_are_bound() {
    contextRunner
        .withPropertyValues(
            "hybridir.fusion.method=linear",
            "hybridir.fusion.weights=0.7,0.3",
            "hybridir.fusion.top-k=100",
            "hybridir.fusion.run-id=bm25_dense_tuned")
        .run(
            context -> {
              FusionConfig config = context.getBean(FusionProperties.class).toFusionConfig();
              assertThat(config.method()).isEqualTo(FusionMethod.LINEAR);
              assertThat(config.weights()).containsExactly(0.7, 0.3);
              assertThat(config.topK()).isEqualTo(100);
              assertThat(config.runId()).isEqualTo("bm25_dense_tuned");
            });
  }

  @Test
  void invalid_configuration_fails_startup() {
    contextRunner
        .withPropertyValues("hybridir.fusion.rrf-k=0")
        .run(
            context ->
                assertThat(context)
                    .hasFailed()
                    .getFailure()
                    .hasRootCauseInstanceOf(FusionConfigurationException.class));
  }
}
