package dev.hybridir.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} used to timestamp evaluation exports. UTC keeps export file names
 * independent of the machine running the experiment; tests replace it with a fixed clock.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock exportClock() {
    return Clock.systemUTC();
  }
}
