package dev.hybridir;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the hybrid retrieval fusion toolkit.
 *
 * <p>With {@code hybridir.job.enabled=true} the fusion job runs once at startup and the application
 * exits when it completes.
 */
@SpringBootApplication
public class HybridIrApplication {
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(HybridIrApplication.class, args)));
  }
}
