package dev.hitrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the hitrank engine.
 *
 * <p>With {@code hitrank.benchmark.enabled=true} the application runs the merge benchmark once at
 * startup and exits.
 */
@SpringBootApplication
public class HitRankApplication {
  public static void main(String[] args) {
    SpringApplication.run(HitRankApplication.class, args);
  }
}
