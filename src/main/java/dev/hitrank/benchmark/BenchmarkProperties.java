package dev.hitrank.benchmark;

import dev.hitrank.hits.TopHits;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised settings of the merge benchmark.
 *
 * <p>Properties are bound from {@code hitrank.benchmark.*} in application.yml.
 *
 * <ul>
 *   <li>{@code enabled} - run the benchmark at startup (default false)
 *   <li>{@code lists} - number of simulated worker lists to merge (default 10)
 *   <li>{@code hits} - hits per list (default 10000)
 *   <li>{@code seed} - random seed for the sort keys (default 42)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "hitrank.benchmark")
public class BenchmarkProperties {

  private boolean enabled = false;
  private int lists = 10;
  private int hits = 10_000;
  private long seed = 42L;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (lists < 1) {
      throw new IllegalStateException("hitrank.benchmark.lists must be at least 1, got: " + lists);
    }
    if (hits < 0) {
      throw new IllegalStateException("hitrank.benchmark.hits must not be negative, got: " + hits);
    }
    if ((long) lists * hits > TopHits.MAX_ARRAY_CAPACITY) {
      throw new IllegalStateException(
          "hitrank.benchmark.hits times hitrank.benchmark.lists must be at most %d, got: %d"
              .formatted(TopHits.MAX_ARRAY_CAPACITY, (long) lists * hits));
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getLists() {
    return lists;
  }

  public void setLists(int lists) {
    this.lists = lists;
  }

  public int getHits() {
    return hits;
  }

  public void setHits(int hits) {
    this.hits = hits;
  }

  public long getSeed() {
    return seed;
  }

  public void setSeed(long seed) {
    this.seed = seed;
  }
}
