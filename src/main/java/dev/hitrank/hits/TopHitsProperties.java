package dev.hitrank.hits;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised sizing of hit lists.
 *
 * <p>Properties are bound from {@code hitrank.tophits.*} in application.yml.
 *
 * <ul>
 *   <li>{@code initial-capacity} - hits allocated when a list is created (default 256)
 *   <li>{@code max-capacity} - upper bound on growth and merges (default {@link
 *       TopHits#MAX_ARRAY_CAPACITY})
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "hitrank.tophits")
public class TopHitsProperties {

  private int initialCapacity = TopHits.DEFAULT_CAPACITY;
  private int maxCapacity = TopHits.MAX_ARRAY_CAPACITY;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (initialCapacity < 1) {
      throw new IllegalStateException(
          "hitrank.tophits.initial-capacity must be at least 1, got: " + initialCapacity);
    }
    if (maxCapacity < initialCapacity || maxCapacity > TopHits.MAX_ARRAY_CAPACITY) {
      throw new IllegalStateException(
          "hitrank.tophits.max-capacity must be in [initial-capacity, %d], got: %d"
              .formatted(TopHits.MAX_ARRAY_CAPACITY, maxCapacity));
    }
  }

  public int getInitialCapacity() {
    return initialCapacity;
  }

  public void setInitialCapacity(int initialCapacity) {
    this.initialCapacity = initialCapacity;
  }

  public int getMaxCapacity() {
    return maxCapacity;
  }

  public void setMaxCapacity(int maxCapacity) {
    this.maxCapacity = maxCapacity;
  }
}
