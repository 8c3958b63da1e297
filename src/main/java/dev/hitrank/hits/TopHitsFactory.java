package dev.hitrank.hits;

import org.springframework.stereotype.Component;

/** Creates hit lists sized from {@link TopHitsProperties}. */
@Component
public class TopHitsFactory {

  private final TopHitsProperties properties;

  public TopHitsFactory(TopHitsProperties properties) {
    this.properties = properties;
  }

  /** Returns a new, empty list owned by the caller. */
  public TopHits create() {
    return new TopHits(properties.getInitialCapacity(), properties.getMaxCapacity());
  }
}
