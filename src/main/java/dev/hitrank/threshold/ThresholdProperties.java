package dev.hitrank.threshold;

import jakarta.annotation.PostConstruct;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised reporting thresholds.
 *
 * <p>Properties are bound from {@code hitrank.threshold.*} in application.yml.
 *
 * <ul>
 *   <li>{@code by-evalue} - threshold targets by E-value rather than bit score (default true)
 *   <li>{@code evalue} / {@code score} - target thresholds (defaults 10.0 / 0.0)
 *   <li>{@code domain-by-evalue} - threshold domains by E-value (default true)
 *   <li>{@code domain-evalue} / {@code domain-score} - domain thresholds (defaults 10.0 / 0.0)
 *   <li>{@code domain-search-space} - fixed domain search space; unset means the number of
 *       reportable targets
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "hitrank.threshold")
public class ThresholdProperties {

  private boolean byEvalue = true;
  private double evalue = 10.0;
  private float score = 0.0f;
  private boolean domainByEvalue = true;
  private double domainEvalue = 10.0;
  private float domainScore = 0.0f;
  private @Nullable Double domainSearchSpace;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (evalue <= 0.0) {
      throw new IllegalStateException("hitrank.threshold.evalue must be > 0, got: " + evalue);
    }
    if (domainEvalue <= 0.0) {
      throw new IllegalStateException(
          "hitrank.threshold.domain-evalue must be > 0, got: " + domainEvalue);
    }
    if (domainSearchSpace != null && domainSearchSpace < 0.0) {
      throw new IllegalStateException(
          "hitrank.threshold.domain-search-space must not be negative, got: "
              + domainSearchSpace);
    }
  }

  /**
   * Builds the thresholds for one search.
   *
   * @param searchSpace number of targets searched, Z
   * @return fresh thresholds; each search needs its own since the domain search space is stateful
   */
  public ReportingThresholds toThresholds(double searchSpace) {
    return new ReportingThresholds(
        byEvalue,
        evalue,
        score,
        domainByEvalue,
        domainEvalue,
        domainScore,
        searchSpace,
        domainSearchSpace);
  }

  public boolean isByEvalue() {
    return byEvalue;
  }

  public void setByEvalue(boolean byEvalue) {
    this.byEvalue = byEvalue;
  }

  public double getEvalue() {
    return evalue;
  }

  public void setEvalue(double evalue) {
    this.evalue = evalue;
  }

  public float getScore() {
    return score;
  }

  public void setScore(float score) {
    this.score = score;
  }

  public boolean isDomainByEvalue() {
    return domainByEvalue;
  }

  public void setDomainByEvalue(boolean domainByEvalue) {
    this.domainByEvalue = domainByEvalue;
  }

  public double getDomainEvalue() {
    return domainEvalue;
  }

  public void setDomainEvalue(double domainEvalue) {
    this.domainEvalue = domainEvalue;
  }

  public float getDomainScore() {
    return domainScore;
  }

  public void setDomainScore(float domainScore) {
    this.domainScore = domainScore;
  }

  public @Nullable Double getDomainSearchSpace() {
    return domainSearchSpace;
  }

  public void setDomainSearchSpace(@Nullable Double domainSearchSpace) {
    this.domainSearchSpace = domainSearchSpace;
  }
}
