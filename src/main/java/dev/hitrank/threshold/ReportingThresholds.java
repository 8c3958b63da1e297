package dev.hitrank.threshold;

import org.jspecify.annotations.Nullable;

/**
 * Reporting rules of a search pipeline.
 *
 * <p>A target is reportable when its E-value ({@code pvalue * searchSpace}) is at most {@code
 * evalue}, or, when thresholding by score, when its bit score is at least {@code score}. Domains
 * follow the same rule against their own thresholds, with E-values computed over the domain
 * search space. Unless fixed explicitly, the domain search space is the number of reportable
 * targets and is refreshed by {@link #targetsReported(int)} during the threshold pass.
 */
public class ReportingThresholds implements ReportabilityCriteria {

  private final boolean byEvalue;
  private final double evalue;
  private final float score;
  private final boolean domainByEvalue;
  private final double domainEvalue;
  private final float domainScore;
  private final double searchSpace;
  private final boolean domainSearchSpaceFromTargets;
  private double domainSearchSpace;

  /**
   * @param byEvalue threshold targets by E-value (true) or by bit score (false)
   * @param evalue target E-value threshold
   * @param score target bit score threshold
   * @param domainByEvalue threshold domains by E-value (true) or by bit score (false)
   * @param domainEvalue domain E-value threshold
   * @param domainScore domain bit score threshold
   * @param searchSpace number of targets searched, Z
   * @param domainSearchSpace fixed domain search space, or null to use the number of reportable
   *     targets
   */
  public ReportingThresholds(
      boolean byEvalue,
      double evalue,
      float score,
      boolean domainByEvalue,
      double domainEvalue,
      float domainScore,
      double searchSpace,
      @Nullable Double domainSearchSpace) {
    if (evalue <= 0.0 || domainEvalue <= 0.0) {
      throw new IllegalArgumentException("E-value thresholds must be positive");
    }
    if (searchSpace < 0.0) {
      throw new IllegalArgumentException("searchSpace must not be negative, got: " + searchSpace);
    }
    this.byEvalue = byEvalue;
    this.evalue = evalue;
    this.score = score;
    this.domainByEvalue = domainByEvalue;
    this.domainEvalue = domainEvalue;
    this.domainScore = domainScore;
    this.searchSpace = searchSpace;
    this.domainSearchSpaceFromTargets = domainSearchSpace == null;
    this.domainSearchSpace = domainSearchSpace == null ? 0.0 : domainSearchSpace;
  }

  /** Default E-value thresholds of 10 for targets and domains over the given search space. */
  public static ReportingThresholds byEvalue(double searchSpace) {
    return new ReportingThresholds(true, 10.0, 0.0f, true, 10.0, 0.0f, searchSpace, null);
  }

  @Override
  public boolean isTargetReportable(float score, double pvalue) {
    if (byEvalue) {
      return pvalue * searchSpace <= evalue;
    }
    return score >= this.score;
  }

  @Override
  public boolean isDomainReportable(float score, double pvalue) {
    if (domainByEvalue) {
      return pvalue * domainSearchSpace <= domainEvalue;
    }
    return score >= domainScore;
  }

  @Override
  public void targetsReported(int reportedTargets) {
    if (domainSearchSpaceFromTargets) {
      domainSearchSpace = reportedTargets;
    }
  }

  /** Effective number of targets searched, Z. */
  public double getSearchSpace() {
    return searchSpace;
  }

  /** Effective domain search space, domZ, as of the last threshold pass. */
  public double getDomainSearchSpace() {
    return domainSearchSpace;
  }

  public boolean isDomainSearchSpaceFromTargets() {
    return domainSearchSpaceFromTargets;
  }
}
