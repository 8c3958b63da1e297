package dev.hitrank.threshold;

/**
 * Significance rules consulted by {@link ThresholdPass}. The pass never computes scores or
 * E-values itself; it only asks these predicates.
 */
public interface ReportabilityCriteria {

  /** Whether a whole target with this bit score and P-value is reportable. */
  boolean isTargetReportable(float score, double pvalue);

  /** Whether a single domain with this bit score and P-value is reportable. */
  boolean isDomainReportable(float score, double pvalue);

  /**
   * Called once between the target pass and the domain pass with the number of targets just
   * flagged, so that a domain search-space size derived from it is current before {@link
   * #isDomainReportable} is asked.
   *
   * @param reportedTargets number of reportable targets
   */
  default void targetsReported(int reportedTargets) {}
}
