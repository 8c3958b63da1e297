package dev.hitrank.threshold;

import dev.hitrank.hits.Domain;
import dev.hitrank.hits.Hit;
import dev.hitrank.hits.TopHits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags the reportable targets and domains of a hit list.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Clear every target and domain flag, so the pass can be re-applied with other criteria
 *   <li>Flag each target whose (score, P-value) satisfies {@link
 *       ReportabilityCriteria#isTargetReportable} and count them
 *   <li>Report the count through {@link ReportabilityCriteria#targetsReported}
 *   <li>For each reportable target, flag its best domain unconditionally and every other domain
 *       that satisfies {@link ReportabilityCriteria#isDomainReportable}
 * </ol>
 *
 * <p>Order of the list is irrelevant; hits are visited in append order. Pure static utility.
 */
public final class ThresholdPass {

  private static final Logger log = LoggerFactory.getLogger(ThresholdPass.class);

  private ThresholdPass() {}

  /**
   * Applies the criteria to every hit of the list.
   *
   * @param hits the list to flag in place
   * @param criteria the significance rules
   * @return the number of reportable targets, also stored as {@link TopHits#reportedCount()}
   * @throws IllegalStateException if a reportable target has domains but no valid best domain
   */
  public static int apply(TopHits hits, ReportabilityCriteria criteria) {
    int n = hits.size();

    for (int h = 0; h < n; h++) {
      Hit hit = hits.getUnsorted(h);
      clearFlags(hit);
      if (criteria.isTargetReportable(hit.getScore(), hit.getPvalue())) {
        hit.setReported(true);
      }
    }
    int reported = hits.recountReported();

    criteria.targetsReported(reported);

    int reportedDomains = 0;
    for (int h = 0; h < n; h++) {
      Hit hit = hits.getUnsorted(h);
      if (!hit.isReported()) {
        continue;
      }
      int best = hit.getBestDomain();
      if (hit.domainCount() > 0 && (best < 0 || best >= hit.domainCount())) {
        throw new IllegalStateException(
            "Reportable hit %s has %d domains but best domain %d"
                .formatted(hit.getName(), hit.domainCount(), best));
      }
      for (int d = 0; d < hit.domainCount(); d++) {
        Domain domain = hit.getDomain(d);
        if (d == best || criteria.isDomainReportable(domain.getBitScore(), domain.getPvalue())) {
          domain.setReported(true);
          hit.setReportedDomains(hit.getReportedDomains() + 1);
          reportedDomains++;
        }
      }
    }

    log.debug(
        "Threshold pass: {} of {} targets reportable, {} domains reportable",
        reported,
        n,
        reportedDomains);
    return reported;
  }

  private static void clearFlags(Hit hit) {
    hit.setReported(false);
    hit.setReportedDomains(0);
    for (Domain domain : hit.getDomains()) {
      domain.setReported(false);
    }
  }
}
