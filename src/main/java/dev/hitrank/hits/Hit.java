package dev.hitrank.hits;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One scored target in a {@link TopHits} list: identity, ranking key, scores, the domains found in
 * the target and the reporting flags set by the threshold pass.
 *
 * <p>Instances are handed out by {@link TopHits#createNextHit()} and filled in place by the
 * producer. The list owns them: after {@link TopHits#reuse()} the same object may be reset and
 * handed out again, so callers must not keep a reference across a reuse.
 *
 * <p>Invariant: {@link #getBestDomain()} is {@code -1} or a valid index into {@link
 * #getDomains()}.
 */
public class Hit {

  private @Nullable String name;
  private @Nullable String accession;
  private @Nullable String description;
  private double sortKey;

  private float score;
  private float preScore;
  private float sumScore;

  private double pvalue;
  private double prePvalue;
  private double sumPvalue;

  private final List<Domain> domains = new ArrayList<>();
  private float nexpected;
  private int nregions;
  private int nclustered;
  private int noverlaps;
  private int nenvelopes;

  private boolean reported;
  private int reportedDomains;
  private int bestDomain = -1;

  Hit() {}

  /** Restores every field to its default; the domain list keeps its capacity. */
  void reset() {
    name = null;
    accession = null;
    description = null;
    sortKey = 0.0;
    score = 0.0f;
    preScore = 0.0f;
    sumScore = 0.0f;
    pvalue = 0.0;
    prePvalue = 0.0;
    sumPvalue = 0.0;
    domains.clear();
    nexpected = 0.0f;
    nregions = 0;
    nclustered = 0;
    noverlaps = 0;
    nenvelopes = 0;
    reported = false;
    reportedDomains = 0;
    bestDomain = -1;
  }

  public @Nullable String getName() {
    return name;
  }

  public void setName(@Nullable String name) {
    this.name = name;
  }

  public @Nullable String getAccession() {
    return accession;
  }

  public void setAccession(@Nullable String accession) {
    this.accession = accession;
  }

  public @Nullable String getDescription() {
    return description;
  }

  public void setDescription(@Nullable String description) {
    this.description = description;
  }

  /** Ranking value: bigger is better. */
  public double getSortKey() {
    return sortKey;
  }

  public void setSortKey(double sortKey) {
    this.sortKey = sortKey;
  }

  public float getScore() {
    return score;
  }

  public void setScore(float score) {
    this.score = score;
  }

  /** Score before the null2 bias correction. */
  public float getPreScore() {
    return preScore;
  }

  public void setPreScore(float preScore) {
    this.preScore = preScore;
  }

  /** Summed score over all domains. */
  public float getSumScore() {
    return sumScore;
  }

  public void setSumScore(float sumScore) {
    this.sumScore = sumScore;
  }

  public double getPvalue() {
    return pvalue;
  }

  public void setPvalue(double pvalue) {
    this.pvalue = pvalue;
  }

  public double getPrePvalue() {
    return prePvalue;
  }

  public void setPrePvalue(double prePvalue) {
    this.prePvalue = prePvalue;
  }

  public double getSumPvalue() {
    return sumPvalue;
  }

  public void setSumPvalue(double sumPvalue) {
    this.sumPvalue = sumPvalue;
  }

  /** Read-only view of the domains, in the order they were added. */
  public List<Domain> getDomains() {
    return Collections.unmodifiableList(domains);
  }

  public Domain getDomain(int index) {
    return domains.get(index);
  }

  public int domainCount() {
    return domains.size();
  }

  /**
   * Appends a domain to this hit.
   *
   * @param domain the domain to take ownership of
   * @return the index of the new domain
   */
  public int addDomain(Domain domain) {
    if (domain == null) {
      throw new IllegalArgumentException("Domain must not be null");
    }
    domains.add(domain);
    return domains.size() - 1;
  }

  /** Expected number of domains. */
  public float getNexpected() {
    return nexpected;
  }

  public void setNexpected(float nexpected) {
    this.nexpected = nexpected;
  }

  public int getNregions() {
    return nregions;
  }

  public void setNregions(int nregions) {
    this.nregions = nregions;
  }

  public int getNclustered() {
    return nclustered;
  }

  public void setNclustered(int nclustered) {
    this.nclustered = nclustered;
  }

  public int getNoverlaps() {
    return noverlaps;
  }

  public void setNoverlaps(int noverlaps) {
    this.noverlaps = noverlaps;
  }

  public int getNenvelopes() {
    return nenvelopes;
  }

  public void setNenvelopes(int nenvelopes) {
    this.nenvelopes = nenvelopes;
  }

  public boolean isReported() {
    return reported;
  }

  /** Flag owned by the threshold pass. */
  public void setReported(boolean reported) {
    this.reported = reported;
  }

  /** Number of domains flagged reportable by the threshold pass. */
  public int getReportedDomains() {
    return reportedDomains;
  }

  public void setReportedDomains(int reportedDomains) {
    this.reportedDomains = reportedDomains;
  }

  public int getBestDomain() {
    return bestDomain;
  }

  /**
   * Marks the single best-scoring domain.
   *
   * @param bestDomain index into {@link #getDomains()}, or {@code -1} for none
   * @throws IllegalArgumentException if the index is neither {@code -1} nor a valid domain index
   */
  public void setBestDomain(int bestDomain) {
    if (bestDomain < -1 || bestDomain >= domains.size()) {
      throw new IllegalArgumentException(
          "bestDomain must be -1 or in [0, %d), got: %d".formatted(domains.size(), bestDomain));
    }
    this.bestDomain = bestDomain;
  }

  /** Returns the best domain, or {@code null} when none is set. */
  public @Nullable Domain bestDomain() {
    return bestDomain < 0 ? null : domains.get(bestDomain);
  }

  @Override
  public String toString() {
    return "Hit[name=%s, sortKey=%s, score=%s, pvalue=%s, domains=%d]"
        .formatted(name, sortKey, score, pvalue, domains.size());
  }
}
