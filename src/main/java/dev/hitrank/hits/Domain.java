package dev.hitrank.hits;

import org.jspecify.annotations.Nullable;

/**
 * One independently scored sub-alignment of a {@link Hit}.
 *
 * <p>Scores, coordinates and the alignment payload are filled in by the producer; the reportable
 * flag is owned by the threshold pass.
 */
public class Domain {

  private float bitScore;
  private double pvalue;
  private int envFrom;
  private int envTo;
  private float domCorrection;
  private float oasc;
  private boolean reported;
  private @Nullable AlignmentDisplay alignment;

  public Domain() {}

  public Domain(float bitScore, double pvalue) {
    this.bitScore = bitScore;
    this.pvalue = pvalue;
  }

  public float getBitScore() {
    return bitScore;
  }

  public void setBitScore(float bitScore) {
    this.bitScore = bitScore;
  }

  public double getPvalue() {
    return pvalue;
  }

  public void setPvalue(double pvalue) {
    this.pvalue = pvalue;
  }

  public int getEnvFrom() {
    return envFrom;
  }

  public int getEnvTo() {
    return envTo;
  }

  /** Sets the envelope coordinates on the target (1-based, inclusive). */
  public void setEnvelope(int envFrom, int envTo) {
    this.envFrom = envFrom;
    this.envTo = envTo;
  }

  /** Null2 score correction for this domain, in nats. */
  public float getDomCorrection() {
    return domCorrection;
  }

  public void setDomCorrection(float domCorrection) {
    this.domCorrection = domCorrection;
  }

  /** Sum of posterior probabilities over the optimal accuracy alignment. */
  public float getOasc() {
    return oasc;
  }

  public void setOasc(float oasc) {
    this.oasc = oasc;
  }

  public boolean isReported() {
    return reported;
  }

  /** Flag owned by the threshold pass. */
  public void setReported(boolean reported) {
    this.reported = reported;
  }

  public @Nullable AlignmentDisplay getAlignment() {
    return alignment;
  }

  public void setAlignment(@Nullable AlignmentDisplay alignment) {
    this.alignment = alignment;
  }
}
