package dev.hitrank.hits;

/**
 * Display payload of one domain alignment, produced upstream and carried by a {@link Domain}.
 *
 * <p>The ranked list never looks inside it; only report writers read the coordinates and the
 * pre-rendered alignment text.
 *
 * @param hmmFrom first model position of the alignment (1-based)
 * @param hmmTo last model position of the alignment
 * @param modelLength model length M
 * @param seqFrom first target position (1-based; greater than {@code seqTo} on the reverse strand)
 * @param seqTo last target position
 * @param seqLength target length L
 * @param text the rendered alignment block, possibly multi-line
 */
public record AlignmentDisplay(
    int hmmFrom, int hmmTo, int modelLength, long seqFrom, long seqTo, long seqLength, String text) {

  /** Compact constructor validating coordinates. */
  public AlignmentDisplay {
    if (modelLength < 0 || seqLength < 0) {
      throw new IllegalArgumentException("Model and sequence lengths must not be negative");
    }
    if (text == null) {
      text = "";
    }
  }
}
