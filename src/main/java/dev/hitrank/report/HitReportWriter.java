package dev.hitrank.report;

import dev.hitrank.hits.AlignmentDisplay;
import dev.hitrank.hits.Domain;
import dev.hitrank.hits.Hit;
import dev.hitrank.hits.TopHits;
import dev.hitrank.threshold.ReportingThresholds;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders a sorted, thresholded hit list as the plain-text target table and the per-target domain
 * annotation tables.
 *
 * <p>Only hits and domains flagged reportable are printed, in rank order. The writer only reads
 * the list: it never sorts or flags, so the list must already be sorted and thresholded.
 *
 * <p>Description columns are clipped to fit {@code hitrank.report.text-width} characters per line
 * (0 means unlimited). Domain bias is {@code logsum(0, ln(omega) + domCorrection)} with the null2
 * prior {@code hitrank.report.omega}.
 */
@Component
public class HitReportWriter {

  static final String NO_HITS = "\n   [No hits detected that satisfy reporting thresholds]\n";

  /** Minimum width of the name column. */
  private static final int MIN_NAME_WIDTH = 8;

  /** Minimum width of a clipped description. */
  private static final int MIN_DESC_WIDTH = 32;

  /** Characters of a target row other than name and description. */
  private static final int TARGET_ROW_FIXED_WIDTH = 59;

  private final int textWidth;
  private final double omega;

  public HitReportWriter(
      @Value("${hitrank.report.text-width:120}") int textWidth,
      @Value("${hitrank.report.omega:0.00390625}") double omega) {
    if (textWidth < 0) {
      throw new IllegalArgumentException("textWidth must not be negative, got: " + textWidth);
    }
    if (omega <= 0.0 || omega >= 1.0) {
      throw new IllegalArgumentException("omega must be in (0, 1), got: " + omega);
    }
    this.textWidth = textWidth;
    this.omega = omega;
  }

  /**
   * Writes the table of reportable targets with full-sequence and best-domain scores.
   *
   * @param out destination
   * @param hits a sorted, thresholded list
   * @param thresholds the thresholds the list was flagged with, for the search space sizes
   * @param mode whether targets are sequences or models
   * @throws IOException if writing fails
   * @throws IllegalStateException if the list is not sorted
   */
  public void writeTargets(
      Appendable out, TopHits hits, ReportingThresholds thresholds, SearchMode mode)
      throws IOException {
    List<Hit> ranked = hits.ranked();
    int nameWidth = Math.max(MIN_NAME_WIDTH, hits.maxNameLength());
    int descWidth =
        textWidth > 0
            ? Math.max(MIN_DESC_WIDTH, textWidth - nameWidth - TARGET_ROW_FIXED_WIDTH)
            : Integer.MAX_VALUE;
    double z = thresholds.getSearchSpace();

    out.append(
        "Scores for complete %s (score includes all domains):\n"
            .formatted(mode == SearchMode.SEQUENCES ? "sequences" : "sequence"));
    out.append(
        format(
            "%22s  %22s  %8s\n",
            " --- full sequence ---", " --- best 1 domain ---", "-#dom-"));
    String headerFormat = "%9s %6s %5s  %9s %6s %5s  %5s %2s  %-" + nameWidth + "s %s\n";
    out.append(
        format(
            headerFormat,
            "E-value", " score", " bias", "E-value", " score", " bias", "  exp", "N",
            mode.columnHeader(), "Description"));
    out.append(
        format(
            headerFormat,
            "-------", "------", "-----", "-------", "------", "-----", " ----", "--",
            "--------", "-----------"));

    String rowFormat =
        "%9s %6.1f %5.1f  %9s %6s %5s  %5.1f %2d  %-" + nameWidth + "s %s\n";
    for (Hit hit : ranked) {
      if (!hit.isReported()) {
        continue;
      }
      Domain best = hit.bestDomain();
      String bestEvalue = best == null ? "-" : formatG(best.getPvalue() * z, 2);
      String bestScore = best == null ? "-" : format("%6.1f", best.getBitScore());
      String bestBias = best == null ? "-" : format("%5.1f", domainBias(best));
      out.append(
          format(
              rowFormat,
              formatG(hit.getPvalue() * z, 2),
              hit.getScore(),
              hit.getPreScore() - hit.getScore(),
              bestEvalue,
              bestScore,
              bestBias,
              hit.getNexpected(),
              hit.getReportedDomains(),
              nullToEmpty(hit.getName()),
              clip(hit.getDescription(), descWidth)));
    }
    if (hits.reportedCount() == 0) {
      out.append(NO_HITS);
    }
  }

  /**
   * Writes, for each reportable target, its table of reportable domains followed by their
   * alignments.
   *
   * @param out destination
   * @param hits a sorted, thresholded list
   * @param thresholds the thresholds the list was flagged with, for the search space sizes
   * @param mode whether targets are sequences or models
   * @throws IOException if writing fails
   * @throws IllegalStateException if the list is not sorted
   */
  public void writeDomains(
      Appendable out, TopHits hits, ReportingThresholds thresholds, SearchMode mode)
      throws IOException {
    List<Hit> ranked = hits.ranked();
    double z = thresholds.getSearchSpace();
    double domZ = thresholds.getDomainSearchSpace();

    out.append("Domain and alignment annotation for each %s:\n".formatted(mode.noun()));

    for (Hit hit : ranked) {
      if (!hit.isReported()) {
        continue;
      }
      String name = nullToEmpty(hit.getName());
      int descWidth =
          textWidth > 0 ? Math.max(MIN_DESC_WIDTH, textWidth - name.length() - 5) : Integer.MAX_VALUE;
      out.append(format(">> %s  %s\n", name, clip(hit.getDescription(), descWidth)));

      String columns = "  %4s %9s %7s %10s %10s %8s %8s %2s %8s %8s %2s %8s %8s %2s %7s\n";
      out.append(
          format(
              columns, "#", "bit score", "bias", "E-value", "ind Evalue", "hmm from", "hmm to",
              "  ", "ali from", "ali to", "  ", "env from", "env to", "  ", "ali-acc"));
      out.append(
          format(
              columns, "---", "---------", "-------", "----------", "----------", "--------",
              "--------", "  ", "--------", "--------", "  ", "--------", "--------", "  ",
              "-------"));

      int nd = 0;
      for (Domain domain : hit.getDomains()) {
        if (domain.isReported()) {
          nd++;
          out.append(domainRow(nd, domain, z, domZ));
        }
      }

      out.append("\n  Alignments for each domain:\n");
      nd = 0;
      for (Domain domain : hit.getDomains()) {
        if (domain.isReported()) {
          nd++;
          out.append(
              format(
                  "  == domain %d    score: %.1f bits;  conditional E-value: %s\n",
                  nd, domain.getBitScore(), formatG(domain.getPvalue() * domZ, 2)));
          AlignmentDisplay alignment = domain.getAlignment();
          if (alignment != null && !alignment.text().isEmpty()) {
            out.append(alignment.text());
            if (!alignment.text().endsWith("\n")) {
              out.append('\n');
            }
          }
          out.append('\n');
        }
      }
    }
    if (hits.reportedCount() == 0) {
      out.append(NO_HITS);
    }
  }

  private String domainRow(int index, Domain domain, double z, double domZ) {
    AlignmentDisplay ad = domain.getAlignment();
    int hmmFrom = ad == null ? 0 : ad.hmmFrom();
    int hmmTo = ad == null ? 0 : ad.hmmTo();
    long seqFrom = ad == null ? 0 : ad.seqFrom();
    long seqTo = ad == null ? 0 : ad.seqTo();
    long seqLength = ad == null ? -1 : ad.seqLength();
    int modelLength = ad == null ? -1 : ad.modelLength();
    double accuracy = domain.getOasc() / (1.0 + Math.abs(domain.getEnvTo() - domain.getEnvFrom()));

    return format(
        "  %4d %9.1f %7.1f %10s %10s %8d %8d %c%c %8d %8d %c%c %8d %8d %c%c %7.2f\n",
        index,
        domain.getBitScore(),
        domainBias(domain),
        formatG(domain.getPvalue() * domZ, 2),
        formatG(domain.getPvalue() * z, 2),
        hmmFrom,
        hmmTo,
        hmmFrom == 1 ? '[' : '.',
        hmmTo == modelLength ? ']' : '.',
        seqFrom,
        seqTo,
        seqFrom == 1 ? '[' : '.',
        seqTo == seqLength ? ']' : '.',
        domain.getEnvFrom(),
        domain.getEnvTo(),
        domain.getEnvFrom() == 1 ? '[' : '.',
        domain.getEnvTo() == seqLength ? ']' : '.',
        accuracy);
  }

  /** Null2 bias of a domain: {@code log(1 + omega * exp(domCorrection))}, in nats. */
  double domainBias(Domain domain) {
    return logsum(0.0, Math.log(omega) + domain.getDomCorrection());
  }

  static double logsum(double a, double b) {
    double max = Math.max(a, b);
    double min = Math.min(a, b);
    return max + Math.log1p(Math.exp(min - max));
  }

  /**
   * Formats like C's {@code %.<precision>g}: fixed or exponent notation by magnitude, trailing
   * zeros and a trailing decimal point dropped, exponent with a sign and at least two digits.
   * {@code java.util.Formatter}'s {@code %g} keeps the trailing zeros.
   */
  static String formatG(double value, int precision) {
    if (Double.isNaN(value)) {
      return "nan";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "inf" : "-inf";
    }
    if (value == 0.0) {
      return "0";
    }
    int p = Math.max(precision, 1);
    BigDecimal rounded = new BigDecimal(value).round(new MathContext(p, RoundingMode.HALF_EVEN));
    int exponent = rounded.precision() - rounded.scale() - 1;
    if (exponent < -4 || exponent >= p) {
      String mantissa =
          rounded
              .scaleByPowerOfTen(-exponent)
              .setScale(p - 1, RoundingMode.UNNECESSARY)
              .toPlainString();
      return stripTrailingZeros(mantissa)
          + format("e%c%02d", exponent < 0 ? '-' : '+', Math.abs(exponent));
    }
    return stripTrailingZeros(
        rounded.setScale(p - 1 - exponent, RoundingMode.UNNECESSARY).toPlainString());
  }

  private static String stripTrailingZeros(String number) {
    if (number.indexOf('.') < 0) {
      return number;
    }
    int end = number.length();
    while (number.charAt(end - 1) == '0') {
      end--;
    }
    if (number.charAt(end - 1) == '.') {
      end--;
    }
    return number.substring(0, end);
  }

  public int getTextWidth() {
    return textWidth;
  }

  private static String clip(@Nullable String text, int width) {
    if (text == null) {
      return "";
    }
    return text.length() > width ? text.substring(0, width) : text;
  }

  private static String nullToEmpty(@Nullable String text) {
    return text == null ? "" : text;
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
