package dev.hitrank.report;

/** What the targets of a search are: sequences searched with one model, or models scanned. */
public enum SearchMode {
  SEQUENCES("sequence", "Sequence"),
  MODELS("model", "Model");

  private final String noun;
  private final String columnHeader;

  SearchMode(String noun, String columnHeader) {
    this.noun = noun;
    this.columnHeader = columnHeader;
  }

  /** Lower-case singular noun used in report headings. */
  public String noun() {
    return noun;
  }

  /** Header of the name column in the targets table. */
  public String columnHeader() {
    return columnHeader;
  }
}
