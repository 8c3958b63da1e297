package dev.hitrank.benchmark;

/**
 * Outcome of one merge benchmark run.
 *
 * @param lists number of lists that were merged
 * @param totalHits hits in the merged list
 * @param elapsedMillis wall-clock time to fill, sort and merge all lists
 * @param topSortKey sort key of the best-ranked hit (0.0 for an empty list)
 */
public record BenchmarkResult(int lists, int totalHits, long elapsedMillis, double topSortKey) {}
