package dev.hitrank.benchmark;

import dev.hitrank.hits.TopHits;
import dev.hitrank.hits.TopHitsFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

/**
 * Simulates a parallel search: fills several worker lists with random hits, sorts each, then folds
 * them into one ranked list and logs the time taken.
 *
 * <p>Sort keys are drawn up front from a seeded {@link Random} so only list work is timed. Every
 * hit shares the same name, accession and description.
 */
@Component
@ConditionalOnProperty(prefix = "hitrank.benchmark", name = "enabled", havingValue = "true")
public class MergeBenchmark implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(MergeBenchmark.class);

  static final String NAME = "not_unique_name";
  static final String ACCESSION = "not_unique_acc";
  static final String DESCRIPTION =
      "Test description for the purposes of making the benchmark allocate space";

  private final TopHitsFactory topHitsFactory;
  private final BenchmarkProperties properties;

  public MergeBenchmark(TopHitsFactory topHitsFactory, BenchmarkProperties properties) {
    this.topHitsFactory = topHitsFactory;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    run();
  }

  /**
   * Runs the benchmark once with the configured sizes.
   *
   * @return totals and timing of the run
   */
  public BenchmarkResult run() {
    int listCount = properties.getLists();
    int hitsPerList = properties.getHits();
    Random random = new Random(properties.getSeed());
    double[] sortKeys = new double[Math.multiplyExact(listCount, hitsPerList)];
    for (int i = 0; i < sortKeys.length; i++) {
      sortKeys[i] = random.nextDouble();
    }

    StopWatch stopWatch = new StopWatch("merge-benchmark");
    stopWatch.start("fill and sort");
    List<TopHits> lists = new ArrayList<>(listCount);
    for (int j = 0; j < listCount; j++) {
      TopHits hits = topHitsFactory.create();
      for (int i = 0; i < hitsPerList; i++) {
        double key = sortKeys[j * hitsPerList + i];
        hits.add(NAME, ACCESSION, DESCRIPTION, key, (float) key, key);
      }
      hits.sort();
      lists.add(hits);
    }
    stopWatch.stop();

    stopWatch.start("merge");
    try (TopHits merged = TopHits.mergeAll(lists)) {
      stopWatch.stop();
      double top = merged.isEmpty() ? 0.0 : merged.get(0).getSortKey();
      BenchmarkResult result =
          new BenchmarkResult(listCount, merged.size(), stopWatch.getTotalTimeMillis(), top);
      log.info(
          "Merged {} lists of {} hits into {} hits in {} ms",
          listCount,
          hitsPerList,
          result.totalHits(),
          result.elapsedMillis());
      log.debug("{}", stopWatch.prettyPrint());
      return result;
    }
  }
}
