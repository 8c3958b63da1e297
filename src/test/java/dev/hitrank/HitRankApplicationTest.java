package dev.hitrank;

import static org.assertj.core.api.Assertions.assertThat;

import dev.hitrank.benchmark.MergeBenchmark;
import dev.hitrank.hits.TopHits;
import dev.hitrank.hits.TopHitsFactory;
import dev.hitrank.report.HitReportWriter;
import dev.hitrank.threshold.ThresholdProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class HitRankApplicationTest {

  @Autowired private ApplicationContext context;
  @Autowired private TopHitsFactory topHitsFactory;
  @Autowired private ThresholdProperties thresholdProperties;
  @Autowired private HitReportWriter reportWriter;

  @Test
  void context_loads_with_application_yml() {
    try (TopHits hits = topHitsFactory.create()) {
      assertThat(hits.capacity()).isEqualTo(256);
    }
    assertThat(thresholdProperties.toThresholds(1000).getSearchSpace()).isEqualTo(1000);
    assertThat(reportWriter.getTextWidth()).isEqualTo(120);
  }

  @Test
  void benchmark_does_not_run_by_default() {
    assertThat(context.getBeanNamesForType(MergeBenchmark.class)).isEmpty();
  }
}
