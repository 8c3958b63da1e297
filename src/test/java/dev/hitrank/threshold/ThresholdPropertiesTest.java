package dev.hitrank.threshold;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class ThresholdPropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
          .withUserConfiguration(ThresholdProperties.class);

  @Test
  void defaults_report_by_evalue_with_domain_space_from_targets() {
    contextRunner.run(
        context -> {
          ReportingThresholds thresholds =
              context.getBean(ThresholdProperties.class).toThresholds(500.0);

          assertThat(thresholds.getSearchSpace()).isEqualTo(500.0);
          assertThat(thresholds.isDomainSearchSpaceFromTargets()).isTrue();
          assertThat(thresholds.isTargetReportable(0f, 0.01)).isTrue();
          assertThat(thresholds.isTargetReportable(0f, 0.03)).isFalse();
        });
  }

  @Test
  void score_thresholds_are_bound() {
    contextRunner
        .withPropertyValues(
            "hitrank.threshold.by-evalue=false",
            "hitrank.threshold.score=20.5",
            "hitrank.threshold.domain-search-space=50")
        .run(
            context -> {
              ThresholdProperties properties = context.getBean(ThresholdProperties.class);
              ReportingThresholds thresholds = properties.toThresholds(500.0);

              assertThat(properties.isByEvalue()).isFalse();
              assertThat(thresholds.isTargetReportable(20.5f, 1.0)).isTrue();
              assertThat(thresholds.isTargetReportable(20.4f, 0.0)).isFalse();
              assertThat(thresholds.getDomainSearchSpace()).isEqualTo(50.0);
            });
  }

  @Test
  void non_positive_evalue_fails_startup() {
    contextRunner
        .withPropertyValues("hitrank.threshold.evalue=0")
        .run(
            context ->
                assertThat(context)
                    .hasFailed()
                    .getFailure()
                    .rootCause()
                    .hasMessageContaining("hitrank.threshold.evalue"));
  }
}
