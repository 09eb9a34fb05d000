package com.flamingo.ai.entities.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for pipeline metrics. */
@Configuration
public class MetricsConfig {

  static final String STAGE_NAME = "extract-symbols";

  /** Tags every meter with the pipeline stage so several stages can share one registry. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> stageTag() {
    return registry -> registry.config().commonTags("stage", STAGE_NAME);
  }

  /**
   * Enables the @Timed annotation on the extraction entry points.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
