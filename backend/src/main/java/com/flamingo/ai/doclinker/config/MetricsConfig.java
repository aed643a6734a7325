package com.flamingo.ai.doclinker.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring for the linker. Counters ({@code linker_references_total}, {@code
 * linker_figures_total}, {@code linker_malformed_input_total}, {@code linker_errors_total}) are
 * registered where they are incremented; this class only adds the aspect behind the {@code
 * linker.document} timer.
 */
@Configuration
public class MetricsConfig {

  /**
   * Enables {@code @Timed} on {@code DocumentStructureLinker.link}, which records the time spent
   * linking each document.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
