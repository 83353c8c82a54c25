package org.kartograph.mutations.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Enables {@code @Timed} on service and controller methods.
 */
@Configuration
@EnableAspectJAutoProxy
public class MetricsConfiguration {

  /**
   * Enables {@code @Timed} annotation support.
   *
   * @param registry the meter registry
   * @return the timed aspect
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
