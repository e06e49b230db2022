package com.flamingo.ai.regulation.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Infrastructure for regulation conversion: the batch worker pool and conversion timing. */
@Configuration
public class ConversionConfig {

  /**
   * Worker pool for directory conversion. When every worker is busy and the queue is full, the
   * submitting thread converts the file itself, so a large folder slows down instead of failing.
   */
  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-proc-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  /** Records {@code regulation.convert} and {@code regulation.convert.batch} timers. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
