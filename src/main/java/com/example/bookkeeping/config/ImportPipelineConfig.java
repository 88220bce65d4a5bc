package com.example.bookkeeping.config;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.example.bookkeeping.exception.DocumentExtractionException;
import com.example.bookkeeping.service.DocumentExtractor;
import com.example.bookkeeping.service.MatcherSettings;
import com.example.bookkeeping.service.ProcessorConfig;

/** Wires the import and reconciliation pipeline from {@code bookkeeping.*} properties. */
@Configuration
@EnableAsync
public class ImportPipelineConfig {

  private static final Logger log = LoggerFactory.getLogger(ImportPipelineConfig.class);

  @Bean
  public ProcessorConfig processorConfig(
      @Value("${bookkeeping.import.batch-size:10}") int batchSize,
      @Value("${bookkeeping.import.transaction-timeout:30s}") Duration transactionTimeout,
      @Value("${bookkeeping.import.max-retries:3}") int maxRetries,
      @Value("${bookkeeping.import.base-backoff:2s}") Duration baseBackoff) {
    log.info(
        "Import chunks of {} with {} timeout, {} attempts, {} base backoff",
        batchSize,
        transactionTimeout,
        maxRetries,
        baseBackoff);
    return new ProcessorConfig(batchSize, transactionTimeout, maxRetries, baseBackoff);
  }

  @Bean
  public MatcherSettings matcherSettings(
      @Value("${bookkeeping.matching.date-window-days:7}") int dateWindowDays,
      @Value("${bookkeeping.matching.amount-tolerance:0.05}") double amountTolerance,
      @Value("${bookkeeping.matching.base-score:0.5}") double baseScore,
      @Value("${bookkeeping.matching.date-weight:0.3}") double dateWeight,
      @Value("${bookkeeping.matching.amount-weight:0.3}") double amountWeight,
      @Value("${bookkeeping.matching.vendor-weight:0.2}") double vendorWeight,
      @Value("${bookkeeping.matching.max-suggestions:3}") int maxSuggestions,
      @Value("${bookkeeping.matching.confirm-threshold:0.9}") double confirmThreshold,
      @Value("${bookkeeping.matching.auto-reconcile-threshold:0.8}")
          double autoReconcileThreshold) {
    return new MatcherSettings(
        dateWindowDays,
        amountTolerance,
        baseScore,
        dateWeight,
        amountWeight,
        vendorWeight,
        maxSuggestions,
        confirmThreshold,
        autoReconcileThreshold);
  }

  /** Sleeps between chunk retries. */
  @Bean
  public Sleeper retrySleeper() {
    return new ThreadWaitSleeper();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean(name = "usageTrackingExecutor")
  public Executor usageTrackingExecutor(
      @Value("${bookkeeping.async.usage-pool-size:2}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("usage-");
    executor.initialize();
    return executor;
  }

  /** Used until the application provides a real extraction service. */
  @Bean
  @ConditionalOnMissingBean
  public DocumentExtractor documentExtractor() {
    return (documentUrl, mimeType) -> {
      throw new DocumentExtractionException("No document extraction service is configured");
    };
  }
}
