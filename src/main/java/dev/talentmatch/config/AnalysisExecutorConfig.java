package dev.talentmatch.config;

import dev.talentmatch.analysis.AnalysisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Bounded pool running per-candidate analysis during a ranking. */
@Configuration
public class AnalysisExecutorConfig {

  public static final String ANALYSIS_EXECUTOR = "analysisExecutor";

  @Bean(name = ANALYSIS_EXECUTOR)
  public ThreadPoolTaskExecutor analysisExecutor(AnalysisProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.concurrency());
    executor.setMaxPoolSize(properties.concurrency());
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("analysis-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
