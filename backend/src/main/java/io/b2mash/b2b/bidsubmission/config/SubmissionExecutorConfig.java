package io.b2mash.b2b.bidsubmission.config;

import io.b2mash.b2b.bidsubmission.submission.SubmissionProperties;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Thread pools for submission processing. Workers are capped at the configured concurrency; portal
 * calls get their own unbounded pool so a worker can stop waiting on a slow portal without
 * cancelling the call.
 */
@Configuration
public class SubmissionExecutorConfig {

  @Bean(name = "submissionWorkerExecutor", destroyMethod = "shutdown")
  public ExecutorService submissionWorkerExecutor(SubmissionProperties properties) {
    return Executors.newFixedThreadPool(
        properties.maxConcurrentSubmissions(), new CustomizableThreadFactory("submission-worker-"));
  }

  @Bean(name = "portalTransportExecutor", destroyMethod = "shutdown")
  public ExecutorService portalTransportExecutor() {
    return Executors.newCachedThreadPool(new CustomizableThreadFactory("portal-transport-"));
  }

  @Bean(name = "notificationExecutor", destroyMethod = "shutdown")
  public ExecutorService notificationExecutor() {
    return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("submission-notify-"));
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
