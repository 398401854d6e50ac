package io.b2mash.mailflow.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools used by the dispatch pipeline. The dispatch pool runs queued jobs; the transport
 * pool runs individual transport calls so they can be abandoned on timeout.
 */
@Configuration
public class EmailExecutorConfig {

  public static final String DISPATCH_EXECUTOR = "emailDispatchExecutor";
  public static final String TRANSPORT_EXECUTOR = "emailTransportExecutor";

  @Bean(name = DISPATCH_EXECUTOR)
  public ThreadPoolTaskExecutor emailDispatchExecutor(EmailDispatchProperties properties) {
    var worker = properties.worker();
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("email-dispatch-");
    executor.setCorePoolSize(worker.coreSize());
    executor.setMaxPoolSize(worker.maxSize());
    executor.setQueueCapacity(worker.queueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean(name = TRANSPORT_EXECUTOR)
  public ThreadPoolTaskExecutor emailTransportExecutor(EmailDispatchProperties properties) {
    var worker = properties.worker();
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("email-transport-");
    // Immediate dispatches from request threads also land here
    executor.setCorePoolSize(worker.maxSize());
    executor.setMaxPoolSize(worker.maxSize() * 2);
    executor.setQueueCapacity(worker.queueCapacity());
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
