package com.scholary.talkingpet.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the pipeline.
 *
 * <p>Network I/O is fully asynchronous and needs no pool of its own. What's left is blocking work
 * (ffmpeg, JDBC), which gets a bounded pool, and timed work (job polls, retry backoff), which gets
 * a small scheduler shared by every request.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "generationExecutor")
  public Executor generationExecutor(GenerationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.blockingThreads());
    executor.setMaxPoolSize(properties.blockingThreads());
    executor.setQueueCapacity(properties.blockingQueueSize());
    executor.setThreadNamePrefix("generation-");
    executor.initialize();
    return executor;
  }

  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService generationScheduler(GenerationProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "generation-poll-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(properties.schedulerThreads(), threadFactory);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }
}
