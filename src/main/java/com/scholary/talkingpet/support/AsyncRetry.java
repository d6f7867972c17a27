package com.scholary.talkingpet.support;

import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.ProviderUnavailableException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry for asynchronous provider calls.
 *
 * <p>Only {@link ProviderUnavailableException} is retried. Explicit rejections, validation errors
 * and anything else fail on the first attempt. Backoff is exponential with jitter and is scheduled
 * on the shared scheduler, so no thread sleeps while waiting for the next attempt.
 */
public class AsyncRetry {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncRetry.class);

  private final ScheduledExecutorService scheduler;
  private final int maxAttempts;
  private final Duration initialBackoff;

  public AsyncRetry(ScheduledExecutorService scheduler, int maxAttempts, Duration initialBackoff) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.scheduler = scheduler;
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
  }

  /**
   * Run {@code action}, retrying transient provider failures.
   *
   * @param operation short name for logs
   * @param action starts one attempt; called again for every retry
   * @return a future completing with the first successful result, or failing with the unwrapped
   *     cause of the last attempt
   */
  public <T> CompletableFuture<T> call(String operation, Supplier<CompletableFuture<T>> action) {
    CompletableFuture<T> result = new CompletableFuture<>();
    attempt(operation, action, 1, result);
    return result;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private <T> void attempt(
      String operation,
      Supplier<CompletableFuture<T>> action,
      int attempt,
      CompletableFuture<T> result) {

    CompletableFuture<T> call;
    try {
      call = action.get();
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }

    call.whenComplete(
        (value, error) -> {
          if (error == null) {
            result.complete(value);
            return;
          }

          Throwable cause = Failures.unwrap(error);
          if (!(cause instanceof ProviderUnavailableException) || attempt >= maxAttempts) {
            result.completeExceptionally(cause);
            return;
          }

          long backoffMs = backoffMillis(attempt);
          LOGGER.warn(
              "{} attempt {}/{} failed, retrying in {}ms: {}",
              operation,
              attempt,
              maxAttempts,
              backoffMs,
              cause.getMessage());
          try {
            scheduler.schedule(
                () -> attempt(operation, action, attempt + 1, result),
                backoffMs,
                TimeUnit.MILLISECONDS);
          } catch (RejectedExecutionException e) {
            cause.addSuppressed(e);
            result.completeExceptionally(cause);
          }
        });
  }

  private long backoffMillis(int attempt) {
    long base = initialBackoff.toMillis() * (1L << Math.min(attempt - 1, 10));
    long jitter = base == 0 ? 0 : ThreadLocalRandom.current().nextLong(base / 2 + 1);
    return base + jitter;
  }
}
