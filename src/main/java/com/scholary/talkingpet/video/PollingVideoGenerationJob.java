package com.scholary.talkingpet.video;

import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.JobFailedException;
import com.scholary.talkingpet.error.JobTimedOutException;
import com.scholary.talkingpet.error.ProviderUnavailableException;
import com.scholary.talkingpet.support.AsyncRetry;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives a provider job to completion by polling on a fixed interval.
 *
 * <p>Each poll is a task on the shared scheduler, so an outstanding job costs a scheduled task
 * rather than a parked thread. The loop ends on the first terminal status or when the deadline
 * passes; after the deadline the provider is not contacted again.
 *
 * <p>A transient poll failure ({@link ProviderUnavailableException}) doesn't end the job, the next
 * tick simply asks again. Any other poll failure is terminal.
 */
@Component
public class PollingVideoGenerationJob implements VideoGenerationJob {

  private static final Logger LOGGER = LoggerFactory.getLogger(PollingVideoGenerationJob.class);

  private final VideoProviderClient providerClient;
  private final ScheduledExecutorService scheduler;
  private final AsyncRetry submitRetry;

  public PollingVideoGenerationJob(
      VideoProviderClient providerClient,
      ScheduledExecutorService scheduler,
      VideoProviderProperties properties) {
    this.providerClient = providerClient;
    this.scheduler = scheduler;
    this.submitRetry =
        new AsyncRetry(
            scheduler, properties.maxRetries(), Duration.ofMillis(properties.retryBackoffMs()));
  }

  @Override
  public CompletableFuture<VideoJobHandle> submit(VideoJobRequest request) {
    LOGGER.info(
        "Submitting video job: model={}, resolution={}, seconds={}, withAudio={}",
        request.modelId(),
        request.resolution(),
        request.seconds(),
        request.audioUrl() != null);

    return submitRetry
        .call("video submit", () -> providerClient.createJob(request))
        .thenApply(
            snapshot -> {
              VideoJobHandle handle =
                  new VideoJobHandle(
                      snapshot.providerJobId(), request.modelId(), VideoJobStatus.QUEUED);
              handle.apply(snapshot);
              LOGGER.info(
                  "Video job submitted: jobId={}, status={}",
                  handle.getProviderJobId(),
                  handle.getStatus());
              return handle;
            });
  }

  @Override
  public CompletableFuture<String> awaitCompletion(
      VideoJobHandle handle, Duration pollInterval, Duration timeout) {
    CompletableFuture<String> result = new CompletableFuture<>();
    long deadline = System.nanoTime() + timeout.toNanos();

    if (handle.getStatus().isTerminal()) {
      settle(handle, result);
    } else {
      poll(handle, pollInterval, timeout, deadline, result);
    }
    return result;
  }

  private void poll(
      VideoJobHandle handle,
      Duration pollInterval,
      Duration timeout,
      long deadline,
      CompletableFuture<String> result) {

    if (result.isDone()) {
      return;
    }
    if (System.nanoTime() >= deadline) {
      LOGGER.warn(
          "Video job timed out: jobId={}, status={}, polls={}",
          handle.getProviderJobId(),
          handle.getStatus(),
          handle.getPollCount());
      result.completeExceptionally(new JobTimedOutException(handle.getProviderJobId(), timeout));
      return;
    }

    CompletableFuture<VideoJobSnapshot> fetch;
    try {
      fetch = providerClient.fetchJob(handle.getProviderJobId());
    } catch (RuntimeException e) {
      fetch = CompletableFuture.failedFuture(e);
    }

    fetch.whenComplete(
        (snapshot, error) -> {
          if (error != null) {
            Throwable cause = Failures.unwrap(error);
            if (cause instanceof ProviderUnavailableException) {
              LOGGER.warn(
                  "Transient poll failure for job {}: {}",
                  handle.getProviderJobId(),
                  cause.getMessage());
              scheduleNext(handle, pollInterval, timeout, deadline, result);
            } else {
              result.completeExceptionally(cause);
            }
            return;
          }

          if (handle.apply(snapshot)) {
            LOGGER.info(
                "Video job {} is now {}", handle.getProviderJobId(), handle.getStatus());
          }

          if (handle.getStatus().isTerminal()) {
            settle(handle, result);
          } else {
            scheduleNext(handle, pollInterval, timeout, deadline, result);
          }
        });
  }

  private void scheduleNext(
      VideoJobHandle handle,
      Duration pollInterval,
      Duration timeout,
      long deadline,
      CompletableFuture<String> result) {

    long remaining = deadline - System.nanoTime();
    long delay = Math.max(0, Math.min(pollInterval.toNanos(), remaining));
    try {
      scheduler.schedule(
          () -> poll(handle, pollInterval, timeout, deadline, result), delay, TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      result.completeExceptionally(
          new ProviderUnavailableException(
              providerClient.name(), "Polling scheduler is shut down", e));
    }
  }

  private void settle(VideoJobHandle handle, CompletableFuture<String> result) {
    switch (handle.getStatus()) {
      case SUCCEEDED:
        if (handle.getOutputUrl() == null || handle.getOutputUrl().isBlank()) {
          result.completeExceptionally(
              new JobFailedException(
                  providerClient.name(),
                  handle.getProviderJobId(),
                  "job succeeded but returned no output"));
        } else {
          LOGGER.info(
              "Video job succeeded: jobId={}, polls={}",
              handle.getProviderJobId(),
              handle.getPollCount());
          result.complete(handle.getOutputUrl());
        }
        break;
      case FAILED:
      case CANCELED:
        LOGGER.warn(
            "Video job ended {}: jobId={}, detail={}",
            handle.getStatus(),
            handle.getProviderJobId(),
            handle.getErrorDetail());
        result.completeExceptionally(
            new JobFailedException(
                providerClient.name(), handle.getProviderJobId(), handle.getErrorDetail()));
        break;
      default:
        throw new IllegalStateException("Not a terminal status: " + handle.getStatus());
    }
  }
}
