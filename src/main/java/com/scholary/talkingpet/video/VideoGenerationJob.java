package com.scholary.talkingpet.video;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** Submits a video job and drives it to a terminal state. */
public interface VideoGenerationJob {

  /**
   * Submit a job. Submission failures complete the future exceptionally before any handle exists.
   */
  CompletableFuture<VideoJobHandle> submit(VideoJobRequest request);

  /**
   * Poll until the job is terminal or {@code timeout} elapses.
   *
   * @return the output video URL; fails with {@code JobFailedException}, {@code
   *     JobTimedOutException} or {@code ProviderRejectedException}
   */
  CompletableFuture<String> awaitCompletion(
      VideoJobHandle handle, Duration pollInterval, Duration timeout);
}
