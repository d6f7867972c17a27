package com.scholary.talkingpet.video;

import java.util.concurrent.CompletableFuture;

/**
 * Wire-level access to an asynchronous video-generation provider.
 *
 * <p>Kept separate from {@link VideoGenerationJob} so the polling state machine can be tested
 * against a fake without any HTTP.
 */
public interface VideoProviderClient {

  /** Provider name used in logs and error messages. */
  String name();

  /**
   * Create a job. Fails with {@code ProviderRejectedException} on a 4xx and {@code
   * ProviderUnavailableException} on transport errors or a 5xx.
   */
  CompletableFuture<VideoJobSnapshot> createJob(VideoJobRequest request);

  /** Fetch the current state of a job. Same failure mapping as {@link #createJob}. */
  CompletableFuture<VideoJobSnapshot> fetchJob(String providerJobId);
}
