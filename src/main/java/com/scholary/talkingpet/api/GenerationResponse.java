package com.scholary.talkingpet.api;

import com.scholary.talkingpet.pipeline.GenerationResult;

/**
 * Result of a finished workflow.
 *
 * <p>{@code finalUrl} is what clients should play. It equals {@code videoUrl} when nothing was
 * muxed.
 */
public record GenerationResponse(
    String audioUrl, String videoUrl, String finalUrl, boolean muxed) {

  public static GenerationResponse from(GenerationResult result) {
    return new GenerationResponse(
        result.audioUrl(), result.videoUrl(), result.finalUrl(), result.muxed());
  }
}
