package com.scholary.talkingpet.pipeline;

/**
 * What a successful workflow hands back.
 *
 * @param audioUrl public URL of the speech track, null for video-only
 * @param videoUrl the provider's raw output
 * @param finalUrl what to play: the muxed artifact, or {@code videoUrl} when nothing was muxed
 */
public record GenerationResult(String audioUrl, String videoUrl, String finalUrl) {

  public boolean muxed() {
    return !finalUrl.equals(videoUrl);
  }
}
