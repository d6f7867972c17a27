package com.scholary.talkingpet.capability;

import java.util.Optional;
import java.util.Set;

/**
 * What one video-generation model can do.
 *
 * @param modelId provider model identifier, e.g. {@code minimax/hailuo-02}
 * @param displayName human readable name for the catalog endpoint
 * @param requiresAudioInput the model animates the image from a speech track and can't run
 *     without one
 * @param supportsPromptOnly the model accepts a text prompt with no audio
 * @param embedsAudio the model's output already carries synchronized audio, so no muxing
 * @param supportedResolutions resolutions the model accepts, e.g. {@code 768p}
 * @param defaultSeconds clip length used when the request leaves it out
 * @param proModeThreshold resolution from which the higher-fidelity mode kicks in, null if none
 */
public record ModelCapability(
    String modelId,
    String displayName,
    boolean requiresAudioInput,
    boolean supportsPromptOnly,
    boolean embedsAudio,
    Set<String> supportedResolutions,
    int defaultSeconds,
    String proModeThreshold) {

  public ModelCapability {
    supportedResolutions = Set.copyOf(supportedResolutions);
  }

  public boolean supportsResolution(String resolution) {
    return resolution != null && supportedResolutions.contains(resolution);
  }

  public Optional<String> proModeThresholdValue() {
    return Optional.ofNullable(proModeThreshold);
  }
}
