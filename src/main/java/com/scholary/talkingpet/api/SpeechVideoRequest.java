package com.scholary.talkingpet.api;

import com.scholary.talkingpet.pipeline.CallerScope;
import com.scholary.talkingpet.pipeline.GenerationRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for a speaking clip.
 *
 * <p>The length limit on {@code speechText} is enforced by the speech client, which reports it as
 * {@code text_too_long}. {@code prompt} may be left out for models that animate from audio alone.
 */
public record SpeechVideoRequest(
    @NotBlank String imageUrl,
    String prompt,
    @Min(1) @Max(20) Integer seconds,
    @NotBlank String resolution,
    String modelId,
    @NotBlank String speechText,
    @NotBlank String voiceId,
    String userId) {

  public GenerationRequest toGenerationRequest() {
    return new GenerationRequest(
        imageUrl,
        prompt,
        seconds,
        resolution,
        modelId,
        speechText,
        voiceId,
        CallerScope.of(userId));
  }
}
