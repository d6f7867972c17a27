package com.scholary.talkingpet.api;

import com.scholary.talkingpet.pipeline.CallerScope;
import com.scholary.talkingpet.pipeline.GenerationRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for a silent clip.
 *
 * <p>{@code modelId} and {@code seconds} fall back to the catalog defaults. {@code userId} is the
 * already authenticated caller, absent for anonymous use.
 */
public record VideoOnlyRequest(
    @NotBlank String imageUrl,
    @NotBlank String prompt,
    @Min(1) @Max(20) Integer seconds,
    @NotBlank String resolution,
    String modelId,
    String userId) {

  public GenerationRequest toGenerationRequest() {
    return GenerationRequest.videoOnly(imageUrl, prompt, seconds, resolution, modelId)
        .withScope(CallerScope.of(userId));
  }
}
