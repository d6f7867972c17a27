package com.scholary.talkingpet.pipeline;

/**
 * One accepted generation request. Immutable.
 *
 * @param imageUrl public URL of the still image to animate
 * @param prompt motion/scene description
 * @param seconds clip length, null for the model default
 * @param resolution output resolution such as {@code 768p}
 * @param modelId model to use, null for the registry default
 * @param speechText text to speak; present together with {@code voiceId} or not at all
 * @param voiceId TTS voice; present together with {@code speechText} or not at all
 * @param scope caller scope, null means anonymous
 */
public record GenerationRequest(
    String imageUrl,
    String prompt,
    Integer seconds,
    String resolution,
    String modelId,
    String speechText,
    String voiceId,
    CallerScope scope) {

  public GenerationRequest {
    if (scope == null) {
      scope = CallerScope.anonymous();
    }
  }

  public static GenerationRequest videoOnly(
      String imageUrl, String prompt, Integer seconds, String resolution, String modelId) {
    return new GenerationRequest(
        imageUrl, prompt, seconds, resolution, modelId, null, null, CallerScope.anonymous());
  }

  public GenerationRequest withScope(CallerScope newScope) {
    return new GenerationRequest(
        imageUrl, prompt, seconds, resolution, modelId, speechText, voiceId, newScope);
  }

  public boolean hasSpeechText() {
    return speechText != null && !speechText.isBlank();
  }

  public boolean hasVoiceId() {
    return voiceId != null && !voiceId.isBlank();
  }
}
