package com.scholary.talkingpet.tts;

import java.util.concurrent.CompletableFuture;

/**
 * Text-to-speech provider abstraction.
 *
 * <p>Implementations check the text length before calling out and the audio size after. Failures
 * arrive through the returned future as {@link com.scholary.talkingpet.error.TextTooLongException},
 * {@link com.scholary.talkingpet.error.ProviderRejectedException} or {@link
 * com.scholary.talkingpet.error.ProviderUnavailableException}.
 */
public interface SpeechSynthesizer {

  /**
   * Synthesize speech.
   *
   * @param text the script to speak
   * @param voiceId provider voice identifier
   * @param outputFormat provider output format, e.g. {@code mp3_44100_64}
   * @return the synthesized audio
   */
  CompletableFuture<SpeechArtifact> synthesize(String text, String voiceId, String outputFormat);
}
