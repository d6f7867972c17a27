package com.scholary.talkingpet.tts;

/**
 * Synthesized speech held in memory for the duration of one request.
 *
 * @param bytes encoded audio
 * @param contentType MIME type, always {@code audio/*}
 * @param sizeBytes length of {@code bytes}
 */
public record SpeechArtifact(byte[] bytes, String contentType, long sizeBytes) {

  public static SpeechArtifact of(byte[] bytes, String contentType) {
    return new SpeechArtifact(bytes, contentType, bytes.length);
  }

  /** File extension matching the content type, without the dot. */
  public String extension() {
    switch (contentType) {
      case "audio/wav":
        return "wav";
      case "audio/ogg":
        return "ogg";
      case "audio/pcm":
        return "pcm";
      default:
        return "mp3";
    }
  }
}
