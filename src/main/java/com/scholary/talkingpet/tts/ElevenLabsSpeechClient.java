package com.scholary.talkingpet.tts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.ProviderNotConfiguredException;
import com.scholary.talkingpet.error.ProviderRejectedException;
import com.scholary.talkingpet.error.ProviderUnavailableException;
import com.scholary.talkingpet.error.TextTooLongException;
import com.scholary.talkingpet.error.ValidationRejectedException;
import com.scholary.talkingpet.support.AsyncRetry;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the ElevenLabs text-to-speech API.
 *
 * <p>Uses the JDK {@link HttpClient} in async mode, so a request waiting on the provider doesn't
 * pin a thread. The length check runs before anything goes over the wire and the size check runs
 * on the returned bytes; neither silently truncates.
 */
@Component
public class ElevenLabsSpeechClient implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ElevenLabsSpeechClient.class);

  static final String PROVIDER = "elevenlabs";

  private final HttpClient httpClient;
  private final TtsProperties properties;
  private final ObjectMapper objectMapper;
  private final AsyncRetry retry;

  public ElevenLabsSpeechClient(
      TtsProperties properties, ObjectMapper objectMapper, ScheduledExecutorService scheduler) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.retry =
        new AsyncRetry(
            scheduler, properties.maxRetries(), Duration.ofMillis(properties.retryBackoffMs()));
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized ElevenLabs client: baseUrl={}, model={}, maxChars={}",
        properties.baseUrl(),
        properties.modelId(),
        properties.maxChars());
  }

  @Override
  public CompletableFuture<SpeechArtifact> synthesize(
      String text, String voiceId, String outputFormat) {
    if (text == null || text.isBlank()) {
      return CompletableFuture.failedFuture(
          new ValidationRejectedException("Speech text must not be empty"));
    }
    if (text.length() > properties.maxChars()) {
      return CompletableFuture.failedFuture(
          new TextTooLongException(text.length(), properties.maxChars()));
    }
    if (voiceId == null || voiceId.isBlank()) {
      return CompletableFuture.failedFuture(
          new ValidationRejectedException("voice_id is required with speech text"));
    }
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      return CompletableFuture.failedFuture(
          new ProviderNotConfiguredException(PROVIDER, "ElevenLabs API key is not configured"));
    }

    String format = outputFormat == null || outputFormat.isBlank()
        ? properties.outputFormat()
        : outputFormat;

    LOGGER.info(
        "Synthesizing speech: chars={}, voiceId={}, format={}", text.length(), voiceId, format);

    return retry.call("tts", () -> attemptSynthesize(text, voiceId, format));
  }

  private CompletableFuture<SpeechArtifact> attemptSynthesize(
      String text, String voiceId, String format) {
    HttpRequest request;
    try {
      request = buildRequest(text, voiceId, format);
    } catch (JsonProcessingException e) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Failed to encode TTS request", e));
    }

    return httpClient
        .sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
        .handle(
            (response, error) -> {
              if (error != null) {
                Throwable cause = Failures.unwrap(error);
                throw new ProviderUnavailableException(
                    PROVIDER, "ElevenLabs request failed: " + cause.getMessage(), cause);
              }
              return toArtifact(response, format);
            });
  }

  HttpRequest buildRequest(String text, String voiceId, String format)
      throws JsonProcessingException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("text", text);
    body.put("model_id", properties.modelId());
    body.put("output_format", format);

    String url =
        properties.baseUrl()
            + "/v1/text-to-speech/"
            + URLEncoder.encode(voiceId, StandardCharsets.UTF_8)
            + "?output_format="
            + URLEncoder.encode(format, StandardCharsets.UTF_8);

    return HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("xi-api-key", properties.apiKey())
        .header("Content-Type", "application/json")
        .header("Accept", "audio/*")
        .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
        .build();
  }

  private SpeechArtifact toArtifact(HttpResponse<byte[]> response, String format) {
    int status = response.statusCode();
    byte[] body = response.body() == null ? new byte[0] : response.body();

    if (status >= 500) {
      throw new ProviderUnavailableException(
          PROVIDER,
          String.format(
              "ElevenLabs returned status %d: %s",
              status, new String(body, StandardCharsets.UTF_8)));
    }
    if (status >= 400) {
      // Invalid voice, quota, auth. Pass the provider's message through untouched.
      throw new ProviderRejectedException(
          PROVIDER, status, new String(body, StandardCharsets.UTF_8));
    }
    if (body.length == 0) {
      throw new ProviderUnavailableException(PROVIDER, "ElevenLabs returned an empty body");
    }
    if (body.length > properties.maxAudioBytes()) {
      throw new ValidationRejectedException(
          String.format(
              "Generated audio is too large (%d bytes, max %d). "
                  + "Shorten the script or reduce bitrate.",
              body.length, properties.maxAudioBytes()));
    }

    LOGGER.info("Speech synthesized: {} bytes", body.length);
    return SpeechArtifact.of(body, contentTypeFor(format));
  }

  /** Map an ElevenLabs output format such as {@code mp3_44100_64} to a MIME type. */
  static String contentTypeFor(String format) {
    if (format == null) {
      return "audio/mpeg";
    }
    if (format.startsWith("wav_")) {
      return "audio/wav";
    }
    if (format.startsWith("pcm_")) {
      return "audio/pcm";
    }
    if (format.startsWith("opus_")) {
      return "audio/ogg";
    }
    return "audio/mpeg";
  }
}
