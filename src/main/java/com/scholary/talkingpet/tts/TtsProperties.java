package com.scholary.talkingpet.tts;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ElevenLabs text-to-speech client.
 *
 * <p>{@code maxChars} and {@code maxAudioBytes} keep the generated file under what the video
 * providers accept as an audio input.
 */
@ConfigurationProperties(prefix = "tts")
@Validated
public record TtsProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String modelId,
    @NotBlank String outputFormat,
    @Positive int maxChars,
    @Positive long maxAudioBytes,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long retryBackoffMs) {}
