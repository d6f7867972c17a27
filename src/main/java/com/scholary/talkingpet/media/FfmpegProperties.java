package com.scholary.talkingpet.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>The video stream is always copied; only the audio is re-encoded, with the codec and bitrate
 * set here.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @NotBlank String audioCodec,
    @NotBlank String audioBitrate,
    @Positive int timeoutSeconds,
    @NotBlank String tempDir) {}
