package com.scholary.talkingpet.video;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the Replicate prediction API. */
@ConfigurationProperties(prefix = "video-provider")
@Validated
public record VideoProviderProperties(
    @NotBlank String baseUrl,
    String apiToken,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long retryBackoffMs) {}
