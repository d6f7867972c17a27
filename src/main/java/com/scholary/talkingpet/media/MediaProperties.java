package com.scholary.talkingpet.media;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Limits for downloading generated media before muxing. */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
    @Positive long maxDownloadBytes, @Positive int connectTimeout, @Positive int readTimeout) {}
