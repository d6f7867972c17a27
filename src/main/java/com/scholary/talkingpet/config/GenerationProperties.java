package com.scholary.talkingpet.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the generation pipeline.
 *
 * <p>Polling cadence and deadline for video jobs, mux timing, and the sizes of the two thread
 * pools: a bounded executor for blocking work (ffmpeg, JDBC) and a small scheduler that runs polls
 * and retry backoffs.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    @NotNull Duration pollInterval,
    @NotNull Duration jobTimeout,
    @NotNull Duration audioLeadDelay,
    @NotNull Duration audioTailPad,
    @Positive int blockingThreads,
    @Positive int blockingQueueSize,
    @Positive int schedulerThreads) {}
