package com.scholary.talkingpet.video;

/**
 * What to submit to the video provider.
 *
 * @param modelId provider model identifier
 * @param imageUrl publicly reachable source image
 * @param prompt motion/scene description
 * @param seconds clip length
 * @param resolution output resolution, e.g. {@code 768p}
 * @param audioUrl public speech track for models that animate from audio, otherwise null
 */
public record VideoJobRequest(
    String modelId,
    String imageUrl,
    String prompt,
    int seconds,
    String resolution,
    String audioUrl) {}
