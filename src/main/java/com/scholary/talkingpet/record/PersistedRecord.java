package com.scholary.talkingpet.record;

import java.time.Instant;

/**
 * One row of {@code pet_videos}: the durable proof that a generation completed.
 *
 * @param userId caller's user id, null for anonymous requests
 * @param modelId model that produced the video
 * @param audioUrl public URL of the uploaded speech, null for video-only
 * @param videoUrl provider-hosted video
 * @param finalUrl what the caller should play; equals {@code videoUrl} when nothing was muxed
 * @param storageKey key of the muxed artifact in our bucket, null when nothing was muxed
 * @param imageUrl source image
 * @param script speech text, null for video-only
 * @param prompt motion prompt
 * @param voiceId TTS voice, null for video-only
 * @param resolution output resolution
 * @param duration clip length in seconds
 * @param createdAt completion time
 */
public record PersistedRecord(
    String userId,
    String modelId,
    String audioUrl,
    String videoUrl,
    String finalUrl,
    String storageKey,
    String imageUrl,
    String script,
    String prompt,
    String voiceId,
    String resolution,
    int duration,
    Instant createdAt) {}
