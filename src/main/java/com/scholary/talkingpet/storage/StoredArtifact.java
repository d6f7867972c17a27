package com.scholary.talkingpet.storage;

/**
 * An object this service uploaded.
 *
 * @param publicUrl where anyone can fetch it
 * @param storagePath key inside the configured bucket; what {@link ArtifactStore#delete} takes
 * @param contentType MIME type it was stored with
 */
public record StoredArtifact(String publicUrl, String storagePath, String contentType) {}
