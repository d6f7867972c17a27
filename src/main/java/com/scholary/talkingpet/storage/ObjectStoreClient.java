package com.scholary.talkingpet.storage;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples the pipeline from a specific storage backend (S3, MinIO, Supabase's S3 gateway)
 * and makes the orchestrator testable with a mock. Operations are asynchronous; failures arrive
 * through the returned future as {@link com.scholary.talkingpet.error.StorageUnavailableException}
 * or {@link com.scholary.talkingpet.error.StorageAuthRejectedException}.
 */
public interface ObjectStoreClient {

  /**
   * Store an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data object content
   * @param contentType the MIME type of the object
   */
  CompletableFuture<Void> putObject(String bucket, String key, byte[] data, String contentType);

  /**
   * Delete an object. Deleting a key that doesn't exist succeeds.
   *
   * @param bucket the bucket name
   * @param key the object key
   */
  CompletableFuture<Void> deleteObject(String bucket, String key);

  /**
   * Public, unauthenticated URL for an object. The bucket must allow anonymous reads; the video
   * provider fetches the speech track through this URL.
   */
  String publicUrl(String bucket, String key);
}
