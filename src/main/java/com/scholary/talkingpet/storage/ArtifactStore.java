package com.scholary.talkingpet.storage;

import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes generated media to the configured bucket.
 *
 * <p>Every upload goes to a brand new key, so retried or concurrent uploads never overwrite each
 * other and we never depend on the backend's upsert behaviour. {@link #delete} exists for rollback
 * only.
 */
@Component
public class ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactStore.class);

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;

  public ArtifactStore(ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.bucket = properties.bucket();
  }

  /**
   * Upload bytes under {@code <prefix>/<category>/<uuid>.<extension>}.
   *
   * @param bytes content
   * @param prefix caller scope, see {@link StorageKeys#resolveUserPrefix}
   * @param category logical folder, e.g. {@code audio} or {@code videos}
   * @param extension file extension without the dot
   * @param contentType MIME type
   * @return the stored artifact with its public URL
   */
  public CompletableFuture<StoredArtifact> upload(
      byte[] bytes, String prefix, String category, String extension, String contentType) {
    String key = StorageKeys.buildStorageKey(prefix, category, extension);
    LOGGER.info(
        "Uploading artifact: key={}, bytes={}, contentType={}", key, bytes.length, contentType);

    return objectStoreClient
        .putObject(bucket, key, bytes, contentType)
        .thenApply(
            ignored ->
                new StoredArtifact(objectStoreClient.publicUrl(bucket, key), key, contentType));
  }

  /**
   * Delete a previously uploaded artifact. The public URL stops resolving once this completes.
   *
   * @param storagePath {@link StoredArtifact#storagePath()}
   */
  public CompletableFuture<Void> delete(String storagePath) {
    LOGGER.info("Deleting artifact: key={}", storagePath);
    return objectStoreClient.deleteObject(bucket, storagePath);
  }
}
