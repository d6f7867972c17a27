package com.scholary.talkingpet.storage;

import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.GenerationException;
import com.scholary.talkingpet.error.StorageAuthRejectedException;
import com.scholary.talkingpet.error.StorageUnavailableException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>Uses the AWS SDK v2 async client, which works with real S3 and with S3-compatible services
 * like MinIO or Supabase Storage's S3 endpoint. The SDK retries throttling and 5xx on its own; what
 * reaches us here is final.
 *
 * <p>Error mapping: 401/403 means our credentials are wrong and becomes {@link
 * StorageAuthRejectedException}; everything else becomes {@link StorageUnavailableException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3AsyncClient s3Client;
  private final ObjectStoreProperties properties;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties), properties);
  }

  S3ObjectStoreClient(S3AsyncClient s3Client, ObjectStoreProperties properties) {
    this.s3Client = s3Client;
    this.properties = properties;
  }

  private static S3AsyncClient buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3AsyncClient.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess())
        .build();
  }

  @Override
  public CompletableFuture<Void> putObject(
      String bucket, String key, byte[] data, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        data.length,
        contentType);

    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(contentType)
            .contentLength((long) data.length)
            .build();

    CompletableFuture<Void> upload;
    try {
      upload =
          s3Client
              .putObject(request, AsyncRequestBody.fromBytes(data))
              .thenAccept(
                  response ->
                      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key));
    } catch (RuntimeException e) {
      upload = CompletableFuture.failedFuture(e);
    }
    return mapErrors(upload, "upload", bucket, key);
  }

  @Override
  public CompletableFuture<Void> deleteObject(String bucket, String key) {
    LOGGER.debug("Deleting object: bucket={}, key={}", bucket, key);

    DeleteObjectRequest request = DeleteObjectRequest.builder().bucket(bucket).key(key).build();

    CompletableFuture<Void> delete;
    try {
      delete =
          s3Client
              .deleteObject(request)
              .thenAccept(
                  response ->
                      LOGGER.info("Successfully deleted object: bucket={}, key={}", bucket, key));
    } catch (RuntimeException e) {
      delete = CompletableFuture.failedFuture(e);
    }
    return mapErrors(delete, "delete", bucket, key);
  }

  @Override
  public String publicUrl(String bucket, String key) {
    String base =
        properties.publicBaseUrl() != null && !properties.publicBaseUrl().isBlank()
            ? properties.publicBaseUrl()
            : properties.endpoint();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + "/" + bucket + "/" + key;
  }

  private static CompletableFuture<Void> mapErrors(
      CompletableFuture<Void> operation, String action, String bucket, String key) {
    CompletableFuture<Void> mapped = new CompletableFuture<>();
    operation.whenComplete(
        (ignored, error) -> {
          if (error == null) {
            mapped.complete(null);
          } else {
            mapped.completeExceptionally(translate(Failures.unwrap(error), action, bucket, key));
          }
        });
    return mapped;
  }

  static GenerationException translate(Throwable error, String action, String bucket, String key) {
    if (error instanceof S3Exception) {
      S3Exception s3Error = (S3Exception) error;
      String message =
          String.format(
              "Failed to %s object: bucket=%s, key=%s, statusCode=%s",
              action, bucket, key, s3Error.statusCode());
      LOGGER.error(message, error);
      if (s3Error.statusCode() == 401 || s3Error.statusCode() == 403) {
        return new StorageAuthRejectedException(message, error);
      }
      return new StorageUnavailableException(message, error);
    }

    String message =
        String.format("Unexpected error during %s: bucket=%s, key=%s", action, bucket, key);
    LOGGER.error(message, error);
    return new StorageUnavailableException(message, error);
  }

  /**
   * Clean up resources when the client is no longer needed.
   *
   * <p>Called by Spring on shutdown to release connections and event loop threads.
   */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
