package com.scholary.talkingpet.media;

import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.MuxFailedException;
import com.scholary.talkingpet.error.ProviderUnavailableException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads provider-hosted media into memory so it can be muxed.
 *
 * <p>Bounded by {@code media.maxDownloadBytes}: a body, or an announced content length, over the
 * limit fails the download.
 */
@Component
public class MediaFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaFetcher.class);

  static final String PROVIDER = "media-host";

  private final HttpClient httpClient;
  private final MediaProperties properties;

  public MediaFetcher(MediaProperties properties) {
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  public CompletableFuture<byte[]> fetch(String url) {
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(URI.create(url))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .GET()
              .build();
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(
          new ProviderUnavailableException(PROVIDER, "Invalid media URL: " + url, e));
    }

    LOGGER.debug("Fetching media: {}", url);
    return httpClient
        .sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
        .handle(
            (response, error) -> {
              if (error != null) {
                Throwable cause = Failures.unwrap(error);
                throw new ProviderUnavailableException(
                    PROVIDER, "Failed to download " + url + ": " + cause.getMessage(), cause);
              }
              return checkResponse(url, response);
            });
  }

  private byte[] checkResponse(String url, HttpResponse<byte[]> response) {
    if (response.statusCode() >= 400) {
      throw new ProviderUnavailableException(
          PROVIDER, String.format("Download of %s returned status %d", url, response.statusCode()));
    }

    OptionalLong announced = response.headers().firstValueAsLong("content-length");
    byte[] body = response.body() == null ? new byte[0] : response.body();
    long size = Math.max(body.length, announced.orElse(0));
    if (size > properties.maxDownloadBytes()) {
      throw new MuxFailedException(
          String.format(
              "Media at %s is too large to mux (%d bytes, max %d)",
              url, size, properties.maxDownloadBytes()));
    }
    if (body.length == 0) {
      throw new ProviderUnavailableException(PROVIDER, "Download of " + url + " was empty");
    }

    LOGGER.info("Fetched {} bytes from {}", body.length, url);
    return body;
  }
}
