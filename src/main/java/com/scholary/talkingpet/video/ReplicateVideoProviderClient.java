package com.scholary.talkingpet.video;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.ProviderNotConfiguredException;
import com.scholary.talkingpet.error.ProviderRejectedException;
import com.scholary.talkingpet.error.ProviderUnavailableException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for Replicate-style prediction endpoints.
 *
 * <pre>
 * POST {baseUrl}/v1/models/{owner}/{name}/predictions  {"input": {...}} -> {id, status, ...}
 * GET  {baseUrl}/v1/predictions/{id}  -> {id, status, output, error, logs}
 * </pre>
 *
 * <p>{@code output} is either a single URL string or an array of URLs.
 */
@Component
public class ReplicateVideoProviderClient implements VideoProviderClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplicateVideoProviderClient.class);

  static final String PROVIDER = "replicate";

  private final HttpClient httpClient;
  private final VideoProviderProperties properties;
  private final ObjectMapper objectMapper;
  private final VideoPayloadBuilder payloadBuilder;

  public ReplicateVideoProviderClient(
      VideoProviderProperties properties,
      ObjectMapper objectMapper,
      VideoPayloadBuilder payloadBuilder) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.payloadBuilder = payloadBuilder;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized video provider client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String name() {
    return PROVIDER;
  }

  @Override
  public CompletableFuture<VideoJobSnapshot> createJob(VideoJobRequest request) {
    if (properties.apiToken() == null || properties.apiToken().isBlank()) {
      return CompletableFuture.failedFuture(
          new ProviderNotConfiguredException(
              PROVIDER, "Video provider API token is not configured"));
    }

    byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payloadBuilder.build(request));
    } catch (JsonProcessingException e) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Failed to encode prediction request", e));
    }

    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(
                URI.create(
                    properties.baseUrl() + "/v1/models/" + request.modelId() + "/predictions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Authorization", "Bearer " + properties.apiToken())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();

    LOGGER.debug("Creating prediction: model={}, uri={}", request.modelId(), httpRequest.uri());
    return send(httpRequest, "create");
  }

  @Override
  public CompletableFuture<VideoJobSnapshot> fetchJob(String providerJobId) {
    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(
                URI.create(
                    properties.baseUrl()
                        + "/v1/predictions/"
                        + URLEncoder.encode(providerJobId, StandardCharsets.UTF_8)))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Authorization", "Bearer " + properties.apiToken())
            .GET()
            .build();

    return send(httpRequest, "fetch");
  }

  private CompletableFuture<VideoJobSnapshot> send(HttpRequest request, String operation) {
    return httpClient
        .sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .handle(
            (response, error) -> {
              if (error != null) {
                Throwable cause = Failures.unwrap(error);
                throw new ProviderUnavailableException(
                    PROVIDER,
                    String.format("Prediction %s failed: %s", operation, cause.getMessage()),
                    cause);
              }
              return parseResponse(response);
            });
  }

  private VideoJobSnapshot parseResponse(HttpResponse<String> response) {
    int status = response.statusCode();
    if (status >= 500) {
      throw new ProviderUnavailableException(
          PROVIDER, String.format("Provider returned status %d: %s", status, response.body()));
    }
    if (status >= 400) {
      throw new ProviderRejectedException(PROVIDER, status, response.body());
    }
    return parseSnapshot(response.body());
  }

  VideoJobSnapshot parseSnapshot(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ProviderUnavailableException(PROVIDER, "Unreadable provider response", e);
    }

    String id = text(root, "id");
    if (id == null || id.isBlank()) {
      throw new ProviderUnavailableException(PROVIDER, "No job id returned from provider");
    }

    return new VideoJobSnapshot(
        id,
        VideoJobStatus.fromProvider(text(root, "status")),
        outputs(root.get("output")),
        errorText(root.get("error")),
        text(root, "logs"));
  }

  private static List<String> outputs(JsonNode output) {
    List<String> urls = new ArrayList<>();
    if (output == null || output.isNull()) {
      return urls;
    }
    if (output.isTextual()) {
      urls.add(output.asText());
    } else if (output.isArray()) {
      for (JsonNode item : output) {
        if (item.isTextual() && !item.asText().isBlank()) {
          urls.add(item.asText());
        }
      }
    } else if (output.hasNonNull("url")) {
      urls.add(output.get("url").asText());
    }
    return urls;
  }

  private static String errorText(JsonNode error) {
    if (error == null || error.isNull()) {
      return null;
    }
    return error.isTextual() ? error.asText() : error.toString();
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
