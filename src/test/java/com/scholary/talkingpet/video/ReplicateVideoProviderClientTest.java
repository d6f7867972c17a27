package com.scholary.talkingpet.video;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.talkingpet.capability.ModelCapabilityRegistry;
import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.ProviderNotConfiguredException;
import com.scholary.talkingpet.error.ProviderRejectedException;
import com.scholary.talkingpet.error.ProviderUnavailableException;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReplicateVideoProviderClientTest {

  private HttpServer server;
  private String baseUrl;

  private final AtomicInteger requests = new AtomicInteger();
  private final AtomicReference<String> lastPath = new AtomicReference<>();
  private final AtomicReference<String> lastAuth = new AtomicReference<>();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private volatile int responseStatus = 200;
  private volatile String responseBody = "{}";

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          requests.incrementAndGet();
          lastPath.set(exchange.getRequestURI().getPath());
          lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(responseStatus, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void createJob_shouldPostModelPayloadWithBearerToken() {
    responseStatus = 201;
    responseBody = "{\"id\":\"pred-1\",\"status\":\"starting\"}";

    VideoJobSnapshot snapshot = client("secret").createJob(request()).join();

    assertThat(snapshot.providerJobId()).isEqualTo("pred-1");
    assertThat(snapshot.status()).isEqualTo(VideoJobStatus.QUEUED);
    assertThat(lastPath.get()).isEqualTo("/v1/models/minimax/hailuo-02/predictions");
    assertThat(lastAuth.get()).isEqualTo("Bearer secret");
    assertThat(lastBody.get())
        .contains("\"input\"")
        .contains("\"first_frame_image\":\"https://img/cat.png\"")
        .contains("\"resolution\":\"768p\"");
  }

  @Test
  void fetchJob_shouldParseOutputList() {
    responseBody =
        "{\"id\":\"pred-1\",\"status\":\"succeeded\","
            + "\"output\":[\"https://cdn/a.mp4\",\"https://cdn/b.mp4\"]}";

    VideoJobSnapshot snapshot = client("secret").fetchJob("pred-1").join();

    assertThat(lastPath.get()).isEqualTo("/v1/predictions/pred-1");
    assertThat(snapshot.status()).isEqualTo(VideoJobStatus.SUCCEEDED);
    assertThat(snapshot.firstOutput()).isEqualTo("https://cdn/a.mp4");
  }

  @Test
  void fetchJob_shouldParseFailureDetail() {
    responseBody =
        "{\"id\":\"pred-1\",\"status\":\"failed\",\"error\":\"NSFW\",\"logs\":\"checking\"}";

    VideoJobSnapshot snapshot = client("secret").fetchJob("pred-1").join();

    assertThat(snapshot.status()).isEqualTo(VideoJobStatus.FAILED);
    assertThat(snapshot.error()).isEqualTo("NSFW");
    assertThat(snapshot.logs()).isEqualTo("checking");
  }

  @Test
  void createJob_shouldMapClientErrorToRejection() {
    responseStatus = 422;
    responseBody = "{\"detail\":\"input.duration must be 6 or 10\"}";

    Throwable error = failureOf(client("secret").createJob(request()));

    assertThat(error).isInstanceOf(ProviderRejectedException.class);
    ProviderRejectedException rejected = (ProviderRejectedException) error;
    assertThat(rejected.statusCode()).isEqualTo(422);
    assertThat(rejected.detail()).isEqualTo("{\"detail\":\"input.duration must be 6 or 10\"}");
  }

  @Test
  void fetchJob_shouldMapServerErrorToUnavailable() {
    responseStatus = 503;
    responseBody = "upstream busy";

    assertThat(failureOf(client("secret").fetchJob("pred-1")))
        .isInstanceOf(ProviderUnavailableException.class);
  }

  @Test
  void createJob_shouldFailWithoutTokenBeforeCallingProvider() {
    assertThat(failureOf(client("").createJob(request())))
        .isInstanceOf(ProviderNotConfiguredException.class);
    assertThat(requests.get()).isZero();
  }

  @Test
  void parseSnapshot_shouldAcceptSingleUrlAndObjectOutputs() {
    ReplicateVideoProviderClient client = client("secret");

    assertThat(
            client
                .parseSnapshot("{\"id\":\"a\",\"status\":\"succeeded\",\"output\":\"https://x\"}")
                .firstOutput())
        .isEqualTo("https://x");
    assertThat(
            client
                .parseSnapshot(
                    "{\"id\":\"a\",\"status\":\"succeeded\",\"output\":{\"url\":\"https://y\"}}")
                .firstOutput())
        .isEqualTo("https://y");
  }

  @Test
  void parseSnapshot_shouldRequireJobId() {
    Throwable error = catchThrowable(() -> client("secret").parseSnapshot("{\"status\":\"x\"}"));

    assertThat(error).isInstanceOf(ProviderUnavailableException.class);
  }

  private ReplicateVideoProviderClient client(String token) {
    return new ReplicateVideoProviderClient(
        new VideoProviderProperties(baseUrl, token, 5, 5, 1, 1),
        new ObjectMapper(),
        new VideoPayloadBuilder(new ModelCapabilityRegistry()));
  }

  private static VideoJobRequest request() {
    return new VideoJobRequest(
        ModelCapabilityRegistry.HAILUO, "https://img/cat.png", "cat waves", 6, "768p", null);
  }

  private static Throwable failureOf(CompletableFuture<?> future) {
    return Failures.unwrap(catchThrowable(future::join));
  }
}
