package com.scholary.talkingpet.tts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.Fault;
import com.scholary.talkingpet.error.ProviderNotConfiguredException;
import com.scholary.talkingpet.error.ProviderRejectedException;
import com.scholary.talkingpet.error.ProviderUnavailableException;
import com.scholary.talkingpet.error.TextTooLongException;
import com.scholary.talkingpet.error.ValidationRejectedException;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ElevenLabsSpeechClientTest {

  private static final int MAX_CHARS = 600;

  private HttpServer server;
  private String baseUrl;
  private ScheduledExecutorService scheduler;

  private final AtomicInteger requests = new AtomicInteger();
  private final AtomicReference<String> lastUri = new AtomicReference<>();
  private final AtomicReference<String> lastApiKey = new AtomicReference<>();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private volatile int responseStatus = 200;
  private volatile byte[] responseBody = new byte[] {1, 2, 3, 4};

  @BeforeEach
  void setUp() throws IOException {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          requests.incrementAndGet();
          lastUri.set(exchange.getRequestURI().toString());
          lastApiKey.set(exchange.getRequestHeaders().getFirst("xi-api-key"));
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          byte[] body = responseBody;
          exchange.sendResponseHeaders(responseStatus, body.length == 0 ? -1 : body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
    scheduler.shutdownNow();
  }

  @Test
  void synthesize_shouldPostTextAndReturnAudio() {
    SpeechArtifact speech = client("key", 100).synthesize("Hello there", "voice-1", null).join();

    assertThat(speech.bytes()).containsExactly(1, 2, 3, 4);
    assertThat(speech.sizeBytes()).isEqualTo(4);
    assertThat(speech.contentType()).isEqualTo("audio/mpeg");
    assertThat(speech.extension()).isEqualTo("mp3");
    assertThat(lastUri.get())
        .isEqualTo("/v1/text-to-speech/voice-1?output_format=mp3_44100_64");
    assertThat(lastApiKey.get()).isEqualTo("key");
    assertThat(lastBody.get())
        .contains("\"text\":\"Hello there\"")
        .contains("\"model_id\":\"eleven_multilingual_v2\"");
  }

  @Test
  void synthesize_shouldRejectLongTextWithoutCallingProvider() {
    String text = "a".repeat(MAX_CHARS + 1);

    Throwable error = failureOf(client("key", 100).synthesize(text, "voice-1", null));

    assertThat(error).isInstanceOf(TextTooLongException.class);
    assertThat(((TextTooLongException) error).code()).isEqualTo("text_too_long");
    assertThat(requests.get()).isZero();
  }

  @Test
  void synthesize_shouldAcceptTextAtLimit() {
    String text = "a".repeat(MAX_CHARS);

    assertThat(client("key", 100).synthesize(text, "voice-1", null).join().sizeBytes())
        .isEqualTo(4);
  }

  @Test
  void synthesize_shouldPassProviderRejectionVerbatim() {
    responseStatus = 400;
    responseBody =
        "{\"detail\":{\"status\":\"voice_not_found\"}}".getBytes(StandardCharsets.UTF_8);

    Throwable error = failureOf(client("key", 100).synthesize("Hi", "missing", null));

    assertThat(error).isInstanceOf(ProviderRejectedException.class);
    assertThat(((ProviderRejectedException) error).detail())
        .isEqualTo("{\"detail\":{\"status\":\"voice_not_found\"}}");
    assertThat(requests.get()).isEqualTo(1);
  }

  @Test
  void synthesize_shouldRetryServerErrorsThenGiveUp() {
    responseStatus = 502;
    responseBody = "bad gateway".getBytes(StandardCharsets.UTF_8);

    Throwable error = failureOf(client("key", 100).synthesize("Hi", "voice-1", null));

    assertThat(error).isInstanceOf(ProviderUnavailableException.class);
    assertThat(requests.get()).isEqualTo(2);
  }

  @Test
  void synthesize_shouldRejectOversizedAudio() {
    responseBody = new byte[101];

    Throwable error = failureOf(client("key", 100).synthesize("Hi", "voice-1", null));

    assertThat(error).isInstanceOf(ValidationRejectedException.class);
    assertThat(error.getMessage()).contains("too large");
  }

  @Test
  void synthesize_shouldFailWithoutApiKey() {
    Throwable error = failureOf(client("", 100).synthesize("Hi", "voice-1", null));

    assertThat(error).isInstanceOf(ProviderNotConfiguredException.class);
    assertThat(((ProviderNotConfiguredException) error).fault()).isEqualTo(Fault.INTERNAL);
    assertThat(requests.get()).isZero();
  }

  @Test
  void contentTypeFor_shouldFollowFormatPrefix() {
    assertThat(ElevenLabsSpeechClient.contentTypeFor("mp3_44100_64")).isEqualTo("audio/mpeg");
    assertThat(ElevenLabsSpeechClient.contentTypeFor("pcm_16000")).isEqualTo("audio/pcm");
    assertThat(ElevenLabsSpeechClient.contentTypeFor("wav_44100")).isEqualTo("audio/wav");
    assertThat(ElevenLabsSpeechClient.contentTypeFor("opus_48000_64")).isEqualTo("audio/ogg");
  }

  private ElevenLabsSpeechClient client(String apiKey, long maxAudioBytes) {
    TtsProperties properties =
        new TtsProperties(
            baseUrl,
            apiKey,
            "eleven_multilingual_v2",
            "mp3_44100_64",
            MAX_CHARS,
            maxAudioBytes,
            5,
            5,
            2,
            1);
    return new ElevenLabsSpeechClient(properties, new ObjectMapper(), scheduler);
  }

  private static Throwable failureOf(CompletableFuture<?> future) {
    return Failures.unwrap(catchThrowable(future::join));
  }
}
