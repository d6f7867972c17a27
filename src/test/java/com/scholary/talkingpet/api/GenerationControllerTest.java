package com.scholary.talkingpet.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.talkingpet.capability.ModelCapabilityRegistry;
import com.scholary.talkingpet.error.GenerationException;
import com.scholary.talkingpet.error.JobTimedOutException;
import com.scholary.talkingpet.error.ProviderNotConfiguredException;
import com.scholary.talkingpet.error.ProviderRejectedException;
import com.scholary.talkingpet.error.StorageUnavailableException;
import com.scholary.talkingpet.error.TextTooLongException;
import com.scholary.talkingpet.pipeline.GenerationOrchestrator;
import com.scholary.talkingpet.pipeline.GenerationRequest;
import com.scholary.talkingpet.pipeline.GenerationResult;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class GenerationControllerTest {

  private static final String USER_ID = "6f9619ff-8b86-d011-b42d-00c04fc964ff";

  private static final String VIDEO_BODY =
      "{\"imageUrl\":\"https://img/cat.png\",\"prompt\":\"cat waves\",\"resolution\":\"768p\"}";

  private static final String SPEECH_BODY =
      "{\"imageUrl\":\"https://img/cat.png\",\"prompt\":\"cat talks\",\"resolution\":\"768p\","
          + "\"speechText\":\"Hello\",\"voiceId\":\"voice-1\",\"userId\":\""
          + USER_ID
          + "\"}";

  @Mock private GenerationOrchestrator orchestrator;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new GenerationController(orchestrator, new ModelCapabilityRegistry()))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void generateVideo_shouldReturnResult() throws Exception {
    when(orchestrator.runVideoOnlyAsync(any()))
        .thenReturn(
            CompletableFuture.completedFuture(
                new GenerationResult(null, "https://cdn/v.mp4", "https://cdn/v.mp4")));

    MvcResult started =
        mockMvc
            .perform(
                post("/api/jobs/video").contentType(MediaType.APPLICATION_JSON).content(VIDEO_BODY))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(started))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.videoUrl").value("https://cdn/v.mp4"))
        .andExpect(jsonPath("$.finalUrl").value("https://cdn/v.mp4"))
        .andExpect(jsonPath("$.muxed").value(false));

    ArgumentCaptor<GenerationRequest> captured = ArgumentCaptor.forClass(GenerationRequest.class);
    verify(orchestrator).runVideoOnlyAsync(captured.capture());
    assertThat(captured.getValue().scope().userId()).isNull();
    assertThat(captured.getValue().hasSpeechText()).isFalse();
  }

  @Test
  void generateSpeechVideo_shouldPassCallerScope() throws Exception {
    when(orchestrator.runSpeechAndVideoAsync(any()))
        .thenReturn(
            CompletableFuture.completedFuture(
                new GenerationResult("https://s/a.mp3", "https://cdn/v.mp4", "https://s/f.mp4")));

    MvcResult started =
        mockMvc
            .perform(
                post("/api/jobs/speech-video")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(SPEECH_BODY))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(started))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.audioUrl").value("https://s/a.mp3"))
        .andExpect(jsonPath("$.finalUrl").value("https://s/f.mp4"))
        .andExpect(jsonPath("$.muxed").value(true));

    ArgumentCaptor<GenerationRequest> captured = ArgumentCaptor.forClass(GenerationRequest.class);
    verify(orchestrator).runSpeechAndVideoAsync(captured.capture());
    assertThat(captured.getValue().scope().userId()).isEqualTo(USER_ID);
    assertThat(captured.getValue().voiceId()).isEqualTo("voice-1");
  }

  @Test
  void generateSpeechVideo_shouldRejectMissingVoiceWithoutCallingPipeline() throws Exception {
    String body =
        "{\"imageUrl\":\"https://img/cat.png\",\"resolution\":\"768p\",\"speechText\":\"Hi\"}";

    mockMvc
        .perform(
            post("/api/jobs/speech-video").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("validation_rejected"))
        .andExpect(jsonPath("$.fault").value("CALLER"));

    verifyNoInteractions(orchestrator);
  }

  @Test
  void generateSpeechVideo_shouldMapTimeoutToGatewayTimeout() throws Exception {
    when(orchestrator.runSpeechAndVideoAsync(any()))
        .thenReturn(
            CompletableFuture.failedFuture(
                new JobTimedOutException("job-1", Duration.ofMinutes(10))));

    MvcResult started =
        mockMvc
            .perform(
                post("/api/jobs/speech-video")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(SPEECH_BODY))
            .andReturn();

    mockMvc
        .perform(asyncDispatch(started))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("job_timed_out"))
        .andExpect(jsonPath("$.fault").value("PROVIDER"));
  }

  @Test
  void generateSpeechVideo_shouldMapTextTooLongToBadRequest() throws Exception {
    when(orchestrator.runSpeechAndVideoAsync(any()))
        .thenReturn(CompletableFuture.failedFuture(new TextTooLongException(700, 600)));

    MvcResult started =
        mockMvc
            .perform(
                post("/api/jobs/speech-video")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(SPEECH_BODY))
            .andReturn();

    mockMvc
        .perform(asyncDispatch(started))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("text_too_long"));
  }

  @Test
  void generateVideo_shouldRejectMalformedJson() throws Exception {
    mockMvc
        .perform(post("/api/jobs/video").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("validation_rejected"));
  }

  @Test
  void listModels_shouldExposeCatalog() throws Exception {
    mockMvc
        .perform(get("/api/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.defaultModel").value(ModelCapabilityRegistry.HAILUO))
        .andExpect(jsonPath("$.models.length()").value(4))
        .andExpect(jsonPath("$.models[0].modelId").value(ModelCapabilityRegistry.HAILUO))
        .andExpect(jsonPath("$.models[0].supportedResolutions[0]").value("512p"))
        .andExpect(jsonPath("$.models[3].requiresAudioInput").value(true));
  }

  @Test
  void health_shouldReportOk() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  @Test
  void statusFor_shouldSeparateFaults() {
    assertThat(statusOf(new ProviderRejectedException("elevenlabs", 401, "bad key")))
        .isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(statusOf(new StorageUnavailableException("down", null)))
        .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(statusOf(new TextTooLongException(601, 600))).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(statusOf(new ProviderNotConfiguredException("replicate", "token missing")))
        .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private static HttpStatus statusOf(GenerationException error) {
    return GlobalExceptionHandler.statusFor(error);
  }
}
