package com.scholary.talkingpet.api;

import com.scholary.talkingpet.capability.ModelCapabilityRegistry;
import com.scholary.talkingpet.pipeline.GenerationOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for talking pet clips.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Generating a silent clip from an image and a prompt
 *   <li>Generating a speaking clip from an image, a prompt and speech text
 *   <li>Listing the supported models
 * </ul>
 *
 * <p>Generation endpoints return a {@link CompletableFuture}, so the servlet thread is released
 * while the video job is being polled. Failures are mapped by {@link GlobalExceptionHandler}.
 */
@RestController
@Tag(name = "Generation", description = "Talking pet video generation API")
public class GenerationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(GenerationController.class);

  private final GenerationOrchestrator orchestrator;
  private final ModelCapabilityRegistry registry;

  public GenerationController(
      GenerationOrchestrator orchestrator, ModelCapabilityRegistry registry) {
    this.orchestrator = orchestrator;
    this.registry = registry;
  }

  @PostMapping("/api/jobs/video")
  @Operation(
      summary = "Generate video",
      description = "Animate an image from a text prompt and return the provider-hosted clip")
  public CompletableFuture<GenerationResponse> generateVideo(
      @Valid @RequestBody VideoOnlyRequest request) {
    LOGGER.info(
        "Video request: model={}, resolution={}, seconds={}",
        request.modelId(),
        request.resolution(),
        request.seconds());
    return orchestrator
        .runVideoOnlyAsync(request.toGenerationRequest())
        .thenApply(GenerationResponse::from);
  }

  @PostMapping("/api/jobs/speech-video")
  @Operation(
      summary = "Generate speaking video",
      description =
          "Synthesize speech, animate an image and return the clip with the speech muxed in")
  public CompletableFuture<GenerationResponse> generateSpeechVideo(
      @Valid @RequestBody SpeechVideoRequest request) {
    LOGGER.info(
        "Speech video request: model={}, resolution={}, voice={}, chars={}",
        request.modelId(),
        request.resolution(),
        request.voiceId(),
        request.speechText().length());
    return orchestrator
        .runSpeechAndVideoAsync(request.toGenerationRequest())
        .thenApply(GenerationResponse::from);
  }

  @GetMapping("/api/models")
  @Operation(summary = "List models", description = "Supported video models and their limits")
  public ModelCatalogResponse listModels() {
    return ModelCatalogResponse.from(registry);
  }

  @GetMapping("/api/health")
  @Operation(summary = "Health check")
  public ResponseEntity<Map<String, String>> health() {
    return ResponseEntity.ok(Map.of("status", "ok"));
  }
}
