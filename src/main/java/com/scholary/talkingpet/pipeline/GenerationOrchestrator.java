package com.scholary.talkingpet.pipeline;

import com.scholary.talkingpet.capability.CapabilityCheck;
import com.scholary.talkingpet.capability.ModelCapability;
import com.scholary.talkingpet.capability.ModelCapabilityRegistry;
import com.scholary.talkingpet.config.GenerationProperties;
import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.error.GenerationException;
import com.scholary.talkingpet.error.ValidationRejectedException;
import com.scholary.talkingpet.logging.StructuredLogger;
import com.scholary.talkingpet.media.MediaFetcher;
import com.scholary.talkingpet.media.Muxer;
import com.scholary.talkingpet.record.MetadataRecorder;
import com.scholary.talkingpet.record.PersistedRecord;
import com.scholary.talkingpet.storage.ArtifactStore;
import com.scholary.talkingpet.storage.StorageKeys;
import com.scholary.talkingpet.storage.StoredArtifact;
import com.scholary.talkingpet.tts.SpeechArtifact;
import com.scholary.talkingpet.tts.SpeechSynthesizer;
import com.scholary.talkingpet.tts.TtsProperties;
import com.scholary.talkingpet.video.VideoGenerationJob;
import com.scholary.talkingpet.video.VideoJobRequest;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the two generation workflows and owns every failure decision.
 *
 * <p>Video only:
 *
 * <ol>
 *   <li>validate the model for a silent clip
 *   <li>submit the video job and poll it to completion
 *   <li>record the result
 * </ol>
 *
 * <p>Speech and video:
 *
 * <ol>
 *   <li>validate the model for a speaking clip
 *   <li>synthesize the speech and upload it
 *   <li>submit the video job (with the speech URL, for models that animate from audio) and poll it
 *   <li>unless the model already embeds the audio: download the clip, mux, upload the result
 *   <li>record the result
 * </ol>
 *
 * <p>Steps inside one request run strictly in sequence; every external call is one non-blocking
 * stage of a {@link CompletableFuture} chain. Uploads made by a request are pushed to its {@link
 * RollbackLedger}; if any later step fails they are deleted again before the original error is
 * reported. The provider-hosted video is not ours and is never deleted.
 */
@Service
public class GenerationOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GenerationOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String VIDEO_ONLY = "video-only";
  static final String SPEECH_AND_VIDEO = "speech-video";

  static final String AUDIO_CATEGORY = "audio";
  static final String VIDEO_CATEGORY = "videos";
  static final String FINAL_EXTENSION = "mp4";
  static final String FINAL_CONTENT_TYPE = "video/mp4";

  private final ModelCapabilityRegistry registry;
  private final SpeechSynthesizer speechSynthesizer;
  private final ArtifactStore artifactStore;
  private final VideoGenerationJob videoGenerationJob;
  private final MediaFetcher mediaFetcher;
  private final Muxer muxer;
  private final MetadataRecorder metadataRecorder;
  private final GenerationProperties properties;
  private final String speechOutputFormat;
  private final Executor blockingExecutor;

  public GenerationOrchestrator(
      ModelCapabilityRegistry registry,
      SpeechSynthesizer speechSynthesizer,
      ArtifactStore artifactStore,
      VideoGenerationJob videoGenerationJob,
      MediaFetcher mediaFetcher,
      Muxer muxer,
      MetadataRecorder metadataRecorder,
      GenerationProperties properties,
      TtsProperties ttsProperties,
      @Qualifier("generationExecutor") Executor blockingExecutor) {
    this.registry = registry;
    this.speechSynthesizer = speechSynthesizer;
    this.artifactStore = artifactStore;
    this.videoGenerationJob = videoGenerationJob;
    this.mediaFetcher = mediaFetcher;
    this.muxer = muxer;
    this.metadataRecorder = metadataRecorder;
    this.properties = properties;
    this.speechOutputFormat = ttsProperties.outputFormat();
    this.blockingExecutor = blockingExecutor;
  }

  /**
   * Generate a silent clip. Blocks until the workflow is terminal.
   *
   * @throws GenerationException describing what went wrong and whose fault it was
   */
  public GenerationResult runVideoOnly(GenerationRequest request) {
    return await(runVideoOnlyAsync(request));
  }

  /**
   * Generate a speaking clip. Blocks until the workflow is terminal.
   *
   * @throws GenerationException describing what went wrong and whose fault it was
   */
  public GenerationResult runSpeechAndVideo(GenerationRequest request) {
    return await(runSpeechAndVideoAsync(request));
  }

  /**
   * Non-blocking form of {@link #runVideoOnly}. The future fails with the unwrapped {@link
   * GenerationException}.
   */
  public CompletableFuture<GenerationResult> runVideoOnlyAsync(GenerationRequest request) {
    String correlationId = UUID.randomUUID().toString();
    long startMs = System.currentTimeMillis();

    Plan plan;
    try {
      plan = prepare(request, false);
    } catch (GenerationException e) {
      return rejected(correlationId, VIDEO_ONLY, e);
    }
    structuredLogger.logWorkflowStarted(
        correlationId, VIDEO_ONLY, plan.model().modelId(), plan.resolution());

    CompletableFuture<GenerationResult> workflow =
        generateVideo(correlationId, plan, null)
            .thenCompose(
                videoUrl -> {
                  GenerationResult result = new GenerationResult(null, videoUrl, videoUrl);
                  return recordResult(correlationId, plan, result, null)
                      .thenApply(ignored -> result);
                });

    return settle(correlationId, VIDEO_ONLY, startMs, workflow, null);
  }

  /**
   * Non-blocking form of {@link #runSpeechAndVideo}. The future fails with the unwrapped {@link
   * GenerationException}, after any uploads made for the request have been rolled back.
   */
  public CompletableFuture<GenerationResult> runSpeechAndVideoAsync(GenerationRequest request) {
    String correlationId = UUID.randomUUID().toString();
    long startMs = System.currentTimeMillis();

    Plan plan;
    try {
      plan = prepare(request, true);
    } catch (GenerationException e) {
      return rejected(correlationId, SPEECH_AND_VIDEO, e);
    }
    structuredLogger.logWorkflowStarted(
        correlationId, SPEECH_AND_VIDEO, plan.model().modelId(), plan.resolution());

    RollbackLedger ledger = new RollbackLedger(artifactStore, structuredLogger, correlationId);

    CompletableFuture<GenerationResult> workflow =
        synthesize(correlationId, plan)
            .thenCompose(
                speech ->
                    uploadSpeech(correlationId, plan, speech, ledger)
                        .thenCompose(
                            audio ->
                                generateVideo(correlationId, plan, audio.publicUrl())
                                    .thenCompose(
                                        videoUrl ->
                                            finishSpeakingClip(
                                                correlationId,
                                                plan,
                                                speech,
                                                audio,
                                                videoUrl,
                                                ledger))));

    return settle(correlationId, SPEECH_AND_VIDEO, startMs, workflow, ledger);
  }

  private CompletableFuture<GenerationResult> finishSpeakingClip(
      String correlationId,
      Plan plan,
      SpeechArtifact speech,
      StoredArtifact audio,
      String videoUrl,
      RollbackLedger ledger) {
    CompletableFuture<StoredArtifact> finalArtifact;
    if (plan.model().embedsAudio()) {
      LOGGER.info(
          "Model {} embeds the speech track, skipping mux", plan.model().modelId());
      finalArtifact = CompletableFuture.completedFuture(null);
    } else {
      finalArtifact = muxAndUpload(correlationId, plan, speech, videoUrl, ledger);
    }

    return finalArtifact.thenCompose(
        muxed -> {
          String finalUrl = muxed == null ? videoUrl : muxed.publicUrl();
          String storageKey = muxed == null ? null : muxed.storagePath();
          GenerationResult result = new GenerationResult(audio.publicUrl(), videoUrl, finalUrl);
          return recordResult(correlationId, plan, result, storageKey)
              .thenApply(ignored -> result);
        });
  }

  /**
   * Check the request before anything leaves the process.
   *
   * @throws ValidationRejectedException if the request can never succeed
   */
  private Plan prepare(GenerationRequest request, boolean wantsAudio) {
    if (request == null) {
      throw new ValidationRejectedException("Request is required");
    }
    if (isBlank(request.imageUrl())) {
      throw new ValidationRejectedException("imageUrl is required");
    }

    if (wantsAudio) {
      if (request.hasSpeechText() != request.hasVoiceId()) {
        throw new ValidationRejectedException(
            "speechText and voiceId must be provided together");
      }
      if (!request.hasSpeechText()) {
        throw new ValidationRejectedException("speechText and voiceId are required");
      }
    } else if (request.hasSpeechText() || request.hasVoiceId()) {
      throw new ValidationRejectedException(
          "Speech text is only accepted by the speech and video workflow");
    }

    String modelId = isBlank(request.modelId()) ? registry.defaultModelId() : request.modelId();
    CapabilityCheck check = registry.validate(modelId, wantsAudio, request.resolution());
    if (!check.accepted()) {
      throw new ValidationRejectedException(
          String.format(
              "%s: model=%s, resolution=%s", check.reason(), modelId, request.resolution()));
    }
    ModelCapability model = registry.find(modelId).orElseThrow();

    if (!model.requiresAudioInput() && isBlank(request.prompt())) {
      throw new ValidationRejectedException("prompt is required for model " + modelId);
    }

    int seconds = request.seconds() == null ? model.defaultSeconds() : request.seconds();
    if (seconds <= 0) {
      throw new ValidationRejectedException("seconds must be positive, got " + seconds);
    }

    String userId = StorageKeys.normalizeUserId(request.scope().userId());
    String storagePrefix = StorageKeys.resolveUserPrefix(userId);
    return new Plan(request, model, seconds, request.resolution(), userId, storagePrefix);
  }

  private CompletableFuture<SpeechArtifact> synthesize(String correlationId, Plan plan) {
    long startMs = System.currentTimeMillis();
    GenerationRequest request = plan.request();
    return attempt(
            () ->
                speechSynthesizer.synthesize(
                    request.speechText(), request.voiceId(), speechOutputFormat))
        .thenApply(
            speech -> {
              structuredLogger.logStepFinished(
                  correlationId, "synthesize", System.currentTimeMillis() - startMs);
              return speech;
            });
  }

  private CompletableFuture<StoredArtifact> uploadSpeech(
      String correlationId, Plan plan, SpeechArtifact speech, RollbackLedger ledger) {
    long startMs = System.currentTimeMillis();
    return attempt(
            () ->
                artifactStore.upload(
                    speech.bytes(),
                    plan.storagePrefix(),
                    AUDIO_CATEGORY,
                    speech.extension(),
                    speech.contentType()))
        .thenApply(
            audio -> {
              ledger.register(audio);
              LOGGER.info(
                  "Speech stored: correlationId={}, path={}", correlationId, audio.storagePath());
              structuredLogger.logStepFinished(
                  correlationId, "upload_speech", System.currentTimeMillis() - startMs);
              return audio;
            });
  }

  private CompletableFuture<String> generateVideo(
      String correlationId, Plan plan, String audioUrl) {
    long startMs = System.currentTimeMillis();
    GenerationRequest request = plan.request();
    VideoJobRequest jobRequest =
        new VideoJobRequest(
            plan.model().modelId(),
            request.imageUrl(),
            request.prompt(),
            plan.seconds(),
            plan.resolution(),
            plan.model().requiresAudioInput() ? audioUrl : null);

    return attempt(() -> videoGenerationJob.submit(jobRequest))
        .thenCompose(
            handle -> {
              LOGGER.info(
                  "Video job submitted: correlationId={}, jobId={}, model={}",
                  correlationId,
                  handle.getProviderJobId(),
                  handle.getModelId());
              return videoGenerationJob.awaitCompletion(
                  handle, properties.pollInterval(), properties.jobTimeout());
            })
        .thenApply(
            videoUrl -> {
              structuredLogger.logStepFinished(
                  correlationId, "generate_video", System.currentTimeMillis() - startMs);
              return videoUrl;
            });
  }

  private CompletableFuture<StoredArtifact> muxAndUpload(
      String correlationId,
      Plan plan,
      SpeechArtifact speech,
      String videoUrl,
      RollbackLedger ledger) {
    long startMs = System.currentTimeMillis();
    return attempt(() -> mediaFetcher.fetch(videoUrl))
        .thenApplyAsync(
            videoBytes ->
                muxer.mux(
                    videoBytes,
                    speech.bytes(),
                    properties.audioLeadDelay(),
                    properties.audioTailPad()),
            blockingExecutor)
        .thenCompose(
            muxedBytes -> {
              structuredLogger.logStepFinished(
                  correlationId, "mux", System.currentTimeMillis() - startMs);
              return artifactStore.upload(
                  muxedBytes,
                  plan.storagePrefix(),
                  VIDEO_CATEGORY,
                  FINAL_EXTENSION,
                  FINAL_CONTENT_TYPE);
            })
        .thenApply(
            muxed -> {
              ledger.register(muxed);
              LOGGER.info(
                  "Final clip stored: correlationId={}, path={}",
                  correlationId,
                  muxed.storagePath());
              structuredLogger.logStepFinished(
                  correlationId, "upload_final", System.currentTimeMillis() - startMs);
              return muxed;
            });
  }

  private CompletableFuture<Void> recordResult(
      String correlationId, Plan plan, GenerationResult result, String storageKey) {
    long startMs = System.currentTimeMillis();
    GenerationRequest request = plan.request();
    PersistedRecord record =
        new PersistedRecord(
            plan.userId(),
            plan.model().modelId(),
            result.audioUrl(),
            result.videoUrl(),
            result.finalUrl(),
            storageKey,
            request.imageUrl(),
            request.speechText(),
            request.prompt(),
            request.voiceId(),
            plan.resolution(),
            plan.seconds(),
            Instant.now());

    return attempt(() -> metadataRecorder.record(record))
        .thenApply(
            ignored -> {
              structuredLogger.logStepFinished(
                  correlationId, "record", System.currentTimeMillis() - startMs);
              return null;
            });
  }

  /**
   * Turn the workflow's outcome into the caller's future.
   *
   * <p>On failure the ledger is rolled back first and the caller then sees the original cause,
   * unwrapped. Rollback problems are only logged.
   */
  private CompletableFuture<GenerationResult> settle(
      String correlationId,
      String workflow,
      long startMs,
      CompletableFuture<GenerationResult> execution,
      RollbackLedger ledger) {
    CompletableFuture<GenerationResult> outcome = new CompletableFuture<>();
    execution.whenComplete(
        (result, error) -> {
          if (error == null) {
            structuredLogger.logWorkflowCompleted(
                correlationId,
                workflow,
                result.finalUrl(),
                result.muxed(),
                System.currentTimeMillis() - startMs);
            outcome.complete(result);
            return;
          }

          Throwable cause = Failures.unwrap(error);
          int uploads = ledger == null ? 0 : ledger.size();
          structuredLogger.logWorkflowFailed(
              correlationId, workflow, codeOf(cause), cause.getMessage(), uploads);

          if (ledger == null) {
            outcome.completeExceptionally(cause);
          } else {
            ledger.rollback().whenComplete((ignored, rollbackError) ->
                outcome.completeExceptionally(cause));
          }
        });
    return outcome;
  }

  private CompletableFuture<GenerationResult> rejected(
      String correlationId, String workflow, GenerationException error) {
    structuredLogger.logWorkflowFailed(
        correlationId, workflow, error.code(), error.getMessage(), 0);
    return CompletableFuture.failedFuture(error);
  }

  private static <T> CompletableFuture<T> attempt(Supplier<CompletableFuture<T>> step) {
    try {
      return step.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static GenerationResult await(CompletableFuture<GenerationResult> future) {
    try {
      return future.join();
    } catch (RuntimeException e) {
      throw Failures.propagate(e);
    }
  }

  private static String codeOf(Throwable error) {
    if (error instanceof GenerationException) {
      return ((GenerationException) error).code();
    }
    return "internal_error";
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /** A request that passed validation, with its defaults filled in. */
  private record Plan(
      GenerationRequest request,
      ModelCapability model,
      int seconds,
      String resolution,
      String userId,
      String storagePrefix) {}
}
