package com.scholary.talkingpet.video;

import com.scholary.talkingpet.capability.ModelCapabilityRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the per-model {@code input} object for a prediction.
 *
 * <p>Every model takes the image, prompt and duration; beyond that their parameter names drift.
 * Kling has no resolution field and instead switches to its pro mode (with a wider aspect ratio)
 * once the registry says the requested resolution crosses its threshold.
 */
@Component
public class VideoPayloadBuilder {

  private final ModelCapabilityRegistry registry;

  public VideoPayloadBuilder(ModelCapabilityRegistry registry) {
    this.registry = registry;
  }

  /** Full request body: {@code {"input": {...}}}. */
  public Map<String, Object> build(VideoJobRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("input", buildInput(request));
    return body;
  }

  Map<String, Object> buildInput(VideoJobRequest request) {
    Map<String, Object> input = new LinkedHashMap<>();
    String modelId = request.modelId();

    switch (modelId) {
      case ModelCapabilityRegistry.HAILUO:
        input.put("first_frame_image", request.imageUrl());
        input.put("prompt", request.prompt());
        input.put("duration", request.seconds());
        input.put("resolution", request.resolution());
        input.put("prompt_optimizer", true);
        break;
      case ModelCapabilityRegistry.SEEDANCE:
        input.put("image", request.imageUrl());
        input.put("prompt", request.prompt());
        input.put("duration", request.seconds());
        input.put("resolution", request.resolution());
        break;
      case ModelCapabilityRegistry.KLING:
        boolean pro = registry.isProMode(modelId, request.resolution());
        input.put("start_image", request.imageUrl());
        input.put("prompt", request.prompt());
        input.put("duration", request.seconds());
        input.put("mode", pro ? "pro" : "standard");
        input.put("aspect_ratio", pro ? "16:9" : "1:1");
        break;
      case ModelCapabilityRegistry.OMNI_HUMAN:
        input.put("image", request.imageUrl());
        input.put("audio", request.audioUrl());
        if (request.prompt() != null && !request.prompt().isBlank()) {
          input.put("prompt", request.prompt());
        }
        break;
      default:
        input.put("image", request.imageUrl());
        input.put("prompt", request.prompt());
        input.put("duration", request.seconds());
        input.put("resolution", request.resolution());
        break;
    }
    return input;
  }
}
