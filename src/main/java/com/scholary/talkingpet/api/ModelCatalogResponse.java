package com.scholary.talkingpet.api;

import com.scholary.talkingpet.capability.ModelCapability;
import com.scholary.talkingpet.capability.ModelCapabilityRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** The model catalog as served by {@code GET /api/models}. */
public record ModelCatalogResponse(String defaultModel, List<Model> models) {

  public static ModelCatalogResponse from(ModelCapabilityRegistry registry) {
    List<Model> models = new ArrayList<>();
    for (ModelCapability capability : registry.catalog()) {
      models.add(Model.from(capability));
    }
    return new ModelCatalogResponse(registry.defaultModelId(), models);
  }

  /** One catalog entry. Resolutions are listed lowest first. */
  public record Model(
      String modelId,
      String displayName,
      boolean requiresAudioInput,
      boolean supportsPromptOnly,
      boolean embedsAudio,
      List<String> supportedResolutions,
      int defaultSeconds,
      String proModeThreshold) {

    static Model from(ModelCapability capability) {
      List<String> resolutions = new ArrayList<>(capability.supportedResolutions());
      resolutions.sort(Comparator.comparingInt(Model::lines));
      return new Model(
          capability.modelId(),
          capability.displayName(),
          capability.requiresAudioInput(),
          capability.supportsPromptOnly(),
          capability.embedsAudio(),
          resolutions,
          capability.defaultSeconds(),
          capability.proModeThreshold());
    }

    private static int lines(String resolution) {
      String digits =
          resolution.endsWith("p") ? resolution.substring(0, resolution.length() - 1) : resolution;
      try {
        return Integer.parseInt(digits);
      } catch (NumberFormatException e) {
        return Integer.MAX_VALUE;
      }
    }
  }
}
