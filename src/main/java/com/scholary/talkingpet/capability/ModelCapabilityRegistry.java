package com.scholary.talkingpet.capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Static table of the video models we know how to drive.
 *
 * <p>Built once at construction and never mutated, so a single instance is shared by every request
 * without locking. All methods are pure lookups.
 */
@Component
public class ModelCapabilityRegistry {

  public static final String HAILUO = "minimax/hailuo-02";
  public static final String SEEDANCE = "bytedance/seedance-1-lite";
  public static final String KLING = "kwaivgi/kling-v2.1";
  public static final String OMNI_HUMAN = "bytedance/omni-human";

  static final String UNSUPPORTED_MODEL = "unsupported model";
  static final String REQUIRES_SPEECH = "model requires paired speech input";
  static final String UNSUPPORTED_RESOLUTION = "unsupported resolution";

  private static final Pattern LINES_PATTERN = Pattern.compile("^(\\d+)p$");

  private final Map<String, ModelCapability> capabilities;
  private final String defaultModelId;

  public ModelCapabilityRegistry() {
    this(defaultCatalog(), HAILUO);
  }

  public ModelCapabilityRegistry(List<ModelCapability> catalog, String defaultModelId) {
    Map<String, ModelCapability> byId = new LinkedHashMap<>();
    for (ModelCapability capability : catalog) {
      if (byId.putIfAbsent(capability.modelId(), capability) != null) {
        throw new IllegalArgumentException("Duplicate model id: " + capability.modelId());
      }
    }
    if (!byId.containsKey(defaultModelId)) {
      throw new IllegalArgumentException("Default model not in catalog: " + defaultModelId);
    }
    this.capabilities = Collections.unmodifiableMap(byId);
    this.defaultModelId = defaultModelId;
  }

  private static List<ModelCapability> defaultCatalog() {
    List<ModelCapability> catalog = new ArrayList<>();
    catalog.add(
        new ModelCapability(
            HAILUO, "Hailuo 02", false, true, false, Set.of("512p", "768p", "1080p"), 6, null));
    catalog.add(
        new ModelCapability(
            SEEDANCE,
            "Seedance 1 Lite",
            false,
            true,
            false,
            Set.of("480p", "720p", "1080p"),
            5,
            null));
    catalog.add(
        new ModelCapability(
            KLING, "Kling v2.1", false, true, false, Set.of("720p", "768p", "1080p"), 5, "1080p"));
    catalog.add(
        new ModelCapability(
            OMNI_HUMAN, "OmniHuman", true, false, true, Set.of("720p"), 5, null));
    return catalog;
  }

  /**
   * Check whether a model can serve a request.
   *
   * @param modelId model to use
   * @param wantsAudio whether the workflow pairs the video with a speech track
   * @param resolution requested output resolution
   * @return {@link CapabilityCheck#ok()} or a rejection with the reason
   */
  public CapabilityCheck validate(String modelId, boolean wantsAudio, String resolution) {
    ModelCapability capability = capabilities.get(modelId);
    if (capability == null) {
      return CapabilityCheck.rejected(UNSUPPORTED_MODEL);
    }
    if (capability.requiresAudioInput() && !wantsAudio) {
      return CapabilityCheck.rejected(REQUIRES_SPEECH);
    }
    if (!capability.supportsResolution(resolution)) {
      return CapabilityCheck.rejected(UNSUPPORTED_RESOLUTION);
    }
    return CapabilityCheck.ok();
  }

  /**
   * Whether the requested resolution switches the model into its higher-fidelity mode.
   *
   * <p>Derived only, never user-settable. False for unknown models and for models with no
   * threshold.
   */
  public boolean isProMode(String modelId, String resolution) {
    ModelCapability capability = capabilities.get(modelId);
    if (capability == null || capability.proModeThreshold() == null) {
      return false;
    }
    int requested = lines(resolution);
    return requested > 0 && requested >= lines(capability.proModeThreshold());
  }

  public Optional<ModelCapability> find(String modelId) {
    return Optional.ofNullable(capabilities.get(modelId));
  }

  public ModelCapability defaultModel() {
    return capabilities.get(defaultModelId);
  }

  public String defaultModelId() {
    return defaultModelId;
  }

  /** Every capability, in catalog order. */
  public List<ModelCapability> catalog() {
    return List.copyOf(capabilities.values());
  }

  private static int lines(String resolution) {
    if (resolution == null) {
      return -1;
    }
    Matcher matcher = LINES_PATTERN.matcher(resolution.trim());
    return matcher.matches() ? Integer.parseInt(matcher.group(1)) : -1;
  }
}
