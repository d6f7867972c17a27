package com.scholary.talkingpet.video;

import java.time.Instant;
import java.util.Locale;

/**
 * Local view of a submitted video job.
 *
 * <p>Created on submission and mutated only by the poller through {@link #apply}. Once the status
 * is terminal the handle is frozen and later observations are ignored.
 */
public class VideoJobHandle {

  private final String providerJobId;
  private final String modelId;
  private final Instant submittedAt;

  private volatile VideoJobStatus status;
  private volatile String outputUrl;
  private volatile String errorDetail;
  private volatile int pollCount;

  public VideoJobHandle(String providerJobId, String modelId, VideoJobStatus status) {
    this.providerJobId = providerJobId;
    this.modelId = modelId;
    this.status = status;
    this.submittedAt = Instant.now();
  }

  /**
   * Fold a provider observation into the handle.
   *
   * @return true if the status changed
   */
  public synchronized boolean apply(VideoJobSnapshot snapshot) {
    pollCount++;
    if (status.isTerminal()) {
      return false;
    }

    VideoJobStatus next = snapshot.status();
    if (!status.canTransitionTo(next)) {
      return false;
    }

    boolean changed = next != status;
    status = next;
    if (next == VideoJobStatus.SUCCEEDED) {
      outputUrl = snapshot.firstOutput();
    } else if (next.isTerminal()) {
      errorDetail = describeFailure(snapshot);
    }
    return changed;
  }

  private static String describeFailure(VideoJobSnapshot snapshot) {
    StringBuilder detail = new StringBuilder();
    if (snapshot.error() != null && !snapshot.error().isBlank()) {
      detail.append(snapshot.error());
    }
    if (snapshot.logs() != null && !snapshot.logs().isBlank()) {
      if (detail.length() > 0) {
        detail.append(" | logs: ");
      }
      detail.append(snapshot.logs().strip());
    }
    if (detail.length() == 0) {
      detail
          .append("job ")
          .append(snapshot.status().name().toLowerCase(Locale.ROOT))
          .append(" without detail");
    }
    return detail.toString();
  }

  public String getProviderJobId() {
    return providerJobId;
  }

  public String getModelId() {
    return modelId;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public VideoJobStatus getStatus() {
    return status;
  }

  public String getOutputUrl() {
    return outputUrl;
  }

  public String getErrorDetail() {
    return errorDetail;
  }

  public int getPollCount() {
    return pollCount;
  }
}
