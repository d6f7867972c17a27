package com.scholary.talkingpet.video;

import java.util.Locale;

/**
 * Lifecycle of a provider-side video job.
 *
 * <p>{@code QUEUED -> PROCESSING -> {SUCCEEDED, FAILED, CANCELED}}. A job may also jump straight
 * from {@code QUEUED} to a terminal state if it finishes between two polls.
 */
public enum VideoJobStatus {
  QUEUED(false),
  PROCESSING(false),
  SUCCEEDED(true),
  FAILED(true),
  CANCELED(true);

  private final boolean terminal;

  VideoJobStatus(boolean terminal) {
    this.terminal = terminal;
  }

  public boolean isTerminal() {
    return terminal;
  }

  /** Whether moving from this status to {@code next} is a legal forward transition. */
  public boolean canTransitionTo(VideoJobStatus next) {
    if (terminal) {
      return false;
    }
    return next.ordinal() >= ordinal();
  }

  /**
   * Map a provider status string.
   *
   * <p>Unknown values are treated as still processing so the poller keeps asking rather than
   * guessing at a terminal outcome.
   */
  public static VideoJobStatus fromProvider(String status) {
    if (status == null) {
      return PROCESSING;
    }
    switch (status.trim().toLowerCase(Locale.ROOT)) {
      case "starting":
      case "queued":
      case "pending":
        return QUEUED;
      case "processing":
      case "running":
        return PROCESSING;
      case "succeeded":
      case "done":
        return SUCCEEDED;
      case "failed":
      case "error":
        return FAILED;
      case "canceled":
      case "cancelled":
        return CANCELED;
      default:
        return PROCESSING;
    }
  }
}
