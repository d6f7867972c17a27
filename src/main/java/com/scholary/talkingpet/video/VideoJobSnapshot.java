package com.scholary.talkingpet.video;

import java.util.List;

/**
 * One observation of a provider job, as returned by a create or status call.
 *
 * @param providerJobId the provider's id
 * @param status mapped status
 * @param outputUrls output references; providers return either one URL or a list
 * @param error provider error message, if any
 * @param logs provider logs, if any
 */
public record VideoJobSnapshot(
    String providerJobId,
    VideoJobStatus status,
    List<String> outputUrls,
    String error,
    String logs) {

  public VideoJobSnapshot {
    outputUrls = outputUrls == null ? List.of() : List.copyOf(outputUrls);
  }

  /** The canonical output: the first entry, or null when there is none. */
  public String firstOutput() {
    return outputUrls.isEmpty() ? null : outputUrls.get(0);
  }
}
