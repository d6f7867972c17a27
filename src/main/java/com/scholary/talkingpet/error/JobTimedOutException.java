package com.scholary.talkingpet.error;

import java.time.Duration;

/**
 * The video job never reached a terminal state within the allowed window. Distinct from {@link
 * JobFailedException}: the provider did not say no, it just never answered.
 */
public class JobTimedOutException extends GenerationException {

  private final String providerJobId;
  private final Duration timeout;

  public JobTimedOutException(String providerJobId, Duration timeout) {
    super(
        "job_timed_out",
        Fault.PROVIDER,
        String.format(
            "Video job %s did not finish within %ds", providerJobId, timeout.toSeconds()));
    this.providerJobId = providerJobId;
    this.timeout = timeout;
  }

  public String providerJobId() {
    return providerJobId;
  }

  public Duration timeout() {
    return timeout;
  }
}
