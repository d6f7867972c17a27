package com.scholary.talkingpet.error;

/** The video job reached {@code failed} or {@code canceled}. Terminal, not retried. */
public class JobFailedException extends ProviderRejectedException {

  private final String providerJobId;

  public JobFailedException(String provider, String providerJobId, String detail) {
    super(
        "job_failed",
        provider,
        0,
        detail,
        String.format("Video job %s failed at %s: %s", providerJobId, provider, detail));
    this.providerJobId = providerJobId;
  }

  public String providerJobId() {
    return providerJobId;
  }
}
