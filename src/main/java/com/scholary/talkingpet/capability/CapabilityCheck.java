package com.scholary.talkingpet.capability;

/**
 * Outcome of {@link ModelCapabilityRegistry#validate}: either accepted, or rejected with a reason
 * that can be shown to the caller as is.
 */
public record CapabilityCheck(boolean accepted, String reason) {

  private static final CapabilityCheck OK = new CapabilityCheck(true, null);

  public static CapabilityCheck ok() {
    return OK;
  }

  public static CapabilityCheck rejected(String reason) {
    return new CapabilityCheck(false, reason);
  }
}
