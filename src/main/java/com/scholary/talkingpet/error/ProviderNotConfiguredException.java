package com.scholary.talkingpet.error;

/** A provider client is missing its credentials. A deployment problem, never retried. */
public class ProviderNotConfiguredException extends GenerationException {

  private final String provider;

  public ProviderNotConfiguredException(String provider, String message) {
    super("provider_not_configured", Fault.INTERNAL, message);
    this.provider = provider;
  }

  public String provider() {
    return provider;
  }
}
