package com.scholary.talkingpet.error;

/** Transport failure or 5xx from a provider. The only failure eligible for bounded retry. */
public class ProviderUnavailableException extends GenerationException {

  private final String provider;

  public ProviderUnavailableException(String provider, String message) {
    super("provider_unavailable", Fault.PROVIDER, message);
    this.provider = provider;
  }

  public ProviderUnavailableException(String provider, String message, Throwable cause) {
    super("provider_unavailable", Fault.PROVIDER, message, cause);
    this.provider = provider;
  }

  public String provider() {
    return provider;
  }
}
