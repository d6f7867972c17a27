package com.scholary.talkingpet.error;

/**
 * A remote provider explicitly declined the call (auth, quota, invalid voice id, malformed
 * payload). The provider's own message is kept verbatim in {@link #detail()}.
 */
public class ProviderRejectedException extends GenerationException {

  private final String provider;
  private final int statusCode;
  private final String detail;

  public ProviderRejectedException(String provider, int statusCode, String detail) {
    this("provider_rejected", provider, statusCode, detail);
  }

  protected ProviderRejectedException(
      String code, String provider, int statusCode, String detail) {
    this(
        code,
        provider,
        statusCode,
        detail,
        String.format("%s rejected the request (status %d): %s", provider, statusCode, detail));
  }

  protected ProviderRejectedException(
      String code, String provider, int statusCode, String detail, String message) {
    super(code, Fault.PROVIDER, message);
    this.provider = provider;
    this.statusCode = statusCode;
    this.detail = detail;
  }

  public String provider() {
    return provider;
  }

  /** HTTP status returned by the provider, or 0 when the rejection came from a job status. */
  public int statusCode() {
    return statusCode;
  }

  public String detail() {
    return detail;
  }
}
