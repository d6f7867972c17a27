package com.scholary.talkingpet.error;

/**
 * Base class for every failure a generation workflow can report.
 *
 * <p>Runtime exception because the failures surface through {@link
 * java.util.concurrent.CompletableFuture} chains, where checked exceptions can't travel. Each
 * subclass carries a stable {@link #code()} and a {@link Fault} so callers can tell a bad request
 * from a provider outage from an internal error.
 */
public abstract class GenerationException extends RuntimeException {

  private final String code;
  private final Fault fault;

  protected GenerationException(String code, Fault fault, String message) {
    super(message);
    this.code = code;
    this.fault = fault;
  }

  protected GenerationException(String code, Fault fault, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.fault = fault;
  }

  public String code() {
    return code;
  }

  public Fault fault() {
    return fault;
  }
}
