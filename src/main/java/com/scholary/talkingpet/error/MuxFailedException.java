package com.scholary.talkingpet.error;

/** ffmpeg could not combine the two streams. Fatal for the request, never retried. */
public class MuxFailedException extends GenerationException {

  public MuxFailedException(String message) {
    super("mux_failed", Fault.INTERNAL, message);
  }

  public MuxFailedException(String message, Throwable cause) {
    super("mux_failed", Fault.INTERNAL, message, cause);
  }
}
