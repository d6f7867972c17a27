package com.scholary.talkingpet.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Helpers for getting at the real cause of a failed {@code CompletableFuture}. */
public final class Failures {

  private Failures() {}

  /** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Rethrows the unwrapped cause as an unchecked exception. Used by the blocking entry points so
   * callers see a {@link GenerationException} rather than a {@link CompletionException}.
   */
  public static RuntimeException propagate(Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new CompletionException(cause);
  }
}
