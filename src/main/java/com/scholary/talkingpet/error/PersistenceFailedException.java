package com.scholary.talkingpet.error;

/** The result row could not be written. Always triggers rollback of the request's uploads. */
public class PersistenceFailedException extends GenerationException {

  public PersistenceFailedException(String message, Throwable cause) {
    super("persistence_failed", Fault.INTERNAL, message, cause);
  }
}
