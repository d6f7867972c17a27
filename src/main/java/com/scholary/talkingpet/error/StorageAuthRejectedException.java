package com.scholary.talkingpet.error;

/** Object storage refused our credentials. A deployment problem, not a caller one. */
public class StorageAuthRejectedException extends GenerationException {

  public StorageAuthRejectedException(String message, Throwable cause) {
    super("storage_auth_rejected", Fault.INTERNAL, message, cause);
  }
}
