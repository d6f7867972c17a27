package com.scholary.talkingpet.error;

/** Object storage could not be reached or failed the operation. */
public class StorageUnavailableException extends GenerationException {

  public StorageUnavailableException(String message, Throwable cause) {
    super("storage_unavailable", Fault.INTERNAL, message, cause);
  }
}
