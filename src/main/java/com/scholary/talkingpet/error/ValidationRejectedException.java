package com.scholary.talkingpet.error;

/**
 * The request can never succeed as submitted: bad shape, unsupported model or resolution, audio
 * capability mismatch. Never retried.
 */
public class ValidationRejectedException extends GenerationException {

  public ValidationRejectedException(String message) {
    super("validation_rejected", Fault.CALLER, message);
  }

  protected ValidationRejectedException(String code, String message) {
    super(code, Fault.CALLER, message);
  }
}
