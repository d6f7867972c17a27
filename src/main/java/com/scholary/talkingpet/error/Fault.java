package com.scholary.talkingpet.error;

/** Who is to blame when a workflow fails. */
public enum Fault {
  CALLER,
  PROVIDER,
  INTERNAL
}
