package com.scholary.talkingpet.pipeline;

/**
 * Who the work is done for, as established by the authentication layer in front of us.
 *
 * @param userId the caller's user id (a UUID), or null for anonymous use
 */
public record CallerScope(String userId) {

  private static final CallerScope ANONYMOUS = new CallerScope(null);

  public static CallerScope anonymous() {
    return ANONYMOUS;
  }

  public static CallerScope of(String userId) {
    return userId == null || userId.isBlank() ? ANONYMOUS : new CallerScope(userId);
  }
}
