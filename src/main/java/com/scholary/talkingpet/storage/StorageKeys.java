package com.scholary.talkingpet.storage;

import com.scholary.talkingpet.error.ValidationRejectedException;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Object key layout: {@code <prefix>/<category>/<uuid>.<ext>}.
 *
 * <p>The prefix scopes objects per user ({@code users/<uuid>}) or puts them under {@code
 * anonymous}. A fresh UUID per key means two uploads never collide, retries included.
 */
public final class StorageKeys {

  public static final String ANONYMOUS_PREFIX = "anonymous";

  private static final Pattern CANONICAL_UUID =
      Pattern.compile(
          "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  private StorageKeys() {}

  /**
   * Normalize a caller's user id to its canonical lowercase UUID form.
   *
   * <p>Only the 36 character hyphenated form is accepted. Short forms such as {@code 1-1-1-1-1},
   * which {@link UUID#fromString} would expand, are rejected.
   *
   * @param userId caller's user id, may be null or padded with whitespace
   * @return the canonical id, or null when no user id was given
   * @throws ValidationRejectedException if the user id is not a UUID
   */
  public static String normalizeUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      return null;
    }
    String trimmed = userId.trim();
    if (!CANONICAL_UUID.matcher(trimmed).matches()) {
      throw new ValidationRejectedException("Invalid user id: " + userId);
    }
    return UUID.fromString(trimmed).toString().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve the storage prefix for a caller.
   *
   * @param userId caller's user id, may be null
   * @return {@code anonymous} or {@code users/<normalized uuid>}
   * @throws ValidationRejectedException if the user id is not a UUID
   */
  public static String resolveUserPrefix(String userId) {
    String normalized = normalizeUserId(userId);
    return normalized == null ? ANONYMOUS_PREFIX : "users/" + normalized;
  }

  /** Build a new, unique key under {@code prefix}. */
  public static String buildStorageKey(String prefix, String category, String extension) {
    String ext = extension.startsWith(".") ? extension.substring(1) : extension;
    return String.format("%s/%s/%s.%s", prefix, category, UUID.randomUUID(), ext);
  }
}
