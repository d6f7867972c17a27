package com.scholary.talkingpet.error;

/** Speech text exceeds the configured character limit. Raised before any provider call. */
public class TextTooLongException extends ValidationRejectedException {

  private final int length;
  private final int maxChars;

  public TextTooLongException(int length, int maxChars) {
    super(
        "text_too_long",
        String.format(
            "Text too long (%d chars, max %d). Please shorten your script.", length, maxChars));
    this.length = length;
    this.maxChars = maxChars;
  }

  public int length() {
    return length;
  }

  public int maxChars() {
    return maxChars;
  }
}
