package tech.yump.settings.prompt;

/**
 * Result of one interactive read: either a value or a cancellation (end of input).
 *
 * @param value     The text read; null when cancelled.
 * @param cancelled true when the input source was closed before a line was entered.
 */
public record PromptResponse(String value, boolean cancelled) {

  public static PromptResponse of(String value) {
    return new PromptResponse(value == null ? "" : value, false);
  }

  public static PromptResponse cancelledResponse() {
    return new PromptResponse(null, true);
  }

  /**
   * @return true when a value was read and it is empty or whitespace only.
   */
  public boolean isBlank() {
    return !cancelled && value.isBlank();
  }
}
