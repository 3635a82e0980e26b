package tech.yump.settings.prompt;

/**
 * Interactive input used by the password gate and the settings shell.
 * Reads block the calling thread; there is no timeout.
 */
public interface PasswordPrompt {

  /**
   * Shows a line of text to the user.
   */
  void show(String message);

  /**
   * Reads one visible line.
   *
   * @param prompt Text printed before the cursor.
   */
  PromptResponse readLine(String prompt);

  /**
   * Reads one line without echoing the typed characters.
   *
   * @param prompt Text printed before the cursor.
   */
  PromptResponse readSecret(String prompt);
}
