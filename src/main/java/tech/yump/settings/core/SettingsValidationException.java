package tech.yump.settings.core;

/**
 * Malformed arguments or settings type declarations, detected before any I/O happens.
 */
public class SettingsValidationException extends RuntimeException {

  public SettingsValidationException(String message) {
    super(message);
  }

  public SettingsValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
