package tech.yump.settings.core;

/**
 * The supplied password does not match the stored hash, or the user abandoned
 * password entry. Never retried automatically.
 */
public class SettingsAuthenticationException extends RuntimeException {

  public SettingsAuthenticationException(String message) {
    super(message);
  }

  public SettingsAuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
