package tech.yump.settings.core;

/**
 * Thrown when an encrypted value is read or written while no password has been
 * unlocked for the owning document. This is a programming error, never a user error.
 */
public class SettingsLockedException extends RuntimeException {
  public SettingsLockedException(String message) {
    super(message);
  }
}
