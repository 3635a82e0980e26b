package tech.yump.settings.document;

/**
 * A settings file exists but is not a JSON object. Loading stops; the document keeps
 * whatever values it had and the file is left untouched for inspection.
 */
public class SettingsParseException extends RuntimeException {

  public SettingsParseException(String message) {
    super(message);
  }

  public SettingsParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
