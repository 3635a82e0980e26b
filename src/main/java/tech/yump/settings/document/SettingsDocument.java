package tech.yump.settings.document;

import com.fasterxml.jackson.annotation.JsonIgnoreType;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tech.yump.settings.core.GateState;
import tech.yump.settings.core.NestedSettings;
import tech.yump.settings.core.PasswordGate;
import tech.yump.settings.core.SettingsValidationException;
import tech.yump.settings.core.VisitedSet;
import tech.yump.settings.descriptor.SettingsDescriptor;
import tech.yump.settings.storage.StorageException;

/**
 * Base class of every persisted settings record. Subclasses declare their settings as
 * instance fields; fields marked {@link tech.yump.settings.descriptor.Encrypted} are stored
 * as ciphertext and need a password.
 * <p>
 * A subclass must call {@link #open()} as the last statement of its constructor:
 * <pre>{@code
 * public class AppSettings extends SettingsDocument {
 *   private int retries = 3;
 *   @Encrypted
 *   private String apiKey;
 *
 *   public AppSettings(SettingsContext context, String directory, String password) {
 *     super(context, directory, "app", password);
 *     open();
 *   }
 * }
 * }</pre>
 * Field initializers run after the base constructor, so values loaded there would be
 * overwritten; {@code open()} runs once they are in place.
 * <p>
 * After {@link #save()} encrypted fields hold their ciphertext; call {@link #load()} to see
 * plaintext again. An instance has a single owning thread.
 */
@Slf4j
@JsonIgnoreType
public abstract class SettingsDocument implements NestedSettings {

  private static final String FILE_SUFFIX = ".json";

  private final transient SettingsContext context;
  private final transient PasswordGate gate;
  private final transient String initialPassword;
  @Getter
  private final transient String directory;
  @Getter
  private final transient String fileName;
  @Getter
  private final transient Path filePath;
  private transient boolean opened;

  protected SettingsDocument(String directory, String fileName) {
    this(SettingsContext.defaults(), directory, fileName, null);
  }

  protected SettingsDocument(SettingsContext context, String directory, String fileName) {
    this(context, directory, fileName, null);
  }

  /**
   * @param context   Shared collaborators.
   * @param directory Directory holding the settings file; created on first save.
   * @param fileName  File name without path; {@code .json} is appended when missing.
   * @param password  Password for encrypted fields, or null to prompt when one is needed.
   * @throws SettingsValidationException if an argument is malformed or the subclass declares
   *                                     an illegal field.
   */
  protected SettingsDocument(SettingsContext context, String directory, String fileName, String password) {
    if (context == null) {
      throw new SettingsValidationException("Settings context must not be null.");
    }
    this.context = context;
    this.directory = validateDirectory(directory);
    this.fileName = normalizeFileName(fileName);
    this.filePath = resolve(this.directory, this.fileName);
    this.initialPassword = password;

    boolean encryptionNeeded = SettingsDescriptor.hasAnyEncryptedField(getClass());
    this.gate = new PasswordGate(context.getEncryptionService(), context.getPrompt(), encryptionNeeded);
    log.debug("Settings document {} bound to {} (encryption {}).", getClass().getSimpleName(), filePath,
        encryptionNeeded ? "enabled" : "not needed");
  }

  /**
   * Reads the stored hash, runs the password gate and loads the stored values. When the
   * user creates a new password here the document is saved straight away, so the file
   * carries the hash before the caller changes anything.
   *
   * @throws IllegalStateException           if called twice.
   * @throws tech.yump.settings.core.SettingsAuthenticationException if the password is rejected.
   * @throws SettingsParseException          if the file is not a JSON object.
   */
  protected final void open() {
    if (opened) {
      throw new IllegalStateException("Settings document " + filePath + " is already open.");
    }
    opened = true;

    Optional<Map<String, JsonNode>> stored = context.getPersistence().read(filePath);
    boolean[] passwordCreated = {false};
    gate.unlock(initialPassword, stored.map(context.getPersistence()::storedPasswordHash).orElse(null),
        () -> passwordCreated[0] = true);
    stored.ifPresent(properties -> context.getPersistence().apply(this, properties, gate.getSession()));

    if (passwordCreated[0]) {
      log.info("New password created for {}; saving settings.", filePath);
      if (!save()) {
        log.warn("Settings {} were not fully saved after the password was created.", filePath);
      }
      load();
    }
  }

  /**
   * Encrypts, writes this document and saves every nested document it reaches.
   *
   * @return false if writing failed; the error is logged.
   * @throws tech.yump.settings.core.SettingsLockedException if an encrypted field is set but no password is held.
   */
  public boolean save() {
    return save(new VisitedSet());
  }

  @Override
  public boolean save(VisitedSet visited) {
    if (!visited.add(this)) {
      log.debug("{} already saved in this pass.", filePath);
      return true;
    }
    return context.getPersistence().save(this, filePath, gate.getPasswordHash(), gate.getSession(), visited);
  }

  /**
   * Re-reads the file with the password already held, prompting if none is held yet.
   */
  public void load() {
    load(null);
  }

  /**
   * Re-reads the file. A supplied password is verified against the stored hash before any
   * field is decrypted. Fields missing from the file keep their current values.
   *
   * @throws tech.yump.settings.core.SettingsAuthenticationException if the password does not verify.
   * @throws SettingsParseException if the file is not a JSON object.
   */
  public void load(String password) {
    Optional<Map<String, JsonNode>> stored = context.getPersistence().read(filePath);
    gate.unlock(password, stored.map(context.getPersistence()::storedPasswordHash).orElse(null), null);
    stored.ifPresent(properties -> context.getPersistence().apply(this, properties, gate.getSession()));
  }

  /**
   * Overwrites and removes the settings file. In-memory values are kept.
   *
   * @return true if a file was deleted.
   */
  public boolean delete() {
    try {
      boolean deleted = context.getFileStore().secureDelete(filePath);
      if (deleted) {
        log.info("Settings file {} deleted.", filePath);
      }
      return deleted;
    } catch (StorageException e) {
      log.error("Failed to delete settings file {}: {}", filePath, e.getMessage(), e);
      return false;
    }
  }

  public GateState getGateState() {
    return gate.getState();
  }

  public String getPasswordHash() {
    return gate.getPasswordHash();
  }

  private static String validateDirectory(String directory) {
    if (directory == null || directory.isBlank()) {
      throw new SettingsValidationException("Settings directory must not be blank.");
    }
    return directory;
  }

  private static String normalizeFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      throw new SettingsValidationException("Settings file name must not be blank.");
    }
    if (fileName.contains("/") || fileName.contains("\\") || fileName.contains("..")) {
      throw new SettingsValidationException("Settings file name must not contain a path: '" + fileName + "'.");
    }
    String trimmed = fileName.trim();
    return trimmed.toLowerCase(Locale.ROOT).endsWith(FILE_SUFFIX) ? trimmed : trimmed + FILE_SUFFIX;
  }

  private static Path resolve(String directory, String fileName) {
    try {
      return Paths.get(directory).resolve(fileName);
    } catch (InvalidPathException e) {
      throw new SettingsValidationException("Invalid settings path: " + e.getMessage(), e);
    }
  }
}
