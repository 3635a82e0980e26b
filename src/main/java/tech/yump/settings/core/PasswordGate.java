package tech.yump.settings.core;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tech.yump.settings.crypto.EncryptionService;
import tech.yump.settings.prompt.PasswordPrompt;
import tech.yump.settings.prompt.PromptResponse;

/**
 * Decides whether a settings document needs a password and, if so, obtains one.
 * <p>
 * A password supplied by the caller is checked against the stored hash; without a
 * supplied password the user is prompted, either for the existing password (repeated
 * until it verifies, with no attempt limit) or for a new one with confirmation. Creating
 * a new password runs the {@code onPasswordCreated} callback; the owning document answers
 * it with an immediate save, so the hash reaches disk before the caller sets any field.
 */
@Slf4j
public class PasswordGate {

  static final String ENTER_PROMPT = "> ";
  static final String CONFIRM_PROMPT = "Re-enter password to confirm: ";

  private final EncryptionService encryptionService;
  private final PasswordPrompt prompt;

  @Getter
  private GateState state;
  @Getter
  private String passwordHash;
  private PasswordSession session = PasswordSession.locked();

  public PasswordGate(EncryptionService encryptionService, PasswordPrompt prompt, boolean encryptionNeeded) {
    this.encryptionService = encryptionService;
    this.prompt = prompt;
    this.state = encryptionNeeded ? GateState.NEED_PASSWORD : GateState.NO_ENCRYPTION_NEEDED;
  }

  /**
   * @return The current session; a locked session unless the state is {@link GateState#UNLOCKED}.
   */
  public PasswordSession getSession() {
    return session;
  }

  /**
   * Takes over the hash found on disk so it is written back on the next save. A hash that
   * differs from the one the gate already holds locks the gate again: the current session
   * was opened for another password.
   */
  public void adoptStoredHash(String storedHash) {
    if (storedHash == null || storedHash.isBlank() || storedHash.equals(passwordHash)) {
      return;
    }
    if (passwordHash != null && state == GateState.UNLOCKED) {
      log.info("Stored password hash changed on disk. Encrypted fields are LOCKED again.");
      session = PasswordSession.locked();
      state = GateState.NEED_PASSWORD;
    }
    passwordHash = storedHash;
  }

  /**
   * Runs the gate.
   *
   * @param suppliedPassword  Password given by the caller, or null to ask interactively.
   * @param storedHash        Hash read from the settings file, or null if there is none.
   * @param onPasswordCreated Invoked once after a new password was created interactively.
   * @throws SettingsAuthenticationException if the supplied password does not verify,
   *                                         or the user cancels password entry.
   * @throws SettingsValidationException     if the supplied password is empty.
   */
  public void unlock(String suppliedPassword, String storedHash, Runnable onPasswordCreated) {
    adoptStoredHash(storedHash);
    if (state == GateState.NO_ENCRYPTION_NEEDED) {
      log.debug("No encrypted fields; password gate skipped.");
      return;
    }

    if (suppliedPassword != null) {
      unlockWithSupplied(suppliedPassword);
      return;
    }
    if (state == GateState.UNLOCKED) {
      return;
    }

    prompt.show("Encryption is enabled for these settings.");
    if (passwordHash != null) {
      promptForExistingPassword();
    } else {
      promptForNewPassword(onPasswordCreated);
    }
  }

  private void unlockWithSupplied(String suppliedPassword) {
    if (suppliedPassword.isEmpty()) {
      throw new SettingsValidationException("Encryption password must not be empty.");
    }
    if (passwordHash != null) {
      if (!encryptionService.verifyPassword(suppliedPassword, passwordHash)) {
        log.warn("Supplied encryption password does not match the stored hash.");
        throw new SettingsAuthenticationException("Invalid encryption password provided.");
      }
    } else {
      log.info("No stored password hash found. Accepting the supplied password as the initial password.");
      passwordHash = encryptionService.hashPassword(suppliedPassword);
    }
    open(suppliedPassword);
  }

  private void promptForExistingPassword() {
    prompt.show("Please enter the encryption password:");
    while (true) {
      String input = readSecret(ENTER_PROMPT);
      if (input.isBlank()) {
        prompt.show("Password cannot be empty.");
        continue;
      }
      if (encryptionService.verifyPassword(input, passwordHash)) {
        open(input);
        prompt.show("Password accepted.");
        return;
      }
      log.debug("Incorrect password entered; asking again.");
      prompt.show("Incorrect password. Try again.");
    }
  }

  private void promptForNewPassword(Runnable onPasswordCreated) {
    prompt.show("Please create a new encryption password:");
    while (true) {
      String first = readSecret(ENTER_PROMPT);
      if (first.isBlank()) {
        prompt.show("Password cannot be empty.");
        continue;
      }
      String confirmation = readSecret(CONFIRM_PROMPT);
      if (!first.equals(confirmation)) {
        prompt.show("Passwords do not match. Please try again.");
        continue;
      }

      passwordHash = encryptionService.hashPassword(first);
      open(first);
      log.info("New encryption password created.");
      if (onPasswordCreated != null) {
        onPasswordCreated.run();
      }
      prompt.show("Encryption password set successfully.");
      return;
    }
  }

  private String readSecret(String promptText) {
    PromptResponse response = prompt.readSecret(promptText);
    if (response.cancelled()) {
      log.warn("Password entry was cancelled.");
      throw new SettingsAuthenticationException("Password entry was cancelled.");
    }
    return response.value();
  }

  private void open(String password) {
    session = PasswordSession.unlocked(password, encryptionService);
    state = GateState.UNLOCKED;
    log.info("Settings password accepted. Encrypted fields are UNLOCKED.");
  }
}
