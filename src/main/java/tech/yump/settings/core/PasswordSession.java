package tech.yump.settings.core;

import java.util.HashSet;
import java.util.Set;
import javax.crypto.SecretKey;
import tech.yump.settings.crypto.EncryptionService;

/**
 * The in-memory password of one settings document, handed to every encrypt and
 * decrypt call made on that document's behalf. Never persisted.
 * <p>
 * The derived key is computed on first use and kept for the life of the session.
 * The session also remembers the ciphertexts it produced and that are still held in
 * fields, so a value that is already in its stored form is not encrypted a second time.
 */
public final class PasswordSession {

  private static final PasswordSession LOCKED = new PasswordSession(null, null);

  private final String password;
  private final EncryptionService encryptionService;
  private final Set<String> issuedCiphertexts = new HashSet<>();
  private SecretKey key;

  private PasswordSession(String password, EncryptionService encryptionService) {
    this.password = password;
    this.encryptionService = encryptionService;
  }

  public static PasswordSession locked() {
    return LOCKED;
  }

  static PasswordSession unlocked(String password, EncryptionService encryptionService) {
    return new PasswordSession(password, encryptionService);
  }

  public boolean isUnlocked() {
    return password != null;
  }

  /**
   * @throws SettingsLockedException if no password is held.
   */
  public String encrypt(String plaintext) {
    String ciphertext = encryptionService().encrypt(plaintext, key());
    issuedCiphertexts.add(ciphertext);
    return ciphertext;
  }

  /**
   * @throws SettingsLockedException                    if no password is held.
   * @throws EncryptionService.DecryptionException if the value cannot be decrypted with this password.
   */
  public String decrypt(String ciphertext) {
    return encryptionService().decrypt(ciphertext, key());
  }

  /**
   * @return true if {@code value} is a ciphertext this session produced.
   */
  public boolean isIssuedCiphertext(String value) {
    return issuedCiphertexts.contains(value);
  }

  /**
   * Forgets every issued ciphertext not in {@code held}. Called after each encryption pass
   * with the ciphertexts the graph holds at its end.
   */
  public void retainIssuedCiphertexts(Set<String> held) {
    issuedCiphertexts.retainAll(held);
  }

  private EncryptionService encryptionService() {
    requireUnlocked();
    return encryptionService;
  }

  private synchronized SecretKey key() {
    requireUnlocked();
    if (key == null) {
      key = encryptionService.deriveKey(password);
    }
    return key;
  }

  private void requireUnlocked() {
    if (!isUnlocked()) {
      throw new SettingsLockedException("Settings are locked. Cannot process encrypted values without a password.");
    }
  }
}
