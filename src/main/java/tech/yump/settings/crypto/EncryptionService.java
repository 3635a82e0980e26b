package tech.yump.settings.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * Password based string encryption for settings fields.
 * <p>
 * Keys are derived with PBKDF2-HMAC-SHA256 using the password as its own salt, so the
 * same password always yields the same key and ciphertexts written by one process can be
 * read by the next. Each call to {@link #encrypt} uses a fresh GCM nonce; the stored form
 * is {@code Base64(nonce || ciphertext || tag)}.
 * <p>
 * Password hashes are a plain one-way digest used only to recognise the right password.
 * They are never used as key material.
 */
@Slf4j
public class EncryptionService {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  public static final int DEFAULT_KDF_ITERATIONS = 100_000;

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final String AES = "AES";
  private static final String HASH_ALGORITHM = "SHA-256";
  private static final int TAG_LENGTH_BIT = 128;
  static final int NONCE_LENGTH_BYTE = 12;
  private static final int KEY_LENGTH_BIT = 256;

  @Getter
  private final int kdfIterations;
  private final SecureRandom secureRandom = new SecureRandom();

  public EncryptionService() {
    this(DEFAULT_KDF_ITERATIONS);
  }

  public EncryptionService(int kdfIterations) {
    if (kdfIterations < 1) {
      throw new IllegalArgumentException("Key derivation iterations must be positive.");
    }
    this.kdfIterations = kdfIterations;
  }

  /**
   * Derives the AES-256 key for a password.
   *
   * @param password The password. Must not be null or empty.
   * @return The derived key.
   */
  public SecretKey deriveKey(String password) {
    if (password == null || password.isEmpty()) {
      throw new EncryptionException("Password cannot be null or empty.");
    }
    byte[] passwordBytes = password.getBytes(StandardCharsets.UTF_8);
    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    generator.init(passwordBytes, passwordBytes, kdfIterations);
    byte[] keyBytes = ((KeyParameter) generator.generateDerivedParameters(KEY_LENGTH_BIT)).getKey();
    SecretKey key = new SecretKeySpec(keyBytes, AES);
    Arrays.fill(keyBytes, (byte) 0);
    log.trace("Derived {}-bit key using {} iterations.", KEY_LENGTH_BIT, kdfIterations);
    return key;
  }

  /**
   * Encrypts text with a key derived from {@code password}.
   *
   * @see #encrypt(String, SecretKey)
   */
  public String encrypt(String plaintext, String password) {
    return encrypt(plaintext, deriveKey(password));
  }

  /**
   * Encrypts text with AES-GCM under a fresh random nonce.
   *
   * @param plaintext The text to encrypt. Cannot be null.
   * @param key       An AES key, normally from {@link #deriveKey(String)}.
   * @return Base64 of nonce followed by ciphertext and tag.
   * @throws EncryptionException If the cipher cannot be initialised or run.
   */
  public String encrypt(String plaintext, SecretKey key) {
    if (plaintext == null) {
      throw new EncryptionException("Plaintext cannot be null.");
    }
    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    secureRandom.nextBytes(nonce);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      ByteBuffer byteBuffer = ByteBuffer.allocate(nonce.length + ciphertext.length);
      byteBuffer.put(nonce);
      byteBuffer.put(ciphertext);
      log.trace("Encrypted value into {} bytes.", byteBuffer.capacity());
      return Base64.getEncoder().encodeToString(byteBuffer.array());
    } catch (GeneralSecurityException e) {
      log.error("Encryption failed: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to encrypt value.", e);
    }
  }

  /**
   * Decrypts text with a key derived from {@code password}.
   *
   * @see #decrypt(String, SecretKey)
   */
  public String decrypt(String encoded, String password) {
    return decrypt(encoded, deriveKey(password));
  }

  /**
   * Reverses {@link #encrypt(String, SecretKey)}. The GCM tag makes a wrong key detectable.
   *
   * @param encoded Base64 of nonce, ciphertext and tag.
   * @param key     The AES key.
   * @return The original text.
   * @throws DecryptionException If the input is not valid Base64, is too short, was
   *                             tampered with, or the key is wrong.
   */
  public String decrypt(String encoded, SecretKey key) {
    if (encoded == null) {
      throw new DecryptionException("Invalid input: encrypted value is null.");
    }
    byte[] nonceAndCiphertext;
    try {
      nonceAndCiphertext = Base64.getDecoder().decode(encoded.trim());
    } catch (IllegalArgumentException e) {
      throw new DecryptionException("Invalid input: encrypted value is not valid Base64.", e);
    }
    if (nonceAndCiphertext.length <= NONCE_LENGTH_BYTE) {
      throw new DecryptionException("Invalid input: encrypted value is too short.");
    }

    ByteBuffer bb = ByteBuffer.wrap(nonceAndCiphertext);
    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    bb.get(nonce);
    byte[] ciphertext = new byte[bb.remaining()];
    bb.get(ciphertext);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
    } catch (AEADBadTagException e) {
      throw new DecryptionException("Decryption failed: invalid authentication tag. Wrong password or corrupted value.", e);
    } catch (GeneralSecurityException e) {
      throw new DecryptionException("Failed to decrypt value.", e);
    }
  }

  /**
   * @param password The password to hash.
   * @return Base64 of the SHA-256 digest of the UTF-8 password.
   */
  public String hashPassword(String password) {
    if (password == null) {
      throw new EncryptionException("Password cannot be null.");
    }
    return Base64.getEncoder().encodeToString(digest(password));
  }

  /**
   * Checks a candidate password against a stored hash in constant time.
   *
   * @return false for a null candidate or a malformed hash.
   */
  public boolean verifyPassword(String password, String storedHash) {
    if (password == null || storedHash == null) {
      return false;
    }
    byte[] expected;
    try {
      expected = Base64.getDecoder().decode(storedHash);
    } catch (IllegalArgumentException e) {
      log.warn("Stored password hash is not valid Base64.");
      return false;
    }
    return MessageDigest.isEqual(expected, digest(password));
  }

  private byte[] digest(String password) {
    try {
      return MessageDigest.getInstance(HASH_ALGORITHM).digest(password.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new EncryptionException("SHA-256 is not available.", e);
    }
  }

  /**
   * Runtime exception for encryption errors.
   */
  public static class EncryptionException extends RuntimeException {
    public EncryptionException(String message) {
      super(message);
    }
    public EncryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Raised when a value cannot be decrypted: malformed input, tampering, or a wrong key.
   */
  public static class DecryptionException extends EncryptionException {
    public DecryptionException(String message) {
      super(message);
    }
    public DecryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
