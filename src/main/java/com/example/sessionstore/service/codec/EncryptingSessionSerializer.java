package com.example.sessionstore.service.codec;

import com.example.sessionstore.domain.entity.SessionData;
import com.example.sessionstore.exception.EncryptionException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * Encrypting codec
 *
 * AES-256-GCM around another serializer. Stored form is Base64(iv || ciphertext || tag).
 */
@Slf4j
public class EncryptingSessionSerializer implements SessionSerializer {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final int KEY_LENGTH_BYTES = 32;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final SessionSerializer delegate;
  private final SecretKey key;

  public EncryptingSessionSerializer(SessionSerializer delegate, SecretKey key) {
    this.delegate = delegate;
    this.key = key;
  }

  /**
   * Builds the codec from a Base64 encoded 256-bit key.
   */
  public static EncryptingSessionSerializer fromBase64Key(SessionSerializer delegate, String keyBase64) {
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(keyBase64);
    } catch (IllegalArgumentException e) {
      throw new EncryptionException("Encryption key is not valid Base64", e);
    }
    if (keyBytes.length != KEY_LENGTH_BYTES) {
      throw new EncryptionException("Invalid key length: expected 256 bits");
    }
    return new EncryptingSessionSerializer(delegate, new SecretKeySpec(keyBytes, "AES"));
  }

  @Override
  public SessionData parse(String text) {
    return delegate.parse(decrypt(text));
  }

  @Override
  public String stringify(SessionData session) {
    return encrypt(delegate.stringify(session));
  }

  private String encrypt(String plaintext) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
      return Base64.getEncoder().encodeToString(combined);
    } catch (Exception e) {
      log.error("Session encryption failed", e);
      throw new EncryptionException("Failed to encrypt session", e);
    }
  }

  private String decrypt(String encryptedData) {
    try {
      byte[] combined = Base64.getDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        throw new EncryptionException("Encrypted session payload is truncated");
      }

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, combined, 0, GCM_IV_LENGTH));
      byte[] decrypted = cipher.doFinal(combined, GCM_IV_LENGTH, combined.length - GCM_IV_LENGTH);
      return new String(decrypted, StandardCharsets.UTF_8);
    } catch (EncryptionException e) {
      throw e;
    } catch (Exception e) {
      log.error("Session decryption failed", e);
      throw new EncryptionException("Failed to decrypt session", e);
    }
  }
}
