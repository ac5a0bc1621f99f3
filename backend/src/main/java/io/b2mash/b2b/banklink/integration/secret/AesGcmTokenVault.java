package io.b2mash.b2b.banklink.integration.secret;

import io.b2mash.b2b.banklink.exception.IntegrationNotConfiguredException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM token vault. Ciphertexts are {@code Base64(iv || ciphertext || tag)} with a fresh
 * 96-bit IV per call.
 *
 * <p>A malformed key fails construction (and so application startup). A missing key leaves the
 * vault unusable: every call throws {@link IntegrationNotConfiguredException}.
 */
@Component
public class AesGcmTokenVault implements TokenVault {

  private static final Logger log = LoggerFactory.getLogger(AesGcmTokenVault.class);

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes (96 bits)
  private static final int KEY_LENGTH = 32; // bytes (256 bits)

  private final SecretKeySpec encryptionKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public AesGcmTokenVault(@Value("${banking.encryption-key:}") String encodedKey) {
    if (encodedKey == null || encodedKey.isBlank()) {
      log.warn("BANKING_ENCRYPTION_KEY is not set; banking credentials cannot be stored");
      this.encryptionKey = null;
      return;
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(encodedKey.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("BANKING_ENCRYPTION_KEY is not valid Base64", e);
    }
    if (keyBytes.length != KEY_LENGTH) {
      throw new IllegalStateException(
          "BANKING_ENCRYPTION_KEY must be a Base64-encoded 256-bit (32-byte) key. Got "
              + keyBytes.length
              + " bytes.");
    }
    this.encryptionKey = new SecretKeySpec(keyBytes, "AES");
  }

  @Override
  public String encrypt(String plaintext) {
    requireKey();
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      byte[] out =
          ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext).array();
      return Base64.getEncoder().encodeToString(out);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  @Override
  public String decrypt(String ciphertext) {
    requireKey();
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(ciphertext);
    } catch (IllegalArgumentException e) {
      throw new IntegrityException("Stored credential is not valid Base64", e);
    }
    if (raw.length < IV_LENGTH + GCM_TAG_LENGTH / 8) {
      throw new IntegrityException("Stored credential is truncated");
    }
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(
          Cipher.DECRYPT_MODE,
          encryptionKey,
          new GCMParameterSpec(GCM_TAG_LENGTH, raw, 0, IV_LENGTH));
      byte[] plaintext = cipher.doFinal(raw, IV_LENGTH, raw.length - IV_LENGTH);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (AEADBadTagException e) {
      log.error("Stored credential failed authentication-tag verification");
      throw new IntegrityException("Stored credential failed integrity verification", e);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Decryption failed", e);
    }
  }

  private void requireKey() {
    if (encryptionKey == null) {
      throw new IntegrationNotConfiguredException(
          "Banking credential encryption key is not configured");
    }
  }
}
