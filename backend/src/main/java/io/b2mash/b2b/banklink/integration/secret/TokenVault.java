package io.b2mash.b2b.banklink.integration.secret;

/**
 * Symmetric authenticated encryption for credentials at rest. Encryption is non-deterministic:
 * encrypting the same plaintext twice yields different ciphertexts.
 */
public interface TokenVault {

  String encrypt(String plaintext);

  /**
   * @throws IntegrityException if the ciphertext was tampered with, truncated, or produced under a
   *     different key
   */
  String decrypt(String ciphertext);
}
