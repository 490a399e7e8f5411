package com.codeheadsystems.tether.server.crypto;

/**
 * A token as it is stored: ciphertext produced by {@link TokenCipher}. The connection store
 * only accepts this type, so plaintext cannot be persisted by accident.
 *
 * @param value the serialized ciphertext, {@code v<version>:<ivHex>:<ciphertextHex>}
 */
public record EncryptedToken(String value) {

  /**
   * Instantiates a new Encrypted token.
   */
  public EncryptedToken {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Encrypted token value must not be blank");
    }
  }

  @Override
  public String toString() {
    return "EncryptedToken[" + value.length() + " chars]";
  }
}
