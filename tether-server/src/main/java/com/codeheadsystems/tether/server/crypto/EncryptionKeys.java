package com.codeheadsystems.tether.server.crypto;

import java.util.Arrays;
import java.util.Optional;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * AES-256 key material for {@link TokenCipher}.
 * <p>
 * New ciphertext is always written with the current key. The previous key, when set, is
 * only used to read ciphertext written before a rotation.
 *
 * @param currentKey      32-byte current key
 * @param currentVersion  version tag written into new ciphertext
 * @param previousKey     32-byte previous key, or null
 * @param previousVersion version of the previous key; ignored when there is none
 */
public record EncryptionKeys(byte[] currentKey, int currentVersion, byte[] previousKey, int previousVersion) {

  /** AES-256 key length. */
  public static final int KEY_BYTES = 32;

  /**
   * Instantiates a new Encryption keys.
   */
  public EncryptionKeys {
    checkKey(currentKey, "current");
    if (previousKey != null) {
      checkKey(previousKey, "previous");
      if (previousVersion == currentVersion) {
        throw new TokenCipherException(TokenCipherException.Code.INVALID_KEY,
            "Previous key version must differ from current version " + currentVersion);
      }
    }
    if (currentVersion < 1) {
      throw new TokenCipherException(TokenCipherException.Code.INVALID_KEY, "Key versions start at 1");
    }
    currentKey = currentKey.clone();
    previousKey = previousKey == null ? null : previousKey.clone();
  }

  /**
   * Parses hex-encoded keys (64 hex characters each).
   *
   * @param currentKeyHex   the current key hex
   * @param currentVersion  the current version
   * @param previousKeyHex  the previous key hex, null or empty for none
   * @param previousVersion the previous version
   * @return the encryption keys
   */
  public static EncryptionKeys fromHex(String currentKeyHex, int currentVersion,
                                       String previousKeyHex, int previousVersion) {
    byte[] previous = previousKeyHex == null || previousKeyHex.isEmpty() ? null : decode(previousKeyHex, "previous");
    return new EncryptionKeys(decode(currentKeyHex, "current"), currentVersion, previous, previousVersion);
  }

  /**
   * A single key with version 1 and nothing to rotate from.
   *
   * @param currentKeyHex the current key hex
   * @return the encryption keys
   */
  public static EncryptionKeys single(String currentKeyHex) {
    return fromHex(currentKeyHex, 1, null, 0);
  }

  /**
   * The key for a version.
   *
   * @param version the version
   * @return the key, or empty if no key with that version is configured
   */
  public Optional<byte[]> keyFor(int version) {
    if (version == currentVersion) {
      return Optional.of(currentKey);
    }
    if (previousKey != null && version == previousVersion) {
      return Optional.of(previousKey);
    }
    return Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EncryptionKeys other
        && currentVersion == other.currentVersion
        && previousVersion == other.previousVersion
        && Arrays.equals(currentKey, other.currentKey)
        && Arrays.equals(previousKey, other.previousKey);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(currentKey) + currentVersion;
  }

  @Override
  public String toString() {
    return "EncryptionKeys[currentVersion=" + currentVersion
        + ", previousVersion=" + (previousKey == null ? "none" : previousVersion) + "]";
  }

  private static byte[] decode(String hex, String which) {
    if (hex == null || hex.length() != KEY_BYTES * 2) {
      throw new TokenCipherException(TokenCipherException.Code.INVALID_KEY,
          "The " + which + " key must be " + (KEY_BYTES * 2) + " hex characters");
    }
    try {
      return Hex.decode(hex);
    } catch (DecoderException e) {
      throw new TokenCipherException(TokenCipherException.Code.INVALID_KEY,
          "The " + which + " key is not valid hex", e);
    }
  }

  private static void checkKey(byte[] key, String which) {
    if (key == null || key.length != KEY_BYTES) {
      throw new TokenCipherException(TokenCipherException.Code.INVALID_KEY,
          "The " + which + " key must be " + KEY_BYTES + " bytes");
    }
  }
}
