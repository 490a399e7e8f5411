package com.codeheadsystems.tether.server.crypto;

import static com.codeheadsystems.tether.server.crypto.TokenCipherException.Code.DECRYPTION_FAILED;
import static com.codeheadsystems.tether.server.crypto.TokenCipherException.Code.ENCRYPTION_FAILED;
import static com.codeheadsystems.tether.server.crypto.TokenCipherException.Code.INVALID_FORMAT;
import static com.codeheadsystems.tether.server.crypto.TokenCipherException.Code.KEY_VERSION_NOT_FOUND;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts provider tokens for storage with AES-256-GCM.
 * <p>
 * Ciphertext format: {@code v<version>:<ivHex>:<ciphertextHex>} where the ciphertext
 * includes the 16-byte GCM tag. The unversioned legacy form {@code <ivHex>:<ciphertextHex>}
 * is read with the current key. Thread-safe; a new {@link Cipher} is created per call.
 */
public class TokenCipher {

  private static final Logger log = LoggerFactory.getLogger(TokenCipher.class);

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int IV_BYTES = 12;
  private static final int TAG_BITS = 128;

  private final EncryptionKeys keys;
  private final SecureRandom random;

  /**
   * Instantiates a new Token cipher.
   *
   * @param keys the keys
   */
  public TokenCipher(EncryptionKeys keys) {
    this(keys, new SecureRandom());
  }

  /**
   * Instantiates a new Token cipher.
   *
   * @param keys   the keys
   * @param random source of IVs
   */
  public TokenCipher(EncryptionKeys keys, SecureRandom random) {
    log.info("TokenCipher({})", keys);
    this.keys = keys;
    this.random = random;
  }

  /**
   * Encrypts with the current key.
   *
   * @param plaintext the plaintext
   * @return the encrypted token
   */
  public EncryptedToken encrypt(String plaintext) {
    byte[] iv = new byte[IV_BYTES];
    random.nextBytes(iv);
    try {
      Cipher cipher = cipher(Cipher.ENCRYPT_MODE, keys.currentKey(), iv);
      byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return new EncryptedToken("v" + keys.currentVersion() + ":" + Hex.toHexString(iv) + ":"
          + Hex.toHexString(ciphertext));
    } catch (GeneralSecurityException e) {
      throw new TokenCipherException(ENCRYPTION_FAILED, "Encryption failed", e);
    }
  }

  /**
   * Decrypts with whichever configured key matches the ciphertext's version.
   *
   * @param token the token
   * @return the plaintext
   * @throws TokenCipherException if the format is invalid, the key version is unknown, or
   *                              authentication fails
   */
  public String decrypt(EncryptedToken token) {
    Parsed parsed = parse(token);
    byte[] key = keys.keyFor(parsed.version())
        .orElseThrow(() -> new TokenCipherException(KEY_VERSION_NOT_FOUND,
            "No key configured for version " + parsed.version()));
    try {
      Cipher cipher = cipher(Cipher.DECRYPT_MODE, key, parsed.iv());
      return new String(cipher.doFinal(parsed.ciphertext()), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new TokenCipherException(DECRYPTION_FAILED, "Decryption failed", e);
    }
  }

  /**
   * Whether the token was written with the current key version.
   *
   * @param token the token
   * @return true if no rotation is needed
   */
  public boolean isCurrentVersion(EncryptedToken token) {
    return token.value().startsWith("v" + keys.currentVersion() + ":");
  }

  /**
   * Re-encrypts a token under the current key, leaving current-version tokens untouched.
   *
   * @param token the token
   * @return the token under the current key
   */
  public EncryptedToken reEncrypt(EncryptedToken token) {
    if (isCurrentVersion(token)) {
      return token;
    }
    return encrypt(decrypt(token));
  }

  private Parsed parse(EncryptedToken token) {
    String[] parts = token.value().split(":");
    int version;
    String ivHex;
    String ciphertextHex;
    if (parts.length == 3 && parts[0].startsWith("v")) {
      try {
        version = Integer.parseInt(parts[0].substring(1));
      } catch (NumberFormatException e) {
        throw new TokenCipherException(INVALID_FORMAT, "Invalid key version prefix", e);
      }
      ivHex = parts[1];
      ciphertextHex = parts[2];
    } else if (parts.length == 2) {
      version = keys.currentVersion();
      ivHex = parts[0];
      ciphertextHex = parts[1];
    } else {
      throw new TokenCipherException(INVALID_FORMAT, "Unrecognized ciphertext format");
    }
    try {
      byte[] iv = Hex.decode(ivHex);
      byte[] ciphertext = Hex.decode(ciphertextHex);
      if (iv.length != IV_BYTES || ciphertext.length < TAG_BITS / 8) {
        throw new TokenCipherException(INVALID_FORMAT, "Ciphertext has wrong IV or tag length");
      }
      return new Parsed(version, iv, ciphertext);
    } catch (DecoderException e) {
      throw new TokenCipherException(INVALID_FORMAT, "Ciphertext is not valid hex", e);
    }
  }

  private static Cipher cipher(int mode, byte[] key, byte[] iv) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
    return cipher;
  }

  private record Parsed(int version, byte[] iv, byte[] ciphertext) {
  }
}
