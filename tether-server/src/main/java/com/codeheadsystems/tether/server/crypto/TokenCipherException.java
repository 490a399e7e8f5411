package com.codeheadsystems.tether.server.crypto;

/**
 * Thrown when a token cannot be encrypted or decrypted.
 */
public class TokenCipherException extends RuntimeException {

  /**
   * Failure kinds.
   */
  public enum Code {
    INVALID_KEY,
    INVALID_FORMAT,
    KEY_VERSION_NOT_FOUND,
    ENCRYPTION_FAILED,
    DECRYPTION_FAILED
  }

  private final Code code;

  /**
   * Instantiates a new Token cipher exception.
   *
   * @param code    the code
   * @param message the message
   * @param cause   the cause
   */
  public TokenCipherException(Code code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /**
   * Instantiates a new Token cipher exception.
   *
   * @param code    the code
   * @param message the message
   */
  public TokenCipherException(Code code, String message) {
    this(code, message, null);
  }

  /**
   * The failure kind.
   *
   * @return the code
   */
  public Code code() {
    return code;
  }
}
