package com.codeheadsystems.tether.client.pkce;

/**
 * A PKCE verifier and the challenge derived from it (RFC 7636 §4.1, §4.2).
 *
 * @param verifier  the high-entropy secret kept on the device until the code exchange
 * @param challenge {@code base64url(SHA-256(verifier))}, sent in the authorization URL
 */
public record PkcePair(String verifier, String challenge) {

  @Override
  public String toString() {
    return "PkcePair[challenge=" + challenge + "]";
  }
}
