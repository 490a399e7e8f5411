package com.codeheadsystems.tether.client.browser;

/**
 * Outcome of a browser authorization session.
 *
 * @param type the outcome
 * @param url  the redirect URL the browser was sent to; only set for {@link Type#SUCCESS}
 */
public record BrowserResult(Type type, String url) {

  /**
   * How the session ended.
   */
  public enum Type {
    SUCCESS,
    CANCEL,
    DISMISS
  }

  /**
   * The browser reached the redirect URI.
   *
   * @param url the full redirect URL including query
   * @return the result
   */
  public static BrowserResult success(String url) {
    return new BrowserResult(Type.SUCCESS, url);
  }

  /**
   * The user pressed cancel.
   *
   * @return the result
   */
  public static BrowserResult cancel() {
    return new BrowserResult(Type.CANCEL, null);
  }

  /**
   * The session was closed without reaching the redirect URI.
   *
   * @return the result
   */
  public static BrowserResult dismiss() {
    return new BrowserResult(Type.DISMISS, null);
  }

  /**
   * Is success boolean.
   *
   * @return the boolean
   */
  public boolean isSuccess() {
    return type == Type.SUCCESS && url != null;
  }
}
