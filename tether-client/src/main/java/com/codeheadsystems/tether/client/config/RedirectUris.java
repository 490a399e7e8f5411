package com.codeheadsystems.tether.client.config;

import java.util.Optional;

/**
 * Redirect URI helpers for development builds.
 * <p>
 * Google native clients only accept the reversed client id as a custom scheme, so a
 * development build that has no registered {@code tether://} scheme redirects there instead.
 */
public final class RedirectUris {

  private static final String GOOGLE_SUFFIX = ".apps.googleusercontent.com";

  private RedirectUris() {
  }

  /**
   * Derives {@code com.googleusercontent.apps.<id>:/oauth2redirect} from a Google client id.
   *
   * @param clientId the client id, e.g. {@code 1234-abc.apps.googleusercontent.com}
   * @return the redirect URI, or empty if the id is not a Google native client id
   */
  public static Optional<String> reversedClientId(String clientId) {
    if (clientId == null || !clientId.endsWith(GOOGLE_SUFFIX)) {
      return Optional.empty();
    }
    String id = clientId.substring(0, clientId.length() - GOOGLE_SUFFIX.length());
    if (id.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of("com.googleusercontent.apps." + id + ":/oauth2redirect");
  }
}
