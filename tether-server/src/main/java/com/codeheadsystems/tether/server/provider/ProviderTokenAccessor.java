package com.codeheadsystems.tether.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for provider OAuth endpoints: code exchange, refresh, user info, revocation.
 * <p>
 * Every request carries the configured timeout. Non-2xx responses become a
 * {@link ProviderTokenException} carrying the status and body so the caller can classify
 * them; no response at all becomes one with status 0.
 */
public class ProviderTokenAccessor {

  private static final Logger log = LoggerFactory.getLogger(ProviderTokenAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeout;

  /**
   * Instantiates a new Provider token accessor.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param requestTimeout per-request timeout
   */
  public ProviderTokenAccessor(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
    log.info("ProviderTokenAccessor(timeout={})", requestTimeout);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.requestTimeout = requestTimeout;
  }

  /**
   * The timeout applied to every provider request.
   *
   * @return the duration
   */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  /**
   * Exchanges a refresh token for a new access token.
   *
   * @param settings     the provider settings
   * @param refreshToken the plaintext refresh token
   * @return the token response
   */
  public TokenResponse refresh(ProviderSettings settings, String refreshToken) {
    log.debug("refresh(provider={})", settings.provider());
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", "refresh_token");
    form.put("refresh_token", refreshToken);
    form.put("client_id", settings.clientId());
    if (settings.hasClientSecret()) {
      form.put("client_secret", settings.clientSecret());
    }
    return postTokenForm(settings, form);
  }

  /**
   * Exchanges an authorization code and PKCE verifier for tokens.
   *
   * @param settings     the provider settings
   * @param code         the code
   * @param codeVerifier the code verifier
   * @param redirectUri  the redirect uri used in the authorization request
   * @return the token response
   */
  public TokenResponse exchangeCode(ProviderSettings settings, String code, String codeVerifier,
                                    String redirectUri) {
    log.debug("exchangeCode(provider={})", settings.provider());
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", "authorization_code");
    form.put("code", code);
    form.put("code_verifier", codeVerifier);
    form.put("redirect_uri", redirectUri);
    form.put("client_id", settings.clientId());
    if (settings.hasClientSecret()) {
      form.put("client_secret", settings.clientSecret());
    }
    return postTokenForm(settings, form);
  }

  /**
   * Looks up the user's id at the provider.
   *
   * @param settings    the provider settings
   * @param accessToken the plaintext access token
   * @return the id, or empty if the provider has no user info endpoint configured
   */
  public Optional<String> fetchProviderUserId(ProviderSettings settings, String accessToken) {
    if (settings.userInfoEndpoint() == null) {
      return Optional.empty();
    }
    log.debug("fetchProviderUserId(provider={})", settings.provider());
    HttpRequest request = HttpRequest.newBuilder()
        .uri(settings.userInfoEndpoint())
        .timeout(requestTimeout)
        .header("Authorization", "Bearer " + accessToken)
        .header("Accept", "application/json")
        .GET()
        .build();
    HttpResponse<String> response = send(request);
    try {
      JsonNode node = objectMapper.readTree(response.body());
      JsonNode id = node.hasNonNull("id") ? node.get("id") : node.get("sub");
      return Optional.ofNullable(id).filter(JsonNode::isValueNode).map(JsonNode::asText);
    } catch (IOException e) {
      throw new ProviderTokenException("Unreadable user info from " + settings.provider(),
          response.statusCode(), response.body(), e);
    }
  }

  /**
   * Revokes a token at the provider.
   *
   * @param settings the provider settings
   * @param token    the plaintext token
   * @return false if the provider has no revocation endpoint
   */
  public boolean revoke(ProviderSettings settings, String token) {
    if (settings.revokeEndpoint() == null) {
      return false;
    }
    log.debug("revoke(provider={})", settings.provider());
    HttpRequest request = HttpRequest.newBuilder()
        .uri(settings.revokeEndpoint())
        .timeout(requestTimeout)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(formEncode(Map.of("token", token))))
        .build();
    send(request);
    return true;
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private TokenResponse postTokenForm(ProviderSettings settings, Map<String, String> form) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(settings.tokenEndpoint())
        .timeout(requestTimeout)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
        .build();
    HttpResponse<String> response = send(request);
    TokenResponse tokens;
    try {
      tokens = objectMapper.readValue(response.body(), TokenResponse.class);
    } catch (IOException e) {
      throw new ProviderTokenException("Unreadable token response from " + settings.provider(),
          response.statusCode(), response.body(), e);
    }
    if (tokens.accessToken() == null || tokens.accessToken().isEmpty()) {
      throw new ProviderTokenException("Token response from " + settings.provider() + " has no access_token",
          response.statusCode(), null, null);
    }
    return tokens;
  }

  private HttpResponse<String> send(HttpRequest request) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new ProviderTokenException("HTTP request failed: " + endpoint(request.uri()), 0, null, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderTokenException("HTTP request interrupted: " + endpoint(request.uri()), 0, null, e);
    }
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new ProviderTokenException("Provider returned HTTP " + status + ": " + endpoint(request.uri()),
          status, response.body(), null);
    }
    return response;
  }

  private static String endpoint(URI uri) {
    return uri.getScheme() + "://" + uri.getAuthority() + uri.getPath();
  }

  private static String formEncode(Map<String, String> form) {
    StringJoiner joiner = new StringJoiner("&");
    form.forEach((name, value) -> joiner.add(URLEncoder.encode(name, StandardCharsets.UTF_8) + "="
        + URLEncoder.encode(value, StandardCharsets.UTF_8)));
    return joiner.toString();
  }
}
