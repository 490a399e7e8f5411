package com.codeheadsystems.tether.client.accessor;

import com.codeheadsystems.tether.client.config.ClientConfig;
import com.codeheadsystems.tether.client.exceptions.ConnectionAccessorException;
import com.codeheadsystems.tether.model.CallbackRequest;
import com.codeheadsystems.tether.model.CallbackResponse;
import com.codeheadsystems.tether.model.ConnectionsResponse;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.model.RegisterStateRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the connection endpoints exposed by {@code tether-server}.
 * <p>
 * Every call is authenticated with the bearer token from the injected
 * {@link CredentialProvider}; when none is available the call fails before a request is
 * sent. The {@code serverEndpoint} in {@link ClientConfig} is treated as the base URL and
 * path segments are appended per endpoint.
 * <p>
 * A 401 response is surfaced as a {@link SecurityException}. Other error statuses, I/O
 * errors and interruptions are wrapped in {@link ConnectionAccessorException}.
 */
@Singleton
public class ConnectionAccessor {

  private static final Logger log = LoggerFactory.getLogger(ConnectionAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI serverEndpoint;
  private final CredentialProvider credentialProvider;

  /**
   * Instantiates a new Connection accessor.
   *
   * @param httpClient         the http client
   * @param objectMapper       the object mapper
   * @param clientConfig       the client config
   * @param credentialProvider source of the user's bearer token
   */
  @Inject
  public ConnectionAccessor(final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final ClientConfig clientConfig,
                            final CredentialProvider credentialProvider) {
    log.info("ConnectionAccessor({})", clientConfig.serverEndpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.serverEndpoint = clientConfig.serverEndpoint();
    this.credentialProvider = credentialProvider;
  }

  /**
   * Binds a CSRF state to the signed-in user.
   *
   * @param request the request
   */
  public void registerState(final RegisterStateRequest request) {
    log.debug("registerState(provider={})", request.provider());
    send(jsonRequest(path("/connections/state"), "POST", request), null);
  }

  /**
   * Asks the server to exchange an authorization code for tokens.
   *
   * @param request the request
   * @return the callback response
   */
  public CallbackResponse callback(final CallbackRequest request) {
    log.debug("callback(provider={})", request.provider());
    return send(jsonRequest(path("/connections/callback"), "POST", request), CallbackResponse.class);
  }

  /**
   * Lists the signed-in user's connections.
   *
   * @return the connections response
   */
  public ConnectionsResponse listConnections() {
    log.debug("listConnections()");
    HttpRequest.Builder builder = authorized(path("/connections"))
        .header("Accept", "application/json")
        .GET();
    return send(builder, ConnectionsResponse.class);
  }

  /**
   * Disconnects a provider. The server revokes the tokens where the provider supports it.
   *
   * @param provider the provider
   */
  public void disconnect(final Provider provider) {
    log.debug("disconnect(provider={})", provider);
    send(authorized(path("/connections/" + provider.name())).DELETE(), null);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI path(String suffix) {
    String basePath = serverEndpoint.getPath() == null ? "" : serverEndpoint.getPath();
    if (basePath.endsWith("/")) {
      basePath = basePath.substring(0, basePath.length() - 1);
    }
    return serverEndpoint.resolve(basePath + suffix);
  }

  private HttpRequest.Builder authorized(URI uri) {
    String token = credentialProvider.bearerToken()
        .orElseThrow(() -> new SecurityException("No signed-in user to authorize request to " + uri));
    return HttpRequest.newBuilder()
        .uri(uri)
        .header("Authorization", "Bearer " + token);
  }

  private HttpRequest.Builder jsonRequest(URI uri, String method, Object body) {
    try {
      String requestBody = objectMapper.writeValueAsString(body);
      return authorized(uri)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .method(method, HttpRequest.BodyPublishers.ofString(requestBody));
    } catch (IOException e) {
      throw new ConnectionAccessorException("Unable to serialize request for " + uri, e);
    }
  }

  private <T> T send(HttpRequest.Builder builder, Class<T> responseType) {
    HttpRequest request = builder.build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(request.uri(), response.statusCode());
      if (responseType == null) {
        return null;
      }
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new ConnectionAccessorException("HTTP request failed: " + request.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionAccessorException("HTTP request interrupted: " + request.uri(), e);
    }
  }

  private void checkStatus(URI uri, int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401): " + uri);
    }
    if (statusCode >= 400) {
      throw new ConnectionAccessorException(
          "Server returned HTTP " + statusCode + ": " + uri, statusCode, null);
    }
  }
}
