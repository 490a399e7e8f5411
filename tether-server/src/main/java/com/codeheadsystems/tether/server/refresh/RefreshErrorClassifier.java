package com.codeheadsystems.tether.server.refresh;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a failed refresh is permanent by parsing the provider's RFC 6749 §5.2
 * error body.
 * <p>
 * Only 400 and 401 responses can be permanent. Server errors, rate limiting, unrecognized
 * error codes and bodies that are not JSON are transient.
 */
public class RefreshErrorClassifier {

  private static final Logger log = LoggerFactory.getLogger(RefreshErrorClassifier.class);

  private static final Set<String> PERMANENT_CODES = Set.of(
      "invalid_grant", "unauthorized_client", "invalid_client");

  // Google: "Token has been expired or revoked." Spotify: "Refresh token revoked".
  private static final Pattern DEAD_TOKEN_DESCRIPTION =
      Pattern.compile("token (has been )?(expired or )?revoked|token has been expired");

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Refresh error classifier.
   *
   * @param objectMapper the object mapper
   */
  public RefreshErrorClassifier(ObjectMapper objectMapper) {
    log.info("RefreshErrorClassifier()");
    this.objectMapper = objectMapper;
  }

  /**
   * Classify a failed token endpoint response.
   *
   * @param status the HTTP status
   * @param body   the response body, may be null
   * @return the refresh error
   */
  public RefreshError classify(int status, String body) {
    String code = null;
    String description = null;
    if (body != null && !body.isBlank()) {
      try {
        JsonNode node = objectMapper.readTree(body);
        if (node != null && node.isObject()) {
          code = textField(node, "error");
          description = textField(node, "error_description");
        }
      } catch (JsonProcessingException e) {
        log.debug("classify(status={}) body is not JSON: {}", status, e.getOriginalMessage());
      }
    }
    boolean permanent = (status == 400 || status == 401)
        && ((code != null && PERMANENT_CODES.contains(code)) || describesDeadToken(description));
    log.debug("classify(status={}, code={}, permanent={})", status, code, permanent);
    return new RefreshError(code, description, permanent);
  }

  /**
   * Whether the response means the refresh token can never succeed again.
   *
   * @param status the HTTP status
   * @param body   the response body
   * @return true if permanent
   */
  public boolean isPermanentRefreshError(int status, String body) {
    return classify(status, body).permanent();
  }

  private static boolean describesDeadToken(String description) {
    return description != null
        && DEAD_TOKEN_DESCRIPTION.matcher(description.toLowerCase(Locale.ROOT)).find();
  }

  private static String textField(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }
}
