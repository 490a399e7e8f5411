package com.codeheadsystems.tether.client.error;

import com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode;
import com.codeheadsystems.tether.client.exceptions.AuthorizationException;
import com.codeheadsystems.tether.client.exceptions.ConnectionAccessorException;
import com.codeheadsystems.tether.client.manager.CompletionResult;
import javax.inject.Singleton;

/**
 * Maps authorization failures to user-facing {@link OAuthError}s.
 * <p>
 * Classification uses error codes only. Messages from providers and the server are
 * diagnostic and may say anything.
 */
@Singleton
public class OAuthErrorClassifier {

  /**
   * Classifies a thrown authorization failure.
   *
   * @param exception the exception
   * @return the error
   */
  public OAuthError classify(final AuthorizationException exception) {
    return classify(exception.code(), exception.providerError(), exception.getCause());
  }

  /**
   * Classifies a failed completion.
   *
   * @param result the result; must not be a success
   * @return the error
   */
  public OAuthError classify(final CompletionResult result) {
    if (result.success()) {
      throw new IllegalArgumentException("Cannot classify a successful completion");
    }
    return classify(result.error(), result.providerError(), null);
  }

  private OAuthError classify(AuthorizationErrorCode code, String providerError, Throwable cause) {
    if (code == null) {
      return unknown();
    }
    return switch (code) {
      case FLOW_CANCELLED -> new OAuthError(OAuthErrorCode.USER_CANCELLED,
          "Authorization was cancelled.", true, RecoveryAction.RETRY);
      case PROVIDER_ERROR -> fromProviderError(providerError);
      case CSRF_MISMATCH -> new OAuthError(OAuthErrorCode.STATE_MISMATCH,
          "The authorization response could not be verified. Please try again.", true, RecoveryAction.RETRY);
      case VERIFIER_NOT_FOUND -> new OAuthError(OAuthErrorCode.VERIFIER_NOT_FOUND,
          "The authorization session expired. Please try again.", true, RecoveryAction.RETRY);
      case MISSING_CODE, MALFORMED_CALLBACK -> new OAuthError(OAuthErrorCode.PROVIDER_ERROR,
          "The provider did not complete the authorization.", true, RecoveryAction.RETRY);
      case CONFIG_ERROR, UNKNOWN_PROVIDER -> new OAuthError(OAuthErrorCode.CONFIG_ERROR,
          "This provider is not available right now.", false, RecoveryAction.CONTACT_SUPPORT);
      case REGISTRATION_FAILED, EXCHANGE_FAILED -> isNetworkFailure(cause)
          ? new OAuthError(OAuthErrorCode.NETWORK_ERROR,
              "Check your connection and try again.", true, RecoveryAction.RETRY)
          : new OAuthError(OAuthErrorCode.TOKEN_EXCHANGE_FAILED,
              "We couldn't finish connecting. Please try again.", true, RecoveryAction.RETRY);
    };
  }

  private OAuthError fromProviderError(String providerError) {
    if (providerError == null) {
      return new OAuthError(OAuthErrorCode.PROVIDER_ERROR,
          "The provider reported an error.", true, RecoveryAction.RETRY);
    }
    return switch (providerError) {
      case "access_denied" -> new OAuthError(OAuthErrorCode.USER_DENIED,
          "Access was not granted.", true, RecoveryAction.RETRY);
      case "invalid_grant" -> new OAuthError(OAuthErrorCode.INVALID_GRANT,
          "Your authorization is no longer valid. Please reconnect.", true, RecoveryAction.REAUTHORIZE);
      case "invalid_scope" -> new OAuthError(OAuthErrorCode.INVALID_SCOPE,
          "The requested permissions were rejected.", false, RecoveryAction.CONTACT_SUPPORT);
      default -> new OAuthError(OAuthErrorCode.PROVIDER_ERROR,
          "The provider reported an error.", true, RecoveryAction.RETRY);
    };
  }

  private boolean isNetworkFailure(Throwable cause) {
    return cause instanceof ConnectionAccessorException accessorException
        && accessorException.isNetworkFailure();
  }

  private OAuthError unknown() {
    return new OAuthError(OAuthErrorCode.UNKNOWN,
        "Something went wrong. Please try again.", true, RecoveryAction.RETRY);
  }
}
