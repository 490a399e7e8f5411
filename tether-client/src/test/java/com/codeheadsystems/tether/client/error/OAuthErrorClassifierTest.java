package com.codeheadsystems.tether.client.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tether.client.exceptions.AuthorizationErrorCode;
import com.codeheadsystems.tether.client.exceptions.AuthorizationException;
import com.codeheadsystems.tether.client.exceptions.ConnectionAccessorException;
import com.codeheadsystems.tether.client.manager.CompletionResult;
import com.codeheadsystems.tether.model.Provider;
import org.junit.jupiter.api.Test;

class OAuthErrorClassifierTest {

  private final OAuthErrorClassifier classifier = new OAuthErrorClassifier();

  @Test
  void cancelled_isRetryable() {
    OAuthError error = classifier.classify(
        new AuthorizationException(AuthorizationErrorCode.FLOW_CANCELLED, "cancel"));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.USER_CANCELLED);
    assertThat(error.recoverable()).isTrue();
    assertThat(error.action()).isEqualTo(RecoveryAction.RETRY);
  }

  @Test
  void providerAccessDenied_isUserDenied() {
    OAuthError error = classifier.classify(new AuthorizationException(
        AuthorizationErrorCode.PROVIDER_ERROR, "The user did not consent", "access_denied", null));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.USER_DENIED);
  }

  @Test
  void providerMessageText_isNotUsedForClassification() {
    OAuthError error = classifier.classify(new AuthorizationException(
        AuthorizationErrorCode.PROVIDER_ERROR, "access_denied invalid_grant", "server_error", null));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.PROVIDER_ERROR);
  }

  @Test
  void invalidGrant_requiresReauthorization() {
    OAuthError error = classifier.classify(CompletionResult.providerFailure(
        Provider.SPOTIFY, "invalid_grant", "bad"));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.INVALID_GRANT);
    assertThat(error.action()).isEqualTo(RecoveryAction.REAUTHORIZE);
  }

  @Test
  void invalidScope_isNotRecoverable() {
    OAuthError error = classifier.classify(CompletionResult.providerFailure(
        Provider.SPOTIFY, "invalid_scope", "bad"));

    assertThat(error.recoverable()).isFalse();
    assertThat(error.action()).isEqualTo(RecoveryAction.CONTACT_SUPPORT);
  }

  @Test
  void exchangeFailed_networkCause_isNetworkError() {
    OAuthError error = classifier.classify(new AuthorizationException(AuthorizationErrorCode.EXCHANGE_FAILED,
        "failed", new ConnectionAccessorException("refused", null)));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.NETWORK_ERROR);
  }

  @Test
  void exchangeFailed_serverStatus_isTokenExchangeFailed() {
    OAuthError error = classifier.classify(new AuthorizationException(AuthorizationErrorCode.EXCHANGE_FAILED,
        "failed", new ConnectionAccessorException("502", 502, null)));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.TOKEN_EXCHANGE_FAILED);
  }

  @Test
  void csrfMismatchCompletion_isStateMismatch() {
    OAuthError error = classifier.classify(
        CompletionResult.failure(Provider.GMAIL, AuthorizationErrorCode.CSRF_MISMATCH, "mismatch"));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.STATE_MISMATCH);
  }

  @Test
  void malformedCallback_isRetryable() {
    OAuthError error = classifier.classify(
        CompletionResult.failure(null, AuthorizationErrorCode.MALFORMED_CALLBACK, "bad escape"));

    assertThat(error.recoverable()).isTrue();
    assertThat(error.action()).isEqualTo(RecoveryAction.RETRY);
  }

  @Test
  void configError_isNotRecoverable() {
    OAuthError error = classifier.classify(
        new AuthorizationException(AuthorizationErrorCode.CONFIG_ERROR, "no client id"));

    assertThat(error.code()).isEqualTo(OAuthErrorCode.CONFIG_ERROR);
    assertThat(error.recoverable()).isFalse();
  }

  @Test
  void successfulCompletion_cannotBeClassified() {
    assertThatThrownBy(() -> classifier.classify(CompletionResult.success(Provider.GMAIL)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
