package com.codeheadsystems.tether.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tether.model.CallbackRequest;
import com.codeheadsystems.tether.model.CallbackResponse;
import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.ConnectionSummary;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.model.RegisterStateRequest;
import com.codeheadsystems.tether.server.crypto.EncryptionKeys;
import com.codeheadsystems.tether.server.crypto.TokenCipher;
import com.codeheadsystems.tether.server.exceptions.ConnectionNotFoundException;
import com.codeheadsystems.tether.server.kv.InMemoryKeyValueStore;
import com.codeheadsystems.tether.server.provider.ProviderSettings;
import com.codeheadsystems.tether.server.provider.ProviderTokenAccessor;
import com.codeheadsystems.tether.server.provider.ProviderTokenException;
import com.codeheadsystems.tether.server.provider.TokenResponse;
import com.codeheadsystems.tether.server.state.OAuthStateRegistry;
import com.codeheadsystems.tether.server.store.InMemoryConnectionStore;
import com.codeheadsystems.tether.server.store.ProviderConnection;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

  private static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String STATE = "SPOTIFY:6f1c2a9e-8d4b-4f3a-9c2e-1b7d5e8f0a3c";
  private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
  private static final String REDIRECT = "tether://oauth/callback";
  private static final ProviderSettings SPOTIFY = ProviderSettings.defaults(Provider.SPOTIFY, "spotify-id", null);

  @Mock private ProviderTokenAccessor accessor;

  private InMemoryConnectionStore store;
  private OAuthStateRegistry stateRegistry;
  private TokenCipher cipher;
  private ConnectionManager manager;

  @BeforeEach
  void setUp() {
    store = new InMemoryConnectionStore();
    stateRegistry = new OAuthStateRegistry(new InMemoryKeyValueStore());
    cipher = new TokenCipher(EncryptionKeys.single(KEY));
    manager = new ConnectionManager(store, stateRegistry, cipher, accessor, Map.of(Provider.SPOTIFY, SPOTIFY),
        REDIRECT, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private CallbackRequest callbackRequest(String redirectUri) {
    return new CallbackRequest(Provider.SPOTIFY, "code-1", STATE, VERIFIER, redirectUri);
  }

  // ── registerState ─────────────────────────────────────────────────────────

  @Test
  void registerState_unconfiguredProvider_isBadRequest() {
    assertThatThrownBy(() -> manager.registerState("alice", new RegisterStateRequest(Provider.YOUTUBE,
        "YOUTUBE:6f1c2a9e-8d4b-4f3a-9c2e-1b7d5e8f0a3c")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.registerState("alice", new RegisterStateRequest(null, STATE)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ── callback ──────────────────────────────────────────────────────────────

  @Test
  void callback_storesEncryptedActiveConnection() {
    manager.registerState("alice", new RegisterStateRequest(Provider.SPOTIFY, STATE));
    when(accessor.exchangeCode(SPOTIFY, "code-1", VERIFIER, REDIRECT))
        .thenReturn(new TokenResponse("access-1", 3600L, "refresh-1", "user-read-email", "Bearer"));
    when(accessor.fetchProviderUserId(SPOTIFY, "access-1")).thenReturn(Optional.of("spotify-user"));

    CallbackResponse response = manager.callback("alice", callbackRequest(null));

    assertThat(response).isEqualTo(new CallbackResponse(true, Provider.SPOTIFY));
    ProviderConnection c = store.findByUserAndProvider("alice", Provider.SPOTIFY).orElseThrow();
    assertThat(c.status()).isEqualTo(ConnectionStatus.ACTIVE);
    assertThat(c.providerUserId()).isEqualTo("spotify-user");
    assertThat(c.scopes()).isEqualTo("user-read-email");
    assertThat(c.tokenExpiresAt()).isEqualTo(NOW.plusSeconds(3600));
    assertThat(c.connectedAt()).isEqualTo(NOW);
    assertThat(c.accessToken().value()).doesNotContain("access-1");
    assertThat(cipher.decrypt(c.accessToken())).isEqualTo("access-1");
    assertThat(cipher.decrypt(c.refreshToken())).isEqualTo("refresh-1");
  }

  @Test
  void callback_stateIsSingleUse() {
    manager.registerState("alice", new RegisterStateRequest(Provider.SPOTIFY, STATE));
    when(accessor.exchangeCode(SPOTIFY, "code-1", VERIFIER, "custom://cb"))
        .thenReturn(new TokenResponse("access-1", 3600L, "refresh-1", null, null));
    when(accessor.fetchProviderUserId(any(), anyString())).thenReturn(Optional.empty());

    manager.callback("alice", callbackRequest("custom://cb"));

    assertThatThrownBy(() -> manager.callback("alice", callbackRequest("custom://cb")))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void callback_unregisteredState_isRejectedBeforeExchange() {
    assertThatThrownBy(() -> manager.callback("alice", callbackRequest(null)))
        .isInstanceOf(SecurityException.class);
    verify(accessor, never()).exchangeCode(any(), any(), any(), any());
  }

  @Test
  void callback_stateOfAnotherUser_isRejected() {
    manager.registerState("bob", new RegisterStateRequest(Provider.SPOTIFY, STATE));

    assertThatThrownBy(() -> manager.callback("alice", callbackRequest(null)))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void callback_badVerifier_isBadRequest() {
    CallbackRequest shortVerifier = new CallbackRequest(Provider.SPOTIFY, "code", STATE, "short", null);
    CallbackRequest noCode = new CallbackRequest(Provider.SPOTIFY, " ", STATE, VERIFIER, null);

    assertThatThrownBy(() -> manager.callback("alice", shortVerifier)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.callback("alice", noCode)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void callback_withoutRefreshToken_isRejected() {
    manager.registerState("alice", new RegisterStateRequest(Provider.SPOTIFY, STATE));
    when(accessor.exchangeCode(SPOTIFY, "code-1", VERIFIER, REDIRECT))
        .thenReturn(new TokenResponse("access-1", 3600L, null, null, null));

    assertThatThrownBy(() -> manager.callback("alice", callbackRequest(null)))
        .isInstanceOf(ProviderTokenException.class);
    assertThat(store.listByUser("alice")).isEmpty();
  }

  @Test
  void callback_negativeExpiresIn_isRejected() {
    manager.registerState("alice", new RegisterStateRequest(Provider.SPOTIFY, STATE));
    when(accessor.exchangeCode(SPOTIFY, "code-1", VERIFIER, REDIRECT))
        .thenReturn(new TokenResponse("access-1", -60L, "refresh-1", null, null));

    assertThatThrownBy(() -> manager.callback("alice", callbackRequest(null)))
        .isInstanceOf(ProviderTokenException.class)
        .hasMessageContaining("unusable token lifetime");
    assertThat(store.listByUser("alice")).isEmpty();
  }

  @Test
  void callback_userInfoFailure_stillConnects() {
    manager.registerState("alice", new RegisterStateRequest(Provider.SPOTIFY, STATE));
    when(accessor.exchangeCode(SPOTIFY, "code-1", VERIFIER, REDIRECT))
        .thenReturn(new TokenResponse("access-1", 3600L, "refresh-1", null, null));
    when(accessor.fetchProviderUserId(SPOTIFY, "access-1"))
        .thenThrow(new ProviderTokenException("HTTP 500", 500, null, null));

    manager.callback("alice", callbackRequest(null));

    assertThat(store.findByUserAndProvider("alice", Provider.SPOTIFY).orElseThrow().providerUserId()).isNull();
  }

  @Test
  void callback_reconnect_replacesExpiredRow() {
    store.replace(new ProviderConnection("old", "alice", "SPOTIFY", null, cipher.encrypt("a"), cipher.encrypt("r"),
        NOW, null, NOW.minusSeconds(1000), null, ConnectionStatus.EXPIRED));
    manager.registerState("alice", new RegisterStateRequest(Provider.SPOTIFY, STATE));
    when(accessor.exchangeCode(SPOTIFY, "code-1", VERIFIER, REDIRECT))
        .thenReturn(new TokenResponse("access-1", 3600L, "refresh-1", null, null));
    when(accessor.fetchProviderUserId(SPOTIFY, "access-1")).thenReturn(Optional.empty());

    manager.callback("alice", callbackRequest(null));

    assertThat(store.findById("old")).isEmpty();
    assertThat(store.listByUser("alice")).singleElement()
        .satisfies(c -> assertThat(c.status()).isEqualTo(ConnectionStatus.ACTIVE));
  }

  // ── list / disconnect ─────────────────────────────────────────────────────

  @Test
  void list_returnsSummariesOnly() {
    store.replace(new ProviderConnection("c1", "alice", "SPOTIFY", "pid", cipher.encrypt("a"), cipher.encrypt("r"),
        NOW, "s", NOW, null, ConnectionStatus.ACTIVE));
    store.replace(new ProviderConnection("c2", "alice", "MYSPACE", "pid", cipher.encrypt("a"), cipher.encrypt("r"),
        NOW, "s", NOW, null, ConnectionStatus.ACTIVE));

    assertThat(manager.list("alice").connections()).containsExactly(
        new ConnectionSummary(Provider.SPOTIFY, ConnectionStatus.ACTIVE, "pid", "s", NOW.toEpochMilli(), null));
    assertThat(manager.list("bob").connections()).isEmpty();
  }

  @Test
  void disconnect_revokesThenDeletes() {
    store.replace(new ProviderConnection("c1", "alice", "SPOTIFY", null, cipher.encrypt("a"), cipher.encrypt("r"),
        NOW, null, NOW, null, ConnectionStatus.ACTIVE));
    when(accessor.revoke(SPOTIFY, "r")).thenReturn(false);

    manager.disconnect("alice", Provider.SPOTIFY);

    assertThat(store.findById("c1")).isEmpty();
  }

  @Test
  void disconnect_revocationFailure_stillDeletes() {
    store.replace(new ProviderConnection("c1", "alice", "SPOTIFY", null, cipher.encrypt("a"), cipher.encrypt("r"),
        NOW, null, NOW, null, ConnectionStatus.ACTIVE));
    doThrow(new ProviderTokenException("down", 0, null, null)).when(accessor).revoke(SPOTIFY, "r");

    manager.disconnect("alice", Provider.SPOTIFY);

    assertThat(store.findById("c1")).isEmpty();
  }

  @Test
  void disconnect_missing_isNotFound() {
    assertThatThrownBy(() -> manager.disconnect("alice", Provider.SPOTIFY))
        .isInstanceOf(ConnectionNotFoundException.class);
  }
}
