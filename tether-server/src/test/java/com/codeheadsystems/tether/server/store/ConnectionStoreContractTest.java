package com.codeheadsystems.tether.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.crypto.EncryptedToken;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link ConnectionStore} shares.
 */
abstract class ConnectionStoreContractTest {

  protected static final Instant CONNECTED = Instant.parse("2026-01-01T00:00:00Z");
  protected static final Instant EXPIRES = CONNECTED.plusSeconds(3600);

  protected ConnectionStore store;

  protected abstract ConnectionStore createStore();

  @BeforeEach
  void setUpStore() {
    store = createStore();
  }

  protected static ProviderConnection connection(String id, String userId, Provider provider) {
    return new ProviderConnection(id, userId, provider.name(), "pid-" + id,
        new EncryptedToken("v1:access-" + id), new EncryptedToken("v1:refresh-" + id),
        EXPIRES, "scope-a scope-b", CONNECTED, null, ConnectionStatus.ACTIVE);
  }

  @Test
  void replace_thenFind() {
    ProviderConnection c = connection("c1", "alice", Provider.SPOTIFY);
    store.replace(c);

    assertThat(store.findById("c1")).contains(c);
    assertThat(store.findByUserAndProvider("alice", Provider.SPOTIFY)).contains(c);
    assertThat(store.findByUserAndProvider("alice", Provider.YOUTUBE)).isEmpty();
    assertThat(store.findByUserAndProvider("bob", Provider.SPOTIFY)).isEmpty();
  }

  @Test
  void replace_reconnect_removesPreviousRow() {
    store.replace(connection("c1", "alice", Provider.SPOTIFY).withStatus(ConnectionStatus.EXPIRED));
    ProviderConnection fresh = connection("c2", "alice", Provider.SPOTIFY);

    store.replace(fresh);

    assertThat(store.findById("c1")).isEmpty();
    assertThat(store.findByUserAndProvider("alice", Provider.SPOTIFY)).contains(fresh);
    assertThat(store.listByUser("alice")).containsExactly(fresh);
  }

  @Test
  void listByUser_onlyThatUser() {
    store.replace(connection("c1", "alice", Provider.SPOTIFY));
    store.replace(connection("c2", "alice", Provider.YOUTUBE));
    store.replace(connection("c3", "bob", Provider.SPOTIFY));

    assertThat(store.listByUser("alice")).extracting(ProviderConnection::id)
        .containsExactlyInAnyOrder("c1", "c2");
    assertThat(store.listByUser("carol")).isEmpty();
  }

  @Test
  void recordRefresh_keepsRefreshTokenUnlessRotated() {
    store.replace(connection("c1", "alice", Provider.SPOTIFY).withStatus(ConnectionStatus.EXPIRED));
    Instant refreshedAt = CONNECTED.plusSeconds(4000);
    Instant newExpiry = refreshedAt.plusSeconds(3600);

    assertThat(store.recordRefresh("c1", new EncryptedToken("v1:new"), newExpiry, refreshedAt, null)).isTrue();

    ProviderConnection refreshed = store.findById("c1").orElseThrow();
    assertThat(refreshed.accessToken().value()).isEqualTo("v1:new");
    assertThat(refreshed.refreshToken().value()).isEqualTo("v1:refresh-c1");
    assertThat(refreshed.tokenExpiresAt()).isEqualTo(newExpiry);
    assertThat(refreshed.lastRefreshedAt()).isEqualTo(refreshedAt);
    assertThat(refreshed.status()).isEqualTo(ConnectionStatus.ACTIVE);

    store.recordRefresh("c1", new EncryptedToken("v1:newer"), newExpiry, refreshedAt,
        new EncryptedToken("v1:rotated"));
    assertThat(store.findById("c1").orElseThrow().refreshToken().value()).isEqualTo("v1:rotated");
  }

  @Test
  void recordRefresh_missingRow_returnsFalse() {
    assertThat(store.recordRefresh("nope", new EncryptedToken("v1:x"), EXPIRES, CONNECTED, null)).isFalse();
  }

  @Test
  void markStatus_andDelete() {
    store.replace(connection("c1", "alice", Provider.GMAIL));

    assertThat(store.markStatus("c1", ConnectionStatus.REVOKED)).isTrue();
    assertThat(store.findById("c1").orElseThrow().status()).isEqualTo(ConnectionStatus.REVOKED);
    assertThat(store.markStatus("nope", ConnectionStatus.EXPIRED)).isFalse();

    assertThat(store.delete("c1")).isTrue();
    assertThat(store.delete("c1")).isFalse();
    assertThat(store.findById("c1")).isEmpty();
  }

  @Test
  void unknownProviderRows_areReadableButHaveNoSummary() {
    ProviderConnection c = new ProviderConnection("c9", "alice", "MYSPACE", null,
        new EncryptedToken("v1:a"), new EncryptedToken("v1:r"), EXPIRES, null, CONNECTED, null,
        ConnectionStatus.ACTIVE);
    store.replace(c);

    ProviderConnection read = store.findById("c9").orElseThrow();
    assertThat(read.knownProvider()).isEmpty();
    assertThat(read.summary()).isEmpty();
  }
}
