package com.codeheadsystems.tether.server.state;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.MutableClock;
import com.codeheadsystems.tether.server.kv.InMemoryKeyValueStore;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OAuthStateRegistryTest {

  private static final String STATE = "SPOTIFY:6f1c2a9e-8d4b-4f3a-9c2e-1b7d5e8f0a3c";

  private MutableClock clock;
  private OAuthStateRegistry registry;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    registry = new OAuthStateRegistry(new InMemoryKeyValueStore(clock));
  }

  @Test
  void registerThenConsume_succeedsOnce() {
    registry.register("alice", Provider.SPOTIFY, STATE);

    assertThatCode(() -> registry.consume("alice", Provider.SPOTIFY, STATE)).doesNotThrowAnyException();
    assertThatThrownBy(() -> registry.consume("alice", Provider.SPOTIFY, STATE))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void consume_byAnotherUser_isRejectedAndStateSurvives() {
    registry.register("alice", Provider.SPOTIFY, STATE);

    assertThatThrownBy(() -> registry.consume("mallory", Provider.SPOTIFY, STATE))
        .isInstanceOf(SecurityException.class);
    assertThatCode(() -> registry.consume("alice", Provider.SPOTIFY, STATE)).doesNotThrowAnyException();
  }

  @Test
  void consume_wrongProvider_isRejected() {
    registry.register("alice", Provider.SPOTIFY, STATE);

    assertThatThrownBy(() -> registry.consume("alice", Provider.YOUTUBE, STATE))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void consume_unregistered_isRejected() {
    assertThatThrownBy(() -> registry.consume("alice", Provider.SPOTIFY, STATE))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void consume_afterTtl_isRejected() {
    registry.register("alice", Provider.SPOTIFY, STATE);
    clock.advance(Duration.ofMinutes(30));

    assertThatThrownBy(() -> registry.consume("alice", Provider.SPOTIFY, STATE))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void register_duplicate_isRejected() {
    registry.register("alice", Provider.SPOTIFY, STATE);

    assertThatThrownBy(() -> registry.register("bob", Provider.SPOTIFY, STATE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void register_validatesShape() {
    assertThatThrownBy(() -> registry.register("alice", Provider.SPOTIFY, "SPOTIFY:short"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> registry.register("alice", Provider.SPOTIFY, "SPOTIFY:" + "x".repeat(121)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> registry.register("alice", Provider.YOUTUBE, STATE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> registry.register("alice", Provider.SPOTIFY, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
