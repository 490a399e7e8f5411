package com.codeheadsystems.tether.dropwizard;

import com.codeheadsystems.tether.dropwizard.auth.TetherAuthenticator;
import com.codeheadsystems.tether.dropwizard.auth.TetherPrincipal;
import com.codeheadsystems.tether.dropwizard.health.TokenCipherHealthCheck;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.auth.JwtManager;
import com.codeheadsystems.tether.server.crypto.EncryptionKeys;
import com.codeheadsystems.tether.server.crypto.TokenCipher;
import com.codeheadsystems.tether.server.kv.InMemoryKeyValueStore;
import com.codeheadsystems.tether.server.kv.KeyValueStore;
import com.codeheadsystems.tether.server.kv.RedisKeyValueStore;
import com.codeheadsystems.tether.server.lease.KeyValueLeaseManager;
import com.codeheadsystems.tether.server.manager.ConnectionManager;
import com.codeheadsystems.tether.server.provider.ProviderSettings;
import com.codeheadsystems.tether.server.provider.ProviderTokenAccessor;
import com.codeheadsystems.tether.server.refresh.RefreshErrorClassifier;
import com.codeheadsystems.tether.server.refresh.RefreshSettings;
import com.codeheadsystems.tether.server.refresh.Sleeper;
import com.codeheadsystems.tether.server.refresh.TokenRefreshManager;
import com.codeheadsystems.tether.server.resource.ConnectionResource;
import com.codeheadsystems.tether.server.state.OAuthStateRegistry;
import com.codeheadsystems.tether.server.store.ConnectionStore;
import com.codeheadsystems.tether.server.store.InMemoryConnectionStore;
import com.codeheadsystems.tether.server.store.JdbcConnectionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.ManagedDataSource;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;

/**
 * Dropwizard bundle that wires provider connections and token refresh into an existing
 * Dropwizard application.
 * <p>
 * Registers the {@code /connections} JAX-RS resource, the token cipher health check and the
 * JWT authentication filter. Requires a {@link TetherConfiguration} as the application's
 * configuration.
 * <p>
 * With the no-arg constructor the stores come from the configuration: a {@code database}
 * block selects the JDBC connection store and a {@code redisUri} selects Redis for leases and
 * OAuth states; either left out falls back to memory (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TetherBundle<>());
 * }</pre>
 * Or supply stores directly:
 * <pre>{@code
 *   bootstrap.addBundle(new TetherBundle<>(myConnectionStore, myKeyValueStore, Clock.systemUTC()));
 * }</pre>
 * Application code that calls providers on a user's behalf obtains tokens through
 * {@link #tokenRefreshManager()} once the bundle has run.
 */
@Singleton
public class TetherBundle<C extends TetherConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TetherBundle.class);

  private final ConnectionStore suppliedConnectionStore;
  private final KeyValueStore suppliedKeyValueStore;
  private final Clock clock;

  private ConnectionStore connectionStore;
  private TokenRefreshManager tokenRefreshManager;
  private JwtManager jwtManager;

  /**
   * Creates a bundle whose stores are chosen from the configuration.
   */
  public TetherBundle() {
    this(null, null, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied stores. A null store is chosen from the
   * configuration instead.
   *
   * @param connectionStore the connection store
   * @param keyValueStore   the store for leases and OAuth states
   * @param clock           the clock
   */
  @Inject
  public TetherBundle(ConnectionStore connectionStore, KeyValueStore keyValueStore, Clock clock) {
    this.suppliedConnectionStore = connectionStore;
    this.suppliedKeyValueStore = keyValueStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    TokenCipher tokenCipher = new TokenCipher(buildEncryptionKeys(configuration));
    jwtManager = buildJwtManager(configuration);
    connectionStore = suppliedConnectionStore != null
        ? suppliedConnectionStore
        : buildConnectionStore(configuration, environment);
    KeyValueStore keyValueStore = suppliedKeyValueStore != null
        ? suppliedKeyValueStore
        : buildKeyValueStore(configuration, environment);
    if (connectionStore instanceof InMemoryConnectionStore || keyValueStore instanceof InMemoryKeyValueStore) {
      log.warn("""
          #################################################################
          # WARNING: Using in-memory stores. Connections, leases and     #
          # OAuth states are lost on restart and not shared between      #
          # instances. Do not use in production.                         #
          #################################################################
          """);
    }

    Map<Provider, ProviderSettings> providers = new EnumMap<>(Provider.class);
    configuration.getProviders().forEach((provider, config) -> providers.put(provider, config.toSettings(provider)));
    RefreshSettings refreshSettings = new RefreshSettings(
        configuration.getRefreshBuffer().toJavaDuration(),
        configuration.getRefreshLeaseTtl().toJavaDuration(),
        configuration.getRefreshLockWait().toJavaDuration(),
        configuration.getProviderRequestTimeout().toJavaDuration());

    ObjectMapper objectMapper = environment.getObjectMapper();
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(refreshSettings.requestTimeout())
        .build();
    ProviderTokenAccessor providerTokenAccessor =
        new ProviderTokenAccessor(httpClient, objectMapper, refreshSettings.requestTimeout());

    tokenRefreshManager = new TokenRefreshManager(connectionStore,
        new KeyValueLeaseManager(keyValueStore, clock),
        tokenCipher,
        providerTokenAccessor,
        new RefreshErrorClassifier(objectMapper),
        providers,
        refreshSettings,
        clock,
        Sleeper.system());
    ConnectionManager connectionManager = new ConnectionManager(connectionStore,
        new OAuthStateRegistry(keyValueStore), tokenCipher, providerTokenAccessor, providers,
        configuration.getRedirectUri(), clock);

    environment.jersey().register(new ConnectionResource(connectionManager));
    environment.healthChecks().register("token-cipher", new TokenCipherHealthCheck(tokenCipher));

    // JWT auth filter
    TetherAuthenticator authenticator = new TetherAuthenticator(jwtManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<TetherPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TetherPrincipal.class));
  }

  /**
   * The refresh orchestrator, available after {@link #run}.
   *
   * @return the token refresh manager
   */
  public TokenRefreshManager tokenRefreshManager() {
    return requireRun(tokenRefreshManager);
  }

  /**
   * The JWT manager, available after {@link #run}. Hosts use it to issue user tokens.
   *
   * @return the jwt manager
   */
  public JwtManager jwtManager() {
    return requireRun(jwtManager);
  }

  /**
   * The connection store in use, available after {@link #run}.
   *
   * @return the connection store
   */
  public ConnectionStore connectionStore() {
    return requireRun(connectionStore);
  }

  private static <T> T requireRun(T value) {
    if (value == null) {
      throw new IllegalStateException("TetherBundle has not run yet");
    }
    return value;
  }

  private EncryptionKeys buildEncryptionKeys(C configuration) {
    String keyHex = configuration.getEncryptionKeyHex();
    if (keyHex == null || keyHex.isEmpty()) {
      log.warn("No encryption key configured, generating randomly. "
          + "Stored tokens will be unreadable after restart. Do not use in production.");
      byte[] key = new byte[EncryptionKeys.KEY_BYTES];
      new SecureRandom().nextBytes(key);
      return new EncryptionKeys(key, configuration.getEncryptionKeyVersion(), null, 0);
    }
    return EncryptionKeys.fromHex(keyHex, configuration.getEncryptionKeyVersion(),
        configuration.getPreviousEncryptionKeyHex(), configuration.getPreviousEncryptionKeyVersion());
  }

  private JwtManager buildJwtManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new JwtManager(secret, configuration.getJwtIssuer(), configuration.getJwtTtlSeconds(), clock);
  }

  private ConnectionStore buildConnectionStore(C configuration, Environment environment) {
    if (configuration.getDatabase() == null) {
      return new InMemoryConnectionStore();
    }
    ManagedDataSource dataSource = configuration.getDatabase().build(environment.metrics(), "tether");
    environment.lifecycle().manage(dataSource);
    JdbcConnectionStore jdbcStore = new JdbcConnectionStore(dataSource);
    if (configuration.isCreateSchema()) {
      jdbcStore.initializeSchema();
    }
    return jdbcStore;
  }

  private KeyValueStore buildKeyValueStore(C configuration, Environment environment) {
    String redisUri = configuration.getRedisUri();
    if (redisUri == null || redisUri.isEmpty()) {
      return new InMemoryKeyValueStore(clock);
    }
    JedisPooled jedis = new JedisPooled(URI.create(redisUri));
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        log.info("Redis key-value store ready");
      }

      @Override
      public void stop() {
        jedis.close();
      }
    });
    return new RedisKeyValueStore(jedis, configuration.getRedisKeyPrefix());
  }
}
