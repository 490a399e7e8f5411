package com.codeheadsystems.tether.dropwizard;

import com.codeheadsystems.tether.model.Provider;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import io.dropwizard.util.Duration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.EnumMap;
import java.util.Map;

/**
 * Dropwizard configuration for the tether connection endpoints and token refresh.
 * <p>
 * For production, supply {@code encryptionKeyHex} and {@code jwtSecretHex} (generate each
 * with {@code openssl rand -hex 32}), a {@code database} and a {@code redisUri}. Omitting
 * them falls back to random keys and in-memory stores, which is only fit for dev and tests.
 * <p>
 * To rotate the encryption key, move the current key to {@code previousEncryptionKeyHex}
 * with its version and configure a new key with a higher {@code encryptionKeyVersion}.
 */
public class TetherConfiguration extends Configuration {

  /**
   * Hex-encoded 32-byte AES key that encrypts stored provider tokens.
   * Leave empty for a random key (dev only: stored tokens become unreadable on restart).
   */
  private String encryptionKeyHex = "";

  /**
   * Version stamped into ciphertexts written with {@code encryptionKeyHex}.
   */
  @Min(1)
  private int encryptionKeyVersion = 1;

  /**
   * The key being rotated away from, still accepted for decryption. Empty when not rotating.
   */
  private String previousEncryptionKeyHex = "";

  /**
   * Version of {@code previousEncryptionKeyHex}.
   */
  @Min(0)
  private int previousEncryptionKeyVersion = 0;

  /**
   * Hex-encoded HMAC-SHA256 signing secret for end-user bearer tokens.
   * Leave empty for random generation (dev only: tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * JWT token time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "tether";

  /**
   * Redirect URI used for code exchange when a callback request does not name one.
   */
  @NotEmpty
  private String redirectUri = "tether://oauth/callback";

  /**
   * OAuth client registrations keyed by provider. Providers without an entry cannot be connected.
   */
  @Valid
  @NotNull
  private Map<Provider, ProviderConfiguration> providers = new EnumMap<>(Provider.class);

  /**
   * Access tokens expiring sooner than this are refreshed before use.
   */
  @NotNull
  private Duration refreshBuffer = Duration.minutes(5);

  /**
   * Lifetime of the per-connection refresh lease if its holder never releases it.
   */
  @NotNull
  private Duration refreshLeaseTtl = Duration.seconds(60);

  /**
   * How long a caller that lost the refresh lease waits before re-reading the connection.
   */
  @NotNull
  private Duration refreshLockWait = Duration.seconds(2);

  /**
   * Timeout on each provider request. Must be shorter than {@code refreshLeaseTtl}.
   */
  @NotNull
  private Duration providerRequestTimeout = Duration.seconds(20);

  /**
   * Redis URI for leases and OAuth states, e.g. {@code redis://localhost:6379}.
   * Leave empty for in-memory stores (single instance only).
   */
  private String redisUri = "";

  /**
   * Prefix for every Redis key.
   */
  private String redisKeyPrefix = "tether:";

  /**
   * Database holding provider connections. Omit for an in-memory store (dev only).
   */
  @Valid
  private DataSourceFactory database = null;

  /**
   * Create the {@code provider_connections} table on startup when it is missing.
   */
  private boolean createSchema = true;

  /**
   * Gets encryption key hex.
   *
   * @return the encryption key hex
   */
  @JsonProperty
  public String getEncryptionKeyHex() {
    return encryptionKeyHex;
  }

  /**
   * Sets encryption key hex.
   *
   * @param encryptionKeyHex the encryption key hex
   */
  @JsonProperty
  public void setEncryptionKeyHex(String encryptionKeyHex) {
    this.encryptionKeyHex = encryptionKeyHex;
  }

  /**
   * Gets encryption key version.
   *
   * @return the encryption key version
   */
  @JsonProperty
  public int getEncryptionKeyVersion() {
    return encryptionKeyVersion;
  }

  /**
   * Sets encryption key version.
   *
   * @param encryptionKeyVersion the encryption key version
   */
  @JsonProperty
  public void setEncryptionKeyVersion(int encryptionKeyVersion) {
    this.encryptionKeyVersion = encryptionKeyVersion;
  }

  /**
   * Gets previous encryption key hex.
   *
   * @return the previous encryption key hex
   */
  @JsonProperty
  public String getPreviousEncryptionKeyHex() {
    return previousEncryptionKeyHex;
  }

  /**
   * Sets previous encryption key hex.
   *
   * @param previousEncryptionKeyHex the previous encryption key hex
   */
  @JsonProperty
  public void setPreviousEncryptionKeyHex(String previousEncryptionKeyHex) {
    this.previousEncryptionKeyHex = previousEncryptionKeyHex;
  }

  /**
   * Gets previous encryption key version.
   *
   * @return the previous encryption key version
   */
  @JsonProperty
  public int getPreviousEncryptionKeyVersion() {
    return previousEncryptionKeyVersion;
  }

  /**
   * Sets previous encryption key version.
   *
   * @param previousEncryptionKeyVersion the previous encryption key version
   */
  @JsonProperty
  public void setPreviousEncryptionKeyVersion(int previousEncryptionKeyVersion) {
    this.previousEncryptionKeyVersion = previousEncryptionKeyVersion;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets redirect uri.
   *
   * @return the redirect uri
   */
  @JsonProperty
  public String getRedirectUri() {
    return redirectUri;
  }

  /**
   * Sets redirect uri.
   *
   * @param redirectUri the redirect uri
   */
  @JsonProperty
  public void setRedirectUri(String redirectUri) {
    this.redirectUri = redirectUri;
  }

  /**
   * Gets providers.
   *
   * @return the providers
   */
  @JsonProperty
  public Map<Provider, ProviderConfiguration> getProviders() {
    return providers;
  }

  /**
   * Sets providers.
   *
   * @param providers the providers
   */
  @JsonProperty
  public void setProviders(Map<Provider, ProviderConfiguration> providers) {
    this.providers = providers;
  }

  /**
   * Gets refresh buffer.
   *
   * @return the refresh buffer
   */
  @JsonProperty
  public Duration getRefreshBuffer() {
    return refreshBuffer;
  }

  /**
   * Sets refresh buffer.
   *
   * @param refreshBuffer the refresh buffer
   */
  @JsonProperty
  public void setRefreshBuffer(Duration refreshBuffer) {
    this.refreshBuffer = refreshBuffer;
  }

  /**
   * Gets refresh lease ttl.
   *
   * @return the refresh lease ttl
   */
  @JsonProperty
  public Duration getRefreshLeaseTtl() {
    return refreshLeaseTtl;
  }

  /**
   * Sets refresh lease ttl.
   *
   * @param refreshLeaseTtl the refresh lease ttl
   */
  @JsonProperty
  public void setRefreshLeaseTtl(Duration refreshLeaseTtl) {
    this.refreshLeaseTtl = refreshLeaseTtl;
  }

  /**
   * Gets refresh lock wait.
   *
   * @return the refresh lock wait
   */
  @JsonProperty
  public Duration getRefreshLockWait() {
    return refreshLockWait;
  }

  /**
   * Sets refresh lock wait.
   *
   * @param refreshLockWait the refresh lock wait
   */
  @JsonProperty
  public void setRefreshLockWait(Duration refreshLockWait) {
    this.refreshLockWait = refreshLockWait;
  }

  /**
   * Gets provider request timeout.
   *
   * @return the provider request timeout
   */
  @JsonProperty
  public Duration getProviderRequestTimeout() {
    return providerRequestTimeout;
  }

  /**
   * Sets provider request timeout.
   *
   * @param providerRequestTimeout the provider request timeout
   */
  @JsonProperty
  public void setProviderRequestTimeout(Duration providerRequestTimeout) {
    this.providerRequestTimeout = providerRequestTimeout;
  }

  /**
   * Gets redis uri.
   *
   * @return the redis uri
   */
  @JsonProperty
  public String getRedisUri() {
    return redisUri;
  }

  /**
   * Sets redis uri.
   *
   * @param redisUri the redis uri
   */
  @JsonProperty
  public void setRedisUri(String redisUri) {
    this.redisUri = redisUri;
  }

  /**
   * Gets redis key prefix.
   *
   * @return the redis key prefix
   */
  @JsonProperty
  public String getRedisKeyPrefix() {
    return redisKeyPrefix;
  }

  /**
   * Sets redis key prefix.
   *
   * @param redisKeyPrefix the redis key prefix
   */
  @JsonProperty
  public void setRedisKeyPrefix(String redisKeyPrefix) {
    this.redisKeyPrefix = redisKeyPrefix;
  }

  /**
   * Gets database.
   *
   * @return the database
   */
  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  /**
   * Sets database.
   *
   * @param database the database
   */
  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }

  /**
   * Gets create schema.
   *
   * @return the create schema
   */
  @JsonProperty
  public boolean isCreateSchema() {
    return createSchema;
  }

  /**
   * Sets create schema.
   *
   * @param createSchema the create schema
   */
  @JsonProperty
  public void setCreateSchema(boolean createSchema) {
    this.createSchema = createSchema;
  }
}
