package com.codeheadsystems.tether.server.kv;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.params.SetParams;

/**
 * {@link KeyValueStore} on Redis, shared by every server instance.
 * <p>
 * {@link #putIfAbsent} is a single {@code SET NX PX}; {@link #deleteIfEquals} runs a Lua
 * script so the compare and the delete happen atomically on the server.
 */
public class RedisKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

  private static final String DELETE_IF_EQUALS = """
      if redis.call('get', KEYS[1]) == ARGV[1] then
        return redis.call('del', KEYS[1])
      else
        return 0
      end
      """;

  private final UnifiedJedis jedis;
  private final String keyPrefix;

  /**
   * Instantiates a new Redis key value store.
   *
   * @param jedis     the client, typically a {@code JedisPooled}
   * @param keyPrefix prefix for every key, e.g. {@code "tether:"}; may be empty
   */
  public RedisKeyValueStore(UnifiedJedis jedis, String keyPrefix) {
    log.info("RedisKeyValueStore(prefix={})", keyPrefix);
    this.jedis = jedis;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
  }

  @Override
  public boolean putIfAbsent(String key, String value, Duration ttl) {
    String reply = jedis.set(keyPrefix + key, value, SetParams.setParams().nx().px(ttl.toMillis()));
    return "OK".equals(reply);
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(jedis.get(keyPrefix + key));
  }

  @Override
  public boolean deleteIfEquals(String key, String expected) {
    Object reply = jedis.eval(DELETE_IF_EQUALS, List.of(keyPrefix + key), List.of(expected));
    return reply instanceof Long count && count > 0;
  }

  @Override
  public void delete(String key) {
    jedis.del(keyPrefix + key);
  }
}
