package com.codeheadsystems.warden.server.store;

import io.lettuce.core.Range;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.sync.RedisCommands;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChallengeStore} shared between server instances through Redis.
 * <p>
 * Each challenge is its own key, {@code warden:challenge:<identifier>:<nonce>}, written with a
 * {@code PX} expiry equal to the challenge timeout, so Redis reclaims expired challenges.
 * Consumption is a {@code DEL}: Redis reports the deletion to exactly one client, which makes
 * validation linearizable across instances.
 * <p>
 * Outstanding challenges are also indexed in the sorted set {@code warden:challenges}, scored by
 * expiry, so the cap holds across the whole fleet. Issuance and consumption update the index in
 * the same script as the challenge key.
 */
public class RedisChallengeStore implements ChallengeStore {

  private static final Logger log = LoggerFactory.getLogger(RedisChallengeStore.class);

  static final String KEY_PREFIX = "warden:challenge:";
  static final String INDEX_KEY = "warden:challenges";

  // 1 stored, 0 nonce collision, -1 store full.
  static final String GENERATE_SCRIPT = """
      redis.call('ZREMRANGEBYSCORE', KEYS[2], '-inf', ARGV[1])
      if redis.call('ZCARD', KEYS[2]) >= tonumber(ARGV[3]) then
        return -1
      end
      if not redis.call('SET', KEYS[1], ARGV[1], 'NX', 'PX', ARGV[2]) then
        return 0
      end
      redis.call('ZADD', KEYS[2], tonumber(ARGV[1]) + tonumber(ARGV[2]), KEYS[1])
      redis.call('PEXPIRE', KEYS[2], ARGV[2])
      return 1
      """;

  static final String CONSUME_SCRIPT = """
      local deleted = redis.call('DEL', KEYS[1])
      redis.call('ZREM', KEYS[2], KEYS[1])
      return deleted
      """;

  private final RedisCommands<String, String> commands;
  private final Duration timeout;
  private final int maxOutstanding;
  private final Clock clock;

  public RedisChallengeStore(RedisCommands<String, String> commands, Duration timeout) {
    this(commands, timeout, DEFAULT_MAX_OUTSTANDING, Clock.systemUTC());
  }

  public RedisChallengeStore(RedisCommands<String, String> commands,
                             Duration timeout,
                             int maxOutstanding,
                             Clock clock) {
    if (maxOutstanding < 1) {
      throw new IllegalArgumentException("maxOutstanding must be positive");
    }
    this.commands = commands;
    this.timeout = timeout;
    this.maxOutstanding = maxOutstanding;
    this.clock = clock;
  }

  @Override
  public String generate(String identifier) {
    ChallengeNonces.requireIdentifier(identifier);
    String nonce = ChallengeNonces.generate();
    Long result = eval(GENERATE_SCRIPT, challengeKey(identifier, nonce),
        Long.toString(clock.millis()), Long.toString(timeout.toMillis()), Integer.toString(maxOutstanding));
    if (result == null) {
      throw new StoreException("Challenge script returned no result", null);
    }
    if (result == -1L) {
      log.warn("Challenge store full ({} outstanding), refusing to issue", maxOutstanding);
      throw new IllegalStateException("Too many outstanding challenges");
    }
    if (result != 1L) {
      throw new StoreException("Challenge was not stored (reply: " + result + ")", null);
    }
    return nonce;
  }

  @Override
  public boolean validate(String identifier, String nonce) {
    if (identifier == null || !ChallengeNonces.isWellFormed(nonce)) {
      return false;
    }
    Long deleted = eval(CONSUME_SCRIPT, challengeKey(identifier, nonce));
    return deleted != null && deleted == 1L;
  }

  /**
   * Drops expired entries from the index. The challenge keys themselves expire by TTL.
   */
  @Override
  public int purgeExpired() {
    Long removed;
    try {
      removed = commands.zremrangebyscore(INDEX_KEY,
          Range.from(Range.Boundary.<Long>unbounded(), Range.Boundary.including(clock.millis())));
    } catch (RedisException e) {
      throw new StoreException("Failed to purge challenge index", e);
    }
    int purged = removed == null ? 0 : removed.intValue();
    log.trace("purgeExpired(): {} index entries removed", purged);
    return purged;
  }

  private Long eval(String script, String challengeKey, String... args) {
    try {
      return commands.eval(script, ScriptOutputType.INTEGER, new String[]{challengeKey, INDEX_KEY}, args);
    } catch (RedisException e) {
      throw new StoreException("Challenge script failed", e);
    }
  }

  static String challengeKey(String identifier, String nonce) {
    return KEY_PREFIX + identifier + ":" + nonce;
  }
}
