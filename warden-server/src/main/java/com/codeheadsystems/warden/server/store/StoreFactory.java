package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.config.StorageBackend;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the challenge and device key stores for the configured {@link StorageBackend}.
 * <p>
 * The backend is never chosen implicitly. Asking for {@link StorageBackend#REDIS} without a URI,
 * or with a Redis that cannot be reached, fails startup instead of falling back to memory.
 */
public class StoreFactory {

  private static final Logger log = LoggerFactory.getLogger(StoreFactory.class);

  /**
   * Creates the stores.
   *
   * @param backend          the configured backend
   * @param redisUri         Redis URI, required for {@link StorageBackend#REDIS}
   * @param challengeTimeout lifetime of issued challenges
   * @param commandTimeout   timeout applied to every Redis command
   * @return the stores
   * @throws IllegalStateException if the configuration is incomplete or Redis is unreachable
   */
  public Stores create(StorageBackend backend,
                       String redisUri,
                       Duration challengeTimeout,
                       Duration commandTimeout) {
    return create(backend, redisUri, challengeTimeout, commandTimeout, ChallengeStore.DEFAULT_MAX_OUTSTANDING);
  }

  /**
   * Creates the stores with an explicit cap on outstanding challenges.
   *
   * @param backend                   the configured backend
   * @param redisUri                  Redis URI, required for {@link StorageBackend#REDIS}
   * @param challengeTimeout          lifetime of issued challenges
   * @param commandTimeout            timeout applied to every Redis command
   * @param maxOutstandingChallenges  how many unconsumed, unexpired challenges may exist at once
   * @return the stores
   * @throws IllegalStateException if the configuration is incomplete or Redis is unreachable
   */
  public Stores create(StorageBackend backend,
                       String redisUri,
                       Duration challengeTimeout,
                       Duration commandTimeout,
                       int maxOutstandingChallenges) {
    if (backend == null) {
      throw new IllegalStateException("A storage backend must be configured (MEMORY or REDIS)");
    }
    if (maxOutstandingChallenges < 1) {
      throw new IllegalStateException("maxOutstandingChallenges must be positive");
    }
    return switch (backend) {
      case MEMORY -> memory(challengeTimeout, maxOutstandingChallenges);
      case REDIS -> redis(redisUri, challengeTimeout, commandTimeout, maxOutstandingChallenges);
    };
  }

  static Stores memory(Duration challengeTimeout, int maxOutstandingChallenges) {
    log.warn("""
        #################################################################
        # WARNING: Using in-memory attestation stores. Challenges and   #
        # device keys are lost on restart and are NOT shared between    #
        # instances. Use the REDIS backend for multi-instance setups.   #
        #################################################################
        """);
    return new Stores(StorageBackend.MEMORY,
        new InMemoryChallengeStore(challengeTimeout, maxOutstandingChallenges, Clock.systemUTC()),
        new InMemoryDeviceKeyStore(),
        () -> true,
        () -> { });
  }

  private Stores redis(String redisUri, Duration challengeTimeout, Duration commandTimeout,
                       int maxOutstandingChallenges) {
    if (redisUri == null || redisUri.isBlank()) {
      throw new IllegalStateException("storageBackend is REDIS but no redisUri is configured");
    }
    RedisURI uri = RedisURI.create(redisUri);
    uri.setTimeout(commandTimeout);
    RedisClient client = RedisClient.create(uri);
    StatefulRedisConnection<String, String> connection;
    try {
      connection = client.connect();
    } catch (RedisException e) {
      client.shutdown();
      throw new IllegalStateException("Unable to connect to Redis at " + uri.getHost() + ":" + uri.getPort(), e);
    }
    log.info("Using Redis attestation stores at {}:{}", uri.getHost(), uri.getPort());
    return forRedis(connection.sync(), challengeTimeout, maxOutstandingChallenges, () -> {
      connection.close();
      client.shutdown();
    });
  }

  static Stores forRedis(RedisCommands<String, String> commands,
                         Duration challengeTimeout,
                         int maxOutstandingChallenges,
                         Runnable closer) {
    return new Stores(StorageBackend.REDIS,
        new RedisChallengeStore(commands, challengeTimeout, maxOutstandingChallenges, Clock.systemUTC()),
        new RedisDeviceKeyStore(commands),
        () -> ping(commands),
        closer);
  }

  private static boolean ping(RedisCommands<String, String> commands) {
    try {
      return "PONG".equalsIgnoreCase(commands.ping());
    } catch (RedisException e) {
      log.warn("Redis health check failed: {}", e.getMessage());
      return false;
    }
  }
}
