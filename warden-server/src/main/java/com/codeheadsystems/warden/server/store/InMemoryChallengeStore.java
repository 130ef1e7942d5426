package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.Challenge;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ChallengeStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * A consumed challenge is removed from the map, so consumption and reclamation are the same
 * step. Expired challenges are evicted lazily on {@link #validate} and actively by
 * {@link #purgeExpired()}. When the cap is reached, issuance first purges expired challenges
 * and fails only if the store is still full. Only correct for a single server instance.
 */
public class InMemoryChallengeStore implements ChallengeStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryChallengeStore.class);

  private record ChallengeKey(String identifier, String nonce) {
  }

  private final ConcurrentHashMap<ChallengeKey, Challenge> store = new ConcurrentHashMap<>();
  private final Duration timeout;
  private final int maxOutstanding;
  private final Clock clock;

  public InMemoryChallengeStore(Duration timeout) {
    this(timeout, DEFAULT_MAX_OUTSTANDING, Clock.systemUTC());
  }

  public InMemoryChallengeStore(Duration timeout, Clock clock) {
    this(timeout, DEFAULT_MAX_OUTSTANDING, clock);
  }

  public InMemoryChallengeStore(Duration timeout, int maxOutstanding, Clock clock) {
    if (maxOutstanding < 1) {
      throw new IllegalArgumentException("maxOutstanding must be positive");
    }
    this.timeout = timeout;
    this.maxOutstanding = maxOutstanding;
    this.clock = clock;
  }

  @Override
  public String generate(String identifier) {
    ChallengeNonces.requireIdentifier(identifier);
    if (store.size() >= maxOutstanding) {
      purgeExpired();
      if (store.size() >= maxOutstanding) {
        log.warn("Challenge store full ({} outstanding), refusing to issue", store.size());
        throw new IllegalStateException("Too many outstanding challenges");
      }
    }
    String nonce = ChallengeNonces.generate();
    Instant now = clock.instant();
    store.put(new ChallengeKey(identifier, nonce), new Challenge(identifier, nonce, now, now.plus(timeout)));
    log.trace("generate(): {} outstanding", store.size());
    return nonce;
  }

  @Override
  public boolean validate(String identifier, String nonce) {
    if (identifier == null || !ChallengeNonces.isWellFormed(nonce)) {
      return false;
    }
    ChallengeKey key = new ChallengeKey(identifier, nonce);
    Challenge challenge = store.get(key);
    if (challenge == null) {
      return false;
    }
    if (challenge.isExpired(clock.instant())) {
      store.remove(key, challenge);
      return false;
    }
    // Only one caller can remove this exact mapping.
    return store.remove(key, challenge);
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    int purged = 0;
    Iterator<Challenge> challenges = store.values().iterator();
    while (challenges.hasNext()) {
      if (challenges.next().isExpired(now)) {
        challenges.remove();
        purged++;
      }
    }
    if (purged > 0) {
      log.debug("Purged {} expired challenge(s)", purged);
    }
    return purged;
  }

  int size() {
    return store.size();
  }
}
