package com.codeheadsystems.warden.server.config;

/**
 * Where challenge and device key state lives.
 * <p>
 * The choice is explicit configuration. A shared deployment that silently used process-local
 * state would accept replays made against another instance and reject valid assertions.
 */
public enum StorageBackend {
  /**
   * Process-local maps. Only correct for a single server instance.
   */
  MEMORY,
  /**
   * Redis, shared by every instance behind the load balancer.
   */
  REDIS
}
