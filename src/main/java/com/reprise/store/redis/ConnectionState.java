package com.reprise.store.redis;

/**
 * Lifecycle of the Redis connection as driven by {@link RedisConnectionSupervisor}.
 */
public enum ConnectionState {

    DISCONNECTED,

    CONNECTING,

    CONNECTED,

    /**
     * Reconnect attempts exhausted; no further connection is attempted.
     */
    FAILED
}
