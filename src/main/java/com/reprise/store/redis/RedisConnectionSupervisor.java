package com.reprise.store.redis;

import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisConnectionStateListener;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Owns the single Redis connection and its reconnect policy.
 *
 * State machine:
 * DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED → ... → FAILED
 *
 * A failed connect or a lost connection schedules the next attempt after
 * min(attempt * 100ms, 3000ms). Once more than {@code maxReconnectAttempts} attempts
 * have failed in a row the supervisor stops and stays FAILED. A successful connect
 * resets the attempt counter.
 *
 * The state is informational: commands are never held back while disconnected, they
 * are attempted and allowed to fail.
 */
@Slf4j
public class RedisConnectionSupervisor implements RedisConnectionStateListener, AutoCloseable {

    static final long BACKOFF_STEP_MS = 100;
    static final long MAX_BACKOFF_MS = 3000;

    private final Supplier<CompletionStage<StatefulRedisConnection<String, String>>> connector;
    private final int maxReconnectAttempts;
    private final Scheduler reconnectScheduler;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicInteger attempts = new AtomicInteger();
    private volatile StatefulRedisConnection<String, String> connection;
    private volatile boolean closed;

    public RedisConnectionSupervisor(Supplier<CompletionStage<StatefulRedisConnection<String, String>>> connector,
                                     int maxReconnectAttempts,
                                     Scheduler reconnectScheduler) {
        this.connector = connector;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.reconnectScheduler = reconnectScheduler;
    }

    /**
     * Begin connecting in the background. Returns immediately.
     */
    public void start() {
        connect();
    }

    /**
     * Reactive command API of the current connection.
     *
     * @return commands, or an error when no connection has been established
     */
    public Mono<RedisReactiveCommands<String, String>> commands() {
        return Mono.defer(() -> {
            StatefulRedisConnection<String, String> current = connection;
            if (current == null) {
                return Mono.error(new RedisConnectionException("Redis connection not established (state=" + state.get() + ")"));
            }
            return Mono.just(current.reactive());
        });
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED;
    }

    public int getAttempts() {
        return attempts.get();
    }

    /**
     * Linear backoff for the given 1-based attempt, capped at three seconds.
     */
    public static Duration backoff(int attempt) {
        return Duration.ofMillis(Math.min(attempt * BACKOFF_STEP_MS, MAX_BACKOFF_MS));
    }

    void connect() {
        if (closed || !state.compareAndSet(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING)) {
            return;
        }

        CompletionStage<StatefulRedisConnection<String, String>> pending;
        try {
            pending = connector.get();
        } catch (RuntimeException e) {
            onConnectFailure(e);
            return;
        }

        pending.whenComplete((established, error) -> {
            if (error != null) {
                onConnectFailure(error);
            } else {
                onConnected(established);
            }
        });
    }

    private void onConnected(StatefulRedisConnection<String, String> established) {
        if (closed) {
            established.closeAsync();
            return;
        }
        connection = established;
        if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CONNECTED)) {
            connection = null;
            established.closeAsync();
            return;
        }

        // a close event that fired before the state flipped was dropped by onConnectionLost
        if (!established.isOpen()) {
            log.warn("Redis: Connection closed right after connecting");
            onConnectionLost();
            return;
        }

        attempts.set(0);
        log.info("Redis: Connected successfully");
    }

    private void onConnectFailure(Throwable error) {
        log.error("Failed to connect to Redis: {}", error.getMessage());
        state.set(ConnectionState.DISCONNECTED);
        scheduleReconnect();
    }

    private void onConnectionLost() {
        if (!state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED)) {
            return;
        }
        StatefulRedisConnection<String, String> lost = connection;
        connection = null;
        if (lost != null) {
            lost.closeAsync();
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closed) {
            return;
        }

        int attempt = attempts.incrementAndGet();
        if (attempt > maxReconnectAttempts) {
            state.set(ConnectionState.FAILED);
            log.error("Redis: Max reconnection attempts reached ({}), cache stays unavailable", maxReconnectAttempts);
            return;
        }

        Duration delay = backoff(attempt);
        log.debug("Redis: reconnect attempt {} of {} in {}ms", attempt, maxReconnectAttempts, delay.toMillis());
        reconnectScheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isCurrent(RedisChannelHandler<?, ?> handler) {
        StatefulRedisConnection<String, String> current = connection;
        return current != null && current == (Object) handler;
    }

    @Override
    public void onRedisConnected(RedisChannelHandler<?, ?> handler, SocketAddress socketAddress) {
        log.debug("Redis: channel active to {}", socketAddress);
    }

    @Override
    public void onRedisDisconnected(RedisChannelHandler<?, ?> handler) {
        if (isCurrent(handler)) {
            log.warn("Redis: Connection closed");
            onConnectionLost();
        }
    }

    @Override
    public void onRedisExceptionCaught(RedisChannelHandler<?, ?> handler, Throwable cause) {
        log.error("Redis connection error: {}", cause.getMessage());
        if (isCurrent(handler) && !handler.isOpen()) {
            onConnectionLost();
        }
    }

    @Override
    public void close() {
        closed = true;
        StatefulRedisConnection<String, String> current = connection;
        connection = null;
        state.set(ConnectionState.DISCONNECTED);
        if (current != null) {
            current.closeAsync();
        }
        reconnectScheduler.dispose();
    }
}
