package com.reprise.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Lettuce client for the networked cache store.
 *
 * Lettuce's own reconnect is switched off: reconnects are driven by
 * {@link com.reprise.store.redis.RedisConnectionSupervisor} so the attempt ceiling and
 * backoff stay under our control. Commands issued while disconnected fail immediately.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "reprise.redis", name = "enabled", havingValue = "true")
public class RedisConfiguration {

    @Bean(destroyMethod = "shutdown")
    public RedisClient redisClient(RepriseProperties properties) {
        RepriseProperties.RedisConfig redis = properties.getRedis();

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(redis.getConnectTimeout())
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(false)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .timeoutOptions(TimeoutOptions.enabled(redis.getCommandTimeout()))
                .build();

        RedisClient client = RedisClient.create();
        client.setOptions(clientOptions);

        log.info("Configured Redis client: connectTimeout={}, commandTimeout={}",
                redis.getConnectTimeout(), redis.getCommandTimeout());
        return client;
    }
}
