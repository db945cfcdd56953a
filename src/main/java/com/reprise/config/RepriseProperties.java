package com.reprise.config;

import com.reprise.model.CacheOptions;
import com.reprise.model.CacheRouteConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Reprise.
 *
 * Read once at startup; nothing here is hot-reloaded.
 */
@Data
@Component
@ConfigurationProperties(prefix = "reprise")
public class RepriseProperties {

    private CacheConfig cache = new CacheConfig();
    private RedisConfig redis = new RedisConfig();
    private List<RouteConfig> routes = new ArrayList<>();

    /**
     * In-process store settings.
     */
    @Data
    public static class CacheConfig {
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration defaultTtl = Duration.ofDays(1);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration checkPeriod = Duration.ofMinutes(10);

        /**
         * Capacity ceiling, zero or negative means unbounded.
         */
        private int maxKeys = 1000;

        public CacheOptions toOptions() {
            return CacheOptions.builder()
                    .defaultTtlSeconds(defaultTtl.toSeconds())
                    .checkPeriodSeconds(checkPeriod.toSeconds())
                    .maxKeys(maxKeys)
                    .build();
        }
    }

    /**
     * Networked store settings.
     */
    @Data
    public static class RedisConfig {
        private boolean enabled = false;
        private String url;
        private int maxReconnectAttempts = 50;

        /**
         * Advisory only, reported in status but not enforced.
         */
        private int connectionPoolSize = 50;
        private String keyPrefix = "reprise:";
        private Duration commandTimeout = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    /**
     * Declarative per-route cache policy.
     */
    @Data
    public static class RouteConfig {
        private String path;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration duration;

        private List<String> keyParams = new ArrayList<>();
        private List<String> ignoreParams = new ArrayList<>();
        private List<String> varyByHeaders = new ArrayList<>();

        public CacheRouteConfig toRouteConfig() {
            return CacheRouteConfig.builder()
                    .duration(duration != null ? duration.toSeconds() : null)
                    .keyParams(keyParams.isEmpty() ? null : List.copyOf(keyParams))
                    .ignoreParams(ignoreParams.isEmpty() ? null : List.copyOf(ignoreParams))
                    .varyByHeaders(varyByHeaders.isEmpty() ? null : List.copyOf(varyByHeaders))
                    .build();
        }
    }
}
