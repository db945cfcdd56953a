package com.reprise.controller;

import com.reprise.model.dto.CacheStatus;
import com.reprise.service.ResponseCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Cache management controller.
 * Exposes backend status, the stored keys and (pattern) invalidation.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheAdminController {

    private final ResponseCacheManager cacheManager;

    public CacheAdminController(ResponseCacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    @GetMapping("/status")
    public Mono<CacheStatus> getStatus() {
        return cacheManager.status();
    }

    @GetMapping("/keys")
    public Mono<Map<String, Object>> getKeys() {
        return cacheManager.keys()
                .sort()
                .collectList()
                .map(keys -> Map.<String, Object>of(
                        "count", keys.size(),
                        "keys", keys));
    }

    /**
     * Clear the whole cache, or only the keys matching {@code pattern} (a regular expression).
     */
    @PostMapping("/clear")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache(
            @RequestParam(name = "pattern", required = false) String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            log.info("Cache clear requested");
            return cacheManager.keys().count()
                    .flatMap(count -> cacheManager.clearCache().thenReturn(count))
                    .map(CacheAdminController::success);
        }

        Pattern compiled = Pattern.compile(pattern);
        log.info("Cache clear requested for pattern '{}'", pattern);
        return cacheManager.clearCache(compiled)
                .map(CacheAdminController::success);
    }

    @ExceptionHandler(PatternSyntaxException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidPattern(PatternSyntaxException e) {
        log.warn("Rejected cache clear with invalid pattern: {}", e.getDescription());
        return ResponseEntity.badRequest().body(Map.<String, Object>of(
                "status", "error",
                "message", "Invalid pattern: " + e.getDescription()));
    }

    private static ResponseEntity<Map<String, Object>> success(long cleared) {
        return ResponseEntity.ok(Map.<String, Object>of(
                "status", "success",
                "cleared", cleared));
    }
}
