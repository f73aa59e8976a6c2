package com.medicaledu.backend.global.pipeline;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medicaledu.backend.global.cache.CacheEntryOptions;
import com.medicaledu.backend.global.cache.CacheProperties;
import com.medicaledu.backend.global.cache.CacheService;
import com.medicaledu.backend.global.common.result.Result;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(200)
public class CachingBehavior implements PipelineBehavior {

    private static final Logger log = LoggerFactory.getLogger(CachingBehavior.class);

    private final CacheService cacheService;
    private final CacheProperties cacheProperties;
    private final ObjectMapper objectMapper;

    public CachingBehavior(CacheService cacheService, CacheProperties cacheProperties, ObjectMapper objectMapper) {
        this.cacheService = cacheService;
        this.cacheProperties = cacheProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        if (!(request instanceof CacheableQuery<?> query)) {
            return next.invoke();
        }

        String key = cacheKey(query);
        Optional<Object> cached = cacheService.get(key, Object.class);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", key);
            return (R) cached.get();
        }
        log.debug("Cache miss for {}", key);

        R response = next.invoke();
        if (response == null || (response instanceof Result<?> result && result.isFailure())) {
            return response;
        }
        cacheService.set(key, response,
                new CacheEntryOptions(query.cacheDuration(), cacheProperties.getDefaultSlidingExpiration()));
        return response;
    }

    String cacheKey(CacheableQuery<?> query) {
        String explicit = query.cacheKey();
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        return query.cachePrefix() + "_" + sha256(serialize(query));
    }

    private String serialize(CacheableQuery<?> query) {
        try {
            return objectMapper.writeValueAsString(query);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot build cache key for " + query.getClass().getSimpleName(), ex);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
