package com.medicaledu.backend.global.pipeline;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CacheProperties;
import com.medicaledu.backend.global.cache.CacheService;
import com.medicaledu.backend.global.common.result.Result;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Drops the cache prefixes a command declares once it has succeeded. Inside a transaction the
 * eviction waits for the commit, so a concurrent reader cannot re-cache pre-commit state.
 */
@Component
@Order(500)
public class CacheInvalidationBehavior implements PipelineBehavior {

    private static final Logger log = LoggerFactory.getLogger(CacheInvalidationBehavior.class);

    static final String DEVELOPMENT_PROFILE = "development";

    private final CacheService cacheService;
    private final CacheProperties.Invalidation properties;
    private final Environment environment;
    private final Map<Class<?>, List<CacheInvalidation>> invalidationsByType = new ConcurrentHashMap<>();

    public CacheInvalidationBehavior(CacheService cacheService, CacheProperties cacheProperties, Environment environment) {
        this.cacheService = cacheService;
        this.properties = cacheProperties.getInvalidation();
        this.environment = environment;
    }

    @Override
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        if (!(request instanceof Command<?>)) {
            return next.invoke();
        }

        String commandName = request.getClass().getSimpleName();
        List<CacheInvalidation> invalidations = invalidationsByType.computeIfAbsent(request.getClass(),
                type -> List.of(type.getAnnotationsByType(CacheInvalidation.class)));
        if (invalidations.isEmpty() && mustDeclareInvalidation()) {
            throw new IllegalStateException("Command " + commandName + " does not declare @CacheInvalidation");
        }

        R response = next.invoke();
        if (response instanceof Result<?> result && result.isFailure()) {
            log.debug("Skipping cache invalidation for failed {}", commandName);
            return response;
        }

        Runnable invalidation = () -> invalidate(commandName, invalidations);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    invalidation.run();
                }
            });
        } else {
            invalidation.run();
        }
        return response;
    }

    private boolean mustDeclareInvalidation() {
        if (properties.isRequireExplicitAttributes()) {
            return true;
        }
        return properties.isThrowOnMissingAttributesInDevelopment()
                && environment.acceptsProfiles(Profiles.of(DEVELOPMENT_PROFILE));
    }

    private void invalidate(String commandName, List<CacheInvalidation> invalidations) {
        if (invalidations.isEmpty()) {
            log.warn("Command {} declares no cache invalidation, clearing the entire cache", commandName);
            cacheService.clear();
            return;
        }
        Set<String> prefixes = new LinkedHashSet<>();
        for (CacheInvalidation invalidation : invalidations) {
            prefixes.addAll(Arrays.asList(invalidation.prefixes()));
        }
        int removed = 0;
        for (String prefix : prefixes) {
            removed += cacheService.removeByPrefix(prefix);
        }
        log.info("Command {} invalidated cache prefixes {} ({} entries)", commandName, prefixes, removed);
    }
}
