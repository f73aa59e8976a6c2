package com.medicaledu.backend.global.cache;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.cache")
public class CacheProperties {

    private long maximumSize = 10_000;

    private Duration defaultSlidingExpiration = Duration.ofMinutes(5);

    private final Invalidation invalidation = new Invalidation();

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public Duration getDefaultSlidingExpiration() {
        return defaultSlidingExpiration;
    }

    public void setDefaultSlidingExpiration(Duration defaultSlidingExpiration) {
        this.defaultSlidingExpiration = defaultSlidingExpiration;
    }

    public Invalidation getInvalidation() {
        return invalidation;
    }

    public static class Invalidation {

        /**
         * Fail commands that carry no {@link CacheInvalidation} instead of clearing the whole cache.
         */
        private boolean requireExplicitAttributes = false;

        /**
         * Same as {@link #requireExplicitAttributes}, but only while the {@code development} profile is active.
         */
        private boolean throwOnMissingAttributesInDevelopment = true;

        public boolean isRequireExplicitAttributes() {
            return requireExplicitAttributes;
        }

        public void setRequireExplicitAttributes(boolean requireExplicitAttributes) {
            this.requireExplicitAttributes = requireExplicitAttributes;
        }

        public boolean isThrowOnMissingAttributesInDevelopment() {
            return throwOnMissingAttributesInDevelopment;
        }

        public void setThrowOnMissingAttributesInDevelopment(boolean throwOnMissingAttributesInDevelopment) {
            this.throwOnMissingAttributesInDevelopment = throwOnMissingAttributesInDevelopment;
        }
    }
}
