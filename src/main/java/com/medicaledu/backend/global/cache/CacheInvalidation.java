package com.medicaledu.backend.global.cache;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares which cache prefixes a command makes stale. Evaluated after the command succeeds.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Repeatable(CacheInvalidations.class)
public @interface CacheInvalidation {

    String[] prefixes();

    String reason() default "";
}
