package com.salonhub.authservice.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Caps how often one client IP may call the annotated endpoint. The window is fixed, not sliding: it
 * opens on the first request and the count starts over once it has passed.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    /** Requests allowed per window. */
    int requests();

    int perSeconds() default 60;

    /** Endpoints naming the same bucket draw from one counter per client. */
    String bucket();

    /** Detail of the 429 response. */
    String message() default "Too many requests. Please try again later.";
}
