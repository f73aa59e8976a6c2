package com.medicaledu.backend.global.pipeline;

/**
 * Step wrapped around every handler invocation. Behaviours run in {@code @Order} order and
 * either call {@code next} or short-circuit with their own response.
 */
public interface PipelineBehavior {

    <R> R handle(Request<R> request, RequestHandlerDelegate<R> next);
}
