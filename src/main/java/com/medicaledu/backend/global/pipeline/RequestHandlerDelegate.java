package com.medicaledu.backend.global.pipeline;

@FunctionalInterface
public interface RequestHandlerDelegate<R> {

    R invoke();
}
