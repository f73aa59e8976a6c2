package com.medicaledu.backend.global.pipeline;

public interface Mediator {

    <R> R send(Request<R> request);
}
