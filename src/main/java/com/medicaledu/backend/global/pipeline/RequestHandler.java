package com.medicaledu.backend.global.pipeline;

public interface RequestHandler<Q extends Request<R>, R> {

    R handle(Q request);
}
