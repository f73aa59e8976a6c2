package com.medicaledu.backend.global.pipeline;

import java.util.List;

/**
 * Validation rule for one request type that bean validation annotations cannot express,
 * typically because it needs a repository lookup.
 */
public interface RequestValidator<Q extends Request<?>> {

    /**
     * @return error messages; empty when the request is valid
     */
    List<String> validate(Q request);
}
