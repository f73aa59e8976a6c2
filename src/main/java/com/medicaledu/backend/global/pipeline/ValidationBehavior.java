package com.medicaledu.backend.global.pipeline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.error.RequestValidationException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(100)
public class ValidationBehavior implements PipelineBehavior {

    private static final Logger log = LoggerFactory.getLogger(ValidationBehavior.class);

    private final Validator validator;
    private final Map<Class<?>, List<RequestValidator<?>>> validatorsByRequest;

    public ValidationBehavior(Validator validator, List<RequestValidator<?>> requestValidators) {
        this.validator = validator;
        this.validatorsByRequest = indexValidators(requestValidators);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        List<String> errors = new ArrayList<>();
        for (ConstraintViolation<Request<R>> violation : validator.validate(request)) {
            errors.add(violation.getPropertyPath() + ": " + violation.getMessage());
        }
        errors.sort(null);

        // rules that hit the database only run once the shape of the request is valid
        if (errors.isEmpty()) {
            for (RequestValidator<?> requestValidator : validatorsByRequest.getOrDefault(request.getClass(), List.of())) {
                errors.addAll(((RequestValidator<Request<R>>) requestValidator).validate(request));
            }
        }

        if (errors.isEmpty()) {
            return next.invoke();
        }

        log.debug("Validation failed for {}: {}", request.getClass().getSimpleName(), errors);
        if (RequestTypes.respondsWithResult(request)) {
            return (R) Result.validationFailure(errors);
        }
        throw new RequestValidationException(errors);
    }

    private static Map<Class<?>, List<RequestValidator<?>>> indexValidators(List<RequestValidator<?>> validators) {
        Map<Class<?>, List<RequestValidator<?>>> index = new HashMap<>();
        for (RequestValidator<?> requestValidator : validators) {
            Class<?> requestType = RequestTypes.resolveRequestType(requestValidator, RequestValidator.class);
            index.computeIfAbsent(requestType, key -> new ArrayList<>()).add(requestValidator);
        }
        return index;
    }
}
