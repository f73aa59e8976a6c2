package com.medicaledu.backend.global.pipeline;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.medicaledu.backend.global.common.result.Result;

import org.springframework.aop.support.AopUtils;
import org.springframework.core.ResolvableType;

public final class RequestTypes {

    private static final Map<Class<?>, Boolean> RESULT_RESPONSES = new ConcurrentHashMap<>();

    private RequestTypes() {
    }

    public static boolean respondsWithResult(Request<?> request) {
        return RESULT_RESPONSES.computeIfAbsent(request.getClass(), type -> {
            Class<?> response = ResolvableType.forClass(type).as(Request.class).getGeneric(0).resolve();
            return response != null && Result.class.isAssignableFrom(response);
        });
    }

    /**
     * Resolves the request type a handler or validator bean is declared for.
     */
    public static Class<?> resolveRequestType(Object bean, Class<?> contract) {
        Class<?> target = AopUtils.getTargetClass(bean);
        Class<?> requestType = ResolvableType.forClass(target).as(contract).getGeneric(0).resolve();
        if (requestType == null) {
            throw new IllegalStateException("Cannot resolve request type of " + target.getName());
        }
        return requestType;
    }
}
