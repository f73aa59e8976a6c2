package com.medicaledu.backend.global.pipeline;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dispatches a request to its single handler through the ordered behaviour chain.
 */
@Component
public class PipelineMediator implements Mediator {

    private static final Logger log = LoggerFactory.getLogger(PipelineMediator.class);

    private final Map<Class<?>, RequestHandler<?, ?>> handlers;
    private final List<PipelineBehavior> behaviors;

    public PipelineMediator(List<RequestHandler<?, ?>> handlers, List<PipelineBehavior> behaviors) {
        this.handlers = indexHandlers(handlers);
        this.behaviors = List.copyOf(behaviors);
        log.info("Mediator registered {} handlers and {} behaviours", this.handlers.size(), this.behaviors.size());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R send(Request<R> request) {
        if (request == null) {
            throw new IllegalArgumentException("Request must not be null");
        }
        RequestHandler<Request<R>, R> handler = (RequestHandler<Request<R>, R>) handlers.get(request.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + request.getClass().getName());
        }

        RequestHandlerDelegate<R> next = () -> handler.handle(request);
        for (int i = behaviors.size() - 1; i >= 0; i--) {
            PipelineBehavior behavior = behaviors.get(i);
            RequestHandlerDelegate<R> inner = next;
            next = () -> behavior.handle(request, inner);
        }
        return next.invoke();
    }

    private static Map<Class<?>, RequestHandler<?, ?>> indexHandlers(List<RequestHandler<?, ?>> handlers) {
        Map<Class<?>, RequestHandler<?, ?>> index = new HashMap<>();
        for (RequestHandler<?, ?> handler : handlers) {
            Class<?> requestType = RequestTypes.resolveRequestType(handler, RequestHandler.class);
            RequestHandler<?, ?> existing = index.putIfAbsent(requestType, handler);
            if (existing != null) {
                throw new IllegalStateException("Multiple handlers registered for " + requestType.getName());
            }
        }
        return Map.copyOf(index);
    }
}
