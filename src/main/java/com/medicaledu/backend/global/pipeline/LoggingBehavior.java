package com.medicaledu.backend.global.pipeline;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(600)
public class LoggingBehavior implements PipelineBehavior {

    private static final Logger log = LoggerFactory.getLogger(LoggingBehavior.class);

    @Override
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        String requestName = request.getClass().getSimpleName();
        log.info("Handling {}", requestName);
        long started = System.nanoTime();
        R response = next.invoke();
        log.info("Handled {} in {} ms", requestName, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return response;
    }
}
