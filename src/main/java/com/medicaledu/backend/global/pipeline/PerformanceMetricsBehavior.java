package com.medicaledu.backend.global.pipeline;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(300)
public class PerformanceMetricsBehavior implements PipelineBehavior {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMetricsBehavior.class);

    static final long SLOW_THRESHOLD_MS = 1000;
    static final long MODERATE_THRESHOLD_MS = 500;

    @Override
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        String requestName = request.getClass().getSimpleName();
        long started = System.nanoTime();
        try {
            R response = next.invoke();
            report(requestName, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return response;
        } catch (RuntimeException ex) {
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            log.error("Request {} failed after {} ms", requestName, elapsed, ex);
            throw ex;
        }
    }

    private void report(String requestName, long elapsedMs) {
        if (elapsedMs > SLOW_THRESHOLD_MS) {
            log.warn("Slow request {} took {} ms", requestName, elapsedMs);
        } else if (elapsedMs > MODERATE_THRESHOLD_MS) {
            log.info("Request {} took {} ms", requestName, elapsedMs);
        } else {
            log.debug("Request {} took {} ms", requestName, elapsedMs);
        }
    }
}
