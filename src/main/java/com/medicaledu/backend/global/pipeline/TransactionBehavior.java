package com.medicaledu.backend.global.pipeline;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.error.RetryableProblemException;

import io.github.resilience4j.retry.Retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs commands in a REQUIRED transaction, retrying transient database failures with
 * exponential backoff. A failed {@link Result} rolls the transaction back.
 */
@Component
@Order(400)
public class TransactionBehavior implements PipelineBehavior {

    private static final Logger log = LoggerFactory.getLogger(TransactionBehavior.class);

    static final String RETRY_EXHAUSTED_CODE = "TRANSACTION_RETRY_EXHAUSTED";
    private static final int RETRY_AFTER_SECONDS = 1;

    private final TransactionTemplate transactionTemplate;
    private final Retry transactionRetry;

    public TransactionBehavior(PlatformTransactionManager transactionManager, Retry transactionRetry) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.transactionRetry = transactionRetry;
    }

    @Override
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        if (!(request instanceof Command<?>)) {
            return next.invoke();
        }

        String requestName = request.getClass().getSimpleName();
        try {
            return transactionRetry.executeSupplier(() -> executeInTransaction(requestName, next));
        } catch (RuntimeException ex) {
            if (TransactionRetryConfig.isTransient(ex)) {
                log.error("Transaction for {} failed after {} attempts", requestName,
                        transactionRetry.getRetryConfig().getMaxAttempts(), ex);
                throw new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, RETRY_EXHAUSTED_CODE,
                        "The operation could not be completed, please retry", RETRY_AFTER_SECONDS, ex);
            }
            throw ex;
        }
    }

    private <R> R executeInTransaction(String requestName, RequestHandlerDelegate<R> next) {
        return transactionTemplate.execute(status -> {
            log.info("Beginning transaction for {}", requestName);
            try {
                R response = next.invoke();
                if (response instanceof Result<?> result && result.isFailure()) {
                    status.setRollbackOnly();
                    log.error("Rolling back transaction for {}: {}", requestName, result.getErrors());
                } else {
                    log.info("Committing transaction for {}", requestName);
                }
                return response;
            } catch (RuntimeException ex) {
                log.error("Rolling back transaction for {}", requestName, ex);
                throw ex;
            }
        });
    }
}
