package com.medicaledu.backend.global.pipeline;

import java.time.Duration;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

@Configuration
public class TransactionRetryConfig {

    public static final String RETRY_NAME = "transactionRetry";

    @Bean
    public Retry transactionRetry(
            @Value("${app.transaction.max-attempts:3}") int maxAttempts,
            @Value("${app.transaction.initial-backoff:100ms}") Duration initialBackoff
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0))
                .retryOnException(TransactionRetryConfig::isTransient)
                .build();
        return RetryRegistry.of(config).retry(RETRY_NAME);
    }

    public static boolean isTransient(Throwable throwable) {
        return throwable instanceof TransientDataAccessException
                || throwable instanceof CannotAcquireLockException
                || throwable instanceof PessimisticLockingFailureException
                || throwable instanceof OptimisticLockingFailureException
                || throwable instanceof CannotCreateTransactionException;
    }
}
