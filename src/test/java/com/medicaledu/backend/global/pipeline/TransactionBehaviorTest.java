package com.medicaledu.backend.global.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.error.RetryableProblemException;

import io.github.resilience4j.retry.Retry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class TransactionBehaviorTest {

    record Pay() implements Command<Result<String>> {
    }

    record Lookup() implements Request<String> {
    }

    @Mock
    private PlatformTransactionManager transactionManager;

    private TransactionBehavior behavior;

    @BeforeEach
    void setUp() {
        Retry retry = new TransactionRetryConfig().transactionRetry(3, Duration.ofMillis(1));
        behavior = new TransactionBehavior(transactionManager, retry);
    }

    @Test
    void commitsSuccessfulCommand() {
        SimpleTransactionStatus status = new SimpleTransactionStatus();
        when(transactionManager.getTransaction(any(TransactionDefinition.class))).thenReturn(status);

        Result<String> result = behavior.handle(new Pay(), () -> Result.success("paid"));

        assertThat(result.getValue()).isEqualTo("paid");
        assertThat(status.isRollbackOnly()).isFalse();
        verify(transactionManager).commit(status);
    }

    @Test
    @DisplayName("a failed Result marks the transaction rollback-only")
    void failedResultRollsBack() {
        SimpleTransactionStatus status = new SimpleTransactionStatus();
        when(transactionManager.getTransaction(any(TransactionDefinition.class))).thenReturn(status);

        Result<String> result = behavior.handle(new Pay(), () -> Result.conflict("PAYMENT_NOT_PENDING"));

        assertThat(result.isFailure()).isTrue();
        assertThat(status.isRollbackOnly()).isTrue();
    }

    @Test
    @DisplayName("transient lock failures are retried")
    void retriesTransientFailures() {
        when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                .thenAnswer(invocation -> new SimpleTransactionStatus());
        AtomicInteger attempts = new AtomicInteger();

        Result<String> result = behavior.handle(new Pay(), () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("locked");
            }
            return Result.success("paid");
        });

        assertThat(result.getValue()).isEqualTo("paid");
        assertThat(attempts).hasValue(3);
        verify(transactionManager, times(2)).rollback(any(TransactionStatus.class));
    }

    @Test
    @DisplayName("exhausted retries surface as 503 with a retry hint")
    void exhaustedRetriesBecomeProblem() {
        when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                .thenAnswer(invocation -> new SimpleTransactionStatus());

        assertThatThrownBy(() -> behavior.handle(new Pay(), () -> {
            throw new CannotAcquireLockException("locked");
        }))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(ex.getCode()).isEqualTo("TRANSACTION_RETRY_EXHAUSTED");
                    assertThat(ex.getRetryAfterSeconds()).isPositive();
                });
        verify(transactionManager, times(3)).getTransaction(any(TransactionDefinition.class));
    }

    @Test
    void nonTransientExceptionsAreNotRetried() {
        when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                .thenAnswer(invocation -> new SimpleTransactionStatus());

        assertThatThrownBy(() -> behavior.handle(new Pay(), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        verify(transactionManager, times(1)).getTransaction(any(TransactionDefinition.class));
    }

    @Test
    @DisplayName("queries run without a transaction")
    void queriesBypassTransaction() {
        String response = behavior.handle(new Lookup(), () -> "value");

        assertThat(response).isEqualTo("value");
        verify(transactionManager, never()).getTransaction(any());
        verify(transactionManager, never()).commit(any());
    }
}
