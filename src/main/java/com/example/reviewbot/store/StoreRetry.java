package com.example.reviewbot.store;

import com.example.reviewbot.error.StoreUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retry boundary around Redis and MongoDB calls.
 * Only connectivity and transient failures are retried, with exponential backoff.
 * Conditional-write losers (duplicate key, optimistic lock) pass straight through
 * so callers can re-read and decide.
 */
@Component
public class StoreRetry {

    private static final Logger logger = LoggerFactory.getLogger(StoreRetry.class);

    private final Retry retry;

    public StoreRetry(@Value("${app.store.retry.max-attempts:3}") int maxAttempts,
                      @Value("${app.store.retry.initial-backoff-ms:1000}") long initialBackoffMs,
                      @Value("${app.store.retry.multiplier:2.0}") double multiplier,
                      @Value("${app.store.retry.max-backoff-ms:5000}") long maxBackoffMs) {
        this.retry = Retry.of("store", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, multiplier, maxBackoffMs))
                .retryExceptions(TransientDataAccessException.class, DataAccessResourceFailureException.class)
                .ignoreExceptions(OptimisticLockingFailureException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                logger.warn("Retrying store call (attempt {}): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    public <T> T call(String operation, Supplier<T> supplier) {
        try {
            return Retry.decorateSupplier(retry, supplier).get();
        } catch (OptimisticLockingFailureException e) {
            throw e;
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            logger.error("Store call {} failed after retries", operation, e);
            throw new StoreUnavailableException(operation, e);
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
