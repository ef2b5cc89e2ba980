package com.cred.freestyle.groupbuy.infrastructure.retry;

import com.cred.freestyle.groupbuy.exception.StoreContentionException;
import com.cred.freestyle.groupbuy.infrastructure.metrics.GroupBuyMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Re-runs a transactional operation that lost a row lock race (lock timeout or deadlock victim).
 * Must wrap the transactional proxy call, so that every attempt gets a fresh transaction.
 *
 * Backoff is exponential: initial, 2x, 4x ... until max attempts are used up,
 * then StoreContentionException is thrown.
 *
 * @author Group Buy Team
 */
@Component
public class StoreContentionRetrier {

    private static final Logger logger = LoggerFactory.getLogger(StoreContentionRetrier.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final GroupBuyMetricsService metricsService;

    public StoreContentionRetrier(
            @Value("${groupbuy.retry.max-attempts:3}") int maxAttempts,
            @Value("${groupbuy.retry.initial-backoff-ms:50}") long initialBackoffMs,
            GroupBuyMetricsService metricsService
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("groupbuy.retry.max-attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.metricsService = metricsService;
    }

    /**
     * Run the operation, retrying on lock contention.
     *
     * @param operationName Name used in logs and metrics
     * @param operation Operation to run
     * @return Operation result
     * @throws StoreContentionException when every attempt lost the race
     */
    public <T> T execute(String operationName, Supplier<T> operation) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return operation.get();
            } catch (PessimisticLockingFailureException e) {
                if (attempt >= maxAttempts) {
                    logger.error("Lock contention on {} not resolved after {} attempts", operationName, attempt, e);
                    throw new StoreContentionException(operationName, attempt, e);
                }

                long delayMs = initialBackoffMs * (1L << (attempt - 1));
                logger.warn("Lock contention on {}, retry {}/{} in {}ms", operationName, attempt, maxAttempts, delayMs);
                metricsService.recordContentionRetry(operationName);

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreContentionException(operationName, attempt, ie);
                }
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
