package com.cred.freestyle.groupbuy.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for the group-buying flows.
 * Exported to CloudWatch when enabled, otherwise to the default Actuator registry.
 *
 * Key Metrics:
 * - Joins and join rejections by reason
 * - Groups locked, offers created, votes cast, groups completed
 * - Fees collected
 * - Cache hit/miss rates
 * - Operation latency and lock contention retries
 *
 * @author Group Buy Team
 */
@Service
public class GroupBuyMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(GroupBuyMetricsService.class);

    private static final String METRIC_PREFIX = "groupbuy.";
    private static final String MEMBERSHIP_PREFIX = METRIC_PREFIX + "membership.";
    private static final String GROUP_PREFIX = METRIC_PREFIX + "group.";
    private static final String OFFER_PREFIX = METRIC_PREFIX + "offer.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    private final MeterRegistry meterRegistry;

    public GroupBuyMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordJoinSuccess() {
        Counter.builder(MEMBERSHIP_PREFIX + "joined")
                .description("Successful group joins")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a rejected join.
     *
     * @param reason Rejection code (e.g. "GROUP_FULL", "PAYMENT_REQUIRED")
     */
    public void recordJoinRejected(String reason) {
        Counter.builder(MEMBERSHIP_PREFIX + "rejected")
                .tag("reason", reason)
                .description("Rejected group joins")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded join rejection, reason: {}", reason);
    }

    public void recordGroupCreated() {
        Counter.builder(GROUP_PREFIX + "created")
                .description("Buying groups created")
                .register(meterRegistry)
                .increment();
    }

    public void recordGroupLocked() {
        Counter.builder(GROUP_PREFIX + "locked")
                .description("Buying groups that reached capacity")
                .register(meterRegistry)
                .increment();
    }

    public void recordGroupCompleted() {
        Counter.builder(GROUP_PREFIX + "completed")
                .description("Buying groups completed with a winning offer")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a participation fee payment.
     *
     * @param amount Fee charged
     */
    public void recordPayment(BigDecimal amount) {
        DistributionSummary.builder(METRIC_PREFIX + "payment.amount")
                .description("Participation fees charged")
                .register(meterRegistry)
                .record(amount.doubleValue());
    }

    /**
     * @param count Number of offers submitted in one request
     */
    public void recordOffersCreated(int count) {
        Counter.builder(OFFER_PREFIX + "created")
                .description("Dealer offers submitted")
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * @param switched true if the member moved an existing vote to another offer
     */
    public void recordVote(boolean switched) {
        Counter.builder(OFFER_PREFIX + "votes")
                .tag("type", switched ? "switch" : "new")
                .description("Votes cast on dealer offers")
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param cacheType Type of cache (e.g., "group")
     */
    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param cacheType Type of cache (e.g., "group")
     */
    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record end-to-end latency of an operation.
     *
     * @param operation Operation name (e.g., "join", "vote")
     * @param durationMs Duration in milliseconds
     */
    public void recordLatency(String operation, long durationMs) {
        Timer.builder(METRIC_PREFIX + "operation.latency")
                .tag("operation", operation)
                .description("Operation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a retry caused by row lock contention.
     *
     * @param operation Operation name
     */
    public void recordContentionRetry(String operation) {
        Counter.builder(METRIC_PREFIX + "contention.retry")
                .tag("operation", operation)
                .description("Retries after lock contention")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an unexpected error.
     *
     * @param errorType Error type
     * @param operation Operation where the error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
