package com.nevis.digest.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.EstimationProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket whose capacity equals its per-second refill rate. Refill is greedy,
 * so tokens accrue continuously in proportion to elapsed time.
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private final Bucket bucket;

    public TokenBucketRateLimiter(int requestsPerSecond) {
        this(requestsPerSecond, TimeMeter.SYSTEM_MILLISECONDS);
    }

    public TokenBucketRateLimiter(int requestsPerSecond, TimeMeter timeMeter) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive: " + requestsPerSecond);
        }
        this.bucket = Bucket.builder()
            .addLimit(Bandwidth.classic(requestsPerSecond, Refill.greedy(requestsPerSecond, Duration.ofSeconds(1))))
            .withCustomTimePrecision(timeMeter)
            .build();
    }

    @Override
    public boolean tryConsume() {
        return bucket.tryConsume(1);
    }

    @Override
    public long getTimeUntilNextToken() {
        EstimationProbe probe = bucket.estimateAbilityToConsume(1);
        if (probe.canBeConsumed()) {
            return 0;
        }
        long nanos = probe.getNanosToWaitForRefill();
        return (nanos + TimeUnit.MILLISECONDS.toNanos(1) - 1) / TimeUnit.MILLISECONDS.toNanos(1);
    }
}
