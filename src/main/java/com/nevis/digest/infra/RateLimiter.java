package com.nevis.digest.infra;

/**
 * Non-blocking admission control for outbound work.
 */
public interface RateLimiter {

    /**
     * Takes one token if available. Never blocks.
     */
    boolean tryConsume();

    /**
     * Milliseconds until one token becomes available, 0 when one is available now.
     */
    long getTimeUntilNextToken();
}
