package com.policyqa.infra;

import java.util.function.Supplier;

/**
 * Throttles calls to one external model provider.
 */
public interface RateLimiter {

    /**
     * Blocks until the provider quota admits one request costing about {@code estimatedTokens}.
     */
    void acquire(int estimatedTokens);

    default <T> T execute(int estimatedTokens, Supplier<T> call) {
        acquire(estimatedTokens);
        return call.get();
    }
}
