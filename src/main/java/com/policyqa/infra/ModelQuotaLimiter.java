package com.policyqa.infra;

import com.policyqa.config.LimitsProperties.Quota;
import com.policyqa.exception.TransientDependencyException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Enforces a provider's per-minute quota: a request bucket and, when the provider meters tokens, a token bucket.
 * A request larger than the whole token allowance is charged the full allowance so it can still proceed.
 */
@Slf4j
public class ModelQuotaLimiter implements RateLimiter {

    @Getter
    private final String model;
    private final Bucket requests;
    private final Bucket tokens;
    private final long tokenAllowance;

    public ModelQuotaLimiter(String model, Quota quota) {
        this.model = model;
        this.requests = perMinute(quota.requestsPerMinute());
        if (quota.meteredTokens()) {
            this.tokens = perMinute(quota.tokensPerMinute());
            this.tokenAllowance = quota.tokensPerMinute();
        } else {
            this.tokens = null;
            this.tokenAllowance = 0;
        }
    }

    private static Bucket perMinute(long capacity) {
        return Bucket.builder()
            .addLimit(limit -> limit.capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(1)))
            .build();
    }

    @Override
    public void acquire(int estimatedTokens) {
        take(requests, 1, "request");
        if (tokens != null) {
            take(tokens, Math.max(1, Math.min(estimatedTokens, tokenAllowance)), "token");
        }
    }

    private void take(Bucket bucket, long amount, String unit) {
        if (bucket.tryConsume(amount)) {
            return;
        }
        log.debug("{} {} quota exhausted, waiting for refill", model, unit);
        try {
            bucket.asBlocking().consume(amount);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientDependencyException("Interrupted while waiting for " + model + " quota", e);
        }
    }
}
