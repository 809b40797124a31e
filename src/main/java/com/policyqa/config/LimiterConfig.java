package com.policyqa.config;

import com.policyqa.infra.ModelQuotaLimiter;
import com.policyqa.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("chatLimiter")
    public RateLimiter chatLimiter(LimitsProperties limits) {
        return new ModelQuotaLimiter("chat", limits.chat());
    }

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(LimitsProperties limits) {
        return new ModelQuotaLimiter("embedding", limits.embedding());
    }
}
