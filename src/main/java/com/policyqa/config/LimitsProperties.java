package com.policyqa.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-minute provider quotas for the chat and embedding models.
 */
@Validated
@ConfigurationProperties(prefix = "app.limits")
public record LimitsProperties(
    @NotNull @Valid Quota chat,
    @NotNull @Valid Quota embedding
) {

    /**
     * {@code tokensPerMinute} is null for providers that only count requests.
     */
    public record Quota(
        @NotNull @Min(1) Integer requestsPerMinute,
        @Min(1) Integer tokensPerMinute
    ) {

        public boolean meteredTokens() {
            return tokensPerMinute != null;
        }
    }
}
