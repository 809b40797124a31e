package com.policyqa.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
    @NotNull Duration timeout,
    @NotNull @Min(1) Integer maxAttempts,
    @NotNull Duration initialBackoff,
    @NotNull @DecimalMin("1.0") Double backoffMultiplier,
    @NotNull Duration maxBackoff,
    @NotNull @Min(1) Integer maxConcurrentQueries,
    @NotNull @Min(0) Integer fallbackMaxSources
) {}
