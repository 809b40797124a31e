package com.policyqa.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.retrieval")
public record RetrievalProperties(
    @NotNull @Min(1) @Max(50) Integer topK,
    @NotNull @Min(1) @Max(500) Integer candidatePool,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double keywordWeight
) {}
