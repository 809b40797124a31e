package com.policyqa.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.evaluation")
public record EvaluationProperties(
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double rejectionConfidence,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double approvalConfidence
) {}
