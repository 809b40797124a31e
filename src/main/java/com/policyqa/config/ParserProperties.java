package com.policyqa.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.parser")
public record ParserProperties(
    @NotNull @Min(1) Integer maxQueryLength,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double attributeThreshold,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double sessionDecay,
    List<String> knownLocations,
    @Valid @NotNull Llm llm
) {

    public ParserProperties {
        knownLocations = knownLocations == null ? List.of() : List.copyOf(knownLocations);
    }

    public record Llm(
        boolean enabled,
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double confidenceCap
    ) {}
}
