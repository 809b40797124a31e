package com.policyqa.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

@Validated
@ConfigurationProperties(prefix = "app.indexing")
public record IndexingProperties(
    @NotNull @Min(100) Integer chunkSize,
    @NotNull @Min(0) Integer chunkOverlap,
    @NotNull @Min(1) Long maxDocumentBytes,
    @NotEmpty List<String> allowedContentTypes,
    @NotNull @Min(1) Integer embeddingBatchSize,
    @NotNull @Min(1) Integer staleThresholdMinutes
) {

    public boolean isAllowed(String contentType) {
        return contentType != null && allowedContentTypes.stream()
            .anyMatch(allowed -> allowed.equalsIgnoreCase(baseType(contentType)));
    }

    public static String baseType(String contentType) {
        int separator = contentType.indexOf(';');
        return (separator >= 0 ? contentType.substring(0, separator) : contentType).trim().toLowerCase(Locale.ROOT);
    }
}
