package com.nevis.policy.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.ingestion")
public record IngestionProperties(
    @NotNull @Min(100) @Max(10_000) Integer chunkSize,
    @NotNull @Min(0) @Max(2_000) Integer chunkOverlap,
    @NotNull @Min(1) @Max(250) Integer embeddingBatchSize,
    @NotNull @Min(1) @Max(5_000) Integer writeBatchSize,
    @NotNull @Min(1) @Max(64) Integer concurrency
) {}
