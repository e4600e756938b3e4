package com.nevis.policy.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
    @NotNull @Min(1) @Max(100) Integer defaultLimit,
    @NotNull @Min(1) @Max(500) Integer maxLimit,
    @NotNull @Min(0) @Max(1) Double minScore
) {}
