package com.nevis.policy.config;

import com.nevis.policy.infra.InMemoryDualRateLimiter;
import com.nevis.policy.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(
        @Value("${app.limits.embedding-rpm:12}") int requestsPerMinute,
        @Value("${app.limits.embedding-tpm:500000}") int tokensPerMinute) {
        return new InMemoryDualRateLimiter(requestsPerMinute, tokensPerMinute);
    }
}
