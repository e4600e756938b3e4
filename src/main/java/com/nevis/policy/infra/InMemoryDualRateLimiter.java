package com.nevis.policy.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> rpmBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tpmBuckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final int tpmLimit;

    public InMemoryDualRateLimiter(int rpmLimit, int tpmLimit) {
        this.rpmLimit = rpmLimit;
        this.tpmLimit = tpmLimit;
    }

    private static Bucket perMinute(int limit) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder().capacity(limit).refillGreedy(limit, Duration.ofMinutes(1)).build())
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int tokens) {
        Bucket rpmBucket = rpmBuckets.computeIfAbsent(key, k -> perMinute(rpmLimit));
        Bucket tpmBucket = tpmBuckets.computeIfAbsent(key, k -> perMinute(tpmLimit));

        rpmBucket.asBlocking().consume(1);
        // a single oversized request may use the whole minute, never more
        tpmBucket.asBlocking().consume(Math.max(1, Math.min(tokens, tpmLimit)));
    }

    @Override
    public void release(String key, int permits) {
    }
}
