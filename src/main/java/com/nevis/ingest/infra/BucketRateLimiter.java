package com.nevis.ingest.infra;

import com.nevis.ingest.exception.OperationCancelledException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class BucketRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int rpmLimit;

    public BucketRateLimiter(int rpmLimit) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("rpmLimit must be positive: " + rpmLimit);
        }
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(rpmLimit)
                .refillGreedy(rpmLimit, Duration.ofMinutes(1))
                .build())
            .build();
    }

    @Override
    public void acquire(String key, int permits) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        try {
            bucket.asBlocking().consume(Math.min(permits, rpmLimit));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(key, "Interrupted while waiting for rate limit on " + key, e);
        }
    }

    @Override
    public void release(String key, int permits) {
    }
}
