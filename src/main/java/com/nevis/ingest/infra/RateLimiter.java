package com.nevis.ingest.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    void acquire(String key, int permits);

    void release(String key, int permits);

    default <T> T execute(String key, int permits, Supplier<T> task) {
        try {
            acquire(key, permits);
            return task.get();
        } finally {
            release(key, permits);
        }
    }
}
