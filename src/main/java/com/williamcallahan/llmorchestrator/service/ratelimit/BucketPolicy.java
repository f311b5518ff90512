package com.williamcallahan.llmorchestrator.service.ratelimit;

/**
 * Token-bucket parameters for one scope.
 *
 * @param capacity maximum burst size
 * @param refillPerSecond tokens added per second
 */
public record BucketPolicy(int capacity, double refillPerSecond) {
    public BucketPolicy {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillPerSecond <= 0 || Double.isNaN(refillPerSecond)) {
            throw new IllegalArgumentException("refillPerSecond must be positive");
        }
    }
}
