package com.williamcallahan.llmorchestrator.service.routing;

import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Admission control for in-flight calls per provider, bounded by {@code maxConcurrency}.
 */
public class ProviderConcurrencyLimiter {
    private final Map<String, Semaphore> permitsByProvider = new ConcurrentHashMap<>();

    public ProviderConcurrencyLimiter(Collection<ProviderDescriptor> descriptors) {
        for (ProviderDescriptor descriptor : descriptors) {
            permitsByProvider.put(descriptor.name(), new Semaphore(descriptor.maxConcurrency()));
        }
    }

    /**
     * Takes a slot without waiting.
     *
     * @return false when the provider is at capacity
     */
    public boolean tryAcquire(String provider) {
        return permits(provider).tryAcquire();
    }

    public void release(String provider) {
        permits(provider).release();
    }

    public int availablePermits(String provider) {
        return permits(provider).availablePermits();
    }

    private Semaphore permits(String provider) {
        Semaphore permits = permitsByProvider.get(provider);
        if (permits == null) {
            throw new IllegalArgumentException("Unknown provider: " + provider);
        }
        return permits;
    }
}
