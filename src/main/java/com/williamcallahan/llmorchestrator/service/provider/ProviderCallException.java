package com.williamcallahan.llmorchestrator.service.provider;

import java.util.Objects;

/**
 * Error signal raised inside provider token streams.
 *
 * <p>Blocking calls report failures through {@link ProviderResult}; reactive streams can only
 * terminate with an error signal, so this exception carries the category across that boundary.</p>
 */
public class ProviderCallException extends RuntimeException {
    private final String provider;
    private final ProviderErrorCategory category;

    public ProviderCallException(String provider, ProviderErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.provider = Objects.requireNonNull(provider, "provider");
        this.category = Objects.requireNonNull(category, "category");
    }

    public ProviderCallException(String provider, ProviderErrorCategory category, String message) {
        this(provider, category, message, null);
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorCategory getCategory() {
        return category;
    }
}
