package com.williamcallahan.llmorchestrator.service.ratelimit;

import java.util.Optional;

/**
 * Rate-limit scopes in the order they are checked.
 */
public enum RateLimitScope {
    IP("ip:"),
    USER("user:"),
    PROVIDER("provider:"),
    GLOBAL("global");

    private final String keyPrefix;

    RateLimitScope(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    /**
     * Builds the bucket key for a subject in this scope, for example {@code user:123}.
     * The global scope has a single bucket and ignores the subject.
     */
    public String key(String subject) {
        if (this == GLOBAL) {
            return keyPrefix;
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank for scope " + this);
        }
        return keyPrefix + subject;
    }

    /**
     * Resolves the scope a bucket key belongs to.
     *
     * @param scopeKey bucket key
     * @return scope, or empty when the key uses no known prefix
     */
    public static Optional<RateLimitScope> fromKey(String scopeKey) {
        if (scopeKey == null) {
            return Optional.empty();
        }
        if (GLOBAL.keyPrefix.equals(scopeKey)) {
            return Optional.of(GLOBAL);
        }
        for (RateLimitScope scope : values()) {
            if (scope != GLOBAL && scopeKey.startsWith(scope.keyPrefix)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
