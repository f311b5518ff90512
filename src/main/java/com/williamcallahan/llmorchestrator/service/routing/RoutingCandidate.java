package com.williamcallahan.llmorchestrator.service.routing;

import com.williamcallahan.llmorchestrator.service.provider.ModelRequest;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClient;
import java.util.Objects;

/**
 * One ranked provider for a request.
 *
 * @param client provider client
 * @param modelRequest request resolved for this provider
 * @param estimatedCents pessimistic cost estimate
 * @param score routing score, higher is preferred
 */
public record RoutingCandidate(ProviderClient client, ModelRequest modelRequest, long estimatedCents, double score) {
    public RoutingCandidate {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(modelRequest, "modelRequest");
    }

    public String provider() {
        return client.name();
    }
}
