package com.marketintel.router.model;

import java.util.List;

/**
 * Terminal routing outcome for one query. Exactly one outcome is produced;
 * {@code endpoint} is null only for {@link Outcome#MULTI_ENDPOINT_DETECTED}.
 */
public record RouteDecision(Outcome outcome, String endpoint, List<EndpointScore> scores) {

    public enum Outcome { EXPLICIT_OVERRIDE, MULTI_ENDPOINT_DETECTED, SINGLE_ENDPOINT }

    public static RouteDecision explicitOverride(String endpoint) {
        return new RouteDecision(Outcome.EXPLICIT_OVERRIDE, endpoint, List.of());
    }

    public static RouteDecision multiEndpoint(List<EndpointScore> scores) {
        return new RouteDecision(Outcome.MULTI_ENDPOINT_DETECTED, null, scores);
    }

    public static RouteDecision singleEndpoint(String endpoint, List<EndpointScore> scores) {
        return new RouteDecision(Outcome.SINGLE_ENDPOINT, endpoint, scores);
    }

    public boolean isMultiEndpoint() {
        return outcome == Outcome.MULTI_ENDPOINT_DETECTED;
    }
}
