package com.marketintel.router.routing;

import com.marketintel.router.model.EndpointScore;
import com.marketintel.router.model.RouteDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the endpoint that answers a query.
 *
 * Order of precedence:
 *  1. an explicit endpoint from the caller wins unconditionally
 *  2. compound queries are flagged for the multi-endpoint merge layer
 *  3. otherwise the best scoring endpoint, or the default when nothing scores
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EndpointRouter {

    private final EndpointScorer scorer;
    private final MultiEndpointDetector multiEndpointDetector;

    public RouteDecision route(String query, String explicitEndpoint) {
        if (explicitEndpoint != null && !explicitEndpoint.isBlank()) {
            String endpoint = explicitEndpoint.trim();
            log.info("Routing '{}' → {} (explicit override)", query, endpoint);
            return RouteDecision.explicitOverride(endpoint);
        }

        List<EndpointScore> scores = scorer.score(query);

        if (multiEndpointDetector.isMultiEndpoint(query)) {
            log.info("Routing '{}' → multi-endpoint merge required", query);
            return RouteDecision.multiEndpoint(scores);
        }

        String endpoint = scorer.bestOf(scores);
        log.info("Routing '{}' → {} (score {})", query, endpoint,
                scores.isEmpty() ? 0 : scores.get(0).score());
        return RouteDecision.singleEndpoint(endpoint, scores);
    }

    public RouteDecision route(String query) {
        return route(query, null);
    }
}
