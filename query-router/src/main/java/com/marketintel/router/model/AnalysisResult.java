package com.marketintel.router.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything handed to the rendering and narrative layers for one query.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {

    private String endpoint;
    private String type;
    private ResultStatus status;
    private RouteDecision.Outcome routing;
    private String targetVariable;

    @Builder.Default
    private List<CanonicalRecord> records = List.of();

    private AnalysisStatistics statistics;
    private Distribution distribution;
    private Patterns patterns;

    /** Endpoint-family blocks, e.g. "clusterAnalysis" or "brandComparison". */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private List<String> geographicEntities = List.of();

    /** Ranked candidates, only set when the query needs a multi-endpoint merge. */
    private List<EndpointScore> candidates;

    /** Bounded text summary for the narrative layer. */
    private String narrativeContext;
}
