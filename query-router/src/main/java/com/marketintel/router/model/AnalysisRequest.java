package com.marketintel.router.model;

import java.util.List;

/**
 * @param query    free-text business question
 * @param endpoint optional endpoint path that bypasses routing, e.g. "/competitive-analysis"
 * @param areaIds  optional spatial selection; an empty list means nothing was selected
 */
public record AnalysisRequest(String query, String endpoint, List<String> areaIds) {

    public static AnalysisRequest of(String query) {
        return new AnalysisRequest(query, null, null);
    }
}
