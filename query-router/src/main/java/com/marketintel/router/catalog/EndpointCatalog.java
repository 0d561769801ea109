package com.marketintel.router.catalog;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Static table of the pre-computed analysis endpoints.
 *
 * Adding an endpoint takes one entry here, one in {@link EndpointKeywordTable}
 * (only if it should be auto-selected) and one processor registration.
 */
@Component
public class EndpointCatalog {

    private static final Pattern ENDPOINT_ID = Pattern.compile("^/?[a-z0-9][a-z0-9-]*$");

    private final Map<String, EndpointDefinition> endpoints = new LinkedHashMap<>();

    public EndpointCatalog() {
        register("/analyze",              "analyze",              "analysis_score",         "analysis");
        register("/strategic-analysis",   "strategic-analysis",   "strategic_score",        "strategic_analysis");
        register("/competitive-analysis", "competitive-analysis", "competitive_score",      "competitive_analysis");
        register("/brand-analysis",       "competitive-analysis", "competitive_score",      "brand_analysis");
        register("/brand-difference",     "brand-difference",     "brand_difference_score", "brand_difference");
        register("/demographic-insights", "demographic-insights", "demographic_score",      "demographic_insights");
        register("/customer-profile",     "customer-profile",     "customer_profile_score", "customer_profile");
        register("/comparative-analysis", "comparative-analysis", "comparison_score",       "comparative_analysis");
        register("/trend-analysis",       "trend-analysis",       "trend_score",            "trend_analysis");
        register("/correlation-analysis", "correlation-analysis", "correlation_score",      "correlation_analysis");
        register("/spatial-clusters",     "spatial-clusters",     "cluster_id",             "spatial_clusters");
        register("/feature-interactions", "feature-interactions", "interaction_score",      "feature_interactions");
        register("/risk-analysis",        "risk-analysis",        "risk_score",             "risk_analysis");
        register("/segment-profiling",    "segment-profiling",    "segment_score",          "segment_profiling");
        register("/market-sizing",        "segment-profiling",    "market_sizing_score",    "market_sizing");
        register("/anomaly-detection",    "anomaly-detection",    "anomaly_score",          "anomaly_detection");
        register("/outlier-detection",    "outlier-detection",    "outlier_score",          "outlier_detection");
        register("/predictive-modeling",  "predictive-modeling",  "prediction_score",       "predictive_modeling");
        register("/scenario-analysis",    "scenario-analysis",    "scenario_score",         "scenario_analysis");
        register("/threshold-analysis",   "threshold-analysis",   "threshold_score",        "threshold_analysis");
        register("/real-estate-analysis", "spatial-clusters",     "cluster_id",             "real_estate_analysis");
    }

    private void register(String path, String cacheKey, String targetVariable, String type) {
        endpoints.put(path, new EndpointDefinition(path, cacheKey, targetVariable, type));
    }

    public Optional<EndpointDefinition> find(String path) {
        return Optional.ofNullable(endpoints.get(normalise(path)));
    }

    /**
     * Resolve an endpoint that is not in the table to an ad hoc definition,
     * keyed by the path without its leading slash. Such endpoints are served
     * by the default processor. The path must be a single lowercase slug; it
     * becomes part of a file name and a blob URL.
     *
     * @throws IllegalArgumentException if an unknown path is not a valid endpoint id
     */
    public EndpointDefinition resolve(String path) {
        String normalised = normalise(path);
        return find(normalised).orElseGet(() -> {
            if (!ENDPOINT_ID.matcher(normalised).matches()) {
                throw new IllegalArgumentException("Invalid endpoint: " + path);
            }
            String key = normalised.startsWith("/") ? normalised.substring(1) : normalised;
            return new EndpointDefinition(normalised, key, "value", key.replace('-', '_'));
        });
    }

    public boolean contains(String path) {
        return endpoints.containsKey(normalise(path));
    }

    public Collection<EndpointDefinition> all() {
        return Collections.unmodifiableCollection(endpoints.values());
    }

    private static String normalise(String path) {
        if (path == null) return "";
        String trimmed = path.trim();
        return trimmed.startsWith("/") || trimmed.isEmpty() ? trimmed : "/" + trimmed;
    }
}
