package com.marketintel.router.catalog;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keyword configuration of every endpoint the scorer may pick on its own.
 * Enumeration order is the tie-break order for equal scores.
 */
@Component
public class EndpointKeywordTable {

    private final List<KeywordProfile> profiles = new ArrayList<>();

    public EndpointKeywordTable(EndpointCatalog catalog) {
        add("/strategic-analysis",
                List.of("strategic", "strategy", "expansion", "invest", "investment", "growth",
                        "opportunity", "best markets", "top markets"),
                List.of("nike expansion", "market opportunity", "strategic value"),
                List.of(),
                1.0);
        add("/competitive-analysis",
                List.of("competitive", "competition", "compete", "market share", "brand position", "dominance"),
                List.of("nike vs", "versus", "against", "compare to"),
                List.of("difference", "percent"),
                0.9);
        add("/brand-difference",
                List.of("difference", "percent difference", "gap", "lead", "delta"),
                List.of("nike vs adidas", "brand difference", "market share difference"),
                List.of(),
                1.1);
        add("/demographic-insights",
                List.of("demographic", "demographics", "population", "age", "income", "race", "ethnicity"),
                List.of("customer demographics", "demographic opportunity", "demographic score"),
                List.of(),
                1.0);
        add("/customer-profile",
                List.of("customer", "profile", "persona", "lifestyle", "behavior", "values", "psychographic"),
                List.of("ideal customer", "target customer", "customer fit"),
                List.of(),
                1.0);
        add("/comparative-analysis",
                List.of("compare", "comparison", "between", "cities", "regions"),
                List.of("brooklyn vs", "compare performance", "city comparison"),
                List.of("correlation"),
                0.95);
        add("/trend-analysis",
                List.of("trend", "trending", "growth", "decline", "change over time", "momentum"),
                List.of("growth trends", "market trends", "trending up"),
                List.of(),
                0.9);
        add("/correlation-analysis",
                List.of("correlation", "correlate", "correlated", "correlates"),
                List.of("correlation between", "correlated with", "statistical relationship"),
                List.of("compare", "versus"),
                0.9);
        add("/spatial-clusters",
                List.of("cluster", "clusters", "clustering", "similar areas", "groupings"),
                List.of("cluster analysis", "similar markets", "group similar"),
                List.of(),
                0.9);
        add("/feature-interactions",
                List.of("interaction", "interactions", "combined effect", "shap"),
                List.of("feature interactions", "factor interactions", "market factor"),
                List.of(),
                0.9);
        add("/risk-analysis",
                List.of("risk", "risky", "volatile", "volatility", "uncertainty", "downside"),
                List.of("market risk", "risk assessment", "risk factors"),
                List.of(),
                0.9);

        for (KeywordProfile profile : profiles) {
            if (!catalog.contains(profile.endpoint())) {
                throw new IllegalStateException("Keyword profile for unknown endpoint: " + profile.endpoint());
            }
        }
    }

    private void add(String endpoint, List<String> primary, List<String> context, List<String> avoid, double weight) {
        profiles.add(new KeywordProfile(endpoint, primary, context, avoid, weight));
    }

    public List<KeywordProfile> profiles() {
        return Collections.unmodifiableList(profiles);
    }
}
