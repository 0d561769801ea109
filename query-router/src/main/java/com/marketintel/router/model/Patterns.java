package com.marketintel.router.model;

import java.util.List;

public record Patterns(List<ScoreCluster> clusters, List<Correlation> correlations, List<Trend> trends) {

    public record ScoreCluster(String name, int size, double avgScore, List<String> characteristics) {}

    public record Trend(String pattern, Correlation.Significance strength, List<String> areas) {}

    public static Patterns empty() {
        return new Patterns(List.of(), List.of(), List.of());
    }
}
