package com.marketintel.router.model;

import java.util.List;

public record Distribution(
        double q1,
        double q2,
        double q3,
        double iqr,
        List<Outlier> outliers,
        Shape shape,
        List<Bucket> buckets) {

    public enum Shape { NORMAL, SKEWED_LEFT, SKEWED_RIGHT, BIMODAL, UNIFORM }

    public record Outlier(String area, double score, boolean high) {}

    public record Bucket(String range, double min, double max, int count, double percentage, List<String> areas) {}

    public static Distribution empty() {
        return new Distribution(0, 0, 0, 0, List.of(), Shape.UNIFORM, List.of());
    }
}
