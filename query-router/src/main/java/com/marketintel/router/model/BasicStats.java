package com.marketintel.router.model;

import java.util.List;

/**
 * Headline statistics over a record set. An empty set yields {@link #empty()}.
 */
public record BasicStats(
        int count,
        double mean,
        double median,
        double stdDev,
        AreaScore min,
        AreaScore max,
        List<AreaScore> top5,
        List<AreaScore> bottom5,
        Double totalPopulation) {

    public static BasicStats empty() {
        return new BasicStats(0, 0, 0, 0,
                new AreaScore("N/A", 0), new AreaScore("N/A", 0),
                List.of(), List.of(), null);
    }
}
