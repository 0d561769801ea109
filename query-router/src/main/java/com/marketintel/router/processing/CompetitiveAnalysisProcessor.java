package com.marketintel.router.processing;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.CanonicalRecord;

import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Competitive position per area. Adds average market share and a
 * Herfindahl-style concentration (sum of squared shares, capped at 1).
 */
public class CompetitiveAnalysisProcessor extends AbstractRecordProcessor {

    private static final List<String> SHARE_FIELDS = List.of(
            "value_MP30034A_B_P", "MP30034A_B_P", "market_share", "share", "market_penetration");

    public CompetitiveAnalysisProcessor() {
        super("competitive",
                List.of("competitive_advantage_score", "competitive_analysis_score"),
                List.of("competitive_score", "competitive_advantage_score", "competitive_analysis_score"));
    }

    @Override
    public void contributeStatistics(List<CanonicalRecord> records,
                                     AnalysisStatistics.AnalysisStatisticsBuilder statistics) {
        List<Double> shares = records.stream()
                .map(r -> RecordFieldExtractor.firstNumber(r.getProperties(), SHARE_FIELDS))
                .filter(OptionalDouble::isPresent)
                .map(v -> toFraction(v.getAsDouble()))
                .collect(Collectors.toList());
        if (shares.isEmpty()) {
            return;
        }
        double avg = shares.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double hhi = shares.stream().mapToDouble(s -> s * s).sum();
        statistics.avgMarketShare(avg).marketConcentration(Math.min(1.0, hhi));
    }

    /** Shares above 1 are percentages. */
    static double toFraction(double share) {
        return share > 1 ? share / 100.0 : share;
    }
}
