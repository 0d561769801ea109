package com.marketintel.router.processing;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.CanonicalRecord;

import java.util.List;

/**
 * Correlation strength per area. The headline strength is the mean score.
 */
public class CorrelationAnalysisProcessor extends AbstractRecordProcessor {

    public CorrelationAnalysisProcessor() {
        super("correlation",
                List.of("correlation_strength_score"),
                List.of("correlation_score", "correlation_strength_score"));
    }

    @Override
    public void contributeStatistics(List<CanonicalRecord> records,
                                     AnalysisStatistics.AnalysisStatisticsBuilder statistics) {
        if (records.isEmpty()) return;
        statistics.correlationStrength(records.stream().mapToDouble(CanonicalRecord::getValue).average().orElse(0));
    }
}
