package com.marketintel.router.processing;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.CanonicalRecord;

import java.util.List;

public class TrendAnalysisProcessor extends AbstractRecordProcessor {

    private static final List<String> GROWTH_FIELDS = List.of("growth_rate", "trend_growth_rate", "yoy_growth");

    public TrendAnalysisProcessor() {
        super("trend",
                List.of("trend_analysis_score", "trend_strength"),
                List.of("trend_score", "trend_analysis_score", "trend_strength"));
    }

    @Override
    public void contributeStatistics(List<CanonicalRecord> records,
                                     AnalysisStatistics.AnalysisStatisticsBuilder statistics) {
        statistics.avgGrowthRate(boxed(average(records, GROWTH_FIELDS)));
    }
}
