package com.marketintel.router.processing;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.CanonicalRecord;

import java.util.List;

public class DemographicInsightsProcessor extends AbstractRecordProcessor {

    private static final List<String> SCORE_FIELDS = List.of(
            "demographic_insights_score", "demographic_opportunity_score");
    private static final List<String> INCOME_FIELDS = List.of(
            "value_MEDDI_CY", "value_AVGHINC_CY", "median_income", "income");
    private static final List<String> DIVERSITY_FIELDS = List.of(
            "value_DIVINDX_CY", "diversity_index");

    public DemographicInsightsProcessor() {
        super("demographic", SCORE_FIELDS,
                List.of("demographic_score", "demographic_insights_score", "demographic_opportunity_score"));
    }

    @Override
    public void contributeStatistics(List<CanonicalRecord> records,
                                     AnalysisStatistics.AnalysisStatisticsBuilder statistics) {
        statistics.avgIncome(boxed(average(records, INCOME_FIELDS)))
                .diversityIndex(boxed(average(records, DIVERSITY_FIELDS)));
    }
}
