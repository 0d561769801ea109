package com.marketintel.router.processing;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.AnalysisStatistics.RiskLevel;
import com.marketintel.router.model.CanonicalRecord;

import java.util.List;

/**
 * Risk-adjusted score per area. Overall level from mean volatility and uncertainty
 * (0-1 scale): either above 0.6 is high, both below 0.3 is low, otherwise medium.
 */
public class RiskAnalysisProcessor extends AbstractRecordProcessor {

    public RiskAnalysisProcessor() {
        super("risk",
                List.of("risk_adjusted_score", "safety_score", "stability_score"),
                List.of("risk_score", "risk_adjusted_score", "safety_score", "stability_score",
                        "volatility", "uncertainty"));
    }

    @Override
    public void contributeStatistics(List<CanonicalRecord> records,
                                     AnalysisStatistics.AnalysisStatisticsBuilder statistics) {
        double volatility = average(records, List.of("volatility")).orElse(0);
        double uncertainty = average(records, List.of("uncertainty")).orElse(0);
        statistics.riskLevel(riskLevel(volatility, uncertainty));
    }

    static RiskLevel riskLevel(double volatility, double uncertainty) {
        if (volatility > 0.6 || uncertainty > 0.6) return RiskLevel.HIGH;
        if (volatility < 0.3 && uncertainty < 0.3) return RiskLevel.LOW;
        return RiskLevel.MEDIUM;
    }
}
