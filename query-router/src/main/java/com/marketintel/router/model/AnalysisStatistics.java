package com.marketintel.router.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Statistics sent with every result. Core fields are always set; the
 * family-specific fields are filled only by the processors they belong to.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisStatistics {

    private int total;
    private double mean;
    private double median;
    private double min;
    private double max;
    private double stdDev;
    private double percentile25;
    private double percentile75;
    private double iqr;
    private int outlierCount;

    // ── Cluster endpoints ───────────────────────────────────────────────────
    private Integer clusterCount;
    private Double avgClusterSize;

    // ── Competitive / brand endpoints ───────────────────────────────────────
    private Double avgMarketShare;
    private Double marketConcentration;

    // ── Demographic endpoints ───────────────────────────────────────────────
    private Double avgIncome;
    private Double diversityIndex;

    // ── Trend endpoints ─────────────────────────────────────────────────────
    private Double avgGrowthRate;

    // ── Correlation endpoints ───────────────────────────────────────────────
    private Double correlationStrength;

    // ── Risk endpoints ──────────────────────────────────────────────────────
    private RiskLevel riskLevel;

    public enum RiskLevel { LOW, MEDIUM, HIGH }
}
