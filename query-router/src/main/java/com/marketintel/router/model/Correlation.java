package com.marketintel.router.model;

/**
 * Association between the primary metric and an auxiliary factor.
 *
 * {@link Kind#ESTIMATED} values are placeholders derived from the score level
 * when no auxiliary field exists in the data. They are never measured and
 * must be presented as estimates.
 */
public record Correlation(String factor, double coefficient, Significance significance, Kind kind) {

    public enum Kind { COMPUTED, ESTIMATED }

    public enum Significance { STRONG, MODERATE, WEAK }

    public boolean isEstimated() {
        return kind == Kind.ESTIMATED;
    }
}
