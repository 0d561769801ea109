package com.marketintel.router.routing;

/**
 * Query conditions that earn endpoint bonuses from the concepts a query mentions.
 */
public enum ConceptTrigger {
    /** Two or more distinct brands named. */
    MULTIPLE_BRANDS,
    /** Lifestyle or activity concepts named. */
    LIFESTYLE,
    DEMOGRAPHIC,
    SHAP
}
