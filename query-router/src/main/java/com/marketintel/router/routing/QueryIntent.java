package com.marketintel.router.routing;

public enum QueryIntent {
    RELATIONSHIP,
    COMPARISON,
    RANKING,
    LOCATION,
    ANALYSIS,
    TREND,
    DEMOGRAPHIC
}
