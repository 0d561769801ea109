package com.marketintel.router.routing;

public enum ConceptGroup {
    BRAND,
    ACTIVITY,
    LIFESTYLE,
    DEMOGRAPHIC,
    SHAP,
    ADMINISTRATIVE
}
