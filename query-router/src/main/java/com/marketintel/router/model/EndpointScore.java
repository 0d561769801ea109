package com.marketintel.router.model;

import java.util.List;

/**
 * Score of one candidate endpoint for a query. {@code reasons} is for
 * explaining the decision only and never feeds back into routing.
 */
public record EndpointScore(String endpoint, double score, List<String> reasons) {}
