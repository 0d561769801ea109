package com.marketintel.router.catalog;

import java.util.List;

/**
 * Scoring configuration of one auto-selectable endpoint.
 *
 * @param primaryKeywords matched on word boundaries
 * @param contextKeywords multi-word phrases matched by plain containment
 * @param avoidTerms      phrases that signal the query is about another concept
 */
public record KeywordProfile(
        String endpoint,
        List<String> primaryKeywords,
        List<String> contextKeywords,
        List<String> avoidTerms,
        double weight) {}
