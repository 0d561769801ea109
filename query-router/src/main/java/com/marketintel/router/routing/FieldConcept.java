package com.marketintel.router.routing;

import java.util.List;

/**
 * A domain concept a user may name, with the data fields that carry it.
 * Field lists hold the raw code plus its value_ and shap_ prefixed variants where the data has them.
 */
public record FieldConcept(
        String name,
        ConceptGroup group,
        List<String> keywords,
        List<String> fields,
        String description) {

    boolean mentionedIn(String lowerQuery) {
        return keywords.stream().anyMatch(lowerQuery::contains);
    }

    int firstPositionIn(String lowerQuery) {
        return keywords.stream()
                .mapToInt(lowerQuery::indexOf)
                .filter(i -> i >= 0)
                .min()
                .orElse(-1);
    }
}
