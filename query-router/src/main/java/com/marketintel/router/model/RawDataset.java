package com.marketintel.router.model;

import java.util.List;
import java.util.Map;

/**
 * One endpoint's pre-computed result set as loaded from storage.
 *
 * {@code success} is false only when the stored document says so. Datasets
 * built in code may leave {@code success} or {@code results} null, and
 * processors reject that shape explicitly.
 */
public record RawDataset(
        Boolean success,
        List<Map<String, Object>> results,
        List<FeatureImportance> featureImportance,
        String targetVariable,
        String summary) {

    public record FeatureImportance(String feature, double importance) {}

    public static RawDataset of(List<Map<String, Object>> results) {
        return new RawDataset(Boolean.TRUE, results, List.of(), null, null);
    }

    public RawDataset withResults(List<Map<String, Object>> filtered) {
        return new RawDataset(success, filtered, featureImportance, targetVariable, summary);
    }

    public int size() {
        return results == null ? 0 : results.size();
    }
}
