package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interaction strength per area, with the SHAP weights carried through.
 * Metadata ranks features by mean absolute SHAP weight.
 */
public class FeatureInteractionProcessor extends AbstractRecordProcessor {

    private static final int TOP_FEATURES = 5;

    public FeatureInteractionProcessor() {
        super("feature-interaction",
                List.of("feature_interaction_score", "interaction_strength"),
                List.of("interaction_score", "feature_interaction_score", "interaction_strength"));
    }

    @Override
    protected void describe(List<CanonicalRecord> ranked, ProcessingContext context, Map<String, Object> metadata) {
        Map<String, double[]> totals = new HashMap<>();
        for (CanonicalRecord record : ranked) {
            record.getShapValues().forEach((feature, weight) -> {
                double[] acc = totals.computeIfAbsent(feature, k -> new double[2]);
                acc[0] += Math.abs(weight);
                acc[1]++;
            });
        }
        Map<String, Double> top = new LinkedHashMap<>();
        totals.entrySet().stream()
                .sorted((a, b) -> {
                    int byWeight = Double.compare(b.getValue()[0] / b.getValue()[1], a.getValue()[0] / a.getValue()[1]);
                    return byWeight != 0 ? byWeight : a.getKey().compareTo(b.getKey());
                })
                .limit(TOP_FEATURES)
                .forEach(e -> top.put(e.getKey(), e.getValue()[0] / e.getValue()[1]));
        metadata.put("featureInteractions", Map.of("topFeatures", top));
    }
}
