package com.marketintel.router.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketintel.router.model.RawDataset;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a stored endpoint document into a {@link RawDataset}.
 *
 * Accepted shapes:
 *   [ {...}, {...} ]
 *   { "success": true, "results": [ {...} ], "model_info": {"target_variable": "..."},
 *     "feature_importance": [ {"feature": "...", "importance": 0.4} ], "summary": "..." }
 *
 * Anything else is rejected with an IllegalArgumentException.
 */
@Component
@RequiredArgsConstructor
public class RawDatasetParser {

    private static final TypeReference<List<Map<String, Object>>> RECORD_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RawDataset parse(String json) throws IOException {
        return parse(objectMapper.readTree(json));
    }

    public RawDataset parse(Path file) throws IOException {
        return parse(readTree(file));
    }

    public JsonNode readTree(Path file) throws IOException {
        return objectMapper.readTree(file.toFile());
    }

    public RawDataset parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new IllegalArgumentException("Document is empty");
        }
        if (root.isArray()) {
            return new RawDataset(Boolean.TRUE, records(root), List.of(), null, null);
        }
        if (!root.isObject() || !root.path("results").isArray()) {
            throw new IllegalArgumentException("Expected an array or an object with a 'results' array");
        }

        JsonNode success = root.path("success");
        return new RawDataset(
                success.isBoolean() ? success.booleanValue() : Boolean.TRUE,
                records(root.get("results")),
                featureImportance(root.path("feature_importance")),
                textOrNull(root.path("model_info").path("target_variable")),
                textOrNull(root.path("summary")));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<Map<String, Object>> records(JsonNode array) {
        for (JsonNode element : array) {
            if (!element.isObject()) {
                throw new IllegalArgumentException("Result entries must be objects, found " + element.getNodeType());
            }
        }
        return objectMapper.convertValue(array, RECORD_LIST);
    }

    private List<RawDataset.FeatureImportance> featureImportance(JsonNode node) {
        if (!node.isArray()) return List.of();
        List<RawDataset.FeatureImportance> importance = new ArrayList<>();
        for (JsonNode entry : node) {
            String feature = textOrNull(entry.path("feature"));
            if (feature != null) {
                importance.add(new RawDataset.FeatureImportance(feature, entry.path("importance").asDouble(0)));
            }
        }
        return importance;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) return null;
        return node.asText();
    }
}
