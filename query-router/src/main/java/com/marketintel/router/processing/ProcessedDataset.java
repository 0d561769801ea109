package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;

import java.util.List;
import java.util.Map;

/**
 * @param records  ranked canonical records, rank 1 first
 * @param metadata endpoint-family blocks, e.g. "clusterAnalysis"
 */
public record ProcessedDataset(
        String type,
        List<CanonicalRecord> records,
        String targetVariable,
        Map<String, Object> metadata) {}
