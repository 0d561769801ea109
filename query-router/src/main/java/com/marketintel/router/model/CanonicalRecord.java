package com.marketintel.router.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standardised per-area record every endpoint is converted into.
 *
 * Schema notes:
 *  - value is the endpoint's designated primary metric; all records in one set share its meaning
 *  - rank is assigned by the processor (1 = highest value) and never copied from raw input
 *  - properties keeps every raw field verbatim for the narrative and rendering layers
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CanonicalRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** ZIP code or administrative id, unique within a result set */
    private String areaId;

    /** Display label, e.g. "10001 (New York)" */
    private String areaName;

    // ── Metric ──────────────────────────────────────────────────────────────
    private double value;

    private int rank;

    /** Optional tier or band label */
    private String category;

    // ── Location ────────────────────────────────────────────────────────────
    /** [longitude, latitude] centroid, null when the source has none */
    private double[] coordinates;

    // ── Auxiliary data ──────────────────────────────────────────────────────
    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> shapValues = new LinkedHashMap<>();

    // ── Cluster assignment ──────────────────────────────────────────────────
    private Integer clusterId;

    private String clusterName;
}
