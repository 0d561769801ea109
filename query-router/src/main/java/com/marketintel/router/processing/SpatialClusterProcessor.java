package com.marketintel.router.processing;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.CanonicalRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Cluster membership per area.
 *
 * The record value is the cluster id itself, not a score, so ranking groups
 * areas by cluster. A record without a cluster id fails the whole dataset.
 */
public class SpatialClusterProcessor extends AbstractRecordProcessor {

    private static final List<String> CLUSTER_ID_FIELDS = List.of("cluster_id", "CLUSTER_ID", "cluster");
    private static final List<String> CLUSTER_NAME_FIELDS = List.of("cluster_name", "cluster_label");
    private static final List<String> SCORE_FIELDS = List.of("cluster_score", "score", "value");

    public SpatialClusterProcessor() {
        super("cluster", List.of(), CLUSTER_ID_FIELDS);
    }

    @Override
    protected CanonicalRecord toRecord(Map<String, Object> raw, int index, ProcessingContext context) {
        CanonicalRecord record = super.toRecord(raw, index, context);
        OptionalDouble id = RecordFieldExtractor.firstNumber(raw, CLUSTER_ID_FIELDS);
        if (id.isEmpty()) {
            throw new IllegalStateException("Record " + record.getAreaId() + " has no cluster id");
        }
        int clusterId = (int) id.getAsDouble();
        String clusterName = RecordFieldExtractor.firstText(raw, CLUSTER_NAME_FIELDS).orElse("Cluster " + clusterId);
        record.setValue(clusterId);
        record.setClusterId(clusterId);
        record.setClusterName(clusterName);
        record.setCategory(clusterName);
        return record;
    }

    @Override
    protected double primaryValue(Map<String, Object> raw, ProcessingContext context) {
        return 0;
    }

    @Override
    protected void describe(List<CanonicalRecord> ranked, ProcessingContext context, Map<String, Object> metadata) {
        Map<Integer, List<CanonicalRecord>> byCluster = group(ranked);
        List<Map<String, Object>> clusters = new ArrayList<>();
        byCluster.forEach((id, members) -> {
            Map<String, Object> cluster = new LinkedHashMap<>();
            cluster.put("clusterId", id);
            cluster.put("name", members.get(0).getClusterName());
            cluster.put("size", members.size());
            cluster.put("avgScore", members.stream()
                    .mapToDouble(r -> RecordFieldExtractor.numeric(r.getProperties(), SCORE_FIELDS))
                    .average().orElse(0));
            clusters.add(cluster);
        });
        metadata.put("clusterAnalysis", Map.of("clusters", clusters));
    }

    @Override
    public void contributeStatistics(List<CanonicalRecord> records,
                                     AnalysisStatistics.AnalysisStatisticsBuilder statistics) {
        int count = group(records).size();
        statistics.clusterCount(count)
                .avgClusterSize(count == 0 ? 0.0 : (double) records.size() / count);
    }

    private static Map<Integer, List<CanonicalRecord>> group(List<CanonicalRecord> records) {
        Map<Integer, List<CanonicalRecord>> byCluster = new TreeMap<>();
        for (CanonicalRecord record : records) {
            byCluster.computeIfAbsent(record.getClusterId(), k -> new ArrayList<>()).add(record);
        }
        return byCluster;
    }
}
