package com.marketintel.router.processing;

import com.marketintel.router.catalog.EndpointCatalog;
import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.AnalysisStatistics.RiskLevel;
import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.RawDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FamilyProcessorsTest {

    private final EndpointCatalog catalog = new EndpointCatalog();

    private ProcessedDataset run(DataProcessor processor, String endpoint, List<Map<String, Object>> rows) {
        return processor.process(RawDataset.of(rows), ProcessingContext.of(catalog.resolve(endpoint)));
    }

    @Nested
    @DisplayName("spatial clusters")
    class Clusters {

        private final SpatialClusterProcessor processor = new SpatialClusterProcessor();

        @Test
        void valueIsClusterIdAndMetadataGroupsMembers() {
            ProcessedDataset processed = run(processor, "/spatial-clusters", List.of(
                    Map.of("ID", "1", "cluster_id", 0, "score", 4.0),
                    Map.of("ID", "2", "cluster_id", 2, "cluster_name", "Urban core", "score", 8.0),
                    Map.of("ID", "3", "cluster_id", 0, "score", 6.0)));

            assertThat(processed.records()).extracting(CanonicalRecord::getClusterId).containsExactly(2, 0, 0);
            assertThat(processed.records().get(0).getCategory()).isEqualTo("Urban core");
            assertThat(processed.records().get(1).getClusterName()).isEqualTo("Cluster 0");

            @SuppressWarnings("unchecked")
            List<Map<String, Object>> clusters = (List<Map<String, Object>>)
                    ((Map<String, Object>) processed.metadata().get("clusterAnalysis")).get("clusters");
            assertThat(clusters).hasSize(2);
            assertThat(clusters.get(0)).containsEntry("clusterId", 0).containsEntry("size", 2).containsEntry("avgScore", 5.0);

            AnalysisStatistics.AnalysisStatisticsBuilder builder = AnalysisStatistics.builder();
            processor.contributeStatistics(processed.records(), builder);
            AnalysisStatistics statistics = builder.build();
            assertThat(statistics.getClusterCount()).isEqualTo(2);
            assertThat(statistics.getAvgClusterSize()).isCloseTo(1.5, within(1e-9));
        }

        @Test
        void missingClusterIdFails() {
            assertThatThrownBy(() -> run(processor, "/spatial-clusters", List.of(Map.of("ID", "1", "score", 3))))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no cluster id");
        }
    }

    @Nested
    @DisplayName("competitive")
    class Competitive {

        @Test
        @DisplayName("percent shares are normalised before averaging")
        void shareStatistics() {
            CompetitiveAnalysisProcessor processor = new CompetitiveAnalysisProcessor();
            ProcessedDataset processed = run(processor, "/competitive-analysis", List.of(
                    Map.of("ID", "1", "competitive_score", 7, "value_MP30034A_B_P", 30),
                    Map.of("ID", "2", "competitive_score", 5, "market_share", 0.1)));

            AnalysisStatistics.AnalysisStatisticsBuilder builder = AnalysisStatistics.builder();
            processor.contributeStatistics(processed.records(), builder);
            AnalysisStatistics statistics = builder.build();

            assertThat(statistics.getAvgMarketShare()).isCloseTo(0.2, within(1e-9));
            assertThat(statistics.getMarketConcentration()).isCloseTo(0.1, within(1e-9));
        }

        @Test
        void noShareFieldsLeavesStatisticsUnset() {
            CompetitiveAnalysisProcessor processor = new CompetitiveAnalysisProcessor();
            AnalysisStatistics.AnalysisStatisticsBuilder builder = AnalysisStatistics.builder();
            processor.contributeStatistics(
                    run(processor, "/competitive-analysis", List.of(Map.of("ID", "1", "competitive_score", 7))).records(),
                    builder);

            assertThat(builder.build().getAvgMarketShare()).isNull();
        }
    }

    @Nested
    @DisplayName("risk")
    class Risk {

        @Test
        void levels() {
            assertThat(RiskAnalysisProcessor.riskLevel(0.7, 0.1)).isEqualTo(RiskLevel.HIGH);
            assertThat(RiskAnalysisProcessor.riskLevel(0.1, 0.65)).isEqualTo(RiskLevel.HIGH);
            assertThat(RiskAnalysisProcessor.riskLevel(0.2, 0.2)).isEqualTo(RiskLevel.LOW);
            assertThat(RiskAnalysisProcessor.riskLevel(0.4, 0.2)).isEqualTo(RiskLevel.MEDIUM);
        }
    }

    @Nested
    @DisplayName("comparative")
    class Comparative {

        @Test
        void cityFromAreaName() {
            ProcessedDataset processed = run(new ComparativeAnalysisProcessor(), "/comparative-analysis", List.of(
                    Map.of("ID", "11201", "DESCRIPTION", "11201 (Brooklyn)", "comparison_score", 8),
                    Map.of("ID", "19103", "DESCRIPTION", "19103 (Philadelphia)", "comparison_score", 6),
                    Map.of("ID", "11215", "DESCRIPTION", "11215 (Brooklyn)", "comparison_score", 4)));

            assertThat(processed.records()).extracting(CanonicalRecord::getCategory)
                    .containsExactly("Brooklyn", "Philadelphia", "Brooklyn");

            @SuppressWarnings("unchecked")
            Map<String, Map<String, Object>> cities = (Map<String, Map<String, Object>>)
                    ((Map<String, Object>) processed.metadata().get("comparativeAnalysis")).get("cities");
            assertThat(cities.get("Brooklyn")).containsEntry("count", 2).containsEntry("avgScore", 6.0);
        }

        @Test
        void noParenthetical() {
            assertThat(ComparativeAnalysisProcessor.cityOf("10001")).isNull();
            assertThat(ComparativeAnalysisProcessor.cityOf(null)).isNull();
        }
    }

    @Nested
    @DisplayName("field extraction")
    class Extraction {

        @Test
        void numericStringsAndIds() {
            assertThat(RecordFieldExtractor.number("12.5%")).hasValue(12.5);
            assertThat(RecordFieldExtractor.number("1,200")).hasValue(1200);
            assertThat(RecordFieldExtractor.number("n/a")).isEmpty();
            assertThat(RecordFieldExtractor.number(Double.NaN)).isEmpty();
            assertThat(RecordFieldExtractor.areaId(Map.of("ZIP", 10001.0))).hasValue("10001");
        }

        @Test
        void coordinatesAndShap() {
            Map<String, Object> raw = Map.of("lng", -73.9, "lat", 40.7, "shap_MEDDI_CY", 0.3);

            assertThat(RecordFieldExtractor.coordinates(raw)).containsExactly(-73.9, 40.7);
            assertThat(RecordFieldExtractor.coordinates(Map.of())).isNull();
            assertThat(RecordFieldExtractor.shapValues(raw)).containsExactly(Map.entry("MEDDI_CY", 0.3));
        }
    }
}
