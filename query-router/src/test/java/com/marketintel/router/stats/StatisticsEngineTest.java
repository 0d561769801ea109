package com.marketintel.router.stats;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.AreaScore;
import com.marketintel.router.model.BasicStats;
import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.Correlation;
import com.marketintel.router.model.Distribution;
import com.marketintel.router.model.Patterns;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticsEngineTest {

    private final StatisticsEngine engine = new StatisticsEngine();

    private static CanonicalRecord record(String name, double value) {
        return record(name, value, Map.of());
    }

    private static CanonicalRecord record(String name, double value, Map<String, Object> properties) {
        return CanonicalRecord.builder()
                .areaId(name)
                .areaName(name)
                .value(value)
                .properties(new LinkedHashMap<>(properties))
                .build();
    }

    private static List<CanonicalRecord> records(double... values) {
        List<CanonicalRecord> records = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            records.add(record("area" + i, values[i]));
        }
        return records;
    }

    @Nested
    @DisplayName("computeBasicStats")
    class Basic {

        @Test
        @DisplayName("empty input gives zeroes and empty lists")
        void empty() {
            BasicStats stats = engine.computeBasicStats(List.of());

            assertThat(stats.count()).isZero();
            assertThat(stats.mean()).isZero();
            assertThat(stats.top5()).isEmpty();
            assertThat(stats.bottom5()).isEmpty();
            assertThat(stats.totalPopulation()).isNull();
        }

        @Test
        void headlineNumbers() {
            BasicStats stats = engine.computeBasicStats(List.of(
                    record("c", 6), record("a", 10), record("e", 2), record("b", 8), record("d", 4)));

            assertThat(stats.count()).isEqualTo(5);
            assertThat(stats.mean()).isEqualTo(6.0);
            assertThat(stats.median()).isEqualTo(6.0);
            assertThat(stats.stdDev()).isCloseTo(Math.sqrt(8), within(1e-9));
            assertThat(stats.max()).isEqualTo(new AreaScore("a", 10));
            assertThat(stats.min()).isEqualTo(new AreaScore("e", 2));
            assertThat(stats.top5()).extracting(AreaScore::area).containsExactly("a", "b", "c", "d", "e");
            assertThat(stats.bottom5()).extracting(AreaScore::area).containsExactly("e", "d", "c", "b", "a");
        }

        @Test
        void evenCountMedian() {
            assertThat(engine.computeBasicStats(records(42, 17)).median()).isEqualTo(29.5);
        }

        @Test
        void populationIsSummedWhenPresent() {
            BasicStats stats = engine.computeBasicStats(List.of(
                    record("a", 9, Map.of("total_population", 1000)),
                    record("b", 3, Map.of("total_population", "2,500"))));

            assertThat(stats.totalPopulation()).isEqualTo(3500.0);
        }
    }

    @Nested
    @DisplayName("computeDistribution")
    class DistributionTests {

        @Test
        void emptyInput() {
            assertThat(engine.computeDistribution(List.of())).isEqualTo(Distribution.empty());
        }

        @Test
        @DisplayName("quartiles are read at floor indexes without interpolation")
        void quartiles() {
            Distribution distribution = engine.computeDistribution(records(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

            assertThat(distribution.q1()).isEqualTo(3.0);
            assertThat(distribution.q2()).isEqualTo(6.0);
            assertThat(distribution.q3()).isEqualTo(8.0);
            assertThat(distribution.iqr()).isEqualTo(5.0);
            assertThat(distribution.outliers()).isEmpty();
        }

        @Test
        void highOutlierAndRightSkew() {
            Distribution distribution = engine.computeDistribution(records(5, 5, 5, 5, 5, 5, 5, 5, 5, 20));

            assertThat(distribution.outliers()).containsExactly(new Distribution.Outlier("area9", 20, true));
            assertThat(distribution.shape()).isEqualTo(Distribution.Shape.SKEWED_RIGHT);
        }

        @Test
        void twoSeparatedPeaksAreBimodal() {
            assertThat(engine.computeDistribution(records(1, 1, 1, 9, 9, 9)).shape())
                    .isEqualTo(Distribution.Shape.BIMODAL);
        }

        @Test
        void constantValuesAreNormal() {
            assertThat(engine.computeDistribution(records(4, 4, 4)).shape()).isEqualTo(Distribution.Shape.NORMAL);
        }

        @Test
        @DisplayName("only populated buckets are listed and a perfect 10 is exceptional")
        void buckets() {
            Distribution distribution = engine.computeDistribution(records(10, 9.5, 8.2, 3));

            assertThat(distribution.buckets()).extracting(Distribution.Bucket::range)
                    .containsExactly("Exceptional (9-10)", "High (8-9)", "Low (0-5)");
            assertThat(distribution.buckets().get(0).count()).isEqualTo(2);
            assertThat(distribution.buckets().get(0).percentage()).isEqualTo(50.0);
            assertThat(distribution.buckets().get(0).areas()).containsExactly("area0", "area1");
        }
    }

    @Nested
    @DisplayName("detectPatterns")
    class PatternTests {

        @Test
        void computedCorrelation() {
            List<CanonicalRecord> records = List.of(
                    record("a", 2, Map.of("median_income", 20)),
                    record("b", 4, Map.of("median_income", 40)),
                    record("c", 6, Map.of("median_income", 60)),
                    record("d", 8, Map.of("median_income", 80)));

            List<Correlation> correlations = engine.detectPatterns(records).correlations();

            assertThat(correlations).hasSize(1);
            Correlation income = correlations.get(0);
            assertThat(income.factor()).isEqualTo("Median Income");
            assertThat(income.coefficient()).isCloseTo(1.0, within(1e-9));
            assertThat(income.significance()).isEqualTo(Correlation.Significance.STRONG);
            assertThat(income.isEstimated()).isFalse();
        }

        @Test
        @DisplayName("without auxiliary fields correlations are weak estimates")
        void estimatedCorrelations() {
            List<Correlation> correlations = engine.detectPatterns(records(8, 9)).correlations();

            assertThat(correlations).hasSize(2).allMatch(Correlation::isEstimated)
                    .allMatch(c -> c.significance() == Correlation.Significance.WEAK)
                    .allMatch(c -> c.coefficient() == 0.6);
        }

        @Test
        void noPositiveValuesNoCorrelations() {
            assertThat(engine.detectPatterns(records(0, -1)).correlations()).isEmpty();
        }

        @Test
        void bandsAndTrends() {
            Patterns patterns = engine.detectPatterns(records(9, 9, 8.5, 8));

            assertThat(patterns.clusters()).extracting(Patterns.ScoreCluster::name).containsExactly("High Performers");
            assertThat(patterns.trends()).extracting(Patterns.Trend::pattern)
                    .containsExactly("Geographic Concentration", "Tight Score Clustering");
            assertThat(patterns.trends().get(0).strength()).isEqualTo(Correlation.Significance.MODERATE);
        }

        @Test
        void emptyInput() {
            assertThat(engine.detectPatterns(List.of())).isEqualTo(Patterns.empty());
        }
    }

    @Test
    void summarizeFillsCoreFields() {
        AnalysisStatistics statistics = engine.summarize(records(42, 17)).build();

        assertThat(statistics.getTotal()).isEqualTo(2);
        assertThat(statistics.getMean()).isEqualTo(29.5);
        assertThat(statistics.getMax()).isEqualTo(42.0);
        assertThat(statistics.getMin()).isEqualTo(17.0);
        assertThat(statistics.getClusterCount()).isNull();
    }
}
