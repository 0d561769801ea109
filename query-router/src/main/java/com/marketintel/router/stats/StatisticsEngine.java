package com.marketintel.router.stats;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.AreaScore;
import com.marketintel.router.model.BasicStats;
import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.Correlation;
import com.marketintel.router.model.Correlation.Kind;
import com.marketintel.router.model.Correlation.Significance;
import com.marketintel.router.model.Distribution;
import com.marketintel.router.model.Patterns;
import com.marketintel.router.processing.RecordFieldExtractor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Descriptive statistics over canonical record values.
 *
 * Every method accepts an empty list and returns the documented empty structure.
 * Bucket and band thresholds assume the 0-10 score scale used by the exports.
 */
@Component
public class StatisticsEngine {

    private static final List<String> POPULATION_FIELDS = List.of(
            "total_population", "population", "pop_total", "POPULATION", "Total_Pop");
    private static final List<String> INCOME_FIELDS = List.of(
            "median_income", "income", "med_income", "INCOME", "Median_Inc", "household_income");

    private static final String POPULATION_FACTOR = "Population Density";
    private static final String INCOME_FACTOR = "Median Income";

    private static final double SKEW_THRESHOLD = 0.5;
    private static final double OUTLIER_FENCE = 1.5;

    private static final List<BucketDef> BUCKETS = List.of(
            new BucketDef("Exceptional (9-10)", 9, 10),
            new BucketDef("High (8-9)", 8, 9),
            new BucketDef("Above Average (7-8)", 7, 8),
            new BucketDef("Average (6-7)", 6, 7),
            new BucketDef("Below Average (5-6)", 5, 6),
            new BucketDef("Low (0-5)", 0, 5));

    // ── Basic statistics ─────────────────────────────────────────────────────

    public BasicStats computeBasicStats(List<CanonicalRecord> records) {
        if (records == null || records.isEmpty()) {
            return BasicStats.empty();
        }

        List<CanonicalRecord> sorted = descending(records);
        int n = sorted.size();
        double mean = mean(sorted);

        // median is read from the descending order
        double median = n % 2 == 0
                ? (sorted.get(n / 2 - 1).getValue() + sorted.get(n / 2).getValue()) / 2
                : sorted.get(n / 2).getValue();

        List<AreaScore> top5 = sorted.subList(0, Math.min(5, n)).stream()
                .map(StatisticsEngine::areaScore)
                .collect(Collectors.toList());
        List<AreaScore> bottom5 = new ArrayList<>();
        for (int i = n - 1; i >= Math.max(0, n - 5); i--) {
            bottom5.add(areaScore(sorted.get(i)));
        }

        Double totalPopulation = null;
        if (sorted.get(0).getProperties().containsKey("total_population")) {
            totalPopulation = records.stream()
                    .mapToDouble(r -> RecordFieldExtractor.number(r.getProperties().get("total_population")).orElse(0))
                    .sum();
        }

        return new BasicStats(n, mean, median, stdDev(sorted, mean),
                areaScore(sorted.get(n - 1)), areaScore(sorted.get(0)),
                top5, bottom5, totalPopulation);
    }

    // ── Distribution ─────────────────────────────────────────────────────────

    /**
     * Quartiles are read at index floor(n × 0.25 / 0.5 / 0.75) of the ascending
     * values, with no interpolation. Outliers lie beyond 1.5 × IQR from Q1/Q3.
     */
    public Distribution computeDistribution(List<CanonicalRecord> records) {
        if (records == null || records.isEmpty()) {
            return Distribution.empty();
        }

        double[] values = records.stream().mapToDouble(CanonicalRecord::getValue).sorted().toArray();
        int n = values.length;
        double q1 = values[(int) Math.floor(n * 0.25)];
        double q2 = values[(int) Math.floor(n * 0.50)];
        double q3 = values[(int) Math.floor(n * 0.75)];
        double iqr = q3 - q1;

        double lower = q1 - OUTLIER_FENCE * iqr;
        double upper = q3 + OUTLIER_FENCE * iqr;
        List<Distribution.Outlier> outliers = records.stream()
                .filter(r -> r.getValue() < lower || r.getValue() > upper)
                .map(r -> new Distribution.Outlier(r.getAreaName(), r.getValue(), r.getValue() > upper))
                .collect(Collectors.toList());

        return new Distribution(q1, q2, q3, iqr, outliers, shape(values), buckets(records));
    }

    // ── Patterns ─────────────────────────────────────────────────────────────

    public Patterns detectPatterns(List<CanonicalRecord> records) {
        if (records == null || records.isEmpty()) {
            return Patterns.empty();
        }
        return new Patterns(scoreBands(records), correlations(records), trends(records));
    }

    // ── Result statistics ────────────────────────────────────────────────────

    /**
     * Core statistics for a result set. Processors add their family fields to the returned builder.
     */
    public AnalysisStatistics.AnalysisStatisticsBuilder summarize(List<CanonicalRecord> records) {
        if (records == null || records.isEmpty()) {
            return AnalysisStatistics.builder();
        }
        BasicStats basic = computeBasicStats(records);
        Distribution distribution = computeDistribution(records);
        return AnalysisStatistics.builder()
                .total(basic.count())
                .mean(basic.mean())
                .median(basic.median())
                .min(basic.min().score())
                .max(basic.max().score())
                .stdDev(basic.stdDev())
                .percentile25(distribution.q1())
                .percentile75(distribution.q3())
                .iqr(distribution.iqr())
                .outlierCount(distribution.outliers().size());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Distribution.Shape shape(double[] ascending) {
        if (isBimodal(ascending)) {
            return Distribution.Shape.BIMODAL;
        }
        double mean = 0;
        for (double v : ascending) mean += v;
        mean /= ascending.length;
        double sd = 0;
        for (double v : ascending) sd += (v - mean) * (v - mean);
        sd = Math.sqrt(sd / ascending.length);
        if (sd == 0) {
            return Distribution.Shape.NORMAL;
        }
        double skew = 0;
        for (double v : ascending) skew += Math.pow((v - mean) / sd, 3);
        skew /= ascending.length;

        if (skew > SKEW_THRESHOLD) return Distribution.Shape.SKEWED_RIGHT;
        if (skew < -SKEW_THRESHOLD) return Distribution.Shape.SKEWED_LEFT;
        return Distribution.Shape.NORMAL;
    }

    /**
     * Unit-width histogram; bimodal when the first two bins holding more than 10%
     * of the values are more than two bins apart.
     */
    private boolean isBimodal(double[] values) {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (double v : values) {
            histogram.merge((int) Math.floor(v), 1, Integer::sum);
        }
        List<Integer> peaks = histogram.entrySet().stream()
                .filter(e -> e.getValue() > values.length * 0.1)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        return peaks.size() >= 2 && Math.abs(peaks.get(0) - peaks.get(1)) > 2;
    }

    private List<Distribution.Bucket> buckets(List<CanonicalRecord> records) {
        int n = records.size();
        List<Distribution.Bucket> buckets = new ArrayList<>();
        for (BucketDef def : BUCKETS) {
            List<CanonicalRecord> members = records.stream()
                    .filter(r -> def.contains(r.getValue()))
                    .collect(Collectors.toList());
            if (members.isEmpty()) continue;
            buckets.add(new Distribution.Bucket(def.label(), def.min(), def.max(), members.size(),
                    members.size() * 100.0 / n,
                    members.stream().limit(3).map(CanonicalRecord::getAreaName).collect(Collectors.toList())));
        }
        return buckets;
    }

    private List<Patterns.ScoreCluster> scoreBands(List<CanonicalRecord> records) {
        List<Patterns.ScoreCluster> bands = new ArrayList<>();
        addBand(bands, "High Performers", records.stream().filter(r -> r.getValue() >= 8).collect(Collectors.toList()),
                List.of("Strong market position", "High growth potential"));
        addBand(bands, "Steady Markets", records.stream().filter(r -> r.getValue() >= 6 && r.getValue() < 8).collect(Collectors.toList()),
                List.of("Stable performance", "Moderate opportunity"));
        addBand(bands, "Emerging Areas", records.stream().filter(r -> r.getValue() < 6).collect(Collectors.toList()),
                List.of("Development potential", "Higher risk"));
        return bands;
    }

    private static void addBand(List<Patterns.ScoreCluster> bands, String name,
                                List<CanonicalRecord> members, List<String> characteristics) {
        if (members.isEmpty()) return;
        bands.add(new Patterns.ScoreCluster(name, members.size(), mean(members), characteristics));
    }

    /**
     * Pearson correlation of value against population and income, each tried under
     * several field spellings. With neither present, two estimates derived from the
     * mean score are returned instead, tagged ESTIMATED and always WEAK.
     */
    private List<Correlation> correlations(List<CanonicalRecord> records) {
        List<Correlation> correlations = new ArrayList<>();
        computed(records, POPULATION_FIELDS, POPULATION_FACTOR).ifPresent(correlations::add);
        computed(records, INCOME_FIELDS, INCOME_FACTOR).ifPresent(correlations::add);

        if (correlations.isEmpty()) {
            double positiveMean = records.stream()
                    .mapToDouble(CanonicalRecord::getValue)
                    .filter(v -> v > 0)
                    .average()
                    .orElse(-1);
            if (positiveMean < 0) {
                return correlations;
            }
            double base = positiveMean > 7 ? 0.6 : positiveMean > 5 ? 0.3 : 0.1;
            correlations.add(new Correlation(POPULATION_FACTOR, base, Significance.WEAK, Kind.ESTIMATED));
            correlations.add(new Correlation(INCOME_FACTOR, base, Significance.WEAK, Kind.ESTIMATED));
        }

        correlations.sort(Comparator.comparingDouble((Correlation c) -> Math.abs(c.coefficient())).reversed());
        return correlations;
    }

    private Optional<Correlation> computed(List<CanonicalRecord> records, List<String> fields, String factor) {
        for (String field : fields) {
            List<double[]> pairs = new ArrayList<>();
            for (CanonicalRecord record : records) {
                OptionalDouble aux = RecordFieldExtractor.number(record.getProperties().get(field));
                if (record.getValue() > 0 && aux.isPresent() && aux.getAsDouble() > 0) {
                    pairs.add(new double[]{record.getValue(), aux.getAsDouble()});
                }
            }
            if (pairs.size() < 2) continue;
            double r = pearson(pairs);
            if (r != 0 && Double.isFinite(r)) {
                return Optional.of(new Correlation(factor, r, significance(r), Kind.COMPUTED));
            }
        }
        return Optional.empty();
    }

    static double pearson(List<double[]> pairs) {
        int n = pairs.size();
        double meanX = pairs.stream().mapToDouble(p -> p[0]).sum() / n;
        double meanY = pairs.stream().mapToDouble(p -> p[1]).sum() / n;
        double num = 0, denX = 0, denY = 0;
        for (double[] p : pairs) {
            double dx = p[0] - meanX;
            double dy = p[1] - meanY;
            num += dx * dy;
            denX += dx * dx;
            denY += dy * dy;
        }
        if (denX == 0 || denY == 0) return 0;
        return num / Math.sqrt(denX * denY);
    }

    private static Significance significance(double r) {
        double abs = Math.abs(r);
        if (abs > 0.7) return Significance.STRONG;
        if (abs > 0.4) return Significance.MODERATE;
        return Significance.WEAK;
    }

    private List<Patterns.Trend> trends(List<CanonicalRecord> records) {
        List<Patterns.Trend> trends = new ArrayList<>();

        List<String> highScoring = records.stream()
                .filter(r -> r.getValue() >= 8)
                .map(CanonicalRecord::getAreaName)
                .collect(Collectors.toList());
        if (highScoring.size() >= 3) {
            trends.add(new Patterns.Trend("Geographic Concentration",
                    highScoring.size() > 5 ? Significance.STRONG : Significance.MODERATE,
                    highScoring.subList(0, Math.min(5, highScoring.size()))));
        }

        double mean = mean(records);
        if (stdDev(records, mean) < mean * 0.15) {
            trends.add(new Patterns.Trend("Tight Score Clustering", Significance.STRONG,
                    records.stream().limit(3).map(CanonicalRecord::getAreaName).collect(Collectors.toList())));
        }
        return trends;
    }

    private static List<CanonicalRecord> descending(List<CanonicalRecord> records) {
        List<CanonicalRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingDouble(CanonicalRecord::getValue).reversed());
        return sorted;
    }

    private static double mean(List<CanonicalRecord> records) {
        return records.stream().mapToDouble(CanonicalRecord::getValue).average().orElse(0);
    }

    private static double stdDev(List<CanonicalRecord> records, double mean) {
        double variance = records.stream()
                .mapToDouble(r -> (r.getValue() - mean) * (r.getValue() - mean))
                .sum() / records.size();
        return Math.sqrt(variance);
    }

    private static AreaScore areaScore(CanonicalRecord record) {
        return new AreaScore(record.getAreaName(), record.getValue());
    }

    private record BucketDef(String label, double min, double max) {
        /** Half-open [min, max), except the top bucket which includes 10. */
        boolean contains(double value) {
            return value >= min && (value < max || (max == 10 && value == 10));
        }
    }
}
